package agentsync;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.Test;

import agentsync.integration.FakeIntegrationManager;

public class MainTest {

  @Test
  public void shouldLoadTheRegisteredIntegrations() {
    assertThat(Main.loadIntegrations(), is(instanceOf(FakeIntegrationManager.class)));
  }

  @Test
  public void shouldHaveAVersionEvenWhenUnpackaged() {
    assertThat(Main.getVersion().isEmpty(), is(false));
  }

}

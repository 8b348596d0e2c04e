package agentsync.integration;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The component that actually talks to the external tools.
 *
 * Everything here may block and may throw; callers in the scheduler run it
 * under a timeout and turn failures into job retries. For every method taking
 * a list of adapter names, an empty list means "all adapters".
 */
public interface IntegrationManager {

  /** @return whether at least the integration layer itself came up */
  boolean initialize() throws Exception;

  /** @param agentNames the agents to sync, or empty for all of them */
  Map<String, SyncResult> syncAgents(List<String> agentNames, List<String> adapterNames) throws Exception;

  Map<String, ValidationResult> validateConfigurations(List<String> adapterNames) throws Exception;

  Map<String, HealthResult> healthCheck(List<String> adapterNames) throws Exception;

  List<String> listAdapters();

  Optional<Adapter> getAdapter(String name);

  /** Knows no adapters, so every sync is trivially empty. */
  class Noop implements IntegrationManager {
    @Override
    public boolean initialize() {
      return true;
    }

    @Override
    public Map<String, SyncResult> syncAgents(List<String> agentNames, List<String> adapterNames) {
      return Collections.emptyMap();
    }

    @Override
    public Map<String, ValidationResult> validateConfigurations(List<String> adapterNames) {
      return Collections.emptyMap();
    }

    @Override
    public Map<String, HealthResult> healthCheck(List<String> adapterNames) {
      return Collections.emptyMap();
    }

    @Override
    public List<String> listAdapters() {
      return Collections.emptyList();
    }

    @Override
    public Optional<Adapter> getAdapter(String name) {
      return Optional.empty();
    }
  }

}

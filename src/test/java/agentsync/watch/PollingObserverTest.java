package agentsync.watch;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import agentsync.LoggingConfig;
import agentsync.TestUtils;

public class PollingObserverTest {

  static {
    LoggingConfig.init();
  }

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private final List<RawEvent> events = new ArrayList<>();
  private Path root;

  @Before
  public void before() {
    root = temp.getRoot().toPath();
  }

  @Test
  public void shouldReportCreates() throws Exception {
    PollingObserver o = start(true);
    TestUtils.writeStringToFile(root.resolve("foo.md").toFile(), "agent");
    assertThat(o.runOneLoop(), is(Duration.ofSeconds(1)));
    assertThat(events.size(), is(1));
    assertEvent(events.get(0), WatchEventType.CREATED, root.resolve("foo.md"));
  }

  @Test
  public void shouldReportNothingWhenNothingChanged() throws Exception {
    TestUtils.writeStringToFile(root.resolve("foo.md").toFile(), "agent");
    PollingObserver o = start(true);
    o.runOneLoop();
    o.runOneLoop();
    assertThat(events, is(empty()));
  }

  @Test
  public void shouldReportModifies() throws Exception {
    File file = root.resolve("foo.md").toFile();
    TestUtils.writeStringToFile(file, "agent");
    PollingObserver o = start(true);
    FileTime before = Files.getLastModifiedTime(file.toPath());
    Files.setLastModifiedTime(file.toPath(), FileTime.fromMillis(before.toMillis() + 5000));
    o.runOneLoop();
    assertThat(events.size(), is(1));
    assertEvent(events.get(0), WatchEventType.MODIFIED, file.toPath());
  }

  @Test
  public void shouldReportDeletes() throws Exception {
    TestUtils.writeStringToFile(root.resolve("foo.md").toFile(), "agent");
    PollingObserver o = start(true);
    Files.delete(root.resolve("foo.md"));
    o.runOneLoop();
    assertThat(events.size(), is(1));
    assertEvent(events.get(0), WatchEventType.DELETED, root.resolve("foo.md"));
  }

  @Test
  public void shouldReportRenamesAsMoves() throws Exception {
    Path from = root.resolve("foo.md");
    TestUtils.writeStringToFile(from.toFile(), "agent");
    assumeTrue(Files.readAttributes(from, BasicFileAttributes.class).fileKey() != null);
    PollingObserver o = start(true);
    Path to = root.resolve("bar.md");
    Files.move(from, to);
    o.runOneLoop();
    assertThat(events.size(), is(1));
    assertEvent(events.get(0), WatchEventType.MOVED, to);
    assertThat(events.get(0).oldPath, is(from));
  }

  @Test
  public void shouldReportNestedFilesWhenRecursive() throws Exception {
    PollingObserver o = start(true);
    Files.createDirectories(root.resolve("agents"));
    TestUtils.writeStringToFile(root.resolve("agents/foo.md").toFile(), "agent");
    o.runOneLoop();
    assertThat(events.size(), is(2));
    assertThat(events.get(0).directory, is(true));
    assertEvent(events.get(1), WatchEventType.CREATED, root.resolve("agents/foo.md"));
  }

  @Test
  public void shouldIgnoreNestedFilesWhenNotRecursive() throws Exception {
    Files.createDirectories(root.resolve("agents"));
    PollingObserver o = start(false);
    TestUtils.writeStringToFile(root.resolve("agents/foo.md").toFile(), "agent");
    TestUtils.writeStringToFile(root.resolve("top.md").toFile(), "agent");
    o.runOneLoop();
    assertThat(events.size(), is(1));
    assertEvent(events.get(0), WatchEventType.CREATED, root.resolve("top.md"));
  }

  @Test
  public void shouldWatchASingleFile() throws Exception {
    Path file = root.resolve(".cursorrules");
    TestUtils.writeStringToFile(file.toFile(), "rules");
    PollingObserver o = new PollingObserver(new WatchedPath(file, false, TargetPatterns.defaults()), Duration.ofSeconds(1), events::add);
    o.onStart();
    Files.delete(file);
    o.runOneLoop();
    TestUtils.writeStringToFile(file.toFile(), "rules again");
    o.runOneLoop();
    assertThat(events.size(), is(2));
    assertEvent(events.get(0), WatchEventType.DELETED, file);
    assertEvent(events.get(1), WatchEventType.CREATED, file);
  }

  @Test
  public void shouldTolerateAMissingRoot() throws Exception {
    Path missing = root.resolve("missing");
    PollingObserver o = new PollingObserver(new WatchedPath(missing, true, TargetPatterns.defaults()), Duration.ofSeconds(1), events::add);
    o.onStart();
    o.runOneLoop();
    assertThat(events, is(empty()));
    Files.createDirectories(missing);
    TestUtils.writeStringToFile(missing.resolve("foo.md").toFile(), "agent");
    o.runOneLoop();
    assertThat(events.size(), is(1));
    assertEvent(events.get(0), WatchEventType.CREATED, missing.resolve("foo.md"));
  }

  private PollingObserver start(boolean recursive) {
    PollingObserver o = new PollingObserver(new WatchedPath(root, recursive, TargetPatterns.defaults()), Duration.ofSeconds(1), events::add);
    o.onStart();
    return o;
  }

  private static void assertEvent(RawEvent e, WatchEventType kind, Path path) {
    assertThat(e.kind, is(kind));
    assertThat(e.path, is(path));
  }

}

package agentsync.watch;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ImmutableList;

import agentsync.LoggingConfig;
import agentsync.MutableClock;
import agentsync.SyncSettings;
import agentsync.tasks.StubTaskFactory;

public class DefaultFileWatcherTest {

  static {
    LoggingConfig.init();
  }

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private final StubTaskFactory factory = new StubTaskFactory();
  private final MutableClock clock = new MutableClock();
  private final List<PathObserver> observers = new ArrayList<>();
  private final List<WatchEvent> events = new ArrayList<>();
  private Path root;
  private SyncSettings settings;
  private DefaultFileWatcher watcher;
  private WatchedPath watched;

  @Before
  public void before() throws IOException {
    root = temp.newFolder(".agentsync").toPath();
    settings = SyncSettings.builder().managedRoot(root).watchDebounce(Duration.ofSeconds(1)).queuePollTimeout(Duration.ZERO).build();
    watcher = newWatcher(ImmutableList.of());
    watcher.addCallback(events::add);
    watched = new WatchedPath(root, true, TargetPatterns.defaults());
  }

  @Test
  public void shouldDeliverAClassifiedEventOnceQuiet() {
    watcher.start(ImmutableList.of(root));
    watcher.onRawEvent(RawEvent.modified(watched, root.resolve("agents/helper.md"), false));
    factory.tick();
    assertThat(events, is(empty()));

    clock.advance(Duration.ofSeconds(1));
    factory.tick();
    assertThat(events.size(), is(1));
    WatchEvent e = events.get(0);
    assertThat(e.getEventType(), is(WatchEventType.MODIFIED));
    assertThat(e.getTarget(), is(WatchTarget.AGENTS));
    assertThat(e.getPath(), is(root.resolve("agents/helper.md")));
  }

  @Test
  public void shouldCoalesceABurstOnTheSamePath() {
    watcher.start(ImmutableList.of(root));
    Path file = root.resolve("config/settings.toml");
    watcher.onRawEvent(RawEvent.created(watched, file, false));
    factory.tick();
    clock.advance(Duration.ofMillis(600));
    watcher.onRawEvent(RawEvent.modified(watched, file, false));
    factory.tick();

    // 1s after the first event, but only 400ms after the second
    clock.advance(Duration.ofMillis(400));
    factory.tick();
    assertThat(events, is(empty()));

    clock.advance(Duration.ofMillis(600));
    factory.tick();
    assertThat(events.size(), is(1));
    assertThat(events.get(0).getEventType(), is(WatchEventType.MODIFIED));
    assertThat(events.get(0).getTarget(), is(WatchTarget.CONFIG));
  }

  @Test
  public void shouldCountCallbacks() {
    Consumer<WatchEvent> other = e -> {
    };
    watcher.addCallback(other);
    assertThat(watcher.getCallbackCount(), is(2));
    watcher.removeCallback(other);
    assertThat(watcher.getCallbackCount(), is(1));
  }

  @Test
  public void shouldSkipDirectoriesAndUnclassifiedFiles() {
    watcher.start(ImmutableList.of(root));
    watcher.onRawEvent(RawEvent.created(watched, root.resolve("agents/sub.md"), true));
    watcher.onRawEvent(RawEvent.created(watched, root.resolve("data/blob.bin"), false));
    factory.tick();
    clock.advance(Duration.ofSeconds(2));
    factory.tick();
    assertThat(events, is(empty()));
  }

  @Test
  public void shouldTurnAMoveBetweenClassifiedPathsIntoDeleteAndCreate() {
    watcher.start(ImmutableList.of(root));
    watcher.onRawEvent(RawEvent.moved(watched, root.resolve("agents/a.md"), root.resolve("config/a.toml"), false));
    settle();
    assertThat(events.size(), is(2));
    WatchEvent deleted = find(WatchEventType.DELETED);
    WatchEvent created = find(WatchEventType.CREATED);
    assertThat(deleted.getPath(), is(root.resolve("agents/a.md")));
    assertThat(deleted.getTarget(), is(WatchTarget.AGENTS));
    assertThat(created.getPath(), is(root.resolve("config/a.toml")));
    assertThat(created.getTarget(), is(WatchTarget.CONFIG));
  }

  @Test
  public void shouldReportAMoveIntoAClassifiedPathAsMoved() {
    watcher.start(ImmutableList.of(root));
    watcher.onRawEvent(RawEvent.moved(watched, root.resolve("data/a.bin"), root.resolve("agents/a.md"), false));
    settle();
    assertThat(events.size(), is(1));
    assertThat(events.get(0).getEventType(), is(WatchEventType.MOVED));
    assertThat(events.get(0).getPath(), is(root.resolve("agents/a.md")));
    assertThat(events.get(0).getOldPath(), is(Optional.of(root.resolve("data/a.bin"))));
  }

  @Test
  public void shouldReportAMoveOutOfAClassifiedPathAsDeleted() {
    watcher.start(ImmutableList.of(root));
    watcher.onRawEvent(RawEvent.moved(watched, root.resolve("agents/a.md"), root.resolve("data/a.bin"), false));
    settle();
    assertThat(events.size(), is(1));
    assertThat(events.get(0).getEventType(), is(WatchEventType.DELETED));
    assertThat(events.get(0).getPath(), is(root.resolve("agents/a.md")));
  }

  @Test
  public void shouldKeepCallingACallbackThatFailed() {
    AtomicInteger calls = new AtomicInteger();
    Consumer<WatchEvent> failing = e -> {
      calls.incrementAndGet();
      throw new IllegalStateException("boom");
    };
    watcher.addCallback(failing);
    watcher.start(ImmutableList.of(root));

    watcher.onRawEvent(RawEvent.modified(watched, root.resolve("agents/a.md"), false));
    settle();
    watcher.onRawEvent(RawEvent.modified(watched, root.resolve("agents/b.md"), false));
    settle();
    assertThat(calls.get(), is(2));
    assertThat(events.size(), is(2));

    watcher.removeCallback(failing);
    watcher.onRawEvent(RawEvent.modified(watched, root.resolve("agents/c.md"), false));
    settle();
    assertThat(calls.get(), is(2));
    assertThat(events.size(), is(3));
  }

  @Test
  public void shouldDropPendingEventsWhenStopped() {
    watcher.start(ImmutableList.of(root));
    watcher.onRawEvent(RawEvent.modified(watched, root.resolve("agents/a.md"), false));
    factory.tick();
    watcher.stop();
    assertThat(watcher.isWatching(), is(false));
    clock.advance(Duration.ofSeconds(2));
    factory.tick();
    assertThat(events, is(empty()));
    assertThat(factory.getTaskCount(), is(0));
  }

  @Test
  public void shouldStartOneObserverPerPath() throws IOException {
    Path agents = Files.createDirectories(root.resolve("agents"));
    Path config = Files.createDirectories(root.resolve("config"));
    watcher.start(ImmutableList.of(agents, config));
    assertThat(watcher.isWatching(), is(true));
    assertThat(watcher.getWatchedPaths(), contains(agents, config));
    assertThat(observers.size(), is(2));
    // the debouncer and the two observers
    assertThat(factory.getTaskCount(), is(3));
  }

  @Test
  public void shouldRestartTheObserverWhenAPathIsReAdded() {
    watcher.start(ImmutableList.of(root));
    PathObserver first = observers.get(0);
    watcher.addPath(root, false, TargetPatterns.none());
    assertThat(observers.size(), is(2));
    assertThat(factory.isRunning(first), is(false));
    assertThat(factory.isRunning(observers.get(1)), is(true));
    assertThat(watcher.getWatchedPaths(), contains(root));
  }

  @Test
  public void shouldStopTheObserverWhenAPathIsRemoved() {
    watcher.start(ImmutableList.of(root));
    assertThat(watcher.removePath(root), is(true));
    assertThat(factory.isRunning(observers.get(0)), is(false));
    assertThat(watcher.getWatchedPaths(), is(empty()));
    assertThat(watcher.removePath(root), is(false));
  }

  @Test
  public void shouldFindTheDefaultPaths() throws IOException {
    Path agents = Files.createDirectories(root.resolve("agents"));
    Path config = Files.createDirectories(root.resolve("config"));
    Path tool = temp.newFolder("tool").toPath();
    ToolPathProvider tools = () -> ImmutableList.of(tool, temp.getRoot().toPath().resolve("missing"));
    ToolPathProvider broken = () -> {
      throw new IOException("no tools here");
    };
    watcher = newWatcher(ImmutableList.of(tools, broken));
    assertThat(watcher.getDefaultWatchPaths(), containsInAnyOrder(config, agents, tool));
  }

  @Test
  public void shouldWatchTheDefaultPathsIfNoneWereAdded() throws IOException {
    Path agents = Files.createDirectories(root.resolve("agents"));
    watcher.start();
    assertThat(watcher.getWatchedPaths(), contains(agents));
  }

  @Test
  public void shouldHaveNoDefaultsWithoutAManagedRoot() throws IOException {
    Files.delete(root);
    assertThat(watcher.getDefaultWatchPaths(), is(empty()));
  }

  private DefaultFileWatcher newWatcher(List<ToolPathProvider> providers) {
    ObserverFactory observerFactory = (path, sink) -> {
      PathObserver o = mock(PathObserver.class);
      when(o.getWatchedPath()).thenReturn(path);
      observers.add(o);
      return o;
    };
    return new DefaultFileWatcher(factory, observerFactory, settings, clock, providers);
  }

  private void settle() {
    factory.tick();
    clock.advance(Duration.ofSeconds(1));
    factory.tick();
  }

  private WatchEvent find(WatchEventType type) {
    return events.stream().filter(e -> e.getEventType() == type).findFirst().get();
  }

}

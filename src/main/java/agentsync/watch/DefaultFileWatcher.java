package agentsync.watch;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.apache.commons.lang3.tuple.Pair;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import agentsync.Debouncer;
import agentsync.SyncSettings;
import agentsync.tasks.TaskFactory;

/**
 * Turns raw file system changes into classified, debounced {@link WatchEvent}s.
 *
 * Each watched path gets its own {@link PathObserver} task. Observers call
 * {@link #onRawEvent(RawEvent)} from their own threads; we classify there
 * (it's pure) and hand the result to a {@link Debouncer} task through its
 * inbox, keyed by (target, path). The debouncer restarts a key's quiet period
 * on every event, so only the latest event of a burst reaches the callbacks.
 */
public class DefaultFileWatcher implements FileWatcher {

  private static final Logger log = LoggerFactory.getLogger(DefaultFileWatcher.class);
  private final TaskFactory taskFactory;
  private final ObserverFactory observerFactory;
  private final SyncSettings settings;
  private final Clock clock;
  private final List<ToolPathProvider> toolPathProviders;
  private final PathClassifier classifier;
  private final Map<Path, WatchedPath> watchedPaths = new ConcurrentHashMap<>();
  private final Map<Path, PathObserver> observers = new ConcurrentHashMap<>();
  private final List<Consumer<WatchEvent>> callbacks = new CopyOnWriteArrayList<>();
  private final Debouncer<Pair<WatchTarget, Path>, WatchEvent> debouncer;
  private volatile boolean running;

  public DefaultFileWatcher(
    TaskFactory taskFactory,
    ObserverFactory observerFactory,
    SyncSettings settings,
    Clock clock,
    List<ToolPathProvider> toolPathProviders) {
    this.taskFactory = taskFactory;
    this.observerFactory = observerFactory;
    this.settings = settings;
    this.clock = clock;
    this.toolPathProviders = ImmutableList.copyOf(toolPathProviders);
    this.classifier = new PathClassifier(String.valueOf(settings.managedRoot.getFileName()));
    this.debouncer = new Debouncer<>("WatchDebouncer", settings.watchDebounce, true, settings.queuePollTimeout, clock, (k, e) -> deliver(e));
  }

  @Override
  public void addPath(Path path, boolean recursive, TargetPatterns patterns) {
    WatchedPath watched = new WatchedPath(path, recursive, patterns);
    watchedPaths.put(watched.getRoot(), watched);
    log.debug("Watching {}", watched);
    synchronized (this) {
      if (running) {
        stopObserver(watched.getRoot());
        startObserver(watched);
      }
    }
  }

  @Override
  public void addPath(Path path) {
    addPath(path, true, TargetPatterns.defaults());
  }

  @Override
  public synchronized boolean removePath(Path path) {
    Path root = path.toAbsolutePath().normalize();
    boolean removed = watchedPaths.remove(root) != null;
    stopObserver(root);
    return removed;
  }

  @Override
  public void start() {
    if (watchedPaths.isEmpty()) {
      getDefaultWatchPaths().forEach(this::addPath);
    }
    synchronized (this) {
      if (running) {
        return;
      }
      running = true;
      taskFactory.runTask(debouncer);
      watchedPaths.values().forEach(this::startObserver);
      log.info("Watching {} paths", watchedPaths.size());
    }
  }

  @Override
  public void start(List<Path> paths) {
    paths.forEach(this::addPath);
    start();
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    new ArrayList<>(observers.keySet()).forEach(this::stopObserver);
    taskFactory.stopTask(debouncer);
    log.info("Stopped watching");
  }

  @Override
  public void addCallback(Consumer<WatchEvent> callback) {
    callbacks.add(callback);
  }

  @Override
  public void removeCallback(Consumer<WatchEvent> callback) {
    callbacks.remove(callback);
  }

  @Override
  public int getCallbackCount() {
    return callbacks.size();
  }

  @Override
  public boolean isWatching() {
    return running;
  }

  @Override
  public List<Path> getWatchedPaths() {
    return Seq.seq(watchedPaths.keySet()).sorted().toList();
  }

  @Override
  public List<Path> getDefaultWatchPaths() {
    List<Path> paths = new ArrayList<>();
    Path root = settings.managedRoot;
    if (Files.isDirectory(root)) {
      paths.add(root.resolve("config"));
      paths.add(root.resolve("agents"));
      paths.add(root.resolve("templates"));
      paths.add(root.resolve("data"));
    }
    for (ToolPathProvider provider : toolPathProviders) {
      try {
        paths.addAll(provider.getToolPaths());
      } catch (Exception e) {
        log.debug("Could not get tool paths from " + provider, e);
      }
    }
    return Seq.seq(paths).filter(Files::exists).distinct().toList();
  }

  /** Called from observer threads. */
  void onRawEvent(RawEvent e) {
    if (e.directory) {
      return;
    }
    if (e.kind == WatchEventType.MOVED) {
      onMoved(e);
      return;
    }
    classifier.classify(e.source, e.path).ifPresent(target -> {
      offer(new WatchEvent(e.kind, e.path, target, clock.instant()));
    });
  }

  private void onMoved(RawEvent e) {
    Optional<WatchTarget> from = classifier.classify(e.source, e.oldPath);
    Optional<WatchTarget> to = classifier.classify(e.source, e.path);
    if (from.isPresent() && to.isPresent()) {
      offer(new WatchEvent(WatchEventType.DELETED, e.oldPath, from.get(), clock.instant()));
      offer(new WatchEvent(WatchEventType.CREATED, e.path, to.get(), clock.instant()));
    } else if (to.isPresent()) {
      offer(new WatchEvent(WatchEventType.MOVED, e.path, to.get(), clock.instant(), e.oldPath));
    } else if (from.isPresent()) {
      offer(new WatchEvent(WatchEventType.DELETED, e.oldPath, from.get(), clock.instant()));
    }
  }

  private void offer(WatchEvent event) {
    log.trace("Classified {}", event);
    debouncer.offer(Pair.of(event.getTarget(), event.getPath()), event);
  }

  private void deliver(WatchEvent event) {
    log.debug("Delivering {}", event);
    for (Consumer<WatchEvent> callback : callbacks) {
      try {
        callback.accept(event);
      } catch (RuntimeException ex) {
        log.error("Watch callback failed for " + event, ex);
      }
    }
  }

  private void startObserver(WatchedPath watched) {
    PathObserver observer = observerFactory.newObserver(watched, this::onRawEvent);
    observers.put(watched.getRoot(), observer);
    taskFactory.runTask(observer);
  }

  private void stopObserver(Path root) {
    PathObserver observer = observers.remove(root);
    if (observer != null) {
      taskFactory.stopTask(observer);
    }
  }

}

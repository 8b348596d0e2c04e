package agentsync.watch;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Observes a set of paths and notifies callbacks of classified, debounced {@link WatchEvent}s.
 *
 * Callbacks are invoked on the watcher's own debounce thread, one event at a time.
 */
public interface FileWatcher {

  /**
   * Registers {@code path}, a file or a directory. Re-adding a path replaces its
   * settings and, if we're running, restarts its observation.
   */
  void addPath(Path path, boolean recursive, TargetPatterns patterns);

  /** Registers {@code path} recursively with the default patterns. */
  void addPath(Path path);

  /** @return whether {@code path} was being watched */
  boolean removePath(Path path);

  /** Starts watching, first registering the default paths if none have been added. Idempotent. */
  void start();

  /** Registers {@code paths} and starts watching. */
  void start(List<Path> paths);

  /** Releases every OS watch and drops any not-yet-delivered events. Idempotent. */
  void stop();

  void addCallback(Consumer<WatchEvent> callback);

  void removeCallback(Consumer<WatchEvent> callback);

  /** @return how many callbacks are currently registered */
  int getCallbackCount();

  boolean isWatching();

  List<Path> getWatchedPaths();

  /** @return the managed directories plus any tool directories, keeping only those that exist */
  List<Path> getDefaultWatchPaths();

}

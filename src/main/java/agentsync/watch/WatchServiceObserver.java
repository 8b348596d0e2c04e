package agentsync.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a path with the JDK's native {@link WatchService}.
 *
 * Directories are registered one by one, walking the tree when recursive, and
 * newly created subdirectories are registered as they show up. A single file is
 * watched via its parent directory, ignoring its siblings.
 *
 * The WatchService has no notion of renames: a move shows up as a delete of the
 * old path and a create of the new one.
 */
public class WatchServiceObserver implements PathObserver {

  private static final Logger log = LoggerFactory.getLogger(WatchServiceObserver.class);
  // maintained by hand in both directions, as watchKey.watchable() goes stale on renames
  private final Map<WatchKey, Path> keyToPath = new ConcurrentHashMap<>();
  private final Map<Path, WatchKey> pathToKey = new ConcurrentHashMap<>();
  private final WatchService watchService;
  private final WatchedPath watched;
  private final Consumer<RawEvent> sink;
  private volatile boolean fileMode;

  public WatchServiceObserver(WatchService watchService, WatchedPath watched, Consumer<RawEvent> sink) {
    this.watchService = watchService;
    this.watched = watched;
    this.sink = sink;
  }

  @Override
  public WatchedPath getWatchedPath() {
    return watched;
  }

  @Override
  public void onStart() {
    Path root = watched.getRoot();
    try {
      if (Files.isDirectory(root)) {
        if (watched.isRecursive()) {
          watchTree(root, false);
        } else {
          watchDirectory(root);
        }
      } else {
        fileMode = true;
        watchDirectory(root.getParent());
      }
    } catch (WatchIOException e) {
      // non-fatal, we just won't hear about this path
      log.warn(e.getMessage(), e);
    }
  }

  @Override
  public void onInterrupt() {
    closeWatchService();
  }

  @Override
  public void onStop() {
    closeWatchService();
    keyToPath.clear();
    pathToKey.clear();
  }

  @Override
  public Duration runOneLoop() throws InterruptedException {
    WatchKey watchKey;
    try {
      watchKey = watchService.take();
    } catch (ClosedWatchServiceException e) {
      // shutting down
      return Duration.ofMillis(-1);
    }
    Path parentDir = keyToPath.get(watchKey);
    for (java.nio.file.WatchEvent<?> watchEvent : watchKey.pollEvents()) {
      java.nio.file.WatchEvent.Kind<?> kind = watchEvent.kind();
      if (kind == OVERFLOW) {
        log.warn("Watch events overflowed for {}, some changes were missed", watched.getRoot());
        continue;
      }
      if (parentDir == null) {
        log.debug("No directory for {}: {}", watchKey.watchable(), watchEvent.context());
        continue;
      }
      Path child = parentDir.resolve((Path) watchEvent.context());
      if (fileMode && !child.equals(watched.getRoot())) {
        continue;
      }
      log.trace("WatchEvent {} {}", kind, child);
      if (kind == ENTRY_CREATE) {
        onCreated(child);
      } else if (kind == ENTRY_MODIFY) {
        sink.accept(RawEvent.modified(watched, child, Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)));
      } else if (kind == ENTRY_DELETE) {
        onDeleted(child);
      }
    }
    if (!watchKey.reset()) {
      Path gone = keyToPath.remove(watchKey);
      if (gone != null) {
        pathToKey.remove(gone);
      }
    }
    return null;
  }

  private void onCreated(Path child) {
    boolean directory = Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS);
    sink.accept(RawEvent.created(watched, child, directory));
    if (directory && watched.isRecursive() && !fileMode) {
      // files may have landed in the new directory before we could watch it
      try {
        watchTree(child, true);
      } catch (WatchIOException e) {
        log.warn(e.getMessage(), e);
      }
    }
  }

  private void onDeleted(Path child) {
    WatchKey key = pathToKey.remove(child);
    if (key != null) {
      keyToPath.remove(key);
      key.cancel();
    }
    sink.accept(RawEvent.deleted(watched, child, key != null));
  }

  private void watchTree(Path directory, boolean emitFiles) throws WatchIOException {
    try {
      Files.walkFileTree(directory, new SimpleFileVisitor<Path>() {
        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
          watchDirectory(dir);
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
          if (emitFiles) {
            sink.accept(RawEvent.created(watched, file, false));
          }
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (WatchIOException e) {
      throw e;
    } catch (IOException e) {
      throw new WatchIOException("Could not walk " + directory, e);
    }
  }

  private void watchDirectory(Path directory) throws WatchIOException {
    if (pathToKey.containsKey(directory)) {
      return;
    }
    try {
      WatchKey key = directory.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
      log.trace("Putting {} = {}", key, directory);
      keyToPath.put(key, directory);
      pathToKey.put(directory, key);
    } catch (IOException | ClosedWatchServiceException e) {
      throw new WatchIOException("Could not watch " + directory, e);
    }
  }

  private void closeWatchService() {
    try {
      watchService.close();
    } catch (IOException e) {
      log.warn("Exception when shutting down the watch service", e);
    }
  }

}

package agentsync.watch;

import java.nio.file.Path;

import com.google.common.base.MoreObjects;

/**
 * An unclassified change as reported by a {@link PathObserver}, before
 * classification and debouncing.
 */
public class RawEvent {

  final WatchEventType kind;
  final Path path;
  // the source of a move
  final Path oldPath;
  final boolean directory;
  final WatchedPath source;

  public static RawEvent created(WatchedPath source, Path path, boolean directory) {
    return new RawEvent(WatchEventType.CREATED, path, null, directory, source);
  }

  public static RawEvent modified(WatchedPath source, Path path, boolean directory) {
    return new RawEvent(WatchEventType.MODIFIED, path, null, directory, source);
  }

  public static RawEvent deleted(WatchedPath source, Path path, boolean directory) {
    return new RawEvent(WatchEventType.DELETED, path, null, directory, source);
  }

  public static RawEvent moved(WatchedPath source, Path from, Path to, boolean directory) {
    return new RawEvent(WatchEventType.MOVED, to, from, directory, source);
  }

  private RawEvent(WatchEventType kind, Path path, Path oldPath, boolean directory, WatchedPath source) {
    this.kind = kind;
    this.path = path;
    this.oldPath = oldPath;
    this.directory = directory;
    this.source = source;
  }

  public WatchEventType getKind() {
    return kind;
  }

  public Path getPath() {
    return path;
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .omitNullValues()
      .add("kind", kind)
      .add("path", path)
      .add("oldPath", oldPath)
      .add("directory", directory)
      .toString();
  }

}

package agentsync.watch;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.MoreObjects;

/** A classified, debounced change, as handed to watcher callbacks. */
public class WatchEvent {

  private final WatchEventType eventType;
  private final Path path;
  private final WatchTarget target;
  private final Instant timestamp;
  private final Path oldPath;

  public WatchEvent(WatchEventType eventType, Path path, WatchTarget target, Instant timestamp) {
    this(eventType, path, target, timestamp, null);
  }

  public WatchEvent(WatchEventType eventType, Path path, WatchTarget target, Instant timestamp, Path oldPath) {
    this.eventType = Objects.requireNonNull(eventType);
    this.path = Objects.requireNonNull(path);
    this.target = Objects.requireNonNull(target);
    this.timestamp = Objects.requireNonNull(timestamp);
    this.oldPath = oldPath;
  }

  public WatchEventType getEventType() {
    return eventType;
  }

  public Path getPath() {
    return path;
  }

  public WatchTarget getTarget() {
    return target;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  /** Only set for {@link WatchEventType#MOVED}. */
  public Optional<Path> getOldPath() {
    return Optional.ofNullable(oldPath);
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .omitNullValues()
      .add("type", eventType)
      .add("path", path)
      .add("target", target)
      .add("oldPath", oldPath)
      .toString();
  }

}

package agentsync.watch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.stream.Stream;

import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a path by re-scanning it every interval and diffing against the last scan.
 *
 * Used where native notifications aren't available. A path that disappears
 * and reappears elsewhere with the same file key (inode) within one interval
 * is reported as a move; everything else is a create, modify or delete. A scan
 * that fails is logged and simply tried again next interval.
 */
public class PollingObserver implements PathObserver {

  private static final Logger log = LoggerFactory.getLogger(PollingObserver.class);
  private final WatchedPath watched;
  private final Duration interval;
  private final Consumer<RawEvent> sink;
  private SortedMap<Path, Entry> snapshot = new TreeMap<>();

  public PollingObserver(WatchedPath watched, Duration interval, Consumer<RawEvent> sink) {
    this.watched = watched;
    this.interval = interval;
    this.sink = sink;
  }

  @Override
  public WatchedPath getWatchedPath() {
    return watched;
  }

  @Override
  public void onStart() {
    try {
      snapshot = scan();
    } catch (WatchIOException e) {
      log.warn("Initial scan failed, will retry: " + e.getMessage(), e);
    }
  }

  @Override
  public void onStop() {
    snapshot.clear();
  }

  @Override
  public Duration runOneLoop() {
    try {
      SortedMap<Path, Entry> next = scan();
      diff(snapshot, next);
      snapshot = next;
    } catch (WatchIOException e) {
      log.warn("Poll failed, retrying in " + interval.toMillis() + "ms: " + e.getMessage(), e);
    }
    return interval;
  }

  private void diff(SortedMap<Path, Entry> before, SortedMap<Path, Entry> after) {
    Map<Path, Entry> deleted = new TreeMap<>(before);
    deleted.keySet().removeAll(after.keySet());
    Map<Path, Entry> created = new TreeMap<>(after);
    created.keySet().removeAll(before.keySet());

    for (Map.Entry<Path, Entry> d : deleted.entrySet()) {
      Optional<Path> movedTo = findByKey(created, d.getValue().fileKey);
      if (movedTo.isPresent()) {
        created.remove(movedTo.get());
        sink.accept(RawEvent.moved(watched, d.getKey(), movedTo.get(), d.getValue().directory));
      } else {
        sink.accept(RawEvent.deleted(watched, d.getKey(), d.getValue().directory));
      }
    }
    created.forEach((path, e) -> sink.accept(RawEvent.created(watched, path, e.directory)));
    for (Map.Entry<Path, Entry> a : after.entrySet()) {
      Entry old = before.get(a.getKey());
      // a directory's mod time moves with its children, which we report on their own
      if (old != null && !a.getValue().directory && !old.sameContentAs(a.getValue())) {
        sink.accept(RawEvent.modified(watched, a.getKey(), false));
      }
    }
  }

  private static Optional<Path> findByKey(Map<Path, Entry> entries, Object fileKey) {
    if (fileKey == null) {
      return Optional.empty();
    }
    return Seq.seq(entries).filter(e -> fileKey.equals(e.v2.fileKey)).map(e -> e.v1).findFirst();
  }

  private SortedMap<Path, Entry> scan() throws WatchIOException {
    SortedMap<Path, Entry> entries = new TreeMap<>();
    Path root = watched.getRoot();
    if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
      return entries;
    }
    try {
      if (!Files.isDirectory(root)) {
        entries.put(root, Entry.of(root));
        return entries;
      }
      int depth = watched.isRecursive() ? Integer.MAX_VALUE : 1;
      try (Stream<Path> s = Files.walk(root, depth)) {
        s.filter(p -> !p.equals(root)).forEach(p -> {
          try {
            entries.put(p, Entry.of(p));
          } catch (NoSuchFileException e) {
            // deleted mid-walk, treat it as gone
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        });
      }
      return entries;
    } catch (IOException e) {
      throw new WatchIOException("Could not scan " + root, e);
    } catch (UncheckedIOException e) {
      throw new WatchIOException("Could not scan " + root, e.getCause());
    }
  }

  private static class Entry {
    private final long modTime;
    private final long size;
    private final boolean directory;
    private final Object fileKey;

    private static Entry of(Path path) throws IOException {
      BasicFileAttributes a = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
      return new Entry(a.lastModifiedTime().toMillis(), a.size(), a.isDirectory(), a.fileKey());
    }

    private Entry(long modTime, long size, boolean directory, Object fileKey) {
      this.modTime = modTime;
      this.size = size;
      this.directory = directory;
      this.fileKey = fileKey;
    }

    private boolean sameContentAs(Entry other) {
      return modTime == other.modTime && size == other.size && Objects.equals(fileKey, other.fileKey);
    }
  }

}

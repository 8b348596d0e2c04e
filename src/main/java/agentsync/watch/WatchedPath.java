package agentsync.watch;

import java.nio.file.Path;

import com.google.common.base.MoreObjects;

import agentsync.Utils;

/** A registered root, either a file or a directory, and the patterns that classify changes under it. */
public class WatchedPath {

  private final Path root;
  private final boolean recursive;
  private final TargetPatterns patterns;

  public WatchedPath(Path root, boolean recursive, TargetPatterns patterns) {
    this.root = root.toAbsolutePath().normalize();
    this.recursive = recursive;
    this.patterns = patterns;
  }

  public Path getRoot() {
    return root;
  }

  public boolean isRecursive() {
    return recursive;
  }

  public TargetPatterns getPatterns() {
    return patterns;
  }

  /**
   * @return {@code path} relative to the root, e.g. {@code agents/foo.md}, or just the
   *   file name when the root is the watched file itself
   */
  public String relativize(Path path) {
    if (path.equals(root) || !path.startsWith(root)) {
      return String.valueOf(path.getFileName());
    }
    return Utils.toRelativePath(root, path);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("root", root).add("recursive", recursive).toString();
  }

}

package agentsync.watch;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Decides which {@link WatchTarget}, if any, a changed path belongs to.
 *
 * Pure and stateless, so observers' threads can share it. Patterns of the
 * watched root are tried first; failing that, a path under the managed root
 * directory (e.g. {@code ~/.agentsync/agents/foo.txt}) is classified by the
 * name of the managed root's child it sits in.
 */
public class PathClassifier {

  private final String managedDirName;

  /** @param managedDirName the managed root's directory name, e.g. {@code .agentsync} */
  public PathClassifier(String managedDirName) {
    this.managedDirName = managedDirName;
  }

  public Optional<WatchTarget> classify(WatchedPath source, Path path) {
    Optional<WatchTarget> byPattern = source.getPatterns().match(source.relativize(path));
    if (byPattern.isPresent()) {
      return byPattern;
    }
    return classifyByAncestor(path);
  }

  Optional<WatchTarget> classifyByAncestor(Path path) {
    for (int i = 0; i < path.getNameCount() - 1; i++) {
      if (path.getName(i).toString().equals(managedDirName)) {
        switch (path.getName(i + 1).toString()) {
          case "agents":
            return Optional.of(WatchTarget.AGENTS);
          case "config":
            return Optional.of(WatchTarget.CONFIG);
          case "templates":
            return Optional.of(WatchTarget.TEMPLATES);
          default:
            return Optional.empty();
        }
      }
    }
    return Optional.empty();
  }

}

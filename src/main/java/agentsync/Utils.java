package agentsync;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;

public class Utils {

  @FunctionalInterface
  public interface InterruptedRunnable {
    void run() throws InterruptedException;
  }

  public static void resetIfInterrupted(InterruptedRunnable r) {
    try {
      r.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
  }

  /** @return {@code path} relative to {@code root}, always with forward slashes, e.g. {@code agents/foo.md}. */
  public static String toRelativePath(Path root, Path path) {
    return root.relativize(path).toString().replace(File.separator, "/");
  }

  /** @return e.g. "300s" or "1500ms", for log lines. */
  public static String toShortString(Duration d) {
    if (d.toMillis() % 1000 == 0) {
      return d.getSeconds() + "s";
    }
    return d.toMillis() + "ms";
  }

}

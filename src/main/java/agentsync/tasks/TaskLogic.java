package agentsync.tasks;

import java.time.Duration;

import org.apache.commons.lang3.StringUtils;

/**
 * One long-lived loop, e.g. a watch observer, a debouncer or a scheduler worker.
 *
 * The loop owns whatever state it mutates; other threads should only
 * reach it through thread-safe queues.
 */
public interface TaskLogic {

  /**
   * Runs one iteration.
   *
   * @return how long to sleep before the next iteration, {@code null} to loop
   *   again immediately, or a negative duration to end the task.
   */
  Duration runOneLoop() throws InterruptedException;

  /** Called on the task thread before the first {@link #runOneLoop()}. */
  default void onStart() throws InterruptedException {
  }

  default void onFailure() throws InterruptedException {
  }

  /** Called on the task thread once the loop has ended. */
  default void onStop() throws InterruptedException {
  }

  /**
   * Called off the task thread while stopping it, for loops that block
   * on something that ignores {@link Thread#interrupt()}.
   */
  default void onInterrupt() {
  }

  default String getName() {
    String name = getClass().getSimpleName();
    // lambdas don't have simple names
    if (name.equals("")) {
      name = StringUtils.substringAfterLast(getClass().getName(), ".");
    }
    return name;
  }
}

package agentsync.scheduler;

import com.google.common.base.MoreObjects;

/**
 * A point-in-time view of where the scheduler's jobs are.
 *
 * Until history caps start evicting, {@code queueSize + running + retrying +
 * completed + failed + cancelled} is the number of jobs ever added.
 */
public class QueueStatus {

  private final int queueSize;
  private final int running;
  private final int retrying;
  private final int completed;
  private final int failed;
  private final int cancelled;
  private final boolean isRunning;
  private final SchedulerStats stats;

  QueueStatus(int queueSize, int running, int retrying, int completed, int failed, int cancelled, boolean isRunning, SchedulerStats stats) {
    this.queueSize = queueSize;
    this.running = running;
    this.retrying = retrying;
    this.completed = completed;
    this.failed = failed;
    this.cancelled = cancelled;
    this.isRunning = isRunning;
    this.stats = stats;
  }

  public int getQueueSize() {
    return queueSize;
  }

  public int getRunning() {
    return running;
  }

  /** @return jobs waiting out their retry delay */
  public int getRetrying() {
    return retrying;
  }

  public int getCompleted() {
    return completed;
  }

  public int getFailed() {
    return failed;
  }

  public int getCancelled() {
    return cancelled;
  }

  public boolean isRunning() {
    return isRunning;
  }

  public SchedulerStats getStats() {
    return stats;
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("queueSize", queueSize)
      .add("running", running)
      .add("retrying", retrying)
      .add("completed", completed)
      .add("failed", failed)
      .add("cancelled", cancelled)
      .add("isRunning", isRunning)
      .add("stats", stats)
      .toString();
  }

}

package agentsync.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.google.common.base.MoreObjects;

/** Cumulative counters since the scheduler was created; unaffected by history eviction. */
public class SchedulerStats {

  private final long jobsCompleted;
  private final long jobsFailed;
  private final long jobsRetried;
  private final long jobsCancelled;
  private final Duration totalExecutionTime;
  private final Instant lastSuccessfulSync;

  SchedulerStats(long jobsCompleted, long jobsFailed, long jobsRetried, long jobsCancelled, Duration totalExecutionTime, Instant lastSuccessfulSync) {
    this.jobsCompleted = jobsCompleted;
    this.jobsFailed = jobsFailed;
    this.jobsRetried = jobsRetried;
    this.jobsCancelled = jobsCancelled;
    this.totalExecutionTime = totalExecutionTime;
    this.lastSuccessfulSync = lastSuccessfulSync;
  }

  public long getJobsCompleted() {
    return jobsCompleted;
  }

  public long getJobsFailed() {
    return jobsFailed;
  }

  public long getJobsRetried() {
    return jobsRetried;
  }

  public long getJobsCancelled() {
    return jobsCancelled;
  }

  public Duration getTotalExecutionTime() {
    return totalExecutionTime;
  }

  public Optional<Instant> getLastSuccessfulSync() {
    return Optional.ofNullable(lastSuccessfulSync);
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("completed", jobsCompleted)
      .add("failed", jobsFailed)
      .add("retried", jobsRetried)
      .add("cancelled", jobsCancelled)
      .add("totalExecutionTime", totalExecutionTime)
      .add("lastSuccessfulSync", lastSuccessfulSync)
      .toString();
  }

}

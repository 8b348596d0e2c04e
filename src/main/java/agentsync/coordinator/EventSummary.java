package agentsync.coordinator;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.google.common.base.MoreObjects;

import agentsync.scheduler.JobType;
import agentsync.scheduler.SyncJob;

/** A finished job, as shown in the recent activity list. */
public class EventSummary {

  public enum Type {
    JOB_COMPLETED, JOB_FAILED
  }

  private final Type type;
  private final String jobId;
  private final JobType jobType;
  private final String targetAdapter;
  private final Instant at;
  private final Duration duration;
  private final String error;
  private final int retryCount;

  static EventSummary completed(SyncJob job) {
    return new EventSummary(Type.JOB_COMPLETED, job, null);
  }

  static EventSummary failed(SyncJob job) {
    return new EventSummary(Type.JOB_FAILED, job, job.getErrorMessage().orElse(null));
  }

  private EventSummary(Type type, SyncJob job, String error) {
    this.type = type;
    this.jobId = job.getId();
    this.jobType = job.getJobType();
    this.targetAdapter = job.getTargetAdapter().orElse(null);
    this.at = job.getCompletedAt().orElse(job.getCreatedAt());
    this.duration = job.getDuration().orElse(null);
    this.error = error;
    this.retryCount = job.getRetryCount();
  }

  public Type getType() {
    return type;
  }

  public String getJobId() {
    return jobId;
  }

  public JobType getJobType() {
    return jobType;
  }

  public Optional<String> getTargetAdapter() {
    return Optional.ofNullable(targetAdapter);
  }

  /** @return when the job completed or finally failed */
  public Instant getAt() {
    return at;
  }

  public Optional<Duration> getDuration() {
    return Optional.ofNullable(duration);
  }

  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }

  public int getRetryCount() {
    return retryCount;
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .omitNullValues()
      .add("type", type)
      .add("jobId", jobId)
      .add("jobType", jobType)
      .add("adapter", targetAdapter)
      .add("at", at)
      .add("error", error)
      .toString();
  }

}

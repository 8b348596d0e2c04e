package agentsync.scheduler;

import static com.google.common.base.Preconditions.checkState;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * A unit of scheduled work and its lifecycle.
 *
 * Goes {@code PENDING -> RUNNING -> COMPLETED}, or on failure
 * {@code RUNNING -> FAILED -> RETRYING -> RUNNING} until the retries run out,
 * at which point {@code FAILED} is final. Any not-yet-finished job can become
 * {@code CANCELLED}. Transitions are only made by the scheduler; readers on
 * other threads see a consistent, if possibly stale, view.
 */
public class SyncJob {

  private final String id = UUID.randomUUID().toString();
  private final long number;
  private final JobType jobType;
  private final String targetAdapter;
  private final int priority;
  private final int maxRetries;
  private final Duration retryDelay;
  private final Duration timeout;
  private final Map<String, String> metadata;
  private final Instant createdAt;
  private volatile JobStatus status = JobStatus.PENDING;
  private volatile Instant startedAt;
  private volatile Instant completedAt;
  private volatile int retryCount;
  private volatile int attempts;
  private volatile String errorMessage;
  private volatile Map<String, Object> result;

  SyncJob(
    long number,
    JobType jobType,
    String targetAdapter,
    int priority,
    int maxRetries,
    Duration retryDelay,
    Duration timeout,
    Map<String, String> metadata,
    Instant createdAt) {
    this.number = number;
    this.jobType = jobType;
    this.targetAdapter = targetAdapter;
    this.priority = priority;
    this.maxRetries = maxRetries;
    this.retryDelay = retryDelay;
    this.timeout = timeout;
    this.metadata = ImmutableMap.copyOf(metadata);
    this.createdAt = createdAt;
  }

  /** @return false if the job was cancelled while waiting */
  synchronized boolean markStarted(Instant now) {
    if (status == JobStatus.CANCELLED) {
      return false;
    }
    checkState(status == JobStatus.PENDING || status == JobStatus.RETRYING, "Cannot start %s job %s", status, id);
    status = JobStatus.RUNNING;
    startedAt = now;
    attempts++;
    return true;
  }

  /** @return false if the job was cancelled while running */
  synchronized boolean markCompleted(Instant now, Map<String, Object> result) {
    if (status == JobStatus.CANCELLED) {
      return false;
    }
    checkState(status == JobStatus.RUNNING, "Cannot complete %s job %s", status, id);
    status = JobStatus.COMPLETED;
    completedAt = now;
    this.result = result;
    return true;
  }

  /** @return false if the job was cancelled while running */
  synchronized boolean markFailed(String errorMessage) {
    if (status == JobStatus.CANCELLED) {
      return false;
    }
    checkState(status == JobStatus.RUNNING, "Cannot fail %s job %s", status, id);
    status = JobStatus.FAILED;
    this.errorMessage = errorMessage;
    return true;
  }

  synchronized void prepareRetry() {
    checkState(canRetry(), "Cannot retry %s job %s after %s retries", status, id, retryCount);
    status = JobStatus.RETRYING;
    retryCount++;
    startedAt = null;
    errorMessage = null;
  }

  /** Makes a failure final, once there are no retries left. */
  synchronized void markFinallyFailed(Instant now) {
    checkState(status == JobStatus.FAILED && completedAt == null, "Cannot finalize %s job %s", status, id);
    completedAt = now;
  }

  /** @return whether the job was still pending, retrying or running */
  synchronized boolean markCancelled(Instant now) {
    if (status == JobStatus.PENDING || status == JobStatus.RETRYING || status == JobStatus.RUNNING) {
      status = JobStatus.CANCELLED;
      completedAt = now;
      return true;
    }
    return false;
  }

  public synchronized boolean canRetry() {
    return status == JobStatus.FAILED && retryCount < maxRetries;
  }

  public boolean isFinished() {
    JobStatus s = status;
    return s == JobStatus.COMPLETED || s == JobStatus.CANCELLED || (s == JobStatus.FAILED && completedAt != null);
  }

  public String getId() {
    return id;
  }

  /** @return the order the job was added in, starting at 0 */
  public long getNumber() {
    return number;
  }

  public JobType getJobType() {
    return jobType;
  }

  /** @return the adapter to sync, or empty for all of them */
  public Optional<String> getTargetAdapter() {
    return Optional.ofNullable(targetAdapter);
  }

  public int getPriority() {
    return priority;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public JobStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  public Optional<Instant> getCompletedAt() {
    return Optional.ofNullable(completedAt);
  }

  public int getRetryCount() {
    return retryCount;
  }

  /** @return how many times the job has been run, including retries */
  public int getAttempts() {
    return attempts;
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public Optional<Map<String, Object>> getResult() {
    return Optional.ofNullable(result);
  }

  /** @return the time between the last start and completion, if both happened */
  public synchronized Optional<Duration> getDuration() {
    if (startedAt == null || completedAt == null) {
      return Optional.empty();
    }
    return Optional.of(Duration.between(startedAt, completedAt));
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .omitNullValues()
      .add("id", id)
      .add("type", jobType)
      .add("adapter", targetAdapter)
      .add("priority", priority)
      .add("status", status)
      .add("retryCount", retryCount)
      .add("error", errorMessage)
      .toString();
  }

}

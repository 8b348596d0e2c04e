package agentsync.scheduler;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * The arguments to {@link SyncScheduler#addJob(JobRequest)}.
 *
 * Anything left unset falls back to the scheduler's settings, e.g. the retry
 * policy and timeout; the priority defaults to 5.
 */
public class JobRequest {

  public static final int DEFAULT_PRIORITY = 5;

  final JobType jobType;
  String targetAdapter;
  int priority = DEFAULT_PRIORITY;
  Integer maxRetries;
  Duration retryDelay;
  Duration timeout;
  final Map<String, String> metadata = new HashMap<>();

  public static JobRequest of(JobType jobType) {
    return new JobRequest(jobType);
  }

  private JobRequest(JobType jobType) {
    this.jobType = checkNotNull(jobType);
  }

  /** @param targetAdapter the one adapter to sync, or null for all */
  public JobRequest targetAdapter(String targetAdapter) {
    this.targetAdapter = targetAdapter;
    return this;
  }

  /** @param priority lower is more urgent */
  public JobRequest priority(int priority) {
    this.priority = priority;
    return this;
  }

  public JobRequest maxRetries(int maxRetries) {
    checkArgument(maxRetries >= 0, "maxRetries must not be negative: %s", maxRetries);
    this.maxRetries = maxRetries;
    return this;
  }

  public JobRequest retryDelay(Duration retryDelay) {
    checkArgument(!retryDelay.isNegative(), "retryDelay must not be negative: %s", retryDelay);
    this.retryDelay = retryDelay;
    return this;
  }

  public JobRequest timeout(Duration timeout) {
    checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive: %s", timeout);
    this.timeout = timeout;
    return this;
  }

  public JobRequest metadata(String key, String value) {
    metadata.put(key, value);
    return this;
  }

}

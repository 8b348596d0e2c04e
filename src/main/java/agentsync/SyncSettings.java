package agentsync;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import com.google.common.base.MoreObjects;

/**
 * A parameter object for the knobs of the watcher, coordinator and scheduler.
 *
 * Defaults match what the CLI uses when no options are given.
 */
public class SyncSettings {

  /** Where the managed agent/config/template directories live, e.g. {@code ~/.agentsync}. */
  public final Path managedRoot;
  /** Per (target, path) quiet period in the watcher. */
  public final Duration watchDebounce;
  /** Per target window in the coordinator, measured from the first event of a burst. */
  public final Duration syncDebounce;
  public final Duration fullSyncInterval;
  public final Duration healthCheckInterval;
  public final int maxConcurrentJobs;
  public final Duration jobTimeout;
  public final Duration retryDelay;
  public final int maxRetries;
  /** How long an idle worker blocks on the queue before re-checking for shutdown. */
  public final Duration queuePollTimeout;
  public final Duration workerErrorBackoff;
  public final Duration pollingInterval;
  public final boolean usePolling;
  public final int maxCompletedHistory;
  public final int maxFailedHistory;
  public final boolean enabled;

  public static SyncSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  private SyncSettings(Builder b) {
    this.managedRoot = b.managedRoot;
    this.watchDebounce = b.watchDebounce;
    this.syncDebounce = b.syncDebounce;
    this.fullSyncInterval = b.fullSyncInterval;
    this.healthCheckInterval = b.healthCheckInterval;
    this.maxConcurrentJobs = b.maxConcurrentJobs;
    this.jobTimeout = b.jobTimeout;
    this.retryDelay = b.retryDelay;
    this.maxRetries = b.maxRetries;
    this.queuePollTimeout = b.queuePollTimeout;
    this.workerErrorBackoff = b.workerErrorBackoff;
    this.pollingInterval = b.pollingInterval;
    this.usePolling = b.usePolling;
    this.maxCompletedHistory = b.maxCompletedHistory;
    this.maxFailedHistory = b.maxFailedHistory;
    this.enabled = b.enabled;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("managedRoot", managedRoot)
      .add("watchDebounce", Utils.toShortString(watchDebounce))
      .add("syncDebounce", Utils.toShortString(syncDebounce))
      .add("fullSyncInterval", Utils.toShortString(fullSyncInterval))
      .add("healthCheckInterval", Utils.toShortString(healthCheckInterval))
      .add("maxConcurrentJobs", maxConcurrentJobs)
      .add("jobTimeout", Utils.toShortString(jobTimeout))
      .add("usePolling", usePolling)
      .toString();
  }

  public static class Builder {
    private Path managedRoot = Paths.get(System.getProperty("user.home"), ".agentsync");
    private Duration watchDebounce = Duration.ofSeconds(1);
    private Duration syncDebounce = Duration.ofSeconds(2);
    private Duration fullSyncInterval = Duration.ofMinutes(5);
    private Duration healthCheckInterval = Duration.ofMinutes(1);
    private int maxConcurrentJobs = 3;
    private Duration jobTimeout = Duration.ofMinutes(5);
    private Duration retryDelay = Duration.ofSeconds(30);
    private int maxRetries = 3;
    private Duration queuePollTimeout = Duration.ofSeconds(1);
    private Duration workerErrorBackoff = Duration.ofSeconds(1);
    private Duration pollingInterval = Duration.ofSeconds(1);
    private boolean usePolling = false;
    private int maxCompletedHistory = 100;
    private int maxFailedHistory = 50;
    private boolean enabled = true;

    private Builder() {
    }

    private Builder(SyncSettings s) {
      managedRoot = s.managedRoot;
      watchDebounce = s.watchDebounce;
      syncDebounce = s.syncDebounce;
      fullSyncInterval = s.fullSyncInterval;
      healthCheckInterval = s.healthCheckInterval;
      maxConcurrentJobs = s.maxConcurrentJobs;
      jobTimeout = s.jobTimeout;
      retryDelay = s.retryDelay;
      maxRetries = s.maxRetries;
      queuePollTimeout = s.queuePollTimeout;
      workerErrorBackoff = s.workerErrorBackoff;
      pollingInterval = s.pollingInterval;
      usePolling = s.usePolling;
      maxCompletedHistory = s.maxCompletedHistory;
      maxFailedHistory = s.maxFailedHistory;
      enabled = s.enabled;
    }

    public Builder managedRoot(Path managedRoot) {
      this.managedRoot = checkNotNull(managedRoot);
      return this;
    }

    public Builder watchDebounce(Duration watchDebounce) {
      this.watchDebounce = nonNegative(watchDebounce, "watchDebounce");
      return this;
    }

    public Builder syncDebounce(Duration syncDebounce) {
      this.syncDebounce = nonNegative(syncDebounce, "syncDebounce");
      return this;
    }

    public Builder fullSyncInterval(Duration fullSyncInterval) {
      this.fullSyncInterval = positive(fullSyncInterval, "fullSyncInterval");
      return this;
    }

    public Builder healthCheckInterval(Duration healthCheckInterval) {
      this.healthCheckInterval = positive(healthCheckInterval, "healthCheckInterval");
      return this;
    }

    public Builder maxConcurrentJobs(int maxConcurrentJobs) {
      checkArgument(maxConcurrentJobs > 0, "maxConcurrentJobs must be positive: %s", maxConcurrentJobs);
      this.maxConcurrentJobs = maxConcurrentJobs;
      return this;
    }

    public Builder jobTimeout(Duration jobTimeout) {
      this.jobTimeout = positive(jobTimeout, "jobTimeout");
      return this;
    }

    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = nonNegative(retryDelay, "retryDelay");
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      checkArgument(maxRetries >= 0, "maxRetries must not be negative: %s", maxRetries);
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder queuePollTimeout(Duration queuePollTimeout) {
      this.queuePollTimeout = nonNegative(queuePollTimeout, "queuePollTimeout");
      return this;
    }

    public Builder workerErrorBackoff(Duration workerErrorBackoff) {
      this.workerErrorBackoff = nonNegative(workerErrorBackoff, "workerErrorBackoff");
      return this;
    }

    public Builder pollingInterval(Duration pollingInterval) {
      this.pollingInterval = positive(pollingInterval, "pollingInterval");
      return this;
    }

    public Builder usePolling(boolean usePolling) {
      this.usePolling = usePolling;
      return this;
    }

    public Builder maxCompletedHistory(int maxCompletedHistory) {
      checkArgument(maxCompletedHistory >= 0, "maxCompletedHistory must not be negative");
      this.maxCompletedHistory = maxCompletedHistory;
      return this;
    }

    public Builder maxFailedHistory(int maxFailedHistory) {
      checkArgument(maxFailedHistory >= 0, "maxFailedHistory must not be negative");
      this.maxFailedHistory = maxFailedHistory;
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public SyncSettings build() {
      return new SyncSettings(this);
    }

    private static Duration nonNegative(Duration d, String name) {
      checkArgument(!checkNotNull(d, name).isNegative(), "%s must not be negative: %s", name, d);
      return d;
    }

    private static Duration positive(Duration d, String name) {
      checkArgument(!checkNotNull(d, name).isNegative() && !d.isZero(), "%s must be positive: %s", name, d);
      return d;
    }
  }

}

package agentsync.coordinator;

import java.time.Instant;
import java.util.Optional;

import com.google.common.base.MoreObjects;

public class CoordinatorStats {

  private final long jobsSubmitted;
  private final long autoSyncsTriggered;
  private final long fileEventsProcessed;
  private final Instant lastAutoSync;
  private final Instant startedAt;

  CoordinatorStats(long jobsSubmitted, long autoSyncsTriggered, long fileEventsProcessed, Instant lastAutoSync, Instant startedAt) {
    this.jobsSubmitted = jobsSubmitted;
    this.autoSyncsTriggered = autoSyncsTriggered;
    this.fileEventsProcessed = fileEventsProcessed;
    this.lastAutoSync = lastAutoSync;
    this.startedAt = startedAt;
  }

  /** @return jobs added through any trigger, manual, automatic or periodic */
  public long getJobsSubmitted() {
    return jobsSubmitted;
  }

  /** @return jobs added because files changed */
  public long getAutoSyncsTriggered() {
    return autoSyncsTriggered;
  }

  public long getFileEventsProcessed() {
    return fileEventsProcessed;
  }

  public Optional<Instant> getLastAutoSync() {
    return Optional.ofNullable(lastAutoSync);
  }

  public Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("jobsSubmitted", jobsSubmitted)
      .add("autoSyncsTriggered", autoSyncsTriggered)
      .add("fileEventsProcessed", fileEventsProcessed)
      .add("lastAutoSync", lastAutoSync)
      .add("startedAt", startedAt)
      .toString();
  }

}

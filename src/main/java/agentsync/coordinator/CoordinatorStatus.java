package agentsync.coordinator;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import agentsync.scheduler.QueueStatus;
import agentsync.watch.WatchTarget;

public class CoordinatorStatus {

  private final boolean enabled;
  private final boolean running;
  private final boolean watcherActive;
  private final Set<WatchTarget> pendingTargets;
  private final Map<WatchTarget, Instant> lastTriggers;
  private final QueueStatus scheduler;
  private final CoordinatorStats stats;

  CoordinatorStatus(
    boolean enabled,
    boolean running,
    boolean watcherActive,
    Set<WatchTarget> pendingTargets,
    Map<WatchTarget, Instant> lastTriggers,
    QueueStatus scheduler,
    CoordinatorStats stats) {
    this.enabled = enabled;
    this.running = running;
    this.watcherActive = watcherActive;
    this.pendingTargets = ImmutableSet.copyOf(pendingTargets);
    this.lastTriggers = ImmutableMap.copyOf(lastTriggers);
    this.scheduler = scheduler;
    this.stats = stats;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public boolean isRunning() {
    return running;
  }

  public boolean isWatcherActive() {
    return watcherActive;
  }

  /** @return targets that changed but whose sync hasn't been submitted yet */
  public Set<WatchTarget> getPendingTargets() {
    return pendingTargets;
  }

  /** @return per target, the time of the latest change seen */
  public Map<WatchTarget, Instant> getLastTriggers() {
    return lastTriggers;
  }

  public QueueStatus getScheduler() {
    return scheduler;
  }

  public CoordinatorStats getStats() {
    return stats;
  }

  @Override
  public String toString() {
    return MoreObjects
      .toStringHelper(this)
      .add("enabled", enabled)
      .add("running", running)
      .add("watcherActive", watcherActive)
      .add("pendingTargets", pendingTargets)
      .add("lastTriggers", lastTriggers)
      .add("scheduler", scheduler)
      .add("stats", stats)
      .toString();
  }

}

package agentsync.coordinator;

import static com.google.common.base.Preconditions.checkArgument;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import agentsync.Debouncer;
import agentsync.SyncSettings;
import agentsync.scheduler.JobRequest;
import agentsync.scheduler.JobType;
import agentsync.scheduler.SyncJob;
import agentsync.scheduler.SyncScheduler;
import agentsync.tasks.TaskFactory;
import agentsync.tasks.TaskLogic;
import agentsync.tasks.TaskPool;
import agentsync.watch.FileWatcher;
import agentsync.watch.WatchEvent;
import agentsync.watch.WatchTarget;

/**
 * Turns file changes into sync jobs, and keeps things in sync periodically regardless.
 *
 * Watch events are debounced again per {@link WatchTarget}, coarser than the
 * watcher's per-path debounce: the first change to a target opens a window of
 * {@code syncDebounce}, and when it closes one job is submitted for the whole
 * burst, e.g. a config sync for any number of config file edits.
 *
 * On start we also submit a health check and a full sync, and every
 * {@code fullSyncInterval} another full sync as a backstop for missed events.
 *
 * The watcher may be shared: we only start it if it isn't already watching,
 * and on stop only shut it down if we started it and no other callbacks remain.
 */
public class AutoSyncCoordinator {

  private static final Logger log = LoggerFactory.getLogger(AutoSyncCoordinator.class);
  static final int PERIODIC_SYNC_PRIORITY = 5;
  private final TaskFactory taskFactory;
  private final FileWatcher watcher;
  private final SyncScheduler scheduler;
  private final SyncSettings settings;
  private final Clock clock;
  private final Consumer<WatchEvent> callback = this::onWatchEvent;
  private final Debouncer<WatchTarget, WatchEvent> targetDebouncer;
  private final Set<WatchTarget> pendingTargets = ConcurrentHashMap.newKeySet();
  private final Map<WatchTarget, Instant> lastTriggers = new ConcurrentHashMap<>();
  private final AtomicBoolean initialized = new AtomicBoolean();
  private final AtomicBoolean callbackAttached = new AtomicBoolean();
  private final AtomicLong jobsSubmitted = new AtomicLong();
  private final AtomicLong autoSyncsTriggered = new AtomicLong();
  private final AtomicLong fileEventsProcessed = new AtomicLong();
  private volatile Instant lastAutoSync;
  private volatile Instant startedAt;
  private volatile boolean enabled;
  private volatile boolean running;
  private boolean ownsWatcher;
  private TaskPool pool;

  public AutoSyncCoordinator(TaskFactory taskFactory, FileWatcher watcher, SyncScheduler scheduler, SyncSettings settings, Clock clock) {
    this.taskFactory = taskFactory;
    this.watcher = watcher;
    this.scheduler = scheduler;
    this.settings = settings;
    this.clock = clock;
    this.enabled = settings.enabled;
    this.targetDebouncer = new Debouncer<>("TargetDebouncer", settings.syncDebounce, false, settings.queuePollTimeout, clock, (t, e) -> onTargetSettled(t));
  }

  /** Subscribes to the watcher and initializes the integrations; done by {@link #start()} if need be. */
  public void initialize() {
    if (initialized.compareAndSet(false, true)) {
      attachCallback();
      scheduler.initialize();
    }
  }

  /** Starts the scheduler, watching the default paths. Does nothing if disabled. */
  public void start() {
    start(null);
  }

  /** @param paths what to watch, or null for the watcher's defaults */
  public synchronized void start(List<Path> paths) {
    if (running) {
      return;
    }
    if (!enabled) {
      log.info("Auto sync is disabled, not starting");
      return;
    }
    initialize();
    attachCallback();
    running = true;
    startedAt = clock.instant();
    scheduler.start();
    if (watcher.isWatching()) {
      if (paths != null) {
        paths.forEach(watcher::addPath);
      }
    } else {
      ownsWatcher = true;
      if (paths == null) {
        watcher.start();
      } else {
        watcher.start(paths);
      }
    }
    pool = taskFactory.newTaskPool("coordinator");
    pool.runTask(targetDebouncer);
    pool.runTask(new FullSyncLoop());
    submitStartupJobs();
    log.info("Auto sync started, watching {}", watcher.getWatchedPaths());
  }

  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    if (callbackAttached.compareAndSet(true, false)) {
      watcher.removeCallback(callback);
    }
    pool.stopAllTasks();
    if (ownsWatcher && watcher.getCallbackCount() == 0) {
      watcher.stop();
    } else {
      log.info("Leaving the watcher running for its other consumers");
    }
    ownsWatcher = false;
    scheduler.stop();
    pendingTargets.clear();
    log.info("Auto sync stopped");
  }

  public boolean isRunning() {
    return running;
  }

  /** Resumes turning watch events and the periodic timer into jobs. */
  public void enable() {
    enabled = true;
  }

  /** Keeps watching, but ignores events and skips periodic syncs until {@link #enable()}. */
  public void disable() {
    enabled = false;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public String triggerManualSync(int priority) {
    return triggerManualSync(priority, null);
  }

  /** @param targetAdapter the adapter to sync, or null for all */
  public String triggerManualSync(int priority, String targetAdapter) {
    return submit(JobRequest.of(JobType.FULL_SYNC).targetAdapter(targetAdapter).priority(priority).metadata("manual", "true"));
  }

  public String triggerConfigSync(int priority) {
    return submit(JobRequest.of(JobType.CONFIG_SYNC).priority(priority).metadata("auto_triggered", "true").metadata("target", "config"));
  }

  public String triggerAgentSync(int priority) {
    return submit(JobRequest.of(JobType.AGENT_SYNC).priority(priority).metadata("auto_triggered", "true").metadata("target", "agents"));
  }

  /** Watches {@code path} too, with the default patterns. @return whether it worked */
  public boolean addWatchPath(Path path) {
    try {
      watcher.addPath(path);
      return true;
    } catch (RuntimeException e) {
      log.error("Could not watch " + path, e);
      return false;
    }
  }

  /** @return whether {@code path} was being watched */
  public boolean removeWatchPath(Path path) {
    try {
      return watcher.removePath(path);
    } catch (RuntimeException e) {
      log.error("Could not stop watching " + path, e);
      return false;
    }
  }

  public CoordinatorStatus getStatus() {
    Map<WatchTarget, Instant> triggers = new EnumMap<>(WatchTarget.class);
    triggers.putAll(lastTriggers);
    return new CoordinatorStatus(
      enabled,
      running,
      watcher.isWatching(),
      pendingTargets,
      triggers,
      scheduler.getQueueStatus(),
      new CoordinatorStats(jobsSubmitted.get(), autoSyncsTriggered.get(), fileEventsProcessed.get(), lastAutoSync, startedAt));
  }

  /** @return up to {@code limit} completed or failed jobs, newest first */
  public List<EventSummary> getRecentEvents(int limit) {
    checkArgument(limit >= 0, "limit must not be negative: %s", limit);
    List<EventSummary> events = new ArrayList<>();
    Seq.seq(lastN(scheduler.getCompletedJobs(), limit)).map(EventSummary::completed).forEach(events::add);
    Seq.seq(lastN(scheduler.getFailedJobs(), limit)).map(EventSummary::failed).forEach(events::add);
    events.sort(Comparator.comparing(EventSummary::getAt).reversed());
    return events.subList(0, Math.min(limit, events.size()));
  }

  /** Called on the watcher's thread. */
  void onWatchEvent(WatchEvent event) {
    if (!enabled || !running) {
      return;
    }
    fileEventsProcessed.incrementAndGet();
    pendingTargets.add(event.getTarget());
    lastTriggers.put(event.getTarget(), event.getTimestamp());
    targetDebouncer.offer(event.getTarget(), event);
  }

  private void onTargetSettled(WatchTarget target) {
    if (!pendingTargets.remove(target)) {
      return;
    }
    try {
      switch (target) {
        case CONFIG:
          triggerConfigSync(2);
          break;
        case AGENTS:
        case TEMPLATES:
          triggerAgentSync(3);
          break;
        default:
          // tools and integrations get everything re-synced
          submit(JobRequest.of(JobType.FULL_SYNC).priority(4).metadata("auto_triggered", "true").metadata("target", target.name().toLowerCase()));
          break;
      }
      autoSyncsTriggered.incrementAndGet();
      lastAutoSync = clock.instant();
    } catch (RuntimeException e) {
      log.error("Could not trigger sync for " + target, e);
    }
  }

  private void submitStartupJobs() {
    try {
      submit(JobRequest.of(JobType.HEALTH_CHECK).priority(1).metadata("initial", "true"));
      submit(JobRequest.of(JobType.FULL_SYNC).priority(2).metadata("initial", "true"));
    } catch (RuntimeException e) {
      log.error("Could not submit startup jobs", e);
    }
  }

  private String submit(JobRequest request) {
    String id = scheduler.addJob(request);
    jobsSubmitted.incrementAndGet();
    return id;
  }

  private void attachCallback() {
    if (callbackAttached.compareAndSet(false, true)) {
      watcher.addCallback(callback);
    }
  }

  private static List<SyncJob> lastN(List<SyncJob> jobs, int n) {
    return jobs.subList(Math.max(0, jobs.size() - n), jobs.size());
  }

  /** Submits a low priority full sync every interval, waiting one interval first. */
  private class FullSyncLoop implements TaskLogic {
    private boolean first = true;

    @Override
    public Duration runOneLoop() {
      if (first) {
        first = false;
      } else if (enabled) {
        try {
          submit(JobRequest.of(JobType.FULL_SYNC).priority(PERIODIC_SYNC_PRIORITY).metadata("periodic", "true"));
        } catch (RuntimeException e) {
          log.error("Could not trigger periodic sync", e);
        }
      }
      return settings.fullSyncInterval;
    }
  }

}

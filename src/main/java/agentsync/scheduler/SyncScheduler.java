package agentsync.scheduler;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;

import agentsync.SyncSettings;
import agentsync.Utils;
import agentsync.integration.IntegrationManager;
import agentsync.tasks.TaskFactory;
import agentsync.tasks.TaskLogic;
import agentsync.tasks.TaskPool;

/**
 * Runs {@link SyncJob}s with bounded concurrency, priority order, timeouts and retries.
 *
 * Jobs wait in a priority queue (lower number first, then first come first
 * served) drained by {@code maxConcurrentJobs} worker tasks. Each attempt runs
 * on a job thread under its timeout; a failed or timed out attempt is parked in
 * a retry list for {@code retryDelay}, without holding a worker, and then
 * re-queued at its original priority. A separate task injects a low priority
 * health check every {@code healthCheckInterval}.
 *
 * Each job is only ever transitioned by the worker holding it, or by
 * {@link #cancelJob(String)}, which {@link SyncJob} arbitrates.
 *
 * Moving a job between the queue, the running set, the retry list and the
 * history all happens under {@code lock}, as does {@link #getQueueStatus()}, so
 * a status always counts every job exactly once.
 */
public class SyncScheduler {

  private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);
  static final int HEALTH_CHECK_PRIORITY = 10;
  private final TaskFactory taskFactory;
  private final IntegrationManager integrations;
  private final SyncSettings settings;
  private final Clock clock;
  private final JobHandlers handlers;
  private final AtomicLong nextNumber = new AtomicLong();
  private final AtomicLong nextSequence = new AtomicLong();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition jobQueued = lock.newCondition();
  private final Condition retryParked = lock.newCondition();
  // guarded by lock
  private final PriorityQueue<QueuedJob> queue = new PriorityQueue<>();
  private final PriorityQueue<PendingRetry> retries = new PriorityQueue<>();
  private final Map<String, SyncJob> running = new HashMap<>();
  // every job we still know about, so lookups by id work wherever the job is
  private final Map<String, SyncJob> jobsById = new ConcurrentHashMap<>();
  private final JobHistory history;
  private final AtomicLong jobsCompleted = new AtomicLong();
  private final AtomicLong jobsFailed = new AtomicLong();
  private final AtomicLong jobsRetried = new AtomicLong();
  private final AtomicLong jobsCancelled = new AtomicLong();
  private final AtomicLong totalExecutionMillis = new AtomicLong();
  private final AtomicBoolean initialized = new AtomicBoolean();
  private volatile Instant lastSuccessfulSync;
  private volatile boolean isRunning;
  private TaskPool pool;
  private ExecutorService executor;
  private volatile TimeLimiter timeLimiter;

  public SyncScheduler(TaskFactory taskFactory, IntegrationManager integrations, SyncSettings settings, Clock clock) {
    this(taskFactory, integrations, settings, clock, new JobHandlers(integrations));
  }

  public SyncScheduler(TaskFactory taskFactory, IntegrationManager integrations, SyncSettings settings, Clock clock, JobHandlers handlers) {
    this.taskFactory = taskFactory;
    this.integrations = integrations;
    this.settings = settings;
    this.clock = clock;
    this.handlers = handlers;
    this.history = new JobHistory(settings.maxCompletedHistory, settings.maxFailedHistory, j -> jobsById.remove(j.getId()));
  }

  /** Initializes the integration layer, once. @return whether it came up */
  public boolean initialize() {
    if (!initialized.compareAndSet(false, true)) {
      return true;
    }
    try {
      boolean ok = integrations.initialize();
      if (!ok) {
        log.warn("Integrations did not fully initialize");
      }
      return ok;
    } catch (Exception e) {
      initialized.set(false);
      log.error("Could not initialize integrations", e);
      return false;
    }
  }

  public synchronized void start() {
    if (isRunning) {
      return;
    }
    initialize();
    executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder().setDaemon(true).setNameFormat("agentsync-job-%s").build());
    timeLimiter = SimpleTimeLimiter.create(executor);
    pool = taskFactory.newTaskPool("scheduler");
    isRunning = true;
    for (int i = 0; i < settings.maxConcurrentJobs; i++) {
      pool.runTask(new Worker(i));
    }
    pool.runTask(new RetryPump());
    pool.runTask(new HealthCheckInjector());
    log.info("Scheduler started with {} workers", settings.maxConcurrentJobs);
  }

  /**
   * Stops every loop and waits for them to exit. Jobs mid-execution are
   * abandoned as cancelled; queued and retrying jobs stay put for a later start.
   */
  public synchronized void stop() {
    if (!isRunning) {
      return;
    }
    isRunning = false;
    pool.stopAllTasks();
    executor.shutdownNow();
    lock.lock();
    try {
      new ArrayList<>(running.values()).forEach(this::abandon);
    } finally {
      lock.unlock();
    }
    log.info("Scheduler stopped");
  }

  public boolean isRunning() {
    return isRunning;
  }

  public String addJob(JobType jobType) {
    return addJob(JobRequest.of(jobType));
  }

  public String addJob(JobType jobType, String targetAdapter, int priority) {
    return addJob(JobRequest.of(jobType).targetAdapter(targetAdapter).priority(priority));
  }

  /**
   * Queues a new job; the queue is unbounded, so this never blocks.
   *
   * @return the new job's id
   * @throws SchedulerNotRunningException if we're not started
   */
  public String addJob(JobRequest r) {
    if (!isRunning) {
      throw new SchedulerNotRunningException();
    }
    SyncJob job = new SyncJob(
      nextNumber.getAndIncrement(),
      r.jobType,
      r.targetAdapter,
      r.priority,
      r.maxRetries != null ? r.maxRetries : settings.maxRetries,
      r.retryDelay != null ? r.retryDelay : settings.retryDelay,
      r.timeout != null ? r.timeout : settings.jobTimeout,
      r.metadata,
      clock.instant());
    jobsById.put(job.getId(), job);
    enqueue(job);
    log.debug("Added {}", job);
    return job.getId();
  }

  /**
   * Cancels a queued, retrying or running job. A running job's attempt isn't
   * interrupted, but its outcome will be ignored.
   *
   * @return whether the job existed and wasn't already finished
   */
  public boolean cancelJob(String id) {
    lock.lock();
    try {
      SyncJob job = jobsById.get(id);
      if (job == null || !job.markCancelled(clock.instant())) {
        return false;
      }
      queue.removeIf(q -> q.job == job);
      retries.removeIf(r -> r.job == job);
      running.remove(id);
      jobsCancelled.incrementAndGet();
      history.addCancelled(job);
      log.info("Cancelled {}", job);
      return true;
    } finally {
      lock.unlock();
    }
  }

  public Optional<SyncJob> getJobStatus(String id) {
    return Optional.ofNullable(jobsById.get(id));
  }

  /** @return every job still tracked, in the order they were added */
  public List<SyncJob> getJobs() {
    return Seq.seq(jobsById.values()).sorted(Comparator.comparingLong(SyncJob::getNumber)).toList();
  }

  public List<SyncJob> getCompletedJobs() {
    return history.getCompleted();
  }

  public List<SyncJob> getFailedJobs() {
    return history.getFailed();
  }

  public QueueStatus getQueueStatus() {
    lock.lock();
    try {
      return new QueueStatus(
        queue.size(),
        running.size(),
        retries.size(),
        history.completedCount(),
        history.failedCount(),
        history.cancelledCount(),
        isRunning,
        getStats());
    } finally {
      lock.unlock();
    }
  }

  public SchedulerStats getStats() {
    return new SchedulerStats(
      jobsCompleted.get(),
      jobsFailed.get(),
      jobsRetried.get(),
      jobsCancelled.get(),
      Duration.ofMillis(totalExecutionMillis.get()),
      lastSuccessfulSync);
  }

  /** Trims the finished-job history, keeping the most recently finished. */
  public void cleanupOldJobs(int maxCompleted, int maxFailed) {
    lock.lock();
    try {
      history.cleanup(maxCompleted, maxFailed);
    } finally {
      lock.unlock();
    }
  }

  private void enqueue(SyncJob job) {
    lock.lock();
    try {
      queue.add(new QueuedJob(job, nextSequence.getAndIncrement()));
      jobQueued.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits up to {@code queuePollTimeout} for the most urgent job and marks it running.
   *
   * @return the job, now in {@code running}, or null if there was none
   */
  private SyncJob takeNext() throws InterruptedException {
    long nanos = settings.queuePollTimeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty()) {
        if (nanos <= 0) {
          return null;
        }
        nanos = jobQueued.awaitNanos(nanos);
      }
      SyncJob job = queue.poll().job;
      if (!job.markStarted(clock.instant())) {
        log.debug("Skipping cancelled {}", job);
        return null;
      }
      running.put(job.getId(), job);
      return job;
    } finally {
      lock.unlock();
    }
  }

  private void execute(SyncJob job) throws InterruptedException {
    try {
      JobHandler handler = handlers.get(job.getJobType());
      Map<String, Object> result = timeLimiter.callWithTimeout(() -> handler.execute(job), job.getTimeout().toMillis(), MILLISECONDS);
      onSucceeded(job, result);
    } catch (TimeoutException e) {
      onAttemptFailed(job, new JobTimeoutException(job.getTimeout()));
    } catch (ExecutionException | UncheckedExecutionException | ExecutionError e) {
      onAttemptFailed(job, e.getCause());
    } catch (InterruptedException e) {
      abandon(job);
      throw e;
    }
  }

  private void onSucceeded(SyncJob job, Map<String, Object> result) {
    Instant now = clock.instant();
    lock.lock();
    try {
      // a cancelled job was already moved to the history by cancelJob
      if (!job.markCompleted(now, result)) {
        log.debug("Ignoring result of cancelled {}", job);
        return;
      }
      running.remove(job.getId());
      history.addCompleted(job);
    } finally {
      lock.unlock();
    }
    jobsCompleted.incrementAndGet();
    job.getDuration().ifPresent(d -> totalExecutionMillis.addAndGet(d.toMillis()));
    lastSuccessfulSync = now;
    if (job.getJobType() == JobType.HEALTH_CHECK) {
      log.debug("Completed {}", job);
    } else {
      log.info("Completed {} {}", job.getJobType(), job.getTargetAdapter().orElse("(all adapters)"));
    }
  }

  private void onAttemptFailed(SyncJob job, Throwable cause) {
    String message = Objects.toString(cause.getMessage(), cause.getClass().getSimpleName());
    if (!(cause instanceof SyncJobException)) {
      log.debug("Job " + job.getId() + " failed", cause);
    }
    lock.lock();
    try {
      if (!job.markFailed(message)) {
        return;
      }
      running.remove(job.getId());
      if (job.canRetry()) {
        log.warn("{} attempt {} failed, retrying in {}: {}", job.getJobType(), job.getAttempts(), Utils.toShortString(job.getRetryDelay()), message);
        job.prepareRetry();
        jobsRetried.incrementAndGet();
        retries.add(new PendingRetry(job, clock.instant().plus(job.getRetryDelay())));
        retryParked.signal();
      } else {
        job.markFinallyFailed(clock.instant());
        jobsFailed.incrementAndGet();
        history.addFailed(job);
        log.error("{} failed after {} attempts: {}", job.getJobType(), job.getAttempts(), message);
      }
    } finally {
      lock.unlock();
    }
  }

  private void abandon(SyncJob job) {
    lock.lock();
    try {
      if (job.markCancelled(clock.instant())) {
        running.remove(job.getId());
        jobsCancelled.incrementAndGet();
        history.addCancelled(job);
        log.info("Abandoned running {}", job);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Pops the most urgent job and runs it. */
  private class Worker implements TaskLogic {
    private final int index;

    private Worker(int index) {
      this.index = index;
    }

    @Override
    public Duration runOneLoop() throws InterruptedException {
      try {
        SyncJob next = takeNext();
        if (next != null) {
          execute(next);
        }
        return null;
      } catch (RuntimeException e) {
        log.error("Unexpected error in " + getName(), e);
        return settings.workerErrorBackoff;
      }
    }

    @Override
    public String getName() {
      return "SyncWorker-" + index;
    }
  }

  /** Moves jobs whose retry delay has passed back into the queue. */
  private class RetryPump implements TaskLogic {
    @Override
    public Duration runOneLoop() throws InterruptedException {
      long nanos = settings.queuePollTimeout.toNanos();
      lock.lockInterruptibly();
      try {
        while (true) {
          PendingRetry r = retries.peek();
          long untilReady = r == null ? Long.MAX_VALUE : Duration.between(clock.instant(), r.readyAt).toNanos();
          if (untilReady <= 0) {
            retries.poll();
            if (r.job.getStatus() == JobStatus.RETRYING) {
              log.debug("Re-queueing {}", r.job);
              enqueue(r.job);
            }
          } else if (nanos <= 0) {
            return null;
          } else {
            long wait = Math.min(nanos, untilReady);
            nanos -= wait - Math.max(0, retryParked.awaitNanos(wait));
          }
        }
      } finally {
        lock.unlock();
      }
    }
  }

  private class HealthCheckInjector implements TaskLogic {
    @Override
    public Duration runOneLoop() {
      try {
        addJob(JobRequest.of(JobType.HEALTH_CHECK).priority(HEALTH_CHECK_PRIORITY).maxRetries(1));
      } catch (RuntimeException e) {
        log.error("Could not add health check", e);
      }
      return settings.healthCheckInterval;
    }
  }

  private static class QueuedJob implements Comparable<QueuedJob> {
    private final SyncJob job;
    private final long sequence;

    private QueuedJob(SyncJob job, long sequence) {
      this.job = job;
      this.sequence = sequence;
    }

    @Override
    public int compareTo(QueuedJob o) {
      int c = Integer.compare(job.getPriority(), o.job.getPriority());
      return c != 0 ? c : Long.compare(sequence, o.sequence);
    }
  }

  private static class PendingRetry implements Comparable<PendingRetry> {
    private final SyncJob job;
    private final Instant readyAt;

    private PendingRetry(SyncJob job, Instant readyAt) {
      this.job = job;
      this.readyAt = readyAt;
    }

    @Override
    public int compareTo(PendingRetry o) {
      return readyAt.compareTo(o.readyAt);
    }
  }

}

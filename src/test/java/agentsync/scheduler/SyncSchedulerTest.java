package agentsync.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.jooq.lambda.Seq;
import org.junit.After;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

import agentsync.LoggingConfig;
import agentsync.MutableClock;
import agentsync.SyncSettings;
import agentsync.integration.FakeIntegrationManager;
import agentsync.tasks.StubTaskFactory;
import agentsync.tasks.ThreadBasedTaskFactory;

public class SyncSchedulerTest {

  static {
    LoggingConfig.init();
  }

  private final StubTaskFactory factory = new StubTaskFactory();
  private final MutableClock clock = new MutableClock();
  private final FakeIntegrationManager integrations = new FakeIntegrationManager();
  private final List<String> ran = new CopyOnWriteArrayList<>();
  private final SyncSettings settings = SyncSettings
    .builder()
    .maxConcurrentJobs(1)
    .maxRetries(0)
    .retryDelay(Duration.ofSeconds(30))
    .healthCheckInterval(Duration.ofMinutes(1))
    .queuePollTimeout(Duration.ZERO)
    .build();
  private SyncScheduler scheduler;

  @After
  public void after() {
    if (scheduler != null) {
      scheduler.stop();
    }
  }

  @Test
  public void shouldRunJobsInPriorityOrder() {
    start(recording());
    String p5a = scheduler.addJob(JobType.FULL_SYNC, null, 5);
    String p1 = scheduler.addJob(JobType.FULL_SYNC, null, 1);
    String p3 = scheduler.addJob(JobType.FULL_SYNC, null, 3);
    String p5b = scheduler.addJob(JobType.FULL_SYNC, null, 5);
    factory.tick(4);
    assertThat(ran, contains(p1, p3, p5a, p5b));
    assertThat(scheduler.getJobStatus(p5b).get().getStatus(), is(JobStatus.COMPLETED));
  }

  @Test
  public void shouldRecordSuccesses() {
    start(recording());
    clock.advance(Duration.ofSeconds(5));
    String id = scheduler.addJob(JobType.FULL_SYNC);
    factory.tick();
    SyncJob job = scheduler.getJobStatus(id).get();
    assertThat(job.getStatus(), is(JobStatus.COMPLETED));
    assertThat(job.getAttempts(), is(1));
    assertThat(job.getResult().isPresent(), is(true));
    assertThat(scheduler.getCompletedJobs(), contains(job));
    assertThat(scheduler.getStats().getJobsCompleted(), is(1L));
    assertThat(scheduler.getStats().getLastSuccessfulSync(), is(Optional.of(clock.instant())));
  }

  @Test
  public void shouldRetryFailedJobsAfterTheDelay() {
    start(failing());
    String id = scheduler.addJob(JobRequest.of(JobType.FULL_SYNC).maxRetries(1).retryDelay(Duration.ofSeconds(30)));
    factory.tick(3);
    SyncJob job = scheduler.getJobStatus(id).get();
    assertThat(job.getStatus(), is(JobStatus.RETRYING));
    assertThat(job.getAttempts(), is(1));
    assertThat(scheduler.getQueueStatus().getRetrying(), is(1));
    assertThat(scheduler.getStats().getJobsRetried(), is(1L));

    clock.advance(Duration.ofSeconds(30));
    factory.tick(5);
    assertThat(job.getStatus(), is(JobStatus.FAILED));
    assertThat(job.isFinished(), is(true));
    assertThat(job.getAttempts(), is(2));
    assertThat(job.getRetryCount(), is(1));
    assertThat(job.getErrorMessage(), is(Optional.of("sync failed")));
    assertThat(scheduler.getFailedJobs(), contains(job));
    assertThat(scheduler.getCompletedJobs(), is(empty()));
    assertThat(scheduler.getStats().getJobsFailed(), is(1L));
    assertThat(scheduler.getQueueStatus().getRetrying(), is(0));
  }

  @Test
  public void shouldFailWithoutRetriesWhenNoneAreAllowed() {
    start(failing());
    String id = scheduler.addJob(JobType.FULL_SYNC);
    factory.tick();
    SyncJob job = scheduler.getJobStatus(id).get();
    assertThat(job.getStatus(), is(JobStatus.FAILED));
    assertThat(job.getAttempts(), is(1));
    assertThat(scheduler.getStats().getJobsRetried(), is(0L));
  }

  @Test
  public void shouldTimeOutSlowJobs() {
    JobHandlers slow = new JobHandlers(integrations).override(JobType.FULL_SYNC, job -> {
      Thread.sleep(10_000);
      return ImmutableMap.of();
    });
    start(slow);
    String id = scheduler.addJob(JobRequest.of(JobType.FULL_SYNC).timeout(Duration.ofMillis(100)));
    factory.tick();
    SyncJob job = scheduler.getJobStatus(id).get();
    assertThat(job.getStatus(), is(JobStatus.FAILED));
    assertThat(job.getErrorMessage(), is(Optional.of("Job timed out after 100ms")));
  }

  @Test
  public void shouldCancelQueuedJobs() {
    start(recording());
    String id = scheduler.addJob(JobType.FULL_SYNC);
    assertThat(scheduler.cancelJob(id), is(true));
    factory.tick();
    assertThat(ran, is(empty()));
    assertThat(scheduler.getJobStatus(id).get().getStatus(), is(JobStatus.CANCELLED));
    assertThat(scheduler.cancelJob(id), is(false));
    assertThat(scheduler.cancelJob("unknown"), is(false));
    assertThat(scheduler.getQueueStatus().getCancelled(), is(1));
    assertThat(scheduler.getStats().getJobsCancelled(), is(1L));
  }

  @Test
  public void shouldCancelRetryingJobs() {
    start(failing());
    String id = scheduler.addJob(JobRequest.of(JobType.FULL_SYNC).maxRetries(3));
    factory.tick();
    assertThat(scheduler.cancelJob(id), is(true));
    clock.advance(Duration.ofMinutes(1));
    factory.tick(3);
    SyncJob job = scheduler.getJobStatus(id).get();
    assertThat(job.getStatus(), is(JobStatus.CANCELLED));
    assertThat(job.getAttempts(), is(1));
    assertThat(scheduler.getQueueStatus().getRetrying(), is(0));
  }

  @Test
  public void shouldIgnoreTheOutcomeOfACancelledRunningJob() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    start(new JobHandlers(integrations).override(JobType.FULL_SYNC, job -> {
      started.countDown();
      release.await();
      return ImmutableMap.of();
    }));
    String id = scheduler.addJob(JobType.FULL_SYNC);
    Thread worker = new Thread(factory::tick);
    worker.start();
    assertThat(started.await(5, TimeUnit.SECONDS), is(true));
    assertThat(scheduler.getQueueStatus().getRunning(), is(1));
    assertThat(scheduler.cancelJob(id), is(true));
    release.countDown();
    worker.join(5000);
    assertThat(scheduler.getJobStatus(id).get().getStatus(), is(JobStatus.CANCELLED));
    assertThat(scheduler.getStats().getJobsCompleted(), is(0L));
    assertThat(scheduler.getCompletedJobs(), is(empty()));
    assertThat(scheduler.getQueueStatus().getRunning(), is(0));
  }

  @Test
  public void shouldInjectHealthChecksPeriodically() {
    start(recording());
    factory.advance(Duration.ofSeconds(125));
    // at 0s, 60s and 120s
    List<SyncJob> checks = Seq.seq(scheduler.getJobs()).filter(j -> j.getJobType() == JobType.HEALTH_CHECK).toList();
    assertThat(checks.size(), is(3));
    assertThat(checks.get(0).getPriority(), is(SyncScheduler.HEALTH_CHECK_PRIORITY));
    assertThat(checks.get(0).getMaxRetries(), is(1));
  }

  @Test
  public void shouldRunHealthChecksAfterMoreUrgentJobs() {
    start(recording());
    factory.advance(Duration.ZERO);
    String sync = scheduler.addJob(JobType.FULL_SYNC, null, 9);
    factory.tick();
    assertThat(ran, contains(sync));
    factory.tick();
    assertThat(integrations.healthCalls.size(), is(1));
  }

  @Test(expected = SchedulerNotRunningException.class)
  public void shouldRejectJobsBeforeStart() {
    scheduler = new SyncScheduler(factory, integrations, settings, clock);
    scheduler.addJob(JobType.FULL_SYNC);
  }

  @Test
  public void shouldRejectJobsAfterStop() {
    start(recording());
    scheduler.stop();
    assertThat(scheduler.isRunning(), is(false));
    assertThat(scheduler.getQueueStatus().isRunning(), is(false));
    try {
      scheduler.addJob(JobType.FULL_SYNC);
      throw new AssertionError("expected a failure");
    } catch (SchedulerNotRunningException e) {
      assertThat(e.getMessage(), is("Scheduler is not running"));
    }
  }

  @Test
  public void shouldKeepQueuedJobsAcrossARestart() {
    start(recording());
    String id = scheduler.addJob(JobType.FULL_SYNC);
    scheduler.stop();
    assertThat(scheduler.getQueueStatus().getQueueSize(), is(1));
    scheduler.start();
    factory.tick();
    assertThat(ran, contains(id));
  }

  @Test
  public void shouldAccountForEveryJob() {
    start(new JobHandlers(integrations).override(JobType.CONFIG_SYNC, job -> {
      throw new JobExecutionException("config failed");
    }));
    scheduler.addJob(JobType.FULL_SYNC);
    scheduler.addJob(JobRequest.of(JobType.CONFIG_SYNC).maxRetries(1));
    scheduler.addJob(JobType.AGENT_SYNC);
    String cancelled = scheduler.addJob(JobType.INCREMENTAL_SYNC);
    assertConserved();
    scheduler.cancelJob(cancelled);
    assertConserved();
    for (int i = 0; i < 6; i++) {
      factory.tick();
      assertConserved();
      clock.advance(Duration.ofSeconds(30));
    }
    assertThat(scheduler.getQueueStatus().getFailed(), is(1));
    assertThat(scheduler.getQueueStatus().getCancelled(), is(1));
  }

  @Test
  public void shouldAccountForEveryJobWhileWorkersRun() throws Exception {
    SyncSettings threaded = settings
      .toBuilder()
      .maxConcurrentJobs(3)
      .healthCheckInterval(Duration.ofDays(1))
      .queuePollTimeout(Duration.ofMillis(10))
      .maxCompletedHistory(10_000)
      .maxFailedHistory(10_000)
      .build();
    JobHandlers handlers = new JobHandlers(integrations).override(JobType.CONFIG_SYNC, job -> {
      throw new JobExecutionException("config failed");
    });
    scheduler = new SyncScheduler(new ThreadBasedTaskFactory(), integrations, threaded, Clock.systemUTC(), handlers);
    scheduler.start();
    // the injector adds its first health check as soon as it starts
    long deadline = System.currentTimeMillis() + 10_000;
    while (scheduler.getJobs().isEmpty()) {
      assertThat(System.currentTimeMillis() < deadline, is(true));
      Thread.sleep(10);
    }

    int added = 1;
    for (int i = 0; i < 3000; i++) {
      if (i % 10 == 0) {
        scheduler.addJob(JobRequest.of(JobType.CONFIG_SYNC).maxRetries(1).retryDelay(Duration.ofMillis(1)));
      } else {
        scheduler.addJob(JobType.FULL_SYNC);
      }
      added++;
      assertTotal(added);
    }
    deadline = System.currentTimeMillis() + 30_000;
    while (finished() < added) {
      assertTotal(added);
      assertThat(System.currentTimeMillis() < deadline, is(true));
    }
    QueueStatus s = scheduler.getQueueStatus();
    assertThat(s.getFailed(), is(300));
    assertThat(s.getCompleted(), is(added - 300));
  }

  @Test
  public void shouldForgetJobsEvictedFromTheHistory() {
    scheduler = new SyncScheduler(factory, integrations, settings.toBuilder().maxCompletedHistory(2).build(), clock);
    scheduler.start();
    String first = scheduler.addJob(JobType.FULL_SYNC);
    for (int i = 0; i < 4; i++) {
      scheduler.addJob(JobType.FULL_SYNC);
    }
    factory.tick(5);
    assertThat(scheduler.getCompletedJobs().size(), is(2));
    assertThat(scheduler.getJobStatus(first), is(Optional.empty()));
  }

  @Test
  public void shouldCleanupAllButTheNewestJobs() {
    start(recording());
    scheduler.addJob(JobType.FULL_SYNC);
    scheduler.addJob(JobType.FULL_SYNC);
    String last = scheduler.addJob(JobType.FULL_SYNC);
    for (int i = 0; i < 3; i++) {
      clock.advance(Duration.ofSeconds(1));
      factory.tick();
    }
    assertThat(scheduler.getCompletedJobs().size(), is(3));
    scheduler.cleanupOldJobs(1, 0);
    assertThat(Seq.seq(scheduler.getCompletedJobs()).map(SyncJob::getId).toList(), contains(last));
    assertThat(scheduler.getJobs().size(), is(1 + scheduler.getQueueStatus().getQueueSize()));
  }

  @Test
  public void shouldInitializeTheIntegrationsOnce() {
    integrations.initializeResult = false;
    scheduler = new SyncScheduler(factory, integrations, settings, clock);
    assertThat(scheduler.initialize(), is(false));
    scheduler.start();
    assertThat(integrations.initializeCalls, is(1));
    assertThat(scheduler.isRunning(), is(true));
  }

  private void start(JobHandlers handlers) {
    scheduler = new SyncScheduler(factory, integrations, settings, clock, handlers);
    scheduler.start();
  }

  private JobHandlers recording() {
    return new JobHandlers(integrations).override(JobType.FULL_SYNC, job -> {
      ran.add(job.getId());
      return ImmutableMap.of();
    });
  }

  private JobHandlers failing() {
    return new JobHandlers(integrations).override(JobType.FULL_SYNC, job -> {
      ran.add(job.getId());
      throw new JobExecutionException("sync failed");
    });
  }

  private void assertTotal(int added) {
    QueueStatus s = scheduler.getQueueStatus();
    int total = s.getQueueSize() + s.getRunning() + s.getRetrying() + s.getCompleted() + s.getFailed() + s.getCancelled();
    assertThat(s.toString(), total, is(added));
  }

  private int finished() {
    QueueStatus s = scheduler.getQueueStatus();
    return s.getCompleted() + s.getFailed() + s.getCancelled();
  }

  private void assertConserved() {
    QueueStatus s = scheduler.getQueueStatus();
    int total = s.getQueueSize() + s.getRunning() + s.getRetrying() + s.getCompleted() + s.getFailed() + s.getCancelled();
    assertThat(s.toString(), total, is(scheduler.getJobs().size()));
  }

}

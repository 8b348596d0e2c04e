package agentsync;

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;
import java.util.jar.Manifest;

import org.apache.commons.lang3.StringUtils;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.rvesse.airline.annotations.Cli;
import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.help.Help;
import com.google.common.collect.ImmutableList;

import agentsync.Main.SyncCommand;
import agentsync.Main.VersionCommand;
import agentsync.Main.WatchCommand;
import agentsync.coordinator.AutoSyncCoordinator;
import agentsync.integration.IntegrationManager;
import agentsync.scheduler.JobRequest;
import agentsync.scheduler.JobType;
import agentsync.scheduler.SyncJob;
import agentsync.scheduler.SyncScheduler;
import agentsync.tasks.TaskFactory;
import agentsync.tasks.ThreadBasedTaskFactory;
import agentsync.watch.DefaultFileWatcher;
import agentsync.watch.ObserverFactory;
import agentsync.watch.ToolPathProvider;

@Cli(name = "agentsync", description = "keeps external tools in sync with locally edited agent configs", commands = {
  WatchCommand.class,
  SyncCommand.class,
  VersionCommand.class }, defaultCommand = Help.class)
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  static {
    LoggingConfig.init();
  }

  public static void main(String[] args) throws Exception {
    com.github.rvesse.airline.Cli<Runnable> cli = new com.github.rvesse.airline.Cli<>(Main.class);
    cli.parse(args).run();
  }

  @Command(name = "version")
  public static class VersionCommand implements Runnable {
    @Override
    public void run() {
      System.out.println("Current Version: " + getVersion());
    }
  }

  public static abstract class BaseCommand implements Runnable {
    @Option(name = { "-r", "--root" }, description = "the managed directory holding agents/, config/ and templates/, default: ~/.agentsync")
    public String managedRoot;

    @Option(name = { "-j", "--max-jobs" }, description = "how many sync jobs may run at once, default: 3")
    public Integer maxConcurrentJobs;

    @Option(name = "--job-timeout", description = "seconds before a sync job attempt is abandoned, default: 300")
    public Integer jobTimeoutSeconds;

    @Option(name = "--max-retries", description = "how many times a failed job is retried, default: 3")
    public Integer maxRetries;

    @Option(name = "--enable-log-file", description = "enables logging debug statements to agentsync.log")
    public boolean enableLogFile;

    @Option(name = "--trace", description = "log everything, including each file system event")
    public boolean trace;

    @Override
    public final void run() {
      if (trace) {
        LoggingConfig.initWithTracing();
      }
      if (enableLogFile) {
        LoggingConfig.enableLogFile();
      }
      SyncSettings.Builder b = SyncSettings.builder();
      if (managedRoot != null) {
        b.managedRoot(Paths.get(managedRoot).toAbsolutePath());
      }
      if (maxConcurrentJobs != null) {
        b.maxConcurrentJobs(maxConcurrentJobs);
      }
      if (jobTimeoutSeconds != null) {
        b.jobTimeout(Duration.ofSeconds(jobTimeoutSeconds));
      }
      if (maxRetries != null) {
        b.maxRetries(maxRetries);
      }
      customize(b);
      SyncSettings settings = b.build();
      log.debug("Settings {}", settings);
      run(settings, new ThreadBasedTaskFactory(), loadIntegrations());
    }

    protected void customize(SyncSettings.Builder b) {
    }

    protected abstract void run(SyncSettings settings, TaskFactory taskFactory, IntegrationManager integrations);
  }

  @Command(name = "watch", description = "watches for changes and syncs them in the background until interrupted")
  public static class WatchCommand extends BaseCommand {
    @Option(name = { "-p", "--path" }, description = "an extra file or directory to watch, in addition to the defaults")
    public List<String> extraPaths = new ArrayList<>();

    @Option(name = "--watch-debounce-ms", description = "quiet period per changed file, default: 1000")
    public Integer watchDebounceMillis;

    @Option(name = "--sync-debounce-ms", description = "window per kind of change before a sync is submitted, default: 2000")
    public Integer syncDebounceMillis;

    @Option(name = "--full-sync-interval", description = "seconds between full syncs, default: 300")
    public Integer fullSyncIntervalSeconds;

    @Option(name = "--health-check-interval", description = "seconds between health checks, default: 60")
    public Integer healthCheckIntervalSeconds;

    @Option(name = "--poll", description = "poll for changes instead of using native file notifications")
    public boolean usePolling;

    @Override
    protected void customize(SyncSettings.Builder b) {
      if (watchDebounceMillis != null) {
        b.watchDebounce(Duration.ofMillis(watchDebounceMillis));
      }
      if (syncDebounceMillis != null) {
        b.syncDebounce(Duration.ofMillis(syncDebounceMillis));
      }
      if (fullSyncIntervalSeconds != null) {
        b.fullSyncInterval(Duration.ofSeconds(fullSyncIntervalSeconds));
      }
      if (healthCheckIntervalSeconds != null) {
        b.healthCheckInterval(Duration.ofSeconds(healthCheckIntervalSeconds));
      }
      b.usePolling(usePolling);
    }

    @Override
    protected void run(SyncSettings settings, TaskFactory taskFactory, IntegrationManager integrations) {
      Clock clock = Clock.systemUTC();
      DefaultFileWatcher watcher = new DefaultFileWatcher(
        taskFactory,
        ObserverFactory.newFactory(settings),
        settings,
        clock,
        ImmutableList.of(ToolPathProvider.fromAdapters(integrations)));
      SyncScheduler scheduler = new SyncScheduler(taskFactory, integrations, settings, clock);
      AutoSyncCoordinator coordinator = new AutoSyncCoordinator(taskFactory, watcher, scheduler, settings, clock);

      List<Path> paths = new ArrayList<>(watcher.getDefaultWatchPaths());
      extraPaths.forEach(p -> paths.add(Paths.get(p).toAbsolutePath()));
      if (paths.isEmpty()) {
        log.warn("Nothing to watch under {}, only periodic syncs will run", settings.managedRoot);
      }

      CountDownLatch done = new CountDownLatch(1);
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        coordinator.stop();
        done.countDown();
      }, "agentsync-shutdown"));
      coordinator.start(paths);
      log.info("Version {}, hit ctrl-c to stop", getVersion());
      Utils.resetIfInterrupted(() -> done.await());
    }
  }

  @Command(name = "sync", description = "runs a single sync job and waits for it to finish")
  public static class SyncCommand extends BaseCommand {
    @Option(name = { "-t", "--type" }, description = "full_sync, incremental_sync, config_sync, agent_sync or health_check, default: full_sync")
    public String type = "full_sync";

    @Option(name = { "-a", "--adapter" }, description = "the one adapter to sync, default: all")
    public String adapter;

    @Override
    protected void run(SyncSettings settings, TaskFactory taskFactory, IntegrationManager integrations) {
      JobType jobType = JobType.valueOf(type.toUpperCase());
      // no periodic health checks for a one-off run
      SyncSettings oneOff = settings.toBuilder().healthCheckInterval(Duration.ofDays(365)).build();
      SyncScheduler scheduler = new SyncScheduler(taskFactory, integrations, oneOff, Clock.systemUTC());
      scheduler.start();
      try {
        String id = scheduler.addJob(JobRequest.of(jobType).targetAdapter(adapter).priority(1));
        SyncJob job = awaitFinished(scheduler, id);
        System.out.println(job.getJobType() + " " + job.getStatus() + job.getErrorMessage().map(e -> ": " + e).orElse(""));
        job.getResult().ifPresent(r -> print(r));
      } finally {
        scheduler.stop();
      }
    }

    private static SyncJob awaitFinished(SyncScheduler scheduler, String id) {
      while (true) {
        SyncJob job = scheduler.getJobStatus(id).orElseThrow(() -> new IllegalStateException("Lost job " + id));
        if (job.isFinished()) {
          return job;
        }
        Utils.resetIfInterrupted(() -> Thread.sleep(100));
      }
    }

    private static void print(Map<String, Object> result) {
      Seq.seq(result).forEach(t -> System.out.println("  " + t.v1 + ": " + t.v2));
    }
  }

  /** @return the first integration layer registered via {@link ServiceLoader}, or a no-op one */
  static IntegrationManager loadIntegrations() {
    Iterator<IntegrationManager> it = ServiceLoader.load(IntegrationManager.class).iterator();
    if (it.hasNext()) {
      IntegrationManager m = it.next();
      log.info("Using integrations {}", m.getClass().getName());
      return m;
    }
    log.warn("No integrations registered, syncs will do nothing");
    return new IntegrationManager.Noop();
  }

  public static String getVersion() {
    String version = null;
    URL url = Main.class.getResource("/META-INF/MANIFEST.MF");
    try {
      try (InputStream in = url.openStream()) {
        Manifest m = new Manifest(in);
        version = m.getMainAttributes().getValue("Agentsync-Version");
      }
    } catch (Exception e) {
      log.error("Error loading manifest", e);
    }
    return StringUtils.defaultIfEmpty(version, "unspecified");
  }

}

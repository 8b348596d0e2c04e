package agentsync.scheduler;

import static com.google.common.base.Preconditions.checkState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import agentsync.integration.Adapter;
import agentsync.integration.IntegrationManager;
import agentsync.integration.SyncResult;
import agentsync.integration.ValidationResult;

/**
 * The {@link JobType} to {@link JobHandler} dispatch table.
 *
 * Every job type must have a handler; this is checked on construction.
 */
public class JobHandlers {

  private static final Logger log = LoggerFactory.getLogger(JobHandlers.class);
  private final IntegrationManager integrations;
  private final Map<JobType, JobHandler> handlers;

  public JobHandlers(IntegrationManager integrations) {
    this.integrations = integrations;
    Map<JobType, JobHandler> m = new EnumMap<>(JobType.class);
    m.put(JobType.FULL_SYNC, this::syncAgents);
    // incremental and agent syncs don't track what changed yet, so they sync everything too
    m.put(JobType.INCREMENTAL_SYNC, this::syncAgents);
    m.put(JobType.AGENT_SYNC, this::syncAgents);
    m.put(JobType.CONFIG_SYNC, this::syncConfigs);
    m.put(JobType.HEALTH_CHECK, this::healthCheck);
    m.put(JobType.CONFLICT_RESOLUTION, job -> {
      throw new JobExecutionException("Conflict resolution is not supported by the integration layer");
    });
    this.handlers = checkComplete(m);
  }

  private JobHandlers(IntegrationManager integrations, Map<JobType, JobHandler> handlers) {
    this.integrations = integrations;
    this.handlers = checkComplete(handlers);
  }

  public JobHandler get(JobType type) {
    return handlers.get(type);
  }

  /** @return a copy of this table with {@code type} dispatched to {@code handler} */
  public JobHandlers override(JobType type, JobHandler handler) {
    Map<JobType, JobHandler> m = new EnumMap<>(handlers);
    m.put(type, handler);
    return new JobHandlers(integrations, m);
  }

  private Map<String, Object> syncAgents(SyncJob job) throws Exception {
    Map<String, SyncResult> results = integrations.syncAgents(ImmutableList.of(), adapterNames(job));
    return new LinkedHashMap<>(results);
  }

  private Map<String, Object> syncConfigs(SyncJob job) throws Exception {
    Map<String, ValidationResult> validation = integrations.validateConfigurations(ImmutableList.of());
    Map<String, SyncResult> synced = new LinkedHashMap<>();
    for (Map.Entry<String, ValidationResult> e : validation.entrySet()) {
      if (e.getValue().needsSync()) {
        Adapter adapter = integrations.getAdapter(e.getKey()).orElse(null);
        if (adapter == null) {
          log.debug("Adapter {} needs a sync but is gone", e.getKey());
          continue;
        }
        synced.put(e.getKey(), adapter.syncAgents(ImmutableList.of()));
      }
    }
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("validation", validation);
    result.put("sync", synced);
    return result;
  }

  private Map<String, Object> healthCheck(SyncJob job) throws Exception {
    return new LinkedHashMap<>(integrations.healthCheck(adapterNames(job)));
  }

  private List<String> adapterNames(SyncJob job) {
    if (!job.getTargetAdapter().isPresent()) {
      return ImmutableList.of();
    }
    String name = job.getTargetAdapter().get();
    if (!integrations.getAdapter(name).isPresent()) {
      throw new JobExecutionException("Adapter not found: " + name);
    }
    return ImmutableList.of(name);
  }

  private static Map<JobType, JobHandler> checkComplete(Map<JobType, JobHandler> handlers) {
    for (JobType type : JobType.values()) {
      checkState(handlers.get(type) != null, "No handler for %s", type);
    }
    return Collections.unmodifiableMap(handlers);
  }

}

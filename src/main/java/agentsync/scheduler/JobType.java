package agentsync.scheduler;

/** What a job does; see {@link JobHandlers} for the handler of each. */
public enum JobType {
  FULL_SYNC, INCREMENTAL_SYNC, CONFIG_SYNC, AGENT_SYNC, CONFLICT_RESOLUTION, HEALTH_CHECK;
}

package agentsync.scheduler;

public enum JobStatus {
  PENDING, RUNNING, COMPLETED, FAILED, RETRYING, CANCELLED;
}

package agentsync.scheduler;

/** Jobs can only be added between {@link SyncScheduler#start()} and {@link SyncScheduler#stop()}. */
public class SchedulerNotRunningException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public SchedulerNotRunningException() {
    super("Scheduler is not running");
  }

}

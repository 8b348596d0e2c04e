package agentsync.tasks;

/** Returned when a task is started, so the caller can stop just that task. */
@FunctionalInterface
public interface TaskHandle {

  void stop();

}

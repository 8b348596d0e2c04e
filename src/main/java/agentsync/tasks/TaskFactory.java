package agentsync.tasks;

/**
 * Starts and stops {@link TaskLogic} loops.
 *
 * The production implementation gives each loop its own thread, so a loop
 * can block on a queue or a watch service without starving anything else;
 * tests use {@link StubTaskFactory} to drive the same loops on the test thread.
 */
public interface TaskFactory {

  default TaskHandle runTask(TaskLogic logic) {
    return runTask(logic, null);
  }

  TaskHandle runTask(TaskLogic logic, Runnable onFailure);

  /** Stops the task and blocks until its loop has exited. */
  void stopTask(TaskLogic logic);

  default TaskPool newTaskPool(String name) {
    return new TaskPool(this, name);
  }

}

package agentsync.tasks;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each task on a dedicated thread, actor style.
 */
public class ThreadBasedTaskFactory implements TaskFactory {

  private final ConcurrentHashMap<TaskLogic, ThreadBasedTask> tasks = new ConcurrentHashMap<>();

  @Override
  public TaskHandle runTask(TaskLogic logic, Runnable onFailure) {
    ThreadBasedTask task = new ThreadBasedTask(logic, onFailure, () -> {
      // the task is already exiting, we only need to forget it
      tasks.remove(logic);
    });
    if (tasks.putIfAbsent(logic, task) != null) {
      throw new IllegalStateException("Task already running: " + logic.getName());
    }
    task.start();
    return () -> stopTask(logic);
  }

  // Not synchronized: while we block on one task stopping, that task may
  // ask us, from its own thread, to stop one of its children.
  @Override
  public void stopTask(TaskLogic logic) {
    ThreadBasedTask task = tasks.remove(logic);
    if (task != null) {
      task.stop();
    }
  }

  public int getRunningTaskCount() {
    return tasks.size();
  }

}

package agentsync.tasks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

/**
 * A group of tasks that live and die together, e.g. all of the workers of one
 * scheduler run. If a task fails with an escaped exception, the whole pool is
 * stopped.
 *
 * A pool is single-use: once stopped, create a new one.
 */
public class TaskPool {

  private static final Logger log = LoggerFactory.getLogger(TaskPool.class);
  private final TaskFactory factory;
  private final String name;
  private final List<TaskLogic> tasks = new CopyOnWriteArrayList<>();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  public TaskPool(TaskFactory factory, String name) {
    this.factory = factory;
    this.name = name;
  }

  public TaskHandle runTask(TaskLogic logic) {
    if (shutdown.get()) {
      throw new IllegalStateException("Pool " + name + " is shutdown");
    }
    tasks.add(logic);
    factory.runTask(logic, this::onTaskFailure);
    return () -> stopTask(logic);
  }

  public void stopTask(TaskLogic logic) {
    factory.stopTask(logic);
    tasks.remove(logic);
  }

  /** Stops every task, newest first, and blocks until they have exited. */
  public void stopAllTasks() {
    if (shutdown.compareAndSet(false, true)) {
      stopEverything();
    }
  }

  public void addShutdownCallback(Runnable callback) {
    callbacks.add(callback);
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  public int size() {
    return tasks.size();
  }

  private void onTaskFailure() {
    // we're on the failed task's thread, so stop everyone from a fresh task
    if (shutdown.compareAndSet(false, true)) {
      log.error("A task in pool {} failed, stopping the pool", name);
      factory.runTask(new StopTasksInPool());
    }
  }

  private void stopEverything() {
    Lists.reverse(new ArrayList<>(tasks)).forEach(t -> {
      try {
        stopTask(t);
      } catch (Exception e) {
        log.error("Error stopping " + t.getName(), e);
      }
    });
    callbacks.forEach(r -> {
      try {
        r.run();
      } catch (Exception e) {
        log.error("Error calling callback", e);
      }
    });
    log.debug("Pool {} stopped", name);
  }

  private class StopTasksInPool implements TaskLogic {
    @Override
    public Duration runOneLoop() {
      stopEverything();
      return Duration.ofMillis(-1);
    }
  }

}

package agentsync.tasks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import agentsync.Utils;

/**
 * Runs tasks on the caller's thread, for deterministic tests.
 *
 * {@link #tick()} runs every task's loop once; {@link #advance(Duration)} moves a
 * simulated clock forward and runs each task whenever its returned sleep has
 * elapsed. Tasks that return {@code null} (queue-driven loops) are only run
 * again by {@link #tick()}.
 */
public class StubTaskFactory implements TaskFactory {

  private static final int maxRunsPerAdvance = 100_000;
  private final Map<TaskLogic, StubTask> tasks = Collections.synchronizedMap(new LinkedHashMap<>());
  private Duration now = Duration.ZERO;

  @Override
  public TaskHandle runTask(TaskLogic logic, Runnable onFailure) {
    StubTask task = new StubTask(logic, onFailure, now);
    Utils.resetIfInterrupted(() -> task.start());
    tasks.put(logic, task);
    return () -> stopTask(logic);
  }

  @Override
  public void stopTask(TaskLogic logic) {
    StubTask task = tasks.remove(logic);
    if (task != null) {
      Utils.resetIfInterrupted(() -> task.stop());
    }
  }

  public void tick() {
    for (StubTask t : snapshot()) {
      if (!t.finished && tasks.containsKey(t.logic)) {
        Utils.resetIfInterrupted(() -> t.tick(now));
      }
    }
  }

  public void tick(int times) {
    for (int i = 0; i < times; i++) {
      tick();
    }
  }

  public void advance(Duration duration) {
    Preconditions.checkArgument(!duration.isNegative(), "Cannot go back in time");
    Duration target = now.plus(duration);
    for (int runs = 0;; runs++) {
      Preconditions.checkState(runs < maxRunsPerAdvance, "Tasks never went to sleep");
      StubTask next = nextDue(target);
      if (next == null) {
        break;
      }
      if (next.nextRunAt.compareTo(now) > 0) {
        now = next.nextRunAt;
      }
      Utils.resetIfInterrupted(() -> next.tick(now));
    }
    now = target;
  }

  public Duration getElapsed() {
    return now;
  }

  public boolean isRunning(TaskLogic logic) {
    return tasks.containsKey(logic);
  }

  public int getTaskCount() {
    return tasks.size();
  }

  public Duration getLastDuration(TaskLogic logic) {
    return tasks.get(logic).lastDuration;
  }

  private StubTask nextDue(Duration target) {
    StubTask next = null;
    for (StubTask t : snapshot()) {
      if (t.finished || t.nextRunAt == null || t.nextRunAt.compareTo(target) > 0 || !tasks.containsKey(t.logic)) {
        continue;
      }
      if (next == null || t.nextRunAt.compareTo(next.nextRunAt) < 0) {
        next = t;
      }
    }
    return next;
  }

  private List<StubTask> snapshot() {
    synchronized (tasks) {
      return new ArrayList<>(tasks.values());
    }
  }
}

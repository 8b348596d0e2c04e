package agentsync.tasks;

import java.time.Duration;

class StubTask {

  final TaskLogic logic;
  final Runnable onFailure;
  Duration lastDuration;
  // simulated time of the next run, null when the task only runs on tick()
  Duration nextRunAt;
  boolean finished;

  StubTask(TaskLogic logic, Runnable onFailure, Duration now) {
    this.logic = logic;
    this.onFailure = onFailure;
    this.nextRunAt = now;
  }

  void start() throws InterruptedException {
    logic.onStart();
  }

  void tick(Duration now) throws InterruptedException {
    lastDuration = logic.runOneLoop();
    if (lastDuration == null) {
      nextRunAt = null;
    } else if (lastDuration.isNegative()) {
      finished = true;
      nextRunAt = null;
    } else {
      nextRunAt = now.plus(lastDuration);
    }
  }

  void stop() throws InterruptedException {
    logic.onStop();
  }
}

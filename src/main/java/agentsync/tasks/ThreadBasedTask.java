package agentsync.tasks;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import agentsync.Utils;

/**
 * Runs a single {@link TaskLogic} on a dedicated daemon thread.
 */
class ThreadBasedTask {

  private static final Logger log = LoggerFactory.getLogger(ThreadBasedTask.class);
  private static final AtomicInteger nextThread = new AtomicInteger();
  private final AtomicBoolean shutdown = new AtomicBoolean(false);
  private final CountDownLatch isStarted = new CountDownLatch(1);
  private final CountDownLatch isShutdown = new CountDownLatch(1);
  private final Thread thread;
  private final TaskLogic task;
  private final Runnable onFailure;
  private final Runnable onStop;

  ThreadBasedTask(TaskLogic task, Runnable onFailure, Runnable onStop) {
    this.task = task;
    this.onFailure = onFailure;
    this.onStop = onStop;
    thread = new ThreadFactoryBuilder() //
      .setDaemon(true)
      .setNameFormat("agentsync-" + nextThread.getAndIncrement() + "-" + task.getName() + "-%s")
      .build()
      .newThread(() -> run());
  }

  void start() {
    thread.start();
    Utils.resetIfInterrupted(() -> isStarted.await());
  }

  void stop() {
    if (shutdown.compareAndSet(false, true)) {
      Utils.resetIfInterrupted(() -> isStarted.await());
      if (Thread.currentThread() == thread) {
        // a task asking to stop itself, e.g. via its pool; the loop will see the flag
        return;
      }
      thread.interrupt();
      task.onInterrupt();
      Utils.resetIfInterrupted(() -> isShutdown.await());
    }
  }

  private void run() {
    try {
      isStarted.countDown();
      try {
        task.onStart();
        while (!shouldStop()) {
          Duration wait = task.runOneLoop();
          if (wait != null) {
            if (wait.isNegative()) {
              break;
            }
            Thread.sleep(wait.toMillis());
          }
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        // shutting down
      } catch (Exception e) {
        log.error("Error escaped runOneLoop of " + task.getName(), e);
        callTaskFailureCallback();
        callFactoryFailureCallback();
      }
      // clear the interrupt so onStop can still do blocking cleanup
      Thread.interrupted();
      task.onStop();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      log.error("Error stopping " + task.getName(), e);
    } finally {
      callFactoryStopCallback();
      isShutdown.countDown();
    }
  }

  private void callTaskFailureCallback() {
    try {
      task.onFailure();
    } catch (Exception e2) {
      log.error("task.onFailure() call failed", e2);
    }
  }

  private void callFactoryFailureCallback() {
    if (onFailure != null) {
      try {
        onFailure.run();
      } catch (Exception e2) {
        log.error("onFailure call failed", e2);
      }
    }
  }

  private void callFactoryStopCallback() {
    try {
      onStop.run();
    } catch (Exception e) {
      log.error("onStop call failed", e);
    }
  }

  private boolean shouldStop() {
    return shutdown.get() || Thread.currentThread().isInterrupted();
  }

}

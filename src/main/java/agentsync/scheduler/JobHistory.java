package agentsync.scheduler;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Bounded lists of finished jobs, oldest first.
 *
 * When a list is over its cap the oldest jobs are dropped and handed to
 * {@code onEvict}, so the scheduler can forget them entirely.
 */
class JobHistory {

  private final Deque<SyncJob> completed = new ArrayDeque<>();
  private final Deque<SyncJob> failed = new ArrayDeque<>();
  private final Deque<SyncJob> cancelled = new ArrayDeque<>();
  private final int maxCompleted;
  private final int maxFailed;
  private final Consumer<SyncJob> onEvict;

  JobHistory(int maxCompleted, int maxFailed, Consumer<SyncJob> onEvict) {
    this.maxCompleted = maxCompleted;
    this.maxFailed = maxFailed;
    this.onEvict = onEvict;
  }

  synchronized void addCompleted(SyncJob job) {
    completed.addLast(job);
    trim(completed, maxCompleted);
  }

  synchronized void addFailed(SyncJob job) {
    failed.addLast(job);
    trim(failed, maxFailed);
  }

  synchronized void addCancelled(SyncJob job) {
    cancelled.addLast(job);
    trim(cancelled, maxFailed);
  }

  /** Trims to the given caps, keeping the most recently finished jobs. */
  synchronized void cleanup(int maxCompleted, int maxFailed) {
    resort(completed);
    trim(completed, maxCompleted);
    resort(failed);
    trim(failed, maxFailed);
  }

  synchronized List<SyncJob> getCompleted() {
    return new ArrayList<>(completed);
  }

  synchronized List<SyncJob> getFailed() {
    return new ArrayList<>(failed);
  }

  synchronized int completedCount() {
    return completed.size();
  }

  synchronized int failedCount() {
    return failed.size();
  }

  synchronized int cancelledCount() {
    return cancelled.size();
  }

  private void trim(Deque<SyncJob> jobs, int max) {
    while (jobs.size() > max) {
      onEvict.accept(jobs.removeFirst());
    }
  }

  private static void resort(Deque<SyncJob> jobs) {
    List<SyncJob> sorted = new ArrayList<>(jobs);
    sorted.sort(Comparator.comparing(j -> j.getCompletedAt().orElse(j.getCreatedAt()), Comparator.<Instant> naturalOrder()));
    jobs.clear();
    jobs.addAll(sorted);
  }

}

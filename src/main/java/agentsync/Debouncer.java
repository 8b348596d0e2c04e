package agentsync;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

import org.apache.commons.lang3.tuple.Pair;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;

import agentsync.tasks.TaskLogic;

/**
 * Coalesces bursts of values per key into a single delayed delivery.
 *
 * Producers on any thread call {@link #offer(Object, Object)}, which only touches
 * a thread-safe inbox; the pending timers themselves are owned by this task's
 * thread, which drains the inbox and fires whatever is due.
 *
 * In "extend" mode every offer restarts the key's quiet period and the latest
 * value wins, e.g. a file written three times in a row is delivered once,
 * {@code delay} after the last write. Otherwise the window is fixed at the
 * first offer of a burst and later offers only replace the value.
 */
public class Debouncer<K, V> implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(Debouncer.class);
  private final String name;
  private final Duration delay;
  private final boolean extendOnOffer;
  private final Duration maxWait;
  private final Clock clock;
  private final BiConsumer<K, V> onFire;
  private final BlockingQueue<Pair<K, V>> inbox = new LinkedBlockingQueue<>();
  // only mutated on the task thread, concurrent so other threads can peek at the keys
  private final Map<K, Pending<V>> pending = new ConcurrentHashMap<>();
  private final AtomicLong fired = new AtomicLong();
  private final AtomicLong superseded = new AtomicLong();

  /**
   * @param maxWait the longest we block on an empty inbox; zero makes the loop non-blocking, e.g. for tests
   */
  public Debouncer(String name, Duration delay, boolean extendOnOffer, Duration maxWait, Clock clock, BiConsumer<K, V> onFire) {
    this.name = name;
    this.delay = delay;
    this.extendOnOffer = extendOnOffer;
    this.maxWait = maxWait;
    this.clock = clock;
    this.onFire = onFire;
  }

  /** Thread-safe. */
  public void offer(K key, V value) {
    inbox.add(Pair.of(key, value));
  }

  @Override
  public Duration runOneLoop() throws InterruptedException {
    Pair<K, V> first = inbox.poll(nextWait().toMillis(), MILLISECONDS);
    if (first != null) {
      List<Pair<K, V>> batch = new ArrayList<>();
      batch.add(first);
      inbox.drainTo(batch);
      batch.forEach(p -> accept(p.getKey(), p.getValue()));
    }
    fireDue();
    return null;
  }

  @Override
  public void onStop() {
    // dropping the pending map cancels every outstanding timer
    int dropped = pending.size() + inbox.size();
    pending.clear();
    inbox.clear();
    if (dropped > 0) {
      log.debug("{} stopped with {} undelivered values", name, dropped);
    }
  }

  @Override
  public String getName() {
    return name;
  }

  public Set<K> getPendingKeys() {
    return ImmutableSet.copyOf(pending.keySet());
  }

  public long getFiredCount() {
    return fired.get();
  }

  public long getSupersededCount() {
    return superseded.get();
  }

  private void accept(K key, V value) {
    Instant now = clock.instant();
    Pending<V> existing = pending.get(key);
    if (existing == null) {
      pending.put(key, new Pending<>(value, now.plus(delay)));
    } else {
      superseded.incrementAndGet();
      existing.value = value;
      if (extendOnOffer) {
        existing.deadline = now.plus(delay);
      }
    }
  }

  private void fireDue() {
    Instant now = clock.instant();
    List<Map.Entry<K, Pending<V>>> due = Seq
      .seq(pending.entrySet())
      .filter(e -> !e.getValue().deadline.isAfter(now))
      .sorted(Comparator.comparing(e -> e.getValue().deadline))
      .toList();
    for (Map.Entry<K, Pending<V>> e : due) {
      pending.remove(e.getKey());
      fired.incrementAndGet();
      try {
        onFire.accept(e.getKey(), e.getValue().value);
      } catch (RuntimeException ex) {
        log.error(name + " failed delivering " + e.getKey(), ex);
      }
    }
  }

  private Duration nextWait() {
    if (pending.isEmpty()) {
      return maxWait;
    }
    Instant now = clock.instant();
    Duration wait = Seq.seq(pending.values()).map(p -> Duration.between(now, p.deadline)).min().get();
    if (wait.isNegative()) {
      return Duration.ZERO;
    }
    return wait.compareTo(maxWait) > 0 ? maxWait : wait;
  }

  private static class Pending<V> {
    private V value;
    private Instant deadline;

    private Pending(V value, Instant deadline) {
      this.value = value;
      this.deadline = deadline;
    }
  }

}

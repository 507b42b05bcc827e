package ca.gc.cra.ctscan.application.pipeline;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity FIFO hand-off between one producer and one consumer that also tracks
 * acknowledgement of consumed items.
 * <p>Every {@link #put(Object)} raises the unfinished count; every {@link #markDone()} lowers it.
 * {@link #awaitDrained()} returns once the count is back to zero, i.e. the queue is empty and the
 * consumer has acknowledged everything it took. The unfinished count is never below the number of
 * queued items.</p>
 * <p>A single lock guards storage and counters; waiting threads park on conditions, never poll.
 * {@link #abort(Throwable)} discards queued items and releases every waiter with a
 * {@link ChannelAbortedException}, so a dead consumer cannot leave the producer blocked.</p>
 *
 * @param <T> item type
 * @since 0.1.0
 */
public final class BoundedChannel<T> {
  private final int capacity;
  private final ArrayDeque<T> items;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notFull = lock.newCondition();
  private final Condition notEmpty = lock.newCondition();
  private final Condition drained = lock.newCondition();

  private int unfinished;
  private boolean aborted;
  private Throwable abortCause;

  /**
   * Creates an empty channel.
   *
   * @param capacity maximum number of queued items; must be positive
   * @throws IllegalArgumentException if {@code capacity} is not positive
   */
  public BoundedChannel(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    this.capacity = capacity;
    this.items = new ArrayDeque<>(capacity);
  }

  /**
   * Appends {@code item} at the tail, blocking while the channel is full.
   *
   * @param item item to enqueue; must not be {@code null}
   * @throws InterruptedException if interrupted while waiting for space
   * @throws ChannelAbortedException if the channel is or becomes aborted
   */
  public void put(T item) throws InterruptedException {
    Objects.requireNonNull(item, "item");
    lock.lockInterruptibly();
    try {
      while (!aborted && items.size() == capacity) {
        notFull.await();
      }
      ensureOpen("put");
      items.addLast(item);
      unfinished++;
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the head item, blocking while the channel is empty.
   *
   * @return oldest queued item
   * @throws InterruptedException if interrupted while waiting for an item
   * @throws ChannelAbortedException if the channel is or becomes aborted
   */
  public T get() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (!aborted && items.isEmpty()) {
        notEmpty.await();
      }
      ensureOpen("get");
      T item = items.removeFirst();
      notFull.signal();
      return item;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Acknowledges that the consumer finished with an item obtained from {@link #get()}.
   * Ignored once the channel is aborted, since the abort already cleared the count.
   *
   * @throws IllegalStateException if called more times than items were put
   */
  public void markDone() {
    lock.lock();
    try {
      if (aborted) {
        return;
      }
      if (unfinished <= 0) {
        throw new IllegalStateException("markDone called more times than items were put");
      }
      unfinished--;
      if (unfinished == 0) {
        drained.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until every item put so far has been taken and acknowledged.
   *
   * @throws InterruptedException if interrupted while waiting
   * @throws ChannelAbortedException if the channel is or becomes aborted
   */
  public void awaitDrained() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (!aborted && unfinished > 0) {
        drained.await();
      }
      ensureOpen("awaitDrained");
    } finally {
      lock.unlock();
    }
  }

  /**
   * Aborts the channel: queued items are discarded and all current and future blocking calls fail.
   * Only the first call has an effect.
   *
   * @param cause failure that made the channel unusable; may be {@code null}
   * @return number of queued items discarded, or {@code 0} if the channel was already aborted
   */
  public int abort(Throwable cause) {
    lock.lock();
    try {
      if (aborted) {
        return 0;
      }
      aborted = true;
      abortCause = cause;
      int discarded = items.size();
      items.clear();
      unfinished = 0;
      notFull.signalAll();
      notEmpty.signalAll();
      drained.signalAll();
      return discarded;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the configured capacity.
   *
   * @return maximum number of queued items
   */
  public int capacity() {
    return capacity;
  }

  /**
   * Returns the number of queued items.
   *
   * @return current queue depth
   */
  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of items put but not yet acknowledged.
   *
   * @return unfinished item count
   */
  public int unfinished() {
    lock.lock();
    try {
      return unfinished;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Indicates whether {@link #abort(Throwable)} has been called.
   *
   * @return {@code true} once aborted
   */
  public boolean isAborted() {
    lock.lock();
    try {
      return aborted;
    } finally {
      lock.unlock();
    }
  }

  private void ensureOpen(String operation) {
    if (aborted) {
      throw new ChannelAbortedException("Channel aborted; " + operation + " rejected", abortCause);
    }
  }
}

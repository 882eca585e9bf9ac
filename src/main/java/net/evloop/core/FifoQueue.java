package net.evloop.core;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayDeque;
import java.util.Optional;

/**
 * Unbounded first-in first-out queue. All operations hold the queue's monitor, so appends from
 * worker threads and the driver's dequeue are serialized. Never blocks waiting for items.
 *
 * @param <E> element type
 */
public class FifoQueue<E> {
  @GuardedBy("this")
  private final ArrayDeque<E> items = new ArrayDeque<>();

  public synchronized void enqueue(E item) {
    Preconditions.checkNotNull(item);
    items.addLast(item);
  }

  /**
   * Removes and returns the oldest item, or returns an empty optional if the queue is empty.
   */
  public synchronized Optional<E> dequeue() {
    return Optional.ofNullable(items.pollFirst());
  }

  public synchronized int size() {
    return items.size();
  }

  public synchronized boolean isEmpty() {
    return items.isEmpty();
  }
}

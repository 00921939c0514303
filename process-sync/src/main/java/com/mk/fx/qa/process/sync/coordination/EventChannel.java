package com.mk.fx.qa.process.sync.coordination;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Unbounded multi-producer, single-consumer event channel.
 *
 * <p>Publishing never blocks. Events from one producer are drained in the order that producer
 * published them; no order is defined across producers.
 *
 * @param <T> event type
 */
public final class EventChannel<T> {

  private final String name;
  private final Queue<T> queue = new ConcurrentLinkedQueue<>();
  private volatile boolean closed;

  public EventChannel(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() {
    return name;
  }

  public void publish(T event) {
    queue.offer(Objects.requireNonNull(event, "event"));
    // offer first: a close that missed this event has not cleared yet, or we clear it here
    if (closed) {
      queue.clear();
    }
  }

  /**
   * Removes every buffered event and hands it to {@code consumer}, without waiting for more.
   *
   * @return number of events drained
   */
  public int drain(Consumer<? super T> consumer) {
    int drained = 0;
    T event;
    while ((event = queue.poll()) != null) {
      consumer.accept(event);
      drained++;
    }
    return drained;
  }

  /**
   * Drops every buffered event.
   *
   * @return number of events dropped
   */
  public int discard() {
    return drain(event -> {});
  }

  /**
   * Drops every buffered event and every event published from now on.
   *
   * @return number of events dropped
   */
  public int close() {
    closed = true;
    return discard();
  }

  public boolean isClosed() {
    return closed;
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }
}

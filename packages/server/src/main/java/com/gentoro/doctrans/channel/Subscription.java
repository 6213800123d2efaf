package com.gentoro.doctrans.channel;

import com.gentoro.doctrans.tasks.TaskEvent;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One observer's bounded view of an {@link EventChannel}. Events are buffered in publication order
 * and dropped (never blocked on) once the buffer is full.
 */
public final class Subscription implements AutoCloseable {
  private final EventChannel channel;
  private final BlockingQueue<TaskEvent> buffer;
  private volatile boolean closed;

  Subscription(EventChannel channel, int capacity) {
    this.channel = channel;
    this.buffer = new ArrayBlockingQueue<>(capacity);
  }

  public String taskId() {
    return channel.taskId();
  }

  boolean offer(TaskEvent event) {
    return !closed && buffer.offer(event);
  }

  /** Next event, or null when nothing arrived within {@code timeout}. */
  public TaskEvent poll(Duration timeout) throws InterruptedException {
    return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  int buffered() {
    return buffer.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /** Detach from the channel. Idempotent. */
  @Override
  public void close() {
    detach(false);
  }

  /**
   * Detach, telling the registry whether the observer saw the task in a terminal state, which makes
   * the channel eligible for teardown once its last observer is gone.
   */
  public void detach(boolean taskTerminal) {
    if (closed) return;
    closed = true;
    channel.registry().detach(this, taskTerminal);
  }

  EventChannel channel() {
    return channel;
  }
}

package com.gentoro.doctrans.channel;

import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.tasks.TaskEvent;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Registry of transient per-task {@link EventChannel}s.
 *
 * <p>Ownership rules:
 *
 * <ul>
 *   <li>The task manager opens a channel when a task is created; an observer attaching first
 *       creates it lazily.
 *   <li>A channel is removed when a terminal event is published and nobody is subscribed, or when
 *       the last subscriber detaches after the task became terminal.
 *   <li>Deleting a task discards its channel unconditionally.
 * </ul>
 *
 * <p>All structural changes happen under the registry monitor. Publishing only offers to bounded
 * buffers, so holding the monitor never blocks on a slow observer.
 */
public final class EventChannelRegistry {
  private static final Logger log = LoggingService.getLogger(EventChannelRegistry.class);

  public static final int DEFAULT_CAPACITY = 256;

  private final int capacity;
  private final Map<String, EventChannel> channels = new HashMap<>();

  public EventChannelRegistry() {
    this(DEFAULT_CAPACITY);
  }

  /** @param capacity per-subscription buffer size */
  public EventChannelRegistry(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
  }

  public synchronized EventChannel open(String taskId) {
    return channels.computeIfAbsent(taskId, id -> new EventChannel(this, id, capacity));
  }

  public synchronized Optional<EventChannel> find(String taskId) {
    return Optional.ofNullable(channels.get(taskId));
  }

  public synchronized Subscription subscribe(String taskId) {
    return open(taskId).subscribe();
  }

  /**
   * Best-effort publish. Never blocks and never throws; returns the number of subscriptions that
   * received the event.
   */
  public synchronized int publish(String taskId, TaskEvent event) {
    EventChannel channel = channels.get(taskId);
    if (channel == null) {
      return 0;
    }
    int delivered;
    try {
      delivered = channel.publish(event);
    } catch (RuntimeException e) {
      log.warn("Failed to publish {} event for task {}", event.type().wireName(), taskId, e);
      delivered = 0;
    }
    if (event.isTerminal() && channel.subscriberCount() == 0) {
      channels.remove(taskId);
    }
    return delivered;
  }

  synchronized void detach(Subscription subscription, boolean taskTerminal) {
    EventChannel channel = subscription.channel();
    channel.remove(subscription);
    if (taskTerminal) {
      channel.markTerminated();
    }
    if (channel.isTerminated()
        && channel.subscriberCount() == 0
        && channels.get(channel.taskId()) == channel) {
      channels.remove(channel.taskId());
    }
  }

  /** Remove the channel regardless of subscribers. Returns whether one existed. */
  public synchronized boolean discard(String taskId) {
    EventChannel channel = channels.remove(taskId);
    if (channel != null) {
      channel.markTerminated();
      return true;
    }
    return false;
  }

  public synchronized int size() {
    return channels.size();
  }
}

package com.gentoro.doctrans.channel;

import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.tasks.TaskEvent;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;

/** Per-task fan-out of {@link TaskEvent}s to the attached {@link Subscription}s. */
public final class EventChannel {
  private static final Logger log = LoggingService.getLogger(EventChannel.class);

  private final EventChannelRegistry registry;
  private final String taskId;
  private final int capacity;
  private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
  private volatile boolean terminated;

  EventChannel(EventChannelRegistry registry, String taskId, int capacity) {
    this.registry = registry;
    this.taskId = taskId;
    this.capacity = capacity;
  }

  public String taskId() {
    return taskId;
  }

  public int subscriberCount() {
    return subscriptions.size();
  }

  public boolean isTerminated() {
    return terminated;
  }

  EventChannelRegistry registry() {
    return registry;
  }

  Subscription subscribe() {
    Subscription s = new Subscription(this, capacity);
    subscriptions.add(s);
    return s;
  }

  void remove(Subscription s) {
    subscriptions.remove(s);
  }

  void markTerminated() {
    terminated = true;
  }

  /**
   * Offer {@code event} to every subscription without blocking. A full subscription loses the
   * event. Returns the number of subscriptions that accepted it.
   */
  int publish(TaskEvent event) {
    int delivered = 0;
    for (Subscription s : subscriptions) {
      if (s.offer(event)) {
        delivered++;
      } else if (!s.isClosed()) {
        log.warn(
            "Event channel full for task {}, dropping {} event", taskId, event.type().wireName());
      }
    }
    if (event.isTerminal()) {
      terminated = true;
    }
    return delivered;
  }
}

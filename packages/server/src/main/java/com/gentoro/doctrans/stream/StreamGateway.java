package com.gentoro.doctrans.stream;

import com.gentoro.doctrans.channel.EventChannelRegistry;
import com.gentoro.doctrans.channel.Subscription;
import com.gentoro.doctrans.exception.NotFoundException;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.tasks.Task;
import com.gentoro.doctrans.tasks.TaskEvent;
import com.gentoro.doctrans.tasks.TaskManager;
import com.gentoro.doctrans.tasks.TaskStatus;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Relays a task's events to one observer.
 *
 * <p>Every attachment first receives the persisted state of the task, then live events until the
 * task is terminal, and exactly one terminal event overall. While idle, a keepalive is written once
 * per keepalive interval and the store is consulted again, so a terminal event lost to a full
 * buffer is still delivered from the persisted record.
 */
public final class StreamGateway {
  private static final Logger log = LoggingService.getLogger(StreamGateway.class);

  public static final Duration DEFAULT_KEEPALIVE = Duration.ofSeconds(30);

  private final TaskManager tasks;
  private final EventChannelRegistry channels;
  private final Duration keepalive;

  public StreamGateway(TaskManager tasks, EventChannelRegistry channels) {
    this(tasks, channels, DEFAULT_KEEPALIVE);
  }

  public StreamGateway(TaskManager tasks, EventChannelRegistry channels, Duration keepalive) {
    this.tasks = tasks;
    this.channels = channels;
    this.keepalive = keepalive;
  }

  /**
   * Stream events of {@code taskId} into {@code sink}, blocking until the task's terminal event has
   * been written, the task disappears or the observer disconnects.
   *
   * @throws NotFoundException if the task does not exist or belongs to another owner
   */
  public void attach(String taskId, String owner, EventSink sink) throws InterruptedException {
    Task task = tasks.get(taskId, owner);
    try {
      if (task.isTerminal()) {
        sink.send(TaskEvent.snapshotOf(task));
        return;
      }

      try (Subscription subscription = channels.subscribe(taskId)) {
        // re-read after subscribing so no transition falls between snapshot and subscription
        Optional<Task> current = tasks.get(taskId);
        if (current.isEmpty()) {
          // deleted in between; nothing will ever publish to this channel again
          subscription.detach(true);
          return;
        }
        TaskEvent snapshot = TaskEvent.snapshotOf(current.get());
        sink.send(snapshot);
        if (snapshot.isTerminal()) {
          subscription.detach(true);
          return;
        }
        relay(subscription, sink, snapshot);
      }
    } catch (IOException e) {
      log.debug("Observer of task {} disconnected: {}", taskId, e.getMessage());
    }
  }

  private void relay(Subscription subscription, EventSink sink, TaskEvent snapshot)
      throws IOException, InterruptedException {
    String taskId = subscription.taskId();
    while (true) {
      TaskEvent event = subscription.poll(keepalive);
      if (event != null) {
        if (precedes(event, snapshot)) {
          continue;
        }
        sink.send(event);
        if (event.isTerminal()) {
          subscription.detach(true);
          return;
        }
        continue;
      }

      sink.keepalive();
      Optional<Task> current = tasks.get(taskId);
      if (current.isEmpty()) {
        log.debug("Task {} was removed while being observed", taskId);
        subscription.detach(true);
        return;
      }
      if (current.get().isTerminal()) {
        // a live terminal event may still be buffered; it wins over the persisted copy
        TaskEvent buffered = subscription.poll(Duration.ZERO);
        while (buffered != null && !buffered.isTerminal()) {
          if (!precedes(buffered, snapshot)) sink.send(buffered);
          buffered = subscription.poll(Duration.ZERO);
        }
        sink.send(buffered != null ? buffered : TaskEvent.snapshotOf(current.get()));
        subscription.detach(true);
        return;
      }
    }
  }

  /**
   * Whether a progress event was published before {@code snapshot} was read. Persisted progress
   * never decreases and a task never returns to {@code queued}, so such events are stale.
   */
  static boolean precedes(TaskEvent event, TaskEvent snapshot) {
    if (event.isTerminal()) return false;
    return event.progress() < snapshot.progress()
        || (event.status() == TaskStatus.QUEUED && snapshot.status() == TaskStatus.PROCESSING);
  }
}

package com.gentoro.doctrans.tasks;

import com.gentoro.doctrans.channel.EventChannelRegistry;
import com.gentoro.doctrans.exception.NotFoundException;
import com.gentoro.doctrans.exception.StateException;
import com.gentoro.doctrans.exception.StoreException;
import com.gentoro.doctrans.exception.ValidationException;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.store.LegacyHistoryImporter;
import com.gentoro.doctrans.store.TaskStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;

/**
 * State-machine authority for tasks.
 *
 * <p>Every mutation is (1) validated against {@link TaskStatus#canTransitionTo}, (2) written to the
 * {@link TaskStore} in one transaction, and only then (3) published to the task's event channel.
 * Publishing is fire-and-forget: a full or missing channel never fails the durable write.
 */
public final class TaskManager {
  private static final Logger log = LoggingService.getLogger(TaskManager.class);

  public static final String QUEUED_MESSAGE = "Translation queued";
  public static final String COMPLETED_MESSAGE = "Translation completed";
  public static final String FAILED_MESSAGE_PREFIX = "Translation failed: ";

  private final TaskStore store;
  private final EventChannelRegistry channels;
  private final TaskWorkspace workspace;
  private final LegacyHistoryImporter legacyImporter;
  private final Clock clock;

  public TaskManager(TaskStore store, EventChannelRegistry channels, TaskWorkspace workspace) {
    this(store, channels, workspace, Clock.systemUTC());
  }

  public TaskManager(
      TaskStore store, EventChannelRegistry channels, TaskWorkspace workspace, Clock clock) {
    this.store = store;
    this.channels = channels;
    this.workspace = workspace;
    this.legacyImporter = new LegacyHistoryImporter(store);
    this.clock = clock;
  }

  public TaskWorkspace workspace() {
    return workspace;
  }

  /** Insert a new {@code queued} task and open its event channel. */
  public String create(
      String owner,
      String inputReference,
      String displayName,
      Map<String, Object> settingsSnapshot) {
    if (owner == null || owner.isBlank()) {
      throw new ValidationException("Task owner is required");
    }
    String taskId = UUID.randomUUID().toString();
    Task task =
        new Task(
            taskId,
            owner,
            TaskStatus.QUEUED,
            0,
            QUEUED_MESSAGE,
            inputReference,
            displayName,
            settingsSnapshot,
            null,
            null,
            clock.instant(),
            null,
            null);
    store.database().inTransaction(conn -> store.insert(conn, task));
    channels.open(taskId);
    log.info("Created task {} for user {} ({})", taskId, owner, displayName);
    return taskId;
  }

  public void updateProgress(String taskId, int progress, String message) {
    updateProgress(taskId, progress, message, TaskStatus.PROCESSING);
  }

  /**
   * Record progress for a non-terminal task. {@code started_at} is stamped exactly once, on the
   * {@code queued → processing} edge. While processing, a progress value below the last persisted
   * one is raised to it.
   *
   * @throws ValidationException if {@code progress} is outside [0, 100] or {@code status} is
   *     terminal
   * @throws StateException if the task is terminal or the edge is not allowed
   * @throws NotFoundException if the task does not exist
   */
  public void updateProgress(String taskId, int progress, String message, TaskStatus status) {
    if (progress < 0 || progress > 100) {
      throw new ValidationException("Progress must be between 0 and 100, got " + progress);
    }
    if (status == null || status.isTerminal()) {
      throw new ValidationException(
          "updateProgress only accepts queued or processing, got " + status);
    }
    String text = message == null ? "" : message;

    int persisted =
        store
            .database()
            .withTransaction(
                conn -> {
                  Task current = requireTask(store.find(conn, taskId), taskId);
                  requireEdge(current, status);
                  Instant startedAt =
                      current.status() == TaskStatus.QUEUED && status == TaskStatus.PROCESSING
                          ? clock.instant()
                          : null;
                  int effective =
                      current.status() == TaskStatus.PROCESSING
                          ? Math.max(progress, current.progress())
                          : progress;
                  store.updateProgress(conn, taskId, status, effective, text, startedAt);
                  return effective;
                });

    channels.publish(taskId, TaskEvent.progress(taskId, status, persisted, text));
  }

  /** Move a processing task to {@code completed} with its output references. */
  public void complete(String taskId, Map<String, String> outputReferences) {
    Map<String, String> outputs = outputReferences == null ? Map.of() : outputReferences;
    store
        .database()
        .inTransaction(
            conn -> {
              Task current = requireTask(store.find(conn, taskId), taskId);
              requireEdge(current, TaskStatus.COMPLETED);
              store.markCompleted(conn, taskId, outputs, COMPLETED_MESSAGE, clock.instant());
            });
    channels.publish(taskId, TaskEvent.complete(taskId, COMPLETED_MESSAGE, outputs));
    log.info("Task {} completed with outputs {}", taskId, outputs.keySet());
  }

  /** Move a non-terminal task to {@code failed}. */
  public void fail(String taskId, String errorDetail) {
    String detail = errorDetail == null || errorDetail.isBlank() ? "Unknown error" : errorDetail;
    String message = FAILED_MESSAGE_PREFIX + detail;
    int progress =
        store
            .database()
            .withTransaction(
                conn -> {
                  Task current = requireTask(store.find(conn, taskId), taskId);
                  requireEdge(current, TaskStatus.FAILED);
                  store.markFailed(conn, taskId, detail, message, clock.instant());
                  return current.progress();
                });
    channels.publish(taskId, TaskEvent.error(taskId, progress, message, detail));
    log.info("Task {} failed: {}", taskId, detail);
  }

  public Optional<Task> get(String taskId) {
    return store.find(taskId);
  }

  /** Owner-scoped lookup; another owner's task is reported as not found. */
  public Task get(String taskId, String owner) {
    return store
        .find(taskId)
        .filter(t -> t.isOwnedBy(owner))
        .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
  }

  /** Tasks of {@code owner}, newest first. */
  public List<Task> listByOwner(String owner) {
    return store.listByOwner(owner);
  }

  /**
   * Delete an owner's finished task: artifacts first, then the record, then any event channel.
   * Returns false, changing nothing, when the task is unknown or belongs to someone else.
   *
   * @throws StateException if the task is still queued or processing
   */
  public boolean delete(String taskId, String owner) {
    Optional<Task> found = store.find(taskId).filter(t -> t.isOwnedBy(owner));
    if (found.isEmpty()) {
      return false;
    }
    Task task = found.get();
    if (!task.isTerminal()) {
      throw new StateException(
          "Task " + taskId + " is still " + task.status().wireValue() + " and cannot be deleted");
    }
    try {
      workspace.deleteArtifacts(owner, taskId, task.inputReference());
    } catch (IOException e) {
      throw new StoreException("Failed to remove artifacts of task " + taskId, e);
    }
    boolean removed = store.database().withTransaction(conn -> store.delete(conn, taskId));
    channels.discard(taskId);
    if (removed) {
      log.info("Deleted task {} of user {}", taskId, owner);
    }
    return removed;
  }

  /** Import the owner's legacy {@code history.json}, if present. */
  public int importLegacyHistory(String owner) {
    return legacyImporter.importHistory(owner, workspace.historyFile(owner));
  }

  private static Task requireTask(Optional<Task> task, String taskId) {
    return task.orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
  }

  private static void requireEdge(Task current, TaskStatus next) {
    if (current.isTerminal()) {
      throw new StateException(
          "Task " + current.taskId() + " is already " + current.status().wireValue());
    }
    if (!current.status().canTransitionTo(next)) {
      throw new StateException(
          "Illegal transition for task "
              + current.taskId()
              + ": "
              + current.status().wireValue()
              + " -> "
              + next.wireValue());
    }
  }
}

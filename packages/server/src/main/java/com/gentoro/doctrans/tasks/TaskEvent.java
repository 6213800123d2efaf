package com.gentoro.doctrans.tasks;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State change published to a task's event channel and relayed to observers.
 *
 * <p>{@code COMPLETE} events carry output references, {@code ERROR} events an error detail; both
 * are terminal.
 */
public record TaskEvent(
    Type type,
    String taskId,
    TaskStatus status,
    int progress,
    String message,
    Map<String, String> outputReferences,
    String errorDetail) {

  public enum Type {
    PROGRESS("progress"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    Type(String wireName) {
      this.wireName = wireName;
    }

    /** SSE event name. */
    public String wireName() {
      return wireName;
    }
  }

  public TaskEvent {
    message = message == null ? "" : message;
    outputReferences =
        outputReferences == null
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(outputReferences));
  }

  public boolean isTerminal() {
    return type != Type.PROGRESS;
  }

  public static TaskEvent progress(String taskId, TaskStatus status, int progress, String message) {
    return new TaskEvent(Type.PROGRESS, taskId, status, progress, message, null, null);
  }

  public static TaskEvent complete(
      String taskId, String message, Map<String, String> outputReferences) {
    return new TaskEvent(
        Type.COMPLETE, taskId, TaskStatus.COMPLETED, 100, message, outputReferences, null);
  }

  public static TaskEvent error(String taskId, int progress, String message, String errorDetail) {
    return new TaskEvent(
        Type.ERROR, taskId, TaskStatus.FAILED, progress, message, null, errorDetail);
  }

  /**
   * Event describing the persisted state of {@code task}: the terminal event for finished tasks,
   * otherwise a progress snapshot.
   */
  public static TaskEvent snapshotOf(Task task) {
    return switch (task.status()) {
      case COMPLETED -> complete(task.taskId(), task.message(), task.outputReferences());
      case FAILED -> error(task.taskId(), task.progress(), task.message(), task.errorDetail());
      case QUEUED, PROCESSING ->
          progress(task.taskId(), task.status(), task.progress(), task.message());
    };
  }

  /** JSON payload sent to observers. */
  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", type.wireName());
    payload.put("task_id", taskId);
    payload.put("status", status.wireValue());
    payload.put("progress", progress);
    payload.put("message", message);
    if (outputReferences != null) payload.put("output_files", outputReferences);
    if (errorDetail != null) payload.put("error", errorDetail);
    return payload;
  }
}

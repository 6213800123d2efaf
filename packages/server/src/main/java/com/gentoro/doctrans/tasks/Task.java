package com.gentoro.doctrans.tasks;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a persisted task.
 *
 * <p>{@code outputReferences} is non-null only for {@link TaskStatus#COMPLETED} tasks and {@code
 * errorDetail} only for {@link TaskStatus#FAILED} ones. {@code settingsSnapshot} is the per-run
 * configuration captured at creation and never changes afterwards.
 */
public record Task(
    String taskId,
    String owner,
    TaskStatus status,
    int progress,
    String message,
    String inputReference,
    String displayName,
    Map<String, Object> settingsSnapshot,
    Map<String, String> outputReferences,
    String errorDetail,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt) {

  public Task {
    message = message == null ? "" : message;
    settingsSnapshot =
        settingsSnapshot == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(settingsSnapshot));
    outputReferences =
        outputReferences == null
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(outputReferences));
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public boolean isOwnedBy(String candidate) {
    return owner.equals(candidate);
  }
}

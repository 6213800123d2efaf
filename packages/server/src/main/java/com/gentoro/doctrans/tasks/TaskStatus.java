package com.gentoro.doctrans.tasks;

import java.util.Locale;

/**
 * Lifecycle state of a translation task.
 *
 * <pre>
 * QUEUED ──► PROCESSING ──► COMPLETED
 *    │            │
 *    └────────────┴───────► FAILED
 * </pre>
 *
 * <p>{@code QUEUED} is the only initial state and the two terminal states have no outgoing edges.
 * The {@code QUEUED → FAILED} edge is taken by startup recovery and by failures that happen before
 * an admission slot was granted.
 */
public enum TaskStatus {
  /** Accepted and waiting for an admission slot. */
  QUEUED,
  /** Holding an admission slot; the engine is running or being prepared. */
  PROCESSING,
  /** Finished with output artifacts. */
  COMPLETED,
  /** Finished with an error detail. */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** Whether {@code this → next} is a legal edge. Non-terminal states may loop onto themselves. */
  public boolean canTransitionTo(TaskStatus next) {
    return switch (this) {
      case QUEUED -> next != COMPLETED;
      case PROCESSING -> next != QUEUED;
      case COMPLETED, FAILED -> false;
    };
  }

  /** Lower-case value used in the database and on the wire. */
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TaskStatus fromWire(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Task status must not be null");
    }
    return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

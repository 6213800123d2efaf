package com.gentoro.doctrans.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.tasks.Task;
import com.gentoro.doctrans.tasks.TaskStatus;
import com.gentoro.doctrans.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;

/**
 * One-time import of the flat-file {@code history.json} that predates the task table.
 *
 * <p>Best effort: an unreadable file is logged and left in place. Records whose {@code task_id}
 * already exists are skipped, so the import can be repeated. After at least one record was
 * imported the file is renamed to {@code history.json.bak}.
 *
 * <p>Legacy records only ever reached the file once finished; anything not marked {@code
 * completed} is imported as {@code failed} so terminal rows always carry exactly one of outputs or
 * error.
 */
public final class LegacyHistoryImporter {
  private static final Logger log = LoggingService.getLogger(LegacyHistoryImporter.class);

  static final String IMPORTED_ERROR = "Imported from legacy history";

  private final TaskStore store;

  public LegacyHistoryImporter(TaskStore store) {
    this.store = store;
  }

  /** Returns the number of imported records. */
  public int importHistory(String owner, Path historyFile) {
    if (historyFile == null || !Files.isRegularFile(historyFile)) {
      return 0;
    }

    JsonNode history;
    try {
      history = JacksonUtility.getJsonMapper().readTree(historyFile.toFile());
    } catch (IOException e) {
      log.warn("Skipping unreadable legacy history {}: {}", historyFile, e.getMessage());
      return 0;
    }
    if (history == null || !history.isArray() || history.isEmpty()) {
      return 0;
    }

    int migrated =
        store
            .database()
            .withTransaction(
                conn -> {
                  int count = 0;
                  for (JsonNode item : history) {
                    String taskId = text(item, "task_id");
                    if (taskId == null || taskId.isBlank()) continue;
                    if (store.exists(conn, taskId)) continue;
                    store.insert(conn, toTask(owner, taskId, item));
                    count++;
                  }
                  return count;
                });

    if (migrated > 0) {
      log.info("Migrated {} history items for user {}", migrated, owner);
      Path backup = historyFile.resolveSibling(historyFile.getFileName() + ".bak");
      try {
        Files.move(historyFile, backup);
      } catch (IOException e) {
        log.warn("Imported {} but could not rename to {}: {}", historyFile, backup, e.getMessage());
      }
    }
    return migrated;
  }

  private static Task toTask(String owner, String taskId, JsonNode item) {
    boolean completed = "completed".equalsIgnoreCase(text(item, "status"));
    Instant createdAt = parseTimestamp(text(item, "created_at"), Instant.now());
    Instant completedAt = parseTimestamp(text(item, "completed_at"), createdAt);

    Map<String, String> outputs = null;
    String error = null;
    if (completed) {
      outputs = new LinkedHashMap<>();
      putIfPresent(outputs, "mono", text(item, "mono_path"));
      putIfPresent(outputs, "dual", text(item, "dual_path"));
    } else {
      error = text(item, "error");
      if (error == null || error.isBlank()) error = IMPORTED_ERROR;
    }

    return new Task(
        taskId,
        owner,
        completed ? TaskStatus.COMPLETED : TaskStatus.FAILED,
        completed ? 100 : 0,
        "",
        text(item, "file_id"),
        text(item, "original_filename"),
        Map.of(),
        outputs,
        error,
        createdAt,
        null,
        completedAt);
  }

  private static void putIfPresent(Map<String, String> map, String key, String value) {
    if (value != null && !value.isBlank()) map.put(key, value);
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  /** Accepts ISO instants and zone-less ISO local timestamps, which are read as UTC. */
  static Instant parseTimestamp(String value, Instant fallback) {
    if (value == null || value.isBlank()) return fallback;
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(value, Instant::from, LocalDateTime::from);
      return parsed instanceof Instant instant
          ? instant
          : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      return fallback;
    }
  }
}

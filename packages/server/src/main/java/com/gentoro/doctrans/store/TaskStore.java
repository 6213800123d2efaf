package com.gentoro.doctrans.store;

import com.gentoro.doctrans.exception.StoreException;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.tasks.Task;
import com.gentoro.doctrans.tasks.TaskStatus;
import com.gentoro.doctrans.utility.JacksonUtility;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Authoritative persistence for task records.
 *
 * <p>Methods taking a {@link Connection} join the caller's transaction (see {@link
 * Database#withTransaction}); the others open their own.
 */
public final class TaskStore {
  private static final Logger log = LoggingService.getLogger(TaskStore.class);

  /** Error detail written by {@link #recoverStaleTasks(Instant)}. */
  public static final String RESTART_ERROR = "Server restarted during translation";

  private static final String COLUMNS =
      "task_id, owner, status, progress, message, input_reference, display_name,"
          + " settings_snapshot, output_references, error_detail, created_at_ms, started_at_ms,"
          + " completed_at_ms";

  private final Database database;

  public TaskStore(Database database) {
    this.database = database;
  }

  public Database database() {
    return database;
  }

  /** Create the task table and its indexes. Safe to call on every startup. */
  public void initSchema() {
    database.inTransaction(
        conn -> {
          try (Statement st = conn.createStatement()) {
            st.execute(
                """
                CREATE TABLE IF NOT EXISTS tasks (
                    task_id TEXT PRIMARY KEY,
                    owner TEXT NOT NULL,
                    status TEXT NOT NULL DEFAULT 'queued',
                    progress INTEGER NOT NULL DEFAULT 0,
                    message TEXT NOT NULL DEFAULT '',
                    input_reference TEXT,
                    display_name TEXT,
                    settings_snapshot TEXT,
                    output_references TEXT,
                    error_detail TEXT,
                    created_at_ms INTEGER NOT NULL,
                    started_at_ms INTEGER,
                    completed_at_ms INTEGER
                )
                """);
            st.execute(
                "CREATE INDEX IF NOT EXISTS idx_tasks_owner_created"
                    + " ON tasks(owner, created_at_ms DESC)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status)");
          }
        });
  }

  /**
   * Force every {@code queued} or {@code processing} task to {@code failed}. Must run once at
   * startup before any task is admitted: no engine run survives a restart, so in-flight work is
   * never resumed. Returns the number of tasks changed; a second call returns 0.
   */
  public int recoverStaleTasks(Instant now) {
    int affected =
        database.withTransaction(
            conn -> {
              try (PreparedStatement ps =
                  conn.prepareStatement(
                      "UPDATE tasks SET status = ?, message = ?, error_detail = ?,"
                          + " output_references = NULL, completed_at_ms = ?"
                          + " WHERE status IN (?, ?)")) {
                ps.setString(1, TaskStatus.FAILED.wireValue());
                ps.setString(2, "Translation failed: " + RESTART_ERROR);
                ps.setString(3, RESTART_ERROR);
                ps.setLong(4, now.toEpochMilli());
                ps.setString(5, TaskStatus.QUEUED.wireValue());
                ps.setString(6, TaskStatus.PROCESSING.wireValue());
                return ps.executeUpdate();
              }
            });
    if (affected > 0) {
      log.info("Recovered {} stale tasks on startup", affected);
    }
    return affected;
  }

  public void insert(Connection conn, Task task) throws SQLException {
    try (PreparedStatement ps =
        conn.prepareStatement(
            "INSERT INTO tasks (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
      ps.setString(1, task.taskId());
      ps.setString(2, task.owner());
      ps.setString(3, task.status().wireValue());
      ps.setInt(4, task.progress());
      ps.setString(5, task.message());
      ps.setString(6, task.inputReference());
      ps.setString(7, task.displayName());
      ps.setString(8, JacksonUtility.toJson(task.settingsSnapshot()));
      setNullableString(
          ps,
          9,
          task.outputReferences() == null ? null : JacksonUtility.toJson(task.outputReferences()));
      setNullableString(ps, 10, task.errorDetail());
      ps.setLong(11, task.createdAt().toEpochMilli());
      setNullableInstant(ps, 12, task.startedAt());
      setNullableInstant(ps, 13, task.completedAt());
      ps.executeUpdate();
    }
  }

  public boolean exists(Connection conn, String taskId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM tasks WHERE task_id = ?")) {
      ps.setString(1, taskId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }

  public Optional<Task> find(Connection conn, String taskId) throws SQLException {
    try (PreparedStatement ps =
        conn.prepareStatement("SELECT " + COLUMNS + " FROM tasks WHERE task_id = ?")) {
      ps.setString(1, taskId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    }
  }

  public Optional<Task> find(String taskId) {
    return database.withTransaction(conn -> find(conn, taskId));
  }

  /** Tasks of {@code owner}, newest first. */
  public List<Task> listByOwner(String owner) {
    return database.withTransaction(
        conn -> {
          try (PreparedStatement ps =
              conn.prepareStatement(
                  "SELECT "
                      + COLUMNS
                      + " FROM tasks WHERE owner = ? ORDER BY created_at_ms DESC, rowid DESC")) {
            ps.setString(1, owner);
            try (ResultSet rs = ps.executeQuery()) {
              List<Task> out = new ArrayList<>();
              while (rs.next()) out.add(map(rs));
              return out;
            }
          }
        });
  }

  /** Persist a non-terminal state change. {@code startedAt} is written only when non-null. */
  public void updateProgress(
      Connection conn,
      String taskId,
      TaskStatus status,
      int progress,
      String message,
      Instant startedAt)
      throws SQLException {
    String sql =
        startedAt == null
            ? "UPDATE tasks SET status = ?, progress = ?, message = ? WHERE task_id = ?"
            : "UPDATE tasks SET status = ?, progress = ?, message = ?, started_at_ms = ?"
                + " WHERE task_id = ?";
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      int i = 1;
      ps.setString(i++, status.wireValue());
      ps.setInt(i++, progress);
      ps.setString(i++, message);
      if (startedAt != null) ps.setLong(i++, startedAt.toEpochMilli());
      ps.setString(i, taskId);
      requireSingleRow(ps.executeUpdate(), taskId);
    }
  }

  public void markCompleted(
      Connection conn,
      String taskId,
      Map<String, String> outputReferences,
      String message,
      Instant completedAt)
      throws SQLException {
    try (PreparedStatement ps =
        conn.prepareStatement(
            "UPDATE tasks SET status = ?, progress = 100, message = ?, output_references = ?,"
                + " error_detail = NULL, completed_at_ms = ? WHERE task_id = ?")) {
      ps.setString(1, TaskStatus.COMPLETED.wireValue());
      ps.setString(2, message);
      ps.setString(3, JacksonUtility.toJson(outputReferences));
      ps.setLong(4, completedAt.toEpochMilli());
      ps.setString(5, taskId);
      requireSingleRow(ps.executeUpdate(), taskId);
    }
  }

  public void markFailed(
      Connection conn, String taskId, String errorDetail, String message, Instant completedAt)
      throws SQLException {
    try (PreparedStatement ps =
        conn.prepareStatement(
            "UPDATE tasks SET status = ?, message = ?, error_detail = ?,"
                + " output_references = NULL, completed_at_ms = ? WHERE task_id = ?")) {
      ps.setString(1, TaskStatus.FAILED.wireValue());
      ps.setString(2, message);
      ps.setString(3, errorDetail);
      ps.setLong(4, completedAt.toEpochMilli());
      ps.setString(5, taskId);
      requireSingleRow(ps.executeUpdate(), taskId);
    }
  }

  public boolean delete(Connection conn, String taskId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement("DELETE FROM tasks WHERE task_id = ?")) {
      ps.setString(1, taskId);
      return ps.executeUpdate() > 0;
    }
  }

  private static void requireSingleRow(int updated, String taskId) {
    if (updated != 1) {
      throw new StoreException("Expected to update task " + taskId + " but " + updated + " rows");
    }
  }

  private static Task map(ResultSet rs) throws SQLException {
    String outputs = rs.getString("output_references");
    return new Task(
        rs.getString("task_id"),
        rs.getString("owner"),
        TaskStatus.fromWire(rs.getString("status")),
        rs.getInt("progress"),
        rs.getString("message"),
        rs.getString("input_reference"),
        rs.getString("display_name"),
        JacksonUtility.readObjectMap(rs.getString("settings_snapshot")),
        outputs == null ? null : JacksonUtility.readStringMap(outputs),
        rs.getString("error_detail"),
        Instant.ofEpochMilli(rs.getLong("created_at_ms")),
        nullableInstant(rs, "started_at_ms"),
        nullableInstant(rs, "completed_at_ms"));
  }

  private static Instant nullableInstant(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : Instant.ofEpochMilli(value);
  }

  private static void setNullableString(PreparedStatement ps, int index, String value)
      throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.VARCHAR);
    } else {
      ps.setString(index, value);
    }
  }

  private static void setNullableInstant(PreparedStatement ps, int index, Instant value)
      throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.INTEGER);
    } else {
      ps.setLong(index, value.toEpochMilli());
    }
  }
}

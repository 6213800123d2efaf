package com.gentoro.doctrans.store;

import com.gentoro.doctrans.exception.StoreException;
import com.gentoro.doctrans.logging.LoggingService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import org.slf4j.Logger;

/**
 * SQLite connection factory with scoped transactions.
 *
 * <p>Every unit of work runs on its own connection opened by {@link #withTransaction}; SQLite
 * serializes writers, and the busy timeout lets concurrent task updates wait for each other instead
 * of failing.
 */
public final class Database {
  private static final Logger log = LoggingService.getLogger(Database.class);

  private static final int BUSY_TIMEOUT_MS = 30_000;

  private final Path dbFile;
  private final String jdbcUrl;

  /** Work executed inside a transaction. */
  @FunctionalInterface
  public interface TransactionCallback<T> {
    T doInTransaction(Connection connection) throws SQLException;
  }

  /** Variant of {@link TransactionCallback} without a result. */
  @FunctionalInterface
  public interface TransactionWork {
    void doInTransaction(Connection connection) throws SQLException;
  }

  public Database(Path dbFile) {
    this.dbFile = dbFile;
    this.jdbcUrl = "jdbc:sqlite:" + dbFile.toAbsolutePath();
  }

  public Path dbFile() {
    return dbFile;
  }

  /** Create the parent directory and switch the database to WAL journaling. */
  public void init() {
    try {
      Path parent = dbFile.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
    } catch (IOException e) {
      throw new StoreException("Failed to create database directory for " + dbFile, e);
    }
    try (Connection conn = DriverManager.getConnection(jdbcUrl);
        Statement st = conn.createStatement()) {
      st.execute("PRAGMA journal_mode=WAL");
    } catch (SQLException e) {
      throw new StoreException("Failed to open SQLite database " + dbFile, e);
    }
    log.info("SQLite database ready at {}", dbFile.toAbsolutePath());
  }

  public Connection openConnection() throws SQLException {
    Connection conn = DriverManager.getConnection(jdbcUrl);
    try (Statement st = conn.createStatement()) {
      st.execute("PRAGMA foreign_keys=ON");
      st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
    } catch (SQLException e) {
      conn.close();
      throw e;
    }
    return conn;
  }

  /**
   * Run {@code callback} in a transaction: commit when it returns, roll back when it throws
   * anything. {@link SQLException}s surface as {@link StoreException}; other exceptions propagate
   * unchanged after the rollback.
   */
  public <T> T withTransaction(TransactionCallback<T> callback) {
    try (Connection conn = openConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = callback.doInTransaction(conn);
        conn.commit();
        return result;
      } catch (Throwable t) {
        rollbackQuietly(conn, t);
        throw t;
      }
    } catch (SQLException e) {
      throw new StoreException("Database transaction failed: " + e.getMessage(), e);
    }
  }

  public void inTransaction(TransactionWork work) {
    withTransaction(
        conn -> {
          work.doInTransaction(conn);
          return null;
        });
  }

  private static void rollbackQuietly(Connection conn, Throwable cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
      log.warn("Rollback failed: {}", e.getMessage());
    }
  }
}

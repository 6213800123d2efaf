package com.gentoro.doctrans.tasks;

import com.gentoro.doctrans.exception.ValidationException;
import com.gentoro.doctrans.utility.FileUtility;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * On-disk layout of per-owner files under the data directory:
 *
 * <pre>
 * users/&lt;owner&gt;/uploads/&lt;file_id&gt;_&lt;name&gt;   source uploads
 * users/&lt;owner&gt;/outputs/&lt;task_id&gt;/         translated artifacts
 * users/&lt;owner&gt;/settings.json                saved translation settings
 * users/&lt;owner&gt;/history.json                 legacy task history
 * </pre>
 */
public final class TaskWorkspace {
  private final Path root;

  public TaskWorkspace(Path dataDir) {
    this.root = dataDir.resolve("users");
  }

  public Path userDir(String owner) {
    return root.resolve(safeSegment(owner, "owner"));
  }

  public Path uploadDir(String owner) {
    return userDir(owner).resolve("uploads");
  }

  public Path outputDir(String owner, String taskId) {
    return userDir(owner).resolve("outputs").resolve(safeSegment(taskId, "task id"));
  }

  public Path settingsFile(String owner) {
    return userDir(owner).resolve("settings.json");
  }

  public Path historyFile(String owner) {
    return userDir(owner).resolve("history.json");
  }

  public Path createOutputDir(String owner, String taskId) throws IOException {
    return Files.createDirectories(outputDir(owner, taskId));
  }

  /** The upload stored for {@code fileId}, if any. */
  public Optional<Path> findUpload(String owner, String fileId) throws IOException {
    String prefix = safeSegment(fileId, "file id") + "_";
    Path dir = uploadDir(owner);
    if (!Files.isDirectory(dir)) return Optional.empty();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
      for (Path f : files) {
        if (f.getFileName().toString().startsWith(prefix) && Files.isRegularFile(f)) {
          return Optional.of(f);
        }
      }
    }
    return Optional.empty();
  }

  /** Remove the task's output directory and the uploads stored under {@code fileId}. */
  public void deleteArtifacts(String owner, String taskId, String fileId) throws IOException {
    FileUtility.deleteDir(outputDir(owner, taskId));
    if (fileId == null || fileId.isBlank()) return;
    Path dir = uploadDir(owner);
    if (!Files.isDirectory(dir)) return;
    String prefix = safeSegment(fileId, "file id") + "_";
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
      for (Path f : files) {
        if (f.getFileName().toString().startsWith(prefix)) {
          Files.deleteIfExists(f);
        }
      }
    }
  }

  private static String safeSegment(String value, String what) {
    if (value == null
        || value.isBlank()
        || value.contains("/")
        || value.contains("\\")
        || value.equals(".")
        || value.equals("..")) {
      throw new ValidationException("Invalid " + what + ": " + value);
    }
    return value;
  }
}

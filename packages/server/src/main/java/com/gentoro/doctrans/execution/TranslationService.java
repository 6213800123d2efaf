package com.gentoro.doctrans.execution;

import com.gentoro.doctrans.exception.NotFoundException;
import com.gentoro.doctrans.exception.StoreException;
import com.gentoro.doctrans.exception.ValidationException;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.tasks.TaskManager;
import com.gentoro.doctrans.tasks.TaskWorkspace;
import com.gentoro.doctrans.utility.FileUtility;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;

/** Entry point for starting translations of previously uploaded files. */
public final class TranslationService {
  private static final Logger log = LoggingService.getLogger(TranslationService.class);

  private final TaskManager tasks;
  private final ExecutionCoordinator coordinator;
  private final Object submissionOrder = new Object();

  public TranslationService(TaskManager tasks, ExecutionCoordinator coordinator) {
    this.tasks = tasks;
    this.coordinator = coordinator;
  }

  /**
   * Create a task for the upload {@code fileId} of {@code owner} and hand it to the coordinator.
   * Returns as soon as the task is durably queued.
   *
   * @throws ValidationException if {@code fileId} is missing
   * @throws NotFoundException if no such upload exists
   */
  public String start(String owner, String fileId, Map<String, Object> overrides) {
    if (fileId == null || fileId.isBlank()) {
      throw new ValidationException("file_id is required");
    }
    TaskWorkspace workspace = tasks.workspace();
    Path input;
    try {
      input =
          workspace
              .findUpload(owner, fileId)
              .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
    } catch (IOException e) {
      throw new StoreException("Failed to look up upload " + fileId, e);
    }
    String displayName = displayName(input, fileId);
    Map<String, Object> snapshot = overrides == null ? Map.of() : overrides;

    // creation and admission reservation must happen in the same order
    synchronized (submissionOrder) {
      String taskId = tasks.create(owner, fileId, displayName, snapshot);
      Path outputDir;
      try {
        outputDir = workspace.createOutputDir(owner, taskId);
      } catch (IOException e) {
        log.error("Could not create output directory for task {}", taskId, e);
        tasks.fail(taskId, "Could not create output directory");
        throw new StoreException("Failed to create output directory for task " + taskId, e);
      }
      coordinator.submit(
          new ExecutionCoordinator.TranslationRequest(
              taskId, owner, input, outputDir, displayName, snapshot));
      return taskId;
    }
  }

  /** Upload name without the {@code <file_id>_} prefix and without its extension. */
  static String displayName(Path upload, String fileId) {
    String stem = FileUtility.stem(upload);
    String prefix = fileId + "_";
    String name = stem.startsWith(prefix) ? stem.substring(prefix.length()) : stem;
    return name.isBlank() ? stem : name;
  }
}

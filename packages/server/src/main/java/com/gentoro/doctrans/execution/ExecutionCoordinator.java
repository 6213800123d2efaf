package com.gentoro.doctrans.execution;

import com.gentoro.doctrans.engine.EngineEvent;
import com.gentoro.doctrans.engine.TranslationEngine;
import com.gentoro.doctrans.exception.DocTransException;
import com.gentoro.doctrans.exception.EngineException;
import com.gentoro.doctrans.exception.ExceptionUtil;
import com.gentoro.doctrans.exception.NotFoundException;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.settings.SettingsProvider;
import com.gentoro.doctrans.tasks.TaskManager;
import com.gentoro.doctrans.tasks.TaskStatus;
import com.gentoro.doctrans.utility.FileUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.slf4j.Logger;

/**
 * Drives each task from {@code queued} to a terminal state.
 *
 * <p>Per task: report "waiting", take an admission slot, load and validate the configuration, run
 * the engine and map its events onto {@link TaskManager} transitions, relocate the outputs and
 * complete. Any failure on the way ends in {@link TaskManager#fail}; nothing escapes the worker.
 * The coordinator is the only writer of a task's state while it runs.
 */
public final class ExecutionCoordinator implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(ExecutionCoordinator.class);

  public static final String WAITING_MESSAGE = "Waiting in queue...";
  public static final String LOADING_MESSAGE = "Loading user settings...";
  public static final String STARTING_MESSAGE = "Starting translation...";
  static final String NO_RESULT_ERROR = "Translation engine ended without a result";

  private final TaskManager tasks;
  private final AdmissionController admission;
  private final SettingsProvider settings;
  private final TranslationEngine engine;
  private final ExecutorService executor;

  public ExecutionCoordinator(
      TaskManager tasks,
      AdmissionController admission,
      SettingsProvider settings,
      TranslationEngine engine) {
    this(tasks, admission, settings, engine, newWorkerPool());
  }

  public ExecutionCoordinator(
      TaskManager tasks,
      AdmissionController admission,
      SettingsProvider settings,
      TranslationEngine engine,
      ExecutorService executor) {
    this.tasks = tasks;
    this.admission = admission;
    this.settings = settings;
    this.engine = engine;
    this.executor = executor;
  }

  /** Everything needed to run one task. */
  public record TranslationRequest(
      String taskId,
      String owner,
      Path input,
      Path outputDir,
      String displayName,
      Map<String, Object> overrides) {}

  /**
   * Queue {@code request} for execution. The admission reservation is taken on the calling thread,
   * so tasks submitted in creation order are admitted in creation order.
   */
  public Future<?> submit(TranslationRequest request) {
    AdmissionController.Ticket ticket = admission.reserve(request.taskId());
    try {
      return executor.submit(() -> run(request, ticket));
    } catch (RejectedExecutionException e) {
      ticket.close();
      failQuietly(request.taskId(), "Translation service is shutting down");
      throw e;
    }
  }

  void run(TranslationRequest request, AdmissionController.Ticket ticket) {
    String taskId = request.taskId();
    try (ticket) {
      tasks.updateProgress(taskId, 0, WAITING_MESSAGE, TaskStatus.QUEUED);

      try (AdmissionController.Permit permit = admission.acquire(ticket)) {
        tasks.updateProgress(taskId, 0, LOADING_MESSAGE, TaskStatus.PROCESSING);

        Map<String, Object> saved = settings.get(request.owner());
        TranslationConfiguration configuration =
            TranslationConfiguration.merge(saved, request.overrides(), request.outputDir())
                .validate();

        log.info("Starting translation task {} for user {}", taskId, request.owner());
        tasks.updateProgress(taskId, 0, STARTING_MESSAGE);

        Map<String, String> outputs = drive(request, configuration);
        tasks.complete(taskId, outputs);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Translation task {} interrupted", taskId);
      failQuietly(taskId, "Translation interrupted");
    } catch (Exception e) {
      log.error("Translation task {} failed", taskId, e);
      failQuietly(taskId, ExceptionUtil.describeFailure(e));
    }
  }

  private Map<String, String> drive(TranslationRequest request, TranslationConfiguration config)
      throws IOException {
    try (Stream<EngineEvent> events = engine.run(config, request.input())) {
      Iterator<EngineEvent> it = events.iterator();
      while (it.hasNext()) {
        EngineEvent event = it.next();
        if (event instanceof EngineEvent.Progress progress) {
          tasks.updateProgress(
              request.taskId(), clamp(progress.overallProgress()), progress.describe());
        } else if (event instanceof EngineEvent.Finish finish) {
          return relocate(finish, request.outputDir(), request.displayName());
        } else if (event instanceof EngineEvent.Failure failure) {
          throw new EngineException(failure.errorDetail());
        }
      }
    }
    throw new EngineException(NO_RESULT_ERROR);
  }

  /**
   * Move each existing artifact into the task's output directory as {@code
   * <display-name>_<variant><ext>}. Variants whose file is missing are left out.
   */
  static Map<String, String> relocate(EngineEvent.Finish finish, Path outputDir, String displayName)
      throws IOException {
    Map<String, String> outputs = new LinkedHashMap<>();
    String base = safeFileName(displayName);
    Files.createDirectories(outputDir);
    for (Map.Entry<String, Path> artifact : finish.outputArtifacts().entrySet()) {
      Path source = artifact.getValue();
      if (source == null || !Files.isRegularFile(source)) {
        log.warn("Engine reported missing {} artifact: {}", artifact.getKey(), source);
        continue;
      }
      String ext = FileUtility.extension(source);
      Path target =
          outputDir.resolve(
              base + "_" + safeFileName(artifact.getKey()) + (ext.isEmpty() ? ".pdf" : ext));
      if (!source.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
        Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
      }
      outputs.put(artifact.getKey(), target.toString());
    }
    return outputs;
  }

  private void failQuietly(String taskId, String detail) {
    try {
      tasks.fail(taskId, detail);
    } catch (NotFoundException e) {
      log.warn("Task {} disappeared before its failure could be recorded", taskId);
    } catch (DocTransException e) {
      // the task keeps its last persisted state until startup recovery reconciles it
      log.error("Could not record failure of task {}: {}", taskId, e.getMessage(), e);
    }
  }

  private static int clamp(int progress) {
    return Math.max(0, Math.min(100, progress));
  }

  static String safeFileName(String value) {
    if (value == null || value.isBlank()) return "translated";
    return value.replaceAll("[^\\w\\-.\\u4e00-\\u9fff]", "_");
  }

  private static ExecutorService newWorkerPool() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(
        r -> {
          Thread t = new Thread(r, "translation-worker-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Translation workers did not stop within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}

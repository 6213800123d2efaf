package com.gentoro.doctrans;

import com.gentoro.doctrans.api.OwnerResolver;
import com.gentoro.doctrans.api.TranslationServer;
import com.gentoro.doctrans.channel.EventChannelRegistry;
import com.gentoro.doctrans.engine.ProcessTranslationEngine;
import com.gentoro.doctrans.engine.TranslationEngine;
import com.gentoro.doctrans.exception.ConfigException;
import com.gentoro.doctrans.exception.NetworkException;
import com.gentoro.doctrans.exception.StateException;
import com.gentoro.doctrans.execution.AdmissionController;
import com.gentoro.doctrans.execution.ExecutionCoordinator;
import com.gentoro.doctrans.execution.TranslationService;
import com.gentoro.doctrans.http.EmbeddedJettyServer;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.settings.FileSettingsProvider;
import com.gentoro.doctrans.store.Database;
import com.gentoro.doctrans.store.TaskStore;
import com.gentoro.doctrans.stream.StreamGateway;
import com.gentoro.doctrans.tasks.TaskManager;
import com.gentoro.doctrans.tasks.TaskWorkspace;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Application root. {@link #initialize()} wires the components in a fixed order: configuration,
 * logging, durable store with schema and stale-task recovery, event channels, task manager,
 * admission, coordinator, stream gateway and finally the http server. Recovery completes before
 * any request can be accepted.
 */
public class DocTrans {
  private static final Logger log = LoggingService.getLogger(DocTrans.class);

  static final String MAX_CONCURRENT_ENV = "MAX_CONCURRENT_TRANSLATIONS";

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private TaskManager taskManager;
  private ExecutionCoordinator coordinator;
  private TranslationService translationService;
  private StreamGateway streamGateway;
  private ExecutorService streamExecutor;
  private OwnerResolver ownerResolver;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public DocTrans(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    initialize(null);
  }

  /** @param engine engine to use, or null to run the configured {@code engine.command} */
  public void initialize(TranslationEngine engine) {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    Path dataDir = Path.of(configuration().getString("storage.dataDir", "data"));
    String dbFile = configuration().getString("storage.dbFile", null);
    Database database =
        new Database(
            dbFile == null || dbFile.isBlank() ? dataDir.resolve("users.db") : Path.of(dbFile));
    database.init();
    TaskStore store = new TaskStore(database);
    store.initSchema();
    int recovered = store.recoverStaleTasks(Instant.now());
    log.info(
        "Task store ready at {} ({} interrupted task(s) recovered)", database.dbFile(), recovered);

    EventChannelRegistry channels =
        new EventChannelRegistry(
            configuration()
                .getInt("execution.channelCapacity", EventChannelRegistry.DEFAULT_CAPACITY));
    TaskWorkspace workspace = new TaskWorkspace(dataDir);
    this.taskManager = new TaskManager(store, channels, workspace);

    int maxConcurrent = resolveMaxConcurrent(configuration(), System.getenv(MAX_CONCURRENT_ENV));
    AdmissionController admission = new AdmissionController(maxConcurrent);
    log.info("Running at most {} translation(s) concurrently", maxConcurrent);

    TranslationEngine effectiveEngine =
        engine != null ? engine : new ProcessTranslationEngine(engineCommand(configuration()));
    this.coordinator =
        new ExecutionCoordinator(
            taskManager, admission, new FileSettingsProvider(workspace), effectiveEngine);
    this.translationService = new TranslationService(taskManager, coordinator);

    this.streamGateway =
        new StreamGateway(
            taskManager,
            channels,
            Duration.ofSeconds(configuration().getLong("stream.keepaliveSeconds", 30L)));
    this.streamExecutor = newStreamPool();
    this.ownerResolver =
        OwnerResolver.fromHeaderOrParameter(
            configuration().getString("auth.ownerHeader", "X-DocTrans-User"),
            configuration().getString("auth.ownerParameter", "user"));

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new TranslationServer(this).register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
  }

  static int resolveMaxConcurrent(Configuration configuration, String envValue) {
    if (envValue != null && !envValue.isBlank()) {
      try {
        int value = Integer.parseInt(envValue.trim());
        if (value >= 1) return value;
      } catch (NumberFormatException e) {
        throw new ConfigException(MAX_CONCURRENT_ENV + " is not a number: " + envValue, e);
      }
      throw new ConfigException(MAX_CONCURRENT_ENV + " must be at least 1: " + envValue);
    }
    int value = configuration.getInt("execution.maxConcurrent", 1);
    if (value < 1) {
      throw new ConfigException("execution.maxConcurrent must be at least 1: " + value);
    }
    return value;
  }

  /** Open event streams each occupy one of these threads, never a Jetty request thread. */
  private static ExecutorService newStreamPool() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(
        r -> {
          Thread t = new Thread(r, "event-stream-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  private static List<String> engineCommand(Configuration configuration) {
    List<String> command = configuration.getList(String.class, "engine.command", List.of());
    if (command.isEmpty()) {
      throw new ConfigException("engine.command is not configured");
    }
    return command;
  }

  /**
   * Block the current thread until a shutdown signal is received, then release resources via
   * {@link #shutdown()}.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "doctrans-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down");
      try {
        if (httpServer != null) httpServer.close();
        if (streamExecutor != null) streamExecutor.shutdownNow();
        if (coordinator != null) coordinator.close();
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("DocTrans not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public TaskManager taskManager() {
    return taskManager;
  }

  public TranslationService translationService() {
    return translationService;
  }

  public StreamGateway streamGateway() {
    return streamGateway;
  }

  public Executor streamExecutor() {
    return streamExecutor;
  }

  public OwnerResolver ownerResolver() {
    return ownerResolver;
  }
}

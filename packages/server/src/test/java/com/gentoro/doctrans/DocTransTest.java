package com.gentoro.doctrans;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.doctrans.engine.EngineEvent;
import com.gentoro.doctrans.exception.ConfigException;
import com.gentoro.doctrans.store.Database;
import com.gentoro.doctrans.store.TaskStore;
import com.gentoro.doctrans.tasks.Task;
import com.gentoro.doctrans.tasks.TaskStatus;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Stream;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocTransTest {

  @TempDir Path temp;

  DocTrans app;

  @AfterEach
  void tearDown() {
    if (app != null) app.shutdown();
  }

  @Test
  void environmentOverridesConfiguredConcurrency() {
    YAMLConfiguration config = new YAMLConfiguration();
    assertEquals(1, DocTrans.resolveMaxConcurrent(config, null));
    config.setProperty("execution.maxConcurrent", 4);
    assertEquals(4, DocTrans.resolveMaxConcurrent(config, " "));
    assertEquals(3, DocTrans.resolveMaxConcurrent(config, "3"));
    assertThrows(ConfigException.class, () -> DocTrans.resolveMaxConcurrent(config, "0"));
    assertThrows(ConfigException.class, () -> DocTrans.resolveMaxConcurrent(config, "many"));
  }

  @Test
  @DisplayName("Boot recovers stale tasks, then serves a translation end to end")
  void bootsRecoversAndTranslates() throws Exception {
    Path dataDir = temp.resolve("data");
    seedStaleTask(dataDir);
    Path configFile = temp.resolve("application.yaml");
    Files.writeString(
        configFile,
        """
        http:
          hostname: 127.0.0.1
          port: 0
        storage:
          dataDir: %s
        stream:
          keepaliveSeconds: 1
        """
            .formatted(dataDir.toString().replace('\\', '/')));
    Path uploads = dataDir.resolve("users/alice/uploads");
    Files.createDirectories(uploads);
    Files.writeString(uploads.resolve("f1_paper.pdf"), "pdf");
    Path produced = temp.resolve("engine-out.pdf");

    app = new DocTrans(new String[] {"--config=" + configFile});
    app.initialize(
        (config, input) -> {
          try {
            Files.writeString(produced, "translated");
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
          return Stream.of(
              new EngineEvent.ProgressUpdate("Translate", 50, 1, 1, 1, 2),
              new EngineEvent.Finish(Map.of("mono", produced)));
        });

    Task stale = app.taskManager().get("stale").orElseThrow();
    assertEquals(TaskStatus.FAILED, stale.status());
    assertEquals(TaskStore.RESTART_ERROR, stale.errorDetail());

    String base = "http://127.0.0.1:" + app.httpServer().getPort() + "/api";
    HttpClient client = HttpClient.newHttpClient();
    HttpResponse<String> created =
        client.send(
            HttpRequest.newBuilder(URI.create(base + "/translate"))
                .header("X-DocTrans-User", "alice")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{\"file_id\": \"f1\"}"))
                .build(),
            HttpResponse.BodyHandlers.ofString());
    assertEquals(202, created.statusCode(), created.body());

    HttpResponse<String> history =
        client.send(
            HttpRequest.newBuilder(URI.create(base + "/translate/history?user=alice")).build(),
            HttpResponse.BodyHandlers.ofString());
    assertEquals(200, history.statusCode());
    assertTrue(history.body().contains("\"stale\""), history.body());

    String taskId = app.taskManager().listByOwner("alice").get(0).taskId();
    HttpResponse<String> events =
        client.send(
            HttpRequest.newBuilder(URI.create(base + "/translate/stream/" + taskId + "?user=alice"))
                .build(),
            HttpResponse.BodyHandlers.ofString());
    assertEquals(200, events.statusCode());
    assertTrue(events.body().contains("event: complete"), events.body());

    Task done = app.taskManager().get(taskId).orElseThrow();
    assertEquals(TaskStatus.COMPLETED, done.status());
    Path mono = Path.of(done.outputReferences().get("mono"));
    assertEquals("paper_mono.pdf", mono.getFileName().toString());
    assertEquals("translated", Files.readString(mono));
  }

  private static void seedStaleTask(Path dataDir) {
    Database database = new Database(dataDir.resolve("users.db"));
    database.init();
    TaskStore store = new TaskStore(database);
    store.initSchema();
    Task stale =
        new Task(
            "stale",
            "alice",
            TaskStatus.PROCESSING,
            35,
            "Layout (1/1, 1/3)",
            "f0",
            "old",
            Map.of(),
            null,
            null,
            Instant.now(),
            Instant.now(),
            null);
    database.inTransaction(conn -> store.insert(conn, stale));
  }
}

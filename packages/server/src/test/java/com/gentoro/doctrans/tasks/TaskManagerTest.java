package com.gentoro.doctrans.tasks;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.doctrans.channel.EventChannelRegistry;
import com.gentoro.doctrans.channel.Subscription;
import com.gentoro.doctrans.exception.NotFoundException;
import com.gentoro.doctrans.exception.StateException;
import com.gentoro.doctrans.exception.ValidationException;
import com.gentoro.doctrans.store.Database;
import com.gentoro.doctrans.store.TaskStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TaskManagerTest {

  /** Clock that only moves when told to. */
  static final class ManualClock extends Clock {
    private Instant now = Instant.parse("2024-06-01T12:00:00Z");

    void advance(Duration d) {
      now = now.plus(d);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  @TempDir Path temp;

  ManualClock clock;
  EventChannelRegistry channels;
  TaskWorkspace workspace;
  TaskManager manager;

  @BeforeEach
  void setup() {
    Database database = new Database(temp.resolve("users.db"));
    database.init();
    TaskStore store = new TaskStore(database);
    store.initSchema();
    clock = new ManualClock();
    channels = new EventChannelRegistry(4);
    workspace = new TaskWorkspace(temp);
    manager = new TaskManager(store, channels, workspace, clock);
  }

  private String newTask() {
    return manager.create("alice", "file-1", "paper", Map.of("lang_to", "de"));
  }

  private Task load(String taskId) {
    return manager.get(taskId).orElseThrow();
  }

  @Test
  void createPersistsQueuedTaskAndOpensChannel() {
    String id = newTask();

    Task t = load(id);
    assertEquals(TaskStatus.QUEUED, t.status());
    assertEquals(0, t.progress());
    assertEquals(TaskManager.QUEUED_MESSAGE, t.message());
    assertEquals(Map.of("lang_to", "de"), t.settingsSnapshot());
    assertEquals(clock.instant(), t.createdAt());
    assertNull(t.startedAt());
    assertNull(t.completedAt());
    assertTrue(channels.find(id).isPresent());
  }

  @Test
  void createRequiresOwner() {
    assertThrows(ValidationException.class, () -> manager.create(" ", "f", "d", Map.of()));
  }

  @Test
  @DisplayName("started_at is stamped once, on the first move to processing")
  void startedAtIsSetExactlyOnce() {
    String id = newTask();

    manager.updateProgress(id, 0, "Waiting in queue...", TaskStatus.QUEUED);
    assertNull(load(id).startedAt());

    clock.advance(Duration.ofSeconds(5));
    Instant started = clock.instant();
    manager.updateProgress(id, 0, "Loading user settings...");
    assertEquals(started, load(id).startedAt());

    clock.advance(Duration.ofSeconds(5));
    manager.updateProgress(id, 50, "Layout (1/1, 1/2)");
    assertEquals(started, load(id).startedAt());
  }

  @Test
  void progressIsValidated() {
    String id = newTask();
    assertThrows(ValidationException.class, () -> manager.updateProgress(id, -1, "x"));
    assertThrows(ValidationException.class, () -> manager.updateProgress(id, 101, "x"));
    assertThrows(
        ValidationException.class,
        () -> manager.updateProgress(id, 10, "x", TaskStatus.COMPLETED));
    assertEquals(TaskStatus.QUEUED, load(id).status());
  }

  @Test
  void progressWhileProcessingNeverDecreases() {
    String id = newTask();
    manager.updateProgress(id, 40, "a");
    manager.updateProgress(id, 20, "b");

    Task t = load(id);
    assertEquals(40, t.progress());
    assertEquals("b", t.message());
  }

  @Test
  void processingCannotReturnToQueued() {
    String id = newTask();
    manager.updateProgress(id, 10, "running");
    assertThrows(
        StateException.class, () -> manager.updateProgress(id, 10, "again", TaskStatus.QUEUED));
  }

  @Test
  void completeStoresOutputsAndClearsError() {
    String id = newTask();
    manager.updateProgress(id, 60, "running");
    clock.advance(Duration.ofSeconds(1));
    manager.complete(id, Map.of("mono", "/o/paper_mono.pdf"));

    Task t = load(id);
    assertEquals(TaskStatus.COMPLETED, t.status());
    assertEquals(100, t.progress());
    assertEquals(TaskManager.COMPLETED_MESSAGE, t.message());
    assertEquals(Map.of("mono", "/o/paper_mono.pdf"), t.outputReferences());
    assertNull(t.errorDetail());
    assertEquals(clock.instant(), t.completedAt());
  }

  @Test
  void failStoresDetailWithoutOutputs() {
    String id = newTask();
    manager.updateProgress(id, 30, "running");
    manager.fail(id, "OCR timeout");

    Task t = load(id);
    assertEquals(TaskStatus.FAILED, t.status());
    assertEquals("OCR timeout", t.errorDetail());
    assertEquals("Translation failed: OCR timeout", t.message());
    assertNull(t.outputReferences());
    assertEquals(30, t.progress());
  }

  @Test
  void queuedTaskCanFailButNotComplete() {
    String a = newTask();
    assertThrows(StateException.class, () -> manager.complete(a, Map.of()));
    manager.fail(a, "rejected");
    assertEquals(TaskStatus.FAILED, load(a).status());
  }

  @Test
  void terminalTasksRejectEveryMutation() {
    String id = newTask();
    manager.updateProgress(id, 10, "running");
    manager.complete(id, Map.of());

    assertThrows(StateException.class, () -> manager.updateProgress(id, 50, "late"));
    assertThrows(StateException.class, () -> manager.complete(id, Map.of()));
    assertThrows(StateException.class, () -> manager.fail(id, "late"));
    assertEquals(TaskStatus.COMPLETED, load(id).status());
  }

  @Test
  void unknownTaskIsNotFound() {
    assertThrows(NotFoundException.class, () -> manager.updateProgress("nope", 1, "x"));
    assertThrows(NotFoundException.class, () -> manager.fail("nope", "x"));
    assertTrue(manager.get("nope").isEmpty());
  }

  @Test
  void ownerScopedLookupHidesOtherOwnersTasks() {
    String id = newTask();
    assertEquals(id, manager.get(id, "alice").taskId());
    assertThrows(NotFoundException.class, () -> manager.get(id, "bob"));
  }

  @Test
  void eventsCarryThePersistedState() throws Exception {
    String id = newTask();
    try (Subscription sub = channels.subscribe(id)) {
      manager.updateProgress(id, 40, "a");
      manager.updateProgress(id, 20, "b");
      manager.complete(id, Map.of("dual", "/d.pdf"));

      TaskEvent first = sub.poll(Duration.ofSeconds(1));
      TaskEvent second = sub.poll(Duration.ofSeconds(1));
      TaskEvent last = sub.poll(Duration.ofSeconds(1));
      assertEquals(40, first.progress());
      assertEquals(40, second.progress());
      assertEquals("b", second.message());
      assertEquals(TaskEvent.Type.COMPLETE, last.type());
      assertEquals(Map.of("dual", "/d.pdf"), last.outputReferences());
    }
  }

  @Test
  void fullChannelNeverFailsTheDurableWrite() {
    String id = newTask();
    Subscription slow = channels.subscribe(id);
    for (int i = 1; i <= 20; i++) {
      manager.updateProgress(id, i, "step " + i);
    }
    manager.complete(id, Map.of());

    assertEquals(TaskStatus.COMPLETED, load(id).status());
    slow.close();
  }

  @Test
  void deleteRemovesRecordArtifactsAndChannel() throws Exception {
    String id = newTask();
    Path out = workspace.createOutputDir("alice", id);
    Files.writeString(out.resolve("paper_mono.pdf"), "pdf");
    Files.createDirectories(workspace.uploadDir("alice"));
    Path upload = workspace.uploadDir("alice").resolve("file-1_paper.pdf");
    Files.writeString(upload, "pdf");
    manager.complete(id, Map.of("mono", out.resolve("paper_mono.pdf").toString()));

    assertFalse(manager.delete(id, "bob"));
    assertTrue(manager.get(id).isPresent());

    assertTrue(manager.delete(id, "alice"));
    assertTrue(manager.get(id).isEmpty());
    assertFalse(Files.exists(out));
    assertFalse(Files.exists(upload));
    assertTrue(channels.find(id).isEmpty());
    assertFalse(manager.delete(id, "alice"));
  }

  @Test
  @DisplayName("A queued or running task cannot be deleted and keeps its artifacts")
  void deleteOfUnfinishedTaskIsRejected() throws Exception {
    String queued = newTask();
    String running = newTask();
    manager.updateProgress(running, 30, "Translate (1/1, 2/6)");
    Path out = workspace.createOutputDir("alice", running);
    Files.writeString(out.resolve("partial.pdf"), "pdf");

    assertThrows(StateException.class, () -> manager.delete(queued, "alice"));
    assertThrows(StateException.class, () -> manager.delete(running, "alice"));

    assertTrue(Files.exists(out.resolve("partial.pdf")));
    assertEquals(TaskStatus.PROCESSING, load(running).status());
    assertEquals(TaskStatus.QUEUED, load(queued).status());

    manager.fail(running, "OCR timeout");
    assertTrue(manager.delete(running, "alice"));
    assertFalse(Files.exists(out));
  }

  @Test
  void listByOwnerIsNewestFirst() {
    String first = newTask();
    clock.advance(Duration.ofSeconds(1));
    String second = newTask();
    manager.create("bob", "f", "other", Map.of());

    var ids = manager.listByOwner("alice").stream().map(Task::taskId).toList();
    assertEquals(java.util.List.of(second, first), ids);
  }

  @Test
  @DisplayName("Random operation sequences only ever take legal edges")
  void randomOperationsRespectTheStateMachine() {
    Random random = new Random(42);
    for (int run = 0; run < 25; run++) {
      String id = newTask();
      TaskStatus previous = TaskStatus.QUEUED;
      int previousProgress = 0;
      for (int step = 0; step < 12; step++) {
        try {
          switch (random.nextInt(5)) {
            case 0 -> manager.updateProgress(id, random.nextInt(101), "q", TaskStatus.QUEUED);
            case 1, 2 -> manager.updateProgress(id, random.nextInt(101), "p");
            case 3 -> manager.complete(id, Map.of("mono", "/m.pdf"));
            default -> manager.fail(id, "boom");
          }
        } catch (StateException expected) {
          // rejected edges leave the record untouched
        }
        Task t = load(id);
        assertTrue(
            previous == t.status() || previous.canTransitionTo(t.status()),
            previous + " -> " + t.status());
        if (previous.isTerminal()) {
          assertEquals(previous, t.status());
        }
        if (previous == TaskStatus.PROCESSING && t.status() == TaskStatus.PROCESSING) {
          assertTrue(t.progress() >= previousProgress);
        }
        assertFalse(t.outputReferences() != null && t.errorDetail() != null);
        previous = t.status();
        previousProgress = t.progress();
      }
    }
  }
}

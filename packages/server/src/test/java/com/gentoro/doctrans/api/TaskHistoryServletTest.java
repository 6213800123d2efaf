package com.gentoro.doctrans.api;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.doctrans.exception.StateException;
import com.gentoro.doctrans.tasks.Task;
import com.gentoro.doctrans.tasks.TaskManager;
import com.gentoro.doctrans.tasks.TaskStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class TaskHistoryServletTest {

  TaskManager tasks;
  ServletTester tester;

  @BeforeEach
  void setup() throws Exception {
    tasks = mock(TaskManager.class);
    tester = new ServletTester();
    tester.addServlet(
        new ServletHolder(
            new TaskHistoryServlet(
                tasks, OwnerResolver.fromHeaderOrParameter("X-DocTrans-User", "user"))),
        "/translate/history/*");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private HttpTester.Response send(String method, String uri) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod(method);
    req.setURI(uri);
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "tester");
    req.setHeader("X-DocTrans-User", "alice");
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  private static Task task(String id, TaskStatus status, String error) {
    return new Task(
        id,
        "alice",
        status,
        10,
        "",
        "f-" + id,
        "doc " + id,
        Map.of(),
        null,
        error,
        Instant.parse("2024-06-01T12:00:00Z"),
        null,
        null);
  }

  @Test
  void listImportsLegacyHistoryFirst() throws Exception {
    when(tasks.listByOwner("alice"))
        .thenReturn(
            List.of(
                task("b", TaskStatus.FAILED, "OCR timeout"), task("a", TaskStatus.QUEUED, null)));

    HttpTester.Response resp = send("GET", "/translate/history");

    assertEquals(200, resp.getStatus());
    String body = resp.getContent();
    assertTrue(body.indexOf("\"task_id\":\"b\"") < body.indexOf("\"task_id\":\"a\""), body);
    assertTrue(body.contains("OCR timeout"), body);
    InOrder order = inOrder(tasks);
    order.verify(tasks).importLegacyHistory("alice");
    order.verify(tasks).listByOwner("alice");
  }

  @Test
  void deleteRemovesOwnedTask() throws Exception {
    when(tasks.delete("t1", "alice")).thenReturn(true);

    assertEquals(200, send("DELETE", "/translate/history/t1").getStatus());
    verify(tasks).delete("t1", "alice");
  }

  @Test
  void deleteOfRunningTaskIsConflict() throws Exception {
    when(tasks.delete("t2", "alice"))
        .thenThrow(new StateException("Task t2 is still processing and cannot be deleted"));

    HttpTester.Response resp = send("DELETE", "/translate/history/t2");

    assertEquals(409, resp.getStatus());
    assertTrue(resp.getContent().contains("STATE_ERROR"), resp.getContent());
  }

  @Test
  void deleteOfUnknownTaskIsNotFound() throws Exception {
    when(tasks.delete("t9", "alice")).thenReturn(false);

    assertEquals(404, send("DELETE", "/translate/history/t9").getStatus());
  }
}

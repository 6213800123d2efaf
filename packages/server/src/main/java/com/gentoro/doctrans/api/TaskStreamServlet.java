package com.gentoro.doctrans.api;

import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.stream.EventSink;
import com.gentoro.doctrans.stream.StreamGateway;
import com.gentoro.doctrans.tasks.TaskEvent;
import com.gentoro.doctrans.utility.JacksonUtility;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;

/**
 * GET /api/translate/stream/{id}: Server-Sent Events for one task.
 *
 * <p>Event names are {@code progress}, {@code complete}, {@code error} and the keepalive {@code
 * ping}. The owner is usually passed as a query parameter since {@code EventSource} cannot send
 * headers.
 *
 * <p>Streams run in async mode on {@code streams}, so open streams never hold Jetty request
 * threads; the servlet must be registered with async support.
 */
public final class TaskStreamServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(TaskStreamServlet.class);

  private final StreamGateway gateway;
  private final OwnerResolver owners;
  private final Executor streams;

  public TaskStreamServlet(StreamGateway gateway, OwnerResolver owners, Executor streams) {
    this.gateway = gateway;
    this.owners = owners;
    this.streams = streams;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<String> owner = ApiResponses.requireOwner(owners, req, resp);
    if (owner.isEmpty()) return;
    String taskId = ApiResponses.pathId(req);
    if (taskId == null) {
      ApiResponses.writeError(resp, 400, "Missing task id", "VALIDATION_ERROR");
      return;
    }

    AsyncContext async = req.startAsync();
    async.setTimeout(0);
    try {
      streams.execute(() -> stream(async, taskId, owner.get()));
    } catch (RejectedExecutionException e) {
      log.warn("Refusing stream of task {}: stream executor is shut down", taskId);
      ApiResponses.writeError(resp, 503, "Server is shutting down", "UNAVAILABLE");
      async.complete();
    }
  }

  private void stream(AsyncContext async, String taskId, String owner) {
    HttpServletResponse resp = (HttpServletResponse) async.getResponse();
    SseSink sink = new SseSink(resp);
    try {
      gateway.attach(taskId, owner, sink);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Stream of task {} interrupted", taskId);
    } catch (Exception e) {
      if (sink.started) {
        log.warn("Stream of task {} aborted", taskId, e);
      } else {
        writeFailure(resp, taskId, e);
      }
    } finally {
      async.complete();
    }
  }

  private static void writeFailure(HttpServletResponse resp, String taskId, Exception failure) {
    try {
      ApiResponses.writeFailure(resp, failure);
    } catch (IOException e) {
      log.debug("Could not report stream failure of task {}: {}", taskId, e.getMessage());
    }
  }

  /** Writes {@code event:}/{@code data:} frames, committing the response on the first write. */
  static final class SseSink implements EventSink {
    private final HttpServletResponse resp;
    private ServletOutputStream out;
    private boolean started;

    SseSink(HttpServletResponse resp) {
      this.resp = resp;
    }

    @Override
    public void send(TaskEvent event) throws IOException {
      write(event.type().wireName(), JacksonUtility.toJson(event.toPayload()));
    }

    @Override
    public void keepalive() throws IOException {
      write("ping", "");
    }

    private void write(String event, String data) throws IOException {
      if (!started) {
        resp.setStatus(200);
        resp.setContentType("text/event-stream");
        resp.setCharacterEncoding("UTF-8");
        resp.setHeader("Cache-Control", "no-cache");
        resp.setHeader("X-Accel-Buffering", "no");
        out = resp.getOutputStream();
        started = true;
      }
      String frame = "event: " + event + "\ndata: " + data + "\n\n";
      out.write(frame.getBytes(StandardCharsets.UTF_8));
      out.flush();
    }
  }
}

package com.gentoro.doctrans.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.doctrans.exception.DocTransErrorCode;
import com.gentoro.doctrans.exception.ErrorDetails;
import com.gentoro.doctrans.exception.ExceptionUtil;
import com.gentoro.doctrans.logging.LoggingService;
import com.gentoro.doctrans.tasks.Task;
import com.gentoro.doctrans.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/** JSON response helpers shared by the translation servlets. */
final class ApiResponses {
  private static final Logger log = LoggingService.getLogger(ApiResponses.class);

  private ApiResponses() {}

  static void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(JacksonUtility.toJson(body));
  }

  static void writeError(HttpServletResponse resp, int status, String message, String code)
      throws IOException {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("error", message);
    node.put("code", code);
    writeJson(resp, status, node);
  }

  /** Map a failure to its HTTP status and write it as {@code {"error", "code"}}. */
  static void writeFailure(HttpServletResponse resp, Throwable t) throws IOException {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    int status = statusOf(details.code());
    if (status >= 500) {
      log.error("Request failed", t);
    }
    String message = details.message();
    if (message == null || message.isBlank()) message = "Internal error";
    writeError(resp, status, message, details.code().name());
  }

  static int statusOf(DocTransErrorCode code) {
    return switch (code) {
      case VALIDATION_ERROR -> 400;
      case NOT_FOUND -> 404;
      case STATE_ERROR -> 409;
      default -> 500;
    };
  }

  /** The requesting owner, or empty after a 401 response has been written. */
  static Optional<String> requireOwner(
      OwnerResolver owners, HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<String> owner = owners.resolve(req);
    if (owner.isEmpty()) {
      writeError(resp, 401, "Not authenticated", "UNAUTHENTICATED");
    }
    return owner;
  }

  /** Path segment after the servlet mapping, or null when absent. */
  static String pathId(HttpServletRequest req) {
    String info = req.getPathInfo();
    if (info == null || info.length() <= 1) return null;
    String id = info.substring(1);
    return id.contains("/") ? null : id;
  }

  static ObjectNode taskView(Task task) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("task_id", task.taskId());
    node.put("file_id", task.inputReference());
    node.put("filename", task.displayName());
    node.put("status", task.status().wireValue());
    node.put("progress", task.progress());
    node.put("message", task.message());
    putInstant(node, "created_at", task.createdAt());
    putInstant(node, "started_at", task.startedAt());
    putInstant(node, "completed_at", task.completedAt());
    if (task.outputReferences() != null) {
      ObjectNode outputs = node.putObject("output_files");
      for (Map.Entry<String, String> e : task.outputReferences().entrySet()) {
        outputs.put(e.getKey(), e.getValue());
      }
    }
    if (task.errorDetail() != null) node.put("error", task.errorDetail());
    return node;
  }

  private static void putInstant(ObjectNode node, String field, Instant value) {
    if (value != null) node.put(field, value.toString());
  }
}

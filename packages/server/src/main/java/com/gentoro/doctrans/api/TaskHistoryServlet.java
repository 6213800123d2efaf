package com.gentoro.doctrans.api;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.doctrans.tasks.Task;
import com.gentoro.doctrans.tasks.TaskManager;
import com.gentoro.doctrans.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/**
 * GET /api/translate/history lists the owner's tasks, newest first, after importing any legacy
 * history file. DELETE /api/translate/history/{id} removes a task with its files.
 */
public final class TaskHistoryServlet extends HttpServlet {
  private final TaskManager tasks;
  private final OwnerResolver owners;

  public TaskHistoryServlet(TaskManager tasks, OwnerResolver owners) {
    this.tasks = tasks;
    this.owners = owners;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<String> owner = ApiResponses.requireOwner(owners, req, resp);
    if (owner.isEmpty()) return;
    try {
      tasks.importLegacyHistory(owner.get());
      ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
      ArrayNode history = node.putArray("history");
      for (Task task : tasks.listByOwner(owner.get())) {
        history.add(ApiResponses.taskView(task));
      }
      ApiResponses.writeJson(resp, 200, node);
    } catch (Exception e) {
      ApiResponses.writeFailure(resp, e);
    }
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<String> owner = ApiResponses.requireOwner(owners, req, resp);
    if (owner.isEmpty()) return;
    String taskId = ApiResponses.pathId(req);
    if (taskId == null) {
      ApiResponses.writeError(resp, 400, "Missing task id", "VALIDATION_ERROR");
      return;
    }
    try {
      if (!tasks.delete(taskId, owner.get())) {
        ApiResponses.writeError(resp, 404, "History item not found", "NOT_FOUND");
        return;
      }
      ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
      node.put("task_id", taskId);
      node.put("message", "History item deleted");
      ApiResponses.writeJson(resp, 200, node);
    } catch (Exception e) {
      ApiResponses.writeFailure(resp, e);
    }
  }
}

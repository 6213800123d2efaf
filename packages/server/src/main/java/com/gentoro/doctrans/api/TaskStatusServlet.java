package com.gentoro.doctrans.api;

import com.gentoro.doctrans.tasks.TaskManager;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/** GET /api/translate/status/{id}: polling fallback for clients without SSE. */
public final class TaskStatusServlet extends HttpServlet {
  private final TaskManager tasks;
  private final OwnerResolver owners;

  public TaskStatusServlet(TaskManager tasks, OwnerResolver owners) {
    this.tasks = tasks;
    this.owners = owners;
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
    try {
      ApiResponses.writeJson(resp, 200, ApiResponses.taskView(tasks.get(taskId, owner.get())));
    } catch (Exception e) {
      ApiResponses.writeFailure(resp, e);
    }
  }
}

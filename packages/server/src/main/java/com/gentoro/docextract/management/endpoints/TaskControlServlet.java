package com.gentoro.docextract.management.endpoints;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docextract.tasks.TaskRegistry;
import com.gentoro.docextract.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** POST /api/tasks/{id}/pause|resume|stop: idempotent task control. */
public final class TaskControlServlet extends HttpServlet {
  private final TaskRegistry tasks;

  public TaskControlServlet(TaskRegistry tasks) {
    this.tasks = tasks;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String tail = ServletSupport.pathTail(req.getPathInfo());
    String[] parts = tail == null ? new String[0] : tail.split("/");
    if (parts.length != 2 || parts[0].isBlank()) {
      ServletSupport.writeError(resp, 400, "Expected /{taskId}/pause|resume|stop");
      return;
    }
    String taskId = parts[0];
    boolean known;
    switch (parts[1]) {
      case "pause" -> known = tasks.pause(taskId);
      case "resume" -> known = tasks.resume(taskId);
      case "stop" -> known = tasks.stop(taskId);
      default -> {
        ServletSupport.writeError(resp, 400, "Unknown action: " + parts[1]);
        return;
      }
    }
    if (!known) {
      ServletSupport.writeError(resp, 404, "Unknown taskId");
      return;
    }
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("ok", true);
    ServletSupport.writeJson(resp, 200, node);
  }
}

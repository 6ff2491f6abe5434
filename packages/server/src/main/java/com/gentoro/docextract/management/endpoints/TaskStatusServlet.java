package com.gentoro.docextract.management.endpoints;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docextract.pipeline.ItemError;
import com.gentoro.docextract.tasks.TaskRegistry;
import com.gentoro.docextract.tasks.TaskView;
import com.gentoro.docextract.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/** GET /api/tasks/status/{id}: progress, errors, control flags and usage of a task. */
public final class TaskStatusServlet extends HttpServlet {
  private final TaskRegistry tasks;

  public TaskStatusServlet(TaskRegistry tasks) {
    this.tasks = tasks;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String taskId = ServletSupport.pathTail(req.getPathInfo());
    if (taskId == null) {
      ServletSupport.writeError(resp, 400, "Missing taskId");
      return;
    }
    Optional<TaskView> view = tasks.view(taskId);
    if (view.isEmpty()) {
      ServletSupport.writeError(resp, 404, "Unknown taskId");
      return;
    }
    ServletSupport.writeJson(resp, 200, toJson(view.get()));
  }

  static ObjectNode toJson(TaskView v) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("id", v.id());
    node.put("name", v.name());
    node.put("mode", v.mode());
    node.put("status", v.status().name());
    node.put("total", v.total());
    node.put("done", v.done());
    node.put("embedded", v.embedded());
    node.put("pages", v.pages());

    ArrayNode errors = node.putArray("errors");
    for (ItemError e : v.errors()) {
      errors.addObject().put("item", e.item()).put("reason", e.reason());
    }
    ObjectNode control = node.putObject("control");
    control.put("paused", v.paused());
    control.put("stop", v.stopRequested());

    ObjectNode usage = node.putObject("usage");
    usage.put("prompt", v.usage().prompt());
    usage.put("completion", v.usage().completion());
    usage.put("total", v.usage().total());

    node.put("elapsedSeconds", Math.round(v.elapsedSeconds() * 10) / 10.0);
    node.put("resultAvailable", v.resultAvailable());
    if (v.message() != null) node.put("message", v.message());
    if (v.createdAt() != null) node.put("createdAt", v.createdAt().toString());
    if (v.startedAt() != null) node.put("startedAt", v.startedAt().toString());
    if (v.finishedAt() != null) node.put("finishedAt", v.finishedAt().toString());
    return node;
  }
}

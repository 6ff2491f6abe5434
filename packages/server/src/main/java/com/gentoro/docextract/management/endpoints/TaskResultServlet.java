package com.gentoro.docextract.management.endpoints;

import com.gentoro.docextract.tasks.TaskRegistry;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** GET /api/tasks/result/{id}: the written document of a finished task. */
public final class TaskResultServlet extends HttpServlet {
  private final TaskRegistry tasks;

  public TaskResultServlet(TaskRegistry tasks) {
    this.tasks = tasks;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String taskId = ServletSupport.pathTail(req.getPathInfo());
    if (taskId == null) {
      ServletSupport.writeError(resp, 400, "Missing taskId");
      return;
    }
    Optional<Path> result = tasks.result(taskId);
    if (result.isEmpty() || !Files.isRegularFile(result.get())) {
      ServletSupport.writeError(resp, 404, "No result available for task " + taskId);
      return;
    }
    Path file = result.get();
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.setHeader(
        "Content-Disposition", "attachment; filename=\"%s\"".formatted(file.getFileName()));
    resp.setContentLengthLong(Files.size(file));
    Files.copy(file, resp.getOutputStream());
  }
}

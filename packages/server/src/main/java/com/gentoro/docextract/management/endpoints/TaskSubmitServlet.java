package com.gentoro.docextract.management.endpoints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docextract.exception.DocExtractException;
import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.source.SourceFactory;
import com.gentoro.docextract.source.SourceMode;
import com.gentoro.docextract.source.WorkItemSource;
import com.gentoro.docextract.tasks.TaskRegistry;
import com.gentoro.docextract.tasks.TaskRequest;
import com.gentoro.docextract.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * POST /api/tasks
 *
 * <p>Submits a batch for extraction. The body names exactly one input:
 *
 * <pre>
 * {"name": "report", "mode": "text|table", "directory": "/data/scans"}
 * {"images": ["/data/a.png", "/data/b.png"], "mode": "table"}
 * {"pdf": "/data/report.pdf", "source": "embedded|page|both"}
 * </pre>
 *
 * Answers {@code 202 {"taskId": "..."}}, or 400 for an invalid body.
 */
public final class TaskSubmitServlet extends HttpServlet {
  private final TaskRegistry tasks;
  private final SourceFactory sources;

  public TaskSubmitServlet(TaskRegistry tasks, SourceFactory sources) {
    this.tasks = tasks;
    this.sources = sources;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JsonNode body;
    try {
      body = JacksonUtility.getJsonMapper().readTree(req.getInputStream());
    } catch (JsonProcessingException e) {
      ServletSupport.writeError(resp, 400, "Request body is not valid JSON");
      return;
    }
    if (body == null || !body.isObject()) {
      ServletSupport.writeError(resp, 400, "Request body must be a JSON object");
      return;
    }

    String taskId;
    try {
      WorkItemSource source = resolveSource(body);
      if (source == null) {
        ServletSupport.writeError(
            resp, 400, "Exactly one of 'directory', 'images' or 'pdf' is required");
        return;
      }
      ExtractionMode mode = ExtractionMode.fromString(body.path("mode").asText(null));
      taskId = tasks.submit(new TaskRequest(body.path("name").asText(null), mode, source));
    } catch (DocExtractException | IllegalArgumentException e) {
      ServletSupport.writeError(resp, 400, e.getMessage());
      return;
    }

    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("taskId", taskId);
    node.put("status", "accepted");
    ServletSupport.writeJson(resp, 202, node);
  }

  private WorkItemSource resolveSource(JsonNode body) {
    int inputs =
        (body.hasNonNull("directory") ? 1 : 0)
            + (body.hasNonNull("images") ? 1 : 0)
            + (body.hasNonNull("pdf") ? 1 : 0);
    if (inputs != 1) {
      return null;
    }
    if (body.hasNonNull("directory")) {
      return sources.forDirectory(Path.of(body.get("directory").asText()));
    }
    if (body.hasNonNull("pdf")) {
      SourceMode mode =
          body.hasNonNull("source") ? SourceMode.fromString(body.get("source").asText()) : null;
      return sources.forPdf(Path.of(body.get("pdf").asText()), mode);
    }
    List<Path> images = new ArrayList<>();
    for (JsonNode image : body.get("images")) {
      images.add(Path.of(image.asText()));
    }
    return sources.forImages(images);
  }
}

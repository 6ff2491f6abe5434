package com.gentoro.docextract.output;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docextract.content.ContentInterchange;
import com.gentoro.docextract.exception.OutputException;
import com.gentoro.docextract.pipeline.ItemError;
import com.gentoro.docextract.pipeline.OrderedResult;
import com.gentoro.docextract.pipeline.PipelineResult;
import com.gentoro.docextract.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a run as one JSON document in the content interchange format:
 *
 * <pre>
 * {
 *   "name": "...", "mode": "text", "empty": false, "stopped": false,
 *   "total": 3, "done": 3,
 *   "usage": {"prompt": 0, "completion": 0, "total": 0},
 *   "items": [{"index": 0, "image": "page-001.png", "content": [...]}],
 *   "errors": [{"item": "page-002.png", "reason": "no_content"}]
 * }
 * </pre>
 *
 * Table-mode items carry {@code "tables"} instead of {@code "content"}. {@code "empty"} is set when
 * no item produced anything, so renderers can show a "nothing recognized" notice.
 */
public class JsonDocumentWriter implements DocumentWriter {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(JsonDocumentWriter.class);

  private final Path outputDirectory;

  public JsonDocumentWriter(Path outputDirectory) {
    this.outputDirectory = outputDirectory;
  }

  @Override
  public Path write(String baseName, String title, PipelineResult result) {
    Path target = outputDirectory.resolve(safeFileName(baseName) + ".json");
    try {
      Files.createDirectories(outputDirectory);
      JacksonUtility.getJsonMapper()
          .writerWithDefaultPrettyPrinter()
          .writeValue(target.toFile(), toJson(title, result));
    } catch (IOException e) {
      throw new OutputException("Unable to write document " + target, e);
    }
    log.info(
        "Wrote {} item(s) to {}{}",
        result.results().size(),
        target,
        result.isEmpty() ? " (nothing recognized)" : "");
    return target;
  }

  ObjectNode toJson(String title, PipelineResult result) {
    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
    root.put("name", title);
    root.put("mode", result.mode().wireName());
    root.put("empty", result.isEmpty());
    root.put("stopped", result.stopped());
    root.put("total", result.total());
    root.put("done", result.done());
    ObjectNode usage = root.putObject("usage");
    usage.put("prompt", result.usage().prompt());
    usage.put("completion", result.usage().completion());
    usage.put("total", result.usage().total());

    ArrayNode items = root.putArray("items");
    String field = result.mode().payloadField();
    for (OrderedResult r : result.results()) {
      ObjectNode item = items.addObject();
      item.put("index", r.item().sequenceIndex());
      item.put("image", r.item().name());
      item.set(field, ContentInterchange.toJson(r.content()));
    }

    ArrayNode errors = root.putArray("errors");
    for (ItemError e : result.errors()) {
      errors.addObject().put("item", e.item()).put("reason", e.reason());
    }
    return root;
  }

  static String safeFileName(String name) {
    String cleaned = name == null ? "" : name.trim().replaceAll("[\\\\/:*?\"<>|\\s]+", "_");
    return cleaned.isEmpty() ? "document" : cleaned;
  }
}

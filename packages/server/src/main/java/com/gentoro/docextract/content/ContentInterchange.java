package com.gentoro.docextract.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docextract.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Conversion between content nodes and the JSON interchange shape shared with the extraction
 * service and the document writers:
 *
 * <pre>
 * {"type": "h1"|"h2"|"h3", "text": "..."}
 * {"type": "paragraph", "text": "..."}
 * {"type": "list", "items": ["...", ...]}
 * {"type": "table", "rows": [["...", ...], ...]}
 * </pre>
 *
 * Table mode uses {@code {"name": "...", "rows": [[...], ...]}} per table.
 */
public final class ContentInterchange {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(ContentInterchange.class);

  private ContentInterchange() {}

  /**
   * Reads one node. Entries without a type are paragraphs, blank text and empty lists or tables
   * are dropped, and unknown types are ignored.
   */
  public static Optional<ContentNode> readNode(JsonNode entry) {
    if (entry == null || entry.isNull()) {
      return Optional.empty();
    }
    if (entry.isTextual()) {
      return StringUtils.isBlank(entry.asText())
          ? Optional.empty()
          : Optional.of(new ContentNode.Paragraph(entry.asText()));
    }
    if (!entry.isObject()) {
      return Optional.empty();
    }

    String type = entry.path("type").asText("paragraph").trim().toLowerCase(Locale.ROOT);
    switch (type) {
      case "h1", "h2", "h3" -> {
        String text = cell(entry.get("text"));
        return text.isBlank()
            ? Optional.empty()
            : Optional.of(new ContentNode.Heading(type.charAt(1) - '0', text));
      }
      case "paragraph", "" -> {
        String text = cell(entry.get("text"));
        return text.isBlank() ? Optional.empty() : Optional.of(new ContentNode.Paragraph(text));
      }
      case "list" -> {
        List<String> items = new ArrayList<>();
        for (JsonNode item : entry.path("items")) {
          String text = cell(item);
          if (!text.isBlank()) {
            items.add(text);
          }
        }
        return items.isEmpty() ? Optional.empty() : Optional.of(new ContentNode.ListBlock(items));
      }
      case "table" -> {
        List<List<String>> rows = readRows(entry.get("rows"));
        return rows.isEmpty() ? Optional.empty() : Optional.of(new ContentNode.Table(rows));
      }
      default -> {
        log.debug("Ignoring content node of unknown type '{}'", type);
        return Optional.empty();
      }
    }
  }

  public static List<ContentNode> readNodes(JsonNode array) {
    List<ContentNode> nodes = new ArrayList<>();
    if (array == null || !array.isArray()) {
      return nodes;
    }
    for (JsonNode entry : array) {
      readNode(entry).ifPresent(nodes::add);
    }
    return nodes;
  }

  /** Reads named tables; a missing name becomes {@code "Table <n>"} by position. */
  public static List<NamedTable> readTables(JsonNode array) {
    List<NamedTable> tables = new ArrayList<>();
    if (array == null || !array.isArray()) {
      return tables;
    }
    int index = 0;
    for (JsonNode entry : array) {
      index++;
      if (!entry.isObject()) {
        continue;
      }
      List<List<String>> rows = readRows(entry.get("rows"));
      if (rows.isEmpty()) {
        continue;
      }
      String name = cell(entry.get("name"));
      tables.add(new NamedTable(name.isBlank() ? "Table " + index : name, rows));
    }
    return tables;
  }

  /** Rows that are not arrays are skipped. */
  static List<List<String>> readRows(JsonNode rowsNode) {
    List<List<String>> rows = new ArrayList<>();
    if (rowsNode == null || !rowsNode.isArray()) {
      return rows;
    }
    for (JsonNode row : rowsNode) {
      if (!row.isArray()) {
        continue;
      }
      List<String> cells = new ArrayList<>(row.size());
      for (JsonNode c : row) {
        cells.add(cell(c));
      }
      rows.add(cells);
    }
    return rows;
  }

  private static String cell(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return "";
    }
    if (node.isValueNode()) {
      return node.asText();
    }
    return node.toString();
  }

  public static ObjectNode toJson(ContentNode node) {
    ObjectNode json = JacksonUtility.getJsonMapper().createObjectNode();
    json.put("type", node.type());
    if (node instanceof ContentNode.Heading h) {
      json.put("text", h.text());
    } else if (node instanceof ContentNode.Paragraph p) {
      json.put("text", p.text());
    } else if (node instanceof ContentNode.ListBlock l) {
      ArrayNode items = json.putArray("items");
      l.items().forEach(items::add);
    } else if (node instanceof ContentNode.Table t) {
      writeRows(json.putArray("rows"), t.rows());
    }
    return json;
  }

  public static ArrayNode toJson(ContentBatch batch) {
    ArrayNode array = JacksonUtility.getJsonMapper().createArrayNode();
    batch.nodes().forEach(n -> array.add(toJson(n)));
    return array;
  }

  public static ArrayNode toJson(TableSet tableSet) {
    ArrayNode array = JacksonUtility.getJsonMapper().createArrayNode();
    for (NamedTable table : tableSet.tables()) {
      ObjectNode json = array.addObject();
      json.put("name", table.name());
      writeRows(json.putArray("rows"), table.rows());
    }
    return array;
  }

  public static ArrayNode toJson(ExtractedContent content) {
    if (content instanceof TableSet tables) {
      return toJson(tables);
    }
    return toJson((ContentBatch) content);
  }

  private static void writeRows(ArrayNode target, List<List<String>> rows) {
    for (List<String> row : rows) {
      ArrayNode cells = target.addArray();
      row.forEach(cells::add);
    }
  }
}

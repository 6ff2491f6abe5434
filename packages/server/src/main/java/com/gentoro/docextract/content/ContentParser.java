package com.gentoro.docextract.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns the free-form answer of the extraction service into structured content.
 *
 * <p>Models do not always follow the requested schema, so the payload is located with a chain of
 * strategies and the first one that yields the expected top-level field wins:
 *
 * <ol>
 *   <li>the whole answer parsed as JSON;
 *   <li>the body of each fenced code block ({@code ```json} blocks first);
 *   <li>the substring from the first {@code {} to the last {@code }}.
 * </ol>
 *
 * When no JSON payload is found, table mode tries Markdown pipe tables and then comma separated
 * lines and otherwise reports no tables; text mode turns every non-blank line into a paragraph, so
 * a non-blank answer never yields an empty batch. Parsing never throws.
 */
public class ContentParser {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(ContentParser.class);

  private static final Pattern JSON_FENCE =
      Pattern.compile("```json\\s*(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern ANY_FENCE = Pattern.compile("```\\s*(.*?)```", Pattern.DOTALL);
  private static final Pattern OBJECT_BLOCK = Pattern.compile("\\{[\\s\\S]*\\}");

  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public ExtractedContent parse(String raw, ExtractionMode mode) {
    return mode == ExtractionMode.TABLE ? parseTables(raw) : parseContent(raw);
  }

  public ContentBatch parseContent(String raw) {
    if (StringUtils.isBlank(raw)) {
      return ContentBatch.EMPTY;
    }
    Optional<JsonNode> payload = locatePayload(raw, ExtractionMode.TEXT.payloadField());
    if (payload.isPresent()) {
      return new ContentBatch(ContentInterchange.readNodes(payload.get()));
    }

    log.debug("No JSON content payload found, falling back to one paragraph per line");
    List<ContentNode> nodes = new ArrayList<>();
    for (String line : DelimitedTableParser.nonBlankLines(raw)) {
      nodes.add(new ContentNode.Paragraph(line));
    }
    return new ContentBatch(nodes);
  }

  public TableSet parseTables(String raw) {
    if (StringUtils.isBlank(raw)) {
      return TableSet.EMPTY;
    }
    Optional<JsonNode> payload = locatePayload(raw, ExtractionMode.TABLE.payloadField());
    if (payload.isPresent()) {
      return new TableSet(ContentInterchange.readTables(payload.get()));
    }

    List<List<String>> rows = DelimitedTableParser.parseMarkdown(raw);
    if (rows.isEmpty()) {
      rows = DelimitedTableParser.parseCsv(raw);
    }
    if (rows.isEmpty()) {
      log.debug("No table found in extraction answer");
      return TableSet.EMPTY;
    }
    log.debug("Recovered a {}-row table from delimited text", rows.size());
    return new TableSet(List.of(new NamedTable("Table 1", rows)));
  }

  /**
   * Finds the value of {@code field} in the first JSON object located by the strategy chain. A
   * {@code null} value counts as present and yields an empty array.
   */
  Optional<JsonNode> locatePayload(String raw, String field) {
    Optional<JsonNode> found = payloadOf(raw, field);
    if (found.isPresent()) {
      return found;
    }

    for (Pattern fence : List.of(JSON_FENCE, ANY_FENCE)) {
      Matcher m = fence.matcher(raw);
      while (m.find()) {
        found = payloadOf(m.group(1), field);
        if (found.isPresent()) {
          log.trace("Content payload found inside a fenced block");
          return found;
        }
      }
    }

    Matcher m = OBJECT_BLOCK.matcher(raw);
    if (m.find()) {
      found = payloadOf(m.group(), field);
      if (found.isPresent()) {
        log.trace("Content payload found in embedded object");
      }
    }
    return found;
  }

  private Optional<JsonNode> payloadOf(String candidate, String field) {
    JsonNode root;
    try {
      root = mapper.readTree(candidate.trim());
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
    if (root == null || !root.isObject() || !root.has(field)) {
      return Optional.empty();
    }
    JsonNode value = root.get(field);
    if (value.isNull()) {
      return Optional.of(mapper.createArrayNode());
    }
    return value.isArray() ? Optional.of(value) : Optional.empty();
  }
}

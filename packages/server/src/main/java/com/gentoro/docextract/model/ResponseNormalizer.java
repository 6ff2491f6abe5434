package com.gentoro.docextract.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docextract.utility.JacksonUtility;

/**
 * Extracts the text payload and token usage from the response envelopes the extraction service
 * is known to produce.
 *
 * <p>Text is read from {@code choices[0].message.content}, either an array of segments carrying
 * {@code text} or a plain string, then from a top-level {@code output_text}. When the body is not
 * JSON or matches neither envelope, the raw body is the payload. Missing usage counters read as
 * zero.
 */
public final class ResponseNormalizer {
  private ResponseNormalizer() {}

  public static ExtractionResponse normalize(String body) {
    String raw = body == null ? "" : body;
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(raw);
    } catch (JsonProcessingException e) {
      return new ExtractionResponse(raw, Usage.ZERO);
    }
    if (root == null || !root.isObject()) {
      return new ExtractionResponse(raw, Usage.ZERO);
    }

    String text = textFromChoices(root.path("choices"));
    if (text == null) {
      JsonNode outputText = root.path("output_text");
      if (outputText.isTextual() && !outputText.asText().isEmpty()) {
        text = outputText.asText();
      }
    }
    return new ExtractionResponse(text == null ? raw : text, usage(root.path("usage")));
  }

  private static String textFromChoices(JsonNode choices) {
    if (!choices.isArray() || choices.isEmpty()) {
      return null;
    }
    JsonNode message = choices.get(0).path("message");
    if (!message.isObject()) {
      return null;
    }
    JsonNode content = message.path("content");
    if (content.isArray()) {
      StringBuilder joined = new StringBuilder();
      for (JsonNode segment : content) {
        JsonNode segmentText = segment.path("text");
        if (segmentText.isTextual()) {
          joined.append(segmentText.asText());
        }
      }
      return joined.length() > 0 ? joined.toString() : null;
    }
    if (content.isTextual()) {
      return content.asText();
    }
    return null;
  }

  private static Usage usage(JsonNode usage) {
    if (!usage.isObject()) {
      return Usage.ZERO;
    }
    return new Usage(
        usage.path("prompt_tokens").asLong(0),
        usage.path("completion_tokens").asLong(0),
        usage.path("total_tokens").asLong(0));
  }
}

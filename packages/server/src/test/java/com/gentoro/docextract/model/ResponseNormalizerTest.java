package com.gentoro.docextract.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResponseNormalizerTest {

  @Test
  @DisplayName("String message content and usage counters are read from chat completions")
  void readsStringContent() {
    String body =
        """
        {"choices":[{"message":{"role":"assistant","content":"{\\"content\\":[]}"}}],
         "usage":{"prompt_tokens":120,"completion_tokens":30,"total_tokens":150}}
        """;

    ExtractionResponse response = ResponseNormalizer.normalize(body);

    assertEquals("{\"content\":[]}", response.text());
    assertEquals(new Usage(120, 30, 150), response.usage());
  }

  @Test
  @DisplayName("Segmented message content is joined")
  void joinsSegments() {
    String body =
        """
        {"choices":[{"message":{"content":[{"type":"text","text":"part one, "},
                                           {"type":"image"},
                                           {"type":"text","text":"part two"}]}}]}
        """;

    ExtractionResponse response = ResponseNormalizer.normalize(body);

    assertEquals("part one, part two", response.text());
    assertEquals(Usage.ZERO, response.usage());
  }

  @Test
  @DisplayName("output_text envelope is supported")
  void readsOutputText() {
    ExtractionResponse response =
        ResponseNormalizer.normalize("{\"output_text\":\"hello\",\"usage\":{\"total_tokens\":7}}");

    assertEquals("hello", response.text());
    assertEquals(new Usage(0, 0, 7), response.usage());
  }

  @Test
  @DisplayName("Bodies that are not a known envelope are passed through")
  void passesThroughUnknownBodies() {
    assertEquals("plain text answer", ResponseNormalizer.normalize("plain text answer").text());
    assertEquals("{\"foo\":1}", ResponseNormalizer.normalize("{\"foo\":1}").text());
    assertEquals("", ResponseNormalizer.normalize(null).text());
  }

  @Test
  @DisplayName("An empty string message is empty text, not the raw body")
  void emptyMessageContent() {
    ExtractionResponse response =
        ResponseNormalizer.normalize("{\"choices\":[{\"message\":{\"content\":\"\"}}]}");

    assertEquals("", response.text());
  }

  @Test
  @DisplayName("Negative or malformed usage values never go below zero")
  void clampsUsage() {
    ExtractionResponse response =
        ResponseNormalizer.normalize(
            "{\"output_text\":\"x\","
                + "\"usage\":{\"prompt_tokens\":-5,\"completion_tokens\":\"n/a\"}}");

    assertEquals(Usage.ZERO, response.usage());
  }
}

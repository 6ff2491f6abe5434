package com.gentoro.docextract.pipeline;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gentoro.docextract.content.ContentParser;
import com.gentoro.docextract.content.TableSet;
import com.gentoro.docextract.exception.ExtractionException;
import com.gentoro.docextract.model.ExtractionClient;
import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.model.ExtractionResponse;
import com.gentoro.docextract.model.Usage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExtractingItemProcessorTest {
  private final ExtractionClient client = mock(ExtractionClient.class);
  private final WorkItem item = PipelineFixtures.batch(1).items().get(0);

  @Test
  void parsesTablesFromAnswer() {
    when(client.extract(any(), eq(ExtractionMode.TABLE)))
        .thenReturn(
            new ExtractionResponse(
                "{\"tables\":[{\"name\":\"Prices\",\"rows\":[[\"a\",\"b\"],[\"1\",\"2\"]]}]}",
                new Usage(3, 4, 7)));

    ExtractionOutcome outcome =
        new ExtractingItemProcessor(client, new ContentParser(), ExtractionMode.TABLE)
            .process(item);

    ExtractionOutcome.Success success = assertInstanceOf(ExtractionOutcome.Success.class, outcome);
    TableSet tables = assertInstanceOf(TableSet.class, success.content());
    assertEquals("Prices", tables.tables().get(0).name());
    assertEquals(new Usage(3, 4, 7), success.usage());
  }

  @Test
  @DisplayName("An answer with nothing recognized is a no_content failure that keeps its usage")
  void emptyAnswerKeepsUsage() {
    when(client.extract(any(), any()))
        .thenReturn(
            new ExtractionResponse(
                "{\"status\":\"no_text\",\"content\":[]}", new Usage(9, 1, 10)));

    ExtractionOutcome outcome =
        new ExtractingItemProcessor(client, new ContentParser(), ExtractionMode.TEXT)
            .process(item);

    ExtractionOutcome.Failure failure = assertInstanceOf(ExtractionOutcome.Failure.class, outcome);
    assertEquals("no_content", failure.reason());
    assertEquals(10, failure.usage().total());
  }

  @Test
  @DisplayName("Service errors become failures with a short reason")
  void serviceErrorIsFailure() {
    when(client.extract(any(), any()))
        .thenThrow(ExtractionException.httpFailure(429, "rate limited"));

    ExtractionOutcome outcome =
        new ExtractingItemProcessor(client, new ContentParser(), ExtractionMode.TEXT)
            .process(item);

    ExtractionOutcome.Failure failure = assertInstanceOf(ExtractionOutcome.Failure.class, outcome);
    assertEquals("HTTP 429: rate limited", failure.reason());
    assertEquals(Usage.ZERO, failure.usage());
  }
}

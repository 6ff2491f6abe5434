package com.gentoro.docextract.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docextract.content.ContentBatch;
import com.gentoro.docextract.content.ContentNode;
import com.gentoro.docextract.content.ContentParser;
import com.gentoro.docextract.exception.ExtractionException;
import com.gentoro.docextract.model.ExtractionClient;
import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.model.ExtractionResponse;
import com.gentoro.docextract.model.Usage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExtractionPipelineTest {

  /** Answers each page with a heading naming it, after a random delay. */
  private static final ExtractionClient FAKE_SERVICE =
      (item, mode) -> {
        PipelineFixtures.pause(ThreadLocalRandom.current().nextInt(5, 40));
        if (item.sequenceIndex() == 5) {
          throw ExtractionException.httpFailure(500, "internal error");
        }
        return new ExtractionResponse(
            "```json\n{\"content\":[{\"type\":\"h1\",\"text\":\"" + item.name() + "\"}]}\n```",
            new Usage(100, 20, 120));
      };

  @Test
  @DisplayName("Ten pages on three workers: one failure, nine results in page order")
  void ordersResultsAndCollectsErrors() throws Exception {
    List<PipelineEvent> events = Collections.synchronizedList(new ArrayList<>());
    ExtractionPipeline pipeline =
        new ExtractionPipeline(
            FAKE_SERVICE, new ContentParser(), new WorkerPool(3, Duration.ofMillis(20)));

    PipelineResult result =
        pipeline.run(
            PipelineFixtures.batch(10), ExtractionMode.TEXT, new ControlGate(), events::add);

    assertEquals(10, result.total());
    assertEquals(10, result.done());
    assertFalse(result.stopped());
    assertEquals(
        List.of(new ItemError("page-006.png", "HTTP 500: internal error")), result.errors());

    List<Integer> order = result.results().stream().map(r -> r.item().sequenceIndex()).toList();
    assertEquals(List.of(0, 1, 2, 3, 4, 6, 7, 8, 9), order);
    ContentBatch first = (ContentBatch) result.results().get(0).content();
    assertEquals(new ContentNode.Heading(1, "page-001.png"), first.nodes().get(0));

    assertEquals(new Usage(900, 180, 1080), result.usage());
    assertEquals(12, events.size());
    assertInstanceOf(PipelineEvent.Finish.class, events.get(11));
  }

  @Test
  @DisplayName("Failures only: the run completes with an empty result")
  void allItemsFail() throws Exception {
    ExtractionPipeline pipeline =
        new ExtractionPipeline(
            (item, mode) -> new ExtractionResponse("", Usage.ZERO),
            new ContentParser(),
            new WorkerPool(2));

    PipelineResult result =
        pipeline.run(PipelineFixtures.batch(3), ExtractionMode.TABLE, new ControlGate(), null);

    assertTrue(result.isEmpty());
    assertEquals(3, result.errors().size());
    assertTrue(result.errors().stream().allMatch(e -> "no_tables".equals(e.reason())));
  }

  @Test
  void stoppedRunKeepsCompletedResults() throws Exception {
    ControlGate gate = new ControlGate();
    ExtractionPipeline pipeline =
        new ExtractionPipeline(FAKE_SERVICE, new ContentParser(), new WorkerPool(1));

    PipelineResult result =
        pipeline.run(
            PipelineFixtures.batch(6),
            item -> {
              if (item.sequenceIndex() == 1) {
                gate.stop();
              }
              return PipelineFixtures.paragraph(item);
            },
            ExtractionMode.TEXT,
            gate,
            PipelineListener.NOOP);

    assertTrue(result.stopped());
    assertEquals(2, result.done());
    assertEquals(2, result.results().size());
  }
}

package com.gentoro.docextract.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResultOrdererTest {

  @Test
  @DisplayName("Completions in any order come out in sequence order without failures")
  void ordersBySequenceIndex() {
    List<WorkItem> items = new ArrayList<>(PipelineFixtures.batch(12).items());
    Collections.shuffle(items, new Random(42));

    ResultOrderer orderer = new ResultOrderer();
    for (WorkItem item : items) {
      ExtractionOutcome outcome =
          item.sequenceIndex() % 4 == 3
              ? ExtractionOutcome.failure("HTTP 500")
              : PipelineFixtures.paragraph(item);
      orderer.accept(item, outcome);
    }

    List<Integer> indexes =
        orderer.orderedResults().stream().map(r -> r.item().sequenceIndex()).toList();
    assertEquals(List.of(0, 1, 2, 4, 5, 6, 8, 9, 10), indexes);
  }

  @Test
  void keepsFirstCompletionForAnIndex() {
    WorkItem item = PipelineFixtures.batch(1).items().get(0);
    ResultOrderer orderer = new ResultOrderer();

    ExtractionOutcome.Success first = PipelineFixtures.paragraph(item);
    orderer.accept(item, first);
    orderer.accept(item, PipelineFixtures.paragraph(item));

    assertEquals(1, orderer.orderedResults().size());
    assertSame(first.content(), orderer.orderedResults().get(0).content());
  }

  @Test
  void listensToStepEvents() {
    WorkItem item = PipelineFixtures.batch(1).items().get(0);
    ResultOrderer orderer = new ResultOrderer();

    orderer.onEvent(new PipelineEvent.Start(1, 0, 0));
    orderer.onEvent(new PipelineEvent.Step(1, 1, item, PipelineFixtures.paragraph(item)));

    assertEquals(1, orderer.orderedResults().size());
    assertEquals(PipelineFixtures.name(0), orderer.orderedResults().get(0).item().name());
  }
}

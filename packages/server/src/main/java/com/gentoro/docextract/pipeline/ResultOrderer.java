package com.gentoro.docextract.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buffers completions, which arrive in any order, and returns the successful ones in ascending
 * {@link WorkItem#sequenceIndex()} order. Failed items are not part of the output.
 */
public final class ResultOrderer implements PipelineListener {
  private final Map<Integer, OrderedResult> successes = new TreeMap<>();

  @Override
  public void onEvent(PipelineEvent event) {
    if (event instanceof PipelineEvent.Step step) {
      accept(step.item(), step.outcome());
    }
  }

  public synchronized void accept(WorkItem item, ExtractionOutcome outcome) {
    if (outcome instanceof ExtractionOutcome.Success success) {
      successes.putIfAbsent(item.sequenceIndex(), new OrderedResult(item, success.content()));
    }
  }

  public synchronized List<OrderedResult> orderedResults() {
    return List.copyOf(new ArrayList<>(successes.values()));
  }
}

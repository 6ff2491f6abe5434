package com.gentoro.docextract.pipeline;

import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.model.Usage;
import java.util.List;

/** Everything a document writer needs from a finished run. */
public record PipelineResult(
    ExtractionMode mode,
    List<OrderedResult> results,
    List<ItemError> errors,
    int total,
    int done,
    Usage usage,
    boolean stopped) {

  public PipelineResult {
    results = List.copyOf(results);
    errors = List.copyOf(errors);
    usage = usage == null ? Usage.ZERO : usage;
  }

  /** {@code true} when no item produced content. */
  public boolean isEmpty() {
    return results.isEmpty();
  }
}

package com.gentoro.docextract.pipeline;

import com.gentoro.docextract.model.Usage;

/** Telemetry emitted by a pipeline run: one start, one step per completed item, one finish. */
public sealed interface PipelineEvent
    permits PipelineEvent.Start, PipelineEvent.Step, PipelineEvent.Finish {

  record Start(int total, int embedded, int pages) implements PipelineEvent {}

  /**
   * One item completed. {@code done} counts completed items so far; {@code error} is {@code null}
   * on success.
   */
  record Step(int done, int total, WorkItem item, ExtractionOutcome outcome)
      implements PipelineEvent {

    public String image() {
      return item.name();
    }

    public String error() {
      return outcome instanceof ExtractionOutcome.Failure f ? f.reason() : null;
    }
  }

  /** The run ended; {@code stopped} is set when a stop request left items undispatched. */
  record Finish(int done, int total, Usage usage, boolean stopped) implements PipelineEvent {}
}

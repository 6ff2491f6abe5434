package com.gentoro.docextract.tasks;

import com.gentoro.docextract.pipeline.ItemError;
import com.gentoro.docextract.pipeline.PipelineEvent;
import com.gentoro.docextract.pipeline.PipelineListener;

/** Applies pipeline events to the {@link TaskState} of the task that produced them. */
public final class ProgressAggregator implements PipelineListener {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(ProgressAggregator.class);

  private final TaskState state;

  public ProgressAggregator(TaskState state) {
    this.state = state;
  }

  @Override
  public void onEvent(PipelineEvent event) {
    if (event instanceof PipelineEvent.Start start) {
      state.start(start.total(), start.embedded(), start.pages());
    } else if (event instanceof PipelineEvent.Step step) {
      state.advance(step.done());
      state.addUsage(step.outcome().usage());
      if (step.error() != null) {
        state.addError(new ItemError(step.image(), step.error()));
      }
      log.debug(
          "Task {}: {}/{} {}{}",
          state.id(),
          step.done(),
          step.total(),
          step.image(),
          step.error() != null ? " failed: " + step.error() : "");
    } else if (event instanceof PipelineEvent.Finish finish) {
      state.finish(finish.done(), finish.usage(), finish.stopped());
    }
  }
}

package com.gentoro.docextract.pipeline;

import java.util.List;

/** Subscriber to {@link PipelineEvent}s. Invoked on the pipeline's driver thread only. */
@FunctionalInterface
public interface PipelineListener {
  PipelineListener NOOP = event -> {};

  void onEvent(PipelineEvent event);

  static PipelineListener compose(PipelineListener... listeners) {
    List<PipelineListener> all = List.of(listeners);
    return event -> {
      for (PipelineListener listener : all) {
        listener.onEvent(event);
      }
    };
  }
}

package com.gentoro.docextract.pipeline;

import com.gentoro.docextract.content.ContentParser;
import com.gentoro.docextract.model.ExtractionClient;
import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.source.SourceBatch;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs one batch end to end: every item goes through the {@link ExtractionClient} and the {@link
 * ContentParser} on the {@link WorkerPool}, completions are collected by a {@link ResultOrderer}
 * and forwarded to the caller's listener, and the ordered result is returned.
 */
public class ExtractionPipeline {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(ExtractionPipeline.class);

  private final ExtractionClient client;
  private final ContentParser parser;
  private final WorkerPool workerPool;

  public ExtractionPipeline(ExtractionClient client, ContentParser parser, WorkerPool workerPool) {
    this.client = client;
    this.parser = parser;
    this.workerPool = workerPool;
  }

  public PipelineResult run(
      SourceBatch batch, ExtractionMode mode, ControlGate gate, PipelineListener listener)
      throws InterruptedException {
    return run(batch, new ExtractingItemProcessor(client, parser, mode), mode, gate, listener);
  }

  PipelineResult run(
      SourceBatch batch,
      ItemProcessor processor,
      ExtractionMode mode,
      ControlGate gate,
      PipelineListener listener)
      throws InterruptedException {
    ResultOrderer orderer = new ResultOrderer();
    List<ItemError> errors = Collections.synchronizedList(new ArrayList<>());
    PipelineListener errorCollector =
        event -> {
          if (event instanceof PipelineEvent.Step step && step.error() != null) {
            errors.add(new ItemError(step.image(), step.error()));
          }
        };

    log.info(
        "Starting {} extraction of {} item(s) with {} worker(s)",
        mode.wireName(),
        batch.total(),
        workerPool.concurrency());
    PipelineListener downstream = listener == null ? PipelineListener.NOOP : listener;
    WorkerPool.RunSummary summary =
        workerPool.run(
            batch, processor, gate, PipelineListener.compose(orderer, errorCollector, downstream));

    List<OrderedResult> results = orderer.orderedResults();
    log.info(
        "Extraction finished: {}/{} done, {} succeeded, {} failed, {} tokens{}",
        summary.done(),
        summary.total(),
        results.size(),
        errors.size(),
        summary.usage().total(),
        summary.stopped() ? " (stopped)" : "");
    return new PipelineResult(
        mode, results, errors, summary.total(), summary.done(), summary.usage(), summary.stopped());
  }
}

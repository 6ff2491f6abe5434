package com.gentoro.docextract.pipeline;

/**
 * Processes one work item. Implementations report problems as {@link ExtractionOutcome.Failure}
 * rather than throwing; the {@link WorkerPool} still converts stray runtime exceptions.
 */
@FunctionalInterface
public interface ItemProcessor {
  ExtractionOutcome process(WorkItem item);
}

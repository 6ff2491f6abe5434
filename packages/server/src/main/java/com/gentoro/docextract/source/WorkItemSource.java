package com.gentoro.docextract.source;

/**
 * Produces the ordered work items of one batch.
 *
 * <p>{@link #load()} runs on the task's own thread; a source that cannot be read at all throws
 * {@link com.gentoro.docextract.exception.SourceException}, which fails the whole task.
 */
public interface WorkItemSource {

  /** Human-readable name used for the task and its output document. */
  String displayName();

  SourceBatch load();
}

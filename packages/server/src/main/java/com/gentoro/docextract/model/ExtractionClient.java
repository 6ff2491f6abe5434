package com.gentoro.docextract.model;

import com.gentoro.docextract.exception.ExtractionException;
import com.gentoro.docextract.pipeline.WorkItem;

/**
 * Client for the external content-extraction service.
 *
 * <p>One call per work item. Implementations retry transient failures internally and normalize
 * the service's response envelope, so callers only see the model's text payload and its usage, or
 * an {@link ExtractionException} once retries are exhausted or the failure is permanent.
 */
public interface ExtractionClient {
  ExtractionResponse extract(WorkItem item, ExtractionMode mode);
}

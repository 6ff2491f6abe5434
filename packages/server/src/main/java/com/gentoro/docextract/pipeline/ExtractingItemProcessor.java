package com.gentoro.docextract.pipeline;

import com.gentoro.docextract.content.ContentParser;
import com.gentoro.docextract.content.ExtractedContent;
import com.gentoro.docextract.exception.DocExtractException;
import com.gentoro.docextract.exception.ExceptionUtil;
import com.gentoro.docextract.model.ExtractionClient;
import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.model.ExtractionResponse;

/**
 * Calls the extraction service for one item and parses its answer. An answer with nothing
 * recognized becomes a failure carrying the mode's empty reason ({@code no_content} or {@code
 * no_tables}) together with the usage the call consumed.
 */
public class ExtractingItemProcessor implements ItemProcessor {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(ExtractingItemProcessor.class);

  private final ExtractionClient client;
  private final ContentParser parser;
  private final ExtractionMode mode;

  public ExtractingItemProcessor(
      ExtractionClient client, ContentParser parser, ExtractionMode mode) {
    this.client = client;
    this.parser = parser;
    this.mode = mode;
  }

  @Override
  public ExtractionOutcome process(WorkItem item) {
    ExtractionResponse response;
    try {
      response = client.extract(item, mode);
    } catch (DocExtractException e) {
      return ExtractionOutcome.failure(ExceptionUtil.extractErrorMessage(e));
    }

    ExtractedContent content = parser.parse(response.text(), mode);
    if (content.isEmpty()) {
      log.debug("Nothing recognized in {}", item.name());
      return ExtractionOutcome.failure(mode.emptyReason(), response.usage());
    }
    return ExtractionOutcome.success(content, response.usage());
  }
}

package com.gentoro.docextract.pipeline;

import com.gentoro.docextract.content.ExtractedContent;
import com.gentoro.docextract.model.Usage;
import java.util.Objects;

/** Result of running one work item through extraction and parsing. */
public sealed interface ExtractionOutcome
    permits ExtractionOutcome.Success, ExtractionOutcome.Failure {

  Usage usage();

  default boolean isSuccess() {
    return this instanceof Success;
  }

  static Success success(ExtractedContent content, Usage usage) {
    return new Success(content, usage);
  }

  static Failure failure(String reason) {
    return new Failure(reason, Usage.ZERO);
  }

  static Failure failure(String reason, Usage usage) {
    return new Failure(reason, usage);
  }

  record Success(ExtractedContent content, Usage usage) implements ExtractionOutcome {
    public Success {
      Objects.requireNonNull(content, "content");
      usage = usage == null ? Usage.ZERO : usage;
    }
  }

  /**
   * The item produced no content. {@code usage} is non-zero when the service answered but nothing
   * was recognized.
   */
  record Failure(String reason, Usage usage) implements ExtractionOutcome {
    public Failure {
      reason = reason == null || reason.isBlank() ? "Unknown error" : reason;
      usage = usage == null ? Usage.ZERO : usage;
    }
  }
}

package com.gentoro.docextract.exception;

/**
 * Failure of a single call to the content-extraction service.
 *
 * <p>{@link #isTransient()} tells the retry loop whether another attempt may succeed. Connection
 * and timeout problems are transient; HTTP error statuses and unreadable inputs are not.
 */
public class ExtractionException extends DocExtractException {
  private final boolean transientFailure;
  private final int httpStatus;

  public ExtractionException(String message) {
    this(message, null, false, -1);
  }

  public ExtractionException(String message, Throwable cause) {
    this(message, cause, false, -1);
  }

  public ExtractionException(
      String message, Throwable cause, boolean transientFailure, int httpStatus) {
    super(DocExtractErrorCode.EXTRACTION_ERROR, message, cause);
    this.transientFailure = transientFailure;
    this.httpStatus = httpStatus;
    if (httpStatus > 0) {
      withContext("httpStatus", httpStatus);
    }
  }

  public static ExtractionException transientFailure(String message, Throwable cause) {
    return new ExtractionException(message, cause, true, -1);
  }

  public static ExtractionException httpFailure(int status, String body) {
    return new ExtractionException(
        "API error: HTTP %d: %s".formatted(status, body == null ? "" : body), null, false, status);
  }

  public boolean isTransient() {
    return transientFailure;
  }

  public int httpStatus() {
    return httpStatus;
  }
}

package com.gentoro.docextract.exception;

/** The work-item source could not be read; fatal for the whole batch. */
public class SourceException extends DocExtractException {
  public SourceException(String message) {
    super(DocExtractErrorCode.SOURCE_ERROR, message);
  }

  public SourceException(String message, Throwable cause) {
    super(DocExtractErrorCode.SOURCE_ERROR, message, cause);
  }
}

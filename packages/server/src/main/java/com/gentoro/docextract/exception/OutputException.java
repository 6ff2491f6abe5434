package com.gentoro.docextract.exception;

/** The ordered results could not be handed to the document writer. */
public class OutputException extends DocExtractException {
  public OutputException(String message) {
    super(DocExtractErrorCode.OUTPUT_ERROR, message);
  }

  public OutputException(String message, Throwable cause) {
    super(DocExtractErrorCode.OUTPUT_ERROR, message, cause);
  }
}

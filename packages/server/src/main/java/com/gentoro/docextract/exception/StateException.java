package com.gentoro.docextract.exception;

/** A component was used in an invalid lifecycle state. */
public class StateException extends DocExtractException {
  public StateException(String message) {
    super(DocExtractErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(DocExtractErrorCode.STATE_ERROR, message, cause);
  }
}

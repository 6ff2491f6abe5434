package com.gentoro.docextract.exception;

/** Failures while binding or starting network listeners. */
public class NetworkException extends DocExtractException {
  public NetworkException(String message) {
    super(DocExtractErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(DocExtractErrorCode.NETWORK_ERROR, message, cause);
  }
}

package com.gentoro.docextract.exception;

/** Stable error categories reported alongside {@link DocExtractException}. */
public enum DocExtractErrorCode {
  CONFIG_ERROR,
  STATE_ERROR,
  NETWORK_ERROR,
  EXTRACTION_ERROR,
  SOURCE_ERROR,
  OUTPUT_ERROR
}

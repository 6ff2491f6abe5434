package com.gentoro.docextract.exception;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Root of the DocExtract exception hierarchy.
 *
 * <p>Every exception carries a {@link DocExtractErrorCode} and an optional context map with
 * diagnostic values (task id, item name, HTTP status, ...). The hierarchy is unchecked so that
 * service boundaries decide where errors are caught and reported.
 */
public class DocExtractException extends RuntimeException {
  private final DocExtractErrorCode code;
  private final Map<String, Object> context = new HashMap<>();

  public DocExtractException(DocExtractErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public DocExtractException(DocExtractErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public DocExtractErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public DocExtractException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}

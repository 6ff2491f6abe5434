package com.gentoro.docextract.exception;

/** Invalid or missing configuration. */
public class ConfigException extends DocExtractException {
  public ConfigException(String message) {
    super(DocExtractErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(DocExtractErrorCode.CONFIG_ERROR, message, cause);
  }
}

package com.gentoro.docextract.model;

import com.gentoro.docextract.exception.ConfigException;
import java.util.Locale;

/** What the extraction service is asked to recognize in each image. */
public enum ExtractionMode {
  /** Headings, paragraphs, lists and tables, rendered as a rich-text document. */
  TEXT("content", "no_content"),
  /** Tables only, rendered as a spreadsheet. */
  TABLE("tables", "no_tables");

  private final String payloadField;
  private final String emptyReason;

  ExtractionMode(String payloadField, String emptyReason) {
    this.payloadField = payloadField;
    this.emptyReason = emptyReason;
  }

  /** Top-level JSON field that carries the structured payload in a model response. */
  public String payloadField() {
    return payloadField;
  }

  /** Sentinel failure reason recorded when the service answered but nothing was recognized. */
  public String emptyReason() {
    return emptyReason;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ExtractionMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return TEXT;
    }
    for (ExtractionMode mode : values()) {
      if (mode.name().equalsIgnoreCase(value.trim())) {
        return mode;
      }
    }
    throw new ConfigException("Unknown extraction mode: " + value);
  }
}

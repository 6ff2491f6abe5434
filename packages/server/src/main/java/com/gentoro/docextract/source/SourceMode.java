package com.gentoro.docextract.source;

import com.gentoro.docextract.exception.ConfigException;
import java.util.Locale;

/** Which images of a PDF become work items. */
public enum SourceMode {
  /** Pictures embedded in the pages only. */
  EMBEDDED,
  /** Full-page renders only. */
  PAGE,
  /** Embedded pictures first, then full-page renders. */
  BOTH;

  public boolean includesEmbedded() {
    return this != PAGE;
  }

  public boolean includesPages() {
    return this != EMBEDDED;
  }

  public static SourceMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return BOTH;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown source mode: " + value + " (expected embedded|page|both)");
    }
  }
}

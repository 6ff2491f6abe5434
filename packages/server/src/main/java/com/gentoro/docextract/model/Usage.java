package com.gentoro.docextract.model;

/**
 * Token usage reported by the extraction service. Values are clamped to be non-negative and are
 * aggregated by plain summation, so totals are best-effort.
 */
public record Usage(long prompt, long completion, long total) {
  public static final Usage ZERO = new Usage(0, 0, 0);

  public Usage {
    prompt = Math.max(0, prompt);
    completion = Math.max(0, completion);
    total = Math.max(0, total);
  }

  public Usage plus(Usage other) {
    if (other == null) {
      return this;
    }
    return new Usage(prompt + other.prompt, completion + other.completion, total + other.total);
  }
}

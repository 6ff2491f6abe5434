package com.gentoro.docextract.model;

/** Normalized answer of one extraction call: the model's text payload and its token usage. */
public record ExtractionResponse(String text, Usage usage) {
  public ExtractionResponse {
    text = text == null ? "" : text;
    usage = usage == null ? Usage.ZERO : usage;
  }
}

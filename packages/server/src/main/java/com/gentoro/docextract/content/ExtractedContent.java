package com.gentoro.docextract.content;

/** Structured result of parsing one extraction response. */
public sealed interface ExtractedContent permits ContentBatch, TableSet {

  /** {@code true} when nothing was recognized in the image. */
  boolean isEmpty();
}

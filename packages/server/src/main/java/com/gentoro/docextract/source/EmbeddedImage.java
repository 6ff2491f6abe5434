package com.gentoro.docextract.source;

/** A picture drawn on a PDF page. {@code page} is 1-based. */
public record EmbeddedImage(int page, ImageRef image) {}

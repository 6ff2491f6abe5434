package com.gentoro.docextract.model;

/**
 * Prepared input for one extraction call. The image is already encoded as a {@code data:} URI so
 * retries do not re-read the source.
 */
public record ExtractionRequest(String itemName, String imageDataUri, String prompt) {}

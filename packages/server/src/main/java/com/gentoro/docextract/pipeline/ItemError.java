package com.gentoro.docextract.pipeline;

/** A failed work item as reported to users: its name and a short reason. */
public record ItemError(String item, String reason) {}

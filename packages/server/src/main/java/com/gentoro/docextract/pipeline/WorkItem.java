package com.gentoro.docextract.pipeline;

import com.gentoro.docextract.source.ImageRef;
import java.util.Objects;

/**
 * One image submitted for extraction. {@code sequenceIndex} is its position in the source and the
 * only key used to restore output order.
 */
public record WorkItem(int sequenceIndex, ImageRef source, String name) {
  public WorkItem {
    if (sequenceIndex < 0) {
      throw new IllegalArgumentException("sequenceIndex must be >= 0");
    }
    Objects.requireNonNull(source, "source");
    name = name == null ? "item-" + sequenceIndex : name;
  }
}

package com.gentoro.docextract.content;

import java.util.List;

/** Ordered content nodes produced from one work item. May be empty. */
public record ContentBatch(List<ContentNode> nodes) implements ExtractedContent {
  public static final ContentBatch EMPTY = new ContentBatch(List.of());

  public ContentBatch {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
  }

  @Override
  public boolean isEmpty() {
    return nodes.isEmpty();
  }
}

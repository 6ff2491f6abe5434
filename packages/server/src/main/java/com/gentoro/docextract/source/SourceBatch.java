package com.gentoro.docextract.source;

import com.gentoro.docextract.pipeline.WorkItem;
import java.util.List;

/**
 * Ordered work items loaded from one source, with the number of embedded pictures and full-page
 * renders among them (both zero for plain image batches).
 */
public record SourceBatch(List<WorkItem> items, int embeddedCount, int pageCount) {
  public SourceBatch {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static SourceBatch ofImages(List<WorkItem> items) {
    return new SourceBatch(items, 0, 0);
  }

  public int total() {
    return items.size();
  }
}

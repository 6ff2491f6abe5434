package com.gentoro.docextract.content;

import java.util.List;

/** Ordered tables produced from one work item in table mode. May be empty. */
public record TableSet(List<NamedTable> tables) implements ExtractedContent {
  public static final TableSet EMPTY = new TableSet(List.of());

  public TableSet {
    tables = tables == null ? List.of() : List.copyOf(tables);
  }

  @Override
  public boolean isEmpty() {
    return tables.isEmpty();
  }
}

package com.gentoro.docextract.content;

/** A table recognized in table mode. Rows are repaired to the first row's width. */
public record NamedTable(String name, java.util.List<java.util.List<String>> rows) {
  public NamedTable {
    name = name == null || name.isBlank() ? "Table 1" : name;
    rows = TableRepair.repair(rows);
  }
}

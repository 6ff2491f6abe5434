package com.gentoro.docextract.content;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalizes table rows to the column count of the first row: short rows are padded with empty
 * cells, long rows are truncated and {@code null} cells become empty strings.
 *
 * <p>Repair is idempotent: repairing an already repaired table returns equal rows.
 */
public final class TableRepair {
  private TableRepair() {}

  public static List<List<String>> repair(List<? extends List<String>> rows) {
    if (rows == null || rows.isEmpty()) {
      return List.of();
    }
    List<String> header = rows.get(0);
    int width = header == null ? 0 : header.size();

    List<List<String>> repaired = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      List<String> cells = new ArrayList<>(width);
      int present = row == null ? 0 : Math.min(row.size(), width);
      for (int i = 0; i < present; i++) {
        String cell = row.get(i);
        cells.add(cell == null ? "" : cell);
      }
      while (cells.size() < width) {
        cells.add("");
      }
      repaired.add(Collections.unmodifiableList(cells));
    }
    return Collections.unmodifiableList(repaired);
  }
}

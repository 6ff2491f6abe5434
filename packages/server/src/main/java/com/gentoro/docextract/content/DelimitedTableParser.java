package com.gentoro.docextract.content;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Last-resort table parsing for answers that are not JSON. */
final class DelimitedTableParser {
  private DelimitedTableParser() {}

  /**
   * Rows of a Markdown pipe table. Only lines that start and end with {@code |} are considered;
   * separator rows made of {@code -} and {@code :} are dropped.
   */
  static List<List<String>> parseMarkdown(String text) {
    List<List<String>> rows = new ArrayList<>();
    for (String line : nonBlankLines(text)) {
      if (!line.startsWith("|") || !line.endsWith("|")) {
        continue;
      }
      String inner = stripPipes(line);
      List<String> cells = new ArrayList<>();
      for (String part : inner.split("\\|", -1)) {
        cells.add(part.trim());
      }
      if (!isSeparator(cells)) {
        rows.add(cells);
      }
    }
    return rows;
  }

  /** Rows of comma separated lines, tried only when the first line contains a comma. */
  static List<List<String>> parseCsv(String text) {
    List<String> lines = nonBlankLines(text);
    if (lines.isEmpty() || !lines.get(0).contains(",")) {
      return List.of();
    }
    List<List<String>> rows = new ArrayList<>(lines.size());
    for (String line : lines) {
      rows.add(Arrays.stream(line.split(",", -1)).map(String::trim).toList());
    }
    return rows;
  }

  static List<String> nonBlankLines(String text) {
    if (text == null) {
      return List.of();
    }
    return text.lines().map(String::trim).filter(l -> !l.isEmpty()).toList();
  }

  private static String stripPipes(String line) {
    int start = 0;
    int end = line.length();
    while (start < end && line.charAt(start) == '|') start++;
    while (end > start && line.charAt(end - 1) == '|') end--;
    return line.substring(start, end);
  }

  private static boolean isSeparator(List<String> cells) {
    for (String cell : cells) {
      for (int i = 0; i < cell.length(); i++) {
        char c = cell.charAt(i);
        if (c != '-' && c != ':') {
          return false;
        }
      }
    }
    return true;
  }
}

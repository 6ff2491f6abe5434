package com.gentoro.docextract.content;

import java.util.List;
import java.util.Objects;

/** One structural unit of recognized document content. */
public sealed interface ContentNode
    permits ContentNode.Heading, ContentNode.Paragraph, ContentNode.ListBlock, ContentNode.Table {

  /** Interchange type tag: {@code h1..h3}, {@code paragraph}, {@code list} or {@code table}. */
  String type();

  record Heading(int level, String text) implements ContentNode {
    public Heading {
      if (level < 1 || level > 3) {
        throw new IllegalArgumentException("Heading level must be 1..3, got " + level);
      }
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
      return "h" + level;
    }
  }

  record Paragraph(String text) implements ContentNode {
    public Paragraph {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String type() {
      return "paragraph";
    }
  }

  record ListBlock(List<String> items) implements ContentNode {
    public ListBlock {
      items = List.copyOf(items);
    }

    @Override
    public String type() {
      return "list";
    }
  }

  /** A table whose rows always share the first row's column count. */
  record Table(List<List<String>> rows) implements ContentNode {
    public Table {
      rows = TableRepair.repair(rows);
    }

    @Override
    public String type() {
      return "table";
    }
  }
}

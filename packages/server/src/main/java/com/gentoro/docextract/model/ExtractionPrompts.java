package com.gentoro.docextract.model;

/** Instruction prompts sent along with every image. */
public final class ExtractionPrompts {
  private ExtractionPrompts() {}

  public static final String TEXT =
      """
      Recognize all text in the image and answer with JSON only.

      Typical inputs: slides, scanned books, textbooks, reports, pictures of tables.

      Rules:
      1. Transcribe every printed character exactly; do not omit or rephrase anything.
      2. Ignore watermarks, stamps, seals, handwritten notes, doodles and background decoration.
      3. Infer the heading hierarchy from font size, weight, position, numbering and indentation:
         - top-level numbering or the largest title on the page is h1
         - section numbering such as "1." or "(a)" is h2
         - sub-section numbering such as "(1)" is h3
      4. Tables must be transcribed exactly:
         - the first row of "rows" is the header, the following rows are data
         - every row has exactly as many cells as the header
         - an empty cell is written as "" and never omitted
         - keep the visual row/column alignment
      5. Follow the reading order: top to bottom, left to right.

      Output format:
      {
        "status": "ok",
        "content": [
          {"type": "h1", "text": "Top-level title"},
          {"type": "h2", "text": "Section title"},
          {"type": "h3", "text": "Sub-section title"},
          {"type": "paragraph", "text": "Body text, kept whole however long"},
          {"type": "list", "items": ["item 1", "item 2"]},
          {"type": "table", "rows": [["h1", "h2"], ["v1", "v2"]]}
        ]
      }

      - Output JSON only, without explanations or markdown fences.
      - If the image contains no recognizable text answer {"status":"no_text","content":[]}.
      - Keep numbers, dates, units and punctuation unchanged.
      - Do not split one paragraph into several paragraph entries.
      - Numbering such as "1." or "(1)" stays inside the heading text.
      """;

  public static final String TABLE =
      """
      Extract every table in the image and answer with JSON only, in this format:
      {
        "status": "ok",
        "tables": [ { "name": "Table 1", "rows": [["col1", "col2"], ["...", "..."]] } ]
      }

      Rules:
      - Do not output anything besides the JSON.
      - If there is no table answer {"status":"no_table","tables":[]}.
      - Keep numbers, decimals, dates and units unchanged.
      - Expand merged cells following the visual rows and columns.
      - A cell holding a ditto mark takes the value of the cell above it.
      """;

  public static String forMode(ExtractionMode mode) {
    return mode == ExtractionMode.TABLE ? TABLE : TEXT;
  }
}

package com.gentoro.docextract.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Pulls images out of a PDF document. Results are in page order. */
public interface PdfImageExtractor {

  /** Pictures embedded in the pages, page by page, in drawing-resource order. */
  List<EmbeddedImage> embeddedImages(Path pdf) throws IOException;

  /** One rendered image per page at the given resolution. */
  List<ImageRef> renderPages(Path pdf, int dpi) throws IOException;
}

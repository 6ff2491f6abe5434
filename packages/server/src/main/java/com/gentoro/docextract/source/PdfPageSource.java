package com.gentoro.docextract.source;

import com.gentoro.docextract.exception.SourceException;
import com.gentoro.docextract.pipeline.WorkItem;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Work items of one PDF: embedded pictures first (page order), then full-page renders, as
 * selected by the {@link SourceMode}.
 */
public final class PdfPageSource implements WorkItemSource {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(PdfPageSource.class);

  private final Path pdf;
  private final PdfImageExtractor extractor;
  private final SourceMode mode;
  private final int dpi;

  public PdfPageSource(Path pdf, PdfImageExtractor extractor, SourceMode mode, int dpi) {
    if (dpi <= 0) {
      throw new IllegalArgumentException("dpi must be positive");
    }
    this.pdf = pdf;
    this.extractor = extractor;
    this.mode = mode == null ? SourceMode.BOTH : mode;
    this.dpi = dpi;
  }

  @Override
  public String displayName() {
    String name = pdf.getFileName().toString();
    return StringUtils.defaultIfEmpty(StringUtils.substringBeforeLast(name, "."), name);
  }

  @Override
  public SourceBatch load() {
    if (!Files.isRegularFile(pdf)) {
      throw new SourceException("PDF not found: " + pdf);
    }
    List<EmbeddedImage> embedded;
    List<ImageRef> pages;
    try {
      embedded = mode.includesEmbedded() ? extractor.embeddedImages(pdf) : List.of();
      pages = mode.includesPages() ? extractor.renderPages(pdf, dpi) : List.of();
    } catch (IOException e) {
      throw new SourceException("Unable to read PDF " + pdf.getFileName(), e);
    }

    List<WorkItem> items = new ArrayList<>(embedded.size() + pages.size());
    int lastPage = -1;
    int onPage = 0;
    for (EmbeddedImage picture : embedded) {
      onPage = picture.page() == lastPage ? onPage + 1 : 1;
      lastPage = picture.page();
      String name = "page-%03d-img-%02d.png".formatted(picture.page(), onPage);
      items.add(new WorkItem(items.size(), picture.image(), name));
    }
    for (int i = 0; i < pages.size(); i++) {
      items.add(new WorkItem(items.size(), pages.get(i), "page-%03d-full.png".formatted(i + 1)));
    }
    log.info(
        "Prepared {} work item(s) from {} ({} embedded, {} pages, mode {})",
        items.size(),
        pdf.getFileName(),
        embedded.size(),
        pages.size(),
        mode.name().toLowerCase(Locale.ROOT));
    return new SourceBatch(items, embedded.size(), pages.size());
  }
}

package com.gentoro.docextract.source;

import com.gentoro.docextract.exception.SourceException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.apache.commons.configuration2.Configuration;

/**
 * Builds {@link WorkItemSource}s for submitted inputs using the configured PDF settings:
 * {@code source.mode} ({@code embedded|page|both}, default both) and {@code source.dpi} (default
 * 200).
 */
public class SourceFactory {
  public static final int DEFAULT_DPI = 200;

  private final PdfImageExtractor pdfExtractor;
  private final SourceMode defaultMode;
  private final int dpi;

  public SourceFactory(PdfImageExtractor pdfExtractor, SourceMode defaultMode, int dpi) {
    this.pdfExtractor = pdfExtractor;
    this.defaultMode = defaultMode == null ? SourceMode.BOTH : defaultMode;
    this.dpi = dpi > 0 ? dpi : DEFAULT_DPI;
  }

  public static SourceFactory fromConfiguration(
      Configuration configuration, PdfImageExtractor pdfExtractor) {
    return new SourceFactory(
        pdfExtractor,
        SourceMode.fromString(configuration.getString("source.mode", "both")),
        configuration.getInt("source.dpi", DEFAULT_DPI));
  }

  public WorkItemSource forDirectory(Path directory) {
    return ImageBatchSource.fromDirectory(directory);
  }

  public WorkItemSource forImages(List<Path> images) {
    if (images.isEmpty()) {
      throw new SourceException("No images given");
    }
    return ImageBatchSource.of(images);
  }

  /** @param mode overrides the configured source mode when not {@code null} */
  public WorkItemSource forPdf(Path pdf, SourceMode mode) {
    return new PdfPageSource(pdf, pdfExtractor, mode == null ? defaultMode : mode, dpi);
  }

  /** A directory of images, a PDF, or a single image file. */
  public WorkItemSource forPath(Path input) {
    if (Files.isDirectory(input)) {
      return forDirectory(input);
    }
    if (isPdf(input)) {
      return forPdf(input, null);
    }
    if (FileImageRef.isSupportedImage(input)) {
      return forImages(List.of(input));
    }
    throw new SourceException("Unsupported input: " + input);
  }

  /**
   * Sources for a command-line run. A directory holding PDFs anywhere below it yields one source
   * per PDF, in natural path order; any other input is a single source as in {@link #forPath}.
   */
  public List<WorkItemSource> forBatchInput(Path input) {
    if (!Files.isDirectory(input)) {
      return List.of(forPath(input));
    }
    List<Path> pdfs = pdfsUnder(input);
    if (pdfs.isEmpty()) {
      return List.of(forDirectory(input));
    }
    List<WorkItemSource> sources = new ArrayList<>(pdfs.size());
    for (Path pdf : pdfs) {
      sources.add(forPdf(pdf, null));
    }
    return sources;
  }

  private static List<Path> pdfsUnder(Path directory) {
    try (Stream<Path> files = Files.walk(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(SourceFactory::isPdf)
          .sorted(
              Comparator.comparing(
                  p -> directory.relativize(p).toString(), NaturalOrderComparator.INSTANCE))
          .toList();
    } catch (IOException e) {
      throw new SourceException("Unable to search " + directory + " for PDFs", e);
    }
  }

  private static boolean isPdf(Path path) {
    return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
  }
}

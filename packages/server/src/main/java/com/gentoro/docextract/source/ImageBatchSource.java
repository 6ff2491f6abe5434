package com.gentoro.docextract.source;

import com.gentoro.docextract.exception.SourceException;
import com.gentoro.docextract.pipeline.WorkItem;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.apache.commons.lang3.StringUtils;

/** A batch of image files, processed in natural filename order. */
public final class ImageBatchSource implements WorkItemSource {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(ImageBatchSource.class);

  private static final Comparator<Path> BY_NAME =
      Comparator.comparing(p -> p.getFileName().toString(), NaturalOrderComparator.INSTANCE);

  private final List<Path> images;
  private final Path directory;

  private ImageBatchSource(List<Path> images, Path directory) {
    this.images = images;
    this.directory = directory;
  }

  public static ImageBatchSource of(List<Path> images) {
    List<Path> sorted = new ArrayList<>(images);
    sorted.sort(BY_NAME);
    return new ImageBatchSource(List.copyOf(sorted), null);
  }

  /** All supported images directly inside {@code directory}, listed when the batch is loaded. */
  public static ImageBatchSource fromDirectory(Path directory) {
    return new ImageBatchSource(null, directory);
  }

  @Override
  public String displayName() {
    if (directory != null) {
      Path name = directory.getFileName();
      return name == null ? directory.toString() : name.toString();
    }
    return displayNameOf(images);
  }

  /** The single file's stem, or the first stem followed by the number of other files. */
  static String displayNameOf(List<Path> images) {
    if (images.isEmpty()) {
      return "images";
    }
    String first = stem(images.get(0));
    return images.size() == 1 ? first : "%s (+%d more)".formatted(first, images.size() - 1);
  }

  @Override
  public SourceBatch load() {
    List<Path> files = directory != null ? listDirectory() : images;
    List<WorkItem> items = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      Path file = files.get(i);
      items.add(new WorkItem(i, new FileImageRef(file), file.getFileName().toString()));
    }
    log.debug("Loaded {} image(s) for batch '{}'", items.size(), displayName());
    return SourceBatch.ofImages(items);
  }

  private List<Path> listDirectory() {
    if (!Files.isDirectory(directory)) {
      throw new SourceException("Input directory does not exist: " + directory);
    }
    try (Stream<Path> entries = Files.list(directory)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(FileImageRef::isSupportedImage)
          .sorted(BY_NAME)
          .toList();
    } catch (IOException e) {
      throw new SourceException("Unable to list input directory " + directory, e);
    }
  }

  private static String stem(Path file) {
    String name = file.getFileName().toString();
    return StringUtils.defaultIfEmpty(StringUtils.substringBeforeLast(name, "."), name);
  }
}

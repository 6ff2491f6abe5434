package com.gentoro.docextract.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/** Image stored on the local filesystem. */
public record FileImageRef(Path path) implements ImageRef {
  private static final Map<String, String> MIME_BY_EXTENSION =
      Map.of(
          "png", "image/png",
          "jpg", "image/jpeg",
          "jpeg", "image/jpeg",
          "bmp", "image/bmp",
          "webp", "image/webp",
          "gif", "image/gif",
          "tif", "image/tiff",
          "tiff", "image/tiff");

  @Override
  public byte[] bytes() throws IOException {
    return Files.readAllBytes(path);
  }

  @Override
  public String mimeType() {
    return mimeTypeOf(path.getFileName().toString());
  }

  /** Resolves the MIME type from the file extension, defaulting to {@code image/png}. */
  public static String mimeTypeOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0) {
      return "image/png";
    }
    return MIME_BY_EXTENSION.getOrDefault(
        fileName.substring(dot + 1).toLowerCase(Locale.ROOT), "image/png");
  }

  public static boolean isSupportedImage(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot >= 0
        && MIME_BY_EXTENSION.containsKey(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}

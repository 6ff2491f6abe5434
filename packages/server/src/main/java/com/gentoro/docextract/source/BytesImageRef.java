package com.gentoro.docextract.source;

/** Image already held in memory, e.g. produced by a PDF rasterizer. */
public record BytesImageRef(byte[] data, String mimeType) implements ImageRef {
  public BytesImageRef {
    if (data == null) {
      throw new IllegalArgumentException("data must not be null");
    }
    mimeType = mimeType == null || mimeType.isBlank() ? "image/png" : mimeType;
  }

  @Override
  public byte[] bytes() {
    return data;
  }
}

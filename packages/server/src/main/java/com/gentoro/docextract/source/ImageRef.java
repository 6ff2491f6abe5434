package com.gentoro.docextract.source;

import java.io.IOException;

/** Opaque handle to the bytes of one image. Reading may happen on a worker thread. */
public interface ImageRef {
  byte[] bytes() throws IOException;

  /** MIME type used to build the {@code data:} URI, e.g. {@code image/png}. */
  String mimeType();
}

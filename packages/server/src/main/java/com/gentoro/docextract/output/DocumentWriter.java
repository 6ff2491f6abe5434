package com.gentoro.docextract.output;

import com.gentoro.docextract.pipeline.PipelineResult;
import java.nio.file.Path;

/**
 * Renders the ordered result of a run into a document. Implementations throw {@link
 * com.gentoro.docextract.exception.OutputException} when the document cannot be written.
 */
public interface DocumentWriter {

  /**
   * @param baseName file name without extension
   * @return the written file
   */
  Path write(String baseName, String title, PipelineResult result);
}

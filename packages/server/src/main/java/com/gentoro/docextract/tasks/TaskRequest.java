package com.gentoro.docextract.tasks;

import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.source.WorkItemSource;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;

/** A batch submitted for extraction. {@code name} defaults to the source's display name. */
public record TaskRequest(String name, ExtractionMode mode, WorkItemSource source) {
  public TaskRequest {
    Objects.requireNonNull(source, "source");
    mode = mode == null ? ExtractionMode.TEXT : mode;
    name = StringUtils.isBlank(name) ? source.displayName() : name.trim();
  }
}

package com.gentoro.docextract.pipeline;

import com.gentoro.docextract.content.ExtractedContent;

/** Content of one successful work item, as handed to document writers. */
public record OrderedResult(WorkItem item, ExtractedContent content) {}

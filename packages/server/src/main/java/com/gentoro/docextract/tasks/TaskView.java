package com.gentoro.docextract.tasks;

import com.gentoro.docextract.model.Usage;
import com.gentoro.docextract.pipeline.ItemError;
import java.time.Instant;
import java.util.List;

/** Snapshot of a task for status polling. */
public record TaskView(
    String id,
    String name,
    String mode,
    TaskStatus status,
    int total,
    int done,
    int embedded,
    int pages,
    List<ItemError> errors,
    boolean paused,
    boolean stopRequested,
    Usage usage,
    double elapsedSeconds,
    String message,
    boolean resultAvailable,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt) {

  static TaskView fromState(TaskState s, long nowMillis) {
    return new TaskView(
        s.id(),
        s.name(),
        s.mode().wireName(),
        s.status(),
        s.total(),
        s.done(),
        s.embedded(),
        s.pages(),
        s.errors(),
        s.gate().isPaused(),
        s.gate().isStopRequested(),
        s.usage(),
        s.activeMillis(nowMillis) / 1000.0,
        s.message(),
        s.resultPath() != null,
        s.createdAt(),
        s.startedAt(),
        s.finishedAt());
  }
}

package com.gentoro.docextract.tasks;

import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.model.Usage;
import com.gentoro.docextract.pipeline.ControlGate;
import com.gentoro.docextract.pipeline.ItemError;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live, pollable state of one task.
 *
 * <p>Mutators are synchronized so counter updates never interleave; fields are volatile so status
 * readers never take the lock and may observe a state mid-update. {@code done} never decreases and
 * a terminal status is never left.
 */
public final class TaskState {
  private final String id;
  private final String name;
  private final ExtractionMode mode;
  private final ControlGate gate = new ControlGate();
  private final Instant createdAt = Instant.now();
  private final List<ItemError> errors = new CopyOnWriteArrayList<>();

  private volatile TaskStatus status = TaskStatus.PENDING;
  private volatile int total;
  private volatile int done;
  private volatile int embedded;
  private volatile int pages;
  private volatile Usage usage = Usage.ZERO;
  private volatile Instant startedAt;
  private volatile Instant finishedAt;
  private volatile String message;
  private volatile Path resultPath;

  // pause accounting, guarded by this
  private long pausedMillis;
  private long pausedSinceMillis = -1;

  public TaskState(String id, String name, ExtractionMode mode) {
    this.id = id;
    this.name = name;
    this.mode = mode;
  }

  public synchronized void start(int total, int embedded, int pages) {
    if (status.isTerminal()) {
      return;
    }
    this.total = Math.max(0, total);
    this.embedded = Math.max(0, embedded);
    this.pages = Math.max(0, pages);
    this.startedAt = Instant.now();
    if (gate.isPaused() && !gate.isStopRequested()) {
      status = TaskStatus.PAUSED;
      pausedSinceMillis = System.currentTimeMillis();
    } else {
      status = TaskStatus.IN_PROGRESS;
    }
  }

  public synchronized void advance(int done) {
    if (done > this.done) {
      this.done = done;
    }
  }

  public synchronized void addUsage(Usage delta) {
    usage = usage.plus(delta);
  }

  public synchronized void addError(ItemError error) {
    errors.add(error);
  }

  /**
   * Ends the run. Unless stopped, {@code done} is raised to the known total.
   *
   * @param stopped the run was halted by a stop request before every item was dispatched
   */
  public synchronized void finish(int done, Usage usage, boolean stopped) {
    if (status.isTerminal()) {
      return;
    }
    advance(stopped ? done : Math.max(done, total));
    this.usage = usage == null ? Usage.ZERO : usage;
    endPause();
    this.status = stopped ? TaskStatus.STOPPED : TaskStatus.COMPLETED;
    this.finishedAt = Instant.now();
  }

  public synchronized void fail(String message) {
    if (status.isTerminal()) {
      return;
    }
    endPause();
    this.message = message;
    this.status = TaskStatus.FAILED;
    this.finishedAt = Instant.now();
  }

  /**
   * Pauses the gate and, for a running task, the status in one step so a concurrent start or
   * finish observes both or neither. Returns {@code true} if the gate was not paused before.
   */
  synchronized boolean requestPause() {
    if (!gate.pause()) {
      return false;
    }
    if (status == TaskStatus.IN_PROGRESS) {
      status = TaskStatus.PAUSED;
      pausedSinceMillis = System.currentTimeMillis();
    }
    return true;
  }

  /** Counterpart of {@link #requestPause()}. */
  synchronized boolean requestResume() {
    if (!gate.resume()) {
      return false;
    }
    if (status == TaskStatus.PAUSED) {
      endPause();
      status = TaskStatus.IN_PROGRESS;
    }
    return true;
  }

  private void endPause() {
    if (pausedSinceMillis >= 0) {
      pausedMillis += System.currentTimeMillis() - pausedSinceMillis;
      pausedSinceMillis = -1;
    }
  }

  /** Milliseconds spent running since start, excluding time spent paused. */
  public synchronized long activeMillis(long nowMillis) {
    if (startedAt == null) {
      return 0;
    }
    long end = finishedAt != null ? finishedAt.toEpochMilli() : nowMillis;
    long paused = pausedMillis;
    if (pausedSinceMillis >= 0) {
      paused += nowMillis - pausedSinceMillis;
    }
    return Math.max(0, end - startedAt.toEpochMilli() - paused);
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public ExtractionMode mode() {
    return mode;
  }

  public ControlGate gate() {
    return gate;
  }

  public TaskStatus status() {
    return status;
  }

  public int total() {
    return total;
  }

  public int done() {
    return done;
  }

  public int embedded() {
    return embedded;
  }

  public int pages() {
    return pages;
  }

  public Usage usage() {
    return usage;
  }

  public List<ItemError> errors() {
    return List.copyOf(errors);
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Instant finishedAt() {
    return finishedAt;
  }

  public String message() {
    return message;
  }

  public Path resultPath() {
    return resultPath;
  }

  void resultPath(Path resultPath) {
    this.resultPath = resultPath;
  }
}

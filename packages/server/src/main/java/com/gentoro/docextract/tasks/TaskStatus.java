package com.gentoro.docextract.tasks;

/** Lifecycle state of an extraction task. */
public enum TaskStatus {
  /** Accepted, waiting for a free task slot. */
  PENDING,
  /** Work items are being dispatched. */
  IN_PROGRESS,
  /** Dispatch is held; in-flight items still complete. */
  PAUSED,
  /** All items were processed; some may have failed. */
  COMPLETED,
  /** Ended early on user request with partial output. */
  STOPPED,
  /** The task itself could not run, e.g. its source was unreadable. */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == STOPPED || this == FAILED;
  }
}

package com.gentoro.docextract.pipeline;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pause/stop signal shared between a running pipeline and an external controller.
 *
 * <p>The flags are volatile fields, read without locking. Changing a flag also signals a
 * condition so a waiting pipeline wakes up before its next poll; waiters re-check the flags on
 * every poll interval regardless. All operations are idempotent, and stop is permanent.
 */
public final class ControlGate {
  private volatile boolean paused;
  private volatile boolean stopRequested;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();

  /** Returns {@code true} if this call paused the gate. */
  public boolean pause() {
    lock.lock();
    try {
      if (paused) {
        return false;
      }
      paused = true;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Returns {@code true} if this call cleared a pause. */
  public boolean resume() {
    lock.lock();
    try {
      if (!paused) {
        return false;
      }
      paused = false;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Returns {@code true} if this call requested the stop. */
  public boolean stop() {
    lock.lock();
    try {
      if (stopRequested) {
        return false;
      }
      stopRequested = true;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isPaused() {
    return paused;
  }

  public boolean isStopRequested() {
    return stopRequested;
  }

  /**
   * While paused, waits up to {@code maxWait} or until the next resume or stop. Returns
   * immediately when the gate is not paused or already stopped.
   */
  public void awaitChange(Duration maxWait) throws InterruptedException {
    lock.lockInterruptibly();
    try {
      if (paused && !stopRequested) {
        changed.await(maxWait.toMillis(), TimeUnit.MILLISECONDS);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks while the gate is paused, re-checking every {@code pollInterval}. Returns {@code true}
   * when dispatch may proceed, {@code false} once a stop has been requested.
   */
  public boolean awaitDispatchPermit(Duration pollInterval) throws InterruptedException {
    while (paused && !stopRequested) {
      awaitChange(pollInterval);
    }
    return !stopRequested;
  }
}

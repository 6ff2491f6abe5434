package com.gentoro.docextract.pipeline;

import com.gentoro.docextract.exception.ExceptionUtil;
import com.gentoro.docextract.model.Usage;
import com.gentoro.docextract.source.SourceBatch;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded-concurrency driver for one batch of work items.
 *
 * <p>Items are dispatched in sequence order with at most {@code concurrency} calls in flight, and
 * each completion is reported as a {@link PipelineEvent.Step} in completion order. Before every
 * dispatch the {@link ControlGate} is consulted: a stop ends dispatching for good (undispatched
 * items are dropped), a pause holds dispatching while in-flight items keep running and reporting.
 * Items already dispatched always run to completion and are never retried here.
 *
 * <p>The driver logic runs on the calling thread. With {@code concurrency == 1} items are processed
 * on that thread too, one after another, with the same control semantics.
 */
public class WorkerPool {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(WorkerPool.class);

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

  private final int concurrency;
  private final Duration pollInterval;
  private final AtomicInteger runCounter = new AtomicInteger();

  public WorkerPool(int concurrency) {
    this(concurrency, DEFAULT_POLL_INTERVAL);
  }

  public WorkerPool(int concurrency, Duration pollInterval) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
    }
    this.concurrency = concurrency;
    this.pollInterval =
        pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()
            ? DEFAULT_POLL_INTERVAL
            : pollInterval;
  }

  public int concurrency() {
    return concurrency;
  }

  /**
   * Runs the batch, emitting start, one step per dispatched item and finish to {@code listener}.
   *
   * @throws InterruptedException if the driver thread is interrupted; in-flight items are then
   *     cancelled and no finish event is emitted
   */
  public RunSummary run(
      SourceBatch batch, ItemProcessor processor, ControlGate gate, PipelineListener listener)
      throws InterruptedException {
    Run run = new Run(batch.items(), processor, gate, listener);
    listener.onEvent(
        new PipelineEvent.Start(batch.total(), batch.embeddedCount(), batch.pageCount()));
    if (batch.total() > 0) {
      if (concurrency == 1 || batch.total() == 1) {
        run.sequential();
      } else {
        run.concurrent();
      }
    }
    boolean stopped = run.dispatched < batch.total();
    listener.onEvent(new PipelineEvent.Finish(run.done, batch.total(), run.usage, stopped));
    if (stopped) {
      log.info("Run stopped after dispatching {} of {} item(s)", run.dispatched, batch.total());
    }
    return new RunSummary(batch.total(), run.dispatched, run.done, run.usage, stopped);
  }

  /** Totals of one run. {@code done == dispatched} whenever the run was not interrupted. */
  public record RunSummary(int total, int dispatched, int done, Usage usage, boolean stopped) {}

  private final class Run {
    private final List<WorkItem> items;
    private final ItemProcessor processor;
    private final ControlGate gate;
    private final PipelineListener listener;

    private int cursor;
    private int dispatched;
    private int done;
    private Usage usage = Usage.ZERO;

    Run(
        List<WorkItem> items,
        ItemProcessor processor,
        ControlGate gate,
        PipelineListener listener) {
      this.items = items;
      this.processor = processor;
      this.gate = gate;
      this.listener = listener;
    }

    void sequential() throws InterruptedException {
      while (cursor < items.size()) {
        if (!gate.awaitDispatchPermit(pollInterval)) {
          break;
        }
        WorkItem item = items.get(cursor++);
        dispatched++;
        complete(item, processSafely(processor, item));
      }
    }

    void concurrent() throws InterruptedException {
      int id = runCounter.incrementAndGet();
      AtomicInteger threadCounter = new AtomicInteger();
      ExecutorService executor =
          Executors.newFixedThreadPool(
              concurrency,
              r -> {
                String name = "extract-%d-worker-%d".formatted(id, threadCounter.incrementAndGet());
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
              });
      CompletionService<Completed> completions = new ExecutorCompletionService<>(executor);
      int inFlight = 0;
      try {
        while (true) {
          boolean pending = cursor < items.size();
          if (pending && gate.isStopRequested()) {
            break;
          }
          // once everything is dispatched a pause has nothing left to hold
          if (pending && gate.isPaused()) {
            if (inFlight > 0) {
              // keep reporting in-flight work while dispatch is held
              Future<Completed> next =
                  completions.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
              if (next != null) {
                inFlight--;
                complete(next);
              }
            } else {
              gate.awaitChange(pollInterval);
            }
            continue;
          }
          if (pending && inFlight < concurrency) {
            WorkItem item = items.get(cursor++);
            dispatched++;
            inFlight++;
            completions.submit(() -> new Completed(item, processSafely(processor, item)));
            continue;
          }
          if (inFlight == 0) {
            break;
          }
          inFlight--;
          complete(completions.take());
        }
        // stopped with items pending: drain what is already running
        while (inFlight > 0) {
          inFlight--;
          complete(completions.take());
        }
      } finally {
        executor.shutdownNow();
      }
    }

    private void complete(Future<Completed> future) throws InterruptedException {
      Completed completed;
      try {
        completed = future.get();
      } catch (ExecutionException e) {
        // processSafely does not throw, so this only covers errors such as OutOfMemoryError
        throw new IllegalStateException("Worker failed unexpectedly", e.getCause());
      }
      complete(completed.item(), completed.outcome());
    }

    private void complete(WorkItem item, ExtractionOutcome outcome) {
      done++;
      usage = usage.plus(outcome.usage());
      listener.onEvent(new PipelineEvent.Step(done, items.size(), item, outcome));
    }
  }

  private record Completed(WorkItem item, ExtractionOutcome outcome) {}

  static ExtractionOutcome processSafely(ItemProcessor processor, WorkItem item) {
    try {
      ExtractionOutcome outcome = processor.process(item);
      return outcome != null ? outcome : ExtractionOutcome.failure("No outcome produced");
    } catch (RuntimeException e) {
      log.warn("Processing of {} failed: {}", item.name(), e.toString());
      return ExtractionOutcome.failure(ExceptionUtil.extractErrorMessage(e));
    }
  }
}

package com.gentoro.docextract.tasks;

import com.gentoro.docextract.exception.ExceptionUtil;
import com.gentoro.docextract.model.Usage;
import com.gentoro.docextract.output.DocumentWriter;
import com.gentoro.docextract.pipeline.ExtractionPipeline;
import com.gentoro.docextract.pipeline.PipelineEvent;
import com.gentoro.docextract.pipeline.PipelineListener;
import com.gentoro.docextract.pipeline.PipelineResult;
import com.gentoro.docextract.source.SourceBatch;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;

/**
 * Process-wide registry of extraction tasks.
 *
 * <p>Each submitted task runs on a bounded task executor: its source is loaded, the batch goes
 * through the {@link ExtractionPipeline} with a {@link ProgressAggregator} keeping the task state
 * current, and the ordered result is written by the {@link DocumentWriter}. The task reaches its
 * terminal status only after the document has been written. Pause, resume and stop act on the
 * task's control gate. Terminal tasks are evicted once older than the retention period.
 */
public final class TaskRegistry implements AutoCloseable {
  private static final Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(TaskRegistry.class);

  private final TaskStore store;
  private final ExtractionPipeline pipeline;
  private final DocumentWriter writer;
  private final Duration retention;
  private final ExecutorService executor;
  private final AtomicInteger threadCounter = new AtomicInteger();
  private volatile ScheduledExecutorService sweeper;

  public TaskRegistry(
      TaskStore store,
      ExtractionPipeline pipeline,
      DocumentWriter writer,
      int maxConcurrentTasks,
      Duration retention) {
    if (maxConcurrentTasks < 1) {
      throw new IllegalArgumentException("maxConcurrentTasks must be >= 1");
    }
    this.store = store;
    this.pipeline = pipeline;
    this.writer = writer;
    this.retention = retention == null ? Duration.ofHours(1) : retention;
    this.executor =
        Executors.newFixedThreadPool(
            maxConcurrentTasks,
            r -> {
              Thread t = new Thread(r, "task-runner-" + threadCounter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public String submit(TaskRequest request) {
    String id = UUID.randomUUID().toString();
    TaskState state = new TaskState(id, request.name(), request.mode());
    store.put(state);
    log.info("Accepted task {} '{}' ({} mode)", id, request.name(), request.mode().wireName());
    executor.execute(() -> run(state, request));
    return id;
  }

  private void run(TaskState state, TaskRequest request) {
    ProgressAggregator aggregator = new ProgressAggregator(state);
    if (state.gate().isStopRequested()) {
      // stopped before start
      aggregator.onEvent(new PipelineEvent.Start(0, 0, 0));
      aggregator.onEvent(new PipelineEvent.Finish(0, 0, Usage.ZERO, true));
      return;
    }

    // the finish event is applied once the document exists
    AtomicReference<PipelineEvent.Finish> finish = new AtomicReference<>();
    PipelineListener listener =
        event -> {
          if (event instanceof PipelineEvent.Finish f) {
            finish.set(f);
          } else {
            aggregator.onEvent(event);
          }
        };

    try {
      SourceBatch batch = request.source().load();
      PipelineResult result = pipeline.run(batch, state.mode(), state.gate(), listener);
      Path document = writer.write(documentName(state), state.name(), result);
      state.resultPath(document);
      aggregator.onEvent(finish.get());
      log.info(
          "Task {} {} with {} error(s)",
          state.id(),
          state.status().name().toLowerCase(Locale.ROOT),
          state.errors().size());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      state.fail("Interrupted");
    } catch (Exception e) {
      log.error("Task {} failed: {}", state.id(), e.toString());
      state.fail(ExceptionUtil.extractErrorMessage(e));
    }
  }

  private static String documentName(TaskState state) {
    return "%s_%s_%s".formatted(state.name(), state.mode().wireName(), state.id().substring(0, 8));
  }

  public Optional<TaskView> view(String id) {
    return store.get(id).map(s -> TaskView.fromState(s, System.currentTimeMillis()));
  }

  /** The written document of a terminal task, if any. */
  public Optional<Path> result(String id) {
    return store
        .get(id)
        .filter(s -> s.status().isTerminal())
        .map(TaskState::resultPath);
  }

  public boolean pause(String id) {
    Optional<TaskState> state = store.get(id);
    state.ifPresent(
        s -> {
          if (s.requestPause()) {
            log.info("Task {} paused", id);
          }
        });
    return state.isPresent();
  }

  public boolean resume(String id) {
    Optional<TaskState> state = store.get(id);
    state.ifPresent(
        s -> {
          if (s.requestResume()) {
            log.info("Task {} resumed", id);
          }
        });
    return state.isPresent();
  }

  public boolean stop(String id) {
    Optional<TaskState> state = store.get(id);
    state.ifPresent(
        s -> {
          if (s.gate().stop()) {
            log.info("Task {} stop requested", id);
          }
        });
    return state.isPresent();
  }

  /** Removes terminal tasks that finished more than the retention period before {@code now}. */
  public int sweepExpired(Instant now) {
    int removed = 0;
    Instant cutoff = now.minus(retention);
    for (TaskState state : store.all()) {
      Instant finishedAt = state.finishedAt();
      if (state.status().isTerminal() && finishedAt != null && finishedAt.isBefore(cutoff)) {
        store.remove(state.id());
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Evicted {} expired task(s)", removed);
    }
    return removed;
  }

  public synchronized void startSweeper(Duration interval) {
    if (sweeper != null) {
      return;
    }
    sweeper =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "task-sweeper");
              t.setDaemon(true);
              return t;
            });
    long millis = Math.max(1, interval.toMillis());
    sweeper.scheduleAtFixedRate(
        () -> {
          try {
            sweepExpired(Instant.now());
          } catch (RuntimeException e) {
            log.warn("Task sweep failed: {}", e.toString());
          }
        },
        millis,
        millis,
        TimeUnit.MILLISECONDS);
  }

  @Override
  public synchronized void close() {
    if (sweeper != null) {
      sweeper.shutdownNow();
      sweeper = null;
    }
    executor.shutdownNow();
  }
}

package com.gentoro.docextract.tasks;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docextract.content.ContentParser;
import com.gentoro.docextract.exception.OutputException;
import com.gentoro.docextract.exception.SourceException;
import com.gentoro.docextract.model.ExtractionClient;
import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.model.ExtractionResponse;
import com.gentoro.docextract.model.Usage;
import com.gentoro.docextract.output.JsonDocumentWriter;
import com.gentoro.docextract.pipeline.ExtractionPipeline;
import com.gentoro.docextract.pipeline.WorkItem;
import com.gentoro.docextract.pipeline.WorkerPool;
import com.gentoro.docextract.source.BytesImageRef;
import com.gentoro.docextract.source.SourceBatch;
import com.gentoro.docextract.source.WorkItemSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TaskRegistryTest {
  @TempDir Path outputDir;

  private final CountDownLatch release = new CountDownLatch(1);
  private TaskRegistry registry;

  /** Answers every page with a paragraph; {@code slow-*} pages wait for {@link #release}. */
  private final ExtractionClient client =
      (item, mode) -> {
        if (item.name().startsWith("slow")) {
          try {
            release.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        }
        if (item.name().contains("blank")) {
          return new ExtractionResponse("{\"content\":[]}", new Usage(1, 0, 1));
        }
        return new ExtractionResponse(
            "{\"content\":[{\"type\":\"paragraph\",\"text\":\"" + item.name() + "\"}]}",
            new Usage(10, 5, 15));
      };

  @AfterEach
  void tearDown() {
    release.countDown();
    if (registry != null) {
      registry.close();
    }
  }

  private TaskRegistry registry(int workers, int maxTasks) {
    ExtractionPipeline pipeline =
        new ExtractionPipeline(
            client, new ContentParser(), new WorkerPool(workers, Duration.ofMillis(20)));
    registry =
        new TaskRegistry(
            new InMemoryTaskStore(),
            pipeline,
            new JsonDocumentWriter(outputDir),
            maxTasks,
            Duration.ofMinutes(5));
    return registry;
  }

  private static WorkItemSource source(String displayName, String... names) {
    return new WorkItemSource() {
      @Override
      public String displayName() {
        return displayName;
      }

      @Override
      public SourceBatch load() {
        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
          items.add(new WorkItem(i, new BytesImageRef(new byte[] {1}, "image/png"), names[i]));
        }
        return new SourceBatch(items, 0, names.length);
      }
    };
  }

  @Test
  @DisplayName("A submitted task completes and writes its document")
  void completesAndWritesDocument() throws Exception {
    TaskRegistry tasks = registry(2, 2);

    String id =
        tasks.submit(
            new TaskRequest(
                null, ExtractionMode.TEXT, source("scans", "page-1", "blank-2", "page-3")));

    TaskView view = awaitStatus(tasks, id, TaskStatus.COMPLETED, Duration.ofSeconds(5));
    assertEquals("scans", view.name());
    assertEquals("text", view.mode());
    assertEquals(3, view.total());
    assertEquals(3, view.done());
    assertEquals(3, view.pages());
    assertEquals(31, view.usage().total());
    assertEquals(1, view.errors().size());
    assertEquals("no_content", view.errors().get(0).reason());
    assertTrue(view.resultAvailable());

    Path document = tasks.result(id).orElseThrow();
    assertTrue(Files.exists(document));
    assertTrue(document.getFileName().toString().startsWith("scans_text_" + id.substring(0, 8)));
    assertTrue(Files.readString(document).contains("page-3"));
  }

  @Test
  @DisplayName("Pause holds dispatch until resume, then the task completes")
  void pauseAndResume() throws Exception {
    TaskRegistry tasks = registry(1, 1);
    String id =
        tasks.submit(
            new TaskRequest(
                "held", ExtractionMode.TEXT, source("x", "slow-1", "page-2", "page-3")));
    awaitStatus(tasks, id, TaskStatus.IN_PROGRESS, Duration.ofSeconds(5));

    assertTrue(tasks.pause(id));
    assertEquals(TaskStatus.PAUSED, tasks.view(id).orElseThrow().status());
    assertTrue(tasks.view(id).orElseThrow().paused());

    release.countDown();
    Thread.sleep(200);
    TaskView paused = tasks.view(id).orElseThrow();
    assertEquals(TaskStatus.PAUSED, paused.status());
    assertEquals(1, paused.done());
    assertTrue(tasks.result(id).isEmpty());

    assertTrue(tasks.resume(id));
    TaskView view = awaitStatus(tasks, id, TaskStatus.COMPLETED, Duration.ofSeconds(5));
    assertEquals(3, view.done());
    assertFalse(view.paused());
  }

  @Test
  @DisplayName("Stop keeps the finished items and ends as STOPPED")
  void stopKeepsPartialResult() throws Exception {
    TaskRegistry tasks = registry(1, 1);
    String id =
        tasks.submit(
            new TaskRequest(
                "partial", ExtractionMode.TEXT, source("x", "slow-1", "page-2", "page-3")));
    awaitStatus(tasks, id, TaskStatus.IN_PROGRESS, Duration.ofSeconds(5));

    assertTrue(tasks.stop(id));
    release.countDown();

    TaskView view = awaitStatus(tasks, id, TaskStatus.STOPPED, Duration.ofSeconds(5));
    assertEquals(1, view.done());
    assertEquals(3, view.total());
    assertTrue(view.stopRequested());
    String document = Files.readString(tasks.result(id).orElseThrow());
    assertTrue(document.contains("slow-1"));
    assertFalse(document.contains("page-2"));
  }

  @Test
  @DisplayName("A task stopped while still queued never starts")
  void stopBeforeStart() throws Exception {
    TaskRegistry tasks = registry(1, 1);
    String first =
        tasks.submit(new TaskRequest("first", ExtractionMode.TEXT, source("x", "slow-1")));
    String second =
        tasks.submit(new TaskRequest("second", ExtractionMode.TEXT, source("y", "page-1")));

    assertEquals(TaskStatus.PENDING, tasks.view(second).orElseThrow().status());
    tasks.stop(second);
    release.countDown();

    awaitStatus(tasks, first, TaskStatus.COMPLETED, Duration.ofSeconds(5));
    TaskView view = awaitStatus(tasks, second, TaskStatus.STOPPED, Duration.ofSeconds(5));
    assertEquals(0, view.total());
    assertFalse(view.resultAvailable());
  }

  @Test
  void unreadableSourceFailsTheTask() throws Exception {
    TaskRegistry tasks = registry(2, 1);
    WorkItemSource missing =
        new WorkItemSource() {
          @Override
          public String displayName() {
            return "missing";
          }

          @Override
          public SourceBatch load() {
            throw new SourceException("PDF not found: missing.pdf");
          }
        };

    String id = tasks.submit(new TaskRequest(null, ExtractionMode.TABLE, missing));

    TaskView view = awaitStatus(tasks, id, TaskStatus.FAILED, Duration.ofSeconds(5));
    assertEquals("SourceException: PDF not found: missing.pdf", view.message());
  }

  @Test
  @DisplayName("A writer failure fails the task instead of completing it")
  void writerFailureFailsTheTask() throws Exception {
    registry =
        new TaskRegistry(
            new InMemoryTaskStore(),
            new ExtractionPipeline(client, new ContentParser(), new WorkerPool(1)),
            (baseName, title, result) -> {
              throw new OutputException("disk full");
            },
            1,
            Duration.ofMinutes(5));

    String id =
        registry.submit(new TaskRequest("doc", ExtractionMode.TEXT, source("x", "page-1")));

    TaskView view = awaitStatus(registry, id, TaskStatus.FAILED, Duration.ofSeconds(5));
    assertEquals("OutputException: disk full", view.message());
    assertEquals(1, view.done());
  }

  @Test
  void unknownTasksAreReported() {
    TaskRegistry tasks = registry(1, 1);

    assertTrue(tasks.view("nope").isEmpty());
    assertTrue(tasks.result("nope").isEmpty());
    assertFalse(tasks.pause("nope"));
    assertFalse(tasks.resume("nope"));
    assertFalse(tasks.stop("nope"));
  }

  @Test
  @DisplayName("Terminal tasks are evicted after the retention period")
  void sweepsExpiredTasks() throws Exception {
    TaskRegistry tasks = registry(1, 1);
    String id = tasks.submit(new TaskRequest("old", ExtractionMode.TEXT, source("x", "page-1")));
    awaitStatus(tasks, id, TaskStatus.COMPLETED, Duration.ofSeconds(5));

    assertEquals(0, tasks.sweepExpired(Instant.now()));
    assertEquals(1, tasks.sweepExpired(Instant.now().plus(Duration.ofMinutes(6))));
    assertTrue(tasks.view(id).isEmpty());
  }

  private static TaskView awaitStatus(
      TaskRegistry registry, String id, TaskStatus desired, Duration timeout) throws Exception {
    long end = System.currentTimeMillis() + timeout.toMillis();
    while (System.currentTimeMillis() < end) {
      var v = registry.view(id);
      if (v.isPresent() && v.get().status() == desired) return v.get();
      Thread.sleep(20);
    }
    fail("Timeout waiting for status " + desired + ", last: " + registry.view(id));
    return null; // Unreachable
  }
}

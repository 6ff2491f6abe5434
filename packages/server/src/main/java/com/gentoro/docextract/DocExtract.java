package com.gentoro.docextract;

import com.gentoro.docextract.content.ContentParser;
import com.gentoro.docextract.exception.ConfigException;
import com.gentoro.docextract.exception.StateException;
import com.gentoro.docextract.http.EmbeddedJettyServer;
import com.gentoro.docextract.logging.LoggingService;
import com.gentoro.docextract.management.TaskServer;
import com.gentoro.docextract.model.ExtractionClient;
import com.gentoro.docextract.model.ExtractionClientFactory;
import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.output.DocumentWriter;
import com.gentoro.docextract.output.JsonDocumentWriter;
import com.gentoro.docextract.pipeline.ControlGate;
import com.gentoro.docextract.pipeline.ExtractionPipeline;
import com.gentoro.docextract.pipeline.PipelineEvent;
import com.gentoro.docextract.pipeline.PipelineResult;
import com.gentoro.docextract.pipeline.WorkerPool;
import com.gentoro.docextract.source.PdfBoxImageExtractor;
import com.gentoro.docextract.source.SourceFactory;
import com.gentoro.docextract.source.WorkItemSource;
import com.gentoro.docextract.tasks.InMemoryTaskStore;
import com.gentoro.docextract.tasks.TaskRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application container: loads configuration, wires the extraction client, pipeline, writer and
 * task registry, then either serves the task API ({@code --mode=server}) or processes one input
 * and exits ({@code --mode=batch --input=<dir|pdf|image>}).
 */
public class DocExtract {
  private static final org.slf4j.Logger log = LoggingService.getLogger(DocExtract.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ExtractionPipeline pipeline;
  private DocumentWriter documentWriter;
  private SourceFactory sourceFactory;
  private TaskRegistry taskRegistry;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public DocExtract(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    ExtractionClient client = ExtractionClientFactory.create(configuration());
    WorkerPool workerPool =
        new WorkerPool(
            configuration().getInt("pipeline.workers", 4),
            Duration.ofMillis(configuration().getLong("pipeline.pollIntervalMs", 500)));
    this.pipeline = new ExtractionPipeline(client, new ContentParser(), workerPool);
    this.documentWriter =
        new JsonDocumentWriter(Path.of(configuration().getString("output.directory", "output")));
    this.sourceFactory =
        SourceFactory.fromConfiguration(configuration(), new PdfBoxImageExtractor());

    switch (startupParameters.mode()) {
      case "server" -> startServer();
      case "batch" -> {
        runBatch();
        shutdown();
      }
      default -> throw new ConfigException("Invalid mode: " + startupParameters.mode());
    }
  }

  private void startServer() {
    this.taskRegistry =
        new TaskRegistry(
            new InMemoryTaskStore(),
            pipeline,
            documentWriter,
            configuration().getInt("tasks.maxConcurrent", 2),
            Duration.ofMinutes(configuration().getLong("tasks.retentionMinutes", 60)));
    taskRegistry.startSweeper(
        Duration.ofSeconds(configuration().getLong("tasks.sweepIntervalSeconds", 60)));

    this.httpServer = EmbeddedJettyServer.fromConfiguration(configuration());
    new TaskServer(taskRegistry, sourceFactory).register(httpServer.contextHandler());
    try {
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  /**
   * Processes {@code --input} once, on the calling thread, writing one document per source. A
   * directory containing PDFs (searched recursively) produces one document per PDF; otherwise its
   * images form a single batch.
   */
  List<PipelineResult> runBatch() {
    Path input = startupParameters.getParameter("input", Path.class);
    if (input == null) {
      throw new ConfigException(
          "Batch mode requires --input=<directory|pdf|image>; a directory with PDFs below it"
              + " yields one document per PDF, otherwise its images form one batch");
    }
    ExtractionMode mode =
        ExtractionMode.fromString(startupParameters.getParameter("extract", "text"));
    List<WorkItemSource> sources = sourceFactory.forBatchInput(input);
    List<PipelineResult> results = new ArrayList<>(sources.size());
    for (WorkItemSource source : sources) {
      // --name only applies when the input is a single document
      String name =
          sources.size() == 1
              ? startupParameters.getParameter("name", source.displayName())
              : source.displayName();
      results.add(runBatch(source, name, mode));
    }
    return results;
  }

  private PipelineResult runBatch(WorkItemSource source, String name, ExtractionMode mode) {
    PipelineResult result;
    try {
      result =
          pipeline.run(
              source.load(),
              mode,
              new ControlGate(),
              event -> {
                if (event instanceof PipelineEvent.Step step) {
                  log.info(
                      "[{}/{}] {}{}",
                      step.done(),
                      step.total(),
                      step.image(),
                      step.error() != null ? " failed: " + step.error() : "");
                }
              });
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StateException("Batch run interrupted", e);
    }
    Path document = documentWriter.write(name + "_" + mode.wireName(), name, result);
    log.info(
        "Batch '{}' finished: {} of {} item(s) extracted, {} error(s), {} tokens -> {}",
        name,
        result.results().size(),
        result.total(),
        result.errors().size(),
        result.usage().total(),
        document);
    return result;
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "docextract-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (httpServer != null) {
          httpServer.close();
        }
        if (taskRegistry != null) {
          taskRegistry.close();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("DocExtract not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public TaskRegistry taskRegistry() {
    return taskRegistry;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}

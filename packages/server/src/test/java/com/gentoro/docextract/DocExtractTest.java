package com.gentoro.docextract;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docextract.exception.ConfigException;
import com.gentoro.docextract.utility.JacksonUtility;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocExtractTest {
  @TempDir Path dir;

  private HttpServer extractionService;
  private final AtomicInteger calls = new AtomicInteger();
  private Path configFile;
  private Path images;
  private Path output;

  /** Starts a fake chat-completions service that recognizes one heading per image. */
  @BeforeEach
  void setUp() throws Exception {
    extractionService = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    extractionService.createContext(
        "/chat/completions",
        exchange -> {
          exchange.getRequestBody().readAllBytes();
          int n = calls.incrementAndGet();
          ObjectNode heading = JacksonUtility.getJsonMapper().createObjectNode();
          heading.putArray("content").addObject().put("type", "h1").put("text", "Heading " + n);
          ObjectNode answer = JacksonUtility.getJsonMapper().createObjectNode();
          answer
              .putArray("choices")
              .addObject()
              .putObject("message")
              .put("content", heading.toString());
          answer
              .putObject("usage")
              .put("prompt_tokens", 5)
              .put("completion_tokens", 2)
              .put("total_tokens", 7);
          byte[] body = answer.toString().getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "application/json");
          exchange.sendResponseHeaders(200, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    extractionService.setExecutor(Executors.newFixedThreadPool(4));
    extractionService.start();

    images = Files.createDirectory(dir.resolve("scans"));
    for (String name : new String[] {"p1.png", "p2.png", "p10.png"}) {
      Files.write(images.resolve(name), new byte[] {1, 2, 3});
    }
    output = dir.resolve("output");

    configFile = dir.resolve("application.yaml");
    Files.writeString(
        configFile,
        """
        extraction:
          baseUrl: http://127.0.0.1:%d
          apiKey: test-key
          retries: 0
        pipeline:
          workers: 2
          pollIntervalMs: 20
        output:
          directory: "%s"
        tasks:
          maxConcurrent: 1
        http:
          hostname: 127.0.0.1
          port: 0
        """
            .formatted(extractionService.getAddress().getPort(), output));
  }

  @AfterEach
  void tearDown() {
    extractionService.stop(0);
  }

  @Test
  @DisplayName("Batch mode extracts a directory and writes one document")
  void batchMode() throws Exception {
    DocExtract app =
        new DocExtract(
            new String[] {
              "--mode=batch", "--config-file=" + configFile, "--input=" + images, "--name=scans"
            });
    app.initialize();

    Path document = output.resolve("scans_text.json");
    assertTrue(Files.exists(document));
    JsonNode json = JacksonUtility.getJsonMapper().readTree(document.toFile());
    assertEquals(3, json.path("items").size());
    assertEquals("p10.png", json.path("items").get(2).path("image").asText());
    assertEquals(21, json.path("usage").path("total").asLong());
    assertEquals(3, calls.get());
  }

  @Test
  @DisplayName("Batch mode writes one document per PDF found below a directory")
  void batchModeOverPdfFolder() throws Exception {
    Path reports = Files.createDirectories(dir.resolve("reports/2024"));
    writeBlankPdf(dir.resolve("reports/summary.pdf"));
    writeBlankPdf(reports.resolve("annual.pdf"));
    DocExtract app =
        new DocExtract(
            new String[] {
              "--mode=batch",
              "--config-file=" + configFile,
              "--input=" + dir.resolve("reports"),
              "--name=ignored"
            });
    app.initialize();

    assertTrue(Files.exists(output.resolve("summary_text.json")));
    assertTrue(Files.exists(output.resolve("annual_text.json")));
    assertFalse(Files.exists(output.resolve("ignored_text.json")));
    JsonNode annual =
        JacksonUtility.getJsonMapper().readTree(output.resolve("annual_text.json").toFile());
    assertEquals("page-001-full.png", annual.path("items").get(0).path("image").asText());
    assertEquals(2, calls.get());
  }

  private static void writeBlankPdf(Path target) throws Exception {
    try (PDDocument document = new PDDocument()) {
      document.addPage(new PDPage());
      document.save(target.toFile());
    }
  }

  @Test
  @DisplayName("Server mode accepts a task, reports progress and serves the result")
  void serverMode() throws Exception {
    DocExtract app = new DocExtract(new String[] {"--config-file=" + configFile});
    app.initialize();
    try {
      String base = "http://127.0.0.1:" + app.httpServer().port() + "/api/tasks";
      OkHttpClient http = new OkHttpClient();

      String taskId;
      RequestBody submit =
          RequestBody.create(
              "{\"directory\":\"" + images + "\",\"mode\":\"text\"}",
              MediaType.get("application/json"));
      try (Response resp = http.newCall(new Request.Builder().url(base).post(submit).build())
          .execute()) {
        assertEquals(202, resp.code());
        taskId =
            JacksonUtility.getJsonMapper().readTree(resp.body().string()).path("taskId").asText();
      }

      JsonNode status = null;
      long end = System.currentTimeMillis() + Duration.ofSeconds(10).toMillis();
      while (System.currentTimeMillis() < end) {
        try (Response resp =
            http.newCall(new Request.Builder().url(base + "/status/" + taskId).build())
                .execute()) {
          status = JacksonUtility.getJsonMapper().readTree(resp.body().string());
        }
        if ("COMPLETED".equals(status.path("status").asText())) {
          break;
        }
        Thread.sleep(50);
      }
      assertNotNull(status);
      assertEquals("COMPLETED", status.path("status").asText());
      assertEquals(3, status.path("done").asInt());
      assertTrue(status.path("resultAvailable").asBoolean());

      try (Response resp =
          http.newCall(new Request.Builder().url(base + "/result/" + taskId).build()).execute()) {
        assertEquals(200, resp.code());
        assertTrue(resp.body().string().contains("Heading"));
      }
    } finally {
      app.shutdown();
    }
  }

  @Test
  void unknownModeIsRejected() throws Exception {
    DocExtract app = new DocExtract(new String[] {"--mode=daemon", "--config-file=" + configFile});
    assertThrows(ConfigException.class, app::initialize);
  }

  @Test
  void batchModeRequiresInput() {
    DocExtract app = new DocExtract(new String[] {"--mode=batch", "--config-file=" + configFile});
    assertThrows(ConfigException.class, app::initialize);
  }
}

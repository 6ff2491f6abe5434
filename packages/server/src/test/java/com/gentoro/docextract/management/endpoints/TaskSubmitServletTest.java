package com.gentoro.docextract.management.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.docextract.model.ExtractionMode;
import com.gentoro.docextract.source.ImageBatchSource;
import com.gentoro.docextract.source.PdfBoxImageExtractor;
import com.gentoro.docextract.source.PdfPageSource;
import com.gentoro.docextract.source.SourceFactory;
import com.gentoro.docextract.source.SourceMode;
import com.gentoro.docextract.tasks.TaskRegistry;
import com.gentoro.docextract.tasks.TaskRequest;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class TaskSubmitServletTest {
  private TaskRegistry tasks;
  private ServletTester tester;

  @BeforeEach
  void setUp() throws Exception {
    tasks = Mockito.mock(TaskRegistry.class);
    Mockito.when(tasks.submit(Mockito.any())).thenReturn("task-123");
    SourceFactory sources = new SourceFactory(new PdfBoxImageExtractor(), SourceMode.BOTH, 200);

    tester = new ServletTester();
    tester.addServlet(new ServletHolder(new TaskSubmitServlet(tasks, sources)), "/api/tasks");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private HttpTester.Response post(String json) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod("POST");
    req.setURI("/api/tasks");
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "localhost");
    req.setHeader("Content-Type", "application/json");
    req.setContent(json);
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  @Test
  void acceptsDirectoryBatch() throws Exception {
    HttpTester.Response resp =
        post("{\"name\":\"scans\",\"mode\":\"table\",\"directory\":\"/data/scans\"}");

    assertEquals(202, resp.getStatus());
    assertTrue(resp.getContent().contains("\"taskId\":\"task-123\""));

    ArgumentCaptor<TaskRequest> captor = ArgumentCaptor.forClass(TaskRequest.class);
    Mockito.verify(tasks).submit(captor.capture());
    assertEquals("scans", captor.getValue().name());
    assertEquals(ExtractionMode.TABLE, captor.getValue().mode());
    assertInstanceOf(ImageBatchSource.class, captor.getValue().source());
  }

  @Test
  void acceptsPdfWithSourceMode() throws Exception {
    HttpTester.Response resp = post("{\"pdf\":\"/data/report.pdf\",\"source\":\"page\"}");

    assertEquals(202, resp.getStatus());
    ArgumentCaptor<TaskRequest> captor = ArgumentCaptor.forClass(TaskRequest.class);
    Mockito.verify(tasks).submit(captor.capture());
    assertEquals("report", captor.getValue().name());
    assertEquals(ExtractionMode.TEXT, captor.getValue().mode());
    assertInstanceOf(PdfPageSource.class, captor.getValue().source());
  }

  @Test
  void rejectsInvalidBodies() throws Exception {
    assertEquals(400, post("not json").getStatus());
    assertEquals(400, post("[1,2]").getStatus());
    assertEquals(400, post("{\"name\":\"nothing\"}").getStatus());
    assertEquals(400, post("{\"directory\":\"/a\",\"pdf\":\"/b.pdf\"}").getStatus());
    assertEquals(400, post("{\"images\":[]}").getStatus());

    HttpTester.Response badMode = post("{\"directory\":\"/a\",\"mode\":\"audio\"}");
    assertEquals(400, badMode.getStatus());
    assertTrue(badMode.getContent().contains("Unknown extraction mode"));

    Mockito.verify(tasks, Mockito.never()).submit(Mockito.any());
  }
}

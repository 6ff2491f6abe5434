package com.gentoro.docextract;

public class DocExtractApp {

  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(DocExtractApp.class);

  public static void main(String[] args) {
    try {
      DocExtract app = new DocExtract(args);
      app.initialize();
      // batch mode has already shut down; the latch is released
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}

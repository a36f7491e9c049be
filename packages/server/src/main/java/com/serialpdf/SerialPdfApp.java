package com.serialpdf;

public class SerialPdfApp {

  private static final org.slf4j.Logger log =
      com.serialpdf.logging.LoggingService.getLogger(SerialPdfApp.class);

  public static void main(String[] args) {
    try {
      SerialPdf app = new SerialPdf(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}

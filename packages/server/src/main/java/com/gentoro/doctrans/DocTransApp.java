package com.gentoro.doctrans;

import com.gentoro.doctrans.logging.LoggingService;
import org.slf4j.Logger;

public class DocTransApp {

  private static final Logger log = LoggingService.getLogger(DocTransApp.class);

  public static void main(String[] args) {
    try {
      DocTrans app = new DocTrans(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}

package com.gentoro.doctrans.api;

import com.gentoro.doctrans.DocTrans;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the translation endpoints under {@code /api} on the shared Jetty context. */
public final class TranslationServer {

  private final DocTrans docTrans;

  public TranslationServer(DocTrans docTrans) {
    this.docTrans = docTrans;
  }

  private String contextPath() {
    return "/api";
  }

  public void register() {
    var ctx = docTrans.httpServer().getContextHandler();
    OwnerResolver owners = docTrans.ownerResolver();

    ctx.addServlet(
        new ServletHolder(new TranslateServlet(docTrans.translationService(), owners)),
        "%s/translate".formatted(contextPath()));

    ctx.addServlet(
        new ServletHolder(new TaskStatusServlet(docTrans.taskManager(), owners)),
        "%s/translate/status/*".formatted(contextPath()));

    ServletHolder stream =
        new ServletHolder(
            new TaskStreamServlet(docTrans.streamGateway(), owners, docTrans.streamExecutor()));
    stream.setAsyncSupported(true);
    ctx.addServlet(stream, "%s/translate/stream/*".formatted(contextPath()));

    // "/history/*" also matches the bare "/history" used for listing
    ctx.addServlet(
        new ServletHolder(new TaskHistoryServlet(docTrans.taskManager(), owners)),
        "%s/translate/history/*".formatted(contextPath()));
  }
}

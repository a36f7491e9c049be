package com.serialpdf.http;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/** GET / - liveness text with the worker count. */
public final class IndexServlet extends HttpServlet {
  private final int concurrency;

  public IndexServlet(int concurrency) {
    this.concurrency = concurrency;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    resp.setStatus(200);
    resp.setContentType("text/plain");
    resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
    resp.getWriter().write("serial-pdf is running with up to %d worker(s)".formatted(concurrency));
  }
}

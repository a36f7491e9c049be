package com.serialpdf.http;

import com.serialpdf.exception.ConfigException;
import com.serialpdf.exception.ExceptionUtil;
import com.serialpdf.exception.NetworkException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle; servlets are registered on {@link #getContextHandler()} between
 * {@link #prepare()} and {@link #start()}. Reads {@code http.port} (default 8080, 0 for an
 * ephemeral port) and {@code http.hostname} (default {@code 0.0.0.0}).
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.serialpdf.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the server and its root context without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", 8080);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }
      String hostname = configuration.getString("http.hostname", "0.0.0.0");
      if (StringUtils.isBlank(hostname)) {
        throw new ConfigException("Missing http.hostname configuration");
      }
      hostname = hostname.trim();

      QueuedThreadPool threadPool = new QueuedThreadPool();
      threadPool.setDaemon(true);
      threadPool.setName("jetty-http");
      server = new Server(threadPool);

      ServerConnector connector = new ServerConnector(server);
      if (!hostname.equals("0.0.0.0")) {
        connector.setHost(hostname);
      }
      connector.setPort(port);
      server.addConnector(connector);

      contextHandler = new ServletContextHandler();
      contextHandler.setContextPath("/");
      server.setHandler(contextHandler);
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        server.start();
        log.info("HTTP interface listening on port {}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new NetworkException(
                    "Could not start the HTTP listener, check that port and hostname are available",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      try {
        if (server.isStarted() || server.isStarting()) {
          server.setStopTimeout(2000);
          server.stop();
        }
      } catch (Exception e) {
        // Keep shutting down the remaining components
        log.error("Error stopping jetty server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started, else the configured one. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return configuration.getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}

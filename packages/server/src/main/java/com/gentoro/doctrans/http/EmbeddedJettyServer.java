package com.gentoro.doctrans.http;

import com.gentoro.doctrans.exception.ConfigException;
import com.gentoro.doctrans.exception.ExceptionUtil;
import com.gentoro.doctrans.exception.NetworkException;
import com.gentoro.doctrans.logging.LoggingService;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle (prepare/start/stop) and exposes the context handler so the API layer
 * can register its servlets before {@link #start()}. Reads {@code http.hostname}, {@code http.port}
 * and {@code http.idleTimeoutMs}; the idle timeout must stay above the stream keepalive interval or
 * idle event streams are cut by the connector.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(EmbeddedJettyServer.class);

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Create the server, connector and root context without starting them. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      long idleTimeout;
      String hostname;
      try {
        port = configuration.getInt("http.port", 8080);
        idleTimeout = configuration.getLong("http.idleTimeoutMs", 120_000L);
        hostname = configuration.getString("http.hostname", "0.0.0.0");
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http configuration", e);
      }
      if (hostname == null || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }

      try {
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");
        server = new Server(threadPool);

        ServerConnector connector = new ServerConnector(server);
        if (!"0.0.0.0".equals(hostname.trim())) {
          connector.setHost(hostname.trim());
        }
        connector.setPort(port);
        connector.setIdleTimeout(idleTimeout);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException("Failed to initialize the http server", e);
      }
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return;
      }
      if (server == null) {
        prepare();
      }
      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new NetworkException(
                    "Failed to start the http server; check that the configured hostname and port"
                        + " are available",
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
        server.setStopTimeout(2000);
        server.stop();
      } catch (Exception e) {
        // stopping continues with the remaining services
        log.error("Error stopping the http server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
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

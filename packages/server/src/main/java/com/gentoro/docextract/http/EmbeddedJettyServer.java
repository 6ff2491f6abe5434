package com.gentoro.docextract.http;

import com.gentoro.docextract.exception.ConfigException;
import com.gentoro.docextract.exception.NetworkException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a single root {@link ServletContextHandler} on which the task
 * endpoints are registered before {@link #start()}.
 *
 * <p>Configured by {@code http.hostname} (default {@code 0.0.0.0}, all interfaces) and {@code
 * http.port} (default 8080; {@code 0} binds a free port, see {@link #port()}). Worker threads are
 * daemons so a stopped main thread does not keep the JVM alive.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  public static final int DEFAULT_PORT = 8080;
  private static final String ANY_HOST = "0.0.0.0";

  private final String hostname;
  private final int configuredPort;
  private final Server server;
  private final ServerConnector connector;
  private final ServletContextHandler contextHandler;

  public EmbeddedJettyServer(String hostname, int port) {
    if (StringUtils.isBlank(hostname)) {
      throw new ConfigException("Missing http.hostname configuration");
    }
    if (port < 0 || port > 65535) {
      throw new ConfigException("Invalid http.port: " + port);
    }
    this.hostname = hostname.trim();
    this.configuredPort = port;

    QueuedThreadPool threadPool = new QueuedThreadPool();
    threadPool.setDaemon(true);
    threadPool.setName("jetty-http");
    this.server = new Server(threadPool);

    this.connector = new ServerConnector(server);
    if (!ANY_HOST.equals(this.hostname)) {
      connector.setHost(this.hostname);
    }
    connector.setPort(port);
    server.addConnector(connector);

    this.contextHandler = new ServletContextHandler();
    contextHandler.setContextPath("/");
    server.setHandler(contextHandler);
  }

  public static EmbeddedJettyServer fromConfiguration(Configuration configuration) {
    int port;
    try {
      port = configuration.getInt("http.port", DEFAULT_PORT);
    } catch (RuntimeException e) {
      throw new ConfigException("Failed to resolve http.port configuration", e);
    }
    return new EmbeddedJettyServer(configuration.getString("http.hostname", ANY_HOST), port);
  }

  public ServletContextHandler contextHandler() {
    return contextHandler;
  }

  public synchronized void start() {
    if (server.isStarted()) {
      return;
    }
    try {
      server.start();
    } catch (Exception e) {
      throw new NetworkException(
          "Failed to start the HTTP server on %s:%d; check that the address is available"
              .formatted(hostname, configuredPort),
          e);
    }
    log.info("Task API listening on http://{}:{}/api/tasks", hostname, port());
  }

  /** The bound port once started, otherwise the configured one. */
  public int port() {
    int local = connector.getLocalPort();
    return local > 0 ? local : configuredPort;
  }

  public boolean isRunning() {
    return server.isRunning();
  }

  @Override
  public synchronized void close() {
    if (server.isStopped()) {
      return;
    }
    try {
      server.setStopTimeout(2000);
      server.stop();
      log.info("HTTP server stopped");
    } catch (Exception e) {
      // remaining services still shut down
      log.error("Error stopping the HTTP server", e);
    }
  }
}

package com.serialpdf;

import com.serialpdf.compile.BuildLogFilter;
import com.serialpdf.compile.ErrorLogArchive;
import com.serialpdf.compile.LatexCompiler;
import com.serialpdf.config.SerialPdfSettings;
import com.serialpdf.exception.ConfigException;
import com.serialpdf.exception.ExecutionException;
import com.serialpdf.exception.IoException;
import com.serialpdf.exception.StateException;
import com.serialpdf.http.EmbeddedJettyServer;
import com.serialpdf.http.IndexServlet;
import com.serialpdf.http.JobServlet;
import com.serialpdf.jobs.JobManager;
import com.serialpdf.jobs.JobStore;
import com.serialpdf.jobs.JobStores;
import com.serialpdf.jobs.PdfJobPipeline;
import com.serialpdf.render.PlaceholderEngine;
import com.serialpdf.staging.ResultStager;
import com.serialpdf.template.GitClient;
import com.serialpdf.template.TemplatePathResolver;
import com.serialpdf.template.VersionResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Wires configuration, job manager and HTTP interface together and owns their lifecycle. */
public class SerialPdf {

  private static final org.slf4j.Logger log =
      com.serialpdf.logging.LoggingService.getLogger(SerialPdf.class);

  private final StartupParameters startupParameters;
  private Configuration configuration;
  private SerialPdfSettings settings;
  private JobStore jobStore;
  private JobManager jobManager;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public SerialPdf(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  /** Start from an already loaded configuration. */
  public SerialPdf(Configuration configuration) {
    this.startupParameters = new StartupParameters(new String[0]);
    this.configuration = configuration;
  }

  public void initialize() {
    // Jetty and the JDK would otherwise log through java.util.logging
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    if (configuration == null) {
      configuration = new ConfigurationProvider(startupParameters.configFile()).config();
    }
    com.serialpdf.logging.LoggingService.applyConfiguration(configuration);
    this.settings = SerialPdfSettings.from(configuration);
    log.info("Initializing serial-pdf");

    GitClient git = new GitClient();
    requireWorkTree(git, settings.templatesRoot());
    createDirectories(settings.exportRoot(), settings.errorLogs().root(), settings.workParent());

    VersionResolver resolver =
        new VersionResolver(
            settings.templatesRoot(),
            settings.entryFile(),
            TemplatePathResolver.subdirectory(),
            git);
    SerialPdfSettings.Placeholders placeholders = settings.placeholders();
    PlaceholderEngine engine =
        new PlaceholderEngine(
            placeholders.syntax(), placeholders.textExtensions(), placeholders.reportExclusions());
    ErrorLogArchive errorLogs =
        new ErrorLogArchive(
            settings.errorLogs().root(),
            settings.errorLogs().maxFiles(),
            settings.errorLogs().pruneSlack(),
            new BuildLogFilter(settings.compiler().logFilterCommand(), Duration.ofSeconds(30)));
    ResultStager stager = ResultStager.create(settings.stagingParent(), settings.exportRoot());

    this.jobStore = JobStores.create(settings.store());
    this.jobManager =
        new JobManager(
            jobStore,
            resolver,
            placeholders.syntax(),
            new PdfJobPipeline(
                resolver,
                engine,
                new LatexCompiler(settings.compiler()),
                stager,
                settings.workParent(),
                placeholders.detectUnmatched()),
            stager,
            errorLogs,
            settings.pool());

    this.httpServer = new EmbeddedJettyServer(configuration);
    httpServer.prepare();
    try {
      httpServer
          .getContextHandler()
          .addServlet(new ServletHolder(new IndexServlet(jobManager.concurrency())), "");
      httpServer
          .getContextHandler()
          .addServlet(new ServletHolder(new JobServlet(jobManager)), "/job/*");
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new ExecutionException("Could not start http server", e);
    }
  }

  private static void requireWorkTree(GitClient git, Path templatesRoot) {
    if (!Files.isDirectory(templatesRoot)) {
      throw new ConfigException("templates.root is not a directory: " + templatesRoot);
    }
    GitClient.Result result =
        git.exec(templatesRoot, Map.of(), "rev-parse", "--is-inside-work-tree");
    if (!result.ok() || !"true".equals(result.stdout().strip())) {
      throw new ConfigException("templates.root is not a git work tree: " + templatesRoot);
    }
  }

  private static void createDirectories(Path... dirs) {
    for (Path dir : dirs) {
      try {
        Files.createDirectories(dir);
      } catch (IOException e) {
        throw new IoException("Could not create directory " + dir, e);
      }
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination),
   * then release resources.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "serial-pdf-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down serial-pdf");
    try {
      if (httpServer != null) {
        httpServer.close();
      }
      if (jobManager != null) {
        jobManager.shutdown();
      }
      if (jobStore != null) {
        jobStore.close();
      }
    } finally {
      shutdownLatch.countDown();
    }
  }

  public Configuration configuration() {
    if (configuration == null) {
      throw new StateException("SerialPdf not initialized. Call initialize() first.");
    }
    return configuration;
  }

  public SerialPdfSettings settings() {
    return settings;
  }

  public JobManager jobManager() {
    return jobManager;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}

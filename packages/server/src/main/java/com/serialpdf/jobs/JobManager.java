package com.serialpdf.jobs;

import com.serialpdf.compile.ErrorLogArchive;
import com.serialpdf.exception.CheckoutException;
import com.serialpdf.exception.CompilationException;
import com.serialpdf.exception.ExceptionUtil;
import com.serialpdf.exception.ExportException;
import com.serialpdf.exception.NotFoundException;
import com.serialpdf.exception.SerialPdfException;
import com.serialpdf.exception.StateException;
import com.serialpdf.exception.ValidationException;
import com.serialpdf.render.PlaceholderSyntax;
import com.serialpdf.render.PlaceholderValue;
import com.serialpdf.staging.ExportMetadata;
import com.serialpdf.staging.ResultStager;
import com.serialpdf.template.TemplateLocation;
import com.serialpdf.template.VersionResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Accepts PDF jobs, runs them on a fixed pool of worker threads and answers polls.
 *
 * <p>Neither {@link #submit} nor {@link #poll} waits for job execution. Jobs are dispatched in
 * submission order; each worker handles one job at a time and converts whatever the pipeline
 * throws into a failed job, so the pool never loses a thread to a bad job.
 */
public final class JobManager implements AutoCloseable {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(JobManager.class);

  static final String MDC_JOB_ID = "jobId";
  static final int ID_LENGTH = 12;

  private final JobStore store;
  private final VersionResolver resolver;
  private final PlaceholderSyntax syntax;
  private final JobPipeline pipeline;
  private final ResultStager stager;
  private final ErrorLogArchive errorLogs;
  private final PoolSettings poolSettings;
  private final Supplier<String> idSource;
  private final ThreadPoolExecutor executor;
  private final Map<String, Object> exportLocks = new ConcurrentHashMap<>();
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  public JobManager(
      JobStore store,
      VersionResolver resolver,
      PlaceholderSyntax syntax,
      JobPipeline pipeline,
      ResultStager stager,
      ErrorLogArchive errorLogs,
      PoolSettings poolSettings) {
    this(
        store, resolver, syntax, pipeline, stager, errorLogs, poolSettings, JobManager::randomId);
  }

  JobManager(
      JobStore store,
      VersionResolver resolver,
      PlaceholderSyntax syntax,
      JobPipeline pipeline,
      ResultStager stager,
      ErrorLogArchive errorLogs,
      PoolSettings poolSettings,
      Supplier<String> idSource) {
    this.store = store;
    this.resolver = resolver;
    this.syntax = syntax;
    this.pipeline = pipeline;
    this.stager = stager;
    this.errorLogs = errorLogs;
    this.poolSettings = poolSettings;
    this.idSource = idSource;

    AtomicInteger workerCount = new AtomicInteger();
    this.executor =
        new ThreadPoolExecutor(
            poolSettings.concurrency(),
            poolSettings.concurrency(),
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            r -> new Thread(r, "pdf-worker-" + workerCount.incrementAndGet()));
    log.info("Job manager started with {} worker(s)", poolSettings.concurrency());
  }

  public int concurrency() {
    return poolSettings.concurrency();
  }

  /**
   * Validate a request, pin its commit and queue it.
   *
   * @param commit {@code null}, {@code HEAD} or an alphanumeric commit reference
   * @return id of the queued job
   * @throws ValidationException for malformed input
   * @throws NotFoundException if the template does not exist
   * @throws StateException after {@link #shutdown()}
   */
  public String submit(String templateId, String commit, Map<String, PlaceholderValue> data) {
    if (shutdown.get()) {
      throw new StateException("Job manager is shut down");
    }
    if (StringUtils.isBlank(templateId)) {
      throw new ValidationException("Missing template id");
    }
    if (!VersionResolver.isValidCommitReference(commit)) {
      throw new ValidationException("Bad commit reference (should be alphanumeric): " + commit);
    }
    validateData(data);

    TemplateLocation location = resolver.resolve(templateId, commit);

    Job job;
    do {
      job =
          Job.pending(
              idSource.get(),
              templateId,
              location.pathWithinRoot(),
              commit,
              location.commit(),
              data);
    } while (!store.put(job));

    try {
      executor.execute(new JobTask(job.id()));
    } catch (RejectedExecutionException e) {
      store.remove(job.id());
      throw new StateException("Job manager is shut down", e);
    }
    log.info(
        "Queued job {} for template '{}' @ {} ({} placeholder key(s))",
        job.id(),
        templateId,
        location.commit(),
        data.size());
    return job.id();
  }

  private void validateData(Map<String, PlaceholderValue> data) {
    if (data == null) {
      throw new ValidationException("Missing placeholder data");
    }
    for (Map.Entry<String, PlaceholderValue> entry : data.entrySet()) {
      String key = entry.getKey();
      if (!syntax.isValidKey(key)) {
        throw new ValidationException("Invalid placeholder key: " + key);
      }
      PlaceholderValue value = entry.getValue();
      if (value == null) {
        throw new ValidationException("Missing value for placeholder key: " + key);
      }
      if (value instanceof PlaceholderValue.ListValue list && list.values().contains(null)) {
        throw new ValidationException("List for placeholder key '%s' contains null".formatted(key));
      }
    }
  }

  /**
   * Current state of a job. The first poll of a {@link JobState#READY} job exports its PDF; later
   * polls return the same export metadata.
   */
  public JobStatus poll(String jobId) {
    if (StringUtils.isBlank(jobId)) {
      return JobStatus.notFound(jobId);
    }
    Optional<Job> found = store.get(jobId);
    if (found.isEmpty()) {
      return JobStatus.notFound(jobId);
    }
    Job job = found.get();
    switch (job.state()) {
      case PENDING:
        return JobStatus.pending(jobId);
      case FAILED:
        JobFailure failure = job.failure();
        String errorLog = errorLogs.exists(failure.errorLog()) ? failure.errorLog() : null;
        return JobStatus.failed(jobId, failure, errorLog);
      case READY:
        return export(job);
      default:
        throw new StateException(
            "Unexpected stored state %s of job %s".formatted(job.state(), jobId));
    }
  }

  private JobStatus export(Job job) {
    if (job.export() != null) {
      return JobStatus.ready(job.id(), job.export());
    }
    Object lock = exportLocks.computeIfAbsent(job.id(), k -> new Object());
    try {
      synchronized (lock) {
        Job current = store.get(job.id()).orElse(job);
        if (current.export() != null) {
          return JobStatus.ready(current.id(), current.export());
        }
        if (current.result() == null) {
          throw new ExportException("Job %s has no staged result".formatted(current.id()));
        }
        ExportMetadata metadata = stager.export(current.result());
        Job recorded =
            store
                .transition(
                    current.id(),
                    JobState.READY,
                    j -> j.export() == null ? j.withExport(metadata) : j)
                .orElse(current);
        return JobStatus.ready(
            current.id(), recorded.export() == null ? metadata : recorded.export());
      }
    } catch (SerialPdfException e) {
      log.error("Could not export job {}: {}", job.id(), e.getMessage());
      return JobStatus.exportFailed(job.id(), ExceptionUtil.extractErrorMessage(e));
    } finally {
      exportLocks.remove(job.id(), lock);
    }
  }

  private void runJob(String jobId) {
    MDC.put(MDC_JOB_ID, jobId);
    try {
      Optional<Job> found = store.get(jobId);
      if (found.isEmpty() || found.get().state() != JobState.PENDING) {
        log.warn("Skipping job {}: no longer pending", jobId);
        return;
      }
      log.info("Processing job {}", jobId);
      var staged = pipeline.execute(found.get());
      store.transition(jobId, JobState.PENDING, j -> j.withResult(staged));
      log.info("Job {} is ready ({})", jobId, staged.processingTime());
    } catch (Throwable t) {
      if (t instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      JobFailure failure = toFailure(jobId, t);
      try {
        store.transition(jobId, JobState.PENDING, j -> j.withFailure(failure));
      } catch (RuntimeException e) {
        log.error(
            "Could not record failure of job {}: {}", jobId, ExceptionUtil.extractErrorMessage(e));
      }
    } finally {
      MDC.remove(MDC_JOB_ID);
    }
  }

  private JobFailure toFailure(String jobId, Throwable t) {
    if (t instanceof CompilationException ce) {
      log.error("Job {} failed to compile: {}", jobId, ce.getMessage());
      return JobFailure.compilation(ce.getMessage(), archiveLog(jobId, ce.buildLog()));
    }
    if (t instanceof CheckoutException || t instanceof NotFoundException) {
      log.error("Job {} failed to check out its template: {}", jobId, t.getMessage());
      return JobFailure.checkout(t.getMessage());
    }
    log.error(
        "Job {} failed: {} at {}",
        jobId,
        ExceptionUtil.extractErrorMessage(t),
        ExceptionUtil.formatCompactStackTrace(t));
    return JobFailure.internal(ExceptionUtil.extractErrorMessage(t));
  }

  private String archiveLog(String jobId, String buildLog) {
    if (buildLog == null) {
      return null;
    }
    try {
      return errorLogs.write(jobId, buildLog);
    } catch (RuntimeException e) {
      log.error("Could not archive build log of job {}: {}", jobId, e.getMessage());
      return null;
    }
  }

  /**
   * Stop accepting jobs, drop queued ones and release the staging root. Running jobs either finish
   * or are interrupted, depending on {@link PoolSettings#awaitInFlight()}. Idempotent.
   */
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down job manager");

    // Queued jobs never start once shutdown begins; idle workers would take them otherwise
    List<Runnable> queued = new ArrayList<>();
    executor.getQueue().drainTo(queued);
    executor.shutdown();
    executor.getQueue().drainTo(queued);
    for (Runnable r : queued) {
      if (r instanceof JobTask task) {
        store.remove(task.jobId());
        log.info("Dropped queued job {}", task.jobId());
      }
    }

    if (poolSettings.awaitInFlight()) {
      try {
        long timeout = poolSettings.shutdownTimeout().toMillis();
        if (!executor.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
          log.warn("Jobs still running after {}ms, interrupting them", timeout);
          executor.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        executor.shutdownNow();
      }
    } else {
      executor.shutdownNow();
    }

    stager.close();
    log.info("Job manager shut down");
  }

  @Override
  public void close() {
    shutdown();
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  static String randomId() {
    String uuid = UUID.randomUUID().toString();
    return uuid.substring(uuid.length() - ID_LENGTH).toUpperCase(Locale.ROOT);
  }

  /** Queue entry; carries only the id so that dropping it on shutdown can clean the store. */
  private final class JobTask implements Runnable {
    private final String jobId;

    JobTask(String jobId) {
      this.jobId = jobId;
    }

    String jobId() {
      return jobId;
    }

    @Override
    public void run() {
      runJob(jobId);
    }
  }
}

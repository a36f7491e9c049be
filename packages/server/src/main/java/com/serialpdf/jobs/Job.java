package com.serialpdf.jobs;

import com.serialpdf.exception.StateException;
import com.serialpdf.render.PlaceholderValue;
import com.serialpdf.staging.ExportMetadata;
import com.serialpdf.staging.StagedResult;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one job. New states are derived with the {@code with*} methods and written
 * through {@link JobStore#transition}. Placeholder data is dropped once the job has run and the
 * staged result once it has been exported, so stored jobs keep only what later polls answer with.
 *
 * @param templatePath template directory relative to the template root, {@code ""} for the root
 * @param requestedCommit commit as supplied by the caller, may be {@code null}
 * @param commit commit pinned at submission time
 */
public record Job(
    String id,
    String templateId,
    String templatePath,
    String requestedCommit,
    String commit,
    Map<String, PlaceholderValue> data,
    JobState state,
    Instant createdAt,
    Instant finishedAt,
    StagedResult result,
    ExportMetadata export,
    JobFailure failure) {

  public Job {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(state, "state");
    if (state == JobState.NOT_FOUND) {
      throw new IllegalArgumentException("NOT_FOUND is not a storable job state");
    }
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public static Job pending(
      String id,
      String templateId,
      String templatePath,
      String requestedCommit,
      String commit,
      Map<String, PlaceholderValue> data) {
    return new Job(
        id,
        templateId,
        templatePath,
        requestedCommit,
        commit,
        data,
        JobState.PENDING,
        Instant.now(),
        null,
        null,
        null,
        null);
  }

  public Job withResult(StagedResult staged) {
    return new Job(
        id,
        templateId,
        templatePath,
        requestedCommit,
        commit,
        Map.of(),
        JobState.READY,
        createdAt,
        Instant.now(),
        staged,
        null,
        null);
  }

  public Job withFailure(JobFailure jobFailure) {
    return new Job(
        id,
        templateId,
        templatePath,
        requestedCommit,
        commit,
        Map.of(),
        JobState.FAILED,
        createdAt,
        Instant.now(),
        null,
        null,
        jobFailure);
  }

  public Job withExport(ExportMetadata metadata) {
    return new Job(
        id,
        templateId,
        templatePath,
        requestedCommit,
        commit,
        data,
        state,
        createdAt,
        finishedAt,
        null,
        metadata,
        failure);
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  /** Rules every store applies before replacing {@code current} with {@code next}. */
  static void checkTransition(Job current, Job next) {
    if (next == null) {
      throw new StateException("Transition of job %s produced no job".formatted(current.id()));
    }
    if (!current.id().equals(next.id())) {
      throw new StateException(
          "Transition may not change the job id (%s -> %s)".formatted(current.id(), next.id()));
    }
    if (!Objects.equals(current.commit(), next.commit())) {
      throw new StateException("Pinned commit of job %s may not change".formatted(current.id()));
    }
    if (current.isTerminal() && next.state() != current.state()) {
      throw new StateException(
          "Job %s is %s and cannot become %s"
              .formatted(current.id(), current.state(), next.state()));
    }
    if (current.export() != null && !current.export().equals(next.export())) {
      throw new StateException("Job %s was already exported".formatted(current.id()));
    }
  }
}

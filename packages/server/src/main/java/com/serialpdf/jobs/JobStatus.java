package com.serialpdf.jobs;

import com.serialpdf.staging.ExportMetadata;
import java.util.List;
import java.util.Map;

/**
 * Answer to a poll. Only the fields that apply to {@link #state()} are set.
 *
 * @param errorLog archived build log of a failed compilation, relative to the error-log directory
 * @param failure failure kind of a {@link JobState#FAILED} job
 * @param error failure message, or why a {@link JobState#READY} job could not be exported
 */
public record JobStatus(
    String id,
    JobState state,
    String exportFile,
    String commit,
    Double processingTime,
    Map<String, List<String>> unmatchedPlaceholders,
    String errorLog,
    JobFailure.Kind failure,
    String error) {

  static JobStatus notFound(String id) {
    return new JobStatus(id, JobState.NOT_FOUND, null, null, null, null, null, null, null);
  }

  static JobStatus pending(String id) {
    return new JobStatus(id, JobState.PENDING, null, null, null, null, null, null, null);
  }

  static JobStatus ready(String id, ExportMetadata metadata) {
    return new JobStatus(
        id,
        JobState.READY,
        metadata.exportFile(),
        metadata.commit(),
        metadata.processingTime(),
        metadata.unmatchedPlaceholders(),
        null,
        null,
        null);
  }

  static JobStatus exportFailed(String id, String error) {
    return new JobStatus(id, JobState.READY, null, null, null, null, null, null, error);
  }

  static JobStatus failed(String id, JobFailure failure, String errorLog) {
    return new JobStatus(
        id, JobState.FAILED, null, null, null, null, errorLog, failure.kind(), failure.message());
  }

  /** Export metadata of a successfully collected job, {@code null} otherwise. */
  public ExportMetadata exportMetadata() {
    if (state != JobState.READY || exportFile == null) {
      return null;
    }
    return new ExportMetadata(exportFile, commit, processingTime, unmatchedPlaceholders);
  }
}

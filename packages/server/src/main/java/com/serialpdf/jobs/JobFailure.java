package com.serialpdf.jobs;

/**
 * Why a job failed.
 *
 * @param errorLog file name of the archived build log, only for compilation failures that produced
 *     one
 */
public record JobFailure(Kind kind, String message, String errorLog) {

  public enum Kind {
    /** The template could not be materialised at the pinned commit. */
    CHECKOUT,
    /** The build tool failed, timed out or produced no PDF. */
    COMPILATION,
    INTERNAL
  }

  public JobFailure {
    if (kind == null) {
      throw new IllegalArgumentException("Failure kind is required");
    }
    if (kind != Kind.COMPILATION) {
      errorLog = null;
    }
  }

  public static JobFailure checkout(String message) {
    return new JobFailure(Kind.CHECKOUT, message, null);
  }

  public static JobFailure compilation(String message, String errorLog) {
    return new JobFailure(Kind.COMPILATION, message, errorLog);
  }

  public static JobFailure internal(String message) {
    return new JobFailure(Kind.INTERNAL, message, null);
  }
}

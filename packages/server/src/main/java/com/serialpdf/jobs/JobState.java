package com.serialpdf.jobs;

/** Lifecycle of a job. {@link #NOT_FOUND} only ever appears in poll answers. */
public enum JobState {
  PENDING,
  READY,
  FAILED,
  NOT_FOUND;

  public boolean isTerminal() {
    return this == READY || this == FAILED;
  }
}

package com.serialpdf.jobs;

import java.util.Optional;
import java.util.function.UnaryOperator;

/** Where jobs live between submission and collection. The only state workers share. */
public interface JobStore {
  /** Insert a job unless one with the same id exists. */
  boolean put(Job job);

  Optional<Job> get(String id);

  /**
   * Atomically replace the job with {@code change.apply(current)} if its state is {@code
   * expected}. A terminal job never changes its state.
   *
   * @return the stored result, or empty if the job is missing or not in the expected state
   * @throws com.serialpdf.exception.StateException if the change breaks a job invariant
   */
  Optional<Job> transition(String id, JobState expected, UnaryOperator<Job> change);

  boolean remove(String id);

  /** Release connections or other resources. */
  default void close() {}
}

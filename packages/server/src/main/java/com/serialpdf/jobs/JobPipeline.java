package com.serialpdf.jobs;

import com.serialpdf.staging.StagedResult;

/** SPI for the work a worker thread performs on one job. */
public interface JobPipeline {
  /**
   * Produce and stage the PDF of a pending job.
   *
   * <p>Implementations throw {@link com.serialpdf.exception.CheckoutException} when the template
   * cannot be materialised and {@link com.serialpdf.exception.CompilationException} when the build
   * fails; anything else counts as an internal failure.
   */
  StagedResult execute(Job job) throws Exception;
}

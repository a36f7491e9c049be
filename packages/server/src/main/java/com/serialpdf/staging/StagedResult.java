package com.serialpdf.staging;

import com.serialpdf.render.RenderReport;
import java.nio.file.Path;
import java.time.Duration;

/** A finished PDF waiting in the staging root for its first collection. */
public record StagedResult(
    String jobId, Path pdf, String commit, Duration processingTime, RenderReport renderReport) {

  public StagedResult {
    renderReport = renderReport == null ? RenderReport.empty() : renderReport;
  }

  /** Name of the PDF once exported, relative to the export directory. */
  public String exportFileName() {
    return jobId + ".pdf";
  }
}

package com.serialpdf.staging;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a poller learns about an exported PDF.
 *
 * @param exportFile file name relative to the export directory
 * @param commit full hash the template was built from
 * @param processingTime seconds spent building, rounded to two decimals
 * @param unmatchedPlaceholders file -> placeholder tokens left unfilled
 */
public record ExportMetadata(
    String exportFile,
    String commit,
    double processingTime,
    Map<String, List<String>> unmatchedPlaceholders) {

  public ExportMetadata {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    if (unmatchedPlaceholders != null) {
      unmatchedPlaceholders.forEach((file, tokens) -> copy.put(file, List.copyOf(tokens)));
    }
    unmatchedPlaceholders = Collections.unmodifiableMap(copy);
  }

  public static ExportMetadata of(StagedResult staged) {
    return new ExportMetadata(
        staged.exportFileName(),
        staged.commit(),
        seconds(staged.processingTime()),
        staged.renderReport().tokensByFile());
  }

  static double seconds(Duration duration) {
    return duration == null ? 0.0 : Math.round(duration.toMillis() / 10.0) / 100.0;
  }
}

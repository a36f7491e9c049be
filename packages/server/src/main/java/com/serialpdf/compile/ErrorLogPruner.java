package com.serialpdf.compile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;

/** Bounds the number of files kept directly in a directory, deleting the oldest first. */
public final class ErrorLogPruner {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(ErrorLogPruner.class);

  private ErrorLogPruner() {}

  /**
   * Delete the oldest regular files of {@code dir} (by modification time) down to {@code maxCount}
   * once more than {@code maxCount + thresholdSlack} are present. Sub-directories are neither
   * counted nor touched.
   *
   * @return number of files deleted
   */
  public static int prune(Path dir, int maxCount, int thresholdSlack) {
    if (maxCount < 0 || thresholdSlack < 0) {
      throw new IllegalArgumentException(
          "maxCount and thresholdSlack must not be negative: %d, %d"
              .formatted(maxCount, thresholdSlack));
    }
    log.debug("Pruning directory '{}', allowing {} file(s)", dir, maxCount);

    List<Path> files;
    try (Stream<Path> children = Files.list(dir)) {
      files = children.filter(Files::isRegularFile).toList();
    } catch (IOException e) {
      log.warn("Could not list '{}' for pruning: {}", dir, e.getMessage());
      return 0;
    }
    if (files.size() <= maxCount + thresholdSlack) {
      log.debug("File limit not exceeded, skipping");
      return 0;
    }

    List<Path> oldestFirst =
        files.stream()
            .sorted(
                Comparator.comparing(ErrorLogPruner::modifiedTime)
                    .thenComparing(Path::toString))
            .toList();
    List<Path> toRemove = oldestFirst.subList(0, files.size() - maxCount);
    log.debug("Removing {} file(s) from '{}'", toRemove.size(), dir);

    int removed = 0;
    for (Path file : toRemove) {
      try {
        if (Files.deleteIfExists(file)) {
          removed++;
        }
      } catch (IOException e) {
        log.warn("Could not delete '{}': {}", file, e.getMessage());
      }
    }
    return removed;
  }

  private static FileTime modifiedTime(Path file) {
    try {
      return Files.getLastModifiedTime(file);
    } catch (IOException e) {
      // Vanished or unreadable entries sort first and are simply skipped on delete
      return FileTime.fromMillis(0);
    }
  }
}

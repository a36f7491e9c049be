package com.serialpdf.compile;

import com.serialpdf.exception.IoException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;

/** Directory of filtered build logs of failed jobs, one {@code <jobId>.log} per job. */
public class ErrorLogArchive {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(ErrorLogArchive.class);

  private final Path root;
  private final int maxFiles;
  private final int pruneSlack;
  private final BuildLogFilter filter;

  public ErrorLogArchive(Path root, int maxFiles, int pruneSlack, BuildLogFilter filter) {
    this.root = root;
    this.maxFiles = maxFiles;
    this.pruneSlack = pruneSlack;
    this.filter = filter;
  }

  public Path root() {
    return root;
  }

  public static String fileName(String jobId) {
    return jobId + ".log";
  }

  /**
   * Filter {@code rawLog}, store it as {@code <jobId>.log} and prune the directory.
   *
   * @return the file name written, relative to the archive root
   */
  public String write(String jobId, String rawLog) {
    String name = fileName(jobId);
    try {
      Files.createDirectories(root);
      Files.writeString(root.resolve(name), filter.filter(rawLog), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Could not write error log " + name, e);
    }
    log.debug("Wrote compilation error log '{}' to the log directory", name);
    ErrorLogPruner.prune(root, maxFiles, pruneSlack);
    return name;
  }

  /** Whether the log of a job is still present (it may have been pruned). */
  public boolean exists(String fileName) {
    return fileName != null && Files.isRegularFile(root.resolve(fileName));
  }
}

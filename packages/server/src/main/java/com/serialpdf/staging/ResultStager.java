package com.serialpdf.staging;

import com.serialpdf.exception.ExportException;
import com.serialpdf.exception.IoException;
import com.serialpdf.render.RenderReport;
import com.serialpdf.utility.IoUtil;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;

/**
 * Holds finished PDFs until they are collected, then hands each one over to the export directory.
 *
 * <p>The staging root is a private directory owned by this instance and removed by {@link
 * #close()}. Exports move files and never copy them, so a staged PDF can leave the staging root at
 * most once.
 */
public class ResultStager implements AutoCloseable {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(ResultStager.class);

  private final Path stagingRoot;
  private final Path exportRoot;

  public ResultStager(Path stagingRoot, Path exportRoot) {
    this.stagingRoot = stagingRoot;
    this.exportRoot = exportRoot;
  }

  /** Create a fresh staging root below {@code stagingParent}. */
  public static ResultStager create(Path stagingParent, Path exportRoot) {
    try {
      Files.createDirectories(stagingParent);
      Path root = Files.createTempDirectory(stagingParent, "serial-pdf-staging-");
      log.info("Staging finished PDFs in {}", root);
      return new ResultStager(root, exportRoot);
    } catch (IOException e) {
      throw new IoException("Could not create staging directory below " + stagingParent, e);
    }
  }

  public Path stagingRoot() {
    return stagingRoot;
  }

  public Path exportRoot() {
    return exportRoot;
  }

  /** Move a freshly built PDF into the staging root as {@code <jobId>.pdf}. */
  public StagedResult stage(
      Path pdfPath, String jobId, String commit, Duration processingTime, RenderReport report) {
    Path staged = stagingRoot.resolve(jobId + ".pdf");
    try {
      Files.move(pdfPath, staged);
    } catch (IOException e) {
      throw new IoException("Could not stage %s as %s".formatted(pdfPath, staged), e);
    }
    log.debug("Staged '{}' for job {}", staged, jobId);
    return new StagedResult(jobId, staged, commit, processingTime, report);
  }

  public ExportMetadata export(StagedResult staged) {
    return export(staged, exportRoot);
  }

  /**
   * Move a staged PDF to {@code <exportDir>/<jobId>.pdf}.
   *
   * <p>Calling this again after a successful export returns the same metadata.
   *
   * @throws ExportException if neither the staged nor the exported file exists, or a file this
   *     stager did not create is in the way
   */
  public ExportMetadata export(StagedResult staged, Path exportDir) {
    Path target = exportDir.resolve(staged.exportFileName());
    ExportMetadata metadata = ExportMetadata.of(staged);

    if (!Files.exists(staged.pdf())) {
      if (Files.isRegularFile(target)) {
        return metadata;
      }
      throw new ExportException("Staged PDF of job %s is gone".formatted(staged.jobId()));
    }

    try {
      Files.createDirectories(exportDir);
      Files.move(staged.pdf(), target);
    } catch (FileAlreadyExistsException e) {
      throw new ExportException("Refusing to overwrite existing export file " + target, e);
    } catch (NoSuchFileException e) {
      // Lost a race against another exporter of the same job
      if (Files.isRegularFile(target) && !Files.exists(staged.pdf())) {
        return metadata;
      }
      throw new ExportException("Could not export job %s".formatted(staged.jobId()), e);
    } catch (IOException e) {
      throw new ExportException(
          "Could not move %s to %s".formatted(staged.pdf(), target), e);
    }
    log.info("Exported job {} to '{}'", staged.jobId(), target);
    return metadata;
  }

  /** Remove the staging root and anything still staged in it. */
  @Override
  public void close() {
    IoUtil.silentDeleteDir(stagingRoot);
  }
}

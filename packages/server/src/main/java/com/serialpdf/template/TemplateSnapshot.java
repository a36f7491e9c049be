package com.serialpdf.template;

import com.serialpdf.render.RenderReport;
import com.serialpdf.utility.IoUtil;
import java.nio.file.Path;

/**
 * Private checkout of one template at one commit. Closing the snapshot deletes its directory.
 *
 * <p>Confined to the worker thread that created it.
 */
public final class TemplateSnapshot implements AutoCloseable {
  private final Path directory;
  private final String commit;
  private final Path entryFile;
  private RenderReport renderReport = RenderReport.empty();
  private boolean closed;

  public TemplateSnapshot(Path directory, String commit, Path entryFile) {
    this.directory = directory;
    this.commit = commit;
    this.entryFile = entryFile;
  }

  public Path directory() {
    return directory;
  }

  /** Full hash the snapshot was checked out from. */
  public String commit() {
    return commit;
  }

  public Path entryFile() {
    return entryFile;
  }

  public RenderReport renderReport() {
    return renderReport;
  }

  public void attach(RenderReport report) {
    this.renderReport = report == null ? RenderReport.empty() : report;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      IoUtil.silentDeleteDir(directory);
    }
  }

  @Override
  public String toString() {
    return "TemplateSnapshot(" + directory + " @ " + commit + ")";
  }
}

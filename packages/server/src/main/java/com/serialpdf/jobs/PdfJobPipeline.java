package com.serialpdf.jobs;

import com.serialpdf.compile.LatexCompiler;
import com.serialpdf.render.PlaceholderEngine;
import com.serialpdf.render.RenderReport;
import com.serialpdf.staging.ResultStager;
import com.serialpdf.staging.StagedResult;
import com.serialpdf.template.TemplateLocation;
import com.serialpdf.template.TemplateSnapshot;
import com.serialpdf.template.VersionResolver;
import com.serialpdf.utility.IoUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;

/**
 * Checkout, render, compile and stage, in a build directory private to the job. The build
 * directory, snapshot included, is removed whatever the outcome.
 */
public class PdfJobPipeline implements JobPipeline {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(PdfJobPipeline.class);

  private final VersionResolver resolver;
  private final PlaceholderEngine engine;
  private final LatexCompiler compiler;
  private final ResultStager stager;
  private final Path workParent;
  private final boolean detectUnmatched;

  public PdfJobPipeline(
      VersionResolver resolver,
      PlaceholderEngine engine,
      LatexCompiler compiler,
      ResultStager stager,
      Path workParent,
      boolean detectUnmatched) {
    this.resolver = resolver;
    this.engine = engine;
    this.compiler = compiler;
    this.stager = stager;
    this.workParent = workParent;
    this.detectUnmatched = detectUnmatched;
  }

  @Override
  public StagedResult execute(Job job) throws IOException {
    long begin = System.nanoTime();
    Files.createDirectories(workParent);
    Path buildDir = Files.createTempDirectory(workParent, "pdf-" + job.id() + "-");
    TemplateLocation location =
        new TemplateLocation(
            job.templateId(), job.templatePath(), job.commit(), resolver.entryFile());
    try (TemplateSnapshot snapshot = resolver.checkout(location, buildDir.resolve("template"))) {
      log.debug("Checked out template '{}' @ {}", job.templateId(), snapshot.commit());

      RenderReport report = engine.renderAll(snapshot.directory(), job.data(), detectUnmatched);
      snapshot.attach(report);

      Path pdf =
          compiler.compile(
              snapshot.directory(), snapshot.entryFile(), buildDir.resolve("out"), job.id());
      Duration took = Duration.ofNanos(System.nanoTime() - begin);
      return stager.stage(pdf, job.id(), snapshot.commit(), took, snapshot.renderReport());
    } finally {
      IoUtil.silentDeleteDir(buildDir);
    }
  }
}

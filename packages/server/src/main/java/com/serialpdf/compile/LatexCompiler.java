package com.serialpdf.compile;

import com.serialpdf.exception.CompilationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Runs the external build tool on a rendered entry file.
 *
 * <p>The PDF is created as {@code <outputDir>/<jobName>.pdf}. Intermediate files go to an
 * {@code aux} directory next to {@code outputDir}; the raw build log found there (or the captured
 * process output) travels with every {@link CompilationException}.
 */
public class LatexCompiler {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(LatexCompiler.class);

  private final CompilerSettings settings;

  public LatexCompiler(CompilerSettings settings) {
    this.settings = settings;
  }

  public CompilerSettings settings() {
    return settings;
  }

  /**
   * Compile {@code entryFile} into a PDF.
   *
   * @return path of the produced PDF
   * @throws CompilationException on timeout, non-zero exit or missing output
   */
  public Path compile(Path snapshotDir, Path entryFile, Path outputDir, String jobName) {
    Path auxDir = outputDir.resolveSibling(outputDir.getFileName() + "-aux");
    Path processOutput = auxDir.resolve(jobName + ".out");
    try {
      Files.createDirectories(outputDir);
      Files.createDirectories(auxDir);
    } catch (IOException e) {
      throw new CompilationException("Could not prepare build directories below " + outputDir, e);
    }

    List<String> command = new ArrayList<>();
    command.add(settings.executable());
    command.addAll(settings.args());
    command.add("--auxdir=" + auxDir);
    command.add("--outdir=" + outputDir);
    command.add("--jobname=" + jobName);
    command.add(entryFile.toString());

    Path workDir = entryFile.getParent() == null ? snapshotDir : entryFile.getParent();
    log.debug("Running '{}' in {}", String.join(" ", command), workDir);

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.directory(workDir.toFile());
    pb.redirectErrorStream(true);
    pb.redirectOutput(processOutput.toFile());

    long begin = System.nanoTime();
    Process process;
    try {
      process = pb.start();
      process.getOutputStream().close();
    } catch (IOException e) {
      throw new CompilationException("Could not start " + settings.executable(), e);
    }

    try {
      boolean finished = process.waitFor(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        log.debug("Killing timed out build process with pid {}", process.pid());
        process.destroyForcibly();
        process.waitFor(5, TimeUnit.SECONDS);
        throw new CompilationException(
            "PDF conversion failed: Timed out (%ds)".formatted(settings.timeout().toSeconds()),
            buildLog(auxDir, jobName, processOutput),
            true);
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new CompilationException("Interrupted while waiting for " + settings.executable(), e);
    }

    int exitCode = process.exitValue();
    if (exitCode != 0) {
      throw new CompilationException(
          "PDF conversion failed: %s return code was %d"
              .formatted(Path.of(settings.executable()).getFileName(), exitCode),
          buildLog(auxDir, jobName, processOutput),
          false);
    }

    Path pdf = outputDir.resolve(jobName + ".pdf");
    if (!Files.isRegularFile(pdf) || !Files.isReadable(pdf)) {
      throw new CompilationException(
          "PDF conversion failed: output PDF not found/readable: '%s'".formatted(pdf), null, false);
    }
    log.debug(
        "Successfully built '{}' (took {}ms)",
        pdf,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin));
    return pdf;
  }

  /** The tool's own log if it wrote one, else whatever the process printed. */
  private static String buildLog(Path auxDir, String jobName, Path processOutput) {
    Path toolLog = auxDir.resolve(jobName + ".log");
    for (Path candidate : List.of(toolLog, processOutput)) {
      if (Files.isRegularFile(candidate)) {
        try {
          byte[] bytes = Files.readAllBytes(candidate);
          if (bytes.length > 0) {
            return new String(bytes, StandardCharsets.UTF_8);
          }
        } catch (IOException e) {
          log.warn("Could not read build log {}: {}", candidate, e.getMessage());
        }
      }
    }
    return null;
  }
}

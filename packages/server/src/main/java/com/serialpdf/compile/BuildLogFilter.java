package com.serialpdf.compile;

import com.serialpdf.exception.ExceptionUtil;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Reduces a raw build log to its diagnostics.
 *
 * <p>With an external filter command configured, the log is piped through it and colour escape
 * sequences are stripped from the result. Otherwise, or when the command fails, a built-in filter
 * keeps {@code !} error blocks up to their {@code l.<n>} context line, warnings, errors and box
 * reports. If nothing survives, the raw log is returned unchanged.
 */
public class BuildLogFilter {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(BuildLogFilter.class);

  private static final Pattern ANSI_ESCAPE =
      Pattern.compile("(?i)\\x1B(?:[@-Z\\\\-_]|\\[[0-?]*[ -/]*[@-~])");
  private static final Pattern CONTEXT_LINE = Pattern.compile("^l\\.\\d+.*");
  private static final Pattern DIAGNOSTIC_LINE =
      Pattern.compile("^(?:Overfull|Underfull)\\b.*|.*\\b(?:Error|Warning)\\b.*");

  /** An error block is cut off after this many lines when no context line follows. */
  private static final int MAX_BLOCK_LINES = 20;

  private final List<String> command;
  private final Duration timeout;

  public BuildLogFilter(List<String> command, Duration timeout) {
    this.command = command == null ? List.of() : List.copyOf(command);
    this.timeout = timeout;
  }

  /** Built-in filtering only. */
  public BuildLogFilter() {
    this(List.of(), Duration.ofSeconds(30));
  }

  public String filter(String rawLog) {
    if (rawLog == null) {
      return null;
    }
    String filtered = null;
    if (!command.isEmpty()) {
      try {
        filtered = ANSI_ESCAPE.matcher(runExternal(rawLog)).replaceAll("").strip();
      } catch (IOException e) {
        log.error(
            "Could not extract errors from build log with '{}': {}",
            String.join(" ", command),
            ExceptionUtil.formatCompactStackTrace(e));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while filtering build log, using built-in filter");
      }
    }
    if (filtered == null) {
      filtered = filterBuiltIn(rawLog);
    }
    return StringUtils.isBlank(filtered) ? rawLog : filtered;
  }

  static String filterBuiltIn(String rawLog) {
    List<String> kept = new ArrayList<>();
    String[] lines = rawLog.split("\\R", -1);
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      if (line.startsWith("!")) {
        kept.add(line);
        // Keep the block up to the line reference that locates the error in the source
        int end = Math.min(lines.length, i + 1 + MAX_BLOCK_LINES);
        for (int j = i + 1; j < end; j++) {
          if (CONTEXT_LINE.matcher(lines[j]).matches()) {
            for (int k = i + 1; k <= j; k++) {
              kept.add(lines[k]);
            }
            i = j;
            break;
          }
        }
      } else if (DIAGNOSTIC_LINE.matcher(line).matches()) {
        kept.add(line);
      }
    }
    return String.join("\n", kept).strip();
  }

  private String runExternal(String rawLog) throws IOException, InterruptedException {
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectError(ProcessBuilder.Redirect.DISCARD);
    Process process = pb.start();
    CompletableFuture<byte[]> stdout =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return process.getInputStream().readAllBytes();
              } catch (IOException e) {
                throw new java.io.UncheckedIOException(e);
              }
            });
    try (OutputStream in = process.getOutputStream()) {
      in.write(rawLog.getBytes(StandardCharsets.UTF_8));
    }
    if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      process.destroyForcibly();
      throw new IOException("Log filter timed out after " + timeout.toSeconds() + "s");
    }
    if (process.exitValue() != 0) {
      throw new IOException("Log filter exited with code " + process.exitValue());
    }
    try {
      return new String(stdout.join(), StandardCharsets.UTF_8);
    } catch (java.util.concurrent.CompletionException e) {
      throw new IOException("Could not read log filter output", e.getCause());
    }
  }
}

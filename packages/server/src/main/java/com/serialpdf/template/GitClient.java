package com.serialpdf.template;

import com.serialpdf.exception.CheckoutException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/** Thin wrapper around the {@code git} command line client. */
public class GitClient {
  private static final Logger log = com.serialpdf.logging.LoggingService.getLogger(GitClient.class);

  private final String executable;
  private final Duration timeout;

  public GitClient(String executable, Duration timeout) {
    this.executable = executable;
    this.timeout = timeout;
  }

  public GitClient() {
    this("git", Duration.ofSeconds(60));
  }

  /** Outcome of one git invocation. */
  public record Result(int exitCode, String stdout, String stderr) {
    public boolean ok() {
      return exitCode == 0;
    }
  }

  /** Run git and return its result whatever the exit code. */
  public Result exec(Path workDir, Map<String, String> env, String... args) {
    List<String> command = new ArrayList<>(args.length + 1);
    command.add(executable);
    command.addAll(List.of(args));
    log.trace("Running '{}' in {}", String.join(" ", command), workDir);

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.directory(workDir.toFile());
    pb.environment().putAll(env);
    pb.redirectInput(ProcessBuilder.Redirect.PIPE);

    Process process;
    try {
      process = pb.start();
      process.getOutputStream().close();
    } catch (IOException e) {
      throw new CheckoutException("Could not start " + executable, e);
    }

    // Drained off-thread; the timeout must not depend on git closing its streams
    CompletableFuture<String> stdout =
        CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
    CompletableFuture<String> stderr =
        CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
    try {
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        throw new CheckoutException(
            "git timed out after %ds: %s".formatted(timeout.toSeconds(), String.join(" ", args)));
      }
      return new Result(process.exitValue(), stdout.join(), stderr.join());
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new CheckoutException("Interrupted while running git " + String.join(" ", args), e);
    } catch (UncheckedIOException | CompletionException e) {
      process.destroyForcibly();
      throw new CheckoutException("Could not read git output", e);
    }
  }

  /** Run git and return trimmed stdout; a non-zero exit is a {@link CheckoutException}. */
  public String run(Path workDir, Map<String, String> env, String... args) {
    Result result = exec(workDir, env, args);
    if (!result.ok()) {
      throw new CheckoutException(
          "git %s failed with exit code %d: %s"
              .formatted(String.join(" ", args), result.exitCode(), result.stderr().strip()));
    }
    return result.stdout().strip();
  }

  public String run(Path workDir, String... args) {
    return run(workDir, Map.of(), args);
  }

  private static String drain(InputStream in) {
    try (in) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

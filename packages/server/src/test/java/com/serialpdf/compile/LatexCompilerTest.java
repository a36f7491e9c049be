package com.serialpdf.compile;

import static org.junit.jupiter.api.Assertions.*;

import com.serialpdf.exception.CompilationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LatexCompilerTest {

  @TempDir Path temp;

  private Path script;
  private Path snapshot;

  @BeforeEach
  void setUp() throws Exception {
    Assumptions.assumeTrue(FakeLatexmk.shellAvailable(), "/bin/sh is not available");
    script = FakeLatexmk.install(temp.resolve("bin"));
    snapshot = Files.createDirectories(temp.resolve("snapshot"));
  }

  private LatexCompiler compiler(Duration timeout) {
    return new LatexCompiler(FakeLatexmk.settings(script, timeout));
  }

  @Test
  void producesPdfNamedAfterJob() throws Exception {
    Path entry = snapshot.resolve("main.tex");
    Files.writeString(entry, "rendered source");

    Path pdf =
        compiler(Duration.ofSeconds(20)).compile(snapshot, entry, temp.resolve("out"), "JOB1");

    assertEquals(temp.resolve("out").resolve("JOB1.pdf"), pdf);
    assertEquals("rendered source", Files.readString(pdf));
  }

  @Test
  @DisplayName("A failing build carries the tool's own log")
  void failureCarriesBuildLog() throws Exception {
    Path entry = snapshot.resolve("main.tex");
    Files.writeString(entry, "FAIL");

    CompilationException e =
        assertThrows(
            CompilationException.class,
            () ->
                compiler(Duration.ofSeconds(20)).compile(snapshot, entry, temp.resolve("out"), "JOB2"));

    assertFalse(e.timedOut());
    assertTrue(e.getMessage().contains("return code was 12"), e.getMessage());
    assertNotNull(e.buildLog());
    assertTrue(e.buildLog().contains("! Undefined control sequence."));
  }

  @Test
  void timeoutKillsTheBuild() throws Exception {
    Path entry = snapshot.resolve("main.tex");
    Files.writeString(entry, "SLEEP");

    long begin = System.nanoTime();
    CompilationException e =
        assertThrows(
            CompilationException.class,
            () ->
                compiler(Duration.ofSeconds(1)).compile(snapshot, entry, temp.resolve("out"), "JOB3"));

    assertTrue(e.timedOut());
    assertTrue(e.getMessage().contains("Timed out"));
    assertTrue(Duration.ofNanos(System.nanoTime() - begin).toSeconds() < 20);
  }

  @Test
  void missingPdfIsAFailureWithoutLog() throws Exception {
    Path entry = snapshot.resolve("main.tex");
    Files.writeString(entry, "NOPDF");

    CompilationException e =
        assertThrows(
            CompilationException.class,
            () ->
                compiler(Duration.ofSeconds(20)).compile(snapshot, entry, temp.resolve("out"), "JOB4"));

    assertFalse(e.timedOut());
    assertNull(e.buildLog());
    assertTrue(e.getMessage().contains("output PDF not found"));
  }

  @Test
  void missingExecutableIsACompilationFailure() throws Exception {
    Path entry = snapshot.resolve("main.tex");
    Files.writeString(entry, "x");
    LatexCompiler missing =
        new LatexCompiler(
            new CompilerSettings(
                temp.resolve("no-such-latexmk").toString(),
                List.of(),
                Duration.ofSeconds(5),
                List.of()));

    assertThrows(
        CompilationException.class,
        () -> missing.compile(snapshot, entry, temp.resolve("out"), "JOB5"));
  }
}

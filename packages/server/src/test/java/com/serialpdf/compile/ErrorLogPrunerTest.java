package com.serialpdf.compile;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ErrorLogPrunerTest {

  @TempDir Path dir;

  private Path file(String name, long ageSeconds) throws Exception {
    Path file = Files.writeString(dir.resolve(name), name);
    Files.setLastModifiedTime(file, FileTime.from(Instant.now().minusSeconds(ageSeconds)));
    return file;
  }

  @Test
  void nothingHappensWithinSlack() throws Exception {
    for (int i = 0; i < 6; i++) {
      file("f" + i + ".log", 100 - i);
    }

    assertEquals(0, ErrorLogPruner.prune(dir, 4, 2));
    try (var files = Files.list(dir)) {
      assertEquals(6, files.count());
    }
  }

  @Test
  void deletesOldestDownToMaximum() throws Exception {
    Path oldest = file("a.log", 500);
    Path older = file("b.log", 400);
    Path old = file("c.log", 300);
    Path recent = file("d.log", 200);
    Path newest = file("e.log", 100);

    assertEquals(3, ErrorLogPruner.prune(dir, 2, 1));

    assertFalse(Files.exists(oldest));
    assertFalse(Files.exists(older));
    assertFalse(Files.exists(old));
    assertTrue(Files.exists(recent));
    assertTrue(Files.exists(newest));
  }

  @Test
  void directoriesAreIgnored() throws Exception {
    Files.createDirectory(dir.resolve("nested"));
    file("a.log", 30);
    file("b.log", 20);

    assertEquals(1, ErrorLogPruner.prune(dir, 1, 0));
    assertTrue(Files.isDirectory(dir.resolve("nested")));
    assertTrue(Files.exists(dir.resolve("b.log")));
  }

  @Test
  void missingDirectoryIsNotAnError() {
    assertEquals(0, ErrorLogPruner.prune(dir.resolve("missing"), 1, 0));
  }

  @Test
  void negativeLimitsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ErrorLogPruner.prune(dir, -1, 0));
    assertThrows(IllegalArgumentException.class, () -> ErrorLogPruner.prune(dir, 1, -1));
  }
}

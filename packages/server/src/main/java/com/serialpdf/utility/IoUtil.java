package com.serialpdf.utility;

import com.serialpdf.exception.IoException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import org.slf4j.Logger;

/** Small collection of I/O helpers for safe file operations. */
public final class IoUtil {
  private static final Logger log = com.serialpdf.logging.LoggingService.getLogger(IoUtil.class);

  private IoUtil() {}

  /**
   * Resolve a relative name securely inside a base directory.
   *
   * <p>Normalizes the result and refuses anything that would land outside {@code base}, such as
   * {@code ../} sequences or absolute names.
   */
  public static Path secureResolve(Path base, String name) {
    Path normalizedBase = base.toAbsolutePath().normalize();
    Path dest = normalizedBase.resolve(name).normalize();
    if (!dest.startsWith(normalizedBase)) {
      throw new IoException("Blocked path outside of " + base + ": " + name);
    }
    return dest;
  }

  /** Delete a directory tree, logging (not throwing) entries that could not be removed. */
  public static void silentDeleteDir(Path dir) {
    if (dir == null || !Files.exists(dir)) return;

    try (var stream = Files.walk(dir)) {
      stream
          .sorted(Comparator.reverseOrder())
          .forEach(
              p -> {
                try {
                  Files.deleteIfExists(p);
                } catch (IOException e) {
                  log.debug("Could not delete {}: {}", p, e.getMessage());
                }
              });
    } catch (IOException e) {
      log.debug("Could not walk {} for deletion: {}", dir, e.getMessage());
    }
  }

  /** Render a path relative to {@code base} with forward slashes. */
  public static String relativeUnixPath(Path base, Path file) {
    return base.relativize(file).toString().replace('\\', '/');
  }
}

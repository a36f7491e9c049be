package com.serialpdf.config;

import com.serialpdf.compile.CompilerSettings;
import com.serialpdf.exception.ConfigException;
import com.serialpdf.jobs.PoolSettings;
import com.serialpdf.jobs.StoreSettings;
import com.serialpdf.render.PlaceholderSyntax;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;
import org.apache.commons.lang3.StringUtils;

/**
 * Typed view of {@code application.yaml}.
 *
 * <p>{@code templates.root}, {@code paths.export-root} and {@code error-logs.root} are required;
 * everything else has a default.
 */
public record SerialPdfSettings(
    Path templatesRoot,
    String entryFile,
    Path stagingParent,
    Path workParent,
    Path exportRoot,
    ErrorLogs errorLogs,
    PoolSettings pool,
    StoreSettings store,
    CompilerSettings compiler,
    Placeholders placeholders) {

  /** Where failed build logs go and how many are kept. */
  public record ErrorLogs(Path root, int maxFiles, int pruneSlack) {}

  public record Placeholders(
      PlaceholderSyntax syntax,
      boolean detectUnmatched,
      Set<String> textExtensions,
      Set<String> reportExclusions) {}

  public static SerialPdfSettings from(Configuration c) {
    try {
      return read(c);
    } catch (ConversionException | IllegalArgumentException e) {
      throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
    }
  }

  private static SerialPdfSettings read(Configuration c) {
    Path tmp = Path.of(System.getProperty("java.io.tmpdir"));

    Path templatesRoot = requiredPath(c, "templates.root");
    String entryFile = c.getString("templates.entry-file", "main.tex");
    if (StringUtils.isBlank(entryFile)) {
      throw new ConfigException("templates.entry-file must not be blank");
    }

    int maxFiles = c.getInt("error-logs.max-files", 50);
    int pruneSlack = c.getInt("error-logs.prune-slack", 5);
    if (maxFiles < 0 || pruneSlack < 0 || pruneSlack > maxFiles) {
      throw new ConfigException(
          "error-logs.prune-slack must be between 0 and error-logs.max-files (%d, %d)"
              .formatted(pruneSlack, maxFiles));
    }
    ErrorLogs errorLogs = new ErrorLogs(requiredPath(c, "error-logs.root"), maxFiles, pruneSlack);

    int concurrency = c.getInt("jobs.concurrency", 4);
    if (concurrency < 1) {
      throw new ConfigException("jobs.concurrency must be at least 1, got " + concurrency);
    }
    PoolSettings pool =
        new PoolSettings(
            concurrency,
            c.getBoolean("jobs.shutdown.await-in-flight", true),
            Duration.ofSeconds(c.getLong("jobs.shutdown.timeout-seconds", 120)));

    StoreSettings store =
        new StoreSettings(
            c.getString("jobs.store.type", StoreSettings.MEMORY),
            c.getString("jobs.store.redis.host", "localhost"),
            c.getInt("jobs.store.redis.port", 6379),
            c.getString("jobs.store.redis.key-prefix", "serial-pdf:job:"),
            Duration.ofSeconds(c.getLong("jobs.store.redis.ttl-seconds", 0)));

    CompilerSettings compiler =
        new CompilerSettings(
            c.getString("compiler.executable", "latexmk"),
            c.getList(String.class, "compiler.args", CompilerSettings.DEFAULT_ARGS),
            Duration.ofSeconds(c.getLong("compiler.timeout-seconds", 60)),
            c.getList(String.class, "compiler.log-filter.command", List.of()));

    PlaceholderSyntax syntax =
        new PlaceholderSyntax(
            c.getString("placeholders.pattern", PlaceholderSyntax.DEFAULT_PATTERN),
            c.getString("placeholders.key-pattern", PlaceholderSyntax.DEFAULT_KEY_PATTERN),
            c.getString("placeholders.list-begin", PlaceholderSyntax.DEFAULT_LIST_BEGIN),
            c.getString("placeholders.list-item", PlaceholderSyntax.DEFAULT_LIST_ITEM),
            c.getString("placeholders.list-end", PlaceholderSyntax.DEFAULT_LIST_END),
            c.getBoolean("placeholders.escape-backslashes", true));
    Placeholders placeholders =
        new Placeholders(
            syntax,
            c.getBoolean("placeholders.detect-unmatched", true),
            stringSet(c, "placeholders.text-extensions", List.of("tex", "latex", "sty", "cls")),
            stringSet(c, "placeholders.report-exclusions", List.of("serial-pdf.sty")));

    return new SerialPdfSettings(
        templatesRoot,
        entryFile.trim(),
        optionalPath(c, "paths.staging-parent", tmp),
        optionalPath(c, "paths.work-parent", tmp),
        requiredPath(c, "paths.export-root"),
        errorLogs,
        pool,
        store,
        compiler,
        placeholders);
  }

  private static Path requiredPath(Configuration c, String key) {
    String value = c.getString(key, null);
    // An unresolved ${env:...} reference counts as missing
    if (StringUtils.isBlank(value) || value.contains("${")) {
      throw new ConfigException("Missing required configuration: " + key);
    }
    return Path.of(value.trim()).toAbsolutePath().normalize();
  }

  private static Path optionalPath(Configuration c, String key, Path fallback) {
    String value = c.getString(key, null);
    return StringUtils.isBlank(value) || value.contains("${")
        ? fallback
        : Path.of(value.trim()).toAbsolutePath().normalize();
  }

  private static Set<String> stringSet(Configuration c, String key, List<String> defaults) {
    Set<String> values = new LinkedHashSet<>();
    for (String value : c.getList(String.class, key, defaults)) {
      if (StringUtils.isNotBlank(value)) {
        values.add(value.trim());
      }
    }
    return values;
  }
}

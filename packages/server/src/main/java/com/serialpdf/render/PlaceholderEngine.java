package com.serialpdf.render;

import com.serialpdf.exception.RenderException;
import com.serialpdf.utility.IoUtil;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;

/**
 * Fills placeholders in every file of a checked-out template tree, in place.
 *
 * <p>Each file is rewritten in a single pass. Keys missing from the data, and tokens whose shape
 * does not match the supplied value (a list for a scalar token or vice versa), are left as they
 * are. A second scan can then report whatever still looks like a placeholder.
 */
public class PlaceholderEngine {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(PlaceholderEngine.class);

  private final PlaceholderSyntax syntax;
  private final Set<String> textExtensions;
  private final Set<String> reportExclusions;

  public PlaceholderEngine(
      PlaceholderSyntax syntax, Set<String> textExtensions, Set<String> reportExclusions) {
    this.syntax = syntax;
    this.textExtensions =
        textExtensions.stream()
            .map(e -> e.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
            .collect(Collectors.toUnmodifiableSet());
    this.reportExclusions = Set.copyOf(reportExclusions);
  }

  public PlaceholderSyntax syntax() {
    return syntax;
  }

  /**
   * Render all files below {@code snapshotDir}.
   *
   * @param detectUnmatched whether to scan for leftover placeholders after substitution
   * @return leftover placeholders per file; empty if detection is disabled
   */
  public RenderReport renderAll(
      Path snapshotDir, Map<String, PlaceholderValue> data, boolean detectUnmatched) {
    log.debug("Rendering '{}' with placeholder keys: {}", snapshotDir, describeKeys(data));

    List<Path> files;
    try (Stream<Path> stream = Files.walk(snapshotDir)) {
      // Never write through symbolic links; link targets inside the snapshot are walked directly
      files =
          stream.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS)).sorted().toList();
    } catch (IOException e) {
      throw new RenderException("Could not list template files in " + snapshotDir, e);
    }

    Map<String, List<UnmatchedPlaceholder>> unmatched = new TreeMap<>();
    for (Path file : files) {
      String relative = IoUtil.relativeUnixPath(snapshotDir, file);
      String content = readText(file, relative);
      if (content == null || !syntax.pattern().matcher(content).find()) {
        continue;
      }

      String rendered = render(content, data);
      try {
        Files.writeString(file, rendered, StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new RenderException("Could not write rendered file " + relative, e);
      }

      if (detectUnmatched && !reportExclusions.contains(file.getFileName().toString())) {
        List<UnmatchedPlaceholder> leftovers = findPlaceholders(rendered);
        if (!leftovers.isEmpty()) {
          unmatched.put(relative, leftovers);
        }
      }
    }

    RenderReport report = new RenderReport(unmatched);
    if (!report.isEmpty()) {
      log.warn(
          "Found possibly unmatched placeholder(s) during rendering. File(s): {}. Key(s): {}",
          String.join(", ", report.unmatched().keySet()),
          String.join(", ", report.keys()));
    }
    return report;
  }

  /** Substitute placeholders of one text in a single pass. */
  String render(String content, Map<String, PlaceholderValue> data) {
    Matcher m = syntax.pattern().matcher(content);
    StringBuilder out = new StringBuilder(content.length());
    while (m.find()) {
      String replacement = replacementFor(m, data.get(PlaceholderSyntax.key(m)));
      m.appendReplacement(
          out, Matcher.quoteReplacement(replacement == null ? m.group() : replacement));
    }
    m.appendTail(out);
    return out.toString();
  }

  private String replacementFor(Matcher m, PlaceholderValue value) {
    if (value == null) {
      return null;
    }
    boolean listToken = PlaceholderSyntax.isList(m);
    if (!listToken && value instanceof PlaceholderValue.Scalar scalar) {
      return syntax.scalar(scalar.value());
    }
    if (listToken && value instanceof PlaceholderValue.ListValue list) {
      return syntax.listBlock(list.values());
    }
    return null;
  }

  /** All placeholder tokens of a text, in source order. */
  List<UnmatchedPlaceholder> findPlaceholders(String content) {
    List<UnmatchedPlaceholder> found = new ArrayList<>();
    Matcher m = syntax.pattern().matcher(content);
    int line = 1;
    int scanned = 0;
    while (m.find()) {
      for (int i = scanned; i < m.start(); i++) {
        if (content.charAt(i) == '\n') line++;
      }
      scanned = m.start();
      found.add(new UnmatchedPlaceholder(m.group(), PlaceholderSyntax.key(m), line));
    }
    return found;
  }

  private String readText(Path file, String relative) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (IOException e) {
      throw new RenderException("Could not read template file " + relative, e);
    }
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      if (textExtensions.contains(extensionOf(file))) {
        throw new RenderException("Template source is not valid UTF-8: " + relative, e);
      }
      log.debug("File '{}' looks like a binary file, skipped rendering", relative);
      return null;
    }
  }

  private static String extensionOf(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static String describeKeys(Map<String, PlaceholderValue> data) {
    return data.entrySet().stream()
        .map(
            e ->
                e.getValue() instanceof PlaceholderValue.ListValue
                    ? "[" + e.getKey() + "]"
                    : e.getKey())
        .collect(Collectors.joining(", "));
  }
}

package com.serialpdf.render;

import com.serialpdf.exception.ConfigException;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * How placeholders look in template sources and what a list placeholder expands to.
 *
 * <p>{@code pattern} must define the named groups {@code key} and {@code list}; a match whose
 * {@code list} group participated is a list placeholder, anything else a scalar one. The three
 * list markers are plain text with the substitutions {@code {count}}, {@code {index}} (1-based) and
 * {@code {value}}.
 */
public final class PlaceholderSyntax {
  public static final String DEFAULT_PATTERN = "\\\\placeholder(?<list>list)?\\{(?<key>[\\w-]+)\\}";
  public static final String DEFAULT_KEY_PATTERN = "[\\w-]+";
  public static final String DEFAULT_LIST_BEGIN = "\\begin{placeholders}[{count}]\n";
  public static final String DEFAULT_LIST_ITEM = "\\lfitem[{index}]{{value}}\n";
  public static final String DEFAULT_LIST_END = "\\end{placeholders}\n";

  private final Pattern pattern;
  private final Pattern keyPattern;
  private final String listBegin;
  private final String listItem;
  private final String listEnd;
  private final boolean escapeBackslashes;

  public PlaceholderSyntax(
      String pattern,
      String keyPattern,
      String listBegin,
      String listItem,
      String listEnd,
      boolean escapeBackslashes) {
    this.pattern = compile(pattern, "placeholders.pattern");
    this.keyPattern = compile(keyPattern, "placeholders.key-pattern");
    if (!pattern.contains("(?<key>") || !pattern.contains("(?<list>")) {
      throw new ConfigException(
          "placeholders.pattern must define the named groups 'key' and 'list': " + pattern);
    }
    this.listBegin = Objects.requireNonNull(listBegin, "listBegin");
    this.listItem = Objects.requireNonNull(listItem, "listItem");
    this.listEnd = Objects.requireNonNull(listEnd, "listEnd");
    this.escapeBackslashes = escapeBackslashes;
  }

  /** The LaTeX convention used by the bundled {@code serial-pdf.sty}. */
  public static PlaceholderSyntax defaults() {
    return new PlaceholderSyntax(
        DEFAULT_PATTERN,
        DEFAULT_KEY_PATTERN,
        DEFAULT_LIST_BEGIN,
        DEFAULT_LIST_ITEM,
        DEFAULT_LIST_END,
        true);
  }

  private static Pattern compile(String regex, String name) {
    if (regex == null || regex.isEmpty()) {
      throw new ConfigException("Missing " + name);
    }
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new ConfigException("Invalid regular expression in " + name + ": " + regex, e);
    }
  }

  public Pattern pattern() {
    return pattern;
  }

  public boolean isValidKey(String key) {
    return key != null && keyPattern.matcher(key).matches();
  }

  static boolean isList(Matcher match) {
    return match.group("list") != null;
  }

  static String key(Matcher match) {
    return match.group("key");
  }

  String scalar(String value) {
    return sanitize(value);
  }

  /** Expand a list value into begin marker, one item per element and end marker. */
  String listBlock(List<String> values) {
    if (values.isEmpty()) {
      return "";
    }
    String count = String.valueOf(values.size());
    StringBuilder sb = new StringBuilder(listBegin.replace("{count}", count));
    for (int i = 0; i < values.size(); i++) {
      sb.append(
          listItem
              .replace("{index}", String.valueOf(i + 1))
              .replace("{value}", sanitize(values.get(i))));
    }
    sb.append(listEnd.replace("{count}", count));
    return sb.toString();
  }

  private String sanitize(String value) {
    // Keeps supplied data from injecting TeX commands.
    return escapeBackslashes ? value.replace('\\', '/') : value;
  }
}

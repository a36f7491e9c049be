package com.serialpdf;

import com.serialpdf.exception.ConfigException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Command line arguments of the form {@code --name=value} (a bare {@code --flag} means {@code
 * true}).
 */
public class StartupParameters {
  static final String CONFIG_ENV = "SERIALPDF_CONFIG";

  private final Map<String, String> parameters = new LinkedHashMap<>();
  private final Map<String, String> environment;

  public StartupParameters(String[] args) {
    this(args, System.getenv());
  }

  StartupParameters(String[] args, Map<String, String> environment) {
    this.environment = environment;
    if (args == null) return;
    for (String arg : args) {
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException(
            "Unsupported argument '%s', expected --name=value".formatted(arg));
      }
      int eq = arg.indexOf('=');
      if (eq < 0) {
        parameters.put(arg.substring(2), "true");
      } else {
        parameters.put(arg.substring(2, eq), arg.substring(eq + 1));
      }
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    String value = parameters.get(name);
    if (value == null) {
      return null;
    }
    if (type == String.class) {
      return type.cast(value);
    }
    if (type == Integer.class) {
      return type.cast(Integer.valueOf(value));
    }
    if (type == Boolean.class) {
      return type.cast(Boolean.valueOf(value));
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  /** Configuration file from {@code --config} or {@code SERIALPDF_CONFIG}, else null. */
  public Path configFile() {
    String value = parameters.get("config");
    if (StringUtils.isBlank(value)) {
      value = environment.get(CONFIG_ENV);
    }
    return StringUtils.isBlank(value) ? null : Path.of(value.trim());
  }
}

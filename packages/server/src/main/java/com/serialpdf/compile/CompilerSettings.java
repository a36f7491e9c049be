package com.serialpdf.compile;

import java.time.Duration;
import java.util.List;

/**
 * How to invoke the document build tool.
 *
 * @param executable build tool binary, {@code latexmk} by default
 * @param args arguments placed before the generated directory, job name and entry file arguments
 * @param timeout wall clock limit for one build
 * @param logFilterCommand optional external log filter (for example {@code texlogfilter}); empty
 *     to use the built-in filter
 */
public record CompilerSettings(
    String executable, List<String> args, Duration timeout, List<String> logFilterCommand) {

  public static final List<String> DEFAULT_ARGS =
      List.of("--gg", "--cd", "--interaction=nonstopmode", "--pdf", "-f");

  public CompilerSettings {
    args = args == null ? List.of() : List.copyOf(args);
    logFilterCommand = logFilterCommand == null ? List.of() : List.copyOf(logFilterCommand);
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      timeout = Duration.ofSeconds(60);
    }
  }

  public static CompilerSettings defaults() {
    return new CompilerSettings("latexmk", DEFAULT_ARGS, Duration.ofSeconds(60), List.of());
  }
}

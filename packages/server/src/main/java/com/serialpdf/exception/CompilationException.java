package com.serialpdf.exception;

/**
 * The external document build tool failed, timed out or produced no PDF.
 *
 * <p>{@link #buildLog()} holds the raw, unfiltered build log when one could be captured; the
 * caller decides whether to filter and persist it.
 */
public class CompilationException extends SerialPdfException {
  private final String buildLog;
  private final boolean timedOut;

  public CompilationException(String message, String buildLog, boolean timedOut) {
    super(SerialPdfErrorCode.COMPILATION_ERROR, message);
    this.buildLog = buildLog;
    this.timedOut = timedOut;
  }

  public CompilationException(String message, Throwable cause) {
    super(SerialPdfErrorCode.COMPILATION_ERROR, message, cause);
    this.buildLog = null;
    this.timedOut = false;
  }

  /** Raw build log, or {@code null} if none was available. */
  public String buildLog() {
    return buildLog;
  }

  public boolean timedOut() {
    return timedOut;
  }
}

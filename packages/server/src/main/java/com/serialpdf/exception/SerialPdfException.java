package com.serialpdf.exception;

/** Root of all serial-pdf exceptions. Unchecked; carries a {@link SerialPdfErrorCode}. */
public class SerialPdfException extends RuntimeException {
  private final SerialPdfErrorCode code;

  public SerialPdfException(SerialPdfErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public SerialPdfException(SerialPdfErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public SerialPdfErrorCode getCode() {
    return code;
  }
}

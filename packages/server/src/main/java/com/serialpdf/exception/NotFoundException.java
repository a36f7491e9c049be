package com.serialpdf.exception;

/** An unknown template id or job id. */
public class NotFoundException extends SerialPdfException {
  public NotFoundException(String message) {
    super(SerialPdfErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(SerialPdfErrorCode.NOT_FOUND, message, cause);
  }
}

package com.serialpdf.exception;

/** A submission was rejected before a job was created. */
public class ValidationException extends SerialPdfException {
  public ValidationException(String message) {
    super(SerialPdfErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(SerialPdfErrorCode.VALIDATION_ERROR, message, cause);
  }
}

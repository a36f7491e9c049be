package com.serialpdf.exception;

/** Unexpected fault while executing a job. */
public class ExecutionException extends SerialPdfException {
  public ExecutionException(String message) {
    super(SerialPdfErrorCode.INTERNAL_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(SerialPdfErrorCode.INTERNAL_ERROR, message, cause);
  }
}

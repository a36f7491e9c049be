package com.serialpdf.exception;

/** A component was used in a state that does not allow the operation. */
public class StateException extends SerialPdfException {
  public StateException(String message) {
    super(SerialPdfErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(SerialPdfErrorCode.STATE_ERROR, message, cause);
  }
}

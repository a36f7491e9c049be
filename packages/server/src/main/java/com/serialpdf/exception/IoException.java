package com.serialpdf.exception;

/** Filesystem or stream failure. */
public class IoException extends SerialPdfException {
  public IoException(String message) {
    super(SerialPdfErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(SerialPdfErrorCode.IO_ERROR, message, cause);
  }
}

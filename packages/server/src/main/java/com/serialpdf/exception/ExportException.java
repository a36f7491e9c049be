package com.serialpdf.exception;

/** A staged artifact could not be moved to the export directory. */
public class ExportException extends SerialPdfException {
  public ExportException(String message) {
    super(SerialPdfErrorCode.EXPORT_ERROR, message);
  }

  public ExportException(String message, Throwable cause) {
    super(SerialPdfErrorCode.EXPORT_ERROR, message, cause);
  }
}

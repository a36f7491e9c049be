package com.serialpdf.exception;

/** Placeholder substitution could not be applied to a template file. */
public class RenderException extends SerialPdfException {
  public RenderException(String message) {
    super(SerialPdfErrorCode.RENDER_ERROR, message);
  }

  public RenderException(String message, Throwable cause) {
    super(SerialPdfErrorCode.RENDER_ERROR, message, cause);
  }
}

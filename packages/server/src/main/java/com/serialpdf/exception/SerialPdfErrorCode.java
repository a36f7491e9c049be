package com.serialpdf.exception;

/** Stable error codes attached to every {@link SerialPdfException}. */
public enum SerialPdfErrorCode {
  CONFIG_ERROR,
  STATE_ERROR,
  IO_ERROR,
  VALIDATION_ERROR,
  NOT_FOUND,
  CHECKOUT_ERROR,
  RENDER_ERROR,
  COMPILATION_ERROR,
  EXPORT_ERROR,
  NETWORK_ERROR,
  INTERNAL_ERROR
}

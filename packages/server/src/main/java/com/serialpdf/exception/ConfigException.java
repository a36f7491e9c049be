package com.serialpdf.exception;

/** Invalid or missing configuration. */
public class ConfigException extends SerialPdfException {
  public ConfigException(String message) {
    super(SerialPdfErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SerialPdfErrorCode.CONFIG_ERROR, message, cause);
  }
}

package com.serialpdf.exception;

public class NetworkException extends SerialPdfException {
  public NetworkException(String message) {
    super(SerialPdfErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(SerialPdfErrorCode.NETWORK_ERROR, message, cause);
  }
}

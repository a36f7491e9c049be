package com.serialpdf.exception;

/** A commit or path could not be materialised from version history. */
public class CheckoutException extends SerialPdfException {
  public CheckoutException(String message) {
    super(SerialPdfErrorCode.CHECKOUT_ERROR, message);
  }

  public CheckoutException(String message, Throwable cause) {
    super(SerialPdfErrorCode.CHECKOUT_ERROR, message, cause);
  }
}

package com.codeheadsystems.blog.exception;

/**
 * A stored item is missing required attributes or has them in the wrong shape. Indicates data
 * corruption or schema drift.
 */
public class DecodeException extends BlogStoreException {

  /**
   * Instantiates a new Decode exception.
   *
   * @param message the message
   */
  public DecodeException(final String message) {
    super(ErrorKind.DECODE, message);
  }

  /**
   * Instantiates a new Decode exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DecodeException(final String message, final Throwable cause) {
    super(ErrorKind.DECODE, message, cause);
  }

}

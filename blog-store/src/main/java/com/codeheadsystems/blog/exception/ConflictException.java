package com.codeheadsystems.blog.exception;

/**
 * An item with the same key is already stored.
 */
public class ConflictException extends BlogStoreException {

  /**
   * Instantiates a new Conflict exception.
   *
   * @param message the message
   */
  public ConflictException(final String message) {
    super(ErrorKind.CONFLICT, message);
  }

  /**
   * Instantiates a new Conflict exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConflictException(final String message, final Throwable cause) {
    super(ErrorKind.CONFLICT, message, cause);
  }

}

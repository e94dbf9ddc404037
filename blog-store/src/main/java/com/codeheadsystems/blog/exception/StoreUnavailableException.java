package com.codeheadsystems.blog.exception;

/**
 * The store could not be reached, timed out, or throttled the request. Safe to retry.
 */
public class StoreUnavailableException extends BlogStoreException {

  /**
   * Instantiates a new Store unavailable exception.
   *
   * @param message the message
   */
  public StoreUnavailableException(final String message) {
    super(ErrorKind.STORE_UNAVAILABLE, message);
  }

  /**
   * Instantiates a new Store unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StoreUnavailableException(final String message, final Throwable cause) {
    super(ErrorKind.STORE_UNAVAILABLE, message, cause);
  }

}

package com.codeheadsystems.blog.exception;

/**
 * The requested entity does not exist.
 */
public class NotFoundException extends BlogStoreException {

  /**
   * Instantiates a new Not found exception.
   *
   * @param message the message
   */
  public NotFoundException(final String message) {
    super(ErrorKind.NOT_FOUND, message);
  }

}

package com.codeheadsystems.blog.exception;

/**
 * Input failed validation.
 */
public class ValidationException extends BlogStoreException {

  /**
   * Instantiates a new Validation exception.
   *
   * @param message the message
   */
  public ValidationException(final String message) {
    super(ErrorKind.VALIDATION, message);
  }

}

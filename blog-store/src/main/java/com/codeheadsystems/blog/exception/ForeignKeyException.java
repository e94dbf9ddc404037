package com.codeheadsystems.blog.exception;

/**
 * An entity referenced by the input does not exist.
 */
public class ForeignKeyException extends BlogStoreException {

  /**
   * Instantiates a new Foreign key exception.
   *
   * @param message the message
   */
  public ForeignKeyException(final String message) {
    super(ErrorKind.FOREIGN_KEY, message);
  }

}

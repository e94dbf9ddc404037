package com.codeheadsystems.blog.exception;

/**
 * The kinds of failure the store layer reports, with the HTTP status a handler should answer with.
 */
public enum ErrorKind {

  /**
   * Bad input shape or a missing required field.
   */
  VALIDATION(400, false),
  /**
   * The entity does not exist.
   */
  NOT_FOUND(404, false),
  /**
   * A referenced entity does not exist.
   */
  FOREIGN_KEY(400, false),
  /**
   * An entity with the same key already exists.
   */
  CONFLICT(409, false),
  /**
   * A dependent-entity deletion stopped part way.
   */
  CASCADE(500, false),
  /**
   * The store returned data that could not be decoded.
   */
  DECODE(500, false),
  /**
   * The store could not be reached or refused the request for capacity reasons.
   */
  STORE_UNAVAILABLE(503, true);

  private final int httpStatus;
  private final boolean retryable;

  ErrorKind(final int httpStatus, final boolean retryable) {
    this.httpStatus = httpStatus;
    this.retryable = retryable;
  }

  /**
   * Http status int.
   *
   * @return the int
   */
  public int httpStatus() {
    return httpStatus;
  }

  /**
   * Whether the caller may safely retry the same request.
   *
   * @return the boolean
   */
  public boolean retryable() {
    return retryable;
  }
}

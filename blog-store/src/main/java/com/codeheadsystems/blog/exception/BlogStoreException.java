package com.codeheadsystems.blog.exception;

/**
 * Root of every failure raised by the managers and the entity stores. Callers branch on
 * {@link #kind()} rather than on the concrete type.
 */
public abstract class BlogStoreException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Instantiates a new Blog store exception.
   *
   * @param kind    the kind
   * @param message the message
   */
  protected BlogStoreException(final ErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new Blog store exception.
   *
   * @param kind    the kind
   * @param message the message
   * @param cause   the cause
   */
  protected BlogStoreException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Kind error kind.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

}

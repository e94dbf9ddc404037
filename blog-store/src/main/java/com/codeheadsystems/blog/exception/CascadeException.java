package com.codeheadsystems.blog.exception;

import com.codeheadsystems.blog.model.CascadeResult;

/**
 * A cascading delete stopped before removing everything it planned to. Nothing already removed is
 * restored.
 */
public class CascadeException extends BlogStoreException {

  private final CascadeResult result;

  /**
   * Instantiates a new Cascade exception.
   *
   * @param result the partial result
   * @param cause  the failure that stopped the cascade
   */
  public CascadeException(final CascadeResult result, final Throwable cause) {
    super(ErrorKind.CASCADE,
        String.format("Cascade delete of %s stopped. Removed %s, not removed %s",
            result.root(), result.removed(), result.remaining()),
        cause);
    this.result = result;
  }

  /**
   * What was and was not removed.
   *
   * @return the cascade result
   */
  public CascadeResult result() {
    return result;
  }

}

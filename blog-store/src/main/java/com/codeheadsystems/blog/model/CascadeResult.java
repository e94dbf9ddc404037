package com.codeheadsystems.blog.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * Outcome of a cascading delete.
 */
@Value.Immutable
public interface CascadeResult {

  /**
   * The entity the cascade was rooted at.
   *
   * @return the item key
   */
  ItemKey root();

  /**
   * Keys deleted, or found already absent, in the order they were processed.
   *
   * @return the list
   */
  List<ItemKey> removed();

  /**
   * Keys still present because the cascade stopped before reaching them.
   *
   * @return the list
   */
  List<ItemKey> remaining();

  /**
   * Complete boolean.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean complete() {
    return remaining().isEmpty();
  }

}

package com.codeheadsystems.blog.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Key condition for a query: an equality on the partition attribute of the base table or of a
 * secondary index, optionally narrowed by a prefix on the sort attribute.
 */
@Value.Immutable
public interface IndexKey {

  /**
   * Secondary index to query, empty for the base table.
   *
   * @return the optional
   */
  Optional<String> indexName();

  /**
   * Name of the partition attribute in the queried index.
   *
   * @return the string
   */
  String partitionKeyName();

  /**
   * Partition key value.
   *
   * @return the string
   */
  String partitionKey();

  /**
   * Name of the sort attribute in the queried index, present when the index has one.
   *
   * @return the optional
   */
  Optional<String> sortKeyName();

  /**
   * Sort key prefix, matched with begins_with.
   *
   * @return the optional
   */
  Optional<String> sortKeyPrefix();

  /**
   * Prefix needs an attribute to apply to.
   */
  @Value.Check
  default void check() {
    if (sortKeyPrefix().isPresent() && sortKeyName().isEmpty()) {
      throw new IllegalStateException("Sort key prefix without a sort key name: " + this);
    }
  }

}

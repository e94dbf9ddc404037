package com.codeheadsystems.blog.model;

import org.immutables.value.Value;

/**
 * Primary key of an item in the single table.
 */
@Value.Immutable
public interface ItemKey {

  /**
   * Of item key.
   *
   * @param partitionKey the partition key
   * @param sortKey      the sort key
   * @return the item key
   */
  static ItemKey of(final String partitionKey, final String sortKey) {
    return ImmutableItemKey.builder().partitionKey(partitionKey).sortKey(sortKey).build();
  }

  /**
   * Partition key string.
   *
   * @return the string
   */
  String partitionKey();

  /**
   * Sort key string.
   *
   * @return the string
   */
  String sortKey();

}

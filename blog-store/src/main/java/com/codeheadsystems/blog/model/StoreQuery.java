package com.codeheadsystems.blog.model;

import java.util.Map;
import org.immutables.value.Value;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * One query against the entity store: a key condition plus equality filters applied to the
 * matching items.
 */
@Value.Immutable
public interface StoreQuery {

  /**
   * Of store query.
   *
   * @param indexKey the index key
   * @return the store query
   */
  static StoreQuery of(final IndexKey indexKey) {
    return ImmutableStoreQuery.builder().indexKey(indexKey).build();
  }

  /**
   * Index key.
   *
   * @return the index key
   */
  IndexKey indexKey();

  /**
   * Attribute name to required value. All must match.
   *
   * @return the map
   */
  Map<String, AttributeValue> filters();

}

package com.codeheadsystems.blog.store;

import com.codeheadsystems.blog.model.ItemKey;
import com.codeheadsystems.blog.model.StoreQuery;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The key-value document store the managers are written against. Each call is atomic on its own,
 * nothing spans calls.
 * <p>
 * Implementations raise {@link com.codeheadsystems.blog.exception.StoreUnavailableException} when
 * the store cannot be reached.
 */
public interface EntityStore {

  /**
   * Item stored under the key.
   *
   * @param key the key
   * @return the item, if present
   */
  Optional<Map<String, AttributeValue>> get(ItemKey key);

  /**
   * Write a new item.
   *
   * @param item the item, including its key attributes
   * @throws com.codeheadsystems.blog.exception.ConflictException if an item with the key exists.
   */
  void create(Map<String, AttributeValue> item);

  /**
   * Overwrite an existing item.
   *
   * @param item the item, including its key attributes
   * @throws com.codeheadsystems.blog.exception.NotFoundException if no item with the key exists.
   */
  void replace(Map<String, AttributeValue> item);

  /**
   * Delete the item.
   *
   * @param key the key
   * @return true if an item was deleted, false if there was nothing to delete
   */
  boolean delete(ItemKey key);

  /**
   * All items matching the key condition and filters. One logical request, pages are followed.
   *
   * @param query the query
   * @return the list
   */
  List<Map<String, AttributeValue>> query(StoreQuery query);

}

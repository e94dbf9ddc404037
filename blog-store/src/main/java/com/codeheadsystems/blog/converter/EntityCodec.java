package com.codeheadsystems.blog.converter;

import com.codeheadsystems.blog.model.EntityType;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Maps a domain object to and from the store's attribute representation.
 *
 * @param <T> the domain type
 */
public interface EntityCodec<T> {

  /**
   * The entity type this codec writes and accepts.
   *
   * @return the entity type
   */
  EntityType entityType();

  /**
   * Encode the entity, including its keys and index attributes.
   *
   * @param entity the entity
   * @return the map
   */
  Map<String, AttributeValue> encode(T entity);

  /**
   * Decode a stored item.
   *
   * @param item the item
   * @return the entity
   * @throws com.codeheadsystems.blog.exception.DecodeException if required attributes are missing or malformed.
   */
  T decode(Map<String, AttributeValue> item);

}

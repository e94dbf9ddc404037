package com.codeheadsystems.blog.converter;

import com.codeheadsystems.blog.exception.DecodeException;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.model.ItemKey;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Shared attribute reading and writing for the codecs.
 *
 * @param <T> the domain type
 */
public abstract class BaseEntityCodec<T> implements EntityCodec<T> {

  /**
   * Starts an item with its primary key and entity type.
   *
   * @param key the key
   * @return a mutable map
   */
  protected Map<String, AttributeValue> newItem(final ItemKey key) {
    final Map<String, AttributeValue> item = new HashMap<>();
    item.put(Attributes.PK, s(key.partitionKey()));
    item.put(Attributes.SK, s(key.sortKey()));
    item.put(Attributes.ENTITY_TYPE, s(entityType().name()));
    return item;
  }

  /**
   * Fails unless the item carries this codec's entity type.
   *
   * @param item the item
   */
  protected void requireEntityType(final Map<String, AttributeValue> item) {
    if (item == null) {
      throw new DecodeException("No item to decode as " + entityType());
    }
    final String type = string(item, Attributes.ENTITY_TYPE);
    if (!entityType().name().equals(type)) {
      throw new DecodeException("Expected " + entityType() + " item but found " + type);
    }
  }

  /**
   * String attribute value.
   *
   * @param value the value
   * @return the attribute value
   */
  protected AttributeValue s(final String value) {
    return AttributeValue.fromS(value);
  }

  /**
   * Number attribute value.
   *
   * @param value the value
   * @return the attribute value
   */
  protected AttributeValue n(final double value) {
    return AttributeValue.fromN(Double.toString(value));
  }

  /**
   * Required string attribute.
   *
   * @param item the item
   * @param name the name
   * @return the string
   */
  protected String string(final Map<String, AttributeValue> item, final String name) {
    final AttributeValue value = item.get(name);
    if (value == null) {
      throw new DecodeException("Missing attribute '" + name + "'");
    }
    if (value.s() == null) {
      throw new DecodeException("Attribute '" + name + "' is not a string: " + value);
    }
    return value.s();
  }

  /**
   * Required number attribute.
   *
   * @param item the item
   * @param name the name
   * @return the double
   */
  protected double number(final Map<String, AttributeValue> item, final String name) {
    final AttributeValue value = item.get(name);
    if (value == null) {
      throw new DecodeException("Missing attribute '" + name + "'");
    }
    if (value.n() == null) {
      throw new DecodeException("Attribute '" + name + "' is not a number: " + value);
    }
    try {
      return Double.parseDouble(value.n());
    } catch (NumberFormatException e) {
      throw new DecodeException("Attribute '" + name + "' is not a valid number: " + value.n(), e);
    }
  }

  /**
   * Required ISO-8601 timestamp attribute.
   *
   * @param item the item
   * @param name the name
   * @return the instant
   */
  protected Instant instant(final Map<String, AttributeValue> item, final String name) {
    final String value = string(item, name);
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new DecodeException("Attribute '" + name + "' is not a timestamp: " + value, e);
    }
  }

}

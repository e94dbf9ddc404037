package com.codeheadsystems.blog.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * A row of the relational BLOG_CONTENT table. The key and index attributes are columns so they can
 * be queried, the full item is kept as DynamoDB-typed JSON.
 */
@Value.Immutable
public interface ContentItem {

  /**
   * Pk string.
   *
   * @return the string
   */
  String pk();

  /**
   * Sk string.
   *
   * @return the string
   */
  String sk();

  /**
   * Entity type string.
   *
   * @return the string
   */
  String entityType();

  /**
   * Gsi 1 pk optional.
   *
   * @return the optional
   */
  Optional<String> gsi1pk();

  /**
   * Gsi 1 sk optional.
   *
   * @return the optional
   */
  Optional<String> gsi1sk();

  /**
   * Attributes json string.
   *
   * @return the string
   */
  String attributesJson();

}

package com.codeheadsystems.blog.model;

/**
 * The entity kinds sharing the single table. The name is stored on every item and the prefix
 * starts every key built for the kind.
 */
public enum EntityType {

  USER("USER#"),
  BLOG("BLOG#"),
  COMMENT("COMMENT#");

  private final String prefix;

  EntityType(final String prefix) {
    this.prefix = prefix;
  }

  /**
   * Key prefix string.
   *
   * @return the string
   */
  public String prefix() {
    return prefix;
  }

  /**
   * Key for the identifier with this type's prefix.
   *
   * @param id the id
   * @return the string
   */
  public String key(final String id) {
    return prefix + id;
  }

}

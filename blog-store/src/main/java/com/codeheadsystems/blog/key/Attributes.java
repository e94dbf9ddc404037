package com.codeheadsystems.blog.key;

/**
 * Attribute and index names of the BlogContent table.
 */
public final class Attributes {

  public static final String PK = "PK";
  public static final String SK = "SK";
  public static final String GSI1PK = "GSI1PK";
  public static final String GSI1SK = "GSI1SK";
  public static final String ENTITY_TYPE = "EntityType";

  /**
   * Re-keys blogs and comments by their user.
   */
  public static final String GSI1 = "GSI1";
  /**
   * Every item of one entity type.
   */
  public static final String ENTITY_TYPE_INDEX = "EntityTypeIndex";

  public static final String USER_ID = "user_id";
  public static final String BLOG_ID = "blog_id";
  public static final String NAME = "name";
  public static final String EMAIL = "email";
  public static final String PASSWORD = "password";
  public static final String TITLE = "title";
  public static final String SCORE = "score";
  public static final String CREATED_DATE = "created_date";
  public static final String MESSAGE = "message";

  private Attributes() {
  }

}

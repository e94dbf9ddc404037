package com.codeheadsystems.blog.model;

/**
 * Which entity store backs the managers.
 */
public enum StoreType {
  /**
   * A DynamoDB table, real or local.
   */
  DYNAMODB,
  /**
   * A relational table reached through JDBC.
   */
  JDBC
}

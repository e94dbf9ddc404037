package com.codeheadsystems.blog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Settings for the blog content store.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableBlogStoreConfiguration.class)
@JsonDeserialize(builder = ImmutableBlogStoreConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface BlogStoreConfiguration {

  /**
   * The default table name.
   */
  String DEFAULT_TABLE_NAME = "BlogContent";

  /**
   * Store type.
   *
   * @return the store type
   */
  @Value.Default
  default StoreType storeType() {
    return StoreType.DYNAMODB;
  }

  /**
   * Table name string.
   *
   * @return the string
   */
  @Value.Default
  default String tableName() {
    return DEFAULT_TABLE_NAME;
  }

  /**
   * Endpoint override, e.g. http://localhost:8000 for DynamoDB local.
   *
   * @return the optional
   */
  Optional<String> endpoint();

  /**
   * Region string.
   *
   * @return the string
   */
  @Value.Default
  default String region() {
    return "us-east-1";
  }

  /**
   * Total time allowed for one store call including retries.
   *
   * @return the long
   */
  @Value.Default
  default long apiCallTimeoutMillis() {
    return 5000L;
  }

  /**
   * Time allowed for a single attempt of a store call.
   *
   * @return the long
   */
  @Value.Default
  default long apiCallAttemptTimeoutMillis() {
    return 2000L;
  }

  /**
   * How many times a batch write is sent while items stay unprocessed.
   *
   * @return the int
   */
  @Value.Default
  default int batchWriteMaxAttempts() {
    return 5;
  }

  /**
   * Wait before the second batch write attempt, doubled for each later one.
   *
   * @return the long
   */
  @Value.Default
  default long batchWriteBackoffMillis() {
    return 100L;
  }

  /**
   * Database settings, required for {@link StoreType#JDBC}.
   *
   * @return the optional
   */
  Optional<Database> database();

  /**
   * Check.
   */
  @Value.Check
  default void check() {
    if (storeType() == StoreType.JDBC && database().isEmpty()) {
      throw new IllegalStateException("A database is required for the JDBC store");
    }
  }

}

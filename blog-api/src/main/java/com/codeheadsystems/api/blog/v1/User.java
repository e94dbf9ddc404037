package com.codeheadsystems.api.blog.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A registered author. Owns blogs and comments.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUser.class)
@JsonDeserialize(builder = ImmutableUser.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface User {

  /**
   * Server generated UUID.
   *
   * @return the user id
   */
  @JsonProperty("user_id")
  String userId();

  /**
   * Display name.
   *
   * @return the name
   */
  @JsonProperty("name")
  String name();

  /**
   * Email address.
   *
   * @return the email
   */
  @JsonProperty("email")
  String email();

  /**
   * The hashed password, never the plain text.
   *
   * @return the password hash
   */
  @JsonProperty("password")
  @Value.Redacted
  String password();

}

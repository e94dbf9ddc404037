package com.codeheadsystems.api.blog.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Input for registering a user. The password is plain text here and hashed before storage.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCreateUserRequest.class)
@JsonDeserialize(builder = ImmutableCreateUserRequest.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface CreateUserRequest {

  @JsonProperty("name")
  String name();

  @JsonProperty("email")
  String email();

  @JsonProperty("password")
  @Value.Redacted
  String password();

}

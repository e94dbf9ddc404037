package com.codeheadsystems.api.blog.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Partial update of a user. Absent fields keep their current value.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpdateUserRequest.class)
@JsonDeserialize(builder = ImmutableUpdateUserRequest.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpdateUserRequest {

  @JsonProperty("name")
  Optional<String> name();

  @JsonProperty("email")
  Optional<String> email();

  @JsonProperty("password")
  @Value.Redacted
  Optional<String> password();

}

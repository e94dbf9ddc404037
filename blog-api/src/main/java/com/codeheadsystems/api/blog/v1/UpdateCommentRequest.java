package com.codeheadsystems.api.blog.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Partial update of a comment.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpdateCommentRequest.class)
@JsonDeserialize(builder = ImmutableUpdateCommentRequest.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpdateCommentRequest {

  @JsonProperty("message")
  Optional<String> message();

}

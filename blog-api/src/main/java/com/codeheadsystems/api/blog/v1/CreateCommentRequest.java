package com.codeheadsystems.api.blog.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Input for commenting on a blog.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCreateCommentRequest.class)
@JsonDeserialize(builder = ImmutableCreateCommentRequest.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface CreateCommentRequest {

  @JsonProperty("blog_id")
  String blogId();

  @JsonProperty("user_id")
  String userId();

  @JsonProperty("message")
  String message();

}

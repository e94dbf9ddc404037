package com.codeheadsystems.api.blog.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Input for creating a blog. The id and created date are generated by the server.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCreateBlogRequest.class)
@JsonDeserialize(builder = ImmutableCreateBlogRequest.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface CreateBlogRequest {

  @JsonProperty("title")
  String title();

  /**
   * Initial score, zero when not given.
   *
   * @return the score
   */
  @JsonProperty("score")
  @Value.Default
  default double score() {
    return 0.0;
  }

  @JsonProperty("user_id")
  String userId();

}

package com.codeheadsystems.api.blog.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Partial update of a blog. Ownership cannot be changed.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableUpdateBlogRequest.class)
@JsonDeserialize(builder = ImmutableUpdateBlogRequest.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface UpdateBlogRequest {

  @JsonProperty("title")
  Optional<String> title();

  @JsonProperty("score")
  Optional<Double> score();

}

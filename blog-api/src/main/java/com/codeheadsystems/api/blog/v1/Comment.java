package com.codeheadsystems.api.blog.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import org.immutables.value.Value;

/**
 * A comment left by a user on a blog. A user has at most one comment per blog, so the pair of
 * ids is the identity.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableComment.class)
@JsonDeserialize(builder = ImmutableComment.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Comment {

  @JsonProperty("blog_id")
  String blogId();

  @JsonProperty("user_id")
  String userId();

  @JsonProperty("created_date")
  Instant createdDate();

  @JsonProperty("message")
  String message();

}

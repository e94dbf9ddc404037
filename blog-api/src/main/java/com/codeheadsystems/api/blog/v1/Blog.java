package com.codeheadsystems.api.blog.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import org.immutables.value.Value;

/**
 * A blog post written by a single user.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableBlog.class)
@JsonDeserialize(builder = ImmutableBlog.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Blog {

  /**
   * Server generated UUID.
   *
   * @return the blog id
   */
  @JsonProperty("blog_id")
  String blogId();

  /**
   * Title.
   *
   * @return the title
   */
  @JsonProperty("title")
  String title();

  /**
   * Score.
   *
   * @return the score
   */
  @JsonProperty("score")
  double score();

  /**
   * When the blog was created, set by the server.
   *
   * @return the created date
   */
  @JsonProperty("created_date")
  Instant createdDate();

  /**
   * The owning user.
   *
   * @return the user id
   */
  @JsonProperty("user_id")
  String userId();

}

package com.codeheadsystems.blog.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Equality filter for listing comments.
 */
@Value.Immutable
public interface CommentFilter {

  /**
   * No filter.
   *
   * @return the comment filter
   */
  static CommentFilter all() {
    return ImmutableCommentFilter.builder().build();
  }

  Optional<String> blogId();

  Optional<String> userId();

}

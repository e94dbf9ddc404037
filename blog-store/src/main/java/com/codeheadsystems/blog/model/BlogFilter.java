package com.codeheadsystems.blog.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Equality filter for listing blogs.
 */
@Value.Immutable
public interface BlogFilter {

  /**
   * No filter.
   *
   * @return the blog filter
   */
  static BlogFilter all() {
    return ImmutableBlogFilter.builder().build();
  }

  Optional<String> title();

  Optional<String> userId();

}

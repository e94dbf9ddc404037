package com.codeheadsystems.blog.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Equality filter for listing users.
 */
@Value.Immutable
public interface UserFilter {

  /**
   * No filter.
   *
   * @return the user filter
   */
  static UserFilter all() {
    return ImmutableUserFilter.builder().build();
  }

  Optional<String> name();

  Optional<String> email();

}

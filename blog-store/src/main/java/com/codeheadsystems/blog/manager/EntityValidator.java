package com.codeheadsystems.blog.manager;

import com.codeheadsystems.api.blog.v1.Blog;
import com.codeheadsystems.api.blog.v1.Comment;
import com.codeheadsystems.api.blog.v1.User;
import com.codeheadsystems.blog.exception.ValidationException;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Input checks run before anything is written or any key is built.
 */
@Singleton
public class EntityValidator {

  static final int MIN_PASSWORD_LENGTH = 8;
  static final int MAX_MESSAGE_LENGTH = 1000;
  // DynamoDB numbers: zero, or a magnitude between 1E-130 and 9.99..E+125.
  static final double MAX_SCORE = 9.9999999999999999999999999999999999999E+125;
  static final double MIN_POSITIVE_SCORE = 1E-130;

  private static final Pattern UUID_PATTERN =
      Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
  private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

  /**
   * Instantiates a new Entity validator.
   */
  @Inject
  public EntityValidator() {
  }

  /**
   * Require id.
   *
   * @param field the field
   * @param id    the id
   */
  public void requireId(final String field, final String id) {
    requireText(field, id);
    if (!UUID_PATTERN.matcher(id).matches()) {
      throw new ValidationException(field + " must be a UUID: " + id);
    }
  }

  /**
   * Require a plain text password long enough to hash.
   *
   * @param password the password
   */
  public void requirePassword(final String password) {
    if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
      throw new ValidationException("password must be at least " + MIN_PASSWORD_LENGTH + " characters");
    }
  }

  /**
   * Validate user.
   *
   * @param user the user
   */
  public void validate(final User user) {
    requireId("user_id", user.userId());
    requireText("name", user.name());
    requireText("email", user.email());
    if (!EMAIL_PATTERN.matcher(user.email()).matches()) {
      throw new ValidationException("email is not an address: " + user.email());
    }
  }

  /**
   * Validate blog.
   *
   * @param blog the blog
   */
  public void validate(final Blog blog) {
    requireId("blog_id", blog.blogId());
    requireId("user_id", blog.userId());
    requireText("title", blog.title());
    requireScore(blog.score());
  }

  /**
   * Validate comment.
   *
   * @param comment the comment
   */
  public void validate(final Comment comment) {
    requireId("blog_id", comment.blogId());
    requireId("user_id", comment.userId());
    requireText("message", comment.message());
    if (comment.message().length() > MAX_MESSAGE_LENGTH) {
      throw new ValidationException("message must be at most " + MAX_MESSAGE_LENGTH + " characters");
    }
  }

  /**
   * Require score.
   *
   * @param score the score
   */
  public void requireScore(final double score) {
    if (!Double.isFinite(score) || score < 0) {
      throw new ValidationException("score must be a non-negative number: " + score);
    }
    if (score > MAX_SCORE || (score > 0 && score < MIN_POSITIVE_SCORE)) {
      throw new ValidationException("score is outside the storable number range: " + score);
    }
  }

  /**
   * Require text.
   *
   * @param field the field
   * @param value the value
   */
  public void requireText(final String field, final String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " is required");
    }
  }

}

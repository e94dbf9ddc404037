package com.codeheadsystems.blog.manager;

import com.codeheadsystems.api.blog.v1.Comment;
import com.codeheadsystems.api.blog.v1.CreateCommentRequest;
import com.codeheadsystems.api.blog.v1.ImmutableComment;
import com.codeheadsystems.api.blog.v1.UpdateCommentRequest;
import com.codeheadsystems.blog.converter.CommentCodec;
import com.codeheadsystems.blog.exception.ForeignKeyException;
import com.codeheadsystems.blog.exception.NotFoundException;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.key.KeyBuilder;
import com.codeheadsystems.blog.model.CommentFilter;
import com.codeheadsystems.blog.model.EntityType;
import com.codeheadsystems.blog.model.ImmutableStoreQuery;
import com.codeheadsystems.blog.store.EntityStore;
import java.time.Clock;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The type Comment manager. Comments are identified by the blog and the user, a second comment by
 * the same user on the same blog is a conflict.
 */
@Singleton
public class CommentManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(CommentManager.class);

  private final EntityStore entityStore;
  private final CommentCodec commentCodec;
  private final KeyBuilder keyBuilder;
  private final EntityValidator entityValidator;
  private final Clock clock;

  /**
   * Instantiates a new Comment manager.
   *
   * @param entityStore     the entity store
   * @param commentCodec    the comment codec
   * @param keyBuilder      the key builder
   * @param entityValidator the entity validator
   * @param clock           the clock
   */
  @Inject
  public CommentManager(final EntityStore entityStore,
                        final CommentCodec commentCodec,
                        final KeyBuilder keyBuilder,
                        final EntityValidator entityValidator,
                        final Clock clock) {
    LOGGER.info("CommentManager({},{})", entityStore, clock);
    this.entityStore = entityStore;
    this.commentCodec = commentCodec;
    this.keyBuilder = keyBuilder;
    this.entityValidator = entityValidator;
    this.clock = clock;
  }

  /**
   * Create comment.
   *
   * @param request the request
   * @return the comment
   */
  public Comment create(final CreateCommentRequest request) {
    LOGGER.trace("create({})", request);
    final Comment comment = ImmutableComment.builder()
        .blogId(request.blogId())
        .userId(request.userId())
        .message(request.message())
        .createdDate(clock.instant())
        .build();
    entityValidator.validate(comment);
    if (entityStore.get(keyBuilder.blogKey(comment.blogId())).isEmpty()) {
      throw new ForeignKeyException("Blog does not exist: " + comment.blogId());
    }
    if (entityStore.get(keyBuilder.userKey(comment.userId())).isEmpty()) {
      throw new ForeignKeyException("User does not exist: " + comment.userId());
    }
    entityStore.create(commentCodec.encode(comment));
    return comment;
  }

  /**
   * Read comment.
   *
   * @param blogId the blog id
   * @param userId the user id
   * @return the comment
   */
  public Comment read(final String blogId, final String userId) {
    LOGGER.trace("read({},{})", blogId, userId);
    entityValidator.requireId("blog_id", blogId);
    entityValidator.requireId("user_id", userId);
    return entityStore.get(keyBuilder.commentKey(blogId, userId))
        .map(commentCodec::decode)
        .orElseThrow(() -> new NotFoundException("Comment not found: " + blogId + "/" + userId));
  }

  /**
   * Update the message.
   *
   * @param blogId  the blog id
   * @param userId  the user id
   * @param request the request
   * @return the comment
   */
  public Comment update(final String blogId, final String userId, final UpdateCommentRequest request) {
    LOGGER.trace("update({},{},{})", blogId, userId, request);
    final Comment current = read(blogId, userId);
    final ImmutableComment.Builder builder = ImmutableComment.builder().from(current);
    request.message().ifPresent(builder::message);
    final Comment updated = builder.build();
    entityValidator.validate(updated);
    entityStore.replace(commentCodec.encode(updated));
    return updated;
  }

  /**
   * Delete comment. Nothing depends on a comment.
   *
   * @param blogId the blog id
   * @param userId the user id
   */
  public void delete(final String blogId, final String userId) {
    LOGGER.trace("delete({},{})", blogId, userId);
    entityValidator.requireId("blog_id", blogId);
    entityValidator.requireId("user_id", userId);
    if (!entityStore.delete(keyBuilder.commentKey(blogId, userId))) {
      throw new NotFoundException("Comment not found: " + blogId + "/" + userId);
    }
  }

  /**
   * List comments. A blog filter reads the blog's partition, a user filter alone reads the user's
   * partition of GSI1, no filter reads the entity type index.
   *
   * @param filter the filter
   * @return the list
   */
  public List<Comment> list(final CommentFilter filter) {
    LOGGER.trace("list({})", filter);
    final ImmutableStoreQuery.Builder query = ImmutableStoreQuery.builder();
    if (filter.blogId().isPresent()) {
      entityValidator.requireId("blog_id", filter.blogId().get());
      query.indexKey(keyBuilder.indexKeyForBlogComments(filter.blogId().get()));
      filter.userId().ifPresent(userId -> {
        entityValidator.requireId("user_id", userId);
        query.putFilters(Attributes.USER_ID, AttributeValue.fromS(userId));
      });
    } else if (filter.userId().isPresent()) {
      entityValidator.requireId("user_id", filter.userId().get());
      query.indexKey(keyBuilder.indexKeyForUserComments(filter.userId().get()));
    } else {
      query.indexKey(keyBuilder.indexKeyForType(EntityType.COMMENT));
    }
    return entityStore.query(query.build()).stream()
        .map(commentCodec::decode)
        .toList();
  }

}

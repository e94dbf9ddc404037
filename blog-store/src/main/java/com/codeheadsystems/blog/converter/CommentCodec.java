package com.codeheadsystems.blog.converter;

import com.codeheadsystems.api.blog.v1.Comment;
import com.codeheadsystems.api.blog.v1.ImmutableComment;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.key.KeyBuilder;
import com.codeheadsystems.blog.model.EntityType;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The type Comment codec. Comments are stored in their blog's partition and written to GSI1
 * under their author.
 */
@Singleton
public class CommentCodec extends BaseEntityCodec<Comment> {

  private final KeyBuilder keyBuilder;

  /**
   * Instantiates a new Comment codec.
   *
   * @param keyBuilder the key builder
   */
  @Inject
  public CommentCodec(final KeyBuilder keyBuilder) {
    this.keyBuilder = keyBuilder;
  }

  @Override
  public EntityType entityType() {
    return EntityType.COMMENT;
  }

  @Override
  public Map<String, AttributeValue> encode(final Comment comment) {
    final Map<String, AttributeValue> item = newItem(keyBuilder.commentKey(comment.blogId(), comment.userId()));
    item.put(Attributes.GSI1PK, s(keyBuilder.userIndexPartitionKey(comment.userId())));
    item.put(Attributes.GSI1SK, s(keyBuilder.userCommentsIndexSortKey(comment.blogId())));
    item.put(Attributes.BLOG_ID, s(comment.blogId()));
    item.put(Attributes.USER_ID, s(comment.userId()));
    item.put(Attributes.MESSAGE, s(comment.message()));
    item.put(Attributes.CREATED_DATE, s(comment.createdDate().toString()));
    return item;
  }

  @Override
  public Comment decode(final Map<String, AttributeValue> item) {
    requireEntityType(item);
    return ImmutableComment.builder()
        .blogId(string(item, Attributes.BLOG_ID))
        .userId(string(item, Attributes.USER_ID))
        .message(string(item, Attributes.MESSAGE))
        .createdDate(instant(item, Attributes.CREATED_DATE))
        .build();
  }
}

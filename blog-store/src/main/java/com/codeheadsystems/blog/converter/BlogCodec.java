package com.codeheadsystems.blog.converter;

import com.codeheadsystems.api.blog.v1.Blog;
import com.codeheadsystems.api.blog.v1.ImmutableBlog;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.key.KeyBuilder;
import com.codeheadsystems.blog.model.EntityType;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The type Blog codec. Blogs are also written to GSI1 under their owner.
 */
@Singleton
public class BlogCodec extends BaseEntityCodec<Blog> {

  private final KeyBuilder keyBuilder;

  /**
   * Instantiates a new Blog codec.
   *
   * @param keyBuilder the key builder
   */
  @Inject
  public BlogCodec(final KeyBuilder keyBuilder) {
    this.keyBuilder = keyBuilder;
  }

  @Override
  public EntityType entityType() {
    return EntityType.BLOG;
  }

  @Override
  public Map<String, AttributeValue> encode(final Blog blog) {
    final Map<String, AttributeValue> item = newItem(keyBuilder.blogKey(blog.blogId()));
    item.put(Attributes.GSI1PK, s(keyBuilder.userIndexPartitionKey(blog.userId())));
    item.put(Attributes.GSI1SK, s(keyBuilder.userBlogsIndexSortKey(blog.blogId())));
    item.put(Attributes.BLOG_ID, s(blog.blogId()));
    item.put(Attributes.USER_ID, s(blog.userId()));
    item.put(Attributes.TITLE, s(blog.title()));
    item.put(Attributes.SCORE, n(blog.score()));
    item.put(Attributes.CREATED_DATE, s(blog.createdDate().toString()));
    return item;
  }

  @Override
  public Blog decode(final Map<String, AttributeValue> item) {
    requireEntityType(item);
    return ImmutableBlog.builder()
        .blogId(string(item, Attributes.BLOG_ID))
        .userId(string(item, Attributes.USER_ID))
        .title(string(item, Attributes.TITLE))
        .score(number(item, Attributes.SCORE))
        .createdDate(instant(item, Attributes.CREATED_DATE))
        .build();
  }
}

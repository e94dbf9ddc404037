package com.codeheadsystems.blog.manager;

import com.codeheadsystems.api.blog.v1.Blog;
import com.codeheadsystems.api.blog.v1.CreateBlogRequest;
import com.codeheadsystems.api.blog.v1.ImmutableBlog;
import com.codeheadsystems.api.blog.v1.UpdateBlogRequest;
import com.codeheadsystems.blog.converter.BlogCodec;
import com.codeheadsystems.blog.exception.ForeignKeyException;
import com.codeheadsystems.blog.exception.NotFoundException;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.key.KeyBuilder;
import com.codeheadsystems.blog.model.BlogFilter;
import com.codeheadsystems.blog.model.CascadeResult;
import com.codeheadsystems.blog.model.EntityType;
import com.codeheadsystems.blog.model.ImmutableStoreQuery;
import com.codeheadsystems.blog.store.EntityStore;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The type Blog manager.
 */
@Singleton
public class BlogManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(BlogManager.class);

  private final EntityStore entityStore;
  private final BlogCodec blogCodec;
  private final KeyBuilder keyBuilder;
  private final EntityValidator entityValidator;
  private final CascadeDeleteManager cascadeDeleteManager;
  private final Clock clock;

  /**
   * Instantiates a new Blog manager.
   *
   * @param entityStore          the entity store
   * @param blogCodec            the blog codec
   * @param keyBuilder           the key builder
   * @param entityValidator      the entity validator
   * @param cascadeDeleteManager the cascade delete manager
   * @param clock                the clock
   */
  @Inject
  public BlogManager(final EntityStore entityStore,
                     final BlogCodec blogCodec,
                     final KeyBuilder keyBuilder,
                     final EntityValidator entityValidator,
                     final CascadeDeleteManager cascadeDeleteManager,
                     final Clock clock) {
    LOGGER.info("BlogManager({},{})", entityStore, clock);
    this.entityStore = entityStore;
    this.blogCodec = blogCodec;
    this.keyBuilder = keyBuilder;
    this.entityValidator = entityValidator;
    this.cascadeDeleteManager = cascadeDeleteManager;
    this.clock = clock;
  }

  /**
   * Create a blog for an existing user.
   *
   * @param request the request
   * @return the blog
   */
  public Blog create(final CreateBlogRequest request) {
    LOGGER.trace("create({})", request);
    final Blog blog = ImmutableBlog.builder()
        .blogId(UUID.randomUUID().toString())
        .title(request.title())
        .score(request.score())
        .createdDate(clock.instant())
        .userId(request.userId())
        .build();
    entityValidator.validate(blog);
    if (entityStore.get(keyBuilder.userKey(blog.userId())).isEmpty()) {
      throw new ForeignKeyException("User does not exist: " + blog.userId());
    }
    entityStore.create(blogCodec.encode(blog));
    return blog;
  }

  /**
   * Read blog.
   *
   * @param blogId the blog id
   * @return the blog
   */
  public Blog read(final String blogId) {
    LOGGER.trace("read({})", blogId);
    entityValidator.requireId("blog_id", blogId);
    return entityStore.get(keyBuilder.blogKey(blogId))
        .map(blogCodec::decode)
        .orElseThrow(() -> new NotFoundException("Blog not found: " + blogId));
  }

  /**
   * Update blog title and score.
   *
   * @param blogId  the blog id
   * @param request the request
   * @return the blog
   */
  public Blog update(final String blogId, final UpdateBlogRequest request) {
    LOGGER.trace("update({},{})", blogId, request);
    final Blog current = read(blogId);
    final ImmutableBlog.Builder builder = ImmutableBlog.builder().from(current);
    request.title().ifPresent(builder::title);
    request.score().ifPresent(builder::score);
    final Blog updated = builder.build();
    entityValidator.validate(updated);
    entityStore.replace(blogCodec.encode(updated));
    return updated;
  }

  /**
   * Delete the blog and its comments.
   *
   * @param blogId the blog id
   * @return the cascade result
   */
  public CascadeResult delete(final String blogId) {
    LOGGER.trace("delete({})", blogId);
    entityValidator.requireId("blog_id", blogId);
    return cascadeDeleteManager.deleteBlog(blogId);
  }

  /**
   * List blogs. A user filter reads that user's partition of GSI1, otherwise every blog is read
   * from the entity type index.
   *
   * @param filter the filter
   * @return the list
   */
  public List<Blog> list(final BlogFilter filter) {
    LOGGER.trace("list({})", filter);
    final ImmutableStoreQuery.Builder query = ImmutableStoreQuery.builder();
    if (filter.userId().isPresent()) {
      entityValidator.requireId("user_id", filter.userId().get());
      query.indexKey(keyBuilder.indexKeyForUserBlogs(filter.userId().get()));
    } else {
      query.indexKey(keyBuilder.indexKeyForType(EntityType.BLOG));
    }
    filter.title().ifPresent(title -> query.putFilters(Attributes.TITLE, AttributeValue.fromS(title)));
    return entityStore.query(query.build()).stream()
        .map(blogCodec::decode)
        .toList();
  }

}

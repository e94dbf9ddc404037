package com.codeheadsystems.blog.key;

import com.codeheadsystems.blog.model.EntityType;
import com.codeheadsystems.blog.model.ImmutableIndexKey;
import com.codeheadsystems.blog.model.IndexKey;
import com.codeheadsystems.blog.model.ItemKey;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Computes the keys of every item and access pattern in the single table.
 * <p>
 * Users and blogs key on themselves. A comment lives in its blog's partition, sorted by the
 * commenting user, so one partition query returns all comments of a blog and the pair of ids can
 * only be stored once. GSI1 re-keys blogs and comments by their user.
 * <p>
 * Ids are not validated here.
 */
@Singleton
public class KeyBuilder {

  /**
   * Instantiates a new Key builder.
   */
  @Inject
  public KeyBuilder() {
  }

  /**
   * User key item key.
   *
   * @param userId the user id
   * @return the item key
   */
  public ItemKey userKey(final String userId) {
    final String key = EntityType.USER.key(userId);
    return ItemKey.of(key, key);
  }

  /**
   * Blog key item key.
   *
   * @param blogId the blog id
   * @return the item key
   */
  public ItemKey blogKey(final String blogId) {
    final String key = EntityType.BLOG.key(blogId);
    return ItemKey.of(key, key);
  }

  /**
   * Comment key item key.
   *
   * @param blogId the blog id
   * @param userId the user id
   * @return the item key
   */
  public ItemKey commentKey(final String blogId, final String userId) {
    return ItemKey.of(EntityType.BLOG.key(blogId), EntityType.COMMENT.key(userId));
  }

  /**
   * GSI1 partition value shared by everything a user owns.
   *
   * @param userId the user id
   * @return the string
   */
  public String userIndexPartitionKey(final String userId) {
    return EntityType.USER.key(userId);
  }

  /**
   * GSI1 sort value of a blog.
   *
   * @param blogId the blog id
   * @return the string
   */
  public String userBlogsIndexSortKey(final String blogId) {
    return EntityType.BLOG.key(blogId);
  }

  /**
   * GSI1 sort value of a comment.
   *
   * @param blogId the blog id
   * @return the string
   */
  public String userCommentsIndexSortKey(final String blogId) {
    return EntityType.COMMENT.key(blogId);
  }

  /**
   * Blogs owned by a user.
   *
   * @param userId the user id
   * @return the index key
   */
  public IndexKey indexKeyForUserBlogs(final String userId) {
    return userIndex(userId, EntityType.BLOG.prefix());
  }

  /**
   * Comments written by a user, on any blog.
   *
   * @param userId the user id
   * @return the index key
   */
  public IndexKey indexKeyForUserComments(final String userId) {
    return userIndex(userId, EntityType.COMMENT.prefix());
  }

  /**
   * Comments on a blog. Queries the base table.
   *
   * @param blogId the blog id
   * @return the index key
   */
  public IndexKey indexKeyForBlogComments(final String blogId) {
    return ImmutableIndexKey.builder()
        .partitionKeyName(Attributes.PK)
        .partitionKey(EntityType.BLOG.key(blogId))
        .sortKeyName(Attributes.SK)
        .sortKeyPrefix(EntityType.COMMENT.prefix())
        .build();
  }

  /**
   * Every entity of a type.
   *
   * @param entityType the entity type
   * @return the index key
   */
  public IndexKey indexKeyForType(final EntityType entityType) {
    return ImmutableIndexKey.builder()
        .indexName(Attributes.ENTITY_TYPE_INDEX)
        .partitionKeyName(Attributes.ENTITY_TYPE)
        .partitionKey(entityType.name())
        .build();
  }

  private IndexKey userIndex(final String userId, final String sortKeyPrefix) {
    return ImmutableIndexKey.builder()
        .indexName(Attributes.GSI1)
        .partitionKeyName(Attributes.GSI1PK)
        .partitionKey(userIndexPartitionKey(userId))
        .sortKeyName(Attributes.GSI1SK)
        .sortKeyPrefix(sortKeyPrefix)
        .build();
  }

}

package com.codeheadsystems.blog.manager;

import com.codeheadsystems.blog.exception.CascadeException;
import com.codeheadsystems.blog.exception.DecodeException;
import com.codeheadsystems.blog.exception.NotFoundException;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.key.KeyBuilder;
import com.codeheadsystems.blog.model.CascadeResult;
import com.codeheadsystems.blog.model.ImmutableCascadeResult;
import com.codeheadsystems.blog.model.IndexKey;
import com.codeheadsystems.blog.model.ItemKey;
import com.codeheadsystems.blog.model.StoreQuery;
import com.codeheadsystems.blog.store.EntityStore;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Deletes a user or a blog together with everything that depends on it.
 * <p>
 * The dependents are found first and deleted one by one, children before parents, the root last.
 * A failure stops the cascade and is reported as a {@link CascadeException} listing what was and
 * was not removed. Nothing is rolled back. A dependent that is already gone counts as removed.
 * The calling thread's interrupt flag is checked before every delete.
 */
@Singleton
public class CascadeDeleteManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(CascadeDeleteManager.class);

  private final EntityStore entityStore;
  private final KeyBuilder keyBuilder;

  /**
   * Instantiates a new Cascade delete manager.
   *
   * @param entityStore the entity store
   * @param keyBuilder  the key builder
   */
  @Inject
  public CascadeDeleteManager(final EntityStore entityStore,
                              final KeyBuilder keyBuilder) {
    LOGGER.info("CascadeDeleteManager({},{})", entityStore, keyBuilder);
    this.entityStore = entityStore;
    this.keyBuilder = keyBuilder;
  }

  /**
   * Delete a user, the blogs they own with all comments on them, and their comments on other blogs.
   *
   * @param userId the user id
   * @return the cascade result
   */
  public CascadeResult deleteUser(final String userId) {
    LOGGER.trace("deleteUser({})", userId);
    final ItemKey root = keyBuilder.userKey(userId);
    requireExists(root, "User not found: " + userId);
    final Set<ItemKey> plan = new LinkedHashSet<>();
    try {
      for (Map<String, AttributeValue> blog : query(keyBuilder.indexKeyForUserBlogs(userId))) {
        final String blogId = blogId(blog);
        query(keyBuilder.indexKeyForBlogComments(blogId)).forEach(comment -> plan.add(itemKey(comment)));
        plan.add(itemKey(blog));
      }
      query(keyBuilder.indexKeyForUserComments(userId)).forEach(comment -> plan.add(itemKey(comment)));
    } catch (RuntimeException e) {
      throw planningFailed(root, e);
    }
    plan.add(root);
    return execute(root, new ArrayList<>(plan));
  }

  /**
   * Delete a blog and its comments.
   *
   * @param blogId the blog id
   * @return the cascade result
   */
  public CascadeResult deleteBlog(final String blogId) {
    LOGGER.trace("deleteBlog({})", blogId);
    final ItemKey root = keyBuilder.blogKey(blogId);
    requireExists(root, "Blog not found: " + blogId);
    final Set<ItemKey> plan = new LinkedHashSet<>();
    try {
      query(keyBuilder.indexKeyForBlogComments(blogId)).forEach(comment -> plan.add(itemKey(comment)));
    } catch (RuntimeException e) {
      throw planningFailed(root, e);
    }
    plan.add(root);
    return execute(root, new ArrayList<>(plan));
  }

  private CascadeResult execute(final ItemKey root, final List<ItemKey> plan) {
    final List<ItemKey> removed = new ArrayList<>();
    for (int i = 0; i < plan.size(); i++) {
      final ItemKey key = plan.get(i);
      if (Thread.currentThread().isInterrupted()) {
        final CascadeResult result = result(root, removed, plan.subList(i, plan.size()));
        LOGGER.warn("execute(): interrupted {}", result);
        throw new CascadeException(result, new InterruptedException("Cascade delete interrupted"));
      }
      try {
        if (!entityStore.delete(key)) {
          LOGGER.debug("execute(): already absent {}", key);
        }
      } catch (RuntimeException e) {
        final CascadeResult result = result(root, removed, plan.subList(i, plan.size()));
        LOGGER.error("execute(): failed on {} {}", key, result, e);
        throw new CascadeException(result, e);
      }
      removed.add(key);
    }
    final CascadeResult result = result(root, removed, List.of());
    LOGGER.info("execute(): removed {} items for {}", removed.size(), root);
    return result;
  }

  private void requireExists(final ItemKey root, final String message) {
    if (entityStore.get(root).isEmpty()) {
      throw new NotFoundException(message);
    }
  }

  private List<Map<String, AttributeValue>> query(final IndexKey indexKey) {
    return entityStore.query(StoreQuery.of(indexKey));
  }

  private CascadeException planningFailed(final ItemKey root, final RuntimeException e) {
    final CascadeResult result = result(root, List.of(), List.of(root));
    LOGGER.error("planningFailed(): unable to find dependents of {}", root, e);
    return new CascadeException(result, e);
  }

  private CascadeResult result(final ItemKey root, final List<ItemKey> removed, final List<ItemKey> remaining) {
    return ImmutableCascadeResult.builder()
        .root(root)
        .removed(removed)
        .remaining(remaining)
        .build();
  }

  private ItemKey itemKey(final Map<String, AttributeValue> item) {
    return ItemKey.of(string(item, Attributes.PK), string(item, Attributes.SK));
  }

  private String blogId(final Map<String, AttributeValue> item) {
    return string(item, Attributes.BLOG_ID);
  }

  private String string(final Map<String, AttributeValue> item, final String name) {
    final AttributeValue value = item.get(name);
    if (value == null || value.s() == null) {
      throw new DecodeException("Item has no string attribute '" + name + "'");
    }
    return value.s();
  }

}

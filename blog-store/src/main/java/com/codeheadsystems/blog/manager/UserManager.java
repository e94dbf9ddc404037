package com.codeheadsystems.blog.manager;

import com.codeheadsystems.api.blog.v1.CreateUserRequest;
import com.codeheadsystems.api.blog.v1.ImmutableUser;
import com.codeheadsystems.api.blog.v1.UpdateUserRequest;
import com.codeheadsystems.api.blog.v1.User;
import com.codeheadsystems.blog.converter.UserCodec;
import com.codeheadsystems.blog.exception.NotFoundException;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.key.KeyBuilder;
import com.codeheadsystems.blog.model.CascadeResult;
import com.codeheadsystems.blog.model.EntityType;
import com.codeheadsystems.blog.model.ImmutableStoreQuery;
import com.codeheadsystems.blog.model.StoreQuery;
import com.codeheadsystems.blog.model.UserFilter;
import com.codeheadsystems.blog.store.EntityStore;
import com.codeheadsystems.blog.utilities.PasswordHasher;
import java.util.List;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The type User manager.
 */
@Singleton
public class UserManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(UserManager.class);

  private final EntityStore entityStore;
  private final UserCodec userCodec;
  private final KeyBuilder keyBuilder;
  private final EntityValidator entityValidator;
  private final PasswordHasher passwordHasher;
  private final CascadeDeleteManager cascadeDeleteManager;

  /**
   * Instantiates a new User manager.
   *
   * @param entityStore          the entity store
   * @param userCodec            the user codec
   * @param keyBuilder           the key builder
   * @param entityValidator      the entity validator
   * @param passwordHasher       the password hasher
   * @param cascadeDeleteManager the cascade delete manager
   */
  @Inject
  public UserManager(final EntityStore entityStore,
                     final UserCodec userCodec,
                     final KeyBuilder keyBuilder,
                     final EntityValidator entityValidator,
                     final PasswordHasher passwordHasher,
                     final CascadeDeleteManager cascadeDeleteManager) {
    LOGGER.info("UserManager({})", entityStore);
    this.entityStore = entityStore;
    this.userCodec = userCodec;
    this.keyBuilder = keyBuilder;
    this.entityValidator = entityValidator;
    this.passwordHasher = passwordHasher;
    this.cascadeDeleteManager = cascadeDeleteManager;
  }

  /**
   * Create user.
   *
   * @param request the request
   * @return the user
   */
  public User create(final CreateUserRequest request) {
    LOGGER.trace("create({})", request);
    entityValidator.requirePassword(request.password());
    final User user = ImmutableUser.builder()
        .userId(UUID.randomUUID().toString())
        .name(request.name())
        .email(request.email())
        .password(passwordHasher.hash(request.password()))
        .build();
    entityValidator.validate(user);
    entityStore.create(userCodec.encode(user));
    return user;
  }

  /**
   * Read user.
   *
   * @param userId the user id
   * @return the user
   */
  public User read(final String userId) {
    LOGGER.trace("read({})", userId);
    entityValidator.requireId("user_id", userId);
    return entityStore.get(keyBuilder.userKey(userId))
        .map(userCodec::decode)
        .orElseThrow(() -> new NotFoundException("User not found: " + userId));
  }

  /**
   * Update user. Fields absent from the request are kept.
   *
   * @param userId  the user id
   * @param request the request
   * @return the user
   */
  public User update(final String userId, final UpdateUserRequest request) {
    LOGGER.trace("update({},{})", userId, request);
    final User current = read(userId);
    final ImmutableUser.Builder builder = ImmutableUser.builder().from(current);
    request.name().ifPresent(builder::name);
    request.email().ifPresent(builder::email);
    if (request.password().isPresent()) {
      entityValidator.requirePassword(request.password().get());
      builder.password(passwordHasher.hash(request.password().get()));
    }
    final User updated = builder.build();
    entityValidator.validate(updated);
    entityStore.replace(userCodec.encode(updated));
    return updated;
  }

  /**
   * Delete the user with their blogs and comments.
   *
   * @param userId the user id
   * @return the cascade result
   */
  public CascadeResult delete(final String userId) {
    LOGGER.trace("delete({})", userId);
    entityValidator.requireId("user_id", userId);
    return cascadeDeleteManager.deleteUser(userId);
  }

  /**
   * List users, optionally filtered by name and email.
   *
   * @param filter the filter
   * @return the list
   */
  public List<User> list(final UserFilter filter) {
    LOGGER.trace("list({})", filter);
    final ImmutableStoreQuery.Builder query = ImmutableStoreQuery.builder()
        .indexKey(keyBuilder.indexKeyForType(EntityType.USER));
    filter.name().ifPresent(name -> query.putFilters(Attributes.NAME, AttributeValue.fromS(name)));
    filter.email().ifPresent(email -> query.putFilters(Attributes.EMAIL, AttributeValue.fromS(email)));
    final StoreQuery storeQuery = query.build();
    return entityStore.query(storeQuery).stream()
        .map(userCodec::decode)
        .toList();
  }

  /**
   * Verify password boolean.
   *
   * @param userId   the user id
   * @param password the password
   * @return the boolean
   */
  public boolean verifyPassword(final String userId, final String password) {
    LOGGER.trace("verifyPassword({})", userId);
    return passwordHasher.matches(password, read(userId).password());
  }

}

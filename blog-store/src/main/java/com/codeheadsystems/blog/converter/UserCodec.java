package com.codeheadsystems.blog.converter;

import com.codeheadsystems.api.blog.v1.ImmutableUser;
import com.codeheadsystems.api.blog.v1.User;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.key.KeyBuilder;
import com.codeheadsystems.blog.model.EntityType;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The type User codec.
 */
@Singleton
public class UserCodec extends BaseEntityCodec<User> {

  private final KeyBuilder keyBuilder;

  /**
   * Instantiates a new User codec.
   *
   * @param keyBuilder the key builder
   */
  @Inject
  public UserCodec(final KeyBuilder keyBuilder) {
    this.keyBuilder = keyBuilder;
  }

  @Override
  public EntityType entityType() {
    return EntityType.USER;
  }

  @Override
  public Map<String, AttributeValue> encode(final User user) {
    final Map<String, AttributeValue> item = newItem(keyBuilder.userKey(user.userId()));
    item.put(Attributes.USER_ID, s(user.userId()));
    item.put(Attributes.NAME, s(user.name()));
    item.put(Attributes.EMAIL, s(user.email()));
    item.put(Attributes.PASSWORD, s(user.password()));
    return item;
  }

  @Override
  public User decode(final Map<String, AttributeValue> item) {
    requireEntityType(item);
    return ImmutableUser.builder()
        .userId(string(item, Attributes.USER_ID))
        .name(string(item, Attributes.NAME))
        .email(string(item, Attributes.EMAIL))
        .password(string(item, Attributes.PASSWORD))
        .build();
  }
}

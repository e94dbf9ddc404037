package com.codeheadsystems.blog.manager;

import static com.codeheadsystems.blog.BlogFixtures.USER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.api.blog.v1.ImmutableCreateUserRequest;
import com.codeheadsystems.api.blog.v1.ImmutableUpdateUserRequest;
import com.codeheadsystems.api.blog.v1.User;
import com.codeheadsystems.blog.BlogFixtures;
import com.codeheadsystems.blog.converter.UserCodec;
import com.codeheadsystems.blog.exception.ConflictException;
import com.codeheadsystems.blog.exception.NotFoundException;
import com.codeheadsystems.blog.exception.ValidationException;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.key.KeyBuilder;
import com.codeheadsystems.blog.model.CascadeResult;
import com.codeheadsystems.blog.model.ImmutableCascadeResult;
import com.codeheadsystems.blog.model.ImmutableUserFilter;
import com.codeheadsystems.blog.model.StoreQuery;
import com.codeheadsystems.blog.model.UserFilter;
import com.codeheadsystems.blog.store.EntityStore;
import com.codeheadsystems.blog.utilities.PasswordHasher;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@ExtendWith(MockitoExtension.class)
class UserManagerTest {

  private static final String HASH = "pbkdf2-sha256$65536$aa$bb";

  @Mock private EntityStore entityStore;
  @Mock private PasswordHasher passwordHasher;
  @Mock private CascadeDeleteManager cascadeDeleteManager;
  @Captor private ArgumentCaptor<Map<String, AttributeValue>> itemCaptor;
  @Captor private ArgumentCaptor<StoreQuery> queryCaptor;

  private KeyBuilder keyBuilder;
  private UserCodec userCodec;
  private UserManager manager;

  @BeforeEach
  void setup() {
    keyBuilder = new KeyBuilder();
    userCodec = new UserCodec(keyBuilder);
    manager = new UserManager(entityStore, userCodec, keyBuilder, new EntityValidator(), passwordHasher,
        cascadeDeleteManager);
  }

  @Test
  void create_hashesThePassword() {
    when(passwordHasher.hash("password123")).thenReturn(HASH);

    final User user = manager.create(ImmutableCreateUserRequest.builder()
        .name("Ada").email("ada@example.com").password("password123").build());

    verify(entityStore).create(itemCaptor.capture());
    assertThat(user.password()).isEqualTo(HASH);
    assertThat(user.userId()).hasSize(36);
    assertThat(itemCaptor.getValue())
        .containsEntry(Attributes.PASSWORD, AttributeValue.fromS(HASH))
        .containsEntry(Attributes.PK, AttributeValue.fromS("USER#" + user.userId()));
    assertThat(userCodec.decode(itemCaptor.getValue())).isEqualTo(user);
  }

  @Test
  void create_invalidEmail_writesNothing() {
    when(passwordHasher.hash("password123")).thenReturn(HASH);

    assertThatThrownBy(() -> manager.create(ImmutableCreateUserRequest.builder()
        .name("Ada").email("nope").password("password123").build()))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(entityStore);
  }

  @Test
  void create_shortPassword() {
    assertThatThrownBy(() -> manager.create(ImmutableCreateUserRequest.builder()
        .name("Ada").email("ada@example.com").password("short").build()))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(entityStore, passwordHasher);
  }

  @Test
  void create_conflict() {
    when(passwordHasher.hash("password123")).thenReturn(HASH);
    doThrow(new ConflictException("exists")).when(entityStore).create(any());

    assertThatThrownBy(() -> manager.create(ImmutableCreateUserRequest.builder()
        .name("Ada").email("ada@example.com").password("password123").build()))
        .isInstanceOf(ConflictException.class);
  }

  @Test
  void read() {
    final User user = BlogFixtures.user();
    when(entityStore.get(keyBuilder.userKey(USER_ID))).thenReturn(Optional.of(userCodec.encode(user)));

    assertThat(manager.read(USER_ID)).isEqualTo(user);
  }

  @Test
  void read_notFound() {
    when(entityStore.get(keyBuilder.userKey(USER_ID))).thenReturn(Optional.empty());

    assertThatThrownBy(() -> manager.read(USER_ID))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void read_malformedId() {
    assertThatThrownBy(() -> manager.read("USER#1"))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(entityStore);
  }

  @Test
  void update_mergesPresentFields() {
    final User user = BlogFixtures.user();
    when(entityStore.get(keyBuilder.userKey(USER_ID))).thenReturn(Optional.of(userCodec.encode(user)));

    final User updated = manager.update(USER_ID, ImmutableUpdateUserRequest.builder().name("Grace").build());

    assertThat(updated.name()).isEqualTo("Grace");
    assertThat(updated.email()).isEqualTo(user.email());
    assertThat(updated.password()).isEqualTo(user.password());
    verify(entityStore).replace(userCodec.encode(updated));
    verifyNoInteractions(passwordHasher);
  }

  @Test
  void update_newPassword() {
    when(entityStore.get(keyBuilder.userKey(USER_ID))).thenReturn(Optional.of(userCodec.encode(BlogFixtures.user())));
    when(passwordHasher.hash("new password")).thenReturn(HASH);

    final User updated = manager.update(USER_ID, ImmutableUpdateUserRequest.builder().password("new password").build());

    assertThat(updated.password()).isEqualTo(HASH);
  }

  @Test
  void update_invalidMerge_writesNothing() {
    when(entityStore.get(keyBuilder.userKey(USER_ID))).thenReturn(Optional.of(userCodec.encode(BlogFixtures.user())));

    assertThatThrownBy(() -> manager.update(USER_ID, ImmutableUpdateUserRequest.builder().email("bad").build()))
        .isInstanceOf(ValidationException.class);
    verify(entityStore, never()).replace(any());
  }

  @Test
  void delete_delegatesToTheCascade() {
    final CascadeResult result = ImmutableCascadeResult.builder()
        .root(keyBuilder.userKey(USER_ID))
        .addRemoved(keyBuilder.userKey(USER_ID))
        .build();
    when(cascadeDeleteManager.deleteUser(USER_ID)).thenReturn(result);

    assertThat(manager.delete(USER_ID)).isEqualTo(result);
  }

  @Test
  void list_isOneTypeIndexQuery() {
    when(entityStore.query(queryCaptor.capture())).thenReturn(List.of(userCodec.encode(BlogFixtures.user())));

    final List<User> users = manager.list(UserFilter.all());

    assertThat(users).containsExactly(BlogFixtures.user());
    verify(entityStore).query(any());
    assertThat(queryCaptor.getValue().indexKey().indexName()).contains(Attributes.ENTITY_TYPE_INDEX);
    assertThat(queryCaptor.getValue().filters()).isEmpty();
  }

  @Test
  void list_filters() {
    when(entityStore.query(queryCaptor.capture())).thenReturn(List.of());

    manager.list(ImmutableUserFilter.builder().name("Ada").email("ada@example.com").build());

    assertThat(queryCaptor.getValue().filters())
        .containsEntry(Attributes.NAME, AttributeValue.fromS("Ada"))
        .containsEntry(Attributes.EMAIL, AttributeValue.fromS("ada@example.com"));
  }

  @Test
  void verifyPassword() {
    when(entityStore.get(keyBuilder.userKey(USER_ID))).thenReturn(Optional.of(userCodec.encode(BlogFixtures.user())));
    when(passwordHasher.matches("password123", BlogFixtures.user().password())).thenReturn(true);

    assertThat(manager.verifyPassword(USER_ID, "password123")).isTrue();
  }

}

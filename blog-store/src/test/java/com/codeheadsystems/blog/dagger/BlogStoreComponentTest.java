package com.codeheadsystems.blog.dagger;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.blog.model.ImmutableBlogStoreConfiguration;
import com.codeheadsystems.blog.model.ImmutableDatabase;
import com.codeheadsystems.blog.model.StoreType;
import com.codeheadsystems.blog.store.DynamoDbEntityStore;
import com.codeheadsystems.blog.store.JdbiEntityStore;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class BlogStoreComponentTest {

  @Test
  void jdbcConfiguration() {
    final BlogStoreComponent component = BlogStoreComponent.instance(ImmutableBlogStoreConfiguration.builder()
        .storeType(StoreType.JDBC)
        .database(ImmutableDatabase.builder()
            .url("jdbc:hsqldb:mem:BlogStoreComponentTest" + UUID.randomUUID())
            .username("SA")
            .password("")
            .build())
        .build());

    assertThat(component.entityStore()).isInstanceOf(JdbiEntityStore.class);
    assertThat(component.userManager()).isNotNull();
    assertThat(component.blogManager()).isNotNull();
    assertThat(component.commentManager()).isNotNull();
    assertThat(component.entityStore()).isSameAs(component.entityStore());
  }

  @Test
  void dynamoDbConfiguration() {
    final BlogStoreComponent component = BlogStoreComponent.instance(ImmutableBlogStoreConfiguration.builder()
        .endpoint("http://localhost:8000")
        .build());

    assertThat(component.entityStore()).isInstanceOf(DynamoDbEntityStore.class);
    assertThat(component.tableManager()).isNotNull();
    assertThat(component.seeder()).isNotNull();
  }

}

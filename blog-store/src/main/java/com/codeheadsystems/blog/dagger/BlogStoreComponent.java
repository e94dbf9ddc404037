package com.codeheadsystems.blog.dagger;

import com.codeheadsystems.blog.manager.BlogManager;
import com.codeheadsystems.blog.manager.CascadeDeleteManager;
import com.codeheadsystems.blog.manager.CommentManager;
import com.codeheadsystems.blog.manager.UserManager;
import com.codeheadsystems.blog.model.BlogStoreConfiguration;
import com.codeheadsystems.blog.store.EntityStore;
import com.codeheadsystems.blog.tool.BlogContentSeeder;
import com.codeheadsystems.blog.tool.BlogContentTableManager;
import dagger.Component;
import javax.inject.Singleton;

/**
 * The interface Blog store component.
 */
@Singleton
@Component(modules = {BlogStoreModule.class, ConfigurationModule.class, CommonModule.class})
public interface BlogStoreComponent {

  /**
   * Instance blog store component.
   *
   * @param configuration the configuration
   * @return the blog store component
   */
  static BlogStoreComponent instance(final BlogStoreConfiguration configuration) {
    return DaggerBlogStoreComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * User manager.
   *
   * @return the user manager
   */
  UserManager userManager();

  /**
   * Blog manager.
   *
   * @return the blog manager
   */
  BlogManager blogManager();

  /**
   * Comment manager.
   *
   * @return the comment manager
   */
  CommentManager commentManager();

  /**
   * Cascade delete manager.
   *
   * @return the cascade delete manager
   */
  CascadeDeleteManager cascadeDeleteManager();

  /**
   * Entity store for the configured store type.
   *
   * @return the entity store
   */
  EntityStore entityStore();

  /**
   * Table manager, DynamoDB only.
   *
   * @return the blog content table manager
   */
  BlogContentTableManager tableManager();

  /**
   * Seeder, DynamoDB only.
   *
   * @return the blog content seeder
   */
  BlogContentSeeder seeder();

}

package com.codeheadsystems.blog.dagger;

import com.codeheadsystems.blog.dao.ContentItemDao;
import com.codeheadsystems.blog.factory.JdbiFactory;
import com.codeheadsystems.blog.model.BlogStoreConfiguration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * The type Jdbi module.
 */
@Module
public class JdbiModule {

  /**
   * Instantiates a new Jdbi module.
   */
  public JdbiModule() {
    // Default constructor
  }

  /**
   * Jdbi jdbi.
   *
   * @param factory       the factory
   * @param configuration the configuration
   * @return the jdbi
   */
  @Provides
  @Singleton
  public Jdbi jdbi(final JdbiFactory factory,
                   final BlogStoreConfiguration configuration) {
    return factory.createJdbi(configuration.database()
        .orElseThrow(() -> new IllegalStateException("No database configured")));
  }

  /**
   * Content item dao.
   *
   * @param jdbi the jdbi
   * @return the content item dao
   */
  @Provides
  @Singleton
  public ContentItemDao contentItemDao(final Jdbi jdbi) {
    return jdbi.onDemand(ContentItemDao.class);
  }

}

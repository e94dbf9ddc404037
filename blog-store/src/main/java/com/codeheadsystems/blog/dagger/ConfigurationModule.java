package com.codeheadsystems.blog.dagger;

import com.codeheadsystems.blog.model.BlogStoreConfiguration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Configuration module.
 */
@Module
public class ConfigurationModule {

  private final BlogStoreConfiguration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final BlogStoreConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration blog store configuration.
   *
   * @return the blog store configuration
   */
  @Provides
  @Singleton
  public BlogStoreConfiguration configuration() {
    return configuration;
  }

}

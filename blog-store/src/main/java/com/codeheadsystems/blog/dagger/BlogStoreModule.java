package com.codeheadsystems.blog.dagger;

import com.codeheadsystems.blog.model.BlogStoreConfiguration;
import com.codeheadsystems.blog.store.DynamoDbEntityStore;
import com.codeheadsystems.blog.store.EntityStore;
import com.codeheadsystems.blog.store.JdbiEntityStore;
import dagger.Module;
import dagger.Provides;
import javax.inject.Provider;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The type Blog store module.
 */
@Module(includes = {DynamoDbModule.class, JdbiModule.class})
public class BlogStoreModule {

  private static final Logger LOGGER = LoggerFactory.getLogger(BlogStoreModule.class);

  /**
   * Instantiates a new Blog store module.
   */
  public BlogStoreModule() {
    // Default constructor
  }

  /**
   * The entity store for the configured store type. Only the chosen one is built.
   *
   * @param configuration the configuration
   * @param dynamoDb      the dynamo db store
   * @param jdbi          the jdbi store
   * @return the entity store
   */
  @Provides
  @Singleton
  public EntityStore entityStore(final BlogStoreConfiguration configuration,
                                 final Provider<DynamoDbEntityStore> dynamoDb,
                                 final Provider<JdbiEntityStore> jdbi) {
    LOGGER.info("entityStore({})", configuration.storeType());
    return switch (configuration.storeType()) {
      case DYNAMODB -> dynamoDb.get();
      case JDBC -> jdbi.get();
    };
  }

}

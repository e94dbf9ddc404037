package com.codeheadsystems.blog.dagger;

import com.codeheadsystems.blog.model.BlogStoreConfiguration;
import dagger.Module;
import dagger.Provides;
import java.net.URI;
import java.time.Duration;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

/**
 * Builds the one DynamoDB client the process shares.
 */
@Module
public class DynamoDbModule {

  private static final Logger LOGGER = LoggerFactory.getLogger(DynamoDbModule.class);

  /**
   * Instantiates a new Dynamo db module.
   */
  public DynamoDbModule() {
    // Default constructor
  }

  /**
   * Dynamo db client. An endpoint override means DynamoDB local, which accepts any credentials.
   *
   * @param configuration the configuration
   * @return the dynamo db client
   */
  @Provides
  @Singleton
  public DynamoDbClient dynamoDbClient(final BlogStoreConfiguration configuration) {
    LOGGER.info("dynamoDbClient({},{})", configuration.region(), configuration.endpoint());
    final DynamoDbClientBuilder builder = DynamoDbClient.builder()
        .region(Region.of(configuration.region()))
        .overrideConfiguration(ClientOverrideConfiguration.builder()
            .apiCallTimeout(Duration.ofMillis(configuration.apiCallTimeoutMillis()))
            .apiCallAttemptTimeout(Duration.ofMillis(configuration.apiCallAttemptTimeoutMillis()))
            .build());
    configuration.endpoint().ifPresent(endpoint -> builder
        .endpointOverride(URI.create(endpoint))
        .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create("local", "local"))));
    return builder.build();
  }

}

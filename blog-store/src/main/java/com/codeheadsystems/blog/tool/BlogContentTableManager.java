package com.codeheadsystems.blog.tool;

import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.model.BlogStoreConfiguration;
import com.codeheadsystems.blog.store.DynamoDbCalls;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Creates and drops the blog content table in DynamoDB.
 */
@Singleton
public class BlogContentTableManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(BlogContentTableManager.class);

  private final DynamoDbClient dynamoDbClient;
  private final String tableName;

  /**
   * Instantiates a new Blog content table manager.
   *
   * @param dynamoDbClient the dynamo db client
   * @param configuration  the configuration
   */
  @Inject
  public BlogContentTableManager(final DynamoDbClient dynamoDbClient,
                                 final BlogStoreConfiguration configuration) {
    LOGGER.info("BlogContentTableManager({},{})", dynamoDbClient, configuration.tableName());
    this.dynamoDbClient = dynamoDbClient;
    this.tableName = configuration.tableName();
  }

  /**
   * Create the table with both secondary indexes.
   *
   * @return false if the table already existed
   */
  public boolean createTable() {
    LOGGER.trace("createTable({})", tableName);
    try {
      DynamoDbCalls.call("createTable", tableName, () -> dynamoDbClient.createTable(createTableRequest()));
      LOGGER.info("createTable(): created {}", tableName);
      return true;
    } catch (ResourceInUseException e) {
      LOGGER.warn("createTable(): {} already exists", tableName);
      return false;
    }
  }

  /**
   * Delete the table.
   *
   * @return false if there was no table
   */
  public boolean deleteTable() {
    LOGGER.trace("deleteTable({})", tableName);
    return DynamoDbCalls.call("deleteTable", tableName, () -> {
      try {
        dynamoDbClient.deleteTable(DeleteTableRequest.builder().tableName(tableName).build());
        LOGGER.info("deleteTable(): deleted {}", tableName);
        return true;
      } catch (ResourceNotFoundException e) {
        LOGGER.warn("deleteTable(): {} does not exist", tableName);
        return false;
      }
    });
  }

  CreateTableRequest createTableRequest() {
    return CreateTableRequest.builder()
        .tableName(tableName)
        .billingMode(BillingMode.PAY_PER_REQUEST)
        .attributeDefinitions(
            stringAttribute(Attributes.PK),
            stringAttribute(Attributes.SK),
            stringAttribute(Attributes.GSI1PK),
            stringAttribute(Attributes.GSI1SK),
            stringAttribute(Attributes.ENTITY_TYPE))
        .keySchema(
            keyElement(Attributes.PK, KeyType.HASH),
            keyElement(Attributes.SK, KeyType.RANGE))
        .globalSecondaryIndexes(
            GlobalSecondaryIndex.builder()
                .indexName(Attributes.GSI1)
                .keySchema(
                    keyElement(Attributes.GSI1PK, KeyType.HASH),
                    keyElement(Attributes.GSI1SK, KeyType.RANGE))
                .projection(Projection.builder().projectionType(ProjectionType.ALL).build())
                .build(),
            GlobalSecondaryIndex.builder()
                .indexName(Attributes.ENTITY_TYPE_INDEX)
                .keySchema(keyElement(Attributes.ENTITY_TYPE, KeyType.HASH))
                .projection(Projection.builder().projectionType(ProjectionType.ALL).build())
                .build())
        .build();
  }

  private AttributeDefinition stringAttribute(final String name) {
    return AttributeDefinition.builder().attributeName(name).attributeType(ScalarAttributeType.S).build();
  }

  private KeySchemaElement keyElement(final String name, final KeyType keyType) {
    return KeySchemaElement.builder().attributeName(name).keyType(keyType).build();
  }

}

package com.codeheadsystems.blog.store;

import com.codeheadsystems.blog.exception.ConflictException;
import com.codeheadsystems.blog.exception.NotFoundException;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.model.BlogStoreConfiguration;
import com.codeheadsystems.blog.model.IndexKey;
import com.codeheadsystems.blog.model.ItemKey;
import com.codeheadsystems.blog.model.StoreQuery;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;

/**
 * Entity store over a DynamoDB table.
 */
@Singleton
public class DynamoDbEntityStore implements EntityStore {

  private static final Logger log = LoggerFactory.getLogger(DynamoDbEntityStore.class);

  private static final String ITEM_ABSENT = "attribute_not_exists(#pk)";
  private static final String ITEM_PRESENT = "attribute_exists(#pk)";
  private static final Map<String, String> PK_NAME = Map.of("#pk", Attributes.PK);

  private final DynamoDbClient dynamoDbClient;
  private final String tableName;

  /**
   * Instantiates a new Dynamo db entity store.
   *
   * @param dynamoDbClient the dynamo db client
   * @param configuration  the configuration
   */
  @Inject
  public DynamoDbEntityStore(final DynamoDbClient dynamoDbClient,
                             final BlogStoreConfiguration configuration) {
    log.info("DynamoDbEntityStore({},{})", dynamoDbClient, configuration.tableName());
    this.dynamoDbClient = dynamoDbClient;
    this.tableName = configuration.tableName();
  }

  @Override
  public Optional<Map<String, AttributeValue>> get(final ItemKey key) {
    log.trace("get({})", key);
    final GetItemRequest request = GetItemRequest.builder()
        .tableName(tableName)
        .key(keyAttributes(key))
        .consistentRead(true)
        .build();
    final GetItemResponse response = call("get", () -> dynamoDbClient.getItem(request));
    return response.hasItem() && !response.item().isEmpty()
        ? Optional.of(response.item())
        : Optional.empty();
  }

  @Override
  public void create(final Map<String, AttributeValue> item) {
    log.trace("create({})", item);
    try {
      call("create", () -> dynamoDbClient.putItem(conditionalPut(item, ITEM_ABSENT)));
    } catch (ConditionalCheckFailedException e) {
      throw new ConflictException("Item already exists: " + keyOf(item), e);
    }
  }

  @Override
  public void replace(final Map<String, AttributeValue> item) {
    log.trace("replace({})", item);
    try {
      call("replace", () -> dynamoDbClient.putItem(conditionalPut(item, ITEM_PRESENT)));
    } catch (ConditionalCheckFailedException e) {
      throw new NotFoundException("Item not found: " + keyOf(item));
    }
  }

  @Override
  public boolean delete(final ItemKey key) {
    log.trace("delete({})", key);
    final DeleteItemRequest request = DeleteItemRequest.builder()
        .tableName(tableName)
        .key(keyAttributes(key))
        .returnValues(ReturnValue.ALL_OLD)
        .build();
    final DeleteItemResponse response = call("delete", () -> dynamoDbClient.deleteItem(request));
    return response.hasAttributes() && !response.attributes().isEmpty();
  }

  @Override
  public List<Map<String, AttributeValue>> query(final StoreQuery query) {
    log.trace("query({})", query);
    final IndexKey indexKey = query.indexKey();
    final Map<String, String> names = new HashMap<>();
    final Map<String, AttributeValue> values = new HashMap<>();

    names.put("#pk", indexKey.partitionKeyName());
    values.put(":pk", AttributeValue.fromS(indexKey.partitionKey()));
    final StringBuilder keyCondition = new StringBuilder("#pk = :pk");
    if (indexKey.sortKeyPrefix().isPresent()) {
      names.put("#sk", indexKey.sortKeyName().orElseThrow());
      values.put(":sk", AttributeValue.fromS(indexKey.sortKeyPrefix().get()));
      keyCondition.append(" AND begins_with(#sk, :sk)");
    }

    final List<String> filters = new ArrayList<>();
    int i = 0;
    for (Map.Entry<String, AttributeValue> filter : query.filters().entrySet()) {
      names.put("#f" + i, filter.getKey());
      values.put(":f" + i, filter.getValue());
      filters.add("#f" + i + " = :f" + i);
      i++;
    }

    final QueryRequest.Builder builder = QueryRequest.builder()
        .tableName(tableName)
        .keyConditionExpression(keyCondition.toString())
        .expressionAttributeNames(names)
        .expressionAttributeValues(values);
    indexKey.indexName().ifPresent(builder::indexName);
    if (!filters.isEmpty()) {
      builder.filterExpression(String.join(" AND ", filters));
    }

    final List<Map<String, AttributeValue>> items = new ArrayList<>();
    Map<String, AttributeValue> startKey = null;
    do {
      final QueryRequest request = builder.exclusiveStartKey(startKey).build();
      final QueryResponse response = call("query", () -> dynamoDbClient.query(request));
      if (response.hasItems()) {
        items.addAll(response.items());
      }
      startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
          ? response.lastEvaluatedKey()
          : null;
    } while (startKey != null);
    log.debug("query({}): {} items", query, items.size());
    return items;
  }

  private PutItemRequest conditionalPut(final Map<String, AttributeValue> item, final String condition) {
    return PutItemRequest.builder()
        .tableName(tableName)
        .item(item)
        .conditionExpression(condition)
        .expressionAttributeNames(PK_NAME)
        .build();
  }

  private Map<String, AttributeValue> keyAttributes(final ItemKey key) {
    return Map.of(
        Attributes.PK, AttributeValue.fromS(key.partitionKey()),
        Attributes.SK, AttributeValue.fromS(key.sortKey()));
  }

  private String keyOf(final Map<String, AttributeValue> item) {
    final AttributeValue pk = item.get(Attributes.PK);
    final AttributeValue sk = item.get(Attributes.SK);
    return (pk == null ? null : pk.s()) + "/" + (sk == null ? null : sk.s());
  }

  private <T> T call(final String operation, final Supplier<T> supplier) {
    return DynamoDbCalls.call(operation, tableName, supplier);
  }

}

package com.codeheadsystems.blog.tool;

import com.codeheadsystems.blog.converter.AttributeValueJsonConverter;
import com.codeheadsystems.blog.exception.DecodeException;
import com.codeheadsystems.blog.exception.StoreUnavailableException;
import com.codeheadsystems.blog.model.BlogStoreConfiguration;
import com.codeheadsystems.blog.store.DynamoDbCalls;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * Exports the table to, and seeds it from, batch-write files: one JSON document per line, each
 * shaped like the BatchWriteItem request the AWS CLI takes,
 * {"BlogContent":[{"PutRequest":{"Item":{"PK":{"S":"USER#..."}, ...}}}]}.
 */
@Singleton
public class BlogContentSeeder {

  /**
   * DynamoDB accepts at most this many writes per batch.
   */
  static final int BATCH_SIZE = 25;

  private static final Logger LOGGER = LoggerFactory.getLogger(BlogContentSeeder.class);
  private static final String PUT_REQUEST = "PutRequest";
  private static final String ITEM = "Item";

  private final DynamoDbClient dynamoDbClient;
  private final AttributeValueJsonConverter converter;
  private final ObjectMapper objectMapper;
  private final String tableName;
  private final int maxAttempts;
  private final long backoffMillis;

  /**
   * Instantiates a new Blog content seeder.
   *
   * @param dynamoDbClient the dynamo db client
   * @param converter      the converter
   * @param objectMapper   the object mapper
   * @param configuration  the configuration
   */
  @Inject
  public BlogContentSeeder(final DynamoDbClient dynamoDbClient,
                           final AttributeValueJsonConverter converter,
                           final ObjectMapper objectMapper,
                           final BlogStoreConfiguration configuration) {
    LOGGER.info("BlogContentSeeder({},{})", dynamoDbClient, configuration.tableName());
    this.dynamoDbClient = dynamoDbClient;
    this.converter = converter;
    this.objectMapper = objectMapper;
    this.tableName = configuration.tableName();
    this.maxAttempts = configuration.batchWriteMaxAttempts();
    this.backoffMillis = configuration.batchWriteBackoffMillis();
  }

  /**
   * Scan the whole table and write one batch-write line per item.
   *
   * @param writer the writer
   * @return the number of items written
   */
  public int export(final Writer writer) {
    LOGGER.trace("export({})", tableName);
    int count = 0;
    Map<String, AttributeValue> startKey = null;
    try {
      do {
        final ScanRequest request = ScanRequest.builder()
            .tableName(tableName)
            .exclusiveStartKey(startKey)
            .build();
        final ScanResponse response = DynamoDbCalls.call("scan", tableName, () -> dynamoDbClient.scan(request));
        final List<Map<String, AttributeValue>> items = response.hasItems() ? response.items() : List.of();
        for (Map<String, AttributeValue> item : items) {
          writer.write(line(item));
          writer.write(System.lineSeparator());
        }
        count += items.size();
        startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
            ? response.lastEvaluatedKey()
            : null;
      } while (startKey != null);
      writer.flush();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write export", e);
    }
    LOGGER.info("export(): {} items from {}", count, tableName);
    return count;
  }

  /**
   * Read batch-write lines and put every item into the table, up to {@link #BATCH_SIZE} items per
   * request. Blank lines are skipped.
   *
   * @param reader the reader
   * @return the number of items written
   */
  public int seed(final Reader reader) {
    LOGGER.trace("seed({})", tableName);
    int count = 0;
    final List<WriteRequest> batch = new ArrayList<>();
    final BufferedReader lines = new BufferedReader(reader);
    try {
      String line;
      int lineNumber = 0;
      while ((line = lines.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        for (WriteRequest request : writeRequests(lineNumber, line)) {
          batch.add(request);
          if (batch.size() == BATCH_SIZE) {
            write(List.copyOf(batch));
            batch.clear();
          }
          count++;
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read seed data", e);
    }
    if (!batch.isEmpty()) {
      write(List.copyOf(batch));
    }
    LOGGER.info("seed(): {} items into {}", count, tableName);
    return count;
  }

  private void write(final List<WriteRequest> batch) {
    List<WriteRequest> pending = batch;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (attempt > 1) {
        backoff(attempt);
      }
      final BatchWriteItemRequest request = BatchWriteItemRequest.builder()
          .requestItems(Map.of(tableName, pending))
          .build();
      final BatchWriteItemResponse response = DynamoDbCalls.call("batchWriteItem", tableName,
          () -> dynamoDbClient.batchWriteItem(request));
      final List<WriteRequest> unprocessed = response.hasUnprocessedItems()
          ? response.unprocessedItems().getOrDefault(tableName, List.of())
          : List.of();
      if (unprocessed.isEmpty()) {
        return;
      }
      LOGGER.warn("write(): {} unprocessed after attempt {}", unprocessed.size(), attempt);
      pending = unprocessed;
    }
    throw new StoreUnavailableException(
        pending.size() + " items still unprocessed after " + maxAttempts + " attempts");
  }

  /**
   * Waits backoffMillis * 2^(attempt - 2) before the given attempt.
   */
  private void backoff(final int attempt) {
    final long delay = backoffMillis << Math.min(attempt - 2, 20);
    if (delay <= 0) {
      return;
    }
    try {
      Thread.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreUnavailableException("Interrupted while retrying unprocessed items", e);
    }
  }

  private String line(final Map<String, AttributeValue> item) throws JsonProcessingException {
    final Map<String, Object> request = Map.of(PUT_REQUEST, Map.of(ITEM, converter.toTypedMap(item)));
    return objectMapper.writeValueAsString(Map.of(tableName, List.of(request)));
  }

  private List<WriteRequest> writeRequests(final int lineNumber, final String line) {
    final JsonNode root;
    try {
      root = objectMapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new DecodeException("Line " + lineNumber + " is not valid JSON", e);
    }
    final JsonNode requests = root.path(tableName);
    if (!requests.isArray()) {
      throw new DecodeException("Line " + lineNumber + " has no requests for table " + tableName);
    }
    final List<WriteRequest> result = new ArrayList<>();
    for (JsonNode request : requests) {
      final JsonNode item = request.path(PUT_REQUEST).path(ITEM);
      if (!item.isObject()) {
        throw new DecodeException("Line " + lineNumber + " has a request without PutRequest.Item");
      }
      final Map<String, Object> typed = objectMapper.convertValue(item, converter.typedMapType());
      result.add(WriteRequest.builder()
          .putRequest(PutRequest.builder().item(converter.fromTypedMap(typed)).build())
          .build());
    }
    return result;
  }

}

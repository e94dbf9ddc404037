package com.codeheadsystems.blog.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.blog.BlogFixtures;
import com.codeheadsystems.blog.converter.AttributeValueJsonConverter;
import com.codeheadsystems.blog.converter.BlogCodec;
import com.codeheadsystems.blog.converter.CommentCodec;
import com.codeheadsystems.blog.converter.UserCodec;
import com.codeheadsystems.blog.exception.DecodeException;
import com.codeheadsystems.blog.exception.StoreUnavailableException;
import com.codeheadsystems.blog.key.KeyBuilder;
import com.codeheadsystems.blog.model.ImmutableBlogStoreConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

@ExtendWith(MockitoExtension.class)
class BlogContentSeederTest {

  private static final String TABLE_NAME = "BlogContent";

  @Mock private DynamoDbClient dynamoDbClient;
  @Captor private ArgumentCaptor<BatchWriteItemRequest> batchCaptor;

  private List<Map<String, AttributeValue>> items;
  private BlogContentSeeder seeder;

  @BeforeEach
  void setup() {
    final KeyBuilder keyBuilder = new KeyBuilder();
    items = List.of(
        new UserCodec(keyBuilder).encode(BlogFixtures.user()),
        new BlogCodec(keyBuilder).encode(BlogFixtures.blog()),
        new CommentCodec(keyBuilder).encode(BlogFixtures.comment()));
    final ObjectMapper objectMapper = new ObjectMapper();
    seeder = new BlogContentSeeder(dynamoDbClient, new AttributeValueJsonConverter(objectMapper), objectMapper,
        ImmutableBlogStoreConfiguration.builder().batchWriteMaxAttempts(2).batchWriteBackoffMillis(0).build());
  }

  @Test
  void export_writesOneLinePerItem() {
    when(dynamoDbClient.scan(any(ScanRequest.class))).thenReturn(ScanResponse.builder().items(items).build());
    final StringWriter writer = new StringWriter();

    assertThat(seeder.export(writer)).isEqualTo(3);

    final String[] lines = writer.toString().split("\\R");
    assertThat(lines).hasSize(3);
    assertThat(lines)
        .allSatisfy(line -> assertThat(line)
            .startsWith("{\"" + TABLE_NAME + "\":[{\"PutRequest\":{\"Item\":{")
            .endsWith("}}}]}"));
    assertThat(lines[0]).contains("\"EntityType\":{\"S\":\"USER\"}").doesNotContain("BLOG#");
    assertThat(lines[1]).contains("\"EntityType\":{\"S\":\"BLOG\"}");
    assertThat(lines[2]).contains("\"EntityType\":{\"S\":\"COMMENT\"}");
  }

  @Test
  void export_followsScanPages() {
    final Map<String, AttributeValue> lastKey = Map.of("PK", AttributeValue.fromS("x"), "SK", AttributeValue.fromS("x"));
    when(dynamoDbClient.scan(any(ScanRequest.class)))
        .thenReturn(ScanResponse.builder().items(items.subList(0, 2)).lastEvaluatedKey(lastKey).build())
        .thenReturn(ScanResponse.builder().items(items.subList(2, 3)).build());
    final StringWriter writer = new StringWriter();

    assertThat(seeder.export(writer)).isEqualTo(3);

    assertThat(writer.toString().split("\\R")).hasSize(3);
  }

  @Test
  void export_unreachable() {
    when(dynamoDbClient.scan(any(ScanRequest.class))).thenThrow(SdkClientException.create("connection refused"));

    assertThatThrownBy(() -> seeder.export(new StringWriter()))
        .isInstanceOf(StoreUnavailableException.class)
        .hasCauseInstanceOf(SdkClientException.class);
  }

  @Test
  void exportThenSeed_writesTheSameItems() {
    when(dynamoDbClient.scan(any(ScanRequest.class))).thenReturn(ScanResponse.builder().items(items).build());
    when(dynamoDbClient.batchWriteItem(batchCaptor.capture())).thenReturn(BatchWriteItemResponse.builder().build());
    final StringWriter writer = new StringWriter();
    seeder.export(writer);

    assertThat(seeder.seed(new StringReader(writer.toString()))).isEqualTo(3);

    assertThat(batchCaptor.getValue().requestItems().get(TABLE_NAME))
        .extracting(request -> request.putRequest().item())
        .containsExactlyElementsOf(items);
  }

  @Test
  void seed_splitsIntoBatches() {
    final StringBuilder line = new StringBuilder("{\"" + TABLE_NAME + "\":[");
    for (int i = 0; i < BlogContentSeeder.BATCH_SIZE + 5; i++) {
      line.append(i == 0 ? "" : ",")
          .append("{\"PutRequest\":{\"Item\":{\"PK\":{\"S\":\"USER#").append(i)
          .append("\"},\"SK\":{\"S\":\"USER#").append(i).append("\"}}}}");
    }
    line.append("]}\n\n");
    when(dynamoDbClient.batchWriteItem(batchCaptor.capture())).thenReturn(BatchWriteItemResponse.builder().build());

    assertThat(seeder.seed(new StringReader(line.toString()))).isEqualTo(BlogContentSeeder.BATCH_SIZE + 5);

    assertThat(batchCaptor.getAllValues()).extracting(request -> request.requestItems().get(TABLE_NAME).size())
        .containsExactly(BlogContentSeeder.BATCH_SIZE, 5);
  }

  @Test
  void seed_retriesUnprocessedItems() {
    final WriteRequest unprocessed = WriteRequest.builder()
        .putRequest(builder -> builder.item(items.get(1)))
        .build();
    when(dynamoDbClient.batchWriteItem(batchCaptor.capture()))
        .thenReturn(BatchWriteItemResponse.builder().unprocessedItems(Map.of(TABLE_NAME, List.of(unprocessed))).build())
        .thenReturn(BatchWriteItemResponse.builder().build());

    assertThat(seeder.seed(new StringReader(exportLine()))).isEqualTo(3);

    verify(dynamoDbClient, times(2)).batchWriteItem(any(BatchWriteItemRequest.class));
    assertThat(batchCaptor.getAllValues().get(1).requestItems().get(TABLE_NAME)).containsExactly(unprocessed);
  }

  @Test
  void seed_givesUpAfterMaxAttempts() {
    final WriteRequest unprocessed = WriteRequest.builder()
        .putRequest(builder -> builder.item(items.get(1)))
        .build();
    when(dynamoDbClient.batchWriteItem(any(BatchWriteItemRequest.class)))
        .thenReturn(BatchWriteItemResponse.builder().unprocessedItems(Map.of(TABLE_NAME, List.of(unprocessed))).build());

    assertThatThrownBy(() -> seeder.seed(new StringReader(exportLine())))
        .isInstanceOf(StoreUnavailableException.class);
    verify(dynamoDbClient, times(2)).batchWriteItem(any(BatchWriteItemRequest.class));
  }

  @Test
  void seed_combinesLinesIntoBatches() {
    final StringBuilder lines = new StringBuilder();
    for (int i = 0; i < BlogContentSeeder.BATCH_SIZE + 1; i++) {
      lines.append("{\"" + TABLE_NAME + "\":[{\"PutRequest\":{\"Item\":{\"PK\":{\"S\":\"USER#").append(i)
          .append("\"},\"SK\":{\"S\":\"USER#").append(i).append("\"}}}}]}\n");
    }
    when(dynamoDbClient.batchWriteItem(batchCaptor.capture())).thenReturn(BatchWriteItemResponse.builder().build());

    assertThat(seeder.seed(new StringReader(lines.toString()))).isEqualTo(BlogContentSeeder.BATCH_SIZE + 1);

    assertThat(batchCaptor.getAllValues()).extracting(request -> request.requestItems().get(TABLE_NAME).size())
        .containsExactly(BlogContentSeeder.BATCH_SIZE, 1);
  }

  @Test
  void seed_unreachable() {
    final String line = exportLine();
    when(dynamoDbClient.batchWriteItem(any(BatchWriteItemRequest.class)))
        .thenThrow(SdkClientException.create("connection refused"));

    assertThatThrownBy(() -> seeder.seed(new StringReader(line)))
        .isInstanceOf(StoreUnavailableException.class)
        .hasCauseInstanceOf(SdkClientException.class);
  }

  @Test
  void seed_interruptedWhileWaitingToRetry() {
    final BlogContentSeeder slowSeeder = new BlogContentSeeder(dynamoDbClient, new AttributeValueJsonConverter(new ObjectMapper()),
        new ObjectMapper(), ImmutableBlogStoreConfiguration.builder().batchWriteMaxAttempts(3).batchWriteBackoffMillis(10_000L).build());
    final WriteRequest unprocessed = WriteRequest.builder()
        .putRequest(builder -> builder.item(items.get(1)))
        .build();
    final String line = exportLine();
    when(dynamoDbClient.batchWriteItem(any(BatchWriteItemRequest.class)))
        .thenReturn(BatchWriteItemResponse.builder().unprocessedItems(Map.of(TABLE_NAME, List.of(unprocessed))).build());

    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> slowSeeder.seed(new StringReader(line)))
          .isInstanceOf(StoreUnavailableException.class)
          .hasCauseInstanceOf(InterruptedException.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
    verify(dynamoDbClient, times(1)).batchWriteItem(any(BatchWriteItemRequest.class));
  }

  @Test
  void seed_badLine() {
    assertThatThrownBy(() -> seeder.seed(new StringReader("{\"OtherTable\":[]}")))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Line 1");
    verifyNoInteractions(dynamoDbClient);
  }

  @Test
  void seed_notJson() {
    assertThatThrownBy(() -> seeder.seed(new StringReader("\nPK,SK\n")))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Line 2");
  }

  private String exportLine() {
    when(dynamoDbClient.scan(any(ScanRequest.class))).thenReturn(ScanResponse.builder().items(items).build());
    final StringWriter writer = new StringWriter();
    seeder.export(writer);
    return writer.toString();
  }

}

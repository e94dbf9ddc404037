package com.codeheadsystems.blog.store;

import com.codeheadsystems.blog.converter.AttributeValueJsonConverter;
import com.codeheadsystems.blog.dao.ContentItemDao;
import com.codeheadsystems.blog.exception.ConflictException;
import com.codeheadsystems.blog.exception.NotFoundException;
import com.codeheadsystems.blog.exception.StoreUnavailableException;
import com.codeheadsystems.blog.key.Attributes;
import com.codeheadsystems.blog.model.ContentItem;
import com.codeheadsystems.blog.model.ImmutableContentItem;
import com.codeheadsystems.blog.model.IndexKey;
import com.codeheadsystems.blog.model.ItemKey;
import com.codeheadsystems.blog.model.StoreQuery;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.ConnectionException;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Entity store over the relational BLOG_CONTENT table, laid out like the DynamoDB table: the key
 * and index attributes are columns, the item itself is DynamoDB JSON.
 */
@Singleton
public class JdbiEntityStore implements EntityStore {

  private static final Logger log = LoggerFactory.getLogger(JdbiEntityStore.class);
  private static final String DUPLICATE_KEY_STATE = "23505";

  private final ContentItemDao contentItemDao;
  private final AttributeValueJsonConverter jsonConverter;

  /**
   * Instantiates a new Jdbi entity store.
   *
   * @param contentItemDao the content item dao
   * @param jsonConverter  the json converter
   */
  @Inject
  public JdbiEntityStore(final ContentItemDao contentItemDao,
                         final AttributeValueJsonConverter jsonConverter) {
    log.info("JdbiEntityStore({},{})", contentItemDao, jsonConverter);
    this.contentItemDao = contentItemDao;
    this.jsonConverter = jsonConverter;
  }

  @Override
  public Optional<Map<String, AttributeValue>> get(final ItemKey key) {
    log.trace("get({})", key);
    return call("get", () -> contentItemDao.get(key.partitionKey(), key.sortKey()))
        .map(item -> jsonConverter.fromJson(item.attributesJson()));
  }

  @Override
  public void create(final Map<String, AttributeValue> item) {
    log.trace("create({})", item);
    final ContentItem contentItem = toContentItem(item);
    try {
      call("create", () -> contentItemDao.insert(contentItem));
    } catch (UnableToExecuteStatementException e) {
      if (isDuplicateKey(e)) {
        throw new ConflictException("Item already exists: " + contentItem.pk() + "/" + contentItem.sk(), e);
      }
      log.error("create(): unable to insert {}/{}", contentItem.pk(), contentItem.sk(), e);
      throw e;
    }
  }

  @Override
  public void replace(final Map<String, AttributeValue> item) {
    log.trace("replace({})", item);
    final ContentItem contentItem = toContentItem(item);
    if (!call("replace", () -> contentItemDao.update(contentItem))) {
      throw new NotFoundException("Item not found: " + contentItem.pk() + "/" + contentItem.sk());
    }
  }

  @Override
  public boolean delete(final ItemKey key) {
    log.trace("delete({})", key);
    return call("delete", () -> contentItemDao.delete(key.partitionKey(), key.sortKey()));
  }

  @Override
  public List<Map<String, AttributeValue>> query(final StoreQuery query) {
    log.trace("query({})", query);
    final IndexKey indexKey = query.indexKey();
    final String pattern = likePattern(indexKey.sortKeyPrefix().orElse(""));
    final String indexName = indexKey.indexName().orElse(Attributes.PK);
    final List<ContentItem> rows = call("query", () -> switch (indexName) {
      case Attributes.PK -> contentItemDao.queryPartition(indexKey.partitionKey(), pattern);
      case Attributes.GSI1 -> contentItemDao.queryUserIndex(indexKey.partitionKey(), pattern);
      case Attributes.ENTITY_TYPE_INDEX -> contentItemDao.queryEntityType(indexKey.partitionKey());
      default -> throw new IllegalArgumentException("Unknown index: " + indexName);
    });
    return rows.stream()
        .map(row -> jsonConverter.fromJson(row.attributesJson()))
        .filter(item -> query.filters().entrySet().stream()
            .allMatch(filter -> filter.getValue().equals(item.get(filter.getKey()))))
        .toList();
  }

  private ContentItem toContentItem(final Map<String, AttributeValue> item) {
    return ImmutableContentItem.builder()
        .pk(required(item, Attributes.PK))
        .sk(required(item, Attributes.SK))
        .entityType(required(item, Attributes.ENTITY_TYPE))
        .gsi1pk(Optional.ofNullable(item.get(Attributes.GSI1PK)).map(AttributeValue::s))
        .gsi1sk(Optional.ofNullable(item.get(Attributes.GSI1SK)).map(AttributeValue::s))
        .attributesJson(jsonConverter.toJson(item))
        .build();
  }

  private String required(final Map<String, AttributeValue> item, final String name) {
    final AttributeValue value = item.get(name);
    if (value == null || value.s() == null) {
      throw new IllegalArgumentException("Item has no string attribute '" + name + "'");
    }
    return value.s();
  }

  private String likePattern(final String prefix) {
    return prefix.replace("!", "!!").replace("%", "!%").replace("_", "!_") + "%";
  }

  private boolean isDuplicateKey(final UnableToExecuteStatementException e) {
    return e.getCause() instanceof SQLIntegrityConstraintViolationException
        || (e.getCause() instanceof SQLException sqlException
        && DUPLICATE_KEY_STATE.equals(sqlException.getSQLState()));
  }

  private <T> T call(final String operation, final Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (ConnectionException e) {
      log.warn("{}: unable to reach database", operation, e);
      throw new StoreUnavailableException("Unable to reach database during " + operation, e);
    }
  }

}

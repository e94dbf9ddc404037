package com.codeheadsystems.blog.dao;

import com.codeheadsystems.blog.model.ContentItem;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * The interface Content item dao. Prefix parameters are LIKE patterns escaped with '!'.
 */
public interface ContentItemDao {

  /**
   * Gets item.
   *
   * @param pk the pk
   * @param sk the sk
   * @return the item
   */
  @SqlQuery("select * from BLOG_CONTENT where PK = :pk and SK = :sk")
  Optional<ContentItem> get(@Bind("pk") String pk, @Bind("sk") String sk);

  /**
   * Insert boolean.
   *
   * @param item the item
   * @return the boolean
   */
  @SqlUpdate("insert into BLOG_CONTENT (PK, SK, ENTITY_TYPE, GSI1PK, GSI1SK, ATTRIBUTES_JSON) "
      + "values (:pk, :sk, :entityType, :gsi1pk, :gsi1sk, :attributesJson)")
  boolean insert(@BindPojo ContentItem item);

  /**
   * Update boolean.
   *
   * @param item the item
   * @return the boolean
   */
  @SqlUpdate("update BLOG_CONTENT set ENTITY_TYPE = :entityType, GSI1PK = :gsi1pk, GSI1SK = :gsi1sk, "
      + "ATTRIBUTES_JSON = :attributesJson where PK = :pk and SK = :sk")
  boolean update(@BindPojo ContentItem item);

  /**
   * Delete boolean.
   *
   * @param pk the pk
   * @param sk the sk
   * @return the boolean
   */
  @SqlUpdate("delete from BLOG_CONTENT where PK = :pk and SK = :sk")
  boolean delete(@Bind("pk") String pk, @Bind("sk") String sk);

  /**
   * Items of a partition whose sort key matches the pattern.
   *
   * @param pk      the pk
   * @param pattern the pattern
   * @return the list
   */
  @SqlQuery("select * from BLOG_CONTENT where PK = :pk and SK like :pattern escape '!' order by SK")
  List<ContentItem> queryPartition(@Bind("pk") String pk, @Bind("pattern") String pattern);

  /**
   * Items of a GSI1 partition whose GSI1 sort key matches the pattern.
   *
   * @param gsi1pk  the gsi 1 pk
   * @param pattern the pattern
   * @return the list
   */
  @SqlQuery("select * from BLOG_CONTENT where GSI1PK = :gsi1pk and GSI1SK like :pattern escape '!' order by GSI1SK")
  List<ContentItem> queryUserIndex(@Bind("gsi1pk") String gsi1pk, @Bind("pattern") String pattern);

  /**
   * Items of an entity type.
   *
   * @param entityType the entity type
   * @return the list
   */
  @SqlQuery("select * from BLOG_CONTENT where ENTITY_TYPE = :entityType order by PK, SK")
  List<ContentItem> queryEntityType(@Bind("entityType") String entityType);

}

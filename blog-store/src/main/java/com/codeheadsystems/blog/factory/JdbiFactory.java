package com.codeheadsystems.blog.factory;

import static org.slf4j.LoggerFactory.getLogger;

import com.codeheadsystems.blog.liquibase.LiquibaseHelper;
import com.codeheadsystems.blog.model.ContentItem;
import com.codeheadsystems.blog.model.Database;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.cache.caffeine.CaffeineCachePlugin;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.immutables.JdbiImmutables;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;

/**
 * Creates the Jdbi instance for the relational store, with the schema brought up to date.
 */
@Singleton
public class JdbiFactory {

  /**
   * The changelog that creates BLOG_CONTENT.
   */
  public static final String CHANGELOG = "liquibase/blog-content-changelog.xml";

  private static final Logger log = getLogger(JdbiFactory.class);

  private final LiquibaseHelper liquibaseHelper;

  /**
   * Instantiates a new Jdbi factory.
   *
   * @param liquibaseHelper the liquibase helper
   */
  @Inject
  public JdbiFactory(final LiquibaseHelper liquibaseHelper) {
    log.info("JdbiFactory({})", liquibaseHelper);
    this.liquibaseHelper = liquibaseHelper;
  }

  /**
   * Create jdbi jdbi.
   *
   * @param database the database
   * @return the jdbi
   */
  public Jdbi createJdbi(final Database database) {
    log.trace("createJdbi({})", database);
    final Jdbi jdbi = Jdbi.create(database.url(), database.username(), database.password());
    jdbi.getConfig(JdbiImmutables.class)
        .registerImmutable(ContentItem.class);
    jdbi.installPlugin(new SqlObjectPlugin())
        .installPlugin(new CaffeineCachePlugin());
    if (database.usePostgresql()) {
      jdbi.installPlugin(new PostgresPlugin());
    }
    jdbi.setSqlLogger(new Slf4JSqlLogger());
    liquibaseHelper.runLiquibase(jdbi, CHANGELOG);
    return jdbi;
  }

}

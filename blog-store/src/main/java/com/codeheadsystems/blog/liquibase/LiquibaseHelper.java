package com.codeheadsystems.blog.liquibase;

import static org.slf4j.LoggerFactory.getLogger;

import java.sql.Connection;
import java.util.HashMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import liquibase.Scope;
import liquibase.changelog.ChangeLogParameters;
import liquibase.command.CommandScope;
import liquibase.command.core.UpdateCommandStep;
import liquibase.command.core.helpers.DatabaseChangelogCommandStep;
import liquibase.command.core.helpers.DbUrlConnectionCommandStep;
import liquibase.database.Database;
import liquibase.database.DatabaseFactory;
import liquibase.database.jvm.JdbcConnection;
import liquibase.resource.ClassLoaderResourceAccessor;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;

/**
 * Applies a classpath changelog to the database behind a Jdbi instance.
 */
@Singleton
public class LiquibaseHelper {

  private static final Logger log = getLogger(LiquibaseHelper.class);

  /**
   * Instantiates a new Liquibase helper.
   */
  @Inject
  public LiquibaseHelper() {
  }

  /**
   * Run liquibase.
   *
   * @param jdbi          the jdbi
   * @param changeLogFile the change log file
   */
  public void runLiquibase(final Jdbi jdbi, final String changeLogFile) {
    log.info("runLiquibase({})", changeLogFile);
    jdbi.useHandle(handle -> {
      final Connection connection = handle.getConnection();
      try {
        final Database database = DatabaseFactory.getInstance()
            .findCorrectDatabaseImplementation(new JdbcConnection(connection));
        final Map<String, Object> scopeObjects = new HashMap<>();
        scopeObjects.put(Scope.Attr.database.name(), database);
        scopeObjects.put(Scope.Attr.resourceAccessor.name(), new ClassLoaderResourceAccessor());
        Scope.child(scopeObjects, () -> {
          final CommandScope commandScope = new CommandScope(UpdateCommandStep.COMMAND_NAME);
          commandScope.addArgumentValue(DbUrlConnectionCommandStep.DATABASE_ARG, database);
          commandScope.addArgumentValue(UpdateCommandStep.CHANGELOG_FILE_ARG, changeLogFile);
          commandScope.addArgumentValue(DatabaseChangelogCommandStep.CHANGELOG_PARAMETERS,
              new ChangeLogParameters(database));
          commandScope.execute();
        });
        // Liquibase turns auto-commit off; the handle must be returned with no open transaction.
        connection.commit();
        connection.setAutoCommit(true);
        log.info("runLiquibase(): complete");
      } catch (Exception e) {
        throw new IllegalStateException("Database update failure", e);
      }
    });
  }

}

package com.codeheadsystems.blog.tool;

import com.codeheadsystems.blog.configuration.ConfigurationLoader;
import com.codeheadsystems.blog.dagger.BlogStoreComponent;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line tool for provisioning and loading the blog content table.
 * <pre>
 *   BlogContentTool config.yml create-table
 *   BlogContentTool config.yml delete-table
 *   BlogContentTool config.yml export items.json
 *   BlogContentTool config.yml seed items.json
 * </pre>
 * {@code blog-store/config/blog-store-local.yml} points the tool at DynamoDB local on port 8000.
 */
public class BlogContentTool {

  static final String USAGE = "usage: BlogContentTool <config.yml> create-table|delete-table|export <file>|seed <file>";

  private static final Logger LOGGER = LoggerFactory.getLogger(BlogContentTool.class);

  private final Function<Path, BlogStoreComponent> componentFactory;

  /**
   * Instantiates a new Blog content tool.
   *
   * @param componentFactory builds the component from a configuration file
   */
  public BlogContentTool(final Function<Path, BlogStoreComponent> componentFactory) {
    this.componentFactory = componentFactory;
  }

  /**
   * Run the tool.
   *
   * @param args from the command line.
   * @throws IOException if a data file could not be opened.
   */
  public static void main(final String[] args) throws IOException {
    LOGGER.info("main({})", (Object) args);
    final ConfigurationLoader loader = new ConfigurationLoader();
    final int status = new BlogContentTool(path -> BlogStoreComponent.instance(loader.load(path))).run(args);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Run one command.
   *
   * @param args the args
   * @return the exit status
   * @throws IOException if a data file could not be opened.
   */
  public int run(final String[] args) throws IOException {
    if (args.length < 2) {
      LOGGER.error(USAGE);
      return 2;
    }
    final String command = args[1];
    final boolean needsFile = command.equals("export") || command.equals("seed");
    if (needsFile && args.length < 3) {
      LOGGER.error(USAGE);
      return 2;
    }
    if (!needsFile && !command.equals("create-table") && !command.equals("delete-table")) {
      LOGGER.error("Unknown command {}. {}", command, USAGE);
      return 2;
    }
    final BlogStoreComponent component = componentFactory.apply(Path.of(args[0]));
    switch (command) {
      case "create-table" -> LOGGER.info("create-table: {}",
          component.tableManager().createTable() ? "created" : "already exists");
      case "delete-table" -> LOGGER.info("delete-table: {}",
          component.tableManager().deleteTable() ? "deleted" : "did not exist");
      case "export" -> {
        try (Writer writer = Files.newBufferedWriter(Path.of(args[2]), StandardCharsets.UTF_8)) {
          LOGGER.info("export: {} items", component.seeder().export(writer));
        }
      }
      default -> {
        try (Reader reader = Files.newBufferedReader(Path.of(args[2]), StandardCharsets.UTF_8)) {
          LOGGER.info("seed: {} items", component.seeder().seed(reader));
        }
      }
    }
    return 0;
  }

}

package com.codeheadsystems.blog.configuration;

import com.codeheadsystems.blog.model.BlogStoreConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link BlogStoreConfiguration} from YAML, either a file on disk or a classpath resource.
 */
public class ConfigurationLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationLoader.class);

  private final ObjectMapper yamlMapper;

  /**
   * Instantiates a new Configuration loader.
   */
  public ConfigurationLoader() {
    this.yamlMapper = new ObjectMapper(new YAMLFactory())
        .registerModule(new Jdk8Module());
  }

  /**
   * Load from a file.
   *
   * @param path the path
   * @return the blog store configuration
   */
  public BlogStoreConfiguration load(final Path path) {
    LOGGER.info("load({})", path);
    try (InputStream in = Files.newInputStream(path)) {
      return read(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read configuration " + path, e);
    }
  }

  /**
   * Load from the classpath.
   *
   * @param resource the resource
   * @return the blog store configuration
   */
  public BlogStoreConfiguration loadResource(final String resource) {
    LOGGER.info("loadResource({})", resource);
    try (InputStream in = ConfigurationLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No such configuration resource: " + resource);
      }
      return read(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read configuration " + resource, e);
    }
  }

  private BlogStoreConfiguration read(final InputStream in) throws IOException {
    return yamlMapper.readValue(in, BlogStoreConfiguration.class);
  }

}

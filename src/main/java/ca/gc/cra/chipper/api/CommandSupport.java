package ca.gc.cra.chipper.api;

import ca.gc.cra.chipper.application.routing.TagLogger;
import ca.gc.cra.chipper.config.LoggerDefinition;
import ca.gc.cra.chipper.config.YamlLoggerDefinitionLoader;
import ca.gc.cra.chipper.domain.tag.TagSet;
import ca.gc.cra.chipper.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Option handling shared by {@code emit} and {@code render}.
 */
final class CommandSupport {
  static final String CONFIG = "config";
  static final String TAGS = "tags";
  static final String NAME = "name";
  static final String MESSAGE = "message";

  private CommandSupport() {
    // Utility
  }

  /**
   * Loads the definition named by {@code config=}, or the built-in defaults when absent.
   *
   * @param options parsed options
   * @return logger definition
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the file is not a valid definition
   */
  static LoggerDefinition definition(Map<String, String> options) throws IOException {
    String config = options.get(CONFIG);
    if (config == null || config.isBlank()) {
      return LoggerDefinition.defaults();
    }
    return YamlLoggerDefinitionLoader.load(Path.of(Strings.requireNonBlank(CONFIG, config)));
  }

  /**
   * Resolves {@code tags=a,b} or {@code name=a_b}; neither yields the empty set.
   *
   * @param options parsed options
   * @return emission tags
   * @throws IllegalArgumentException if both are given, the name is reserved, or a tag is malformed
   */
  static TagSet tags(Map<String, String> options) {
    String tags = options.get(TAGS);
    String name = options.get(NAME);
    if (tags != null && name != null) {
      throw new IllegalArgumentException("tags= and name= are mutually exclusive");
    }
    if (name != null) {
      return TagLogger.resolveName(name.trim());
    }
    return TagSet.of(Strings.splitList(tags));
  }

  static String message(Map<String, String> options) {
    String message = options.get(MESSAGE);
    if (message == null) {
      throw new IllegalArgumentException("message= is required");
    }
    return message;
  }
}

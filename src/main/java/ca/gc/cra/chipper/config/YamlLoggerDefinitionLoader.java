package ca.gc.cra.chipper.config;

import ca.gc.cra.chipper.application.routing.DefaultRouting;
import ca.gc.cra.chipper.domain.format.FormatterConfig;
import ca.gc.cra.chipper.domain.format.TagTransform;
import ca.gc.cra.chipper.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link LoggerDefinition} from a YAML document.
 *
 * <pre>{@code
 * routing: always
 * zone: UTC
 * default:
 *   target: { stdout: true }
 * handlers:
 *   - name: sql
 *     tags: [sql, blog, warning]
 *     target: { filename: logs/sql.log }
 *     formatter: { tag_delimiter: "|" }
 * }</pre>
 *
 * <p>Formatter keys use the option names {@code tag_template}, {@code tag_formatter}, {@code tag_delimiter},
 * {@code date_template}, {@code date_format}, {@code time_template}, {@code time_format}, {@code file_template},
 * {@code line_template}, {@code module_template}, {@code tags_template}, {@code datetime_template},
 * {@code trace_template} and {@code template}. Unknown keys are rejected.</p>
 *
 * @since 0.1.0
 */
public final class YamlLoggerDefinitionLoader {
  private static final Set<String> ROOT_KEYS = Set.of("routing", "zone", "default", "handlers");
  private static final Set<String> HANDLER_KEYS = Set.of("name", "tags", "target", "formatter");
  private static final Set<String> DEFAULT_KEYS = Set.of("target", "formatter");
  private static final Set<String> TARGET_KEYS = Set.of("filename", "stdout", "stderr");

  private YamlLoggerDefinitionLoader() {}

  /**
   * Reads and parses a definition file.
   *
   * @param path YAML file; must exist
   * @return parsed definition
   * @throws IOException if the file is missing or unreadable
   * @throws IllegalArgumentException if the YAML structure or an option value is invalid
   */
  public static LoggerDefinition load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Logger definition not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Parses a definition held in memory.
   *
   * @param yaml YAML text
   * @return parsed definition
   * @throws IllegalArgumentException if the YAML structure or an option value is invalid
   */
  public static LoggerDefinition parse(String yaml) {
    Objects.requireNonNull(yaml, "yaml");
    return parse(new StringReader(yaml), "<string>");
  }

  private static LoggerDefinition parse(Reader reader, String origin) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML logger definition at " + origin, ex);
    }
    if (document == null) {
      return LoggerDefinition.defaults();
    }
    Map<String, Object> root = asMap(document, "root");
    requireKnownKeys(root, ROOT_KEYS, "root");

    DefaultRouting routing = DefaultRouting.from(toOptionalString(root.get("routing")));
    ZoneId zone = parseZone(toOptionalString(root.get("zone")));

    TargetDefinition defaultTarget = TargetDefinition.stdoutOnly();
    FormatterConfig defaultFormatter = FormatterConfig.defaultHandler();
    Object defaultNode = root.get("default");
    if (defaultNode != null) {
      Map<String, Object> section = asMap(defaultNode, "default");
      requireKnownKeys(section, DEFAULT_KEYS, "default");
      if (section.get("target") != null) {
        defaultTarget = parseTarget(asMap(section.get("target"), "default.target"));
      }
      defaultFormatter = parseFormatter(section.get("formatter"), defaultFormatter, "default.formatter");
    }

    List<HandlerDefinition> handlers = new ArrayList<>();
    Set<String> names = new LinkedHashSet<>();
    Object handlersNode = root.get("handlers");
    if (handlersNode != null) {
      if (!(handlersNode instanceof Iterable<?> iterable)) {
        throw new IllegalArgumentException("handlers must be a list");
      }
      for (Object node : iterable) {
        HandlerDefinition handler = parseHandler(asMap(node, "handler"));
        if (!names.add(handler.name())) {
          throw new IllegalArgumentException("Duplicate handler name detected: " + handler.name());
        }
        handlers.add(handler);
      }
    }
    return new LoggerDefinition(handlers, defaultTarget, defaultFormatter, routing, zone);
  }

  private static HandlerDefinition parseHandler(Map<String, Object> map) {
    requireKnownKeys(map, HANDLER_KEYS, "handler");
    String name = Strings.requireNonBlank("handler name", requireString(map, "name", "handler"));
    if (LoggerDefinition.DEFAULT_HANDLER_NAME.equals(name.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException(
          "handler name '" + name + "' is reserved for the default handler; configure it under 'default'");
    }
    List<String> tags = parseTags(map.get("tags"), name);
    if (tags.isEmpty()) {
      throw new IllegalArgumentException("handler '" + name + "' tags list must contain at least one tag");
    }
    Object targetNode = map.get("target");
    if (targetNode == null) {
      throw new IllegalArgumentException("handler '" + name + "' requires a target");
    }
    TargetDefinition target = parseTarget(asMap(targetNode, name + ".target"));
    FormatterConfig formatter = parseFormatter(map.get("formatter"), FormatterConfig.defaults(), name + ".formatter");
    return new HandlerDefinition(name, tags, target, formatter);
  }

  private static List<String> parseTags(Object node, String handler) {
    if (node == null) {
      return List.of();
    }
    if (node instanceof String single) {
      return Arrays.asList(Strings.splitList(single));
    }
    if (node instanceof Iterable<?> iterable) {
      List<String> tags = new ArrayList<>();
      for (Object value : iterable) {
        if (value == null) {
          throw new IllegalArgumentException("handler '" + handler + "' tags must not contain null entries");
        }
        tags.add(value.toString());
      }
      return tags;
    }
    throw new IllegalArgumentException("handler '" + handler + "' tags must be a list or comma separated string");
  }

  private static TargetDefinition parseTarget(Map<String, Object> map) {
    requireKnownKeys(map, TARGET_KEYS, "target");
    String filename = toOptionalString(map.get("filename"));
    boolean stdout = toBoolean(map.get("stdout"), "stdout");
    boolean stderr = toBoolean(map.get("stderr"), "stderr");
    return new TargetDefinition(filename, stdout, stderr);
  }

  private static FormatterConfig parseFormatter(Object node, FormatterConfig base, String context) {
    if (node == null) {
      return base;
    }
    Map<String, Object> map = asMap(node, context);
    FormatterConfig.Builder builder = base.toBuilder();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      String value = entry.getValue() == null ? "" : entry.getValue().toString();
      switch (entry.getKey()) {
        case "tag_template" -> builder.tagTemplate(value);
        case "tag_formatter" -> builder.tagTransform(TagTransform.named(value));
        case "tag_delimiter" -> builder.tagDelimiter(value);
        case "date_template" -> builder.dateTemplate(value);
        case "date_format" -> builder.dateFormat(value);
        case "time_template" -> builder.timeTemplate(value);
        case "time_format" -> builder.timeFormat(value);
        case "file_template" -> builder.fileTemplate(value);
        case "line_template" -> builder.lineTemplate(value);
        case "module_template" -> builder.moduleTemplate(value);
        case "tags_template" -> builder.tagsTemplate(value);
        case "datetime_template" -> builder.datetimeTemplate(value);
        case "trace_template" -> builder.traceTemplate(value);
        case "template" -> builder.template(value);
        default -> throw new IllegalArgumentException(
            context + " contains unknown option '" + entry.getKey() + "'");
      }
    }
    return builder.build();
  }

  private static ZoneId parseZone(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return ZoneId.of(raw.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("zone is not a valid zone id: " + raw, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void requireKnownKeys(Map<String, Object> map, Set<String> allowed, String context) {
    for (String key : map.keySet()) {
      if (!allowed.contains(key)) {
        throw new IllegalArgumentException(context + " contains unknown key '" + key + "'");
      }
    }
  }

  private static String requireString(Map<String, Object> map, String key, String context) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException(context + " requires '" + key + "'");
    }
    return value.toString();
  }

  private static String toOptionalString(Object value) {
    return value == null ? null : value.toString();
  }

  private static boolean toBoolean(Object value, String key) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    return switch (text) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off", "" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean (was '" + value + "')");
    };
  }
}

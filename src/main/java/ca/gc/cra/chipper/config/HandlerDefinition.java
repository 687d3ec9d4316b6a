package ca.gc.cra.chipper.config;

import ca.gc.cra.chipper.domain.format.FormatterConfig;
import java.util.List;
import java.util.Objects;

/**
 * Declarative form of a handler before sinks are opened.
 *
 * @param name handler name used in diagnostics
 * @param tags subscription tags in declaration order
 * @param target destinations
 * @param formatter formatter options with overrides applied
 * @since 0.1.0
 */
public record HandlerDefinition(
    String name,
    List<String> tags,
    TargetDefinition target,
    FormatterConfig formatter) {

  public HandlerDefinition {
    Objects.requireNonNull(name, "name");
    tags = List.copyOf(Objects.requireNonNull(tags, "tags"));
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(formatter, "formatter");
  }
}

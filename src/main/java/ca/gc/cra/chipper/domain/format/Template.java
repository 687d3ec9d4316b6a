package ca.gc.cra.chipper.domain.format;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Compiled template with named {@code {placeholder}} substitution.
 * <p><strong>Why:</strong> Every formatter stage is user-configurable text; compiling once keeps rendering cheap and
 * surfaces syntax mistakes when the handler is built.</p>
 * <p><strong>Syntax:</strong> {@code {name}} inserts a value and doubled braces render as literal braces. Names
 * start with a letter or underscore followed by letters, digits or underscores.</p>
 * <p><strong>Thread-safety:</strong> Immutable after compilation.</p>
 *
 * @since 0.1.0
 */
public final class Template {
  private final String source;
  private final List<Segment> segments;
  private final Set<String> placeholders;

  private Template(String source, List<Segment> segments, Set<String> placeholders) {
    this.source = source;
    this.segments = segments;
    this.placeholders = placeholders;
  }

  /**
   * Parses template text.
   *
   * @param source template text; must not be {@code null}
   * @return compiled template
   * @throws TemplateException if braces are unbalanced or a placeholder name is invalid
   */
  public static Template compile(String source) {
    Objects.requireNonNull(source, "source");
    List<Segment> segments = new ArrayList<>();
    Set<String> names = new LinkedHashSet<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (c == '{') {
        if (i + 1 < source.length() && source.charAt(i + 1) == '{') {
          literal.append('{');
          i += 2;
          continue;
        }
        int close = source.indexOf('}', i + 1);
        if (close < 0) {
          throw new TemplateException("unclosed '{' at index " + i + " in template '" + source + "'");
        }
        String name = source.substring(i + 1, close);
        if (!isValidName(name)) {
          throw new TemplateException("invalid placeholder '{" + name + "}' in template '" + source + "'");
        }
        if (literal.length() > 0) {
          segments.add(new Segment(literal.toString(), false));
          literal.setLength(0);
        }
        segments.add(new Segment(name, true));
        names.add(name);
        i = close + 1;
      } else if (c == '}') {
        if (i + 1 < source.length() && source.charAt(i + 1) == '}') {
          literal.append('}');
          i += 2;
          continue;
        }
        throw new TemplateException("single '}' at index " + i + " in template '" + source + "'");
      } else {
        literal.append(c);
        i++;
      }
    }
    if (literal.length() > 0) {
      segments.add(new Segment(literal.toString(), false));
    }
    return new Template(source, List.copyOf(segments), Set.copyOf(names));
  }

  /**
   * Renders the template requiring every placeholder to be supplied.
   *
   * @param values placeholder values keyed by name
   * @return rendered text
   * @throws TemplateException if a placeholder has no value
   */
  public String render(Map<String, String> values) {
    return render(values, Set.of());
  }

  /**
   * Renders the template, substituting an empty string for absent optional placeholders.
   *
   * @param values placeholder values keyed by name
   * @param optional names that may be absent from {@code values}
   * @return rendered text
   * @throws TemplateException if a non-optional placeholder has no value
   */
  public String render(Map<String, String> values, Set<String> optional) {
    StringBuilder out = new StringBuilder(source.length() + 32);
    for (Segment segment : segments) {
      if (!segment.placeholder()) {
        out.append(segment.text());
        continue;
      }
      String value = values.get(segment.text());
      if (value == null) {
        if (!optional.contains(segment.text())) {
          throw new TemplateException(
              "unknown placeholder '{" + segment.text() + "}' in template '" + source + "'");
        }
        continue;
      }
      out.append(value);
    }
    return out.toString();
  }

  /**
   * Returns the placeholder names referenced by this template.
   *
   * @return immutable set of names
   */
  public Set<String> placeholders() {
    return placeholders;
  }

  private static boolean isValidName(String name) {
    if (name.isEmpty()) {
      return false;
    }
    char first = name.charAt(0);
    if (!(Character.isLetter(first) || first == '_')) {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_')) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return source;
  }

  private record Segment(String text, boolean placeholder) {}
}

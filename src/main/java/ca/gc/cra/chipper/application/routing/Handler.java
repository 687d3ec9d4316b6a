package ca.gc.cra.chipper.application.routing;

import ca.gc.cra.chipper.domain.emission.Emission;
import ca.gc.cra.chipper.domain.emission.TraceInfo;
import ca.gc.cra.chipper.domain.format.FormatterConfig;
import ca.gc.cra.chipper.domain.format.PrefixFormatter;
import ca.gc.cra.chipper.domain.tag.TagSet;
import ca.gc.cra.chipper.validation.Strings;
import java.util.Objects;

/**
 * <strong>What:</strong> Binds a tag subscription to a formatter and a target.
 * <p><strong>Why:</strong> Each destination decides independently which emissions it captures and how they look.</p>
 * <p><strong>Role:</strong> Application component owned by a {@link TagLogger}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; concurrent deliveries are serialized by the target's sinks.</p>
 * <p><strong>Errors:</strong> Construction fails fast with {@link ca.gc.cra.chipper.domain.format.TemplateException}
 * when the formatter is misconfigured.</p>
 *
 * @since 0.1.0
 */
public final class Handler {
  private final String name;
  private final TagSet subscription;
  private final PrefixFormatter formatter;
  private final Target target;

  /**
   * Creates a handler and validates its formatter with a sample render.
   *
   * @param name handler name used in diagnostics and the {@code {handler}} placeholder; must not be blank
   * @param subscription tags this handler listens for; an empty set matches nothing
   * @param formatter formatter options; must not be {@code null}
   * @param target destination for rendered lines; must not be {@code null}
   * @throws IllegalArgumentException if the name is blank or the formatter is invalid
   */
  public Handler(String name, TagSet subscription, FormatterConfig formatter, Target target) {
    this.name = Strings.requireNonBlank("handler name", name);
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.formatter = new PrefixFormatter(Objects.requireNonNull(formatter, "formatter"));
    this.target = Objects.requireNonNull(target, "target");
    this.formatter.validate(this.name);
  }

  /**
   * Tests whether this handler captures an emission carrying {@code tags}.
   *
   * @param tags emission tags
   * @return {@code true} when the subscription overlaps the tags
   */
  public boolean matches(TagSet tags) {
    return TagSet.matches(tags, subscription);
  }

  /**
   * Renders the full line this handler writes: prefix, message, optional exception block, newline.
   *
   * @param emission emission to render; its tags are the ones shown in the prefix
   * @return rendered line ending in {@code \n}
   */
  public String renderLine(Emission emission) {
    String prefix = formatter.render(emission, name);
    StringBuilder line = new StringBuilder(prefix.length() + emission.message().length() + 1);
    line.append(prefix).append(emission.message());
    TraceInfo trace = emission.trace();
    if (trace != null && trace.hasException()) {
      line.append('\n').append(trace.exception());
    }
    return line.append('\n').toString();
  }

  /**
   * Renders and writes one emission.
   *
   * @param emission emission to deliver
   * @throws SinkWriteException if the target could not be written
   */
  public void deliver(Emission emission) throws SinkWriteException {
    target.write(renderLine(emission));
  }

  public String name() {
    return name;
  }

  public TagSet subscription() {
    return subscription;
  }

  public FormatterConfig formatterConfig() {
    return formatter.config();
  }

  public Target target() {
    return target;
  }

  @Override
  public String toString() {
    return "Handler[" + name + " " + subscription + " -> " + target.describe() + "]";
  }
}

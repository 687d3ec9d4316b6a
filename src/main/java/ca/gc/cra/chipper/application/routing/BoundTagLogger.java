package ca.gc.cra.chipper.application.routing;

import ca.gc.cra.chipper.domain.tag.TagSet;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Logger with a fixed tag set, for call sites that always log under the same tags.
 *
 * @since 0.1.0
 */
public final class BoundTagLogger implements Consumer<String> {
  private final TagLogger logger;
  private final TagSet tags;

  BoundTagLogger(TagLogger logger, TagSet tags) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.tags = Objects.requireNonNull(tags, "tags");
  }

  public void log(String message) {
    logger.emit(message, tags, null);
  }

  public void log(String message, Throwable error) {
    logger.emit(message, tags, error);
  }

  @Override
  public void accept(String message) {
    log(message);
  }

  public TagSet tags() {
    return tags;
  }

  @Override
  public String toString() {
    return "BoundTagLogger" + tags;
  }
}

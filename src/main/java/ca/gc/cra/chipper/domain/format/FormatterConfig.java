package ca.gc.cra.chipper.domain.format;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable set of templates and transforms driving the three-stage prefix formatter.
 * <p><strong>Why:</strong> Lets every handler override any subset of rendering options while sharing defaults.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@link PrefixFormatter}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; shared by reference across emissions.</p>
 *
 * @param tagTemplate per-tag item template ({@code {tag}})
 * @param tagTransform per-tag transform applied before {@code tagTemplate}
 * @param tagDelimiter separator between rendered tags
 * @param dateTemplate date item template ({@code {date}})
 * @param dateFormat strftime pattern for the date item
 * @param timeTemplate time item template ({@code {time}})
 * @param timeFormat strftime pattern for the time item
 * @param fileTemplate trace file item template ({@code {file}})
 * @param lineTemplate trace line item template ({@code {line}})
 * @param moduleTemplate trace module item template ({@code {module}})
 * @param tagsTemplate tags group template ({@code {tags}})
 * @param datetimeTemplate datetime group template ({@code {date}}, {@code {time}})
 * @param traceTemplate trace group template ({@code {file}}, {@code {line}}, {@code {module}})
 * @param template line template ({@code {datetime}}, {@code {tags}}, {@code {trace}}, {@code {handler}})
 * @since 0.1.0
 */
public record FormatterConfig(
    String tagTemplate,
    TagTransform tagTransform,
    String tagDelimiter,
    String dateTemplate,
    String dateFormat,
    String timeTemplate,
    String timeFormat,
    String fileTemplate,
    String lineTemplate,
    String moduleTemplate,
    String tagsTemplate,
    String datetimeTemplate,
    String traceTemplate,
    String template) {

  public static final String DEFAULT_TAG_TEMPLATE = "{tag}";
  public static final String DEFAULT_TAG_DELIMITER = ",";
  public static final String DEFAULT_DATE_TEMPLATE = "{date}";
  public static final String DEFAULT_DATE_FORMAT = "%Y-%m-%d";
  public static final String DEFAULT_TIME_TEMPLATE = "{time}";
  public static final String DEFAULT_TIME_FORMAT = "%H:%M:%S";
  public static final String DEFAULT_FILE_TEMPLATE = "{file}";
  public static final String DEFAULT_LINE_TEMPLATE = ":{line}";
  public static final String DEFAULT_MODULE_TEMPLATE = ":{module}";
  public static final String DEFAULT_TAGS_TEMPLATE = "[{tags}]";
  public static final String DEFAULT_DATETIME_TEMPLATE = "[{date} {time}]";
  public static final String DEFAULT_TRACE_TEMPLATE = "{file}{line}";
  public static final String DEFAULT_TEMPLATE = "{datetime}{trace}{tags} : ";
  /** Line template used by the built-in default handler. */
  public static final String DEFAULT_HANDLER_TEMPLATE = "{trace}{tags} : ";

  private static final FormatterConfig DEFAULTS = builder().build();

  public FormatterConfig {
    Objects.requireNonNull(tagTemplate, "tag_template");
    Objects.requireNonNull(tagTransform, "tag_formatter");
    Objects.requireNonNull(tagDelimiter, "tag_delimiter");
    Objects.requireNonNull(dateTemplate, "date_template");
    Objects.requireNonNull(dateFormat, "date_format");
    Objects.requireNonNull(timeTemplate, "time_template");
    Objects.requireNonNull(timeFormat, "time_format");
    Objects.requireNonNull(fileTemplate, "file_template");
    Objects.requireNonNull(lineTemplate, "line_template");
    Objects.requireNonNull(moduleTemplate, "module_template");
    Objects.requireNonNull(tagsTemplate, "tags_template");
    Objects.requireNonNull(datetimeTemplate, "datetime_template");
    Objects.requireNonNull(traceTemplate, "trace_template");
    Objects.requireNonNull(template, "template");
  }

  /**
   * Returns the configuration with every option at its default.
   *
   * @return shared default configuration
   */
  public static FormatterConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Returns the configuration used by the built-in default handler.
   *
   * @return defaults with {@value #DEFAULT_HANDLER_TEMPLATE} as the line template
   */
  public static FormatterConfig defaultHandler() {
    return DEFAULTS.toBuilder().template(DEFAULT_HANDLER_TEMPLATE).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder seeded with this configuration's values.
   *
   * @return mutable builder
   */
  public Builder toBuilder() {
    return new Builder()
        .tagTemplate(tagTemplate)
        .tagTransform(tagTransform)
        .tagDelimiter(tagDelimiter)
        .dateTemplate(dateTemplate)
        .dateFormat(dateFormat)
        .timeTemplate(timeTemplate)
        .timeFormat(timeFormat)
        .fileTemplate(fileTemplate)
        .lineTemplate(lineTemplate)
        .moduleTemplate(moduleTemplate)
        .tagsTemplate(tagsTemplate)
        .datetimeTemplate(datetimeTemplate)
        .traceTemplate(traceTemplate)
        .template(template);
  }

  /**
   * Mutable builder starting from the documented defaults. Not thread-safe.
   */
  public static final class Builder {
    private String tagTemplate = DEFAULT_TAG_TEMPLATE;
    private TagTransform tagTransform = TagTransform.UPPER_TRIMMED;
    private String tagDelimiter = DEFAULT_TAG_DELIMITER;
    private String dateTemplate = DEFAULT_DATE_TEMPLATE;
    private String dateFormat = DEFAULT_DATE_FORMAT;
    private String timeTemplate = DEFAULT_TIME_TEMPLATE;
    private String timeFormat = DEFAULT_TIME_FORMAT;
    private String fileTemplate = DEFAULT_FILE_TEMPLATE;
    private String lineTemplate = DEFAULT_LINE_TEMPLATE;
    private String moduleTemplate = DEFAULT_MODULE_TEMPLATE;
    private String tagsTemplate = DEFAULT_TAGS_TEMPLATE;
    private String datetimeTemplate = DEFAULT_DATETIME_TEMPLATE;
    private String traceTemplate = DEFAULT_TRACE_TEMPLATE;
    private String template = DEFAULT_TEMPLATE;

    private Builder() {}

    public Builder tagTemplate(String value) {
      this.tagTemplate = value;
      return this;
    }

    public Builder tagTransform(TagTransform value) {
      this.tagTransform = value;
      return this;
    }

    public Builder tagDelimiter(String value) {
      this.tagDelimiter = value;
      return this;
    }

    public Builder dateTemplate(String value) {
      this.dateTemplate = value;
      return this;
    }

    public Builder dateFormat(String value) {
      this.dateFormat = value;
      return this;
    }

    public Builder timeTemplate(String value) {
      this.timeTemplate = value;
      return this;
    }

    public Builder timeFormat(String value) {
      this.timeFormat = value;
      return this;
    }

    public Builder fileTemplate(String value) {
      this.fileTemplate = value;
      return this;
    }

    public Builder lineTemplate(String value) {
      this.lineTemplate = value;
      return this;
    }

    public Builder moduleTemplate(String value) {
      this.moduleTemplate = value;
      return this;
    }

    public Builder tagsTemplate(String value) {
      this.tagsTemplate = value;
      return this;
    }

    public Builder datetimeTemplate(String value) {
      this.datetimeTemplate = value;
      return this;
    }

    public Builder traceTemplate(String value) {
      this.traceTemplate = value;
      return this;
    }

    public Builder template(String value) {
      this.template = value;
      return this;
    }

    /**
     * Builds the immutable configuration.
     *
     * @return configuration record
     * @throws NullPointerException if any option was set to {@code null}
     */
    public FormatterConfig build() {
      return new FormatterConfig(
          tagTemplate,
          tagTransform,
          tagDelimiter,
          dateTemplate,
          dateFormat,
          timeTemplate,
          timeFormat,
          fileTemplate,
          lineTemplate,
          moduleTemplate,
          tagsTemplate,
          datetimeTemplate,
          traceTemplate,
          template);
    }
  }
}

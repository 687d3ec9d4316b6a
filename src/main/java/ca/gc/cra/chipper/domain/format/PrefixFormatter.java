package ca.gc.cra.chipper.domain.format;

import ca.gc.cra.chipper.domain.emission.Emission;
import ca.gc.cra.chipper.domain.emission.TraceInfo;
import ca.gc.cra.chipper.domain.tag.TagSet;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Renders the prefix written before an emission's message.
 * <p><strong>Why:</strong> Splits rendering into item, item-group and line stages so each level can be restyled
 * without touching the others.</p>
 * <p><strong>Role:</strong> Domain service owned by a handler; one instance per {@link FormatterConfig}.</p>
 * <p><strong>Stages:</strong>
 * <ol>
 *   <li>Item: each tag, the date, the time and the trace file/line/module.</li>
 *   <li>Group: joined tags, combined date and time, combined trace items.</li>
 *   <li>Line: the top-level template over {@code datetime}, {@code tags}, {@code trace} and {@code handler}.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Immutable; rendering is a pure function of the emission and configuration.</p>
 * <p><strong>Errors:</strong> Syntax problems fail at construction; unknown placeholders fail at render with
 * {@link TemplateException}.</p>
 *
 * @since 0.1.0
 */
public final class PrefixFormatter {
  static final String TAG = "tag";
  static final String TAGS = "tags";
  static final String DATE = "date";
  static final String TIME = "time";
  static final String DATETIME = "datetime";
  static final String FILE = "file";
  static final String LINE = "line";
  static final String MODULE = "module";
  static final String TRACE = "trace";
  static final String HANDLER = "handler";

  private static final Set<String> OPTIONAL_LINE_VALUES = Set.of(TRACE);
  private static final ZonedDateTime SAMPLE_TIME = ZonedDateTime.of(2000, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

  private final FormatterConfig config;
  private final Template tagTemplate;
  private final Template tagsTemplate;
  private final Template dateTemplate;
  private final Template timeTemplate;
  private final Template datetimeTemplate;
  private final Template fileTemplate;
  private final Template lineTemplate;
  private final Template moduleTemplate;
  private final Template traceTemplate;
  private final Template template;
  private final StrftimePattern dateFormat;
  private final StrftimePattern timeFormat;

  /**
   * Compiles every template and date/time pattern of {@code config}.
   *
   * @param config formatter options; must not be {@code null}
   * @throws TemplateException if a template or pattern is malformed
   */
  public PrefixFormatter(FormatterConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.tagTemplate = compile("tag_template", config.tagTemplate());
    this.tagsTemplate = compile("tags_template", config.tagsTemplate());
    this.dateTemplate = compile("date_template", config.dateTemplate());
    this.timeTemplate = compile("time_template", config.timeTemplate());
    this.datetimeTemplate = compile("datetime_template", config.datetimeTemplate());
    this.fileTemplate = compile("file_template", config.fileTemplate());
    this.lineTemplate = compile("line_template", config.lineTemplate());
    this.moduleTemplate = compile("module_template", config.moduleTemplate());
    this.traceTemplate = compile("trace_template", config.traceTemplate());
    this.template = compile("template", config.template());
    this.dateFormat = StrftimePattern.compile(config.dateFormat());
    this.timeFormat = StrftimePattern.compile(config.timeFormat());
  }

  /**
   * Renders the prefix for one emission.
   *
   * @param emission emission whose tags, timestamp and trace are rendered; must not be {@code null}
   * @param handlerName name exposed to the line template as {@code {handler}}
   * @return rendered prefix; the caller appends the message
   * @throws TemplateException if a template references an unknown placeholder
   */
  public String render(Emission emission, String handlerName) {
    Objects.requireNonNull(emission, "emission");
    Map<String, String> line = new HashMap<>(8);
    line.put(TAGS, renderTags(emission.tags()));
    line.put(DATETIME, renderDatetime(emission.timestamp()));
    line.put(HANDLER, handlerName == null ? "" : handlerName);
    TraceInfo trace = emission.trace();
    if (trace != null) {
      String rendered = renderTrace(trace);
      if (!rendered.isEmpty()) {
        line.put(TRACE, rendered);
      }
    }
    return template.render(line, OPTIONAL_LINE_VALUES);
  }

  /**
   * Renders a synthetic traced emission so unknown placeholders surface before the first real emission.
   *
   * @param handlerName handler name used in diagnostics
   * @throws TemplateException if any template references an unknown placeholder
   */
  public void validate(String handlerName) {
    TraceInfo sampleTrace = new TraceInfo("Sample.java", 1, "Sample.run", "");
    Emission sample = new Emission("", TagSet.of("sample"), SAMPLE_TIME, sampleTrace);
    try {
      render(sample, handlerName);
    } catch (TemplateException ex) {
      throw new TemplateException("handler '" + handlerName + "': " + ex.getMessage(), ex);
    }
  }

  public FormatterConfig config() {
    return config;
  }

  private String renderTags(TagSet tags) {
    StringJoiner joiner = new StringJoiner(config.tagDelimiter());
    for (String tag : tags.asList()) {
      String transformed = config.tagTransform().apply(tag);
      joiner.add(tagTemplate.render(Map.of(TAG, transformed == null ? "" : transformed)));
    }
    return tagsTemplate.render(Map.of(TAGS, joiner.toString()));
  }

  private String renderDatetime(ZonedDateTime timestamp) {
    String date = dateTemplate.render(Map.of(DATE, dateFormat.format(timestamp)));
    String time = timeTemplate.render(Map.of(TIME, timeFormat.format(timestamp)));
    return datetimeTemplate.render(Map.of(DATE, date, TIME, time));
  }

  // Unknown fields render as empty items; the group is skipped entirely when nothing is known.
  private String renderTrace(TraceInfo trace) {
    if (trace.file().isEmpty() && trace.line() < 0 && trace.module().isEmpty()) {
      return "";
    }
    String file = trace.file().isEmpty() ? "" : fileTemplate.render(Map.of(FILE, trace.file()));
    String line = trace.line() < 0 ? "" : lineTemplate.render(Map.of(LINE, trace.lineText()));
    String module = trace.module().isEmpty() ? "" : moduleTemplate.render(Map.of(MODULE, trace.module()));
    return traceTemplate.render(Map.of(FILE, file, LINE, line, MODULE, module));
  }

  private static Template compile(String option, String source) {
    try {
      return Template.compile(source);
    } catch (TemplateException ex) {
      throw new TemplateException(option + ": " + ex.getMessage(), ex);
    }
  }
}

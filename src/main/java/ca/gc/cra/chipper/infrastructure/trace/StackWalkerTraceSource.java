package ca.gc.cra.chipper.infrastructure.trace;

import ca.gc.cra.chipper.application.port.TraceCaptureException;
import ca.gc.cra.chipper.application.port.TraceSource;
import ca.gc.cra.chipper.application.routing.BoundTagLogger;
import ca.gc.cra.chipper.application.routing.TagLogger;
import ca.gc.cra.chipper.domain.emission.TraceInfo;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link TraceSource} that walks the current thread's stack and reports the first frame outside the logger.
 * <p>Frames from {@link TagLogger}, {@link BoundTagLogger}, this class and any extra facade classes are skipped, as
 * are JDK frames ({@code java.*}, {@code jdk.*}) so that {@code names.forEach(bound)} reports the caller of
 * {@code forEach}.
 * Missing file or line information (e.g., classes compiled without debug info) renders as empty fields.</p>
 *
 * @since 0.1.0
 */
public final class StackWalkerTraceSource implements TraceSource {
  private static final List<String> JDK_PREFIXES = List.of("java.", "jdk.");

  private final StackWalker walker = StackWalker.getInstance();
  private final Set<String> skipped;

  public StackWalkerTraceSource() {
    this(Set.of());
  }

  /**
   * Creates a source that additionally skips the named facade classes.
   *
   * @param facadeClasses fully qualified class names of wrappers around the logger
   */
  public StackWalkerTraceSource(Set<String> facadeClasses) {
    Set<String> names = new HashSet<>(Objects.requireNonNull(facadeClasses, "facadeClasses"));
    names.add(TagLogger.class.getName());
    names.add(BoundTagLogger.class.getName());
    names.add(StackWalkerTraceSource.class.getName());
    this.skipped = Set.copyOf(names);
  }

  @Override
  public TraceInfo capture() {
    Optional<StackWalker.StackFrame> frame;
    try {
      frame = walker.walk(frames -> frames
          .filter(f -> !isSkipped(f.getClassName()))
          .findFirst());
    } catch (RuntimeException ex) {
      throw new TraceCaptureException("stack walk failed", ex);
    }
    return frame.map(StackWalkerTraceSource::toTraceInfo).orElse(TraceInfo.unknown());
  }

  private boolean isSkipped(String className) {
    if (skipped.contains(className)) {
      return true;
    }
    for (String prefix : JDK_PREFIXES) {
      if (className.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  private static TraceInfo toTraceInfo(StackWalker.StackFrame frame) {
    String className = frame.getClassName();
    String simpleName = className.substring(className.lastIndexOf('.') + 1);
    return new TraceInfo(
        frame.getFileName(),
        frame.getLineNumber(),
        simpleName + "." + frame.getMethodName(),
        "");
  }
}

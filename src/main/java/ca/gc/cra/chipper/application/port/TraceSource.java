package ca.gc.cra.chipper.application.port;

import ca.gc.cra.chipper.domain.emission.TraceInfo;

/**
 * <strong>What:</strong> Optional capability that reports the call site of an emission.
 * <p><strong>Why:</strong> Call-site introspection depends on the runtime; keeping it behind a port lets deployments
 * stub it out without weakening routing or formatting.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.chipper.infrastructure.trace.StackWalkerTraceSource
 */
@FunctionalInterface
public interface TraceSource {
  /**
   * Captures the call site of the emission currently being dispatched.
   *
   * @return trace details; fields the runtime cannot supply are empty
   * @throws TraceCaptureException if introspection fails; callers degrade to {@link TraceInfo#unknown()}
   */
  TraceInfo capture();

  /** Source that never reports a call site. */
  TraceSource NONE = TraceInfo::unknown;
}

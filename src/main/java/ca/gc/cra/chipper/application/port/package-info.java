/**
 * Ports between the logger and the outside world: clock, call-site capture, sinks and metrics.
 * <p><strong>Role:</strong> Interfaces implemented by {@code infrastructure} adapters and by tests.</p>
 * <p><strong>Concurrency:</strong> Every port must tolerate concurrent emissions.</p>
 */
package ca.gc.cra.chipper.application.port;

/**
 * Application layer for tag-routed logging.
 * <p><strong>Role:</strong> Hosts the dispatcher and the ports it drives.</p>
 * <p><strong>Metrics:</strong> Emits {@code chipper.emit.*}, {@code chipper.handler.*}, {@code chipper.default.*}
 * and {@code chipper.trace.*} counters through {@link ca.gc.cra.chipper.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.chipper.application;

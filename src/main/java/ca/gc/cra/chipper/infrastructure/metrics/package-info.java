/**
 * Metrics adapters for {@link ca.gc.cra.chipper.application.port.MetricsPort}, backed by the OpenTelemetry SDK.
 * <p><strong>Metrics:</strong> Counter names match the port's keys ({@code chipper.handler.delivered}, ...).</p>
 */
package ca.gc.cra.chipper.infrastructure.metrics;

/**
 * Sink adapters for files and process streams.
 * <p><strong>Concurrency:</strong> Each sink serializes its own writes; {@link ca.gc.cra.chipper.infrastructure.target.LineSinks}
 * hands out one instance per destination.
 */
package ca.gc.cra.chipper.infrastructure.target;

/**
 * Infrastructure adapters implementing the application ports: sinks, clock, call-site capture and metrics.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe unless documented otherwise.</p>
 */
package ca.gc.cra.chipper.infrastructure;

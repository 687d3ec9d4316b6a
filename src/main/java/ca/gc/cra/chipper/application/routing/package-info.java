/**
 * Tag routing: handlers, targets and the {@link ca.gc.cra.chipper.application.routing.TagLogger} dispatcher.
 * <p><strong>Concurrency:</strong> Dispatch is synchronous; sinks serialize writes per destination.
 * <p><strong>Errors:</strong> Per-emission failures are isolated per handler and reported through SLF4J.
 *
 * @since 0.1.0
 */
package ca.gc.cra.chipper.application.routing;

/**
 * Command-line entry points: {@code chipper emit} routes a message through a logger definition and
 * {@code chipper render} previews one handler's output.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures diagnostics and delegates to the
 * configuration layer.</p>
 * <p>Diagnostics go to stderr through SLF4J; rendered lines and usage text go to stdout.</p>
 */
package ca.gc.cra.chipper.api;

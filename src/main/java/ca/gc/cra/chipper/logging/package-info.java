/**
 * Helpers for the library's own diagnostics channel (SLF4J over Logback).
 * <p><strong>Concurrency:</strong> Stateless helpers; level changes are meant for startup.
 *
 * @since 0.1.0
 */
package ca.gc.cra.chipper.logging;

/**
 * Call-site capture backed by {@link java.lang.StackWalker}.
 */
package ca.gc.cra.chipper.infrastructure.trace;

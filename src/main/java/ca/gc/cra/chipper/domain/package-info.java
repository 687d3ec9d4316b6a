/**
 * Domain model for tag-routed logging: tag sets, emissions and the prefix formatter.
 * <p><strong>Role:</strong> Pure types without I/O; the application layer drives them.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package ca.gc.cra.chipper.domain;

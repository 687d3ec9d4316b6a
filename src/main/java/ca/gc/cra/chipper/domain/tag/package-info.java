/**
 * Tag sets and the overlap rule that decides which handlers capture an emission.
 * <p><strong>Concurrency:</strong> Types are immutable and safe to share.
 * <p><strong>Errors:</strong> Malformed tokens raise {@link ca.gc.cra.chipper.domain.tag.InvalidTagException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.chipper.domain.tag;

/**
 * Validation helpers used while building handlers and parsing CLI arguments.
 * <p><strong>Observability:</strong> No direct logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.chipper.validation;

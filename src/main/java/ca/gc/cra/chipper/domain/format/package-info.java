/**
 * Three-stage prefix formatter: item templates, group templates and the line template.
 * <p><strong>Concurrency:</strong> Compiled formatters are immutable and shared across emitting threads.
 * <p><strong>Errors:</strong> {@link ca.gc.cra.chipper.domain.format.TemplateException} covers malformed templates,
 * unknown placeholders and unsupported strftime directives.
 *
 * @since 0.1.0
 */
package ca.gc.cra.chipper.domain.format;

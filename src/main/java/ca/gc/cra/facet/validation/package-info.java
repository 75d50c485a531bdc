/**
 * Validation helpers for CLI and configuration input.
 * <p><strong>Errors:</strong> Violations raise {@link java.lang.IllegalArgumentException} with the offending key in
 * the message so the CLI can print it verbatim.</p>
 *
 * @since FACET 0.1.0
 */
package ca.gc.cra.facet.validation;

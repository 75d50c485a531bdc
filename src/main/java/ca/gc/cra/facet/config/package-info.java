/**
 * Configuration aggregates for FACET command-line runs.
 * <p><strong>Role:</strong> Merges embedded defaults, an optional {@code facet.yaml}, and {@code key=value} CLI
 * overrides into an immutable {@link ca.gc.cra.facet.config.ExtractConfig}.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Errors:</strong> Invalid values raise {@link java.lang.IllegalArgumentException}; relies on
 * {@code ca.gc.cra.facet.validation} utilities.</p>
 */
package ca.gc.cra.facet.config;

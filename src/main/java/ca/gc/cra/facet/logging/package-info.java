/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound document text before emission.
 * <p><strong>Role:</strong> Cross-cutting support for the extractor and the command line.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Privacy:</strong> Document snippets are truncated so logs never carry whole inputs.
 *
 * @since FACET 0.1.0
 */
package ca.gc.cra.facet.logging;

/**
 * CLI entry points for FACET: {@code extract} writes entities as NDJSON and {@code patterns} prints the tier
 * table.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, merges configuration, configures
 * logging, and invokes the extractor.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 */
package ca.gc.cra.facet.api;

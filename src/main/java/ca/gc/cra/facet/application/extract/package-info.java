/**
 * Extraction core: tier-ordered span allocation, entity parsing, and result assembly.
 * <p><strong>Role:</strong> Application layer entry point ({@link ca.gc.cra.facet.application.extract.EntityExtractor})
 * that turns plain text into a position-ordered, conflict-free list of entities.</p>
 * <p><strong>Concurrency:</strong> All per-call state is local; one extractor instance may serve many threads.</p>
 * <p><strong>Metrics:</strong> Emits {@code extract.*} counters and latency through
 * {@link ca.gc.cra.facet.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.facet.application.extract;

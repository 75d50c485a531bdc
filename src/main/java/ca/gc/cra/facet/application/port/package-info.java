/**
 * <strong>Purpose:</strong> Ports the extraction use case reports through.
 * <p><strong>Pipeline role:</strong> Application boundary; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe; extraction may run on many threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.facet.application.port;

/**
 * Metrics adapters that bridge {@link ca.gc.cra.facet.application.port.MetricsPort} to OpenTelemetry or discard
 * updates.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code extract.*} namespace.</p>
 * <p><strong>Privacy:</strong> Only metric keys are exported, never document text.</p>
 */
package ca.gc.cra.facet.infrastructure.metrics;

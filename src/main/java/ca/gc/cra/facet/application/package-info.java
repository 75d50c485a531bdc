/**
 * Application layer orchestration for FACET extraction.
 * <p><strong>Role:</strong> Hosts the pattern library, the span allocator, and the extraction use case, plus
 * the ports they report through.</p>
 * <p><strong>Concurrency:</strong> The pattern library is immutable and shared; per-call state lives on the stack
 * of {@code extract}.</p>
 * <p><strong>Performance:</strong> Every pattern is validated at build time to fall within a linear-time regex
 * subset.</p>
 * <p><strong>Metrics:</strong> Emits the {@code extract.*} namespace.</p>
 */
package ca.gc.cra.facet.application;

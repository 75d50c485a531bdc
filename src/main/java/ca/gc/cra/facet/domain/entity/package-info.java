/**
 * Typed entity records produced by extraction.
 * <p>{@link ca.gc.cra.facet.domain.entity.Entity} is sealed over
 * {@link ca.gc.cra.facet.domain.entity.RangeEntity} and {@link ca.gc.cra.facet.domain.entity.ScalarEntity}.
 * Spans are half-open codepoint ranges into the original text.</p>
 */
package ca.gc.cra.facet.domain.entity;

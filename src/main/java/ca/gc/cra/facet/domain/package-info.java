/**
 * Core domain model for FACET text → spans → entities extraction.
 * <p><strong>Role:</strong> Domain layer values describing extracted facts and the lexicons that read them,
 * without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Lexicon patterns are compiled once per class load.</p>
 * <p><strong>Metrics:</strong> Entity categories feed tagging on {@code extract.*} metrics.</p>
 */
package ca.gc.cra.facet.domain;

/**
 * Lexicons that read numbers, units, calendar dates, and clock times out of matched text.
 * <p><strong>Role:</strong> Leaf domain utilities consumed by the entity parser and the pattern fragments.</p>
 * <p><strong>Concurrency:</strong> Stateless; all patterns are compiled once and shared.</p>
 * <p><strong>Errors:</strong> Lookups return empty results instead of throwing.</p>
 */
package ca.gc.cra.facet.domain.lexicon;

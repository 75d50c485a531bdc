/**
 * Category pattern library: five priority tiers of regex definitions per category.
 * <p><strong>Role:</strong> Build-time compilation and validation of built-in and user-supplied patterns into one
 * immutable, tier-ordered table shared by every extraction call.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.facet.application.patterns.PatternLibrary} and
 * {@link ca.gc.cra.facet.application.patterns.PatternDefinition} are immutable; builders are single-threaded.</p>
 * <p><strong>Errors:</strong> Broken patterns surface as
 * {@link ca.gc.cra.facet.application.patterns.PatternCompilationException} at build time, never during extraction.</p>
 */
package ca.gc.cra.facet.application.patterns;

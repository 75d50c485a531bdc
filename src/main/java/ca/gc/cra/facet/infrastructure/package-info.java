/**
 * Adapters that implement FACET application ports against third-party libraries.
 */
package ca.gc.cra.facet.infrastructure;

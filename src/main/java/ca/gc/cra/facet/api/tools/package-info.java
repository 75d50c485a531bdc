/**
 * Operator tools that inspect FACET configuration without processing documents.
 */
package ca.gc.cra.facet.api.tools;

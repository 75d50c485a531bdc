/**
 * JSON export of extracted entities using the Jackson streaming API.
 * <p><strong>Concurrency:</strong> Writers are stateless apart from a shared, thread-safe {@code JsonFactory}.</p>
 */
package ca.gc.cra.facet.infrastructure.json;

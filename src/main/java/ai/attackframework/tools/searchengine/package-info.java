/**
 * Root package for the OpenSearch description library.
 *
 * <p>Hosts the engine model ({@link ai.attackframework.tools.searchengine.OpenSearchEngine}) and the
 * small value types it exposes. Reading documents, expanding templates, fetching suggestions and
 * loading images live in subpackages; nothing here performs I/O.</p>
 */
package ai.attackframework.tools.searchengine;

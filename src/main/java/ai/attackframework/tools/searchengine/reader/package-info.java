/**
 * Reader and writer for OpenSearch 1.1 description documents.
 */
package ai.attackframework.tools.searchengine.reader;

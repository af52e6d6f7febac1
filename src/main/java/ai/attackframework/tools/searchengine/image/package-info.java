/**
 * Lazy loading and decoding of engine images.
 */
package ai.attackframework.tools.searchengine.image;

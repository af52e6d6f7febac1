/**
 * Transport abstraction and its Apache HttpClient 5 implementation.
 *
 * <p>Callbacks fire on the client's I/O threads; components in this library re-post them to
 * their owner's event loop before touching state.</p>
 */
package ai.attackframework.tools.searchengine.net;

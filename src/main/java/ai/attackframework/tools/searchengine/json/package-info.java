/**
 * JSON import/export of engine descriptions.
 *
 * <p>Pure data/IO helpers with no UI dependencies; safe to use from background threads.</p>
 */
package ai.attackframework.tools.searchengine.json;

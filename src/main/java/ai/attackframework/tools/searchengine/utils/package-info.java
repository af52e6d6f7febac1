/**
 * Common utilities shared across the library.
 *
 * <p>Includes logging ({@link ai.attackframework.tools.searchengine.utils.Logger}) and the version
 * accessor. These classes have no UI dependencies; callers may use them from any thread.</p>
 */
package ai.attackframework.tools.searchengine.utils;

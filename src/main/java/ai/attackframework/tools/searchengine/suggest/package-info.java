/**
 * Search suggestion requests and response parsing.
 */
package ai.attackframework.tools.searchengine.suggest;

package ai.attackframework.tools.searchengine;

/**
 * Receives search requests built by {@link OpenSearchEngine#requestSearchResults(String)}.
 *
 * <p>The engine only constructs the request; opening it (in a browser tab, an HTTP
 * client, a log) is up to the implementation.</p>
 */
@FunctionalInterface
public interface SearchDelegate {
    void performSearchRequest(SearchRequest request);
}

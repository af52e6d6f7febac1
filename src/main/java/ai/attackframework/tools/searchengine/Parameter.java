package ai.attackframework.tools.searchengine;

/**
 * One request parameter of a search engine URL.
 *
 * <p>The value is a template and may contain the same tokens as the URL template
 * (for example {@code {searchTerms}}). Parameters are kept in an ordered list;
 * duplicate keys are allowed.</p>
 */
public record Parameter(String key, String value) {
    public Parameter {
        key   = key == null ? "" : key;
        value = value == null ? "" : value;
    }
}

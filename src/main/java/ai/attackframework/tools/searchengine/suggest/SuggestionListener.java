package ai.attackframework.tools.searchengine.suggest;

import java.util.List;

/** Receives the suggestion list of a completed request. */
@FunctionalInterface
public interface SuggestionListener {
    void onSuggestions(List<String> suggestions);
}

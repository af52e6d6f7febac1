package ai.attackframework.tools.searchengine.suggest;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses OpenSearch suggestion responses ({@code application/x-suggestions+json}).
 *
 * <p>Accepted shape: {@code ["query", ["s1", "s2", ...], ...]}. Element 0 is ignored and
 * elements after index 1 (descriptions, URLs) are not used. Anything else, including a
 * second element that holds a non-string, is rejected.</p>
 */
public final class SuggestionResponseParser {

    // a body is exactly one JSON value; anything after it is an error
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private SuggestionResponseParser() {}

    /** Decodes {@code body} as UTF-8 and parses it. */
    public static Optional<List<String>> parse(byte[] body) {
        if (body == null || body.length == 0) return Optional.empty();
        return parse(new String(body, StandardCharsets.UTF_8));
    }

    /**
     * Parses a response body.
     *
     * @param body raw response text; surrounding whitespace is ignored
     * @return the suggestions, or empty when the body does not have the expected shape
     */
    public static Optional<List<String>> parse(String body) {
        if (body == null) return Optional.empty();
        String trimmed = body.trim();
        if (trimmed.isEmpty() || !trimmed.startsWith("[") || !trimmed.endsWith("]")) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }

        if (root == null || !root.isArray() || root.size() < 2) return Optional.empty();
        JsonNode list = root.get(1);
        if (!list.isArray()) return Optional.empty();

        List<String> out = new ArrayList<>(list.size());
        for (JsonNode n : list) {
            if (!n.isTextual()) return Optional.empty();
            out.add(n.asText());
        }
        return Optional.of(List.copyOf(out));
    }
}

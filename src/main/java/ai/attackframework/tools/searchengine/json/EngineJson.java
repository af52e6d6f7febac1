package ai.attackframework.tools.searchengine.json;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.attackframework.tools.searchengine.OpenSearchEngine;
import ai.attackframework.tools.searchengine.Parameter;
import ai.attackframework.tools.searchengine.RequestMethod;

/**
 * JSON marshaling for storing engines, e.g. the engine list of a host application.
 * Produces compact JSON with deterministic field order (stable insertion order).
 *
 * <pre>
 * {"name":"..","description":"..","imageUrl":"..","tags":["..",".."],
 *  "search":{"template":"..","method":"get","parameters":[{"name":"q","value":"{searchTerms}"}]},
 *  "suggestions":{"template":"..","method":"get","parameters":[]}}
 * </pre>
 *
 * <p>The cached image is not stored; {@code imageUrl} is enough to load it again.</p>
 */
public final class EngineJson {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, false); // compact output

    private static final String LIT_TEMPLATE   = "template";
    private static final String LIT_METHOD     = "method";
    private static final String LIT_PARAMETERS = "parameters";
    private static final String LIT_SEARCH      = "search";
    private static final String LIT_SUGGESTIONS = "suggestions";

    private EngineJson() { }

    /** Dedicated runtime exception for engine JSON errors. */
    public static final class EngineJsonException extends RuntimeException {
        public EngineJsonException(String message, Throwable cause) { super(message, cause); }
    }

    /* ======================== BUILD ======================== */

    public static String toJson(OpenSearchEngine engine) {
        try {
            return MAPPER.writeValueAsString(toNode(engine));
        } catch (JsonProcessingException e) {
            throw new EngineJsonException("JSON serialization error", e);
        }
    }

    /** Serializes several engines as a JSON array, in the given order. */
    public static String toJson(List<OpenSearchEngine> engines) {
        ArrayNode arr = MAPPER.createArrayNode();
        if (engines != null) {
            for (OpenSearchEngine e : engines) {
                if (e != null) arr.add(toNode(e));
            }
        }
        try {
            return MAPPER.writeValueAsString(arr);
        } catch (JsonProcessingException e) {
            throw new EngineJsonException("JSON serialization error", e);
        }
    }

    private static ObjectNode toNode(OpenSearchEngine engine) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("name", engine.getName());
        root.put("description", engine.getDescription());
        root.put("imageUrl", engine.getImageUrl());

        ArrayNode tags = root.putArray("tags");
        for (String t : engine.getTags()) tags.add(t);

        putUrl(root.putObject(LIT_SEARCH), engine.getSearchUrlTemplate(),
                engine.getSearchMethod(), engine.getSearchParameters());
        putUrl(root.putObject(LIT_SUGGESTIONS), engine.getSuggestionsUrlTemplate(),
                engine.getSuggestionsMethod(), engine.getSuggestionsParameters());
        return root;
    }

    private static void putUrl(ObjectNode node, String template, RequestMethod method, List<Parameter> parameters) {
        node.put(LIT_TEMPLATE, template);
        node.put(LIT_METHOD, method.wireName());
        ArrayNode arr = node.putArray(LIT_PARAMETERS);
        for (Parameter p : parameters) {
            ObjectNode pn = arr.addObject();
            pn.put("name", p.key());
            pn.put("value", p.value());
        }
    }

    /* ======================== PARSE ======================== */

    /**
     * Parses one engine. Missing or mistyped fields keep the engine defaults.
     *
     * @throws IOException when {@code json} is not well-formed JSON
     */
    public static OpenSearchEngine parse(String json) throws IOException {
        return fromNode(MAPPER.readTree(json));
    }

    /**
     * Parses a JSON array of engines. Non-object entries are skipped; a single object is
     * accepted as a one-element list.
     */
    public static List<OpenSearchEngine> parseList(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        List<OpenSearchEngine> out = new ArrayList<>();
        if (root != null && root.isArray()) {
            for (JsonNode n : root) {
                if (n.isObject()) out.add(fromNode(n));
            }
        } else if (root != null && root.isObject()) {
            out.add(fromNode(root));
        }
        return out;
    }

    /* ----------------------- parse helpers ----------------------- */

    private static OpenSearchEngine fromNode(JsonNode root) {
        OpenSearchEngine engine = new OpenSearchEngine();
        if (root == null || !root.isObject()) return engine;

        engine.setName(text(root, "name"));
        engine.setDescription(text(root, "description"));
        engine.setImageUrl(text(root, "imageUrl"));

        List<String> tags = new ArrayList<>();
        JsonNode tn = root.path("tags");
        if (tn.isArray()) {
            for (JsonNode n : tn) {
                if (n.isTextual()) tags.add(n.asText());
            }
        }
        engine.setTags(tags);

        JsonNode search = root.path(LIT_SEARCH);
        engine.setSearchUrlTemplate(text(search, LIT_TEMPLATE));
        engine.setSearchMethod(text(search, LIT_METHOD));
        engine.setSearchParameters(parameters(search));

        JsonNode suggestions = root.path(LIT_SUGGESTIONS);
        engine.setSuggestionsUrlTemplate(text(suggestions, LIT_TEMPLATE));
        engine.setSuggestionsMethod(text(suggestions, LIT_METHOD));
        engine.setSuggestionsParameters(parameters(suggestions));
        return engine;
    }

    private static List<Parameter> parameters(JsonNode url) {
        List<Parameter> out = new ArrayList<>();
        JsonNode arr = url.path(LIT_PARAMETERS);
        if (arr.isArray()) {
            for (JsonNode n : arr) {
                String key = text(n, "name");
                if (!key.isEmpty()) out.add(new Parameter(key, text(n, "value")));
            }
        }
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isTextual() ? v.asText() : "";
    }
}

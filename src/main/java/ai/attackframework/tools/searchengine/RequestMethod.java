package ai.attackframework.tools.searchengine;

import java.util.Locale;
import java.util.Optional;

/** HTTP method used for search or suggestion requests. */
public enum RequestMethod {
    GET, POST;

    /** Lower-case name as it appears in description documents. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a method name case-insensitively.
     *
     * @param raw method attribute value; may be {@code null}
     * @return the method, or empty when the value is blank or not get/post
     */
    public static Optional<RequestMethod> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RequestMethod m : values()) {
            if (m.wireName().equals(normalized)) return Optional.of(m);
        }
        return Optional.empty();
    }
}

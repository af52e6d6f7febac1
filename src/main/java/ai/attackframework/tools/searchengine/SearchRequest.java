package ai.attackframework.tools.searchengine;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Request artifact built from an engine for one search term.
 *
 * <p>{@code body} is empty for GET requests. For POST it carries the
 * {@code key=value&...} form built from the engine parameters.</p>
 */
public record SearchRequest(URI uri, RequestMethod method, byte[] body) {

    public SearchRequest {
        Objects.requireNonNull(uri, "uri");
        method = method == null ? RequestMethod.GET : method;
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    /** Body decoded as UTF-8. */
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchRequest other)) return false;
        return uri.equals(other.uri) && method == other.method && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uri, method, Arrays.hashCode(body));
    }

    @Override
    public String toString() {
        return method.name() + " " + uri
                + (body.length == 0 ? "" : " [" + bodyAsString() + "]");
    }
}

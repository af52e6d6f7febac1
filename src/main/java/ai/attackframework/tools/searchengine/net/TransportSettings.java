package ai.attackframework.tools.searchengine.net;

import java.time.Duration;

/**
 * Settings for {@link HttpClient5Transport}.
 *
 * @param connectTimeout  TCP connect timeout
 * @param responseTimeout socket inactivity timeout while waiting for the response
 * @param userAgent       User-Agent header; blank means "searchengine/&lt;version&gt;"
 */
public record TransportSettings(Duration connectTimeout, Duration responseTimeout, String userAgent) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(10);

    public TransportSettings {
        connectTimeout  = positiveOr(connectTimeout, DEFAULT_CONNECT_TIMEOUT);
        responseTimeout = positiveOr(responseTimeout, DEFAULT_RESPONSE_TIMEOUT);
        userAgent       = userAgent == null ? "" : userAgent.trim();
    }

    /** Default timeouts and User-Agent. */
    public static TransportSettings defaults() {
        return new TransportSettings(null, null, null);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return (value == null || value.isNegative() || value.isZero()) ? fallback : value;
    }
}

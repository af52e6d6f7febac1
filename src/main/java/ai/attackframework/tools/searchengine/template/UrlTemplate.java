package ai.attackframework.tools.searchengine.template;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.attackframework.tools.searchengine.Parameter;
import ai.attackframework.tools.searchengine.RequestMethod;
import ai.attackframework.tools.searchengine.utils.Logger;

/**
 * Expands OpenSearch URL templates for a search term.
 *
 * <p>Recognized tokens and their values:</p>
 * <ul>
 *   <li>{@code {count}} - {@code 20}</li>
 *   <li>{@code {startIndex}}, {@code {startPage}} - {@code 0}</li>
 *   <li>{@code {language}} - locale as an RFC 3066 tag</li>
 *   <li>{@code {inputEncoding}}, {@code {outputEncoding}} - {@code UTF-8}</li>
 *   <li>{@code {source}}, {@code {source?}}, {@code {prefix:source}}, {@code {prefix:source?}} - application name</li>
 *   <li>{@code {searchTerms}} - the term, percent-encoded</li>
 * </ul>
 * <p>Any other {@code {...}} token is left as is. Tokens are resolved in one left-to-right pass,
 * so text produced by a substitution is never scanned again.</p>
 */
public final class UrlTemplate {

    static final String COUNT = "20";
    static final String START_INDEX = "0";
    static final String START_PAGE = "0";
    static final String ENCODING = "UTF-8";

    private static final Pattern TOKEN = Pattern.compile("\\{([^{}]*)\\}");
    private static final Pattern SOURCE = Pattern.compile("(?:[^}]*:)?source\\??");

    private final TemplateContext context;

    public UrlTemplate(TemplateContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /** Template engine bound to {@link TemplateContext#defaults()}. */
    public static UrlTemplate withDefaults() {
        return new UrlTemplate(TemplateContext.defaults());
    }

    public TemplateContext context() {
        return context;
    }

    /**
     * Substitutes all recognized tokens of {@code template}.
     *
     * @param term     search term supplied by the user
     * @param template URL or parameter-value template
     * @return expanded text; unrecognized tokens are kept verbatim
     */
    public String expand(String term, String template) {
        if (template == null || template.isEmpty()) return "";
        Matcher m = TOKEN.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 32);
        int last = 0;
        while (m.find()) {
            out.append(template, last, m.start());
            String replacement = resolve(m.group(1), term);
            out.append(replacement != null ? replacement : m.group());
            last = m.end();
        }
        out.append(template, last, template.length());
        return out.toString();
    }

    private String resolve(String token, String term) {
        switch (token) {
            case "count":          return COUNT;
            case "startIndex":     return START_INDEX;
            case "startPage":      return START_PAGE;
            case "language":       return context.languageTag();
            case "inputEncoding":  return ENCODING;
            case "outputEncoding": return ENCODING;
            case "searchTerms":    return UriEncoding.encodeTerm(term);
            default:
                return SOURCE.matcher(token).matches() ? context.applicationName() : null;
        }
    }

    /**
     * Builds the request URL for one term.
     *
     * <p>For GET every parameter is appended to the query string with its value expanded.
     * For POST the expanded template is returned unchanged; parameters travel in the body
     * (see {@link #postBody(List)}).</p>
     *
     * @return the URL, or empty when {@code template} is empty (no template configured) or
     *         the expansion cannot be parsed as a URI
     */
    public Optional<URI> buildUrl(String term, String template, List<Parameter> parameters, RequestMethod method) {
        if (template == null || template.isEmpty()) return Optional.empty();

        String base = UriEncoding.lenient(expand(term, template));
        if (method != RequestMethod.POST && parameters != null && !parameters.isEmpty()) {
            base = appendQuery(base, term, parameters);
        }

        try {
            return Optional.of(URI.create(base));
        } catch (IllegalArgumentException e) {
            Logger.logDebug("[Template] Expanded URL is not a valid URI: " + base + " (" + e.getMessage() + ")");
            return Optional.empty();
        }
    }

    /**
     * Joins parameters as {@code key=value&key=value} for a POST body.
     *
     * <p>Values are used literally and are not template-expanded, unlike GET query
     * parameters. Parameters with an empty key are skipped.</p>
     */
    public static String postBody(List<Parameter> parameters) {
        if (parameters == null || parameters.isEmpty()) return "";
        StringJoiner body = new StringJoiner("&");
        for (Parameter p : parameters) {
            if (p != null && !p.key().isEmpty()) {
                body.add(p.key() + "=" + p.value());
            }
        }
        return body.toString();
    }

    private String appendQuery(String base, String term, List<Parameter> parameters) {
        String fragment = "";
        int hash = base.indexOf('#');
        if (hash >= 0) {
            fragment = base.substring(hash);
            base = base.substring(0, hash);
        }

        StringBuilder url = new StringBuilder(base);
        boolean hasQuery = base.indexOf('?') >= 0;
        for (Parameter p : parameters) {
            if (p == null || p.key().isEmpty()) continue;
            if (!hasQuery) {
                url.append('?');
                hasQuery = true;
            } else if (url.charAt(url.length() - 1) != '?' && url.charAt(url.length() - 1) != '&') {
                url.append('&');
            }
            url.append(UriEncoding.queryComponent(p.key()))
               .append('=')
               .append(UriEncoding.queryComponent(expand(term, p.value())));
        }
        return url.append(fragment).toString();
    }
}

package ai.attackframework.tools.searchengine;

import java.awt.image.BufferedImage;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import ai.attackframework.tools.searchengine.template.UrlTemplate;
import ai.attackframework.tools.searchengine.utils.Logger;

/**
 * A single search engine described in the OpenSearch 1.1 format.
 *
 * <p>Plain mutable model: it is filled by {@link ai.attackframework.tools.searchengine.reader.OpenSearchReader}
 * or programmatically, and consumed by the URL builders below, by
 * {@link ai.attackframework.tools.searchengine.suggest.SuggestionRequestManager} and by
 * {@link ai.attackframework.tools.searchengine.image.ImageLoader}. The engine holds no
 * references to those components.</p>
 *
 * <p>An engine is valid when it has a name and a search URL template. Validity is not
 * enforced; callers check {@link #isValid()} before building URLs.</p>
 *
 * <p>Not thread-safe. Use from the thread that owns it.</p>
 */
public class OpenSearchEngine implements Comparable<OpenSearchEngine> {

    private String name = "";
    private String description = "";

    private String imageUrl = "";
    private BufferedImage image;

    private Set<String> tags = new LinkedHashSet<>();

    private String searchUrlTemplate = "";
    private List<Parameter> searchParameters = List.of();
    private RequestMethod searchMethod = RequestMethod.GET;

    private String suggestionsUrlTemplate = "";
    private List<Parameter> suggestionsParameters = List.of();
    private RequestMethod suggestionsMethod = RequestMethod.GET;

    private UrlTemplate urlTemplate = UrlTemplate.withDefaults();
    private SearchDelegate delegate;

    public String getName() { return name; }

    public void setName(String name) { this.name = safe(name); }

    public String getDescription() { return description; }

    public void setDescription(String description) { this.description = safe(description); }

    public String getImageUrl() { return imageUrl; }

    /**
     * Sets the image location. A different URL drops the cached image so the next
     * {@code ImageLoader.image()} call fetches again.
     */
    public void setImageUrl(String imageUrl) {
        String url = safe(imageUrl);
        if (!url.equals(this.imageUrl)) {
            this.image = null;
        }
        this.imageUrl = url;
    }

    /** Cached decoded image, or {@code null} when none has been loaded or set. */
    public BufferedImage getImage() { return image; }

    /** Replaces the cached image without touching {@link #getImageUrl()}. */
    public void setImage(BufferedImage image) { this.image = image; }

    /** Keywords, without duplicates. The returned set is a read-only view. */
    public Set<String> getTags() { return Collections.unmodifiableSet(tags); }

    public void setTags(Collection<String> tags) {
        LinkedHashSet<String> copy = new LinkedHashSet<>();
        if (tags != null) {
            for (String t : tags) {
                if (t != null && !t.isEmpty()) copy.add(t);
            }
        }
        this.tags = copy;
    }

    public String getSearchUrlTemplate() { return searchUrlTemplate; }

    public void setSearchUrlTemplate(String searchUrlTemplate) { this.searchUrlTemplate = safe(searchUrlTemplate); }

    public List<Parameter> getSearchParameters() { return searchParameters; }

    public void setSearchParameters(List<Parameter> parameters) { this.searchParameters = copy(parameters); }

    public RequestMethod getSearchMethod() { return searchMethod; }

    public void setSearchMethod(RequestMethod method) {
        if (method != null) this.searchMethod = method;
    }

    /**
     * Sets the search method from its name, case-insensitively.
     * Values other than {@code get}/{@code post} are ignored.
     */
    public void setSearchMethod(String method) {
        RequestMethod.parse(method).ifPresent(m -> this.searchMethod = m);
    }

    public String getSuggestionsUrlTemplate() { return suggestionsUrlTemplate; }

    public void setSuggestionsUrlTemplate(String suggestionsUrlTemplate) {
        this.suggestionsUrlTemplate = safe(suggestionsUrlTemplate);
    }

    public List<Parameter> getSuggestionsParameters() { return suggestionsParameters; }

    public void setSuggestionsParameters(List<Parameter> parameters) { this.suggestionsParameters = copy(parameters); }

    public RequestMethod getSuggestionsMethod() { return suggestionsMethod; }

    public void setSuggestionsMethod(RequestMethod method) {
        if (method != null) this.suggestionsMethod = method;
    }

    /** Name-based variant of {@link #setSuggestionsMethod(RequestMethod)}; unknown names are ignored. */
    public void setSuggestionsMethod(String method) {
        RequestMethod.parse(method).ifPresent(m -> this.suggestionsMethod = m);
    }

    /** True when a suggestions URL template is configured. */
    public boolean providesSuggestions() {
        return !suggestionsUrlTemplate.isEmpty();
    }

    public boolean isValid() {
        return !name.isEmpty() && !searchUrlTemplate.isEmpty();
    }

    public UrlTemplate getUrlTemplate() { return urlTemplate; }

    /** Replaces the template engine, e.g. to pin the locale or application name. */
    public void setUrlTemplate(UrlTemplate urlTemplate) {
        this.urlTemplate = Objects.requireNonNull(urlTemplate, "urlTemplate");
    }

    public SearchDelegate getDelegate() { return delegate; }

    public void setDelegate(SearchDelegate delegate) { this.delegate = delegate; }

    // -------- URL building --------

    /** Search URL for {@code term}; empty when no search template is configured. */
    public Optional<URI> searchUrl(String term) {
        return urlTemplate.buildUrl(term, searchUrlTemplate, searchParameters, searchMethod);
    }

    /** Suggestions URL for {@code term}; empty when no suggestions template is configured. */
    public Optional<URI> suggestionsUrl(String term) {
        return urlTemplate.buildUrl(term, suggestionsUrlTemplate, suggestionsParameters, suggestionsMethod);
    }

    /** Complete search request (URL, method, body) for {@code term}. */
    public Optional<SearchRequest> searchRequest(String term) {
        return searchUrl(term).map(uri -> toRequest(uri, searchMethod, searchParameters));
    }

    /** Complete suggestions request (URL, method, body) for {@code term}. */
    public Optional<SearchRequest> suggestionsRequest(String term) {
        return suggestionsUrl(term).map(uri -> toRequest(uri, suggestionsMethod, suggestionsParameters));
    }

    /**
     * Builds the search request for {@code term} and hands it to the installed
     * {@link SearchDelegate}. Does nothing for an empty term, an invalid engine or
     * when no delegate is installed.
     */
    public void requestSearchResults(String term) {
        if (term == null || term.isEmpty() || !isValid()) return;
        if (delegate == null) {
            Logger.logDebug("[Search] No delegate installed for engine '" + name + "'");
            return;
        }
        searchRequest(term).ifPresent(delegate::performSearchRequest);
    }

    private static SearchRequest toRequest(URI uri, RequestMethod method, List<Parameter> parameters) {
        byte[] body = method == RequestMethod.POST
                ? UrlTemplate.postBody(parameters).getBytes(StandardCharsets.UTF_8)
                : new byte[0];
        return new SearchRequest(uri, method, body);
    }

    // -------- identity --------

    /**
     * Engines are equal when their name, description, image URL, URL templates and
     * parameter lists match. Methods, tags and the cached image do not take part.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OpenSearchEngine other)) return false;
        return name.equals(other.name)
                && description.equals(other.description)
                && imageUrl.equals(other.imageUrl)
                && searchUrlTemplate.equals(other.searchUrlTemplate)
                && suggestionsUrlTemplate.equals(other.suggestionsUrlTemplate)
                && searchParameters.equals(other.searchParameters)
                && suggestionsParameters.equals(other.suggestionsParameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, imageUrl, searchUrlTemplate, suggestionsUrlTemplate,
                searchParameters, suggestionsParameters);
    }

    /** Orders engines by name. Not consistent with {@link #equals(Object)}. */
    @Override
    public int compareTo(OpenSearchEngine other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return "OpenSearchEngine{name='" + name + "', search='" + searchUrlTemplate
                + "', suggestions='" + suggestionsUrlTemplate + "'}";
    }

    private static String safe(String s) { return s == null ? "" : s; }

    private static List<Parameter> copy(List<Parameter> parameters) {
        if (parameters == null || parameters.isEmpty()) return List.of();
        List<Parameter> out = new ArrayList<>(parameters.size());
        for (Parameter p : parameters) {
            if (p != null) out.add(p);
        }
        return List.copyOf(out);
    }
}

package ai.attackframework.tools.searchengine;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ai.attackframework.tools.searchengine.template.TemplateContext;
import ai.attackframework.tools.searchengine.template.UrlTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class OpenSearchEngineTest {

    private OpenSearchEngine engine;

    @BeforeEach
    void setUp() {
        engine = new OpenSearchEngine();
        engine.setUrlTemplate(new UrlTemplate(TemplateContext.of(Locale.US, "TestApp")));
    }

    @Test
    void validity_needsNameAndSearchTemplate() {
        assertThat(engine.isValid()).isFalse();
        engine.setName("Example");
        assertThat(engine.isValid()).isFalse();
        engine.setSearchUrlTemplate("http://example.com/?q={searchTerms}");
        assertThat(engine.isValid()).isTrue();
        assertThat(engine.providesSuggestions()).isFalse();
        engine.setSuggestionsUrlTemplate("http://example.com/s");
        assertThat(engine.providesSuggestions()).isTrue();
    }

    @Test
    void nullSetters_storeEmptyValues() {
        engine.setName(null);
        engine.setDescription(null);
        engine.setSearchParameters(null);
        engine.setTags(null);

        assertThat(engine.getName()).isEmpty();
        assertThat(engine.getDescription()).isEmpty();
        assertThat(engine.getSearchParameters()).isEmpty();
        assertThat(engine.getTags()).isEmpty();
    }

    @Test
    void methodNames_areCaseInsensitive_andUnknownNamesIgnored() {
        engine.setSearchMethod("PoSt");
        assertThat(engine.getSearchMethod()).isEqualTo(RequestMethod.POST);
        engine.setSearchMethod("put");
        assertThat(engine.getSearchMethod()).isEqualTo(RequestMethod.POST);
        engine.setSuggestionsMethod("post");
        engine.setSuggestionsMethod("GET");
        assertThat(engine.getSuggestionsMethod()).isEqualTo(RequestMethod.GET);
    }

    @Test
    void tags_dropDuplicatesAndEmpties() {
        engine.setTags(List.of("web", "", "example", "web"));

        assertThat(engine.getTags()).containsExactly("web", "example");
    }

    @Test
    void parameterList_isCopied() {
        List<Parameter> params = new ArrayList<>(List.of(new Parameter("q", "{searchTerms}")));
        engine.setSearchParameters(params);
        params.add(new Parameter("x", "y"));

        assertThat(engine.getSearchParameters()).containsExactly(new Parameter("q", "{searchTerms}"));
    }

    @Test
    void changingImageUrl_dropsCachedImage() {
        engine.setImageUrl("http://example.com/a.png");
        engine.setImage(new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB));

        engine.setImageUrl("http://example.com/a.png");
        assertThat(engine.getImage()).isNotNull();

        engine.setImageUrl("http://example.com/b.png");
        assertThat(engine.getImage()).isNull();
    }

    @Test
    void searchRequest_get_hasNoBody() {
        engine.setName("Example");
        engine.setSearchUrlTemplate("http://example.com/search");
        engine.setSearchParameters(List.of(new Parameter("q", "{searchTerms}")));

        SearchRequest request = engine.searchRequest("a b").orElseThrow();

        assertThat(request.method()).isEqualTo(RequestMethod.GET);
        assertThat(request.uri().toString()).isEqualTo("http://example.com/search?q=a%20b");
        assertThat(request.body()).isEmpty();
    }

    @Test
    void searchRequest_post_carriesLiteralParameterBody() {
        engine.setName("Example");
        engine.setSearchUrlTemplate("http://example.com/search");
        engine.setSearchMethod(RequestMethod.POST);
        engine.setSearchParameters(List.of(new Parameter("q", "{searchTerms}"), new Parameter("b", "foo")));

        SearchRequest request = engine.searchRequest("term").orElseThrow();

        assertThat(request.uri().toString()).isEqualTo("http://example.com/search");
        assertThat(request.bodyAsString()).isEqualTo("q={searchTerms}&b=foo");
    }

    @Test
    void suggestionsUrl_isEmptyWithoutTemplate() {
        assertThat(engine.suggestionsUrl("x")).isEmpty();
        assertThat(engine.suggestionsRequest("x")).isEmpty();
    }

    @Test
    void requestSearchResults_handsRequestToDelegate() {
        engine.setName("Example");
        engine.setSearchUrlTemplate("http://example.com/?q={searchTerms}");
        List<SearchRequest> seen = new ArrayList<>();
        engine.setDelegate(seen::add);

        engine.requestSearchResults("java");

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).uri().toString()).isEqualTo("http://example.com/?q=java");
    }

    @Test
    void requestSearchResults_skipsEmptyTermAndInvalidEngine() {
        SearchDelegate delegate = mock(SearchDelegate.class);
        engine.setDelegate(delegate);
        engine.setSearchUrlTemplate("http://example.com/?q={searchTerms}");

        engine.requestSearchResults("java");
        engine.setName("Example");
        engine.requestSearchResults("");

        verify(delegate, never()).performSearchRequest(any());
    }

    @Test
    void requestSearchResults_withoutDelegate_isNoOp() {
        engine.setName("Example");
        engine.setSearchUrlTemplate("http://example.com/?q={searchTerms}");

        engine.requestSearchResults("java");

        assertThat(engine.getDelegate()).isNull();
    }

    @Test
    void equality_coversDescriptiveFields_notMethodsOrTags() {
        OpenSearchEngine a = sample();
        OpenSearchEngine b = sample();
        b.setSearchMethod(RequestMethod.POST);
        b.setTags(List.of("other"));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);

        b.setSuggestionsParameters(List.of(new Parameter("x", "y")));
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void compareTo_ordersByName() {
        OpenSearchEngine alpha = sample();
        alpha.setName("Alpha");
        OpenSearchEngine beta = sample();
        beta.setName("Beta");

        List<OpenSearchEngine> engines = new ArrayList<>(List.of(beta, alpha));
        engines.sort(null);

        assertThat(engines).containsExactly(alpha, beta);
    }

    private static OpenSearchEngine sample() {
        OpenSearchEngine e = new OpenSearchEngine();
        e.setName("Example");
        e.setDescription("Example search");
        e.setImageUrl("http://example.com/favicon.ico");
        e.setSearchUrlTemplate("http://example.com/?q={searchTerms}");
        e.setSuggestionsUrlTemplate("http://example.com/s?q={searchTerms}");
        return e;
    }
}

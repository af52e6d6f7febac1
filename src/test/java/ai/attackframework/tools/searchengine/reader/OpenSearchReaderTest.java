package ai.attackframework.tools.searchengine.reader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.junit.jupiter.api.Test;

import ai.attackframework.tools.searchengine.OpenSearchEngine;
import ai.attackframework.tools.searchengine.Parameter;
import ai.attackframework.tools.searchengine.RequestMethod;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Reads the fixture documents under {@code /opensearch} and checks the resulting engines.
 */
class OpenSearchReaderTest {

    private final OpenSearchReader reader = new OpenSearchReader();

    private OpenSearchEngine readResource(String name) throws IOException {
        try (InputStream in = OpenSearchReaderTest.class.getResourceAsStream("/opensearch/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return reader.read(in);
        }
    }

    @Test
    void wellFormedDescription_populatesAllFields() throws IOException {
        OpenSearchEngine engine = readResource("testfile1.xml");

        assertThat(reader.hasError()).isFalse();
        assertThat(engine.isValid()).isTrue();
        assertThat(engine.getName()).isEqualTo("Wikipedia (en)");
        assertThat(engine.getDescription()).isEqualTo("Full text search in the English Wikipedia");
        assertThat(engine.getSearchUrlTemplate()).isEqualTo("http://en.wikipedia.org/bar");
        assertThat(engine.getSuggestionsUrlTemplate()).isEqualTo("http://en.wikipedia.org/foo");
        assertThat(engine.getImageUrl()).isEqualTo("http://en.wikipedia.org/favicon.ico");
        assertThat(engine.getSearchMethod()).isEqualTo(RequestMethod.POST);
        assertThat(engine.getSuggestionsMethod()).isEqualTo(RequestMethod.GET);
        assertThat(engine.getSearchParameters()).isEmpty();
        assertThat(engine.getSuggestionsParameters()).isEmpty();
        assertThat(engine.getTags()).isEmpty();
        assertThat(engine.providesSuggestions()).isTrue();
    }

    @Test
    void urlWithoutTemplate_isSkipped_andEngineWithOnlySuggestionsIsInvalid() throws IOException {
        OpenSearchEngine engine = readResource("testfile2.xml");

        assertThat(reader.hasError()).isFalse();
        assertThat(engine.isValid()).isFalse();
        assertThat(engine.getName()).isEqualTo("Wikipedia (en)");
        assertThat(engine.getDescription()).isEmpty();
        assertThat(engine.getSearchUrlTemplate()).isEmpty();
        assertThat(engine.getSuggestionsUrlTemplate()).isEqualTo("http://en.wikipedia.org/foo");
        assertThat(engine.getImageUrl()).isEqualTo("http://en.wikipedia.org/favicon.ico");
        assertThat(engine.getSearchMethod()).isEqualTo(RequestMethod.GET);
    }

    @Test
    void parameters_keepOrder_dropIncompleteOnes_andIgnoreNestedUnknownElements() throws IOException {
        OpenSearchEngine engine = readResource("testfile3.xml");

        assertThat(engine.isValid()).isTrue();
        assertThat(engine.getName()).isEqualTo("GitHub");
        assertThat(engine.getDescription()).isEqualTo("Search GitHub");
        assertThat(engine.getSearchUrlTemplate()).isEqualTo("http://github.com/search");
        assertThat(engine.getSuggestionsUrlTemplate()).isEqualTo("http://github.com/suggestions");
        assertThat(engine.getImageUrl()).isEmpty();
        assertThat(engine.getSearchParameters()).containsExactly(
                new Parameter("q", "{searchTerms}"),
                new Parameter("b", "foo"));
        assertThat(engine.getSuggestionsParameters()).containsExactly(new Parameter("bar", "baz"));
        assertThat(engine.getSearchMethod()).isEqualTo(RequestMethod.GET);
        assertThat(engine.getSuggestionsMethod()).isEqualTo(RequestMethod.POST);
    }

    @Test
    void firstUrlOfEachTypeWins_andUnknownMethodFallsBackToGet() throws IOException {
        OpenSearchEngine engine = readResource("testfile4.xml");

        assertThat(reader.hasError()).isFalse();
        assertThat(engine.isValid()).isTrue();
        assertThat(engine.getName()).isEqualTo("Google");
        assertThat(engine.getDescription()).isEqualTo("Google Web Search");
        assertThat(engine.getSearchUrlTemplate()).isEqualTo("http://www.google.com/search?bar");
        assertThat(engine.getSuggestionsUrlTemplate()).isEqualTo("http://suggestqueries.google.com/complete/foo");
        assertThat(engine.getImageUrl()).isEqualTo("http://www.google.com/favicon.ico");
        assertThat(engine.getSearchParameters()).isEmpty();
        assertThat(engine.getSuggestionsParameters()).isEmpty();
        assertThat(engine.getSearchMethod()).isEqualTo(RequestMethod.GET);
        assertThat(engine.getSuggestionsMethod()).isEqualTo(RequestMethod.GET);
    }

    @Test
    void wrongNamespace_raisesError_andLeavesEngineEmpty() throws IOException {
        OpenSearchEngine engine = readResource("testfile5.xml");

        assertThat(reader.hasError()).isTrue();
        assertThat(reader.errorString()).isEqualTo(OpenSearchReader.NOT_OPENSEARCH);
        assertThat(engine.isValid()).isFalse();
        assertThat(engine.getName()).isEmpty();
        assertThat(engine.getSearchUrlTemplate()).isEmpty();
    }

    @Test
    void wrongRootElement_raisesError() throws IOException {
        OpenSearchEngine engine = readResource("testfile6.xml");

        assertThat(reader.hasError()).isTrue();
        assertThat(engine.isValid()).isFalse();
        assertThat(engine.getName()).isEmpty();
    }

    @Test
    void nonXmlInput_raisesError_butStillReturnsEngine() throws IOException {
        OpenSearchEngine engine = readResource("testfile7.xml");

        assertThat(engine).isNotNull();
        assertThat(reader.hasError()).isTrue();
        assertThat(reader.errorString()).isNotBlank();
        assertThat(engine.isValid()).isFalse();
    }

    @Test
    void tags_areSplitOnSpaces_withoutEmptyTokens() throws IOException {
        OpenSearchEngine engine = readResource("testfile8.xml");

        assertThat(engine.isValid()).isTrue();
        assertThat(engine.getName()).isEqualTo("Web Search");
        assertThat(engine.getDescription()).isEqualTo("Use Example.com to search the Web.");
        assertThat(engine.getSearchUrlTemplate()).isEqualTo("http://example.com/");
        assertThat(engine.getSuggestionsUrlTemplate()).isEmpty();
        assertThat(engine.getTags()).containsExactlyInAnyOrder("example", "web");
    }

    @Test
    void nullOrEmptyInput_raisesError() {
        OpenSearchEngine fromNull = reader.read((String) null);
        assertThat(reader.hasError()).isTrue();
        assertThat(fromNull.isValid()).isFalse();

        OpenSearchEngine fromEmpty = reader.read("");
        assertThat(reader.hasError()).isTrue();
        assertThat(fromEmpty.isValid()).isFalse();
    }

    @Test
    void reader_isReusable_andResetsErrorBetweenDocuments() throws IOException {
        OpenSearchEngine bad = readResource("testfile6.xml");
        assertThat(reader.hasError()).isTrue();

        OpenSearchEngine good = readResource("testfile1.xml");
        assertThat(reader.hasError()).isFalse();
        assertThat(reader.errorString()).isEmpty();
        assertThat(good).isNotSameAs(bad);
        assertThat(good.isValid()).isTrue();
    }

    @Test
    void readsFromString_withEntitiesAndCdata() {
        String xml = """
                <OpenSearchDescription xmlns="http://a9.com/-/spec/opensearch/1.1/">
                  <ShortName>A &amp; B</ShortName>
                  <Description><![CDATA[Search <everything>]]></Description>
                  <Url type="text/html" template="http://ab.example/?q={searchTerms}&amp;lang={language}"/>
                </OpenSearchDescription>
                """;

        OpenSearchEngine engine = reader.read(xml);

        assertThat(reader.hasError()).isFalse();
        assertThat(engine.getName()).isEqualTo("A & B");
        assertThat(engine.getDescription()).isEqualTo("Search <everything>");
        assertThat(engine.getSearchUrlTemplate()).isEqualTo("http://ab.example/?q={searchTerms}&lang={language}");
    }

    @Test
    void duplicateParameterKeys_arePreserved() {
        String xml = """
                <OpenSearchDescription xmlns="http://a9.com/-/spec/opensearch/1.1/">
                  <ShortName>Dup</ShortName>
                  <Url type="text/html" template="http://dup.example/">
                    <Param name="q" value="{searchTerms}"/>
                    <Param name="q" value="again"/>
                  </Url>
                </OpenSearchDescription>
                """;

        OpenSearchEngine engine = reader.read(xml);

        assertThat(engine.getSearchParameters()).isEqualTo(List.of(
                new Parameter("q", "{searchTerms}"),
                new Parameter("q", "again")));
    }

    @Test
    void truncatedDocument_keepsWhatWasReadBeforeTheError() {
        String xml = "<OpenSearchDescription xmlns=\"http://a9.com/-/spec/opensearch/1.1/\">"
                + "<ShortName>Partial</ShortName><Url type=\"text/html\" template=\"http://p.example/\">";

        OpenSearchEngine engine = reader.read(xml);

        assertThat(reader.hasError()).isTrue();
        assertThat(engine.getName()).isEqualTo("Partial");
    }
}

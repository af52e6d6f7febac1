package ai.attackframework.tools.searchengine.suggest;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SuggestionResponseParserTest {

    @Test
    void secondElement_isTheSuggestionList() {
        assertThat(SuggestionResponseParser.parse("[\"term\",[\"a\",\"b\"]]")).contains(List.of("a", "b"));
    }

    @Test
    void trailingDescriptionAndUrlArrays_areIgnored() {
        String body = "[\"fire\",[\"firefox\",\"fire tv\"],[\"d1\",\"d2\"],[\"http://a\",\"http://b\"]]";
        assertThat(SuggestionResponseParser.parse(body)).contains(List.of("firefox", "fire tv"));
    }

    @Test
    void emptySuggestionList_isValid() {
        assertThat(SuggestionResponseParser.parse("[\"term\",[]]")).contains(List.of());
    }

    @Test
    void bytes_areDecodedAsUtf8() {
        byte[] body = "[\"ü\",[\"über\"]]".getBytes(StandardCharsets.UTF_8);
        assertThat(SuggestionResponseParser.parse(body)).contains(List.of("über"));
    }

    @Test
    void wrongShapes_areRejected() {
        assertThat(SuggestionResponseParser.parse("not json")).isEmpty();
        assertThat(SuggestionResponseParser.parse("[\"term\"]")).isEmpty();
        assertThat(SuggestionResponseParser.parse("{\"a\":[\"b\"]}")).isEmpty();
        assertThat(SuggestionResponseParser.parse("[\"term\",\"a\"]")).isEmpty();
        assertThat(SuggestionResponseParser.parse("[\"term\",[\"a\"")).isEmpty();
        assertThat(SuggestionResponseParser.parse("")).isEmpty();
        assertThat(SuggestionResponseParser.parse((String) null)).isEmpty();
        assertThat(SuggestionResponseParser.parse((byte[]) null)).isEmpty();
    }

    @Test
    void trailingContentAfterOuterArray_isRejected() {
        assertThat(SuggestionResponseParser.parse("[\"t\",[\"a\"]] [\"x\",[\"b\"]]")).isEmpty();
        assertThat(SuggestionResponseParser.parse("[\"t\",[\"a\"]]]")).isEmpty();
    }

    @Test
    void nonStringEntry_rejectsWholeResponse() {
        assertThat(SuggestionResponseParser.parse("[\"term\",[\"a\",3,\"b\"]]")).isEmpty();
        assertThat(SuggestionResponseParser.parse("[\"term\",[null]]")).isEmpty();
    }
}

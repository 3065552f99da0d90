package com.example.jsoncompare.infrastructure;

import com.example.jsoncompare.domain.InvalidJsonException;
import com.example.jsoncompare.domain.JsonValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class JacksonJsonValueParserTest {

    private final JacksonJsonValueParser parser = new JacksonJsonValueParser(new ObjectMapper());

    @Test
    void keepsDocumentKeyOrder() {
        JsonValue value = parser.parse("{\"zeta\": 1, \"alpha\": 2, \"mid\": 3}");

        assertThat(((JsonValue.ObjectValue) value).members().keySet())
                .containsExactly("zeta", "alpha", "mid");
    }

    @Test
    void convertsEveryNodeType() {
        JsonValue value = parser.parse("[\"s\", 10, 2.5, true, null, {}, []]");

        assertEquals(
                JsonValue.array(
                        List.of(
                                JsonValue.string("s"),
                                JsonValue.number(10),
                                JsonValue.number(2.5),
                                JsonValue.bool(true),
                                JsonValue.nullValue(),
                                JsonValue.object(Map.of()),
                                JsonValue.array())),
                value);
    }

    @Test
    void acceptsScalarDocuments() {
        assertEquals(JsonValue.string("x"), parser.parse("\"x\""));
        assertEquals(JsonValue.number(-3), parser.parse(" -3 "));
    }

    @Test
    void rejectsMalformedText() {
        assertThatThrownBy(() -> parser.parse("{\"a\": }"))
                .isInstanceOf(InvalidJsonException.class)
                .hasMessageStartingWith("Invalid JSON");
    }

    @Test
    void rejectsTrailingContent() {
        assertThatThrownBy(() -> parser.parse("{} {}")).isInstanceOf(InvalidJsonException.class);
    }

    @Test
    void rejectsBlankText() {
        assertThatThrownBy(() -> parser.parse("   "))
                .isInstanceOf(InvalidJsonException.class)
                .hasMessage("Document is empty");
    }
}

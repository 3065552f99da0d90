package com.example.jsoncompare.infrastructure;

import com.example.jsoncompare.application.JsonValueParser;
import com.example.jsoncompare.domain.InvalidJsonException;
import com.example.jsoncompare.domain.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads text with Jackson's tree model and converts the tree into {@link JsonValue}s. Object members keep
 * document order; every number becomes a double.
 */
@Component
public class JacksonJsonValueParser implements JsonValueParser {
    private final ObjectReader reader;

    public JacksonJsonValueParser(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public JsonValue parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidJsonException("Document is empty", null);
        }
        JsonNode node;
        try {
            node = reader.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new InvalidJsonException("Invalid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (node == null || node.isMissingNode()) {
            throw new InvalidJsonException("Document is empty", null);
        }
        return toValue(node);
    }

    private JsonValue toValue(JsonNode node) {
        switch (node.getNodeType()) {
            case OBJECT -> {
                Map<String, JsonValue> members = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    members.put(field.getKey(), toValue(field.getValue()));
                }
                return JsonValue.object(members);
            }
            case ARRAY -> {
                List<JsonValue> elements = new ArrayList<>(node.size());
                for (JsonNode element : node) {
                    elements.add(toValue(element));
                }
                return JsonValue.array(elements);
            }
            case STRING -> {
                return JsonValue.string(node.textValue());
            }
            case NUMBER -> {
                return JsonValue.number(node.doubleValue());
            }
            case BOOLEAN -> {
                return JsonValue.bool(node.booleanValue());
            }
            case NULL -> {
                return JsonValue.nullValue();
            }
            default -> throw new InvalidJsonException("Unsupported node type " + node.getNodeType(), null);
        }
    }
}

package com.example.jsoncompare.infrastructure;

import com.example.jsoncompare.application.JsonFormatter;
import com.example.jsoncompare.application.JsonValueParser;
import com.example.jsoncompare.domain.InvalidJsonException;
import com.example.jsoncompare.domain.JsonValue;
import com.example.jsoncompare.domain.JsonValue.ArrayValue;
import com.example.jsoncompare.domain.JsonValue.ObjectValue;
import com.example.jsoncompare.domain.JsonValue.StringValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pretty-prints JSON with sorted keys, {@code "key": value} separators and {@code {}} / {@code []} for
 * empty containers.
 */
@Component
public class JacksonJsonFormatter implements JsonFormatter {
    private static final Logger log = LogManager.getLogger(JacksonJsonFormatter.class);

    private final JsonValueParser parser;

    public JacksonJsonFormatter(JsonValueParser parser) {
        this.parser = parser;
    }

    @Override
    public String format(String text, int indentWidth) {
        if (text == null || text.isBlank()) {
            return text == null ? "" : text;
        }
        JsonValue value;
        try {
            value = parser.parse(text);
        } catch (InvalidJsonException ex) {
            log.debug("Leaving unparseable text unformatted: {}", ex.getMessage());
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() * 2);
        write(value, 0, " ".repeat(Math.max(0, indentWidth)), sb);
        return sb.toString();
    }

    private void write(JsonValue value, int level, String indent, StringBuilder sb) {
        if (value instanceof ObjectValue object) {
            Map<String, JsonValue> sorted = new TreeMap<>(object.members());
            if (sorted.isEmpty()) {
                sb.append("{}");
                return;
            }
            sb.append("{\n");
            int remaining = sorted.size();
            for (Map.Entry<String, JsonValue> member : sorted.entrySet()) {
                sb.append(indent.repeat(level + 1)).append(JsonValue.quote(member.getKey())).append(": ");
                write(member.getValue(), level + 1, indent, sb);
                sb.append(--remaining > 0 ? ",\n" : "\n");
            }
            sb.append(indent.repeat(level)).append('}');
        } else if (value instanceof ArrayValue array) {
            List<JsonValue> elements = array.elements();
            if (elements.isEmpty()) {
                sb.append("[]");
                return;
            }
            sb.append("[\n");
            for (int i = 0; i < elements.size(); i++) {
                sb.append(indent.repeat(level + 1));
                write(elements.get(i), level + 1, indent, sb);
                sb.append(i < elements.size() - 1 ? ",\n" : "\n");
            }
            sb.append(indent.repeat(level)).append(']');
        } else if (value instanceof StringValue string) {
            sb.append(JsonValue.quote(string.value()));
        } else {
            sb.append(value.asText());
        }
    }
}

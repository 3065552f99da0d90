package com.example.jsoncompare.domain;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Parsed JSON document. Equality is structural and type-sensitive; object equality ignores key order.
 */
public sealed interface JsonValue
        permits JsonValue.ObjectValue,
                JsonValue.ArrayValue,
                JsonValue.StringValue,
                JsonValue.NumberValue,
                JsonValue.BooleanValue,
                JsonValue.NullValue {

    String typeName();

    default boolean isContainer() {
        return this instanceof ObjectValue || this instanceof ArrayValue;
    }

    /** Compact JSON text with object keys sorted. */
    default String toCanonicalJson() {
        StringBuilder sb = new StringBuilder();
        writeCanonical(this, sb);
        return sb.toString();
    }

    /**
     * Text used for loose equality and hashing: strings unquoted, integral numbers without a decimal point,
     * containers as canonical JSON.
     */
    default String asText() {
        if (this instanceof StringValue s) {
            return s.value();
        }
        if (this instanceof NumberValue n) {
            return formatNumber(n.value());
        }
        if (this instanceof BooleanValue b) {
            return b.value() ? "true" : "false";
        }
        if (this instanceof NullValue) {
            return "null";
        }
        return toCanonicalJson();
    }

    /** Plain Java view (maps, lists, strings, numbers, booleans, null) used when writing responses. */
    @com.fasterxml.jackson.annotation.JsonValue
    Object toPlainObject();

    static ObjectValue object(Map<String, JsonValue> members) {
        return new ObjectValue(members);
    }

    static ArrayValue array(List<JsonValue> elements) {
        return new ArrayValue(elements);
    }

    static ArrayValue array(JsonValue... elements) {
        return new ArrayValue(List.of(elements));
    }

    static StringValue string(String value) {
        return new StringValue(value);
    }

    static NumberValue number(double value) {
        return new NumberValue(value);
    }

    static BooleanValue bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static NullValue nullValue() {
        return NullValue.INSTANCE;
    }

    static String formatNumber(double value) {
        if (!Double.isInfinite(value) && value == Math.rint(value)) {
            return String.format(Locale.ROOT, "%.0f", value);
        }
        return Double.toString(value);
    }

    static String quote(String value) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + "\"";
    }

    private static void writeCanonical(JsonValue value, StringBuilder sb) {
        if (value instanceof ObjectValue o) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, JsonValue> e : new TreeMap<>(o.members()).entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(quote(e.getKey())).append(':');
                writeCanonical(e.getValue(), sb);
            }
            sb.append('}');
        } else if (value instanceof ArrayValue a) {
            sb.append('[');
            for (int i = 0; i < a.elements().size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                writeCanonical(a.elements().get(i), sb);
            }
            sb.append(']');
        } else if (value instanceof StringValue s) {
            sb.append(quote(s.value()));
        } else {
            sb.append(value.asText());
        }
    }

    record ObjectValue(Map<String, JsonValue> members) implements JsonValue {
        public ObjectValue {
            Objects.requireNonNull(members, "members");
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }

        @Override
        public String typeName() {
            return "object";
        }

        @Override
        public Object toPlainObject() {
            Map<String, Object> plain = new LinkedHashMap<>();
            members.forEach((k, v) -> plain.put(k, v.toPlainObject()));
            return plain;
        }
    }

    record ArrayValue(List<JsonValue> elements) implements JsonValue {
        public ArrayValue {
            elements = List.copyOf(elements);
        }

        @Override
        public String typeName() {
            return "array";
        }

        @Override
        public Object toPlainObject() {
            List<Object> plain = new ArrayList<>(elements.size());
            for (JsonValue element : elements) {
                plain.add(element.toPlainObject());
            }
            return plain;
        }
    }

    record StringValue(String value) implements JsonValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public Object toPlainObject() {
            return value;
        }
    }

    record NumberValue(double value) implements JsonValue {
        public NumberValue {
            // -0.0 and 0.0 are the same JSON number
            value = value == 0.0 ? 0.0 : value;
        }

        @Override
        public String typeName() {
            return "number";
        }

        @Override
        public Object toPlainObject() {
            if (value != Math.rint(value) || Double.isInfinite(value)) {
                return value;
            }
            if (Math.abs(value) < 9.0E15) {
                return (long) value;
            }
            return new BigInteger(formatNumber(value));
        }
    }

    record BooleanValue(boolean value) implements JsonValue {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public String typeName() {
            return "boolean";
        }

        @Override
        public Object toPlainObject() {
            return value;
        }
    }

    record NullValue() implements JsonValue {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public String typeName() {
            return "null";
        }

        @Override
        public Object toPlainObject() {
            return null;
        }
    }
}

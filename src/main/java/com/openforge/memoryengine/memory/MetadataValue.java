package com.openforge.memoryengine.memory;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A single metadata value: a string, a number, or a list of strings.
 *
 * JSON form is the bare value ("abc", 3.5, ["a","b"]) so that records read back
 * from the cache or the record store look exactly like the caller's input.
 */
@JsonSerialize(using = MetadataValue.Serializer.class)
@JsonDeserialize(using = MetadataValue.Deserializer.class)
public sealed interface MetadataValue {

    record Text(String value) implements MetadataValue {}

    record Number(double value) implements MetadataValue {}

    record TextList(List<String> values) implements MetadataValue {
        public TextList {
            values = List.copyOf(values);
        }
    }

    static MetadataValue of(String value) {
        return new Text(value);
    }

    static MetadataValue of(double value) {
        return new Number(value);
    }

    static MetadataValue of(List<String> values) {
        return new TextList(values);
    }

    /** Text content, or null when this is not a {@link Text}. */
    default String asText() {
        return this instanceof Text t ? t.value() : null;
    }

    /** List content; a single {@link Text} is treated as a one-element list. */
    default List<String> asTextList() {
        if (this instanceof TextList l) return l.values();
        if (this instanceof Text t) return List.of(t.value());
        return List.of();
    }

    // ── Jackson ──────────────────────────────────────────────────────────────

    class Serializer extends JsonSerializer<MetadataValue> {
        @Override
        public void serialize(MetadataValue value, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            if (value instanceof Text t) {
                gen.writeString(t.value());
            } else if (value instanceof Number n) {
                gen.writeNumber(n.value());
            } else if (value instanceof TextList l) {
                gen.writeStartArray();
                for (String s : l.values()) gen.writeString(s);
                gen.writeEndArray();
            }
        }
    }

    class Deserializer extends JsonDeserializer<MetadataValue> {
        @Override
        public MetadataValue deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
                return new Number(p.getDoubleValue());
            }
            if (token == JsonToken.START_ARRAY) {
                List<String> values = new ArrayList<>();
                while (p.nextToken() != JsonToken.END_ARRAY) {
                    values.add(p.getValueAsString());
                }
                return new TextList(values);
            }
            if (token == JsonToken.VALUE_TRUE || token == JsonToken.VALUE_FALSE) {
                return new Text(String.valueOf(p.getBooleanValue()));
            }
            return new Text(p.getValueAsString());
        }
    }
}

package com.libragraph.attest.core.storage;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.libragraph.attest.util.ContentHash;

import java.io.IOException;

/**
 * Jackson setup shared by every persisted or exported document: hashes as lowercase hex,
 * instants as ISO-8601 strings, map entries in key order, unknown fields rejected.
 */
public final class AttestJson {

    private AttestJson() {
    }

    public static ObjectMapper newMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(contentHashModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .build();
    }

    /**
     * Serializes {@link ContentHash} as its 64-character hex form.
     */
    public static SimpleModule contentHashModule() {
        SimpleModule module = new SimpleModule("attest-content-hash");
        module.addSerializer(ContentHash.class, new JsonSerializer<>() {
            @Override
            public void serialize(ContentHash value, JsonGenerator gen, SerializerProvider serializers)
                    throws IOException {
                gen.writeString(value.toHex());
            }
        });
        module.addDeserializer(ContentHash.class, new JsonDeserializer<>() {
            @Override
            public ContentHash deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                String text = p.getValueAsString();
                try {
                    return ContentHash.fromHex(text);
                } catch (RuntimeException e) {
                    return (ContentHash) ctxt.handleWeirdStringValue(ContentHash.class, text, e.getMessage());
                }
            }
        });
        return module;
    }
}

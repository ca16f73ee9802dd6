package com.geico.poc.streamcatalog.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.geico.poc.streamcatalog.catalog.CatalogObject;
import com.geico.poc.streamcatalog.error.CatalogInconsistentException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * JSON encoding of stored catalog values.
 */
public final class CatalogCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CatalogCodec() {
    }

    public static ObjectMapper objectMapper() {
        return objectMapper;
    }

    public static byte[] encodeObject(CatalogObject object) {
        try {
            return objectMapper.writerFor(CatalogObject.class)
                    .writeValueAsString(object)
                    .getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new CatalogInconsistentException(
                    "Failed to encode " + object.kind() + " " + object.getId() + ": " + e.getMessage(), e);
        }
    }

    public static CatalogObject decodeObject(byte[] value) {
        try {
            return objectMapper.readValue(value, CatalogObject.class);
        } catch (IOException e) {
            throw new CatalogInconsistentException("Failed to decode catalog object: " + e.getMessage(), e);
        }
    }

    public static byte[] encodeLong(long value) {
        return ByteBuffer.allocate(8).putLong(value).array();
    }

    public static long decodeLong(byte[] value) {
        if (value == null || value.length != 8) {
            throw new CatalogInconsistentException("Malformed counter value");
        }
        return ByteBuffer.wrap(value).getLong();
    }
}

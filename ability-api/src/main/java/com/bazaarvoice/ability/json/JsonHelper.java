package com.bazaarvoice.ability.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.base.Throwables;

import java.io.IOException;
import java.io.InputStream;

/**
 * Shared Jackson mapper for conditions, rules and filter documents.
 */
public abstract class JsonHelper {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final ObjectWriter DEFAULT_WRITER = JSON.writer();

    public static String asJson(Object value) {
        try {
            return DEFAULT_WRITER.writeValueAsString(value);
        } catch (IOException e) {
            // Shouldn't get I/O errors writing to a string.
            Throwables.throwIfUnchecked(e);
            throw new RuntimeException(e);
        }
    }

    public static <T> T fromJson(String string, Class<T> valueType) {
        try {
            return JSON.readValue(string, valueType);
        } catch (IOException e) {
            // Must be malformed JSON.  Other kinds of I/O errors don't get thrown when reading from a string.
            throw new IllegalArgumentException(e.toString());
        }
    }

    public static <T> T fromJson(String string, TypeReference<T> reference) {
        try {
            return JSON.readValue(string, reference);
        } catch (IOException e) {
            // Must be malformed JSON.  Other kinds of I/O errors don't get thrown when reading from a string.
            throw new IllegalArgumentException(e.toString());
        }
    }

    public static <T> T readJson(InputStream in, TypeReference<T> reference)
            throws IOException {
        return JSON.readValue(in, reference);
    }
}

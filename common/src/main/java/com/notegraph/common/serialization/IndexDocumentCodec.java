package com.notegraph.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.notegraph.common.exception.IndexFormatException;
import com.notegraph.common.exception.NoteGraphException;

/**
 * JSON codec for index documents.
 * Формат: pretty-printed JSON, ISO-8601 timestamps, trailing newline.
 * Декодирование строгое: документ, не прошедший валидацию схемы, приводит к {@link IndexFormatException}.
 */
public class IndexDocumentCodec {

    private final ObjectMapper mapper;

    public IndexDocumentCodec() {
        this(defaultMapper());
    }

    public IndexDocumentCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES);
    }

    public String encode(Object document) {
        if (document == null) {
            throw new IllegalArgumentException("Document cannot be null");
        }
        try {
            return mapper.writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new NoteGraphException("Failed to encode " + document.getClass().getSimpleName(), e);
        }
    }

    public <T> T decode(String path, String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            throw new IndexFormatException(path, "document is empty", null);
        }
        try {
            T value = mapper.readValue(json, type);
            if (value == null) {
                throw new IndexFormatException(path, "document is null", null);
            }
            return value;
        } catch (ValueInstantiationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IndexFormatException(path, cause.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new IndexFormatException(path, e.getOriginalMessage(), e);
        }
    }
}

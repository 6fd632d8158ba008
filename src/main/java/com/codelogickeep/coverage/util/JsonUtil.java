package com.codelogickeep.coverage.util;

import com.codelogickeep.coverage.exception.CoverageAnalysisException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON helper for options and analysis results.
 */
public class JsonUtil {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static ObjectMapper getMapper() {
        return mapper;
    }

    public static String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CoverageAnalysisException(
                    CoverageAnalysisException.ErrorCode.SERIALIZATION_FAILED,
                    "Failed to serialize " + typeName(value) + ": " + e.getOriginalMessage(),
                    null, e);
        }
    }

    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CoverageAnalysisException(
                    CoverageAnalysisException.ErrorCode.SERIALIZATION_FAILED,
                    "Failed to parse " + type.getSimpleName() + ": " + e.getOriginalMessage(),
                    null, e);
        }
    }

    public static <T> T readValue(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            throw new CoverageAnalysisException(
                    CoverageAnalysisException.ErrorCode.SERIALIZATION_FAILED,
                    "File not found: " + file.toAbsolutePath());
        }
        try {
            return mapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new CoverageAnalysisException(
                    CoverageAnalysisException.ErrorCode.SERIALIZATION_FAILED,
                    "Failed to read " + type.getSimpleName() + " from " + file + ": " + e.getMessage(),
                    file.toString(), e);
        }
    }

    public static void writeValue(Path file, Object value) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new CoverageAnalysisException(
                    CoverageAnalysisException.ErrorCode.SERIALIZATION_FAILED,
                    "Failed to write " + typeName(value) + " to " + file + ": " + e.getMessage(),
                    file.toString(), e);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}

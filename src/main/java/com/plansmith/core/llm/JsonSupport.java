package com.plansmith.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Best-effort decoding of JSON documents out of conversational LLM replies.
 * <p>
 * Extraction fails closed: anything that cannot be decoded yields
 * {@link Optional#empty()} instead of an exception, so callers branch on
 * presence rather than catching.
 */
public final class JsonSupport {

    private static final Logger log = LoggerFactory.getLogger(JsonSupport.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private JsonSupport() {
        // utility class
    }

    /**
     * Decodes the text between the first {@code '{'} and the last {@code '}'} of
     * {@code raw} as a JSON object.
     */
    public static Optional<JsonNode> extractObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.debug("No JSON object found in reply: {}", truncate(raw));
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(raw.substring(start, end + 1));
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Reply is not valid JSON ({}): {}", e.getOriginalMessage(), truncate(raw));
            return Optional.empty();
        }
    }

    /**
     * Leniently binds a decoded document to {@code type}.
     */
    public static <T> Optional<T> convert(JsonNode node, Class<T> type) {
        try {
            return Optional.ofNullable(MAPPER.treeToValue(node, type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Could not bind JSON to {}: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Pretty-printed JSON for prompts and console output.
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    static String truncate(String value) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        return normalized.length() <= 240 ? normalized : normalized.substring(0, 240) + "...";
    }
}

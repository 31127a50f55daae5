package com.autonomous.gateway.shape;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates a JSON value inside free-form model output.
 */
public final class ResponseParser {

    static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private static final Pattern CODE_FENCE = Pattern.compile("^```[\\w-]*\\s*(.*?)\\s*```$", Pattern.DOTALL);
    private static final Pattern JSON_SPAN = Pattern.compile("(\\{.*\\}|\\[.*\\])", Pattern.DOTALL);

    private ResponseParser() {
    }

    public static String stripCodeFence(String text) {
        String trimmed = text == null ? "" : text.trim();
        Matcher matcher = CODE_FENCE.matcher(trimmed);
        return matcher.matches() ? matcher.group(1).trim() : trimmed;
    }

    /**
     * Parses the whole response, or failing that the widest {@code {...}} or {@code [...]} span in it.
     */
    public static JsonNode parse(String raw) throws UnparseableResponseException {
        String cleaned = stripCodeFence(raw);
        if (cleaned.isEmpty()) {
            throw new UnparseableResponseException("the response was empty");
        }

        String firstError;
        try {
            JsonNode node = MAPPER.readTree(cleaned);
            if (node != null && !node.isMissingNode()) {
                return node;
            }
            firstError = "no content";
        } catch (JsonProcessingException e) {
            firstError = e.getOriginalMessage();
        }

        Matcher matcher = JSON_SPAN.matcher(cleaned);
        if (!matcher.find()) {
            throw new UnparseableResponseException("no JSON value was found in the response (" + firstError + ")");
        }
        try {
            return MAPPER.readTree(matcher.group(1));
        } catch (JsonProcessingException e) {
            throw new UnparseableResponseException("the JSON in the response is malformed: " + e.getOriginalMessage());
        }
    }
}

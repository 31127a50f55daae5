package com.autonomous.gateway.shape;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Turns raw model output into a value in two steps, parsing then validating, so each failure
 * can be reported back to the model.
 */
public interface ResponseInterpreter<T> {

    /**
     * Short name of what is expected, used in errors.
     */
    String expectation();

    /**
     * Text appended to the prompt telling the model how to format its answer.
     */
    String formatInstructions();

    JsonNode parse(String raw) throws UnparseableResponseException;

    List<String> validate(JsonNode node);

    T convert(JsonNode node);
}

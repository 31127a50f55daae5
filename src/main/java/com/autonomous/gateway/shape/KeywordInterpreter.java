package com.autonomous.gateway.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;

import java.util.List;

/**
 * Reads a yes/no answer from whichever keyword appears last in the response.
 */
public class KeywordInterpreter implements ResponseInterpreter<Boolean> {

    private final String trueKeyword;
    private final String falseKeyword;

    public KeywordInterpreter(String trueKeyword, String falseKeyword) {
        if (trueKeyword == null || trueKeyword.isBlank() || falseKeyword == null || falseKeyword.isBlank()) {
            throw new IllegalArgumentException("Both keywords are required");
        }
        if (trueKeyword.equals(falseKeyword)) {
            throw new IllegalArgumentException("Keywords must differ");
        }
        this.trueKeyword = trueKeyword;
        this.falseKeyword = falseKeyword;
    }

    @Override
    public String expectation() {
        return trueKeyword + " or " + falseKeyword;
    }

    @Override
    public String formatInstructions() {
        return "End your response with " + trueKeyword + " or " + falseKeyword + ".";
    }

    @Override
    public JsonNode parse(String raw) throws UnparseableResponseException {
        String text = raw == null ? "" : raw;
        int trueIndex = text.lastIndexOf(trueKeyword);
        int falseIndex = text.lastIndexOf(falseKeyword);
        if (trueIndex == falseIndex) {
            throw new UnparseableResponseException(
                "the response contains neither " + trueKeyword + " nor " + falseKeyword);
        }
        return BooleanNode.valueOf(trueIndex > falseIndex);
    }

    @Override
    public List<String> validate(JsonNode node) {
        return List.of();
    }

    @Override
    public Boolean convert(JsonNode node) {
        return node.asBoolean();
    }
}

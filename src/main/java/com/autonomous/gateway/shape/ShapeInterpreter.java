package com.autonomous.gateway.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.List;

public class ShapeInterpreter<T> implements ResponseInterpreter<T> {

    private final Shape<T> shape;

    public ShapeInterpreter(Shape<T> shape) {
        this.shape = shape;
    }

    @Override
    public String expectation() {
        return shape.phrase();
    }

    @Override
    public String formatInstructions() {
        if (Shapes.acceptsRawText(shape)) {
            return "Respond with the answer text only.";
        }
        return "Format your answer as JSON with this structure:\n"
            + shape.describe()
            + "\nRespond with the JSON only. It may be wrapped in a ```json code block but must not be surrounded by other text.";
    }

    @Override
    public JsonNode parse(String raw) throws UnparseableResponseException {
        if (Shapes.acceptsRawText(shape)) {
            JsonNode node = parseOrNull(raw);
            return node != null && node.isTextual() ? node : TextNode.valueOf(ResponseParser.stripCodeFence(raw));
        }
        return ResponseParser.parse(raw);
    }

    private JsonNode parseOrNull(String raw) {
        try {
            return ResponseParser.parse(raw);
        } catch (UnparseableResponseException e) {
            return null;
        }
    }

    @Override
    public List<String> validate(JsonNode node) {
        return shape.validate(node);
    }

    @Override
    public T convert(JsonNode node) {
        return shape.convert(node);
    }
}

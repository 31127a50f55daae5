package com.autonomous.gateway.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Expected structural form of a typed result. The variants are {@link PrimitiveShape},
 * {@link ListShape}, {@link MapShape} and {@link ObjectShape}; each one renders its own
 * description for the prompt and validates and converts a parsed JSON value.
 *
 * @param <T> Java type produced from a valid value
 */
public abstract class Shape<T> {

    /**
     * One-line description, e.g. "a number between 0.0 and 1.0".
     */
    public abstract String phrase();

    abstract void validate(JsonNode node, String path, List<String> problems);

    abstract T convert(JsonNode node, ObjectMapper mapper);

    boolean isComposite() {
        return false;
    }

    void describeChildren(StringBuilder out, int indent) {
    }

    /**
     * Indented multi-line description covering every nested field and element.
     */
    public String describe() {
        StringBuilder out = new StringBuilder();
        line(out, 0, phrase() + (isComposite() ? ":" : ""));
        describeChildren(out, 1);
        return out.toString().stripTrailing();
    }

    /**
     * Every mismatch between {@code node} and this shape, empty when it conforms.
     */
    public List<String> validate(JsonNode node) {
        List<String> problems = new ArrayList<>();
        validate(node, "$", problems);
        return problems;
    }

    public T convert(JsonNode node) {
        return convert(node, ResponseParser.MAPPER);
    }

    static void line(StringBuilder out, int indent, String text) {
        out.append("  ".repeat(indent)).append(text).append('\n');
    }

    static String describeNode(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        if (node.isNull()) {
            return "null";
        }
        String text = node.toString();
        return text.length() > 60 ? text.substring(0, 57) + "..." : text;
    }
}

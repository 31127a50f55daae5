package com.autonomous.gateway.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.stream.Collectors;

public class PrimitiveShape<T> extends Shape<T> {

    public enum Kind {
        STRING,
        INTEGER,
        NUMBER,
        BOOLEAN,
        ENUM
    }

    private final Kind kind;
    private final Double min;
    private final Double max;
    private final List<String> allowed;

    PrimitiveShape(Kind kind, Double min, Double max, List<String> allowed) {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min " + min + " is greater than max " + max);
        }
        if (kind == Kind.ENUM && (allowed == null || allowed.isEmpty())) {
            throw new IllegalArgumentException("An enumerated shape needs at least one value");
        }
        this.kind = kind;
        this.min = min;
        this.max = max;
        this.allowed = allowed == null ? List.of() : List.copyOf(allowed);
    }

    public Kind getKind() {
        return kind;
    }

    boolean acceptsRawText() {
        return kind == Kind.STRING;
    }

    @Override
    public String phrase() {
        return switch (kind) {
            case STRING -> "a string";
            case BOOLEAN -> "a boolean (true or false)";
            case ENUM -> "one of the strings " + allowed.stream()
                .map(v -> "\"" + v + "\"")
                .collect(Collectors.joining(", "));
            case INTEGER -> "an integer" + boundsPhrase();
            case NUMBER -> "a number" + boundsPhrase();
        };
    }

    private String boundsPhrase() {
        if (min != null && max != null) {
            return " between " + min + " and " + max;
        } else if (min != null) {
            return " of at least " + min;
        } else if (max != null) {
            return " of at most " + max;
        }
        return "";
    }

    @Override
    void validate(JsonNode node, String path, List<String> problems) {
        switch (kind) {
            case STRING -> {
                if (!node.isTextual()) {
                    problems.add(path + ": expected a string but got " + describeNode(node));
                }
            }
            case BOOLEAN -> {
                if (!node.isBoolean()) {
                    problems.add(path + ": expected true or false but got " + describeNode(node));
                }
            }
            case ENUM -> {
                if (!node.isTextual() || canonical(node.asText()) == null) {
                    problems.add(path + ": expected " + phrase() + " but got " + describeNode(node));
                }
            }
            case INTEGER -> {
                if (!node.isNumber() || node.asDouble() != Math.rint(node.asDouble())) {
                    problems.add(path + ": expected an integer but got " + describeNode(node));
                } else {
                    checkBounds(node.asDouble(), path, problems);
                }
            }
            case NUMBER -> {
                if (!node.isNumber()) {
                    problems.add(path + ": expected a number but got " + describeNode(node));
                } else {
                    checkBounds(node.asDouble(), path, problems);
                }
            }
        }
    }

    private void checkBounds(double value, String path, List<String> problems) {
        if (min != null && value < min) {
            problems.add(path + ": " + value + " is below the minimum " + min);
        }
        if (max != null && value > max) {
            problems.add(path + ": " + value + " is above the maximum " + max);
        }
    }

    private String canonical(String value) {
        return allowed.stream().filter(v -> v.equalsIgnoreCase(value.trim())).findFirst().orElse(null);
    }

    @Override
    @SuppressWarnings("unchecked")
    T convert(JsonNode node, ObjectMapper mapper) {
        Object value = switch (kind) {
            case STRING -> node.asText();
            case BOOLEAN -> node.asBoolean();
            case ENUM -> canonical(node.asText());
            case INTEGER -> node.asLong();
            case NUMBER -> node.asDouble();
        };
        return (T) value;
    }
}

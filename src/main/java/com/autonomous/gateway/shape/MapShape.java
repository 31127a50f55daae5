package com.autonomous.gateway.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MapShape<V> extends Shape<Map<String, V>> {

    private final Shape<V> value;

    MapShape(Shape<V> value) {
        this.value = value;
    }

    @Override
    public String phrase() {
        return "a JSON object with string keys where each value is " + value.phrase();
    }

    @Override
    boolean isComposite() {
        return value.isComposite();
    }

    @Override
    void describeChildren(StringBuilder out, int indent) {
        value.describeChildren(out, indent);
    }

    @Override
    void validate(JsonNode node, String path, List<String> problems) {
        if (!node.isObject()) {
            problems.add(path + ": expected an object but got " + describeNode(node));
            return;
        }
        node.fields().forEachRemaining(entry ->
            value.validate(entry.getValue(), path + "." + entry.getKey(), problems));
    }

    @Override
    Map<String, V> convert(JsonNode node, ObjectMapper mapper) {
        Map<String, V> values = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> values.put(entry.getKey(), value.convert(entry.getValue(), mapper)));
        return values;
    }
}

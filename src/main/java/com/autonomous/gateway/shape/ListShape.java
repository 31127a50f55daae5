package com.autonomous.gateway.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

public class ListShape<E> extends Shape<List<E>> {

    private final Shape<E> element;
    private final Integer minItems;
    private final Integer maxItems;

    ListShape(Shape<E> element, Integer minItems, Integer maxItems) {
        this.element = element;
        this.minItems = minItems;
        this.maxItems = maxItems;
    }

    public Shape<E> getElement() {
        return element;
    }

    @Override
    public String phrase() {
        String size = "";
        if (minItems != null && maxItems != null) {
            size = " of " + minItems + " to " + maxItems + " items";
        } else if (minItems != null) {
            size = " of at least " + minItems + " items";
        } else if (maxItems != null) {
            size = " of at most " + maxItems + " items";
        }
        return "a JSON list" + size + " where each item is " + element.phrase();
    }

    @Override
    boolean isComposite() {
        return element.isComposite();
    }

    @Override
    void describeChildren(StringBuilder out, int indent) {
        element.describeChildren(out, indent);
    }

    @Override
    void validate(JsonNode node, String path, List<String> problems) {
        if (!node.isArray()) {
            problems.add(path + ": expected a list but got " + describeNode(node));
            return;
        }
        if (minItems != null && node.size() < minItems) {
            problems.add(path + ": expected at least " + minItems + " items but got " + node.size());
        }
        if (maxItems != null && node.size() > maxItems) {
            problems.add(path + ": expected at most " + maxItems + " items but got " + node.size());
        }
        for (int i = 0; i < node.size(); i++) {
            element.validate(node.get(i), path + "[" + i + "]", problems);
        }
    }

    @Override
    List<E> convert(JsonNode node, ObjectMapper mapper) {
        List<E> values = new ArrayList<>(node.size());
        node.forEach(item -> values.add(element.convert(item, mapper)));
        return values;
    }
}

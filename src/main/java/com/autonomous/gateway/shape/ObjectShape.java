package com.autonomous.gateway.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A composite with named fields. Fields the shape does not name are tolerated and dropped.
 */
public class ObjectShape extends Shape<Map<String, Object>> {

    private final List<Field> fields;

    ObjectShape(List<Field> fields) {
        this.fields = List.copyOf(fields);
    }

    public List<Field> getFields() {
        return fields;
    }

    /**
     * Same validation, converting the value into {@code type} with Jackson.
     */
    public <R> Shape<R> bindTo(Class<R> type) {
        return new BoundShape<>(this, type);
    }

    @Override
    public String phrase() {
        return "a JSON object with these fields";
    }

    @Override
    boolean isComposite() {
        return true;
    }

    @Override
    void describeChildren(StringBuilder out, int indent) {
        for (Field field : fields) {
            StringBuilder text = new StringBuilder("\"").append(field.name).append("\" (")
                .append(field.required ? "required" : "optional").append("): ")
                .append(field.shape.phrase());
            if (field.description != null) {
                text.append(" - ").append(field.description);
            }
            if (field.shape.isComposite()) {
                text.append(':');
            }
            line(out, indent, text.toString());
            field.shape.describeChildren(out, indent + 1);
        }
    }

    @Override
    void validate(JsonNode node, String path, List<String> problems) {
        if (!node.isObject()) {
            problems.add(path + ": expected an object but got " + describeNode(node));
            return;
        }
        for (Field field : fields) {
            JsonNode value = node.get(field.name);
            if (value == null || value.isNull()) {
                if (field.required) {
                    problems.add(path + "." + field.name + ": required field is missing");
                }
                continue;
            }
            field.shape.validate(value, path + "." + field.name, problems);
        }
    }

    @Override
    Map<String, Object> convert(JsonNode node, ObjectMapper mapper) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : fields) {
            JsonNode value = node.get(field.name);
            if (value != null && !value.isNull()) {
                values.put(field.name, field.shape.convert(value, mapper));
            }
        }
        return Collections.unmodifiableMap(values);
    }

    public static final class Field {
        private final String name;
        private final Shape<?> shape;
        private final boolean required;
        private final String description;

        Field(String name, Shape<?> shape, boolean required, String description) {
            this.name = name;
            this.shape = shape;
            this.required = required;
            this.description = description;
        }

        public String getName() {
            return name;
        }

        public Shape<?> getShape() {
            return shape;
        }

        public boolean isRequired() {
            return required;
        }
    }

    public static final class Builder {
        private final List<Field> fields = new ArrayList<>();

        public Builder field(String name, Shape<?> shape) {
            return field(name, shape, null);
        }

        public Builder field(String name, Shape<?> shape, String description) {
            fields.add(new Field(name, shape, true, description));
            return this;
        }

        public Builder optionalField(String name, Shape<?> shape, String description) {
            fields.add(new Field(name, shape, false, description));
            return this;
        }

        public ObjectShape build() {
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("An object shape needs at least one field");
            }
            return new ObjectShape(fields);
        }
    }

    static final class BoundShape<R> extends Shape<R> {
        private final ObjectShape shape;
        private final Class<R> type;

        BoundShape(ObjectShape shape, Class<R> type) {
            this.shape = shape;
            this.type = type;
        }

        @Override
        public String phrase() {
            return shape.phrase();
        }

        @Override
        boolean isComposite() {
            return true;
        }

        @Override
        void describeChildren(StringBuilder out, int indent) {
            shape.describeChildren(out, indent);
        }

        @Override
        void validate(JsonNode node, String path, List<String> problems) {
            shape.validate(node, path, problems);
        }

        @Override
        R convert(JsonNode node, ObjectMapper mapper) {
            return mapper.convertValue(node, type);
        }
    }
}

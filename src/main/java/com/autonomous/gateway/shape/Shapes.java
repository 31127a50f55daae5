package com.autonomous.gateway.shape;

import java.util.Arrays;

/**
 * Factories for the shape variants.
 */
public final class Shapes {

    private Shapes() {
    }

    public static PrimitiveShape<String> string() {
        return new PrimitiveShape<>(PrimitiveShape.Kind.STRING, null, null, null);
    }

    public static PrimitiveShape<Boolean> bool() {
        return new PrimitiveShape<>(PrimitiveShape.Kind.BOOLEAN, null, null, null);
    }

    public static PrimitiveShape<Long> integer() {
        return integer(null, null);
    }

    public static PrimitiveShape<Long> integer(Long min, Long max) {
        return new PrimitiveShape<>(PrimitiveShape.Kind.INTEGER,
            min != null ? min.doubleValue() : null, max != null ? max.doubleValue() : null, null);
    }

    public static PrimitiveShape<Double> number() {
        return number(null, null);
    }

    public static PrimitiveShape<Double> number(Double min, Double max) {
        return new PrimitiveShape<>(PrimitiveShape.Kind.NUMBER, min, max, null);
    }

    public static PrimitiveShape<Double> probability() {
        return number(0.0, 1.0);
    }

    public static PrimitiveShape<String> oneOf(String... values) {
        return new PrimitiveShape<>(PrimitiveShape.Kind.ENUM, null, null, Arrays.asList(values));
    }

    public static <E> ListShape<E> listOf(Shape<E> element) {
        return new ListShape<>(element, null, null);
    }

    public static <E> ListShape<E> listOf(Shape<E> element, Integer minItems, Integer maxItems) {
        return new ListShape<>(element, minItems, maxItems);
    }

    public static <V> MapShape<V> mapOf(Shape<V> value) {
        return new MapShape<>(value);
    }

    public static ObjectShape.Builder object() {
        return new ObjectShape.Builder();
    }

    static boolean acceptsRawText(Shape<?> shape) {
        return shape instanceof PrimitiveShape && ((PrimitiveShape<?>) shape).acceptsRawText();
    }
}

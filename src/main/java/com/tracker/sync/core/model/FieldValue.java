package com.tracker.sync.core.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * A scalar field value as text. Numbers are kept in canonical form ({@code 5.0} becomes {@code 5}).
 */
public record FieldValue(String text) {

    private static final FieldValue EMPTY = new FieldValue(null);

    public static FieldValue empty() {
        return EMPTY;
    }

    public static FieldValue of(Object raw) {
        if (raw == null) {
            return EMPTY;
        }
        if (raw instanceof Number n) {
            return new FieldValue(canonicalNumber(new BigDecimal(n.toString())));
        }
        String s = raw.toString().trim();
        if (s.isEmpty()) {
            return EMPTY;
        }
        return new FieldValue(s);
    }

    public boolean isEmpty() {
        return text == null || text.isEmpty();
    }

    public Optional<Double> asNumber() {
        if (isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String canonicalNumber(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }

    @Override
    public String toString() {
        return isEmpty() ? "" : text;
    }
}

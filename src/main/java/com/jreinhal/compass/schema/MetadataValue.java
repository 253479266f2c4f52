package com.jreinhal.compass.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Typed view of a single vector metadata value.
 *
 * Vector stores hand back arbitrary key/value bags; {@link #of(Object)} is the one place
 * where those untyped values are converted. Serializes as the plain JSON value.
 */
public sealed interface MetadataValue
        permits MetadataValue.NumberValue, MetadataValue.StringValue, MetadataValue.BooleanValue,
        MetadataValue.StringArrayValue, MetadataValue.NullValue {

    @JsonValue
    Object raw();

    default boolean isNull() {
        return false;
    }

    /**
     * Numeric view of the value. Strings are accepted when they parse as numbers once
     * thousands separators are removed.
     */
    default Optional<Double> asDouble() {
        return Optional.empty();
    }

    default String asText() {
        Object raw = raw();
        return raw == null ? "" : String.valueOf(raw);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static MetadataValue of(Object raw) {
        if (raw == null) {
            return NullValue.INSTANCE;
        }
        if (raw instanceof MetadataValue value) {
            return value;
        }
        if (raw instanceof Number number) {
            return new NumberValue(number.doubleValue());
        }
        if (raw instanceof Boolean bool) {
            return new BooleanValue(bool);
        }
        if (raw instanceof Collection<?> collection) {
            List<String> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                if (item != null) {
                    items.add(String.valueOf(item));
                }
            }
            return new StringArrayValue(List.copyOf(items));
        }
        if (raw instanceof Object[] array) {
            return of(List.of(array));
        }
        return new StringValue(String.valueOf(raw));
    }

    record NumberValue(double value) implements MetadataValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<Double> asDouble() {
            return Optional.of(value);
        }

        @Override
        public String asText() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return String.valueOf((long) value);
            }
            return String.valueOf(value);
        }
    }

    record StringValue(String value) implements MetadataValue {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<Double> asDouble() {
            if (value == null) {
                return Optional.empty();
            }
            String cleaned = value.replace(",", "").trim();
            if (cleaned.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(Double.parseDouble(cleaned));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
    }

    record BooleanValue(boolean value) implements MetadataValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    record StringArrayValue(List<String> values) implements MetadataValue {
        public StringArrayValue {
            values = values == null ? List.of() : List.copyOf(values);
        }

        @Override
        public Object raw() {
            return values;
        }

        @Override
        public String asText() {
            return String.join(", ", values);
        }
    }

    final class NullValue implements MetadataValue {
        static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override
        public Object raw() {
            return null;
        }

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String toString() {
            return "NullValue";
        }
    }
}

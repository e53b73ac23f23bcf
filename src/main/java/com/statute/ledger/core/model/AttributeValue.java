package com.statute.ledger.core.model;

import java.util.Objects;

/**
 * A typed fact value: integer, string or boolean.
 * Every value has a fixed textual form used in audit payloads.
 */
public sealed interface AttributeValue
        permits AttributeValue.IntValue, AttributeValue.StringValue, AttributeValue.BoolValue {

    enum Type { INTEGER, STRING, BOOLEAN }

    Type type();

    /**
     * Canonical text form: decimal digits, the raw string, or {@code true}/{@code false}.
     */
    String asText();

    static AttributeValue of(long value) {
        return new IntValue(value);
    }

    static AttributeValue of(String value) {
        return new StringValue(value);
    }

    static AttributeValue of(boolean value) {
        return new BoolValue(value);
    }

    record IntValue(long value) implements AttributeValue {
        @Override
        public Type type() {
            return Type.INTEGER;
        }

        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record StringValue(String value) implements AttributeValue {
        public StringValue {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public Type type() {
            return Type.STRING;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record BoolValue(boolean value) implements AttributeValue {
        @Override
        public Type type() {
            return Type.BOOLEAN;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }
}

package org.monkeylang.runtime.model;

/**
 * A 64-bit signed integer.
 * @param value The numeric value.
 */
public record IntegerValue(long value) implements Value {

    @Override
    public ValueType type() {
        return ValueType.INTEGER;
    }

    @Override
    public String inspect() {
        return Long.toString(value);
    }
}

package com.gddoc.template.runtime;

/**
 * A number held either as {@code Long} (integral) or {@code Double}.
 */
public record NumberValue(Number value) implements Value {

    public NumberValue {
        if (!(value instanceof Long) && !(value instanceof Double)) {
            value = value.doubleValue();
        }
    }

    public NumberValue(long value) {
        this((Number) value);
    }

    public NumberValue(double value) {
        this((Number) value);
    }

    public boolean isIntegral() {
        return value instanceof Long;
    }

    public long longValue() {
        return value.longValue();
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    @Override
    public String kind() {
        return "number";
    }

    @Override
    public boolean isTruthy() {
        return isIntegral() ? longValue() != 0 : doubleValue() != 0.0;
    }

    @Override
    public String asText() {
        return value.toString();
    }
}

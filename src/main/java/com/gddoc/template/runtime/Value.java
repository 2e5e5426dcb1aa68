package com.gddoc.template.runtime;

import java.io.File;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dynamically typed template value.
 * <p>
 * Attribute access is uniform across kinds: only records have fields, and every other lookup
 * yields {@link Undefined}. Undefined compares equal to none, has length 0 and renders as empty
 * text, which is how optional documentation fields are represented.
 */
public sealed interface Value permits NoneValue, Undefined, BoolValue, NumberValue, StringValue, ListValue,
        RecordValue {

    Value NONE = NoneValue.INSTANCE;

    /**
     * @return short kind name used in error messages
     */
    String kind();

    boolean isTruthy();

    /**
     * @return the text emitted when the value is output
     */
    String asText();

    /**
     * @return literal-like form used when the value is nested inside a list or record
     */
    default String repr() {
        return asText();
    }

    default Value attribute(String name) {
        return Undefined.INSTANCE;
    }

    /**
     * @return true for none and undefined
     */
    default boolean isNone() {
        return false;
    }

    /**
     * Converts plain Java data into a value tree.
     *
     * @throws IllegalArgumentException for types without a template representation
     */
    static Value of(Object object) {
        if (object == null) {
            return NoneValue.INSTANCE;
        }
        if (object instanceof Value) {
            return (Value) object;
        }
        if (object instanceof Boolean) {
            return BoolValue.of((Boolean) object);
        }
        if (object instanceof Integer || object instanceof Long || object instanceof Short
                || object instanceof Byte || object instanceof BigInteger) {
            return new NumberValue(((Number) object).longValue());
        }
        if (object instanceof Number) {
            Number number = (Number) object;
            if (number instanceof BigDecimal && ((BigDecimal) number).stripTrailingZeros().scale() <= 0) {
                return new NumberValue(number.longValue());
            }
            return new NumberValue(number.doubleValue());
        }
        if (object instanceof CharSequence || object instanceof Character || object instanceof Enum
                || object instanceof Path || object instanceof File) {
            return new StringValue(object.toString());
        }
        if (object instanceof Optional) {
            return of(((Optional<?>) object).orElse(null));
        }
        if (object instanceof Map) {
            Map<String, Value> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) object).entrySet()) {
                fields.put(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return new RecordValue(fields);
        }
        if (object instanceof Iterable) {
            List<Value> items = new ArrayList<>();
            for (Object item : (Iterable<?>) object) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        if (object instanceof Object[]) {
            return of(Arrays.asList((Object[]) object));
        }
        throw new IllegalArgumentException("Unsupported context value type: " + object.getClass().getName());
    }
}

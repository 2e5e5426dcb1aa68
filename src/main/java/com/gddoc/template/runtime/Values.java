package com.gddoc.template.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateTypeException;

/**
 * Equality, ordering, length and iteration rules shared by operators, filters and the renderer.
 */
public final class Values {

    private Values() {
    }

    /**
     * Value equality. None and undefined are equal to each other; integral and fractional
     * numbers compare numerically.
     */
    public static boolean equal(Value a, Value b) {
        if (a.isNone() || b.isNone()) {
            return a.isNone() && b.isNone();
        }
        if (a instanceof NumberValue && b instanceof NumberValue) {
            return compareNumbers((NumberValue) a, (NumberValue) b) == 0;
        }
        if (a instanceof ListValue && b instanceof ListValue) {
            List<Value> left = ((ListValue) a).items();
            List<Value> right = ((ListValue) b).items();
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = 0; i < left.size(); i++) {
                if (!equal(left.get(i), right.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof RecordValue && b instanceof RecordValue) {
            Map<String, Value> left = ((RecordValue) a).fields();
            Map<String, Value> right = ((RecordValue) b).fields();
            if (!left.keySet().equals(right.keySet())) {
                return false;
            }
            for (Map.Entry<String, Value> entry : left.entrySet()) {
                if (!equal(entry.getValue(), right.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * Ordering for {@code < <= > >=}: numbers with numbers, strings with strings.
     */
    public static int compareOrdered(Value a, Value b, String op, SourcePosition position)
            throws TemplateTypeException {
        if (a instanceof NumberValue && b instanceof NumberValue) {
            return compareNumbers((NumberValue) a, (NumberValue) b);
        }
        if (a instanceof StringValue && b instanceof StringValue) {
            return compareCodePoints(((StringValue) a).value(), ((StringValue) b).value());
        }
        throw new TemplateTypeException(op, "cannot compare " + a.kind() + " with " + b.kind(), position);
    }

    /**
     * Total order used for sorting: none/undefined, then booleans, numbers, strings, lists, records.
     * Strings compare by code point, after lower-casing unless {@code caseSensitive}.
     */
    public static Comparator<Value> sortOrder(boolean caseSensitive) {
        return new Comparator<>() {
            @Override
            public int compare(Value a, Value b) {
                int byRank = Integer.compare(rank(a), rank(b));
                if (byRank != 0) {
                    return byRank;
                }
                if (a instanceof BoolValue) {
                    return Boolean.compare(((BoolValue) a).value(), ((BoolValue) b).value());
                }
                if (a instanceof NumberValue) {
                    return compareNumbers((NumberValue) a, (NumberValue) b);
                }
                if (a instanceof StringValue) {
                    String left = ((StringValue) a).value();
                    String right = ((StringValue) b).value();
                    if (!caseSensitive) {
                        left = left.toLowerCase(Locale.ROOT);
                        right = right.toLowerCase(Locale.ROOT);
                    }
                    return compareCodePoints(left, right);
                }
                if (a instanceof ListValue) {
                    List<Value> left = ((ListValue) a).items();
                    List<Value> right = ((ListValue) b).items();
                    for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
                        int c = compare(left.get(i), right.get(i));
                        if (c != 0) {
                            return c;
                        }
                    }
                    return Integer.compare(left.size(), right.size());
                }
                return 0;
            }
        };
    }

    /**
     * Comparator over elements ordered by the key the accessor extracts from each element.
     * Used with a stable sort so equal keys keep their input order.
     */
    public static Comparator<Value> sortOrder(Function<Value, Value> keyAccessor, boolean caseSensitive) {
        return Comparator.comparing(keyAccessor, sortOrder(caseSensitive));
    }

    /**
     * Follows a dotted attribute path ({@code "a.b"}); numeric segments index into lists.
     */
    public static Value path(Value value, String dottedPath) {
        Value current = value;
        for (String segment : dottedPath.split("\\.")) {
            if (current instanceof ListValue && isIndex(segment)) {
                current = index((ListValue) current, Long.parseLong(segment));
            } else {
                current = current.attribute(segment);
            }
        }
        return current;
    }

    public static Value index(ListValue list, long index) {
        List<Value> items = list.items();
        long resolved = index < 0 ? items.size() + index : index;
        if (resolved < 0 || resolved >= items.size()) {
            return Undefined.INSTANCE;
        }
        return items.get((int) resolved);
    }

    /**
     * Element count for lists and records, character count for strings, 0 for none/undefined.
     */
    public static int length(Value value, String op, SourcePosition position) throws TemplateTypeException {
        if (value.isNone()) {
            return 0;
        }
        if (value instanceof ListValue) {
            return ((ListValue) value).items().size();
        }
        if (value instanceof StringValue) {
            String text = ((StringValue) value).value();
            return text.codePointCount(0, text.length());
        }
        if (value instanceof RecordValue) {
            return ((RecordValue) value).fields().size();
        }
        throw new TemplateTypeException(op, value.kind() + " has no length", position);
    }

    /**
     * Elements visited by a loop: list items, record keys, or string characters.
     * None and undefined iterate as empty.
     */
    public static List<Value> iterate(Value value, String op, SourcePosition position)
            throws TemplateTypeException {
        if (value.isNone()) {
            return List.of();
        }
        if (value instanceof ListValue) {
            return ((ListValue) value).items();
        }
        if (value instanceof RecordValue) {
            List<Value> keys = new ArrayList<>();
            for (String key : ((RecordValue) value).fields().keySet()) {
                keys.add(new StringValue(key));
            }
            return keys;
        }
        if (value instanceof StringValue) {
            List<Value> chars = new ArrayList<>();
            ((StringValue) value).value().codePoints()
                    .forEach(cp -> chars.add(new StringValue(new String(Character.toChars(cp)))));
            return chars;
        }
        throw new TemplateTypeException(op, value.kind() + " is not iterable", position);
    }

    private static int rank(Value value) {
        if (value.isNone()) {
            return 0;
        }
        if (value instanceof BoolValue) {
            return 1;
        }
        if (value instanceof NumberValue) {
            return 2;
        }
        if (value instanceof StringValue) {
            return 3;
        }
        if (value instanceof ListValue) {
            return 4;
        }
        return 5;
    }

    private static int compareNumbers(NumberValue a, NumberValue b) {
        if (a.isIntegral() && b.isIntegral()) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
    }
}

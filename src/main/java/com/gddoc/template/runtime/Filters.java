package com.gddoc.template.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateException;
import com.gddoc.template.TemplateTypeException;

/**
 * Fixed registry of named filters ({@code value | name(args)}).
 */
public final class Filters {

    @FunctionalInterface
    public interface Filter {
        Value apply(Value input, Arguments args) throws TemplateException;
    }

    private record Definition(List<String> parameters, Filter filter) {
    }

    private static final Map<String, Definition> REGISTRY = new HashMap<>();

    // Attribute names on lists/strings that resolve to a filter, e.g. {@code items.length}.
    private static final Set<String> ATTRIBUTE_FILTERS = Set.of("length");

    static {
        register("sort", List.of("reverse", "case_sensitive", "attribute"), Filters::sort);
        register("length", List.of(), (input, args) -> new NumberValue(
                Values.length(input, args.operation(), args.position())));
        register("count", List.of(), (input, args) -> new NumberValue(
                Values.length(input, args.operation(), args.position())));
        register("default", List.of("default_value", "boolean"), Filters::defaultValue);
        register("d", List.of("default_value", "boolean"), Filters::defaultValue);
        register("join", List.of("d", "attribute"), Filters::join);
        register("map", List.of("attribute", "default"), Filters::map);
        register("items", List.of(), Filters::items);
        register("dictsort", List.of("case_sensitive", "by", "reverse"), Filters::dictsort);
        register("first", List.of(), (input, args) -> edge(input, args, true));
        register("last", List.of(), (input, args) -> edge(input, args, false));
        register("lower", List.of(), (input, args) -> new StringValue(input.asText().toLowerCase(Locale.ROOT)));
        register("upper", List.of(), (input, args) -> new StringValue(input.asText().toUpperCase(Locale.ROOT)));
        register("capitalize", List.of(), (input, args) -> new StringValue(capitalize(input.asText())));
        register("trim", List.of(), (input, args) -> new StringValue(input.asText().strip()));
        register("replace", List.of("old", "new", "count"), Filters::replace);
        register("string", List.of(), (input, args) -> new StringValue(input.asText()));
        register("list", List.of(), (input, args) -> new ListValue(
                Values.iterate(input, args.operation(), args.position())));
    }

    private Filters() {
    }

    private static void register(String name, List<String> parameters, Filter filter) {
        REGISTRY.put(name, new Definition(parameters, filter));
    }

    public static boolean isKnown(String name) {
        return REGISTRY.containsKey(name);
    }

    static boolean isAttributeFilter(String name) {
        return ATTRIBUTE_FILTERS.contains(name);
    }

    public static Value apply(String name, Value input, List<Value> positional, Map<String, Value> keyword,
            SourcePosition position) throws TemplateException {
        Definition definition = REGISTRY.get(name);
        if (definition == null) {
            throw new TemplateTypeException(name, "no such filter", position);
        }
        Arguments args = new Arguments(name, definition.parameters(), positional, keyword, position);
        return definition.filter().apply(input, args);
    }

    private static Value sort(Value input, Arguments args) throws TemplateTypeException {
        List<Value> items = sequence(input, args);
        String attribute = args.text("attribute", null);
        Function<Value, Value> key;
        if (attribute == null) {
            key = Function.identity();
        } else {
            key = item -> Values.path(item, attribute);
        }
        Comparator<Value> order = Values.sortOrder(key, args.flag("case_sensitive"));
        if (args.flag("reverse")) {
            order = order.reversed();
        }
        List<Value> sorted = new ArrayList<>(items);
        sorted.sort(order);
        return new ListValue(sorted);
    }

    private static Value defaultValue(Value input, Arguments args) {
        Value fallback = args.get("default_value", StringValue.EMPTY);
        if (input == Undefined.INSTANCE || (args.flag("boolean") && !input.isTruthy())) {
            return fallback;
        }
        return input;
    }

    private static Value join(Value input, Arguments args) throws TemplateTypeException {
        String separator = args.text("d", "");
        String attribute = args.text("attribute", null);
        List<String> parts = new ArrayList<>();
        for (Value item : Values.iterate(input, args.operation(), args.position())) {
            parts.add((attribute == null ? item : Values.path(item, attribute)).asText());
        }
        return new StringValue(String.join(separator, parts));
    }

    private static Value map(Value input, Arguments args) throws TemplateTypeException {
        String attribute = args.required("attribute").asText();
        Value fallback = args.get("default", Undefined.INSTANCE);
        List<Value> mapped = new ArrayList<>();
        for (Value item : Values.iterate(input, args.operation(), args.position())) {
            Value value = Values.path(item, attribute);
            mapped.add(value == Undefined.INSTANCE ? fallback : value);
        }
        return new ListValue(mapped);
    }

    private static Value items(Value input, Arguments args) throws TemplateTypeException {
        return new ListValue(pairs(input, args));
    }

    private static Value dictsort(Value input, Arguments args) throws TemplateTypeException {
        String by = args.text("by", "key");
        int position;
        if ("key".equals(by)) {
            position = 0;
        } else if ("value".equals(by)) {
            position = 1;
        } else {
            throw new TemplateTypeException(args.operation(), "'by' must be 'key' or 'value'", args.position());
        }
        Comparator<Value> order = Values.sortOrder(
                pair -> ((ListValue) pair).items().get(position), args.flag("case_sensitive"));
        if (args.flag("reverse")) {
            order = order.reversed();
        }
        List<Value> sorted = new ArrayList<>(pairs(input, args));
        sorted.sort(order);
        return new ListValue(sorted);
    }

    private static Value edge(Value input, Arguments args, boolean first) throws TemplateTypeException {
        if (input.isNone()) {
            return Undefined.INSTANCE;
        }
        if (input instanceof StringValue || input instanceof ListValue) {
            List<Value> items = Values.iterate(input, args.operation(), args.position());
            if (items.isEmpty()) {
                return Undefined.INSTANCE;
            }
            return first ? items.get(0) : items.get(items.size() - 1);
        }
        throw new TemplateTypeException(args.operation(), "expected a list or string, got " + input.kind(),
                args.position());
    }

    private static Value replace(Value input, Arguments args) throws TemplateTypeException {
        String text = input.asText();
        String old = args.required("old").asText();
        String replacement = args.required("new").asText();
        Value count = args.get("count", Undefined.INSTANCE);
        if (count.isNone()) {
            return new StringValue(text.replace(old, replacement));
        }
        if (!(count instanceof NumberValue)) {
            throw new TemplateTypeException(args.operation(), "'count' must be a number", args.position());
        }
        StringBuilder result = new StringBuilder();
        long remaining = ((NumberValue) count).longValue();
        int from = 0;
        int index;
        while (remaining > 0 && !old.isEmpty() && (index = text.indexOf(old, from)) >= 0) {
            result.append(text, from, index).append(replacement);
            from = index + old.length();
            remaining--;
        }
        return new StringValue(result.append(text.substring(from)).toString());
    }

    private static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        int first = text.codePointAt(0);
        int split = Character.charCount(first);
        return new String(Character.toChars(Character.toUpperCase(first)))
                + text.substring(split).toLowerCase(Locale.ROOT);
    }

    private static List<Value> sequence(Value input, Arguments args) throws TemplateTypeException {
        if (input.isNone()) {
            return List.of();
        }
        if (input instanceof ListValue) {
            return ((ListValue) input).items();
        }
        throw new TemplateTypeException(args.operation(), "expected a list, got " + input.kind(), args.position());
    }

    private static List<Value> pairs(Value input, Arguments args) throws TemplateTypeException {
        if (input.isNone()) {
            return List.of();
        }
        if (!(input instanceof RecordValue)) {
            throw new TemplateTypeException(args.operation(), "expected a record, got " + input.kind(),
                    args.position());
        }
        return ((RecordValue) input).fields().entrySet().stream()
                .map(e -> (Value) new ListValue(List.of(new StringValue(e.getKey()), e.getValue())))
                .collect(Collectors.toList());
    }
}

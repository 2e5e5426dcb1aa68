package com.gddoc.template.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateTypeException;

/**
 * Methods callable on values, e.g. {@code enum.vals.items()} or {@code name.startswith('_')}.
 */
final class BuiltinMethods {

    private BuiltinMethods() {
    }

    static Value invoke(Value target, String method, List<Value> positional, Map<String, Value> keyword,
            SourcePosition position) throws TemplateTypeException {
        if (target instanceof RecordValue) {
            return invokeOnRecord((RecordValue) target, method, positional, keyword, position);
        }
        if (target instanceof StringValue) {
            return invokeOnString(((StringValue) target).value(), method, positional, keyword, position);
        }
        throw noSuchMethod(target, method, position);
    }

    private static Value invokeOnRecord(RecordValue mapping, String method, List<Value> positional,
            Map<String, Value> keyword, SourcePosition position) throws TemplateTypeException {
        return switch (method) {
            case "items" -> {
                bind(method, List.of(), positional, keyword, position);
                List<Value> pairs = new ArrayList<>();
                mapping.fields().forEach((key, value) -> pairs.add(new ListValue(List.of(new StringValue(key), value))));
                yield new ListValue(pairs);
            }
            case "keys" -> {
                bind(method, List.of(), positional, keyword, position);
                List<Value> keys = new ArrayList<>();
                mapping.fields().keySet().forEach(key -> keys.add(new StringValue(key)));
                yield new ListValue(keys);
            }
            case "values" -> {
                bind(method, List.of(), positional, keyword, position);
                yield new ListValue(new ArrayList<>(mapping.fields().values()));
            }
            case "get" -> {
                Arguments args = bind(method, List.of("key", "default"), positional, keyword, position);
                Value value = mapping.fields().get(args.required("key").asText());
                yield value != null ? value : args.get("default", NoneValue.INSTANCE);
            }
            default -> throw noSuchMethod(mapping, method, position);
        };
    }

    private static Value invokeOnString(String text, String method, List<Value> positional,
            Map<String, Value> keyword, SourcePosition position) throws TemplateTypeException {
        return switch (method) {
            case "upper" -> {
                bind(method, List.of(), positional, keyword, position);
                yield new StringValue(text.toUpperCase(Locale.ROOT));
            }
            case "lower" -> {
                bind(method, List.of(), positional, keyword, position);
                yield new StringValue(text.toLowerCase(Locale.ROOT));
            }
            case "strip" -> {
                Arguments args = bind(method, List.of("chars"), positional, keyword, position);
                String chars = args.text("chars", null);
                yield new StringValue(chars == null ? text.strip() : stripChars(text, chars));
            }
            case "startswith" -> {
                Arguments args = bind(method, List.of("prefix"), positional, keyword, position);
                yield BoolValue.of(text.startsWith(args.required("prefix").asText()));
            }
            case "endswith" -> {
                Arguments args = bind(method, List.of("suffix"), positional, keyword, position);
                yield BoolValue.of(text.endsWith(args.required("suffix").asText()));
            }
            case "replace" -> {
                Arguments args = bind(method, List.of("old", "new"), positional, keyword, position);
                yield new StringValue(text.replace(args.required("old").asText(), args.required("new").asText()));
            }
            default -> throw noSuchMethod(new StringValue(text), method, position);
        };
    }

    private static Arguments bind(String method, List<String> parameters, List<Value> positional,
            Map<String, Value> keyword, SourcePosition position) throws TemplateTypeException {
        return new Arguments(method, parameters, positional, keyword, position);
    }

    private static String stripChars(String text, String chars) {
        int start = 0;
        int end = text.length();
        while (start < end && chars.indexOf(text.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(start, end);
    }

    private static TemplateTypeException noSuchMethod(Value target, String method, SourcePosition position) {
        return new TemplateTypeException(method, target.kind() + " has no method '" + method + "'", position);
    }
}

package com.gddoc.maven.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented reader for the documented surface of a GDScript file.
 * <p>
 * Header:
 * <pre>
 * class_name Player extends CharacterBody2D
 * ## Summary line.
 * ##
 * ## Longer description.
 * </pre>
 * Body: consecutive {@code ##} lines document the next top-level {@code signal}, {@code enum},
 * {@code var} or {@code func}. Indented lines belong to function bodies and are ignored.
 */
public final class ScriptParser {

    private static final Pattern ANNOTATION = Pattern.compile("@(\\w+)(\\([^)]*\\))?\\s*");
    private static final Pattern SIGNAL = Pattern.compile("signal\\s+(\\w+)");
    private static final Pattern ENUM = Pattern.compile("enum\\b\\s*(\\w*)");
    private static final Pattern VAR = Pattern.compile("(?:static\\s+)?var\\s+(\\w+)");
    private static final Pattern FUNC = Pattern.compile("(?:static\\s+)?func\\s+(\\w+)");
    private static final Pattern TYPE = Pattern.compile("[A-Za-z_][\\w.]*(?:\\[[^\\]]*\\])?");
    private static final Pattern ACCESSOR = Pattern.compile("^([gs]et)\\b");
    private static final Pattern INLINE_ACCESSOR = Pattern.compile("\\b([gs]et)\\s*=\\s*\\w+");

    private final List<String> lines;
    private int index;

    private ScriptParser(String source) {
        this.lines = List.of(source.replace("\r\n", "\n").split("\n", -1));
    }

    /**
     * Parses one script.
     *
     * @param filePath path relative to the project, recorded in the result
     * @param source   file content
     */
    public static ClassInfo parse(String filePath, String source) {
        ScriptParser parser = new ScriptParser(source == null ? "" : source);
        ClassInfo info = new ClassInfo(filePath);
        parser.parseHeader(info);
        parser.parseBody(info);
        return info;
    }

    private void parseHeader(ClassInfo info) {
        List<String> docLines = new ArrayList<>();
        boolean definitionFound = false;
        while (index < lines.size()) {
            String line = lines.get(index);
            String trimmed = line.strip();
            // "extends X" may be followed directly by "class_name Y".
            boolean lateClassName = trimmed.startsWith("class_name") && info.getName() == null;
            if (definitionFound && !trimmed.startsWith("##") && !lateClassName) {
                break;
            }
            if (trimmed.isEmpty()) {
                index++;
                continue;
            }
            if (trimmed.startsWith("##")) {
                docLines.add(trimmed.substring(2).strip());
            } else if (trimmed.startsWith("class_name")) {
                String[] parts = trimmed.split("\\s+", 3);
                if (parts.length > 1) {
                    info.setName(parts[1]);
                }
                if (parts.length > 2 && parts[2].startsWith("extends") && !definitionFound) {
                    info.setExtendsName(extendsTarget(parts[2]));
                    definitionFound = true;
                }
            } else if (trimmed.startsWith("extends")) {
                info.setExtendsName(extendsTarget(trimmed));
                definitionFound = true;
            } else if (!isStandaloneAnnotation(trimmed)) {
                break;
            }
            index++;
        }
        applyClassDoc(info, docLines);
    }

    private static String extendsTarget(String clause) {
        String[] parts = clause.split("\\s+");
        return parts.length > 1 ? parts[1] : "";
    }

    // A lone "##" separates the summary from the description.
    private static void applyClassDoc(ClassInfo info, List<String> docLines) {
        if (docLines.isEmpty()) {
            return;
        }
        int separator = docLines.indexOf("");
        if (separator < 0) {
            info.setSummary(BbcodeConverter.toMarkdown(String.join("\n", docLines).strip()));
            return;
        }
        info.setSummary(BbcodeConverter.toMarkdown(String.join("\n", docLines.subList(0, separator))));
        info.setDescription(BbcodeConverter.toMarkdown(
                String.join("\n", docLines.subList(separator + 1, docLines.size()))));
    }

    private void parseBody(ClassInfo info) {
        List<String> docstring = new ArrayList<>();
        List<String> annotations = new ArrayList<>();
        while (index < lines.size()) {
            String line = lines.get(index++);
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith("##")) {
                docstring.add(line.substring(2).strip());
                continue;
            }

            String declaration = line;
            if (line.startsWith("@")) {
                Matcher matcher = ANNOTATION.matcher(line);
                int end = 0;
                while (matcher.find(end) && matcher.start() == end) {
                    annotations.add(matcher.group(1));
                    end = matcher.end();
                }
                declaration = line.substring(end);
                if (declaration.isBlank()) {
                    // Annotation on its own line applies to the next declaration.
                    continue;
                }
            }

            String description = docstring.isEmpty()
                    ? null
                    : BbcodeConverter.toMarkdown(String.join("\n", docstring));
            boolean onready = annotations.contains("onready");
            if (!Character.isWhitespace(line.charAt(0))) {
                parseDeclaration(info, declaration.strip(), description, onready);
            }
            docstring.clear();
            annotations.clear();
        }
    }

    private void parseDeclaration(ClassInfo info, String declaration, String description, boolean onready) {
        Matcher matcher;
        if ((matcher = ENUM.matcher(declaration)).lookingAt()) {
            // Enum lines keep their comments: "##" documents the values.
            info.getEnums().add(parseEnum(matcher.group(1), declaration.substring(matcher.end()), description));
            return;
        }
        String code = stripComment(declaration).strip();
        if ((matcher = SIGNAL.matcher(code)).lookingAt()) {
            info.getSignals().add(parseSignal(matcher.group(1), code, description));
        } else if ((matcher = VAR.matcher(code)).lookingAt()) {
            info.getProperties().add(parseProperty(matcher.group(1), code.substring(matcher.end()),
                    description, onready));
        } else if ((matcher = FUNC.matcher(code)).lookingAt()) {
            info.getMethods().add(parseMethod(matcher.group(1), code, description));
        }
    }

    private SignalInfo parseSignal(String name, String declaration, String description) {
        if (declaration.indexOf('(') < 0) {
            return new SignalInfo(name, description, List.of());
        }
        String signature = joinUntilBalanced(declaration);
        return new SignalInfo(name, description, parseArgs(argumentList(signature)));
    }

    private MethodInfo parseMethod(String name, String declaration, String description) {
        String signature = joinUntilBalanced(declaration);
        int close = closingParen(signature);
        String returnType = null;
        if (close >= 0) {
            String tail = signature.substring(close + 1);
            int colon = tail.indexOf(':');
            String beforeBody = colon >= 0 ? tail.substring(0, colon) : tail;
            int arrow = beforeBody.indexOf("->");
            if (arrow >= 0) {
                returnType = beforeBody.substring(arrow + 2).strip();
                if (returnType.isEmpty()) {
                    returnType = null;
                }
            }
        }
        return new MethodInfo(name, description, parseArgs(argumentList(signature)), returnType);
    }

    private EnumInfo parseEnum(String name, String afterName, String description) {
        Map<String, String> values = new LinkedHashMap<>();
        boolean done = addEnumValues(afterName, values);
        while (!done && index < lines.size()) {
            String line = lines.get(index++);
            if (line.isBlank()) {
                continue;
            }
            done = addEnumValues(line, values);
        }
        return new EnumInfo(name, description, values);
    }

    /**
     * Adds the values found in one line of an enum body.
     *
     * @return true once the closing brace was seen
     */
    private static boolean addEnumValues(String line, Map<String, String> values) {
        String text = line;
        String comment = null;
        int doc = text.indexOf("##");
        if (doc >= 0) {
            comment = text.substring(doc + 2).strip();
            text = text.substring(0, doc);
        }
        text = stripComment(text);
        int open = text.indexOf('{');
        if (open >= 0) {
            text = text.substring(open + 1);
        }
        int close = text.indexOf('}');
        boolean done = close >= 0;
        if (done) {
            text = text.substring(0, close);
        }
        String last = null;
        for (String part : splitTopLevel(text, ',')) {
            int assign = part.indexOf('=');
            String valueName = (assign >= 0 ? part.substring(0, assign) : part).strip();
            if (!valueName.isEmpty()) {
                values.put(valueName, null);
                last = valueName;
            }
        }
        if (last != null && comment != null && !comment.isEmpty()) {
            values.put(last, BbcodeConverter.toMarkdown(comment));
        }
        return done;
    }

    private PropertyInfo parseProperty(String name, String rest, String description, boolean onready) {
        String remainder = rest.strip();
        String type = null;
        String defaultValue = null;
        String accessors = null;
        String setget = null;

        // Godot 3: "var w = 5 setget set_w, get_w"
        int setgetAt = topLevelKeywordIndex(remainder, "setget");
        if (setgetAt >= 0) {
            setget = remainder.substring(setgetAt + "setget".length());
            remainder = remainder.substring(0, setgetAt).strip();
        }

        if (remainder.startsWith(":=")) {
            remainder = remainder.substring(2);
            defaultValue = remainder;
        } else if (remainder.startsWith(":")) {
            String afterColon = remainder.substring(1).strip();
            Matcher typeMatcher = TYPE.matcher(afterColon);
            if (!afterColon.matches("[gs]et\\s*=.*") && typeMatcher.lookingAt()) {
                type = typeMatcher.group();
                remainder = afterColon.substring(typeMatcher.end()).strip();
                if (remainder.startsWith("=")) {
                    defaultValue = remainder.substring(1);
                } else if (remainder.startsWith(":")) {
                    accessors = remainder.substring(1);
                }
            } else {
                accessors = afterColon;
            }
        } else if (remainder.startsWith("=")) {
            defaultValue = remainder.substring(1);
        }

        if (defaultValue != null) {
            int colon = topLevelIndexOf(defaultValue, ':');
            if (colon >= 0) {
                accessors = defaultValue.substring(colon + 1);
                defaultValue = defaultValue.substring(0, colon);
            }
            defaultValue = abbreviateDefault(defaultValue.strip());
        }
        if (onready) {
            defaultValue = null;
        }

        boolean hasSetter = false;
        boolean hasGetter = false;
        if (setget != null) {
            String[] names = setget.split(",", -1);
            hasSetter = !names[0].isBlank();
            hasGetter = names.length > 1 && !names[1].isBlank();
        }
        if (accessors != null) {
            Matcher inline = INLINE_ACCESSOR.matcher(accessors);
            while (inline.find()) {
                hasSetter |= "set".equals(inline.group(1));
                hasGetter |= "get".equals(inline.group(1));
            }
            // Indented set/get blocks follow a trailing colon.
            while (index < lines.size()) {
                String line = lines.get(index);
                if (line.isBlank()) {
                    if (nextNonBlankIsIndented()) {
                        index++;
                        continue;
                    }
                    break;
                }
                if (!Character.isWhitespace(line.charAt(0))) {
                    break;
                }
                String trimmed = line.strip();
                Matcher accessor = ACCESSOR.matcher(trimmed);
                if (accessor.find()) {
                    hasSetter |= "set".equals(accessor.group(1));
                    hasGetter |= "get".equals(accessor.group(1));
                }
                Matcher inlineLine = INLINE_ACCESSOR.matcher(trimmed);
                while (inlineLine.find()) {
                    hasSetter |= "set".equals(inlineLine.group(1));
                    hasGetter |= "get".equals(inlineLine.group(1));
                }
                index++;
            }
        }
        return new PropertyInfo(name, type, description, defaultValue, hasSetter, hasGetter);
    }

    private boolean nextNonBlankIsIndented() {
        for (int i = index; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!line.isBlank()) {
                return Character.isWhitespace(line.charAt(0));
            }
        }
        return false;
    }

    /**
     * Collection literals are shown as {@code {}}/{@code []} when empty and elided otherwise.
     */
    static String abbreviateDefault(String value) {
        if (value.isEmpty()) {
            return null;
        }
        char first = value.charAt(0);
        if (first == '{' || first == '[') {
            char closing = first == '{' ? '}' : ']';
            int end = value.indexOf(closing);
            boolean empty = end >= 0 && value.substring(1, end).isBlank();
            return empty ? "" + first + closing : first + "..." + closing;
        }
        return value;
    }

    /**
     * Appends following lines (stripped) until every bracket opened on the declaration is
     * closed and, for functions, the body colon has been reached.
     */
    private String joinUntilBalanced(String declaration) {
        StringBuilder signature = new StringBuilder(declaration);
        while (!isSignatureComplete(signature.toString()) && index < lines.size()) {
            signature.append(stripComment(lines.get(index++)).strip());
        }
        return signature.toString();
    }

    private static boolean isSignatureComplete(String signature) {
        int close = closingParen(signature);
        if (close < 0) {
            return false;
        }
        if (!signature.startsWith("func") && !signature.startsWith("static")) {
            return true;
        }
        return signature.indexOf(':', close) >= 0;
    }

    private static int closingParen(String text) {
        int open = text.indexOf('(');
        if (open < 0) {
            return -1;
        }
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            } else if (c == '"' || c == '\'') {
                i = skipString(text, i);
            }
        }
        return -1;
    }

    private static String argumentList(String signature) {
        int open = signature.indexOf('(');
        int close = closingParen(signature);
        if (open < 0) {
            return "";
        }
        return close < 0 ? signature.substring(open + 1) : signature.substring(open + 1, close);
    }

    /**
     * Parses {@code a, b: int, c = 1, d: float = 2.0, e := []}.
     */
    static List<ArgInfo> parseArgs(String argumentList) {
        List<ArgInfo> args = new ArrayList<>();
        for (String part : splitTopLevel(argumentList, ',')) {
            String arg = part.strip();
            if (arg.isEmpty()) {
                continue;
            }
            String type = null;
            String defaultValue = null;
            int inferred = arg.indexOf(":=");
            if (inferred >= 0) {
                defaultValue = arg.substring(inferred + 2).strip();
                arg = arg.substring(0, inferred).strip();
            } else {
                int assign = topLevelIndexOf(arg, '=');
                if (assign >= 0) {
                    defaultValue = arg.substring(assign + 1).strip();
                    arg = arg.substring(0, assign).strip();
                }
                int colon = arg.indexOf(':');
                if (colon >= 0) {
                    type = arg.substring(colon + 1).strip();
                    arg = arg.substring(0, colon).strip();
                }
            }
            args.add(new ArgInfo(arg, type == null || type.isEmpty() ? null : type, defaultValue));
        }
        return args;
    }

    /**
     * Splits on {@code separator} outside of brackets and string literals; empty parts are dropped.
     */
    static List<String> splitTopLevel(String text, char separator) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == '"' || c == '\'') {
                i = skipString(text, i);
            } else if (c == separator && depth == 0) {
                String part = text.substring(start, i).strip();
                if (!part.isEmpty()) {
                    result.add(part);
                }
                start = i + 1;
            }
        }
        String last = text.substring(start).strip();
        if (!last.isEmpty()) {
            result.add(last);
        }
        return result;
    }

    private static int topLevelKeywordIndex(String text, String keyword) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == '"' || c == '\'') {
                i = skipString(text, i);
            } else if (depth == 0 && text.startsWith(keyword, i)
                    && (i == 0 || !isWordChar(text.charAt(i - 1)))
                    && (i + keyword.length() == text.length() || !isWordChar(text.charAt(i + keyword.length())))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static int topLevelIndexOf(String text, char target) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == '"' || c == '\'') {
                i = skipString(text, i);
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Removes a trailing {@code #} comment that is not inside a string literal.
     */
    static String stripComment(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(line, i);
            } else if (c == '#') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    // Index of the closing quote, or the last index when unterminated.
    private static int skipString(String text, int openQuote) {
        char quote = text.charAt(openQuote);
        for (int i = openQuote + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == quote) {
                return i;
            }
        }
        return text.length() - 1;
    }

    private static boolean isStandaloneAnnotation(String trimmed) {
        if (!trimmed.startsWith("@")) {
            return false;
        }
        Matcher matcher = ANNOTATION.matcher(trimmed);
        return matcher.matches();
    }
}

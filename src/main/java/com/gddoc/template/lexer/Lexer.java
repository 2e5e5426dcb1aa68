package com.gddoc.template.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateOptions;
import com.gddoc.template.TemplateSyntaxException;

/**
 * Splits template source into tokens.
 * <p>
 * Outside of tags everything is literal text. Three tag kinds are recognized:
 * <pre>
 * {{ expression }}   {% statement %}   {# comment #}
 * </pre>
 * An opening delimiter followed by {@code -} strips trailing whitespace (at most one newline)
 * from the text before it; a closing delimiter preceded by {@code -} strips leading whitespace
 * (at most one newline) from the text after it. {@link TemplateOptions} adds the block-level
 * trimming applied to statement and comment tags. Comments produce no tokens.
 * <p>
 * {@link #tokens()} returns a fresh lazy stream on every call, so a lexer can be scanned any
 * number of times.
 */
public class Lexer {

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of("==", "!=", "<=", ">=", "//");
    private static final String SINGLE_CHAR_OPERATORS = ".|()[],:=~+-*/%<>";

    private final String source;
    private final TemplateOptions options;
    private final int[] lineStarts;

    public Lexer(String source) {
        this(source, TemplateOptions.DEFAULTS);
    }

    public Lexer(String source, TemplateOptions options) {
        this.source = source == null ? "" : source;
        this.options = options == null ? TemplateOptions.DEFAULTS : options;
        this.lineStarts = computeLineStarts(this.source);
    }

    /**
     * @return a new stream positioned at the start of the source
     */
    public TokenStream tokens() {
        return new Scanner();
    }

    /**
     * Scans the whole source eagerly.
     *
     * @return all tokens, ending with {@link TokenKind#EOF}
     */
    public List<Token> tokenize() throws TemplateSyntaxException {
        List<Token> tokens = new ArrayList<>();
        TokenStream stream = tokens();
        Token token;
        do {
            token = stream.next();
            tokens.add(token);
        } while (token.kind() != TokenKind.EOF);
        return tokens;
    }

    SourcePosition positionAt(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        if (index < 0) {
            index = -index - 2;
        }
        return new SourcePosition(index + 1, offset - lineStarts[index] + 1);
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private enum Mode {
        DATA,
        EXPRESSION,
        STATEMENT
    }

    private final class Scanner implements TokenStream {

        private final Deque<Token> pending = new ArrayDeque<>();
        private int pos;
        private Mode mode = Mode.DATA;
        private int tagStart;
        private boolean stripLeading;
        private boolean dropNewline;
        private boolean finished;

        @Override
        public Token next() throws TemplateSyntaxException {
            while (pending.isEmpty()) {
                if (finished) {
                    return new Token(TokenKind.EOF, "", positionAt(source.length()));
                }
                if (mode == Mode.DATA) {
                    scanData();
                } else {
                    scanTag();
                }
            }
            return pending.poll();
        }

        private void scanData() throws TemplateSyntaxException {
            int delimiter = findDelimiter(pos);
            int end = delimiter < 0 ? source.length() : delimiter;
            String text = source.substring(pos, end);
            int textStart = pos;

            if (stripLeading) {
                int cut = leadingWhitespaceLength(text);
                text = text.substring(cut);
                textStart += cut;
            } else if (dropNewline) {
                int cut = newlineLength(text, 0);
                text = text.substring(cut);
                textStart += cut;
            }
            stripLeading = false;
            dropNewline = false;

            if (delimiter >= 0) {
                char open = source.charAt(delimiter + 1);
                char marker = delimiter + 2 < source.length() ? source.charAt(delimiter + 2) : '\0';
                if (marker == '-') {
                    text = stripTrailingWhitespace(text);
                } else if (open != '{' && marker != '+' && options.lstripBlocks()) {
                    text = stripLineIndent(text, textStart);
                }
            }

            if (!text.isEmpty()) {
                pending.add(new Token(TokenKind.TEXT, text, positionAt(textStart)));
            }

            if (delimiter < 0) {
                pos = source.length();
                pending.add(new Token(TokenKind.EOF, "", positionAt(pos)));
                finished = true;
                return;
            }
            openTag(delimiter);
        }

        private void openTag(int delimiter) throws TemplateSyntaxException {
            char open = source.charAt(delimiter + 1);
            int p = delimiter + 2;
            boolean trimLeft = p < source.length() && source.charAt(p) == '-';
            boolean keepIndent = open != '{' && p < source.length() && source.charAt(p) == '+';
            if (trimLeft || keepIndent) {
                p++;
            }
            tagStart = delimiter;

            if (open == '#') {
                int close = source.indexOf("#}", p);
                if (close < 0) {
                    throw new TemplateSyntaxException("Unterminated comment", positionAt(delimiter));
                }
                boolean trimRight = close > p && source.charAt(close - 1) == '-';
                pos = close + 2;
                afterTag(trimRight, true);
                return;
            }

            boolean expression = open == '{';
            pending.add(new Token(expression ? TokenKind.EXPR_START : TokenKind.STMT_START,
                    expression ? "{{" : "{%", positionAt(delimiter)));
            if (trimLeft) {
                pending.add(new Token(TokenKind.TRIM_LEFT, "-", positionAt(delimiter + 2)));
            }
            mode = expression ? Mode.EXPRESSION : Mode.STATEMENT;
            pos = p;
        }

        private void scanTag() throws TemplateSyntaxException {
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
            boolean statement = mode == Mode.STATEMENT;
            if (pos >= source.length()) {
                throw unterminatedTag();
            }

            String close = statement ? "%}" : "}}";
            TokenKind endKind = statement ? TokenKind.STMT_END : TokenKind.EXPR_END;
            if (source.startsWith("-" + close, pos)) {
                pending.add(new Token(TokenKind.TRIM_RIGHT, "-", positionAt(pos)));
                pending.add(new Token(endKind, close, positionAt(pos + 1)));
                pos += 3;
                mode = Mode.DATA;
                afterTag(true, statement);
                return;
            }
            if (source.startsWith(close, pos)) {
                pending.add(new Token(endKind, close, positionAt(pos)));
                pos += 2;
                mode = Mode.DATA;
                afterTag(false, statement);
                return;
            }

            char c = source.charAt(pos);
            if (Character.isLetter(c) || c == '_') {
                readName();
            } else if (Character.isDigit(c)) {
                readNumber();
            } else if (c == '\'' || c == '"') {
                readString(c);
            } else {
                readOperator(c);
            }
        }

        private TemplateSyntaxException unterminatedTag() {
            return new TemplateSyntaxException(
                    "Unterminated tag '" + (mode == Mode.STATEMENT ? "{%" : "{{") + "'", positionAt(tagStart));
        }

        private void afterTag(boolean trimRight, boolean block) {
            if (trimRight) {
                stripLeading = true;
            } else if (block) {
                dropNewline = options.trimBlocks();
            }
        }

        private void readName() {
            int start = pos;
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            pending.add(new Token(TokenKind.NAME, source.substring(start, pos), positionAt(start)));
        }

        private void readNumber() {
            int start = pos;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
            if (pos + 1 < source.length() && source.charAt(pos) == '.'
                    && Character.isDigit(source.charAt(pos + 1))) {
                pos++;
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            }
            pending.add(new Token(TokenKind.NUMBER, source.substring(start, pos), positionAt(start)));
        }

        private void readString(char quote) throws TemplateSyntaxException {
            int start = pos++;
            StringBuilder value = new StringBuilder();
            while (true) {
                if (pos >= source.length()) {
                    throw new TemplateSyntaxException("Unterminated string literal", positionAt(start));
                }
                char c = source.charAt(pos++);
                if (c == quote) {
                    break;
                }
                if (c == '\\' && pos < source.length()) {
                    char escaped = source.charAt(pos++);
                    switch (escaped) {
                        case 'n' -> value.append('\n');
                        case 't' -> value.append('\t');
                        case 'r' -> value.append('\r');
                        case '\\', '\'', '"' -> value.append(escaped);
                        default -> value.append('\\').append(escaped);
                    }
                } else {
                    value.append(c);
                }
            }
            pending.add(new Token(TokenKind.STRING, value.toString(), positionAt(start)));
        }

        private void readOperator(char c) throws TemplateSyntaxException {
            if (pos + 1 < source.length()) {
                String pair = source.substring(pos, pos + 2);
                if (TWO_CHAR_OPERATORS.contains(pair)) {
                    pending.add(new Token(TokenKind.OPERATOR, pair, positionAt(pos)));
                    pos += 2;
                    return;
                }
            }
            if ((c == '}' || c == '%') && pos == source.length() - 1) {
                // Half a closing delimiter at end of input.
                throw unterminatedTag();
            }
            if (SINGLE_CHAR_OPERATORS.indexOf(c) < 0) {
                throw new TemplateSyntaxException("Unexpected character '" + c + "'", positionAt(pos));
            }
            pending.add(new Token(TokenKind.OPERATOR, String.valueOf(c), positionAt(pos)));
            pos++;
        }

        private int findDelimiter(int from) {
            int index = source.indexOf('{', from);
            while (index >= 0 && index + 1 < source.length()) {
                char next = source.charAt(index + 1);
                if (next == '{' || next == '%' || next == '#') {
                    return index;
                }
                index = source.indexOf('{', index + 1);
            }
            return -1;
        }

        /**
         * Removes indentation between the last line start and the tag, when the text before the
         * tag on that line is only spaces and tabs.
         */
        private String stripLineIndent(String text, int textStart) {
            int lineStart = text.lastIndexOf('\n') + 1;
            if (lineStart == 0 && textStart > 0 && source.charAt(textStart - 1) != '\n') {
                return text;
            }
            for (int i = lineStart; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c != ' ' && c != '\t') {
                    return text;
                }
            }
            return text.substring(0, lineStart);
        }
    }

    // Spaces/tabs, at most one newline, then spaces/tabs again.
    static int leadingWhitespaceLength(String text) {
        int i = skipHorizontal(text, 0);
        int afterNewline = i + newlineLength(text, i);
        if (afterNewline == i) {
            return i;
        }
        return skipHorizontal(text, afterNewline);
    }

    static String stripTrailingWhitespace(String text) {
        int end = text.length();
        while (end > 0 && isHorizontal(text.charAt(end - 1))) {
            end--;
        }
        if (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
            if (end > 0 && text.charAt(end - 1) == '\r') {
                end--;
            }
            while (end > 0 && isHorizontal(text.charAt(end - 1))) {
                end--;
            }
        }
        return text.substring(0, end);
    }

    private static int newlineLength(String text, int at) {
        if (text.startsWith("\r\n", at)) {
            return 2;
        }
        return at < text.length() && text.charAt(at) == '\n' ? 1 : 0;
    }

    private static int skipHorizontal(String text, int from) {
        int i = from;
        while (i < text.length() && isHorizontal(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isHorizontal(char c) {
        return c == ' ' || c == '\t';
    }
}

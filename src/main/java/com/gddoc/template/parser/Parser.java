package com.gddoc.template.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.gddoc.template.SourcePosition;
import com.gddoc.template.TemplateSyntaxException;
import com.gddoc.template.ast.Expr;
import com.gddoc.template.ast.MacroParam;
import com.gddoc.template.ast.Node;
import com.gddoc.template.lexer.Token;
import com.gddoc.template.lexer.TokenKind;
import com.gddoc.template.lexer.TokenStream;
import com.gddoc.template.runtime.Filters;
import com.gddoc.template.runtime.Tests;

/**
 * Recursive-descent parser from a token stream to the template AST.
 * <p>
 * Statements:
 * <pre>
 * {% if e %} ... {% elif e %} ... {% else %} ... {% endif %}
 * {% for x in e %} ... {% else %} ... {% endfor %}      (also: for k, v in e)
 * {% macro name(a, b: type, c = default) %} ... {% endmacro %}
 * {% set name = e %}
 * {% name(args) %}                                       (macro call)
 * </pre>
 * Expression precedence, lowest first: conditional ({@code a if c else b}), {@code or},
 * {@code and}, {@code not}, comparisons ({@code == != < <= > >= in, not in}), {@code ~},
 * {@code + -}, {@code * / // %}, unary {@code -}, then postfix {@code .name [key] (args) | filter is test}.
 */
public class Parser {

    private static final Set<String> END_TAGS = Set.of("elif", "else", "endif", "endfor", "endmacro");
    private static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", "<=", ">", ">=");
    private static final Set<String> RESERVED = Set.of("and", "or", "not", "in", "is", "if", "else");

    private final TokenStream stream;
    private final List<Token> lookahead = new ArrayList<>();

    public Parser(TokenStream stream) {
        this.stream = stream;
    }

    /**
     * Parses a complete template.
     *
     * @return the top-level block
     */
    public List<Node> parseTemplate() throws TemplateSyntaxException {
        Body body = subparse(Set.of());
        if (body.endTag != null) {
            throw new TemplateSyntaxException("Unexpected tag '" + body.endTag + "'", body.endPosition);
        }
        return body.nodes;
    }

    // ------------------------------------------------------------------ statements

    private static final class Body {
        private final List<Node> nodes;
        private final String endTag;
        private final SourcePosition endPosition;

        private Body(List<Node> nodes, String endTag, SourcePosition endPosition) {
            this.nodes = nodes;
            this.endTag = endTag;
            this.endPosition = endPosition;
        }
    }

    /**
     * Parses nodes until EOF or a statement whose keyword is one of {@code endTags}. The end
     * keyword is consumed; the rest of that statement is left for the caller.
     */
    private Body subparse(Set<String> endTags) throws TemplateSyntaxException {
        List<Node> nodes = new ArrayList<>();
        while (true) {
            Token token = next();
            switch (token.kind()) {
                case EOF -> {
                    return new Body(nodes, null, token.position());
                }
                case TEXT -> nodes.add(new Node.Text(token.text()));
                case EXPR_START -> {
                    skip(TokenKind.TRIM_LEFT);
                    Expr expr = parseExpression();
                    skip(TokenKind.TRIM_RIGHT);
                    expect(TokenKind.EXPR_END, "'}}'");
                    nodes.add(new Node.Output(expr, token.position()));
                }
                case STMT_START -> {
                    skip(TokenKind.TRIM_LEFT);
                    Token keyword = next();
                    if (keyword.kind() != TokenKind.NAME) {
                        throw new TemplateSyntaxException("Expected a tag name", keyword.position());
                    }
                    if (endTags.contains(keyword.text())) {
                        return new Body(nodes, keyword.text(), keyword.position());
                    }
                    if (END_TAGS.contains(keyword.text())) {
                        throw new TemplateSyntaxException("Unexpected tag '" + keyword.text() + "'", keyword.position());
                    }
                    nodes.add(parseStatement(keyword, token.position()));
                }
                default -> throw unexpected(token);
            }
        }
    }

    private Node parseStatement(Token keyword, SourcePosition tagStart) throws TemplateSyntaxException {
        return switch (keyword.text()) {
            case "if" -> parseIf(tagStart);
            case "for" -> parseFor(tagStart);
            case "macro" -> parseMacro(tagStart);
            case "set" -> parseSet(tagStart);
            default -> {
                if (peek().isOperator("(")) {
                    yield parseMacroCall(keyword);
                }
                throw new TemplateSyntaxException("Unknown tag '" + keyword.text() + "'", keyword.position());
            }
        };
    }

    private Node.If parseIf(SourcePosition opened) throws TemplateSyntaxException {
        Expr condition = parseExpression();
        endStatement();
        Body then = subparse(Set.of("elif", "else", "endif"));
        requireClosed(then, "if", opened);
        switch (then.endTag) {
            case "elif" -> {
                return new Node.If(condition, then.nodes, List.of(parseIf(opened)), opened);
            }
            case "else" -> {
                endStatement();
                Body otherwise = subparse(Set.of("endif"));
                requireClosed(otherwise, "if", opened);
                endStatement();
                return new Node.If(condition, then.nodes, otherwise.nodes, opened);
            }
            default -> {
                endStatement();
                return new Node.If(condition, then.nodes, List.of(), opened);
            }
        }
    }

    private Node.For parseFor(SourcePosition opened) throws TemplateSyntaxException {
        List<String> targets = new ArrayList<>();
        targets.add(expectName());
        while (peek().isOperator(",")) {
            next();
            targets.add(expectName());
        }
        Token in = next();
        if (!in.isName("in")) {
            throw new TemplateSyntaxException("Expected 'in' in for loop", in.position());
        }
        Expr iterable = parseOr();
        endStatement();
        Body body = subparse(Set.of("else", "endfor"));
        requireClosed(body, "for", opened);
        List<Node> otherwise = List.of();
        if ("else".equals(body.endTag)) {
            endStatement();
            Body elseBody = subparse(Set.of("endfor"));
            requireClosed(elseBody, "for", opened);
            otherwise = elseBody.nodes;
        }
        endStatement();
        return new Node.For(targets, iterable, body.nodes, otherwise, opened);
    }

    private Node.MacroDef parseMacro(SourcePosition opened) throws TemplateSyntaxException {
        String name = expectName();
        expectOperator("(");
        List<MacroParam> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        while (!peek().isOperator(")")) {
            Token paramToken = peek();
            String paramName = expectName();
            if (!seen.add(paramName)) {
                throw new TemplateSyntaxException("Duplicate macro parameter '" + paramName + "'",
                        paramToken.position());
            }
            String type = null;
            if (peek().isOperator(":")) {
                next();
                type = parseTypeName();
            }
            Expr defaultValue = null;
            if (peek().isOperator("=")) {
                next();
                defaultValue = parseExpression();
            }
            params.add(new MacroParam(paramName, type, defaultValue));
            if (!peek().isOperator(",")) {
                break;
            }
            next();
        }
        expectOperator(")");
        endStatement();
        Body body = subparse(Set.of("endmacro"));
        requireClosed(body, "macro", opened);
        endStatement();
        return new Node.MacroDef(name, params, body.nodes, opened);
    }

    private String parseTypeName() throws TemplateSyntaxException {
        StringBuilder type = new StringBuilder(expectName());
        while (peek().isOperator(".")) {
            next();
            type.append('.').append(expectName());
        }
        return type.toString();
    }

    private Node.Set parseSet(SourcePosition opened) throws TemplateSyntaxException {
        String name = expectName();
        expectOperator("=");
        Expr value = parseExpression();
        endStatement();
        return new Node.Set(name, value, opened);
    }

    private Node.MacroCall parseMacroCall(Token name) throws TemplateSyntaxException {
        List<Expr> args = new ArrayList<>();
        Map<String, Expr> kwargs = new LinkedHashMap<>();
        parseArguments(args, kwargs);
        endStatement();
        return new Node.MacroCall(name.text(), args, kwargs, name.position());
    }

    private void endStatement() throws TemplateSyntaxException {
        skip(TokenKind.TRIM_RIGHT);
        expect(TokenKind.STMT_END, "'%}'");
    }

    private static void requireClosed(Body body, String tag, SourcePosition opened) throws TemplateSyntaxException {
        if (body.endTag == null) {
            throw new TemplateSyntaxException("Unclosed '" + tag + "' tag", opened);
        }
    }

    // ------------------------------------------------------------------ expressions

    private Expr parseExpression() throws TemplateSyntaxException {
        Expr expr = parseOr();
        if (peek().isName("if")) {
            Token token = next();
            Expr condition = parseOr();
            Expr otherwise = null;
            if (peek().isName("else")) {
                next();
                otherwise = parseExpression();
            }
            return new Expr.Conditional(condition, expr, otherwise, token.position());
        }
        return expr;
    }

    private Expr parseOr() throws TemplateSyntaxException {
        Expr left = parseAnd();
        while (peek().isName("or")) {
            Token op = next();
            left = new Expr.Logical("or", left, parseAnd(), op.position());
        }
        return left;
    }

    private Expr parseAnd() throws TemplateSyntaxException {
        Expr left = parseNot();
        while (peek().isName("and")) {
            Token op = next();
            left = new Expr.Logical("and", left, parseNot(), op.position());
        }
        return left;
    }

    private Expr parseNot() throws TemplateSyntaxException {
        if (peek().isName("not")) {
            Token op = next();
            return new Expr.Not(parseNot(), op.position());
        }
        return parseCompare();
    }

    private Expr parseCompare() throws TemplateSyntaxException {
        Expr left = parseConcat();
        while (true) {
            Token token = peek();
            if (token.kind() == TokenKind.OPERATOR && COMPARISON_OPERATORS.contains(token.text())) {
                next();
                left = new Expr.Compare(token.text(), left, parseConcat(), token.position());
            } else if (token.isName("in")) {
                next();
                left = new Expr.Compare("in", left, parseConcat(), token.position());
            } else if (token.isName("not") && peek(1).isName("in")) {
                next();
                next();
                left = new Expr.Compare("not in", left, parseConcat(), token.position());
            } else {
                return left;
            }
        }
    }

    private Expr parseConcat() throws TemplateSyntaxException {
        Expr left = parseAdditive();
        while (peek().isOperator("~")) {
            Token op = next();
            left = new Expr.Binary("~", left, parseAdditive(), op.position());
        }
        return left;
    }

    private Expr parseAdditive() throws TemplateSyntaxException {
        Expr left = parseMultiplicative();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            Token op = next();
            left = new Expr.Binary(op.text(), left, parseMultiplicative(), op.position());
        }
        return left;
    }

    private Expr parseMultiplicative() throws TemplateSyntaxException {
        Expr left = parseUnary();
        while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("//")
                || peek().isOperator("%")) {
            Token op = next();
            left = new Expr.Binary(op.text(), left, parseUnary(), op.position());
        }
        return left;
    }

    private Expr parseUnary() throws TemplateSyntaxException {
        if (peek().isOperator("-")) {
            Token op = next();
            return new Expr.Negate(parseUnary(), op.position());
        }
        if (peek().isOperator("+")) {
            next();
            return parseUnary();
        }
        return parsePostfix(parsePrimary());
    }

    private Expr parsePrimary() throws TemplateSyntaxException {
        Token token = next();
        switch (token.kind()) {
            case NAME -> {
                return nameLiteral(token);
            }
            case STRING -> {
                StringBuilder value = new StringBuilder(token.text());
                while (peek().kind() == TokenKind.STRING) {
                    value.append(next().text());
                }
                return new Expr.Literal(value.toString(), token.position());
            }
            case NUMBER -> {
                return new Expr.Literal(token.text().contains(".")
                        ? (Object) Double.valueOf(token.text())
                        : (Object) Long.valueOf(token.text()), token.position());
            }
            case OPERATOR -> {
                if (token.text().equals("(")) {
                    Expr inner = parseExpression();
                    expectOperator(")");
                    return inner;
                }
                if (token.text().equals("[")) {
                    List<Expr> items = new ArrayList<>();
                    while (!peek().isOperator("]")) {
                        items.add(parseExpression());
                        if (!peek().isOperator(",")) {
                            break;
                        }
                        next();
                    }
                    expectOperator("]");
                    return new Expr.ListLiteral(items, token.position());
                }
                throw unexpected(token);
            }
            default -> throw unexpected(token);
        }
    }

    private static Expr nameLiteral(Token token) throws TemplateSyntaxException {
        return switch (token.text()) {
            case "true", "True" -> new Expr.Literal(Boolean.TRUE, token.position());
            case "false", "False" -> new Expr.Literal(Boolean.FALSE, token.position());
            case "none", "None" -> new Expr.Literal(null, token.position());
            default -> {
                if (RESERVED.contains(token.text())) {
                    throw unexpected(token);
                }
                yield new Expr.Var(token.text(), token.position());
            }
        };
    }

    private Expr parsePostfix(Expr base) throws TemplateSyntaxException {
        Expr expr = base;
        while (true) {
            Token token = peek();
            if (token.isOperator(".")) {
                next();
                Token name = next();
                if (name.kind() != TokenKind.NAME && name.kind() != TokenKind.NUMBER) {
                    throw new TemplateSyntaxException("Expected attribute name after '.'", name.position());
                }
                expr = new Expr.Attribute(expr, name.text(), token.position());
            } else if (token.isOperator("[")) {
                next();
                Expr key = parseExpression();
                expectOperator("]");
                expr = new Expr.Item(expr, key, token.position());
            } else if (token.isOperator("(")) {
                List<Expr> args = new ArrayList<>();
                Map<String, Expr> kwargs = new LinkedHashMap<>();
                parseArguments(args, kwargs);
                expr = new Expr.Call(expr, args, kwargs, token.position());
            } else if (token.isOperator("|")) {
                next();
                expr = parseFilter(expr, token.position());
            } else if (token.isName("is")) {
                next();
                expr = parseTest(expr, token.position());
            } else {
                return expr;
            }
        }
    }

    private Expr parseFilter(Expr base, SourcePosition position) throws TemplateSyntaxException {
        Token name = next();
        if (name.kind() != TokenKind.NAME) {
            throw new TemplateSyntaxException("Expected filter name after '|'", name.position());
        }
        if (!Filters.isKnown(name.text())) {
            throw new TemplateSyntaxException("Unknown filter '" + name.text() + "'", name.position());
        }
        List<Expr> args = new ArrayList<>();
        Map<String, Expr> kwargs = new LinkedHashMap<>();
        if (peek().isOperator("(")) {
            parseArguments(args, kwargs);
        }
        return new Expr.FilterApply(base, name.text(), args, kwargs, position);
    }

    private Expr parseTest(Expr base, SourcePosition position) throws TemplateSyntaxException {
        boolean negated = false;
        if (peek().isName("not")) {
            next();
            negated = true;
        }
        Token name = next();
        if (name.kind() != TokenKind.NAME) {
            throw new TemplateSyntaxException("Expected test name after 'is'", name.position());
        }
        if (!Tests.isKnown(name.text())) {
            throw new TemplateSyntaxException("Unknown test '" + name.text() + "'", name.position());
        }
        List<Expr> args = new ArrayList<>();
        if (peek().isOperator("(")) {
            Map<String, Expr> kwargs = new LinkedHashMap<>();
            parseArguments(args, kwargs);
            if (!kwargs.isEmpty()) {
                throw new TemplateSyntaxException("Tests take positional arguments only", name.position());
            }
        }
        return new Expr.IsTest(base, name.text(), negated, args, position);
    }

    /**
     * {@code ( [expr | name = expr] {, ...} [,] )}; keyword arguments must follow positional ones.
     */
    private void parseArguments(List<Expr> args, Map<String, Expr> kwargs) throws TemplateSyntaxException {
        expectOperator("(");
        while (!peek().isOperator(")")) {
            Token token = peek();
            if (token.kind() == TokenKind.NAME && peek(1).isOperator("=")) {
                next();
                next();
                if (kwargs.put(token.text(), parseExpression()) != null) {
                    throw new TemplateSyntaxException("Duplicate keyword argument '" + token.text() + "'",
                            token.position());
                }
            } else {
                if (!kwargs.isEmpty()) {
                    throw new TemplateSyntaxException("Positional argument follows keyword argument",
                            token.position());
                }
                args.add(parseExpression());
            }
            if (!peek().isOperator(",")) {
                break;
            }
            next();
        }
        expectOperator(")");
    }

    // ------------------------------------------------------------------ token helpers

    private Token peek() throws TemplateSyntaxException {
        return peek(0);
    }

    private Token peek(int offset) throws TemplateSyntaxException {
        while (lookahead.size() <= offset) {
            lookahead.add(stream.next());
        }
        return lookahead.get(offset);
    }

    private Token next() throws TemplateSyntaxException {
        Token token = peek();
        lookahead.remove(0);
        return token;
    }

    private void skip(TokenKind kind) throws TemplateSyntaxException {
        if (peek().kind() == kind) {
            next();
        }
    }

    private void expect(TokenKind kind, String description) throws TemplateSyntaxException {
        Token token = next();
        if (token.kind() != kind) {
            throw new TemplateSyntaxException("Expected " + description + " but found " + describe(token),
                    token.position());
        }
    }

    private void expectOperator(String op) throws TemplateSyntaxException {
        Token token = next();
        if (!token.isOperator(op)) {
            throw new TemplateSyntaxException("Expected '" + op + "' but found " + describe(token), token.position());
        }
    }

    private String expectName() throws TemplateSyntaxException {
        Token token = next();
        if (token.kind() != TokenKind.NAME || RESERVED.contains(token.text())) {
            throw new TemplateSyntaxException("Expected a name but found " + describe(token), token.position());
        }
        return token.text();
    }

    private static TemplateSyntaxException unexpected(Token token) {
        return new TemplateSyntaxException("Unexpected " + describe(token), token.position());
    }

    private static String describe(Token token) {
        return switch (token.kind()) {
            case EOF -> "end of template";
            case TEXT -> "text";
            default -> "'" + token.text() + "'";
        };
    }
}

package com.gddoc.template;

import java.util.List;
import java.util.Map;

import com.gddoc.template.ast.Node;
import com.gddoc.template.lexer.Lexer;
import com.gddoc.template.parser.Parser;
import com.gddoc.template.runtime.Renderer;
import com.gddoc.template.runtime.Scope;
import com.gddoc.template.runtime.Value;

/**
 * A compiled template.
 * <p>
 * Compilation happens once; a compiled template is immutable and may be rendered any number of
 * times, also concurrently, since every render gets its own scope and macro table.
 *
 * <pre>
 * Template template = Template.compile("Hello {{ name }}!");
 * String text = template.render(Map.of("name", "World"));
 * </pre>
 */
public final class Template {

    private final List<Node> nodes;

    private Template(List<Node> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public static Template compile(String source) throws TemplateSyntaxException {
        return compile(source, TemplateOptions.DEFAULTS);
    }

    public static Template compile(String source, TemplateOptions options) throws TemplateSyntaxException {
        Parser parser = new Parser(new Lexer(source, options).tokens());
        return new Template(parser.parseTemplate());
    }

    /**
     * Compiles and renders in one step.
     */
    public static String render(String source, Map<String, ?> context) throws TemplateException {
        return compile(source).render(context);
    }

    /**
     * Renders against the given context. Context values are converted with {@link Value#of(Object)}.
     *
     * @throws TemplateException on the first type or macro error; no partial output is returned
     */
    public String render(Map<String, ?> context) throws TemplateException {
        Scope root = new Scope(null);
        if (context != null) {
            for (Map.Entry<String, ?> entry : context.entrySet()) {
                root.define(entry.getKey(), Value.of(entry.getValue()));
            }
        }
        return new Renderer().render(nodes, root);
    }
}

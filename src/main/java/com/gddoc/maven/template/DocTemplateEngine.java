package com.gddoc.maven.template;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import com.gddoc.template.Template;
import com.gddoc.template.TemplateException;
import com.gddoc.template.TemplateOptions;

/**
 * Template engine backed by {@link Template}. Each template is loaded and compiled once.
 */
public class DocTemplateEngine implements TemplateEngine {
    private final TemplateLoader templateLoader;
    private final TemplateOptions options;
    private final Map<String, Template> compiled = new HashMap<>();

    public DocTemplateEngine(TemplateLoader templateLoader) {
        this(templateLoader, TemplateOptions.DEFAULTS);
    }

    public DocTemplateEngine(TemplateLoader templateLoader, TemplateOptions options) {
        this.templateLoader = templateLoader;
        this.options = options;
    }

    @Override
    public String render(String templateName, Map<String, Object> context) throws IOException, TemplateException {
        Template template = compiled.get(templateName);
        if (template == null) {
            template = Template.compile(templateLoader.loadTemplate(templateName), options);
            compiled.put(templateName, template);
        }
        return template.render(context);
    }
}

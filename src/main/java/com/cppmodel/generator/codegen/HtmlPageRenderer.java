package com.cppmodel.generator.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Wraps rendered HTML source into a standalone page using the
 * {@code page.ftl} template.
 */
public class HtmlPageRenderer {
    static final String PAGE_TEMPLATE = "page.ftl";

    private final Configuration freemarkerConfig;

    public HtmlPageRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * @param title page title, escaped by the template
     * @param body  already encoded HTML from {@link HtmlCodeGenerator}
     */
    public String render(String title, String body) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("title", title);
        model.put("body", body);

        Template template = freemarkerConfig.getTemplate(PAGE_TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + PAGE_TEMPLATE + " for " + title, e);
        }
        return out.toString();
    }
}

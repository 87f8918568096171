package com.cstruct.extractor.cli.output;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.cstruct.extractor.extract.ExtractionResult;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the two catalogs of an extraction as text. Responsible only for output.
 */
public class CatalogPrinter {

    private static final String TEMPLATE = "catalog.ftl";

    private final Configuration freemarkerConfig;

    public CatalogPrinter() {
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

    public void print(ExtractionResult result, Writer out) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("structTypes", List.copyOf(result.getStructTypes().getDefinitions()));
        model.put("values", List.copyOf(result.getValues().getValues()));

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render catalog of " + result.getSourceName(), e);
        }
        out.flush();
    }

    public String render(ExtractionResult result) throws IOException {
        StringWriter out = new StringWriter();
        print(result, out);
        return out.toString();
    }
}

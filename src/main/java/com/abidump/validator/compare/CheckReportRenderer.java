package com.abidump.validator.compare;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the human-readable report of a failed dump check.
 */
public class CheckReportRenderer {

    private static final String TEMPLATE = "check-report.ftl";

    private final Configuration freemarkerConfig;

    public CheckReportRenderer() {
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

    public String render(Path expectedFile, Path actualFile, ComparisonResult result, String dumpHint)
            throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("expectedFile", expectedFile.toString());
        model.put("actualFile", actualFile.toString());
        model.put("removedCount", result.getRemovedCount());
        model.put("addedCount", result.getAddedCount());
        model.put("diff", result.getDiff());
        model.put("dumpHint", dumpHint);

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render " + TEMPLATE, e);
        }
        return out.toString();
    }
}

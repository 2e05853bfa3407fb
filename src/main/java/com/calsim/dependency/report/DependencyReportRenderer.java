package com.calsim.dependency.report;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.calsim.dependency.model.DependencyAnalysis;
import com.calsim.dependency.model.DependencyRecord;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Formats an analysis as the plain-text dependency report.
 */
public class DependencyReportRenderer {

    static final String TEMPLATE_NAME = "dependency-report.ftl";

    private final Configuration freemarkerConfig;

    public DependencyReportRenderer() {
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
     * Renders the report, or the single "not found" line when the variable has no definition.
     */
    public String render(DependencyAnalysis analysis, Path studyDir) {
        if (!analysis.isFound()) {
            return notFoundMessage(analysis.getVariable(), studyDir) + System.lineSeparator();
        }

        Map<String, Object> model = new HashMap<>();
        model.put("variable", analysis.getVariable());
        model.put("studyDir", studyDir.toAbsolutePath().normalize().toString());
        model.put("defined", entries(analysis.getDefined()));
        model.put("inputs", entries(analysis.getInputs()));
        model.put("dependencies", entries(analysis.getDependencies()));

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ReportRenderingException("Failed to render dependency report for " + analysis.getVariable(), e);
        }
    }

    public static String notFoundMessage(String variable, Path studyDir) {
        return "Variable " + variable + " not found in " + studyDir + ".";
    }

    private List<ReportEntry> entries(List<DependencyRecord> records) {
        return records.stream().map(ReportEntry::of).collect(Collectors.toList());
    }
}

package com.calsim.dependency.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calsim.dependency.cli.model.ValidatedAnalyzeOptions;
import com.calsim.dependency.model.DependencyAnalysis;

/**
 * Responsible only for the command's log output. The report itself goes to the
 * console through the analyzer.
 */
public class AnalyzeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeResultsPrinter.class);

    public void printBanner(ValidatedAnalyzeOptions v) {
        log.info("=================================================");
        log.info("WRESL Variable Dependency Tool");
        log.info("=================================================");
        log.info("Study Directory: {}", v.getStudyDir().toAbsolutePath());
        log.info("Variable: {}", v.getVariable());
        log.info("Model File Extension: .{}", v.getExtension());
        log.info("Output File: {}", v.getOutputFile() != null ? v.getOutputFile().toAbsolutePath() : "None");
        log.info("Console Report: {}", v.isVerbose() ? "Yes" : "No (silent)");
        log.info("=================================================");
    }

    public void printSummary(DependencyAnalysis analysis) {
        if (!analysis.isFound()) {
            log.info("No definition of {} found; no report produced.", analysis.getVariable());
            return;
        }
        log.info("Definitions: {}", analysis.getDefined().size());
        log.info("Input Locations: {}", analysis.getInputs().size());
        log.info("Dependent Statements: {}", analysis.getDependencies().size());
    }

    public void printValidationErrors(Iterable<String> errors) {
        for (String error : errors) {
            log.error(error);
        }
    }
}

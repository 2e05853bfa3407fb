package com.calsim.dependency.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calsim.dependency.analysis.AnalyzerConfig;
import com.calsim.dependency.analysis.DependencyAnalyzer;
import com.calsim.dependency.cli.exception.OptionsValidationException;
import com.calsim.dependency.cli.model.AnalyzeOptions;
import com.calsim.dependency.cli.model.ValidatedAnalyzeOptions;
import com.calsim.dependency.cli.output.AnalyzeResultsPrinter;
import com.calsim.dependency.cli.validation.AnalyzeOptionsValidator;
import com.calsim.dependency.corpus.StudyNotFoundException;
import com.calsim.dependency.model.DependencyAnalysis;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command listing the definitions, inputs and dependents of one variable.
 */
@Command(
        name = "wresl-deps",
        mixinStandardHelpOptions = true,
        version = "wresl-dependency-tool 1.0.0",
        description = "For a given variable, list variables that are dependent on it and variables that feed directly into it."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Mixin
    private AnalyzeOptions options;

    @Spec
    private CommandSpec spec;

    private final AnalyzeOptionsValidator validator = new AnalyzeOptionsValidator();
    private final AnalyzeResultsPrinter printer = new AnalyzeResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedAnalyzeOptions v = validator.validate(options);
            printer.printBanner(v);

            AnalyzerConfig config = AnalyzerConfig.builder()
                    .studyDir(v.getStudyDir())
                    .variable(v.getVariable())
                    .outputFile(v.getOutputFile())
                    .verbose(v.isVerbose())
                    .fileExtension(v.getExtension())
                    .build();

            DependencyAnalysis analysis = new DependencyAnalyzer(config, spec.commandLine().getOut()).analyze();
            printer.printSummary(analysis);
            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        } catch (StudyNotFoundException e) {
            log.error(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Dependency analysis failed: {}", e.getMessage(), e);
            return 1;
        } catch (Exception e) {
            log.error("Dependency analysis failed with exception", e);
            return 1;
        }
    }
}

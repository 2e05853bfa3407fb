package com.calsim.dependency.analysis;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calsim.dependency.corpus.CorpusLoadingService;
import com.calsim.dependency.corpus.ModelFileDiscoveryService;
import com.calsim.dependency.model.Corpus;
import com.calsim.dependency.model.DependencyAnalysis;
import com.calsim.dependency.report.DependencyReportRenderer;
import com.calsim.dependency.util.FileWriteUtil;

/**
 * Runs a complete analysis: load the study, resolve the variable, then echo
 * and/or write the report.
 */
public class DependencyAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private final AnalyzerConfig config;
    private final PrintWriter console;
    private final CorpusLoadingService loadingService;
    private final DependencyResolverService resolverService;
    private final DependencyReportRenderer renderer;

    public DependencyAnalyzer(AnalyzerConfig config, PrintWriter console) {
        this.config = Objects.requireNonNull(config, "config");
        this.console = Objects.requireNonNull(console, "console");
        this.loadingService = new CorpusLoadingService(new ModelFileDiscoveryService(config.getFileExtension()));
        this.resolverService = new DependencyResolverService();
        this.renderer = new DependencyReportRenderer();
    }

    /**
     * @return the analysis; {@link DependencyAnalysis#isFound()} is false when the
     *         variable has no definition in the study
     * @throws com.calsim.dependency.corpus.StudyNotFoundException if the study directory does not exist
     * @throws IOException if a model file cannot be read or the report cannot be written
     */
    public DependencyAnalysis analyze() throws IOException {
        log.info("Analyzing dependencies of {} in {}", config.getVariable(), config.getStudyDir());

        Corpus corpus = loadingService.load(config.getStudyDir());
        CorpusIndex index = new CorpusIndex(corpus);
        log.debug("Indexed {} statements", index.statementCount());

        DependencyAnalysis analysis = resolverService.analyze(index, config.getVariable());
        if (!analysis.isFound()) {
            console.println(DependencyReportRenderer.notFoundMessage(config.getVariable(), config.getStudyDir()));
            console.flush();
            return analysis;
        }

        if (!config.isReportRequested()) {
            return analysis;
        }

        String report = renderer.render(analysis, config.getStudyDir());
        if (config.isVerbose()) {
            console.print(report);
            console.flush();
        }
        if (config.getOutputFile() != null) {
            FileWriteUtil.safeWriteString(config.getOutputFile(), report);
            log.info("Dependency report written to {}", config.getOutputFile().toAbsolutePath());
        }
        return analysis.toBuilder().report(report).build();
    }
}

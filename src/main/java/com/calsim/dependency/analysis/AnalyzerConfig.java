package com.calsim.dependency.analysis;

import java.nio.file.Path;

import com.calsim.dependency.corpus.ModelFileDiscoveryService;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for one dependency analysis run.
 */
@Data
@Builder
public class AnalyzerConfig {

    /**
     * Study directory holding the model files (searched recursively).
     */
    private Path studyDir;

    /**
     * Variable of interest, e.g. {@code S_SHSTA}.
     */
    private String variable;

    /**
     * Where to write the report. No file is written when null.
     */
    private Path outputFile;

    /**
     * Whether the report is echoed to the console.
     */
    @Builder.Default
    private boolean verbose = true;

    /**
     * Extension identifying model files, without the dot.
     */
    @Builder.Default
    private String fileExtension = ModelFileDiscoveryService.DEFAULT_EXTENSION;

    public boolean isReportRequested() {
        return verbose || outputFile != null;
    }
}

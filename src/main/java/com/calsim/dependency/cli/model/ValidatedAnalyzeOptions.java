package com.calsim.dependency.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Normalized values the command runs with. Keeps AnalyzeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnalyzeOptions {
    Path studyDir;
    String variable;
    Path outputFile;
    boolean verbose;
    String extension;
}

package com.calsim.dependency.cli.model;

import com.calsim.dependency.corpus.ModelFileDiscoveryService;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the dependency command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class AnalyzeOptions {

	@Parameters(index = "0", paramLabel = "study", description = "Absolute or relative path to the study directory.")
	private String studyDir;

	@Parameters(index = "1", paramLabel = "variable", description = "Variable of interest to determine dependencies (e.g. \"S_SHSTA\").")
	private String variable;

	@Option(names = { "--outfile",
			"-o" }, paramLabel = "output file", description = "File path for writing the dependency report to disk. If no path is provided, the report is not written to disk.")
	private String outputFile;

	@Option(names = { "--silent", "-s" }, description = "Suppress displaying the dependency report on the console.")
	private boolean silent;

	@Option(names = { "--extension",
			"-x" }, defaultValue = ModelFileDiscoveryService.DEFAULT_EXTENSION, description = "Extension of model files (default: ${DEFAULT-VALUE})")
	private String extension;

}

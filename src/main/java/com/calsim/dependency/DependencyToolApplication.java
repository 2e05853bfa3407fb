package com.calsim.dependency;

import com.calsim.dependency.cli.AnalyzeCommand;
import picocli.CommandLine;

/**
 * Main entry point for the WRESL variable dependency tool.
 * Reports where a variable is defined in a CalSim study, the variables feeding
 * into it and the variables relying on it.
 */
public class DependencyToolApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AnalyzeCommand()).execute(args);
        System.exit(exitCode);
    }
}

package com.mainframe.transpiler;

import com.mainframe.transpiler.cli.TranspileCommand;

import picocli.CommandLine;

/**
 * Main entry point of the COBOL transpiler.
 */
public class TranspilerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TranspileCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}

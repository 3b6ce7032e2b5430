package com.mainframe.transpiler.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.mainframe.transpiler.lexer.SourceFormat;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "transpile" command. No validation, no execution logic, no
 * printing.
 */
@Getter
public class TranspileOptions {

    @Option(names = { "--source-dir", "-s" }, required = true,
            description = "Directory (or single file) containing COBOL programs; repeatable")
    private List<Path> sourceDirs = new ArrayList<>();

    @Option(names = { "--copybook-dirs", "-c" },
            description = "Additional directories for resolving COPY statements (comma-separated)")
    private String copybookDirs;

    @Option(names = { "--output-dir", "-o" }, required = true, description = "Root directory of the generated sources")
    private Path outputDir;

    @Option(names = { "--target", "-t" }, defaultValue = "java", description = "Target template set: java or python")
    private String target;

    @Option(names = { "--format" }, defaultValue = "FIXED", description = "Source format: FIXED or FREE")
    private SourceFormat format;

    @Option(names = { "--right-margin" }, defaultValue = "72",
            description = "Last source column read in fixed format (default: 72)")
    private int rightMargin;

    @Option(names = { "--parallelism", "-j" }, defaultValue = "0",
            description = "Programs transpiled at once (default: number of processors)")
    private int parallelism;

    @Option(names = { "--augmentation-timeout-ms" }, defaultValue = "30000",
            description = "Timeout of one augmentation call in milliseconds")
    private long augmentationTimeoutMs;

    @Option(names = { "--augmentation-attempts" }, defaultValue = "3",
            description = "Calls made for one augmentation request before giving up")
    private int augmentationAttempts;

    @Option(names = { "--augmentation-backoff-ms" }, defaultValue = "500",
            description = "Delay before the first augmentation retry; doubled for each further retry")
    private long augmentationBackoffMs;

    @Option(names = { "--augmentation-cache-ttl-s" }, defaultValue = "3600",
            description = "Seconds an augmentation answer stays cached")
    private long augmentationCacheTtlSeconds;

    @Option(names = { "--validate" }, description = "Run each generated program through the IR interpreter")
    private boolean validate;

    @Option(names = { "--no-reports" }, description = "Do not write run-report.json and mappings.json")
    private boolean noReports;
}

package com.mainframe.transpiler.cli;

import java.time.Duration;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.cli.exception.OptionsValidationException;
import com.mainframe.transpiler.cli.model.TranspileOptions;
import com.mainframe.transpiler.cli.model.ValidatedTranspileOptions;
import com.mainframe.transpiler.cli.output.TranspileResultsPrinter;
import com.mainframe.transpiler.cli.validation.TranspileOptionsValidator;
import com.mainframe.transpiler.config.TranspilerConfig;
import com.mainframe.transpiler.orchestrator.HybridOrchestrator;
import com.mainframe.transpiler.orchestrator.RunReport;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for transpiling COBOL programs.
 *
 * Exit codes: 0 when every program succeeded (edge cases allowed), 1 when any program failed,
 * 2 when the options are invalid.
 */
@Command(
        name = "transpile",
        mixinStandardHelpOptions = true,
        version = "cobol-transpiler 1.0.0",
        description = "Transpiles fixed-format COBOL programs into Java or Python source."
)
public class TranspileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranspileCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private TranspileOptions options = new TranspileOptions();

    private final TranspileOptionsValidator validator = new TranspileOptionsValidator();
    private final TranspileResultsPrinter printer = new TranspileResultsPrinter();

    @Override
    public Integer call() {
        ValidatedTranspileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return EXIT_INVALID_OPTIONS;
        }

        try {
            printer.printBanner(options, validated);
            TranspilerConfig config = toConfig(options, validated);
            RunReport report = new HybridOrchestrator(config).run();
            printer.printSummary(report, validated, config.isWriteReports());
            return report.isSuccess() ? EXIT_OK : EXIT_FAILED;
        } catch (Exception e) {
            log.error("Transpilation failed with exception", e);
            return EXIT_FAILED;
        }
    }

    static TranspilerConfig toConfig(TranspileOptions o, ValidatedTranspileOptions v) {
        return TranspilerConfig.builder()
                .sourceRoots(v.getSourceRoots())
                .copybookDirs(v.getCopybookDirs())
                .outputRoot(v.getNormalizedOutputDir())
                .templateSet(o.getTarget())
                .sourceFormat(o.getFormat())
                .rightMargin(o.getRightMargin())
                .parallelism(v.getParallelism())
                .augmentationTimeout(Duration.ofMillis(o.getAugmentationTimeoutMs()))
                .augmentationMaxAttempts(o.getAugmentationAttempts())
                .augmentationInitialBackoff(Duration.ofMillis(o.getAugmentationBackoffMs()))
                .augmentationCacheTtl(Duration.ofSeconds(o.getAugmentationCacheTtlSeconds()))
                .validate(o.isValidate())
                .writeReports(!o.isNoReports())
                .build();
    }
}

package com.mainframe.transpiler.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import com.mainframe.transpiler.codegen.CodeGenerator;
import com.mainframe.transpiler.interp.IrInterpreter;
import com.mainframe.transpiler.lexer.SourceFormat;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration of one transpilation run.
 */
@Data
@Builder
public class TranspilerConfig {
    @Singular
    private List<Path> sourceRoots;

    @Singular
    private List<Path> copybookDirs;

    private Path outputRoot;

    @Builder.Default
    private String templateSet = CodeGenerator.DEFAULT_TEMPLATE_SET;

    @Builder.Default
    private SourceFormat sourceFormat = SourceFormat.FIXED;

    @Builder.Default
    private int rightMargin = SourceFormat.DEFAULT_FIXED_MARGIN;

    @Builder.Default
    private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

    @Builder.Default
    private Duration augmentationTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private int augmentationMaxAttempts = 3;

    @Builder.Default
    private Duration augmentationInitialBackoff = Duration.ofMillis(500);

    @Builder.Default
    private Duration augmentationCacheTtl = Duration.ofHours(1);

    /** Run every generated program through the IR interpreter and record findings on its mappings. */
    private boolean validate;

    @Builder.Default
    private long validationStepLimit = IrInterpreter.DEFAULT_STEP_LIMIT;

    /** Write {@code run-report.json} and {@code mappings.json} under the output root. */
    @Builder.Default
    private boolean writeReports = true;
}

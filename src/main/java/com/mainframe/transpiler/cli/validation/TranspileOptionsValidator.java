package com.mainframe.transpiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.mainframe.transpiler.cli.exception.OptionsValidationException;
import com.mainframe.transpiler.cli.model.TranspileOptions;
import com.mainframe.transpiler.cli.model.ValidatedTranspileOptions;
import com.mainframe.transpiler.codegen.CodeGenerator;
import com.mainframe.transpiler.lexer.SourceFormat;

public class TranspileOptionsValidator {

    /** Sequence area, indicator and area A must fit before the margin. */
    static final int MIN_RIGHT_MARGIN = 12;

    public ValidatedTranspileOptions validate(TranspileOptions o) {
        List<String> errors = new ArrayList<>();

        List<Path> sourceRoots = new ArrayList<>();
        if (o.getSourceDirs() == null || o.getSourceDirs().isEmpty()) {
            errors.add("At least one source directory is required (--source-dir / -s).");
        } else {
            for (Path p : o.getSourceDirs()) {
                if (!Files.exists(p)) {
                    errors.add("Source directory does not exist: " + p);
                } else {
                    sourceRoots.add(p.toAbsolutePath().normalize());
                }
            }
        }

        List<Path> copybookDirs = parseCopybookDirs(o.getCopybookDirs(), errors);

        Path normalizedOutputDir = null;
        if (o.getOutputDir() == null) {
            errors.add("Output directory is required (--output-dir / -o).");
        } else {
            normalizedOutputDir = o.getOutputDir().toAbsolutePath().normalize();
            if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
                errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
            }
            for (Path root : sourceRoots) {
                if (Files.isDirectory(root) && normalizedOutputDir.equals(root)) {
                    errors.add("Output directory must differ from source directory: " + root);
                }
            }
        }

        try {
            CodeGenerator.rendererFor(o.getTarget());
        } catch (IllegalArgumentException e) {
            errors.add("Unknown target '" + o.getTarget() + "'. Expected java or python.");
        }

        if (o.getFormat() == SourceFormat.FIXED && o.getRightMargin() < MIN_RIGHT_MARGIN) {
            errors.add("Right margin must be at least " + MIN_RIGHT_MARGIN + ". Got: " + o.getRightMargin());
        }
        if (o.getParallelism() < 0) {
            errors.add("Parallelism must be >= 0. Got: " + o.getParallelism());
        }
        if (o.getAugmentationTimeoutMs() <= 0) {
            errors.add("Augmentation timeout must be > 0. Got: " + o.getAugmentationTimeoutMs());
        }
        if (o.getAugmentationAttempts() < 1) {
            errors.add("Augmentation attempts must be >= 1. Got: " + o.getAugmentationAttempts());
        }
        if (o.getAugmentationBackoffMs() < 0) {
            errors.add("Augmentation backoff must be >= 0. Got: " + o.getAugmentationBackoffMs());
        }
        if (o.getAugmentationCacheTtlSeconds() <= 0) {
            errors.add("Augmentation cache TTL must be > 0. Got: " + o.getAugmentationCacheTtlSeconds());
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        int parallelism = o.getParallelism() == 0 ? Runtime.getRuntime().availableProcessors() : o.getParallelism();
        return new ValidatedTranspileOptions(sourceRoots, copybookDirs, normalizedOutputDir, parallelism);
    }

    private static boolean existsDirectory(Path p) {
        return p != null && Files.exists(p) && Files.isDirectory(p);
    }

    private static List<Path> parseCopybookDirs(String raw, List<String> errors) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        List<Path> result = Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).map(Path::of)
                .toList();

        for (Path p : result) {
            if (!existsDirectory(p)) {
                errors.add("Copybook directory does not exist or is not a directory: " + p);
            }
        }

        return result;
    }
}

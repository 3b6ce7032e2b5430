package com.mainframe.transpiler.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps TranspileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedTranspileOptions {
    List<Path> sourceRoots;
    List<Path> copybookDirs;
    Path normalizedOutputDir;
    int parallelism;
}

package com.mainframe.transpiler.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.transpiler.cli.exception.OptionsValidationException;
import com.mainframe.transpiler.cli.model.TranspileOptions;
import com.mainframe.transpiler.cli.model.ValidatedTranspileOptions;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for validating the transpile command options.
 */
class TranspileOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private final TranspileOptionsValidator validator = new TranspileOptionsValidator();

    @BeforeEach
    void setUp() throws IOException {
        sourceDir = Files.createDirectories(tempDir.resolve("cobol"));
    }

    private static TranspileOptions parse(String... args) {
        return CommandLine.populateCommand(new TranspileOptions(), args);
    }

    @Test
    void testValidOptions() throws IOException {
        Path copybooks = Files.createDirectories(tempDir.resolve("copy"));

        ValidatedTranspileOptions validated = validator.validate(parse(
                "-s", sourceDir.toString(),
                "-o", tempDir.resolve("out").toString(),
                "-c", copybooks + " , ",
                "-j", "3"));

        assertThat(validated.getSourceRoots()).containsExactly(sourceDir.toAbsolutePath().normalize());
        assertThat(validated.getCopybookDirs()).containsExactly(copybooks);
        assertThat(validated.getNormalizedOutputDir()).isEqualTo(tempDir.resolve("out").toAbsolutePath().normalize());
        assertThat(validated.getParallelism()).isEqualTo(3);
    }

    @Test
    void testDefaults() {
        TranspileOptions options = parse("-s", sourceDir.toString(), "-o", tempDir.resolve("out").toString());

        assertThat(options.getTarget()).isEqualTo("java");
        assertThat(options.getRightMargin()).isEqualTo(72);
        assertThat(options.isValidate()).isFalse();
        assertThat(validator.validate(options).getParallelism())
                .isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void testAllErrorsAreReportedTogether() {
        TranspileOptions options = parse(
                "-s", tempDir.resolve("missing").toString(),
                "-o", tempDir.resolve("out").toString(),
                "-t", "cobol",
                "--right-margin", "8",
                "-j", "-1",
                "--augmentation-attempts", "0");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors()).containsExactly(
                        "Source directory does not exist: " + tempDir.resolve("missing"),
                        "Unknown target 'cobol'. Expected java or python.",
                        "Right margin must be at least 12. Got: 8",
                        "Parallelism must be >= 0. Got: -1",
                        "Augmentation attempts must be >= 1. Got: 0"));
    }

    @Test
    void testOutputMustDifferFromSource() {
        TranspileOptions options = parse("-s", sourceDir.toString(), "-o", sourceDir.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Output directory must differ from source directory");
    }

    @Test
    void testOutputMustNotBeAFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("out.txt"), "x");
        TranspileOptions options = parse("-s", sourceDir.toString(), "-o", file.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Output path exists and is not a directory");
    }

    @Test
    void testFreeFormatIgnoresMargin() {
        TranspileOptions options = parse("-s", sourceDir.toString(), "-o", tempDir.resolve("out").toString(),
                "--format", "FREE", "--right-margin", "5");

        assertThatCode(() -> validator.validate(options)).doesNotThrowAnyException();
    }
}

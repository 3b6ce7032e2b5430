package com.mainframe.transpiler.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.cli.model.TranspileOptions;
import com.mainframe.transpiler.cli.validation.TranspileOptionsValidator;
import com.mainframe.transpiler.config.TranspilerConfig;
import com.mainframe.transpiler.lexer.SourceFormat;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the transpile command.
 */
class TranspileCommandTest {

    @TempDir
    Path tempDir;

    private static int execute(String... args) {
        return new CommandLine(new TranspileCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Test
    void testSuccessfulRun() throws IOException {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("CHOICE.cbl"), CobolSources.CHOICE);
        Path out = tempDir.resolve("out");

        int exitCode = execute("-s", src.toString(), "-o", out.toString(), "-t", "python", "-j", "1");

        assertThat(exitCode).isEqualTo(TranspileCommand.EXIT_OK);
        assertThat(out.resolve("Chooser.py")).exists();
        assertThat(out.resolve("run-report.json")).exists();
    }

    @Test
    void testFailedProgramGivesExitOne() throws IOException {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("EDGES.cbl"), CobolSources.EDGE_CASES);

        int exitCode = execute("-s", src.toString(), "-o", tempDir.resolve("out").toString(), "--no-reports");

        assertThat(exitCode).isEqualTo(TranspileCommand.EXIT_FAILED);
        assertThat(tempDir.resolve("out").resolve("run-report.json")).doesNotExist();
    }

    @Test
    void testInvalidOptionsGiveExitTwo() {
        int exitCode = execute("-s", tempDir.resolve("missing").toString(), "-o", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(TranspileCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testOptionsMapToConfig() throws IOException {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        TranspileOptions options = CommandLine.populateCommand(new TranspileOptions(),
                "-s", src.toString(), "-o", tempDir.resolve("out").toString(),
                "--format", "FREE", "--augmentation-timeout-ms", "250", "--augmentation-cache-ttl-s", "60",
                "--validate", "--no-reports", "-j", "2");

        TranspilerConfig config = TranspileCommand.toConfig(options, new TranspileOptionsValidator().validate(options));

        assertThat(config.getSourceFormat()).isEqualTo(SourceFormat.FREE);
        assertThat(config.getAugmentationTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getAugmentationCacheTtl()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getParallelism()).isEqualTo(2);
        assertThat(config.isValidate()).isTrue();
        assertThat(config.isWriteReports()).isFalse();
    }
}

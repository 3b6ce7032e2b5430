package com.mainframe.transpiler.codegen;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.transpiler.AnalyzedProgram;
import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.ir.IrProgram;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests that compile generated Java units and run them.
 */
class GeneratedJavaExecutionTest {

    private static final String CHOICE_WITH_THEN = CobolSources.fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. SELECTOR.
            DATA DIVISION.
            WORKING-STORAGE SECTION.
            01 WS-VARS.
                05 CHOICE PIC 9 VALUE 1.
                05 RESULT-VAR PIC X(10).
            PROCEDURE DIVISION.
            100-MAIN.
                IF CHOICE = 1 THEN
                    MOVE 'ONE' TO RESULT-VAR
                ELSE
                    MOVE 'OTHER' TO RESULT-VAR
                END-IF.
                DISPLAY 'CHOICE IS ' RESULT-VAR.
                STOP RUN.
            """);

    private static final String LOOPS = CobolSources.fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. LOOPS.
            DATA DIVISION.
            WORKING-STORAGE SECTION.
            01 WS-VARS.
                05 N PIC 9(3) VALUE 0.
                05 S PIC 9(3) VALUE 0.
                05 IDX PIC 9(2) VALUE 0.
            PROCEDURE DIVISION.
            100-MAIN.
                PERFORM 200-INC 3 TIMES.
                PERFORM 4 TIMES
                    ADD 1 TO N
                END-PERFORM.
                PERFORM VARYING IDX FROM 1 BY 1 UNTIL IDX > 5
                    ADD IDX TO S
                END-PERFORM.
                DISPLAY 'N=' N ' S=' S.
                STOP RUN.
            200-INC.
                ADD 1 TO N.
            """);

    @TempDir
    Path tempDir;

    /**
     * Renders, compiles and runs the unit, returning its standard output with trailing blanks
     * removed from each line.
     */
    private List<String> run(String source, String fileName, String... args) throws Exception {
        IrProgram program = AnalyzedProgram.of(source, fileName).program();
        CodeGenerator generator = new CodeGenerator();
        Path sourceDir = Files.createDirectories(tempDir.resolve("generated"));
        Path classDir = Files.createDirectories(tempDir.resolve("classes"));
        Path unit = sourceDir.resolve(generator.fileName(program));
        Files.writeString(unit, generator.render(program, Map.of()));

        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assertThat(compiler).as("system Java compiler").isNotNull();
        ByteArrayOutputStream compilerOutput = new ByteArrayOutputStream();
        int status = compiler.run(null, compilerOutput, compilerOutput, "-d", classDir.toString(), unit.toString());
        assertThat(status).as(compilerOutput.toString(StandardCharsets.UTF_8)).isZero();

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        PrintStream original = System.out;
        try (URLClassLoader loader = new URLClassLoader(new URL[] {classDir.toUri().toURL()},
                getClass().getClassLoader())) {
            Method main = loader.loadClass(program.getUnitName()).getMethod("main", String[].class);
            System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
            main.invoke(null, (Object) args);
        } finally {
            System.setOut(original);
        }
        return stdout.toString(StandardCharsets.UTF_8).lines().map(String::stripTrailing).toList();
    }

    @Test
    void testChoicePrintsOne() throws Exception {
        assertThat(run(CobolSources.CHOICE, "CHOICE.cbl")).containsExactly("CHOICE IS ONE");
    }

    @Test
    void testIfThenFormPrintsOne() throws Exception {
        assertThat(run(CHOICE_WITH_THEN, "SELECTOR.cbl")).containsExactly("CHOICE IS ONE");
    }

    @Test
    void testPerformUntilRunsSixTimes() throws Exception {
        assertThat(run(CobolSources.PERFORM_UNTIL, "COUNTING.cbl")).containsExactly("COUNTER 006");
    }

    @Test
    void testTimesAndVaryingLoops() throws Exception {
        assertThat(run(LOOPS, "LOOPS.cbl")).containsExactly("N=007 S=015");
    }

    @Test
    void testFileCopyCountsRecords() throws Exception {
        Path input = tempDir.resolve("input.txt");
        Path output = tempDir.resolve("output.txt");
        Files.write(input, List.of("ALPHA", "BETA", "GAMMA"), StandardCharsets.UTF_8);

        List<String> displayed = run(CobolSources.FILE_COPY, "FILECOPY.cbl",
                "IN-FILE=" + input, "OUT-FILE=" + output);

        assertThat(displayed).containsExactly("LINE-COUNT = 3");
        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).extracting(String::stripTrailing)
                .containsExactly("ALPHA", "BETA", "GAMMA");
    }
}

package com.mainframe.transpiler.orchestrator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.augment.AugmentationProvider;
import com.mainframe.transpiler.augment.AugmentationResult;
import com.mainframe.transpiler.config.TranspilerConfig;
import com.mainframe.transpiler.edgecase.EdgeCaseCategory;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for running the pipeline over a source tree.
 */
class HybridOrchestratorTest {

    private static final String EXEC_ONLY = CobolSources.fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. EXECONLY.
            PROCEDURE DIVISION.
            MAIN-PARA.
                EXEC SQL COMMIT END-EXEC.
                STOP RUN.
            """);

    private static final String NO_PROCEDURE = CobolSources.fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. NOPROC.
            DATA DIVISION.
            WORKING-STORAGE SECTION.
            01 WS-X PIC X.
            """);

    private static final String BAD_REDEFINES = CobolSources.fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. BADREC.
            DATA DIVISION.
            WORKING-STORAGE SECTION.
            01 GOOD-REC PIC X(4) VALUE 'OK'.
            01 OTHER-REC REDEFINES NOPE-REC PIC X(4).
            PROCEDURE DIVISION.
            MAIN-PARA.
                DISPLAY 'HELLO'.
                STOP RUN.
            USE-PARA.
                MOVE 'ABCD' TO OTHER-REC.
            """);

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        sourceDir = Files.createDirectories(tempDir.resolve("src"));
        outputDir = tempDir.resolve("out");
    }

    private TranspilerConfig.TranspilerConfigBuilder config() {
        return TranspilerConfig.builder()
                .sourceRoot(sourceDir)
                .outputRoot(outputDir)
                .parallelism(2);
    }

    private ProgramReport find(RunReport report, String source) {
        return report.getPrograms().stream()
                .filter(p -> p.getSource().equals(source))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testStatusesAndOutputs() throws IOException {
        Files.writeString(sourceDir.resolve("CHOICE.cbl"), CobolSources.CHOICE);
        Files.writeString(sourceDir.resolve("CALLER.cbl"), CobolSources.CALLER);
        Files.writeString(sourceDir.resolve("EDGES.cbl"), CobolSources.EDGE_CASES);
        Files.writeString(sourceDir.resolve("NOPROC.cbl"), NO_PROCEDURE);
        Files.writeString(sourceDir.resolve("CUSTREC.cpy"), "       01 CUST-REC PIC X(10).\n");
        Files.createDirectories(sourceDir.resolve("batch"));
        Files.writeString(sourceDir.resolve("batch/COUNTING.cbl"), CobolSources.PERFORM_UNTIL);

        RunReport report = new HybridOrchestrator(config().build()).run();

        assertThat(report.getPrograms()).extracting(ProgramReport::getSource).containsExactly(
                "CALLER.cbl", "CHOICE.cbl", "EDGES.cbl", "NOPROC.cbl", Path.of("batch", "COUNTING.cbl").toString());
        assertThat(report.isSuccess()).isFalse();
        assertThat(report.count(ProgramStatus.SUCCESS)).isEqualTo(2);
        assertThat(report.failedCount()).isEqualTo(2);

        ProgramReport choice = find(report, "CHOICE.cbl");
        assertThat(choice.getStatus()).isEqualTo(ProgramStatus.SUCCESS);
        assertThat(choice.getUnitName()).isEqualTo("Chooser");
        assertThat(choice.getStages()).startsWith(ProgramState.PARSING).endsWith(ProgramState.DONE);
        assertThat(outputDir.resolve("Chooser.java")).exists();

        ProgramReport caller = find(report, "CALLER.cbl");
        assertThat(caller.getStatus()).isEqualTo(ProgramStatus.SUCCESS_WITH_EDGE_CASES);
        assertThat(caller.getEdgeCases()).extracting(ProgramReport.EdgeCaseEntry::getCategory)
                .containsExactly(EdgeCaseCategory.EXTERNAL_CALL);

        ProgramReport edges = find(report, "EDGES.cbl");
        assertThat(edges.getStatus()).isEqualTo(ProgramStatus.FAILED);
        assertThat(edges.getOutput()).isNull();
        assertThat(edges.getStages()).endsWith(ProgramState.ERRORED);
        assertThat(outputDir.resolve("Edges.java")).doesNotExist();

        ProgramReport noProcedure = find(report, "NOPROC.cbl");
        assertThat(noProcedure.getStatus()).isEqualTo(ProgramStatus.FAILED);
        assertThat(noProcedure.getErrors()).contains("generation PARSING: PROCEDURE DIVISION could not be located");

        assertThat(outputDir.resolve("batch").resolve("Counting.java")).exists();
    }

    @Test
    void testReportsAreWritten() throws IOException {
        Files.writeString(sourceDir.resolve("CHOICE.cbl"), CobolSources.CHOICE);
        Files.writeString(sourceDir.resolve("EDGES.cbl"), CobolSources.EDGE_CASES);

        new HybridOrchestrator(config().validate(true).build()).run();

        String runReport = Files.readString(outputDir.resolve(RunReport.FILE_NAME));
        assertThat(runReport).contains("\"status\" : \"SUCCESS\"").contains("\"status\" : \"FAILED\"");
        assertThat(runReport).contains("\"mappingConfidence\" : 1.0");
        String mappings = Files.readString(outputDir.resolve(HybridOrchestrator.MAPPINGS_FILE_NAME));
        assertThat(mappings).contains("\"functionalityId\" : \"CHOOSER.MAIN-PARA\"");
        assertThat(mappings).contains("validation run executed the paragraph 1 time(s)");
    }

    @Test
    void testReportsCanBeSkipped() throws IOException {
        Files.writeString(sourceDir.resolve("CHOICE.cbl"), CobolSources.CHOICE);

        RunReport report = new HybridOrchestrator(config().writeReports(false).build()).run();

        assertThat(report.isSuccess()).isTrue();
        assertThat(outputDir.resolve(RunReport.FILE_NAME)).doesNotExist();
        assertThat(report.toJson()).contains("\"source\" : \"CHOICE.cbl\"");
    }

    @Test
    void testAugmentationHintIsRecorded() throws IOException {
        Files.writeString(sourceDir.resolve("EXECONLY.cbl"), EXEC_ONLY);
        AugmentationProvider provider = (snippet, context) -> AugmentationResult.success("commit the transaction", 0.8);

        RunReport report = new HybridOrchestrator(config().build(), provider).run();

        ProgramReport program = report.getPrograms().get(0);
        assertThat(program.getStatus()).isEqualTo(ProgramStatus.SUCCESS_WITH_EDGE_CASES);
        assertThat(program.getStages()).contains(ProgramState.AWAITING_AUGMENTATION);
        assertThat(program.getAugmentationHints()).containsValue("commit the transaction");
        assertThat(Files.readString(outputDir.resolve("Execonly.java"))).contains("hint: commit the transaction");
    }

    @Test
    void testCancelSkipsProgramsNotStarted() throws Exception {
        Files.writeString(sourceDir.resolve("A_EXEC.cbl"), EXEC_ONLY);
        Files.writeString(sourceDir.resolve("B_CHOICE.cbl"), CobolSources.CHOICE);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AugmentationProvider provider = (snippet, context) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return AugmentationResult.success("commit", 0.5);
        };

        TranspilationRun run = new HybridOrchestrator(config().parallelism(1).build(), provider).start();
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        run.cancel();
        release.countDown();
        RunReport report = run.await();

        assertThat(run.isCancelled()).isTrue();
        assertThat(report.getPrograms()).extracting(ProgramReport::getStatus)
                .containsExactly(ProgramStatus.SUCCESS_WITH_EDGE_CASES, ProgramStatus.CANCELLED);
        assertThat(outputDir.resolve("Chooser.java")).doesNotExist();
        assertThat(run.await()).isSameAs(report);
    }

    @Test
    void testSemanticErrorBlocksOnlyAffectedParagraphs() throws IOException {
        Files.writeString(sourceDir.resolve("BADREC.cbl"), BAD_REDEFINES);

        RunReport report = new HybridOrchestrator(config().build()).run();

        ProgramReport program = find(report, "BADREC.cbl");
        assertThat(program.getStatus()).isEqualTo(ProgramStatus.SUCCESS_WITH_EDGE_CASES);
        assertThat(program.getStages()).endsWith(ProgramState.DONE);
        assertThat(program.getErrors()).anyMatch(e -> e.startsWith("semantic UNDECLARED_REDEFINES"));
        assertThat(report.failedCount()).isZero();

        String generated = Files.readString(outputDir.resolve("Badrec.java"));
        assertThat(generated).contains("System.out.println(\"HELLO\");");
        assertThat(generated).contains("paragraph USE-PARA was not translated");
    }

    @Test
    void testClashingOutputFailsTheLaterProgram() throws IOException {
        Files.writeString(sourceDir.resolve("A.cbl"), CobolSources.CHOICE);
        Files.writeString(sourceDir.resolve("B.cbl"), CobolSources.CHOICE);
        Files.createDirectories(sourceDir.resolve("other"));
        Files.writeString(sourceDir.resolve("other/C.cbl"), CobolSources.CHOICE);

        RunReport report = new HybridOrchestrator(config().parallelism(1).build()).run();

        assertThat(find(report, "A.cbl").getStatus()).isEqualTo(ProgramStatus.SUCCESS);
        assertThat(find(report, Path.of("other", "C.cbl").toString()).getStatus()).isEqualTo(ProgramStatus.SUCCESS);
        ProgramReport clash = find(report, "B.cbl");
        assertThat(clash.getStatus()).isEqualTo(ProgramStatus.FAILED);
        assertThat(clash.getOutput()).isNull();
        assertThat(clash.getErrors())
                .containsExactly("generation GENERATING: output Chooser.java is already generated from A.cbl");
        assertThat(outputDir.resolve("Chooser.java")).exists();
        assertThat(outputDir.resolve("other").resolve("Chooser.java")).exists();
    }

    @Test
    void testProgramExtensions() {
        assertThat(HybridOrchestrator.isProgram(Path.of("a/PAY.cbl"))).isTrue();
        assertThat(HybridOrchestrator.isProgram(Path.of("PAY.COB"))).isTrue();
        assertThat(HybridOrchestrator.isProgram(Path.of("PAY.cobol"))).isTrue();
        assertThat(HybridOrchestrator.isProgram(Path.of("CUSTREC.cpy"))).isFalse();
        assertThat(HybridOrchestrator.isProgram(Path.of("README"))).isFalse();
    }
}

package com.mainframe.transpiler.interp;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.mainframe.transpiler.AnalyzedProgram;
import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.ir.IrProgram;
import com.mainframe.transpiler.runtime.InMemoryRecordStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for running translated programs directly.
 */
class IrInterpreterTest {

    private static IrProgram program(String source, String fileName) {
        return AnalyzedProgram.of(source, fileName).program();
    }

    private static String runner(String workingStorage, String procedure) {
        return CobolSources.fixed("""
                IDENTIFICATION DIVISION.
                PROGRAM-ID. RUNNER.
                DATA DIVISION.
                WORKING-STORAGE SECTION.
                """ + workingStorage + """
                PROCEDURE DIVISION.
                """ + procedure);
    }

    @Test
    void testConditionalMove() {
        ExecutionResult result = IrInterpreter.of(program(CobolSources.CHOICE, "CHOICE.cbl")).run();

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.isStopped()).isTrue();
        assertThat(result.getDisplayed()).hasSize(1);
        assertThat(result.getDisplayed().get(0).strip()).isEqualTo("CHOICE IS ONE");
        assertThat(result.getDisplayed().get(0)).hasSize(20);
    }

    @Test
    void testPerformUntilCountsIterations() {
        ExecutionResult result = IrInterpreter.of(program(CobolSources.PERFORM_UNTIL, "COUNTING.cbl")).run();

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.isStopped()).isTrue();
        assertThat(result.getDisplayed()).containsExactly("COUNTER 006");
        assertThat(result.getParagraphCounts()).containsEntry("100-MAIN", 1).containsEntry("200-STEP", 6);
        assertThat(result.executedParagraphs()).isEqualTo(2);
    }

    @Test
    void testFileCopy() {
        ExecutionResult result = IrInterpreter.builder()
                .program(program(CobolSources.FILE_COPY, "FILECOPY.cbl"))
                .stream("IN-FILE", new InMemoryRecordStream(List.of("ALPHA", "BETA", "GAMMA")))
                .build()
                .run();

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.getDisplayed()).containsExactly("LINE-COUNT = 3");
        List<String> written = result.getWritten().get("OUT-FILE");
        assertThat(written).hasSize(3);
        assertThat(written.get(0)).hasSize(20).startsWith("ALPHA");
        assertThat(written).extracting(String::strip).containsExactly("ALPHA", "BETA", "GAMMA");
    }

    @Test
    void testStreamFoundByAssignment() {
        ExecutionResult result = IrInterpreter.builder()
                .program(program(CobolSources.FILE_COPY, "FILECOPY.cbl"))
                .stream("INPUT.DAT", new InMemoryRecordStream(List.of("ONLY")))
                .build()
                .run();

        assertThat(result.getDisplayed()).containsExactly("LINE-COUNT = 1");
    }

    @Test
    void testExternalCallIsSkipped() {
        ExecutionResult result = IrInterpreter.of(program(CobolSources.CALLER, "CALLER.cbl")).run();

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.getExternalCalls()).containsExactly("AUDITLOG");
        assertThat(result.getDisplayed()).containsExactly("BEFORE", "AFTER");
    }

    @Test
    void testBlockedParagraphFailsTheRun() {
        ExecutionResult result = IrInterpreter.of(program(CobolSources.EDGE_CASES, "EDGES.cbl")).run();

        assertThat(result.isSucceeded()).isFalse();
        assertThat(result.getFailure()).startsWith("paragraph 100-MAIN is blocked");
        assertThat(result.getParagraphCounts()).containsEntry("100-MAIN", 1);
    }

    @Test
    void testIrreducibleRangeFailsTheRun() {
        ExecutionResult result = IrInterpreter.of(program(CobolSources.IRREDUCIBLE, "TANGLE.cbl")).run();

        assertThat(result.isSucceeded()).isFalse();
        assertThat(result.getFailure()).isEqualTo("range MAIN has several entries into one cycle");
    }

    @Test
    void testForwardGoToSkipsParagraph() {
        String source = runner("""
                01 WS-VARS.
                    05 FLAG PIC X VALUE 'Y'.
                    05 N PIC 9(2) VALUE 0.
                """, """
                100-MAIN.
                    IF FLAG = 'Y'
                        GO TO 300-SKIP
                    END-IF.
                200-MIDDLE.
                    ADD 1 TO N.
                300-SKIP.
                    DISPLAY 'N=' N.
                    STOP RUN.
                """);

        ExecutionResult result = IrInterpreter.of(program(source, "RUNNER.cbl")).run();

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.getDisplayed()).containsExactly("N=00");
        assertThat(result.getParagraphCounts()).containsEntry("200-MIDDLE", 0).containsEntry("300-SKIP", 1);
    }

    @Test
    void testTimesAndVaryingLoops() {
        String source = runner("""
                01 WS-VARS.
                    05 N PIC 9(3) VALUE 0.
                    05 S PIC 9(3) VALUE 0.
                    05 IDX PIC 9(2) VALUE 0.
                """, """
                100-MAIN.
                    PERFORM 200-INC 3 TIMES.
                    PERFORM 4 TIMES
                        ADD 1 TO N
                    END-PERFORM.
                    PERFORM VARYING IDX FROM 1 BY 1 UNTIL IDX > 5
                        ADD IDX TO S
                    END-PERFORM.
                    DISPLAY 'N=' N ' S=' S ' IDX=' IDX.
                    STOP RUN.
                200-INC.
                    ADD 1 TO N.
                """);

        ExecutionResult result = IrInterpreter.of(program(source, "RUNNER.cbl")).run();

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.getDisplayed()).containsExactly("N=007 S=015 IDX=06");
        assertThat(result.getParagraphCounts()).containsEntry("200-INC", 3);
    }

    @Test
    void testInlinePerformUntil() {
        String source = runner("""
                01 WS-VARS.
                    05 COUNTER PIC 9(3) VALUE 0.
                    05 MORE-DATA PIC X(3) VALUE 'YES'.
                """, """
                100-MAIN.
                    PERFORM UNTIL MORE-DATA = 'NO'
                        ADD 1 TO COUNTER
                        IF COUNTER > 5
                            MOVE 'NO' TO MORE-DATA
                        END-IF
                    END-PERFORM.
                    DISPLAY 'COUNTER ' COUNTER.
                    STOP RUN.
                """);

        ExecutionResult result = IrInterpreter.of(program(source, "RUNNER.cbl")).run();

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.getDisplayed()).containsExactly("COUNTER 006");
    }

    @Test
    void testTestAfterRunsBodyOnce() {
        String source = runner("""
                01 WS-VARS.
                    05 K PIC 9(2) VALUE 5.
                    05 PRE-COUNT PIC 9(2) VALUE 0.
                    05 POST-COUNT PIC 9(2) VALUE 0.
                """, """
                100-MAIN.
                    PERFORM UNTIL K > 3
                        ADD 1 TO PRE-COUNT
                    END-PERFORM.
                    PERFORM WITH TEST AFTER UNTIL K > 3
                        ADD 1 TO POST-COUNT
                    END-PERFORM.
                    DISPLAY PRE-COUNT ' ' POST-COUNT.
                    STOP RUN.
                """);

        ExecutionResult result = IrInterpreter.of(program(source, "RUNNER.cbl")).run();

        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.getDisplayed()).containsExactly("00 01");
    }

    @Test
    void testStepLimitStopsRunawayLoop() {
        String source = runner("""
                01 WS-VARS.
                    05 FLAG PIC X VALUE 'N'.
                    05 N PIC 9(2) VALUE 0.
                """, """
                100-MAIN.
                    PERFORM 200-SPIN UNTIL FLAG = 'Y'.
                    STOP RUN.
                200-SPIN.
                    ADD 1 TO N.
                """);

        ExecutionResult result = IrInterpreter.builder()
                .program(program(source, "RUNNER.cbl"))
                .stepLimit(50L)
                .build()
                .run();

        assertThat(result.isSucceeded()).isFalse();
        assertThat(result.getFailure()).isEqualTo("step limit of 50 exceeded");
    }

    @Test
    void testAcceptReadsInputLines() {
        String source = runner("""
                01 WS-NAME PIC X(5).
                """, """
                MAIN-PARA.
                    ACCEPT WS-NAME.
                    DISPLAY 'HELLO ' WS-NAME '!'.
                    STOP RUN.
                """);

        ExecutionResult result = IrInterpreter.builder()
                .program(program(source, "RUNNER.cbl"))
                .inputLine("BOB")
                .build()
                .run();

        assertThat(result.getDisplayed()).containsExactly("HELLO BOB  !");
    }

    @Test
    void testArithmeticTruncatesToPicture() {
        String source = runner("""
                01 WS-VARS.
                    05 RESULT PIC 9V9 VALUE 0.
                    05 SMALL PIC 99 VALUE 0.
                """, """
                MAIN-PARA.
                    COMPUTE RESULT = 7 / 2.
                    COMPUTE SMALL = 99 + 5.
                    DISPLAY RESULT ' ' SMALL.
                    STOP RUN.
                """);

        ExecutionResult result = IrInterpreter.of(program(source, "RUNNER.cbl")).run();

        assertThat(result.getDisplayed()).containsExactly("35 04");
    }
}

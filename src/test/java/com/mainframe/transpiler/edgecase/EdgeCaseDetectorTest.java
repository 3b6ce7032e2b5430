package com.mainframe.transpiler.edgecase;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.mainframe.transpiler.AnalyzedProgram;
import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.flow.ControlFlowResolver;
import com.mainframe.transpiler.flow.FlowAnalysis;
import com.mainframe.transpiler.parser.CobolSourceParser;
import com.mainframe.transpiler.parser.ParseResult;
import com.mainframe.transpiler.symbol.SymbolTable;
import com.mainframe.transpiler.symbol.SymbolTableBuilder;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the edge-case catalog.
 */
class EdgeCaseDetectorTest {

    @Test
    void testFindingsAreOrderedAndNumbered() {
        EdgeCaseReport report = AnalyzedProgram.of(CobolSources.EDGE_CASES, "EDGES.cbl").getEdgeCases();

        assertThat(report.getEdgeCases()).extracting(EdgeCase::getCategory).containsExactly(
                EdgeCaseCategory.EXTERNAL_CALL, EdgeCaseCategory.EMBEDDED_EXEC, EdgeCaseCategory.ALTER_STATEMENT);
        assertThat(report.getEdgeCases()).extracting(EdgeCase::getId).containsExactly("EC-1", "EC-2", "EC-3");
        assertThat(report.getEdgeCases()).extracting(e -> e.getSpan().getLine()).containsExactly(9, 10, 11);
    }

    @Test
    void testSeverities() {
        EdgeCaseReport report = AnalyzedProgram.of(CobolSources.EDGE_CASES, "EDGES.cbl").getEdgeCases();

        EdgeCase call = report.getEdgeCases().get(0);
        EdgeCase exec = report.getEdgeCases().get(1);
        EdgeCase alter = report.getEdgeCases().get(2);

        assertThat(call.getSeverity()).isEqualTo(Severity.INFORMATIONAL);
        assertThat(exec.needsAugmentation()).isTrue();
        assertThat(alter.isBlocking()).isTrue();
        assertThat(alter.getParagraph()).isEqualTo("100-MAIN");
        assertThat(alter.getSnippet()).isEqualTo("ALTER 200-SWITCH TO PROCEED TO 300-DONE");

        assertThat(report.hasBlocking()).isTrue();
        assertThat(report.isBlocked("100-MAIN")).isTrue();
        assertThat(report.isBlocked("300-DONE")).isFalse();
        assertThat(report.needingAugmentation()).containsExactly(exec);
        assertThat(report.forStatement(alter.getStatement())).containsExactly(alter);
    }

    @Test
    void testIrreducibleLoopBlocksItsParagraphs() {
        EdgeCaseReport report = AnalyzedProgram.of(CobolSources.IRREDUCIBLE, "TANGLE.cbl").getEdgeCases();

        assertThat(report.getEdgeCases()).extracting(EdgeCase::getCategory)
                .containsOnly(EdgeCaseCategory.IRREDUCIBLE_CONTROL_FLOW);
        assertThat(report.getBlockedParagraphs()).containsExactlyInAnyOrder("200-A", "300-B");
        assertThat(report.getEdgeCases().get(0).getSnippet()).startsWith("200-A .");
    }

    @Test
    void testGotoOutOfPerformedRange() {
        String source = CobolSources.fixed("""
                IDENTIFICATION DIVISION.
                PROGRAM-ID. ESCAPE.
                DATA DIVISION.
                WORKING-STORAGE SECTION.
                01 FLAG PIC X VALUE 'Y'.
                PROCEDURE DIVISION.
                100-MAIN.
                    PERFORM 200-WORK.
                    STOP RUN.
                200-WORK.
                    IF FLAG = 'Y'
                        GO TO 900-END
                    END-IF.
                900-END.
                    STOP RUN.
                """);

        EdgeCaseReport report = AnalyzedProgram.of(source, "ESCAPE.cbl").getEdgeCases();

        assertThat(report.getEdgeCases()).hasSize(1);
        EdgeCase escape = report.getEdgeCases().get(0);
        assertThat(escape.getCategory()).isEqualTo(EdgeCaseCategory.GOTO_OUT_OF_RANGE);
        assertThat(escape.needsAugmentation()).isTrue();
        assertThat(escape.getMessage()).isEqualTo("GO TO 900-END leaves performed range 200-WORK");
    }

    @Test
    void testArithmeticOnAlphanumericItem() {
        String source = CobolSources.fixed("""
                IDENTIFICATION DIVISION.
                PROGRAM-ID. MIXED.
                DATA DIVISION.
                WORKING-STORAGE SECTION.
                01 WS-TEXT PIC X(3) VALUE '012'.
                01 WS-NUM PIC 9(3) VALUE 0.
                PROCEDURE DIVISION.
                MAIN-PARA.
                    ADD WS-TEXT TO WS-NUM.
                    STOP RUN.
                """);

        EdgeCaseReport report = AnalyzedProgram.of(source, "MIXED.cbl").getEdgeCases();

        assertThat(report.getEdgeCases()).extracting(EdgeCase::getCategory)
                .containsExactly(EdgeCaseCategory.MIXED_PIC_COMPUTE);
        assertThat(report.getEdgeCases().get(0).getMessage()).isEqualTo("ADD uses non-numeric item WS-TEXT");
    }

    @Test
    void testCustomCatalog() {
        ParseResult parse = new CobolSourceParser().parse(CobolSources.EDGE_CASES, "EDGES.cbl", null);
        SymbolTable symbols = new SymbolTableBuilder().build(parse);
        FlowAnalysis flow = new ControlFlowResolver().resolve(parse, symbols);

        EdgeCaseReport report = new EdgeCaseDetector(List.of(new AlterStatementPredicate())).detect(parse, symbols, flow);

        assertThat(report.getEdgeCases()).hasSize(1);
        assertThat(report.getEdgeCases().get(0).getId()).isEqualTo("EC-1");
    }

    @Test
    void testDetectionIsDeterministic() {
        List<EdgeCase> first = AnalyzedProgram.of(CobolSources.EDGE_CASES, "EDGES.cbl").getEdgeCases().getEdgeCases();
        List<EdgeCase> second = AnalyzedProgram.of(CobolSources.EDGE_CASES, "EDGES.cbl").getEdgeCases().getEdgeCases();

        assertThat(second).isEqualTo(first);
    }
}

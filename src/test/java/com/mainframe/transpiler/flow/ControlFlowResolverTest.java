package com.mainframe.transpiler.flow;

import org.junit.jupiter.api.Test;

import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.diagnostics.SemanticErrorKind;
import com.mainframe.transpiler.parser.CobolSourceParser;
import com.mainframe.transpiler.parser.ParseResult;
import com.mainframe.transpiler.symbol.SymbolTableBuilder;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the paragraph flow graph and region structuring.
 */
class ControlFlowResolverTest {

    private FlowAnalysis resolve(String source) {
        ParseResult parse = new CobolSourceParser().parse(source, "FLOW.cbl", null);
        return new ControlFlowResolver().resolve(parse, new SymbolTableBuilder().build(parse));
    }

    private static String program(String procedure) {
        return CobolSources.fixed("""
                IDENTIFICATION DIVISION.
                PROGRAM-ID. FLOW.
                DATA DIVISION.
                WORKING-STORAGE SECTION.
                01 WS-VARS.
                    05 FLAG PIC X VALUE 'N'.
                    05 N PIC 9(2) VALUE 0.
                PROCEDURE DIVISION.
                """ + procedure);
    }

    @Test
    void testPerformedParagraphGetsItsOwnRegion() {
        FlowAnalysis flow = resolve(CobolSources.PERFORM_UNTIL);

        assertThat(flow.getWarnings()).isEmpty();
        assertThat(flow.getFailures()).isEmpty();
        assertThat(flow.getRegions()).extracting(Region::getKey).containsExactly("MAIN", "200-STEP");

        Region main = flow.getMainRegion();
        assertThat(main.getShape()).isEqualTo(RegionShape.SEQUENTIAL);
        assertThat(main.getCallSequence()).extracting(FlowNode::getName).containsExactly("100-MAIN");
        assertThat(flow.region("200-STEP").orElseThrow().getShape()).isEqualTo(RegionShape.SEQUENTIAL);
    }

    @Test
    void testPerformSitesAreClassified() {
        FlowAnalysis flow = resolve(CobolSources.PERFORM_UNTIL);

        FlowNode main = flow.getGraph().getNodes().get(0);
        PerformSite site = flow.site(main.getStatements().get(0)).orElseThrow();

        assertThat(site.getKind()).isEqualTo(PerformKind.OUT_OF_LINE);
        assertThat(site.getAnnotation()).isEqualTo(LoopAnnotation.UNTIL);
        assertThat(site.getRegion().getKey()).isEqualTo("200-STEP");
    }

    @Test
    void testPerformThruRangeKey() {
        FlowAnalysis flow = resolve(program("""
                100-MAIN.
                    PERFORM 200-FIRST THRU 300-LAST.
                    STOP RUN.
                200-FIRST.
                    ADD 1 TO N.
                300-LAST.
                    ADD 2 TO N.
                """));

        Region range = flow.region("200-FIRST..300-LAST").orElseThrow();
        assertThat(range.getMembers()).extracting(FlowNode::getName).containsExactly("200-FIRST", "300-LAST");
        assertThat(range.getShape()).isEqualTo(RegionShape.SEQUENTIAL);
    }

    @Test
    void testUnreachableParagraphWarning() {
        FlowAnalysis flow = resolve(program("""
                100-MAIN.
                    DISPLAY 'DONE'.
                    STOP RUN.
                900-DEAD.
                    DISPLAY 'NEVER'.
                """));

        assertThat(flow.getWarnings()).hasSize(1);
        FlowWarning warning = flow.getWarnings().get(0);
        assertThat(warning.getKind()).isEqualTo(FlowWarningKind.UNREACHABLE_PARAGRAPH);
        assertThat(warning.getParagraph()).isEqualTo("900-DEAD");
    }

    @Test
    void testLoopWhoseConditionNeverChanges() {
        FlowAnalysis flow = resolve(program("""
                100-MAIN.
                    PERFORM 200-SPIN UNTIL FLAG = 'Y'.
                    STOP RUN.
                200-SPIN.
                    ADD 1 TO N.
                """));

        assertThat(flow.getWarnings()).extracting(FlowWarning::getKind)
                .containsExactly(FlowWarningKind.INFINITE_LOOP_RISK);
        assertThat(flow.getWarnings().get(0).getParagraph()).isEqualTo("100-MAIN");
    }

    @Test
    void testUndeclaredTargetIsAnError() {
        FlowAnalysis flow = resolve(program("""
                100-MAIN.
                    PERFORM 200-NOWHERE.
                    STOP RUN.
                """));

        assertThat(flow.allErrors()).hasSize(1);
        SemanticError error = flow.allErrors().get(0);
        assertThat(error.getKind()).isEqualTo(SemanticErrorKind.UNDECLARED_PARAGRAPH);
        assertThat(error.getItem()).isEqualTo("200-NOWHERE");
        assertThat(flow.errorsIn("100-MAIN")).containsExactly(error);
    }

    @Test
    void testGotoLeavingPerformedRange() {
        FlowAnalysis flow = resolve(program("""
                100-MAIN.
                    PERFORM 200-WORK.
                    STOP RUN.
                200-WORK.
                    IF FLAG = 'Y'
                        GO TO 900-END
                    END-IF.
                900-END.
                    STOP RUN.
                """));

        assertThat(flow.getEscapes()).hasSize(1);
        GotoEscape escape = flow.getEscapes().get(0);
        assertThat(escape.getRegion()).isEqualTo("200-WORK");
        assertThat(escape.getParagraph()).isEqualTo("200-WORK");
        assertThat(escape.getTarget()).isEqualTo("900-END");
        assertThat(flow.getFailures()).isEmpty();
    }

    @Test
    void testLoopWithTwoEntriesIsIrreducible() {
        FlowAnalysis flow = resolve(CobolSources.IRREDUCIBLE);

        assertThat(flow.getMainRegion().getShape()).isEqualTo(RegionShape.IRREDUCIBLE);
        assertThat(flow.getFailures()).extracting(StructuringFailure::getParagraph)
                .containsExactlyInAnyOrder("200-A", "300-B");
    }

    @Test
    void testForwardGotoIsDispatch() {
        FlowAnalysis flow = resolve(program("""
                100-MAIN.
                    IF FLAG = 'Y'
                        GO TO 300-SKIP
                    END-IF.
                200-MIDDLE.
                    ADD 1 TO N.
                300-SKIP.
                    STOP RUN.
                """));

        assertThat(flow.getMainRegion().getShape()).isEqualTo(RegionShape.DISPATCH);
        assertThat(flow.getFailures()).isEmpty();
    }
}

package com.mainframe.transpiler.translate;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.mainframe.transpiler.AnalyzedProgram;
import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.ir.Assign;
import com.mainframe.transpiler.ir.Call;
import com.mainframe.transpiler.ir.Conditional;
import com.mainframe.transpiler.ir.IrParagraph;
import com.mainframe.transpiler.ir.IrProgram;
import com.mainframe.transpiler.ir.IrRegion;
import com.mainframe.transpiler.ir.Literal;
import com.mainframe.transpiler.ir.RecordAccess;
import com.mainframe.transpiler.ir.Sequence;
import com.mainframe.transpiler.ir.Stop;
import com.mainframe.transpiler.ir.Tagged;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for lowering analyzed programs to IR.
 */
class IrTranslatorTest {

    @Test
    void testProgramShape() {
        AnalyzedProgram analyzed = AnalyzedProgram.of(CobolSources.CHOICE, "CHOICE.cbl");
        IrProgram program = analyzed.program();

        assertThat(analyzed.getTranslation().hasErrors()).isFalse();
        assertThat(program.getProgramId()).isEqualTo("CHOOSER");
        assertThat(program.getUnitName()).isEqualTo("Chooser");
        assertThat(program.getSourcePath()).isEqualTo("CHOICE.cbl");
        assertThat(program.getRecords()).extracting(f -> f.getCobolName()).containsExactly("WS-VARS");
        assertThat(program.getParagraphs()).extracting(IrParagraph::getIdentifier).containsExactly("main_para");
        assertThat(program.getEntryRegion()).isEqualTo("procedure_division");

        IrRegion main = program.region("procedure_division").orElseThrow();
        assertThat(main.getBody()).isEqualTo(Sequence.of(new Call(Call.Target.PARAGRAPH, "main_para")));
    }

    @Test
    void testIfBecomesConditional() {
        IrProgram program = AnalyzedProgram.of(CobolSources.CHOICE, "CHOICE.cbl").program();

        Sequence body = (Sequence) program.paragraph("main_para").orElseThrow().getBody();
        assertThat(body.getStatements()).hasSize(3);
        assertThat(body.getStatements().get(2)).isSameAs(Stop.INSTANCE);

        Conditional conditional = (Conditional) body.getStatements().get(0);
        Assign then = (Assign) conditional.getThen();
        Assign otherwise = (Assign) conditional.getOtherwise();
        assertThat(((RecordAccess) then.getTarget()).getField().getCobolName()).isEqualTo("RESULT-VAR");
        assertThat(((Literal) then.getValue()).getValue().getText()).isEqualTo("ONE");
        assertThat(((Literal) otherwise.getValue()).getValue().getText()).isEqualTo("OTHER");
    }

    @Test
    void testSingleParagraphPerformCallsTheParagraph() {
        IrProgram program = AnalyzedProgram.of(CobolSources.PERFORM_UNTIL, "COUNTING.cbl").program();

        assertThat(program.getRegions()).extracting(IrRegion::getIdentifier)
                .containsExactly("procedure_division");
        assertThat(program.getParagraphs()).extracting(IrParagraph::getIdentifier)
                .containsExactly("p_100_main", "p_200_step");
    }

    @Test
    void testPerformThruGetsARegionUnit() {
        String source = CobolSources.fixed("""
                IDENTIFICATION DIVISION.
                PROGRAM-ID. RANGES.
                DATA DIVISION.
                WORKING-STORAGE SECTION.
                01 N PIC 9(2) VALUE 0.
                PROCEDURE DIVISION.
                100-MAIN.
                    PERFORM 200-FIRST THRU 300-SECOND.
                    STOP RUN.
                200-FIRST.
                    ADD 1 TO N.
                300-SECOND.
                    ADD 2 TO N.
                """);

        IrProgram program = AnalyzedProgram.of(source, "RANGES.cbl").program();

        assertThat(program.getRegions()).extracting(IrRegion::getIdentifier)
                .containsExactlyInAnyOrder("procedure_division", "perform_200_first_thru_300_second");
        IrRegion range = program.region("perform_200_first_thru_300_second").orElseThrow();
        assertThat(range.getBody()).isEqualTo(Sequence.of(
                new Call(Call.Target.PARAGRAPH, "p_200_first"), new Call(Call.Target.PARAGRAPH, "p_300_second")));

        Sequence main = (Sequence) program.paragraph("p_100_main").orElseThrow().getBody();
        assertThat(main.getStatements().get(0))
                .isEqualTo(new Call(Call.Target.REGION, "perform_200_first_thru_300_second"));
    }

    @Test
    void testBlockingEdgeCaseBlocksParagraph() {
        AnalyzedProgram analyzed = AnalyzedProgram.of(CobolSources.EDGE_CASES, "EDGES.cbl");
        TranslationResult translation = analyzed.getTranslation();

        assertThat(translation.blockedParagraphs()).contains("100-MAIN").doesNotContain("300-DONE");
        IrParagraph main = translation.getProgram().getParagraphs().get(0);
        assertThat(main.isBlocked()).isTrue();
        assertThat(main.getBlockedReason()).startsWith("blocked by EC-3 ALTER_STATEMENT");
        assertThat(main.getBody()).isEqualTo(Sequence.empty());
    }

    @Test
    void testEdgeCaseStatementsAreTagged() {
        IrProgram program = AnalyzedProgram.of(CobolSources.CALLER, "CALLER.cbl").program();

        Sequence body = (Sequence) program.getParagraphs().get(0).getBody();
        List<Tagged> tagged = body.getStatements().stream()
                .filter(Tagged.class::isInstance)
                .map(Tagged.class::cast)
                .toList();
        assertThat(tagged).hasSize(1);
        assertThat(tagged.get(0).getEdgeCaseIds()).containsExactly("EC-1");
    }

    @Test
    void testTranslationIsDeterministic() {
        IrProgram first = AnalyzedProgram.of(CobolSources.FILE_COPY, "FILECOPY.cbl").program();
        IrProgram second = AnalyzedProgram.of(CobolSources.FILE_COPY, "FILECOPY.cbl").program();

        assertThat(second.getParagraphs()).extracting(IrParagraph::getIdentifier)
                .containsExactlyElementsOf(first.getParagraphs().stream().map(IrParagraph::getIdentifier).toList());
        assertThat(second.getRegions()).extracting(IrRegion::getIdentifier)
                .containsExactlyElementsOf(first.getRegions().stream().map(IrRegion::getIdentifier).toList());
    }
}

package com.mainframe.transpiler.parser;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.diagnostics.SyntaxError;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.DivisionNode;
import com.mainframe.transpiler.lst.ParagraphNode;
import com.mainframe.transpiler.lst.StatementNode;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for building the tree of a program.
 */
class CobolParserTest {

    private final CobolSourceParser parser = new CobolSourceParser();

    @Test
    void testParseSimpleProgram() {
        ParseResult result = parser.parse(CobolSources.CHOICE, "CHOICE.cbl", null);

        assertThat(result.isFatal()).isFalse();
        assertThat(result.getSyntaxErrors()).isEmpty();
        assertThat(result.getProgramId()).isEqualTo("CHOOSER");
        assertThat(result.getDivisions()).extracting(DivisionNode::getName)
                .containsExactly("IDENTIFICATION", "DATA", "PROCEDURE");

        List<ParagraphNode> paragraphs = result.procedureDivision().orElseThrow().paragraphs();
        assertThat(paragraphs).extracting(ParagraphNode::getName).containsExactly("MAIN-PARA");
        assertThat(paragraphs.get(0).statements()).extracting(StatementNode::getVerb)
                .containsExactly("IF", "DISPLAY", "STOP");
    }

    @Test
    void testIfBranchesAreNested() {
        ParseResult result = parser.parse(CobolSources.CHOICE, "CHOICE.cbl", null);

        StatementNode ifStatement = result.procedureDivision().orElseThrow()
                .paragraphs().get(0).statements().get(0);

        List<StatementNode> then = ifStatement.body(ClauseRole.THEN);
        List<StatementNode> otherwise = ifStatement.body(ClauseRole.ELSE);
        assertThat(then).hasSize(1);
        assertThat(otherwise).hasSize(1);
        assertThat(then.get(0).toSourceText()).isEqualTo("MOVE \"ONE\" TO RESULT-VAR");
        assertThat(otherwise.get(0).toSourceText()).isEqualTo("MOVE \"OTHER\" TO RESULT-VAR");
        assertThat(ifStatement.getSpan().getLine()).isEqualTo(10);
        assertThat(ifStatement.getSpan().getEndLine()).isEqualTo(14);
    }

    @Test
    void testSyntaxErrorAbandonsOnlyTheParagraph() {
        String source = CobolSources.fixed("""
                IDENTIFICATION DIVISION.
                PROGRAM-ID. BROKEN.
                PROCEDURE DIVISION.
                FIRST-PARA.
                    MOVE TO.
                    DISPLAY 'NEVER PARSED'.
                SECOND-PARA.
                    DISPLAY 'STILL HERE'.
                """);

        ParseResult result = parser.parse(source, "BROKEN.cbl", null);

        assertThat(result.isFatal()).isFalse();
        assertThat(result.getSyntaxErrors()).hasSize(1);
        SyntaxError error = result.getSyntaxErrors().get(0);
        assertThat(error.getFileName()).isEqualTo("BROKEN.cbl");
        assertThat(error.getLine()).isEqualTo(5);
        assertThat(error.getParagraph()).isEqualTo("FIRST-PARA");

        List<ParagraphNode> paragraphs = result.procedureDivision().orElseThrow().paragraphs();
        assertThat(paragraphs).extracting(ParagraphNode::getName).containsExactly("FIRST-PARA", "SECOND-PARA");
        assertThat(paragraphs.get(0).statements()).extracting(StatementNode::getVerb)
                .containsExactly(StatementNode.UNPARSED);
        assertThat(paragraphs.get(1).statements()).extracting(StatementNode::getVerb)
                .containsExactly("DISPLAY");
    }

    @Test
    void testMissingProcedureDivisionIsFatal() {
        String source = CobolSources.fixed("""
                IDENTIFICATION DIVISION.
                PROGRAM-ID. NOPROC.
                DATA DIVISION.
                WORKING-STORAGE SECTION.
                01 WS-X PIC X.
                """);

        ParseResult result = parser.parse(source, "NOPROC.cbl", null);

        assertThat(result.isFatal()).isTrue();
        assertThat(result.getFatalReason()).isEqualTo("PROCEDURE DIVISION could not be located");
    }

    @Test
    void testPerformUntilClauses() {
        ParseResult result = parser.parse(CobolSources.PERFORM_UNTIL, "COUNTING.cbl", null);

        StatementNode perform = result.procedureDivision().orElseThrow()
                .paragraphs().get(0).statements().get(0);

        assertThat(perform.isVerb("PERFORM")).isTrue();
        assertThat(perform.hasClause(ClauseRole.PROCEDURE)).isTrue();
        assertThat(perform.hasClause(ClauseRole.UNTIL)).isTrue();
        assertThat(perform.hasClause(ClauseRole.TIMES)).isFalse();
    }

    @Test
    void testReadAtEndBlocks() {
        ParseResult result = parser.parse(CobolSources.FILE_COPY, "FILECOPY.cbl", null);

        StatementNode perform = result.procedureDivision().orElseThrow()
                .paragraphs().get(0).statements().get(1);
        StatementNode read = perform.body(ClauseRole.BODY).get(0);

        assertThat(result.getSyntaxErrors()).isEmpty();
        assertThat(read.isVerb("READ")).isTrue();
        assertThat(read.body(ClauseRole.AT_END)).extracting(StatementNode::getVerb).containsExactly("MOVE");
        assertThat(read.body(ClauseRole.NOT_AT_END)).extracting(StatementNode::getVerb)
                .containsExactly("MOVE", "WRITE", "ADD");
    }
}

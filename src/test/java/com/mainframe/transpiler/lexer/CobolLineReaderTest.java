package com.mainframe.transpiler.lexer;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for splitting source lines into reference-format areas.
 */
class CobolLineReaderTest {

    private final CobolLineReader reader = new CobolLineReader();

    @Test
    void testFixedFormatAreas() {
        List<SourceLine> lines = reader.read("000100 IDENTIFICATION DIVISION.\n", "PROG.cbl");

        assertThat(lines).hasSize(1);
        SourceLine line = lines.get(0);
        assertThat(line.getKind()).isEqualTo(LineKind.CODE);
        assertThat(line.getSequenceArea()).isEqualTo("000100");
        assertThat(line.getContent()).isEqualTo("IDENTIFICATION DIVISION.");
        assertThat(line.getContentColumn()).isEqualTo(8);
        assertThat(line.getNumber()).isEqualTo(1);
        assertThat(line.getFileName()).isEqualTo("PROG.cbl");
    }

    @Test
    void testIndicatorKinds() {
        String source = String.join("\n",
                "      * a comment",
                "      / page eject",
                "      -    'CONTINUED'.",
                "      D    DISPLAY 'DEBUG'.",
                "",
                "           MOVE 1 TO X.");

        List<SourceLine> lines = reader.read(source, "PROG.cbl");

        assertThat(lines).extracting(SourceLine::getKind).containsExactly(
                LineKind.COMMENT, LineKind.COMMENT, LineKind.CONTINUATION, LineKind.DEBUG,
                LineKind.BLANK, LineKind.CODE);
    }

    @Test
    void testTextBeyondRightMarginIsDropped() {
        String line = "       DISPLAY 'HELLO'." + " ".repeat(49) + "SEQ00010";
        assertThat(line.length()).isEqualTo(80);

        SourceLine read = reader.read(line, "PROG.cbl").get(0);

        assertThat(read.getContent()).hasSize(65);
        assertThat(read.getContent()).doesNotContain("SEQ");
        assertThat(read.getContent().strip()).isEqualTo("DISPLAY 'HELLO'.");
    }

    @Test
    void testCustomRightMargin() {
        CobolLineReader narrow = new CobolLineReader(SourceFormat.FIXED, 20);

        SourceLine read = narrow.read("       DISPLAY 'HELLO WORLD'.", "PROG.cbl").get(0);

        assertThat(narrow.contentWidth()).isEqualTo(13);
        assertThat(read.getContent()).isEqualTo("DISPLAY 'HELL");
    }

    @Test
    void testTrailingNewlineIsNotALine() {
        assertThat(reader.read("       STOP RUN.\n", "PROG.cbl")).hasSize(1);
        assertThat(reader.read("       STOP RUN.\r\n       EXIT.\r\n", "PROG.cbl")).hasSize(2);
    }

    @Test
    void testFreeFormat() {
        CobolLineReader free = new CobolLineReader(SourceFormat.FREE, 0);

        List<SourceLine> lines = free.read("*> note\nDISPLAY 'X'.\n", "PROG.cbl");

        assertThat(lines.get(0).getKind()).isEqualTo(LineKind.COMMENT);
        assertThat(lines.get(0).getContent()).isEqualTo(" note");
        assertThat(lines.get(1).getKind()).isEqualTo(LineKind.CODE);
        assertThat(lines.get(1).getContentColumn()).isEqualTo(1);
        assertThat(lines.get(1).getContent()).isEqualTo("DISPLAY 'X'.");
    }
}

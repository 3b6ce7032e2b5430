package com.mainframe.transpiler.lexer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for COPY member expansion.
 */
class CopyMemberResolverTest {

    @TempDir
    Path tempDir;

    private final CobolLineReader reader = new CobolLineReader();

    private ExpandedSource expand(Path primaryDir, List<Path> dirs, String... lines) {
        List<SourceLine> read = reader.read(String.join("\n", lines), "MAIN.cbl");
        return new CopyMemberResolver(primaryDir, dirs, reader).expand(read);
    }

    @Test
    void testMemberIsSplicedInPlace() throws IOException {
        Files.writeString(tempDir.resolve("CUSTREC.cpy"), String.join("\n",
                "       01 CUSTOMER-REC.",
                "           05 CUST-ID PIC 9(6).",
                ""));

        ExpandedSource expanded = expand(tempDir, List.of(),
                "       WORKING-STORAGE SECTION.",
                "       COPY CUSTREC.",
                "       PROCEDURE DIVISION.");

        assertThat(expanded.getUnresolved()).isEmpty();
        assertThat(expanded.getIncludedMembers()).containsExactly("CUSTREC");
        assertThat(expanded.getLines()).extracting(l -> l.getContent().strip()).containsExactly(
                "WORKING-STORAGE SECTION.",
                "01 CUSTOMER-REC.",
                "05 CUST-ID PIC 9(6).",
                "PROCEDURE DIVISION.");
        assertThat(expanded.getLines().get(1).getFileName()).isEqualTo("CUSTREC.cpy");
    }

    @Test
    void testCopybookDirectoriesAreSearchedAfterPrimary() throws IOException {
        Path copybooks = Files.createDirectories(tempDir.resolve("copybooks"));
        Files.writeString(copybooks.resolve("dates.cpy"), "       01 WS-DATE PIC 9(8).\n");

        ExpandedSource expanded = expand(tempDir.resolve("missing"), List.of(copybooks), "       COPY DATES.");

        assertThat(expanded.getUnresolved()).isEmpty();
        assertThat(expanded.getLines()).hasSize(1);
        assertThat(expanded.getLines().get(0).getContent()).contains("WS-DATE");
    }

    @Test
    void testMissingMemberIsUnresolved() {
        ExpandedSource expanded = expand(tempDir, List.of(), "       COPY NOWHERE.");

        assertThat(expanded.getLines()).isEmpty();
        assertThat(expanded.getUnresolved()).hasSize(1);
        UnresolvedCopy missing = expanded.getUnresolved().get(0);
        assertThat(missing.getMemberName()).isEqualTo("NOWHERE");
        assertThat(missing.getLine()).isEqualTo(1);
        assertThat(missing.getReason()).contains("Missing copybook");
    }

    @Test
    void testReplacingIsReportedAsUnsupported() throws IOException {
        Files.writeString(tempDir.resolve("TEMPLATE.cpy"), "       01 :TAG:-REC PIC X.\n");

        ExpandedSource expanded = expand(tempDir, List.of(), "       COPY TEMPLATE REPLACING ==:TAG:== BY ==WS==.");

        assertThat(expanded.getUnresolved()).hasSize(1);
        assertThat(expanded.getUnresolved().get(0).getReason()).contains("REPLACING");
    }

    @Test
    void testRecursiveCopyIsDetected() throws IOException {
        Files.writeString(tempDir.resolve("A.cpy"), "       COPY B.\n");
        Files.writeString(tempDir.resolve("B.cpy"), "       COPY A.\n");

        ExpandedSource expanded = expand(tempDir, List.of(), "       COPY A.");

        assertThat(expanded.getUnresolved()).hasSize(1);
        assertThat(expanded.getUnresolved().get(0).getReason()).startsWith("Recursive COPY A");
        assertThat(expanded.getIncludedMembers()).containsExactly("A", "B");
    }
}

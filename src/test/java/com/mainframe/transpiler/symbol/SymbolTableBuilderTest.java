package com.mainframe.transpiler.symbol;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.diagnostics.SemanticErrorKind;
import com.mainframe.transpiler.parser.CobolSourceParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for building the typed record hierarchy.
 */
class SymbolTableBuilderTest {

    private SymbolTable build(String dataDivision) {
        String source = CobolSources.fixed("""
                IDENTIFICATION DIVISION.
                PROGRAM-ID. DATATEST.
                DATA DIVISION.
                WORKING-STORAGE SECTION.
                """ + dataDivision + """
                PROCEDURE DIVISION.
                MAIN-PARA.
                    STOP RUN.
                """);
        return new SymbolTableBuilder().build(new CobolSourceParser().parse(source, "DATATEST.cbl", null));
    }

    @Test
    void testOffsetsAndSizes() {
        SymbolTable symbols = build("""
                01 CUSTOMER-REC.
                    05 CUST-ID PIC 9(6).
                    05 CUST-NAME PIC X(20).
                    05 BALANCE PIC S9(7)V99 COMP-3.
                    05 FLAGS.
                        10 ACTIVE-FLAG PIC X.
                            88 IS-ACTIVE VALUE 'Y'.
                        10 TIER PIC 9.
                """);

        assertThat(symbols.getErrors()).isEmpty();
        DataItem record = symbols.resolve("CUSTOMER-REC").getItem();
        assertThat(record.isRecord()).isTrue();
        assertThat(record.isGroup()).isTrue();
        assertThat(record.getSize()).isEqualTo(6 + 20 + 5 + 2);

        DataItem balance = symbols.resolve("BALANCE").getItem();
        assertThat(balance.getOffset()).isEqualTo(26);
        assertThat(balance.getSize()).isEqualTo(5);
        assertThat(balance.getUsage()).isEqualTo(Usage.PACKED_DECIMAL);
        assertThat(balance.getType()).isEqualTo(new NumericType(7, 2, true, Usage.PACKED_DECIMAL));

        DataItem tier = symbols.resolve("TIER").getItem();
        assertThat(tier.getOffset()).isEqualTo(32);
        assertThat(tier.path()).extracting(DataItem::getName).containsExactly("CUSTOMER-REC", "FLAGS", "TIER");

        DataItem active = symbols.resolve("ACTIVE-FLAG").getItem();
        assertThat(active.getConditionNames()).extracting(DataItem::getName).containsExactly("IS-ACTIVE");
        assertThat(symbols.resolve("IS-ACTIVE").getItem().isConditionName()).isTrue();
    }

    @Test
    void testOccursMultipliesSize() {
        SymbolTable symbols = build("""
                01 TABLE-REC.
                    05 ENTRY-COUNT PIC 9(2).
                    05 ENTRIES OCCURS 10 TIMES.
                        10 ENTRY-CODE PIC X(3).
                        10 ENTRY-QTY PIC 9(4).
                """);

        DataItem entries = symbols.resolve("ENTRIES").getItem();
        assertThat(entries.getOccurs().getMax()).isEqualTo(10);
        assertThat(entries.getSize()).isEqualTo(7);
        assertThat(entries.totalSize()).isEqualTo(70);
        assertThat(symbols.resolve("TABLE-REC").getItem().getSize()).isEqualTo(72);
        assertThat(symbols.resolve("ENTRY-QTY").getItem().occursChain()).containsExactly(entries);
    }

    @Test
    void testRedefinesSharesOffset() {
        SymbolTable symbols = build("""
                01 DATE-REC.
                    05 DATE-NUM PIC 9(8).
                    05 DATE-PARTS REDEFINES DATE-NUM.
                        10 DATE-YEAR PIC 9(4).
                        10 DATE-MONTH PIC 9(2).
                        10 DATE-DAY PIC 9(2).
                """);

        DataItem parts = symbols.resolve("DATE-PARTS").getItem();
        assertThat(parts.getRedefines().getName()).isEqualTo("DATE-NUM");
        assertThat(parts.getOffset()).isZero();
        assertThat(symbols.resolve("DATE-DAY").getItem().getOffset()).isEqualTo(6);
        assertThat(symbols.resolve("DATE-REC").getItem().getSize()).isEqualTo(8);
    }

    @Test
    void testQualifiedReferences() {
        SymbolTable symbols = build("""
                01 INPUT-REC.
                    05 AMOUNT PIC 9(5).
                01 OUTPUT-REC.
                    05 AMOUNT PIC 9(7).
                """);

        Resolution unqualified = symbols.resolve("AMOUNT");
        assertThat(unqualified.getStatus()).isEqualTo(Resolution.Status.AMBIGUOUS);
        assertThat(unqualified.getCandidates()).hasSize(2);

        Resolution qualified = symbols.resolve("AMOUNT", List.of("OUTPUT-REC"));
        assertThat(qualified.isResolved()).isTrue();
        assertThat(qualified.getItem().getSize()).isEqualTo(7);

        assertThat(symbols.resolve("NOTHING").getStatus()).isEqualTo(Resolution.Status.UNDECLARED);
    }

    @Test
    void testDeclarationErrorsAreCollected() {
        SymbolTable symbols = build("""
                01 BAD-REC.
                    05 BAD-PIC PIC 9V9V9.
                    05 ALIAS REDEFINES MISSING-ITEM PIC X(4).
                01 GOOD-REC.
                    05 GOOD-FIELD PIC X(4).
                """);

        assertThat(symbols.getErrors()).extracting(SemanticError::getKind).containsExactly(
                SemanticErrorKind.INVALID_PICTURE, SemanticErrorKind.UNDECLARED_REDEFINES);
        assertThat(symbols.getErrors().get(0).getItem()).isEqualTo("BAD-PIC");
        assertThat(symbols.hasErrors()).isTrue();
        assertThat(symbols.resolve("GOOD-FIELD").isResolved()).isTrue();
    }

    @Test
    void testOversizedOccursCountIsReported() {
        SymbolTable symbols = build("""
                01 CODE-TABLE.
                    05 CODE-SLOT PIC X OCCURS 99999999999 TIMES.
                01 GOOD-REC PIC X(4).
                """);

        assertThat(symbols.getErrors()).extracting(SemanticError::getKind)
                .containsExactly(SemanticErrorKind.INVALID_OCCURS);
        assertThat(symbols.getErrors().get(0).getItem()).isEqualTo("CODE-SLOT");
        assertThat(symbols.getErrors().get(0).getMessage()).contains("99999999999");
        assertThat(symbols.resolve("GOOD-REC").isResolved()).isTrue();
    }

    @Test
    void testFileDefinitions() {
        SymbolTable symbols = new SymbolTableBuilder()
                .build(new CobolSourceParser().parse(CobolSources.FILE_COPY, "FILECOPY.cbl", null));

        assertThat(symbols.getErrors()).isEmpty();
        FileDefinition input = symbols.file("IN-FILE").orElseThrow();
        assertThat(input.getAssignment()).isEqualTo("INPUT.DAT");
        assertThat(input.getOrganization()).isEqualTo("SEQUENTIAL");
        assertThat(input.isSelected()).isTrue();
        assertThat(input.getRecords()).extracting(DataItem::getName).containsExactly("IN-RECORD");
        assertThat(input.recordLength()).isEqualTo(20);
        assertThat(symbols.resolve("IN-RECORD").getItem().getFile()).isSameAs(input);
        assertThat(symbols.files()).hasSize(2);
    }
}

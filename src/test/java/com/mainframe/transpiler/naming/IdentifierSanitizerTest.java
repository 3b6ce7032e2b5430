package com.mainframe.transpiler.naming;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for identifier sanitizing and name scopes.
 */
class IdentifierSanitizerTest {

    @ParameterizedTest
    @CsvSource({
        "CUSTOMER-NAME, DATA, customer_name",
        "100-MAIN, PARAGRAPH, p_100_main",
        "01-TOTAL, DATA, f_01_total",
        "CLASS, DATA, class_",
        "PASS, PARAGRAPH, pass_",
        "WS$AMT, DATA, ws_amt"
    })
    void testSanitize(String cobolName, NameKind kind, String expected) {
        assertThat(IdentifierSanitizer.sanitize(cobolName, kind)).isEqualTo(expected);
    }

    @Test
    void testBlankNames() {
        assertThat(IdentifierSanitizer.sanitize(null, NameKind.PARAGRAPH)).isEqualTo("p_unnamed");
        assertThat(IdentifierSanitizer.sanitize("  ", NameKind.DATA)).isEqualTo("f_unnamed");
    }

    @Test
    void testReservedWordsOfBothTargets() {
        assertThat(IdentifierSanitizer.isReserved("while")).isTrue();
        assertThat(IdentifierSanitizer.isReserved("lambda")).isTrue();
        assertThat(IdentifierSanitizer.isReserved("Record")).isTrue();
        assertThat(IdentifierSanitizer.isReserved("customer")).isFalse();
    }

    @Test
    void testNameScopeSuffixesCollisions() {
        NameScope scope = new NameScope();

        assertThat(scope.claim("IN-REC", NameKind.DATA)).isEqualTo("in_rec");
        assertThat(scope.claim("IN_REC", NameKind.DATA)).isEqualTo("in_rec_2");
        assertThat(scope.claim("in_rec")).isEqualTo("in_rec_3");
        assertThat(scope.isUsed("in_rec_2")).isTrue();
    }

    @Test
    void testReservedNameIsSkipped() {
        NameScope scope = new NameScope();
        scope.reserve("total");

        assertThat(scope.claim("total")).isEqualTo("total_2");
    }

    @ParameterizedTest
    @CsvSource({
        "CUSTOMER-RECORD, CustomerRecord",
        "ws_totals, WsTotals",
        "1ST-PASS, T1stPass",
        "'', Type"
    })
    void testToPascalCase(String input, String expected) {
        assertThat(NamingUtil.toPascalCase(input)).isEqualTo(expected);
    }

    @Test
    void testUnitName() {
        assertThat(NamingUtil.unitName("PAYROLL", "PAYROLL.cbl")).isEqualTo("Payroll");
        assertThat(NamingUtil.unitName(null, "batch/daily-report.cbl")).isEqualTo("DailyReport");
        assertThat(NamingUtil.unitName("RECORD", "X.cbl")).isEqualTo("RecordProgram");
    }
}

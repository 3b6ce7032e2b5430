package com.mainframe.transpiler.mapping;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.mainframe.transpiler.AnalyzedProgram;
import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.augment.AugmentationError;
import com.mainframe.transpiler.augment.AugmentationResult;
import com.mainframe.transpiler.interp.ExecutionResult;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for creating and validating functionality mappings.
 */
class MappingFactoryTest {

    private static final String EXEC_ONLY = CobolSources.fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. EXECONLY.
            PROCEDURE DIVISION.
            MAIN-PARA.
                EXEC SQL COMMIT END-EXEC.
                STOP RUN.
            """);

    private final MappingFactory factory = new MappingFactory();

    private static List<FunctionalityMapping> create(AnalyzedProgram analyzed, Map<String, AugmentationResult> hints) {
        return new MappingFactory().create(analyzed.program(), analyzed.getEdgeCases().getEdgeCases(), hints);
    }

    @Test
    void testExactMapping() {
        AnalyzedProgram analyzed = AnalyzedProgram.of(CobolSources.CHOICE, "CHOICE.cbl");

        List<FunctionalityMapping> mappings = factory.create(analyzed.program(),
                analyzed.getEdgeCases().getEdgeCases(), Map.of());

        assertThat(mappings).hasSize(1);
        FunctionalityMapping mapping = mappings.get(0);
        assertThat(mapping.getFunctionalityId()).isEqualTo("CHOOSER.MAIN-PARA");
        assertThat(mapping.getSourceName()).isEqualTo("CHOICE.cbl:MAIN-PARA");
        assertThat(mapping.getTargetName()).isEqualTo("Chooser.main_para");
        assertThat(mapping.getEquivalenceLevel()).isEqualTo(EquivalenceLevel.EXACT);
        assertThat(mapping.getConfidence()).isEqualTo(1.0);
        assertThat(mapping.getFindings()).isEmpty();
    }

    @Test
    void testInformationalEdgeCaseIsHigh() {
        List<FunctionalityMapping> mappings = create(AnalyzedProgram.of(CobolSources.CALLER, "CALLER.cbl"), Map.of());

        assertThat(mappings).extracting(FunctionalityMapping::getEquivalenceLevel).containsExactly(EquivalenceLevel.HIGH);
    }

    @Test
    void testAugmentationDecidesBetweenLowAndMedium() {
        AnalyzedProgram analyzed = AnalyzedProgram.of(EXEC_ONLY, "EXECONLY.cbl");
        String id = analyzed.getEdgeCases().getEdgeCases().get(0).getId();

        assertThat(create(analyzed, Map.of()).get(0).getEquivalenceLevel()).isEqualTo(EquivalenceLevel.LOW);
        assertThat(create(analyzed, Map.of(id, AugmentationResult.failure(AugmentationError.TIMEOUT)))
                .get(0).getEquivalenceLevel()).isEqualTo(EquivalenceLevel.LOW);

        FunctionalityMapping helped = create(analyzed, Map.of(id, AugmentationResult.success("commit the unit of work", 0.8))).get(0);
        assertThat(helped.getEquivalenceLevel()).isEqualTo(EquivalenceLevel.MEDIUM);
        assertThat(helped.getConfidence()).isEqualTo(0.75);
    }

    @Test
    void testBlockedParagraphIsPartial() {
        List<FunctionalityMapping> mappings = create(AnalyzedProgram.of(CobolSources.EDGE_CASES, "EDGES.cbl"), Map.of());

        assertThat(mappings).extracting(FunctionalityMapping::getFunctionalityId)
                .containsExactly("EDGES.100-MAIN", "EDGES.200-SWITCH", "EDGES.300-DONE");
        assertThat(mappings.get(0).getEquivalenceLevel()).isEqualTo(EquivalenceLevel.PARTIAL);
        assertThat(mappings.get(2).getEquivalenceLevel()).isEqualTo(EquivalenceLevel.EXACT);
    }

    @Test
    void testConfidenceOutsideRangeIsRejected() {
        assertThatThrownBy(() -> new FunctionalityMapping("P.X", "p.cbl:X", "P.x", EquivalenceLevel.HIGH, 1.5, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testValidationRecordsFindings() {
        AnalyzedProgram analyzed = AnalyzedProgram.of(CobolSources.PERFORM_UNTIL, "COUNTING.cbl");
        List<FunctionalityMapping> mappings = create(analyzed, Map.of());

        ExecutionResult run = new MappingValidator().validate(analyzed.program(), mappings);

        assertThat(run.isSucceeded()).isTrue();
        assertThat(mappings.get(0).getFindings()).containsExactly("validation run executed the paragraph 1 time(s)");
        assertThat(mappings.get(1).getFindings()).containsExactly("validation run executed the paragraph 6 time(s)");
    }

    @Test
    void testValidationOfFailingRun() {
        AnalyzedProgram analyzed = AnalyzedProgram.of(CobolSources.EDGE_CASES, "EDGES.cbl");
        List<FunctionalityMapping> mappings = create(analyzed, Map.of());

        new MappingValidator().validate(analyzed.program(), mappings);

        assertThat(mappings.get(0).getFindings()).hasSize(2);
        assertThat(mappings.get(0).getFindings().get(1)).startsWith("validation run failed: paragraph 100-MAIN is blocked");
        assertThat(mappings.get(1).getFindings()).startsWith("validation run did not reach the paragraph");
    }
}

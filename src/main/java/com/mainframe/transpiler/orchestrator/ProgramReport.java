package com.mainframe.transpiler.orchestrator;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.mainframe.transpiler.augment.AugmentationError;
import com.mainframe.transpiler.edgecase.EdgeCase;
import com.mainframe.transpiler.edgecase.EdgeCaseCategory;
import com.mainframe.transpiler.edgecase.Severity;
import com.mainframe.transpiler.mapping.FunctionalityMapping;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one program: what came out, what was found and which stages it went through.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgramReport {
    String source;
    String programId;
    String unitName;
    ProgramStatus status;

    /** Generated file; null when the program failed. */
    String output;

    @Singular("stage")
    List<ProgramState> stages;

    @Singular
    List<EdgeCaseEntry> edgeCases;

    @Singular
    List<String> errors;

    @Singular
    List<String> warnings;

    /** Hints recorded against edge cases, by edge-case id. */
    @Singular
    Map<String, String> augmentationHints;

    @Singular
    Map<String, AugmentationError> augmentationErrors;

    /** Mean confidence of the program's mappings; only when validation ran. */
    Double mappingConfidence;

    long elapsedMillis;

    @JsonIgnore
    @Singular
    List<FunctionalityMapping> mappings;

    @Value
    public static class EdgeCaseEntry {
        String id;
        EdgeCaseCategory category;
        Severity severity;
        String location;
        String paragraph;
        String message;

        public static EdgeCaseEntry of(EdgeCase edgeCase) {
            return new EdgeCaseEntry(edgeCase.getId(), edgeCase.getCategory(), edgeCase.getSeverity(),
                    edgeCase.location(), edgeCase.getParagraph(), edgeCase.getMessage());
        }
    }

    public static ProgramReport cancelled(String source) {
        return ProgramReport.builder()
                .source(source)
                .status(ProgramStatus.CANCELLED)
                .build();
    }
}

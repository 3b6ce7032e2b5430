package com.mainframe.transpiler.diagnostics;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.transpiler.augment.AugmentationError;
import com.mainframe.transpiler.edgecase.EdgeCase;
import com.mainframe.transpiler.flow.FlowWarning;
import com.mainframe.transpiler.flow.StructuringFailure;

import lombok.Getter;

/**
 * Everything found wrong with one program during a run, stage by stage.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ProgramDiagnostics {
    private final List<SyntaxError> syntaxErrors = new ArrayList<>();
    private final List<SemanticError> semanticErrors = new ArrayList<>();
    private final List<StructuringFailure> structuringFailures = new ArrayList<>();
    private final List<FlowWarning> flowWarnings = new ArrayList<>();
    private final List<EdgeCase> edgeCases = new ArrayList<>();
    private final List<AugmentationError> augmentationErrors = new ArrayList<>();
    private final List<GenerationError> generationErrors = new ArrayList<>();

    /**
     * True when anything was found that fails the program. Structuring failures are not counted
     * here: they always come with a blocking edge case. Semantic errors are not counted either:
     * they only block the paragraphs that touch the affected record or name.
     */
    public boolean hasErrors() {
        return !syntaxErrors.isEmpty() || !generationErrors.isEmpty()
                || edgeCases.stream().anyMatch(EdgeCase::isBlocking);
    }

    public boolean hasSemanticErrors() {
        return !semanticErrors.isEmpty();
    }

    public boolean hasEdgeCases() {
        return !edgeCases.isEmpty();
    }

    /**
     * One line per error, in stage order, for reports.
     */
    public List<String> errorMessages() {
        List<String> out = new ArrayList<>();
        syntaxErrors.forEach(e -> out.add("syntax " + e.getMessage()));
        semanticErrors.forEach(e -> out.add("semantic " + e.getKind() + " " + e.location() + ": " + e.getMessage()));
        structuringFailures.forEach(f -> out.add("structuring " + f.getRegion() + "/" + f.getParagraph() + ": " + f.getMessage()));
        generationErrors.forEach(e -> out.add("generation " + e.getStage() + ": " + e.getMessage()));
        return out;
    }
}

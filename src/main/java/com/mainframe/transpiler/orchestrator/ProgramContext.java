package com.mainframe.transpiler.orchestrator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.augment.AugmentationResult;
import com.mainframe.transpiler.diagnostics.ProgramDiagnostics;
import com.mainframe.transpiler.edgecase.EdgeCaseReport;
import com.mainframe.transpiler.flow.FlowAnalysis;
import com.mainframe.transpiler.mapping.FunctionalityMapping;
import com.mainframe.transpiler.parser.ParseResult;
import com.mainframe.transpiler.symbol.SymbolTable;
import com.mainframe.transpiler.translate.TranslationResult;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Everything one program accumulates on its way through the pipeline. Each program has its own
 * context and only the worker running it touches it.
 */
@Getter
@Setter
public class ProgramContext {
    private static final Logger log = LoggerFactory.getLogger(ProgramContext.class);

    private final Path source;

    /** Source path relative to its source root. */
    private final Path relativePath;

    private final ProgramDiagnostics diagnostics = new ProgramDiagnostics();

    @Setter(AccessLevel.NONE)
    private ProgramState state = ProgramState.PENDING;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<ProgramState> history = new ArrayList<>();

    private ParseResult parse;
    private SymbolTable symbols;
    private FlowAnalysis flow;
    private EdgeCaseReport edgeCases;
    private TranslationResult translation;

    /** Outcome of every augmentation request, by edge-case id. */
    private final Map<String, AugmentationResult> augmentations = new LinkedHashMap<>();

    private Path output;
    private List<FunctionalityMapping> mappings = List.of();

    public ProgramContext(Path source, Path relativePath) {
        this.source = source;
        this.relativePath = relativePath;
    }

    public void transition(ProgramState next) {
        if (state.isFinal()) {
            throw new IllegalStateException("Program " + relativePath + " is already " + state);
        }
        log.debug("{}: {} -> {}", relativePath, state, next);
        state = next;
        history.add(next);
    }

    public List<ProgramState> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Hints of the successful augmentation requests, by edge-case id.
     */
    public Map<String, String> hints() {
        Map<String, String> hints = new LinkedHashMap<>();
        augmentations.forEach((id, result) -> {
            if (result.isSuccess()) {
                hints.put(id, result.getHint());
            }
        });
        return hints;
    }

    public String programName() {
        if (parse != null && parse.getProgramId() != null) {
            return parse.getProgramId();
        }
        return relativePath.toString();
    }
}

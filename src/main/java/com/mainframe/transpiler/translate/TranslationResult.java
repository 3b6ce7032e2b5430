package com.mainframe.transpiler.translate;

import java.util.List;

import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.ir.IrParagraph;
import com.mainframe.transpiler.ir.IrProgram;

import lombok.Value;

/**
 * The IR of one program together with the reference errors found while lowering it.
 */
@Value
public class TranslationResult {
    IrProgram program;
    List<SemanticError> errors;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Paragraphs emitted as a raise because they could not be translated.
     */
    public List<String> blockedParagraphs() {
        return program.getParagraphs().stream()
                .filter(IrParagraph::isBlocked)
                .map(IrParagraph::getCobolName)
                .toList();
    }
}

package com.mainframe.transpiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.mainframe.transpiler.diagnostics.SyntaxError;
import com.mainframe.transpiler.lexer.UnresolvedCopy;
import com.mainframe.transpiler.lst.DivisionNode;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.ParagraphNode;
import com.mainframe.transpiler.lst.SectionNode;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The tree of one program plus every syntax error found while building it.
 */
@Value
@Builder(toBuilder = true)
public class ParseResult {
    String fileName;
    String programId;

    @Singular
    List<DivisionNode> divisions;

    @Singular
    List<SyntaxError> syntaxErrors;

    @Singular
    List<UnresolvedCopy> unresolvedCopies;

    /**
     * Set when the IDENTIFICATION or PROCEDURE DIVISION could not be located; nothing downstream can run.
     */
    String fatalReason;

    public boolean isFatal() {
        return fatalReason != null;
    }

    public boolean hasSyntaxErrors() {
        return !syntaxErrors.isEmpty();
    }

    public Optional<DivisionNode> division(String name) {
        return divisions.stream().filter(d -> d.getName().equals(name)).findFirst();
    }

    public Optional<DivisionNode> procedureDivision() {
        return division("PROCEDURE");
    }

    public Optional<DivisionNode> dataDivision() {
        return division("DATA");
    }

    /**
     * Sections and paragraphs of the procedure division in source order; a section is followed by
     * its own paragraphs.
     */
    public List<LstNode> procedureUnits() {
        List<LstNode> out = new ArrayList<>();
        procedureDivision().ifPresent(division -> {
            for (LstNode child : division.getChildren()) {
                if (child instanceof ParagraphNode) {
                    out.add(child);
                } else if (child instanceof SectionNode section) {
                    out.add(section);
                    out.addAll(section.paragraphs());
                }
            }
        });
        return out;
    }

    /**
     * Copy with lexical errors placed ahead of the parser's errors and the unresolved COPY members attached.
     */
    public ParseResult withCopyDiagnostics(List<SyntaxError> lexicalErrors, List<UnresolvedCopy> unresolved) {
        List<SyntaxError> errors = new ArrayList<>(lexicalErrors);
        errors.addAll(syntaxErrors);
        return toBuilder()
                .clearSyntaxErrors()
                .syntaxErrors(errors)
                .clearUnresolvedCopies()
                .unresolvedCopies(unresolved)
                .build();
    }
}

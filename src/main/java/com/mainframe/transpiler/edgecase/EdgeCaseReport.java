package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.mainframe.transpiler.lst.StatementNode;

/**
 * Edge cases of one program, with lookups by statement and by paragraph.
 */
public class EdgeCaseReport {
    private final List<EdgeCase> edgeCases;
    private final Map<StatementNode, List<EdgeCase>> byStatement = new IdentityHashMap<>();
    private final Set<String> blockedParagraphs = new LinkedHashSet<>();

    public EdgeCaseReport(List<EdgeCase> edgeCases) {
        this.edgeCases = List.copyOf(edgeCases);
        for (EdgeCase edgeCase : edgeCases) {
            if (edgeCase.getStatement() != null) {
                byStatement.computeIfAbsent(edgeCase.getStatement(), s -> new ArrayList<>()).add(edgeCase);
            }
            if (edgeCase.isBlocking() && edgeCase.getParagraph() != null) {
                blockedParagraphs.add(edgeCase.getParagraph());
            }
        }
    }

    public List<EdgeCase> getEdgeCases() {
        return edgeCases;
    }

    public List<EdgeCase> forStatement(StatementNode statement) {
        return byStatement.getOrDefault(statement, List.of());
    }

    public boolean isBlocked(String paragraph) {
        return blockedParagraphs.contains(paragraph);
    }

    public Set<String> getBlockedParagraphs() {
        return Collections.unmodifiableSet(blockedParagraphs);
    }

    public boolean hasBlocking() {
        return edgeCases.stream().anyMatch(EdgeCase::isBlocking);
    }

    public List<EdgeCase> needingAugmentation() {
        return edgeCases.stream().filter(EdgeCase::needsAugmentation).toList();
    }

    public boolean isEmpty() {
        return edgeCases.isEmpty();
    }
}

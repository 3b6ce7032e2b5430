package com.mainframe.transpiler.edgecase;

import java.util.List;

/**
 * One entry of the edge-case catalog. Implementations are stateless and return their findings in
 * source order; ids are assigned by {@link EdgeCaseDetector}.
 */
public interface EdgeCasePredicate {

    EdgeCaseCategory category();

    List<EdgeCase> detect(DetectionContext context);

    /**
     * Builder preset with this predicate's category and default severity.
     */
    default EdgeCase.EdgeCaseBuilder finding() {
        return EdgeCase.builder()
                .category(category())
                .severity(category().getSeverity());
    }
}

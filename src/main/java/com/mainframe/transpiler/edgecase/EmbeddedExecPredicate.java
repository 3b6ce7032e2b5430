package com.mainframe.transpiler.edgecase;

import java.util.List;

public class EmbeddedExecPredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.EMBEDDED_EXEC;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        return context.statementsWithVerb(this, "Embedded EXEC block is lowered to an opaque external call", "EXEC");
    }
}

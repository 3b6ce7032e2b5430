package com.mainframe.transpiler.edgecase;

import java.util.List;

public class ExternalCallPredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.EXTERNAL_CALL;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        return context.statementsWithVerb(this, "CALL of another program is lowered to an opaque external call", "CALL");
    }
}

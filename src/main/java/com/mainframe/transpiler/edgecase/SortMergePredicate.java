package com.mainframe.transpiler.edgecase;

import java.util.List;

public class SortMergePredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.SORT_MERGE;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        return context.statementsWithVerb(this, "{verb} is lowered to an opaque external call", "SORT", "MERGE");
    }
}

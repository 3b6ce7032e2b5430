package com.mainframe.transpiler.edgecase;

import java.util.List;

/**
 * {@code ALTER p TO PROCEED TO q} rewrites a GO TO at run time; no static graph describes it.
 */
public class AlterStatementPredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.ALTER_STATEMENT;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        return context.statementsWithVerb(this, "ALTER changes GO TO targets at run time", "ALTER");
    }
}

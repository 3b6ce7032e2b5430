package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.mainframe.transpiler.flow.GotoEscape;

/**
 * A GO TO that leaves the paragraph range of a PERFORM. The lowering ends the performed range
 * instead of transferring control.
 */
public class GotoOutOfRangePredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.GOTO_OUT_OF_RANGE;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        List<EdgeCase> out = new ArrayList<>();
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (GotoEscape escape : context.getFlow().getEscapes()) {
            // a paragraph shared by several performed ranges reports its GO TO once
            if (!seen.add(escape.getStatement())) {
                continue;
            }
            out.add(finding()
                    .span(escape.getStatement().getSpan())
                    .paragraph(escape.getParagraph())
                    .message("GO TO " + escape.getTarget() + " leaves performed range " + escape.getRegion())
                    .snippet(escape.getStatement().toSourceText())
                    .statement(escape.getStatement())
                    .build());
        }
        return out;
    }
}

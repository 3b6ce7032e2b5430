package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.transpiler.flow.StructuringFailure;

/**
 * Paragraphs in a loop of GO TOs that can be entered at more than one point.
 */
public class IrreducibleControlFlowPredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.IRREDUCIBLE_CONTROL_FLOW;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        List<EdgeCase> out = new ArrayList<>();
        for (StructuringFailure failure : context.getFlow().getFailures()) {
            String snippet = context.getFlow().getGraph().getNodes().stream()
                    .filter(n -> n.getName().equals(failure.getParagraph()))
                    .findFirst()
                    .map(n -> n.getSource().toSourceText())
                    .orElse(failure.getParagraph());
            out.add(finding()
                    .span(failure.getSpan())
                    .paragraph(failure.getParagraph())
                    .message(failure.getMessage())
                    .snippet(snippet)
                    .build());
        }
        return out;
    }
}

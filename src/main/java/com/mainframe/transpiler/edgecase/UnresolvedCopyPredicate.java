package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.transpiler.flow.FlowNode;
import com.mainframe.transpiler.lexer.UnresolvedCopy;
import com.mainframe.transpiler.lst.SourceSpan;

/**
 * COPY members that could not be included. The text they would contribute is missing, so the
 * program cannot be translated faithfully.
 */
public class UnresolvedCopyPredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.UNRESOLVED_COPY;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        List<EdgeCase> out = new ArrayList<>();
        for (UnresolvedCopy copy : context.getParse().getUnresolvedCopies()) {
            SourceSpan span = new SourceSpan(copy.getFileName(), copy.getLine(), 8, copy.getLine(), 8);
            out.add(finding()
                    .span(span)
                    .paragraph(enclosingParagraph(context, copy))
                    .message("COPY " + copy.getMemberName() + " not included: " + copy.getReason())
                    .snippet("COPY " + copy.getMemberName() + ".")
                    .build());
        }
        return out;
    }

    private static String enclosingParagraph(DetectionContext context, UnresolvedCopy copy) {
        for (FlowNode node : context.getFlow().getGraph().getNodes()) {
            SourceSpan span = node.getSpan();
            if (span.getFileName().equals(copy.getFileName())
                    && span.getLine() <= copy.getLine() && copy.getLine() <= span.getEndLine()) {
                return node.getName();
            }
        }
        return null;
    }
}

package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.mainframe.transpiler.flow.FlowNode;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.ParagraphNode;
import com.mainframe.transpiler.lst.SectionNode;
import com.mainframe.transpiler.lst.SentenceNode;
import com.mainframe.transpiler.lst.StatementNode;

/**
 * Statements outside the supported subset: unknown verbs, EXIT SECTION / EXIT PERFORM, and NEXT
 * SENTENCE where skipping to the end of the sentence is more than ending the enclosing statement.
 */
public class UnsupportedStatementPredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.UNSUPPORTED_STATEMENT;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        List<EdgeCase> out = new ArrayList<>();
        Set<StatementNode> lowerableNextSentence = lowerableNextSentences(context);
        context.forEachStatement((node, statement) -> {
            String reason = reason(statement, lowerableNextSentence);
            if (reason != null) {
                out.add(DetectionContext.at(this, node, statement, reason));
            }
        });
        return out;
    }

    private static String reason(StatementNode statement, Set<StatementNode> lowerableNextSentence) {
        if (statement.isVerb(StatementNode.UNKNOWN)) {
            return "Unsupported statement " + statement.tokens().get(0).upper();
        }
        if (statement.isVerb("EXIT")) {
            String option = statement.clause(ClauseRole.OPTIONS).map(ClauseNode::getOperator).orElse("");
            if (option.startsWith("PERFORM") || option.equals("SECTION")) {
                return "EXIT " + option + " is not supported";
            }
        }
        if (statement.isVerb("NEXT-SENTENCE") && !lowerableNextSentence.contains(statement)) {
            return "NEXT SENTENCE inside a statement that is not the last of its sentence";
        }
        return null;
    }

    /**
     * NEXT SENTENCE phrases nested in the last statement of a sentence, outside any in-line PERFORM;
     * there they simply end the statement.
     */
    private static Set<StatementNode> lowerableNextSentences(DetectionContext context) {
        Set<StatementNode> out = Collections.newSetFromMap(new IdentityHashMap<>());
        for (FlowNode node : context.getFlow().getGraph().getNodes()) {
            for (SentenceNode sentence : sentences(node.getSource())) {
                List<StatementNode> statements = sentence.statements();
                if (statements.isEmpty()) {
                    continue;
                }
                collectOutsidePerform(statements.get(statements.size() - 1), out);
            }
        }
        return out;
    }

    private static void collectOutsidePerform(LstNode node, Set<StatementNode> out) {
        if (node instanceof StatementNode statement) {
            if (statement.isVerb("NEXT-SENTENCE")) {
                out.add(statement);
                return;
            }
            if (statement.isVerb("PERFORM")) {
                return;
            }
        }
        for (LstNode child : node.getChildren()) {
            collectOutsidePerform(child, out);
        }
    }

    private static List<SentenceNode> sentences(LstNode source) {
        if (source instanceof ParagraphNode paragraph) {
            return paragraph.sentences();
        }
        if (source instanceof SectionNode section) {
            return section.sentences();
        }
        return List.of();
    }
}

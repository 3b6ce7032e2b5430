package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

import com.mainframe.transpiler.flow.FlowAnalysis;
import com.mainframe.transpiler.flow.FlowNode;
import com.mainframe.transpiler.lst.LstWalker;
import com.mainframe.transpiler.lst.StatementNode;
import com.mainframe.transpiler.parser.ParseResult;
import com.mainframe.transpiler.symbol.SymbolTable;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Everything the edge-case predicates inspect for one program.
 */
@Getter
@RequiredArgsConstructor
public class DetectionContext {
    private final ParseResult parse;
    private final SymbolTable symbols;
    private final FlowAnalysis flow;

    /**
     * Visits every procedure statement, nested ones included, with its paragraph.
     */
    public void forEachStatement(BiConsumer<FlowNode, StatementNode> action) {
        for (FlowNode node : flow.getGraph().getNodes()) {
            for (StatementNode top : node.getStatements()) {
                for (StatementNode statement : LstWalker.statements(top)) {
                    action.accept(node, statement);
                }
            }
        }
    }

    /**
     * Findings for every statement with one of the given verbs.
     */
    public List<EdgeCase> statementsWithVerb(EdgeCasePredicate predicate, String message, String... verbs) {
        List<EdgeCase> out = new ArrayList<>();
        forEachStatement((node, statement) -> {
            for (String verb : verbs) {
                if (statement.isVerb(verb)) {
                    out.add(at(predicate, node, statement, message.replace("{verb}", verb)));
                }
            }
        });
        return out;
    }

    public static EdgeCase at(EdgeCasePredicate predicate, FlowNode node, StatementNode statement, String message) {
        return predicate.finding()
                .span(statement.getSpan())
                .paragraph(node.getName())
                .message(message)
                .snippet(statement.toSourceText())
                .statement(statement)
                .build();
    }
}

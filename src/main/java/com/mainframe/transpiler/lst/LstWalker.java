package com.mainframe.transpiler.lst;

import java.util.ArrayList;
import java.util.List;

import lombok.experimental.UtilityClass;

/**
 * Traversal helpers over the tree.
 */
@UtilityClass
public class LstWalker {

    /**
     * All statements below {@code root}, nested ones included, in pre-order.
     */
    public static List<StatementNode> statements(LstNode root) {
        List<StatementNode> out = new ArrayList<>();
        collect(root, out);
        return out;
    }

    private static void collect(LstNode node, List<StatementNode> out) {
        if (node instanceof StatementNode statement) {
            out.add(statement);
        }
        for (LstNode child : node.getChildren()) {
            collect(child, out);
        }
    }

    /**
     * All REFERENCE clauses below {@code root}, outermost first; qualifiers are not references.
     */
    public static List<ClauseNode> references(LstNode root) {
        List<ClauseNode> out = new ArrayList<>();
        collectReferences(root, out);
        return out;
    }

    private static void collectReferences(LstNode node, List<ClauseNode> out) {
        if (node instanceof ClauseNode clause && clause.getRole() == ClauseRole.REFERENCE) {
            out.add(clause);
        }
        for (LstNode child : node.getChildren()) {
            collectReferences(child, out);
        }
    }
}

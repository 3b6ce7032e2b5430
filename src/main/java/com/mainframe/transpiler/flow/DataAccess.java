package com.mainframe.transpiler.flow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LiteralKind;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.LstWalker;
import com.mainframe.transpiler.lst.StatementNode;
import com.mainframe.transpiler.symbol.ConditionNameType;
import com.mainframe.transpiler.symbol.DataItem;
import com.mainframe.transpiler.symbol.FileDefinition;
import com.mainframe.transpiler.symbol.Resolution;
import com.mainframe.transpiler.symbol.SymbolTable;

/**
 * Read and write sets of conditions and statements, in terms of symbol table items. A condition
 * name stands for the item it belongs to.
 */
public class DataAccess {
    private static final Set<String> OPAQUE_VERBS = Set.of(StatementNode.UNKNOWN, "SORT", "MERGE", "EXEC");

    private final SymbolTable symbols;

    public DataAccess(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public Set<DataItem> reads(LstNode condition) {
        Set<DataItem> out = new LinkedHashSet<>();
        for (ClauseNode reference : LstWalker.references(condition)) {
            resolve(reference, out);
        }
        return out;
    }

    /**
     * Items the statement (and every statement nested in it) may change.
     */
    public Set<DataItem> writes(StatementNode statement) {
        Set<DataItem> out = new LinkedHashSet<>();
        for (StatementNode nested : LstWalker.statements(statement)) {
            collectWrites(nested, out);
        }
        return out;
    }

    public Set<DataItem> writes(List<StatementNode> statements) {
        Set<DataItem> out = new LinkedHashSet<>();
        for (StatementNode statement : statements) {
            out.addAll(writes(statement));
        }
        return out;
    }

    private void collectWrites(StatementNode statement, Set<DataItem> out) {
        for (ClauseNode reference : targetReferences(statement)) {
            resolve(reference, out);
        }
        switch (statement.getVerb()) {
            case "READ":
                statement.clause(ClauseRole.FILE)
                        .flatMap(c -> c.literals().stream().findFirst())
                        .flatMap(l -> symbols.file(l.upper()))
                        .map(FileDefinition::getRecords)
                        .ifPresent(out::addAll);
                break;
            case "CALL":
                statement.clause(ClauseRole.USING).ifPresent(using -> {
                    for (ClauseNode reference : using.clauses(ClauseRole.REFERENCE)) {
                        resolve(reference, out);
                    }
                });
                break;
            default:
                if (OPAQUE_VERBS.contains(statement.getVerb())) {
                    // Anything an opaque statement names may change
                    for (LiteralNode literal : statement.tokens()) {
                        if (literal.getLiteralKind() == LiteralKind.IDENTIFIER) {
                            Resolution resolution = symbols.resolve(literal.upper());
                            if (resolution.isResolved()) {
                                out.add(owner(resolution.getItem()));
                            }
                        }
                    }
                }
        }
    }

    /**
     * REFERENCE clauses a statement stores into: MOVE / SET / INITIALIZE targets, arithmetic
     * targets and GIVING / REMAINDER items, ACCEPT and READ INTO targets, the VARYING variable.
     */
    public static List<ClauseNode> targetReferences(StatementNode statement) {
        List<ClauseNode> out = new ArrayList<>();
        for (ClauseRole role : new ClauseRole[] {ClauseRole.TARGETS, ClauseRole.GIVING, ClauseRole.REMAINDER,
                ClauseRole.TARGET, ClauseRole.INTO}) {
            if (statement.isVerb("WRITE") && role == ClauseRole.TARGET) {
                continue;
            }
            for (ClauseNode clause : statement.clauses(role)) {
                collectDirectReferences(clause, out);
            }
        }
        statement.clause(ClauseRole.VARYING)
                .flatMap(v -> v.clause(ClauseRole.TARGET))
                .ifPresent(target -> collectDirectReferences(target, out));
        return out;
    }

    private static void collectDirectReferences(ClauseNode clause, List<ClauseNode> out) {
        for (ClauseNode child : clause.subClauses()) {
            if (child.getRole() == ClauseRole.REFERENCE) {
                out.add(child);
            } else if (child.getRole() == ClauseRole.TARGET) {
                collectDirectReferences(child, out);
            }
        }
    }

    private void resolve(ClauseNode reference, Set<DataItem> out) {
        Resolution resolution = symbols.resolve(reference);
        if (resolution.isResolved()) {
            out.add(owner(resolution.getItem()));
        }
    }

    private static DataItem owner(DataItem item) {
        if (item.getType() instanceof ConditionNameType condition) {
            return condition.getParent();
        }
        return item;
    }

    /**
     * True when the two items share storage: the same item, nested items, or overlapping bytes of one record.
     */
    public static boolean overlaps(DataItem a, DataItem b) {
        if (a == b || a.isAncestorOf(b) || b.isAncestorOf(a)) {
            return true;
        }
        if (a.record() != b.record()) {
            return false;
        }
        int aEnd = a.getOffset() + a.totalSize();
        int bEnd = b.getOffset() + b.totalSize();
        return a.getOffset() < bEnd && b.getOffset() < aEnd;
    }
}

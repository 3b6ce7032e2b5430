package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.LstWalker;
import com.mainframe.transpiler.lst.StatementNode;
import com.mainframe.transpiler.symbol.DataItem;
import com.mainframe.transpiler.symbol.Resolution;
import com.mainframe.transpiler.symbol.SymbolTable;

/**
 * Arithmetic on an alphanumeric, edited or group item. The lowering reads the item's digits and
 * stores the display form of the result.
 */
public class MixedPicComputePredicate implements EdgeCasePredicate {
    private static final Set<String> ARITHMETIC = Set.of("ADD", "SUBTRACT", "MULTIPLY", "DIVIDE", "COMPUTE");
    private static final Set<ClauseRole> HANDLERS = Set.of(ClauseRole.ON_SIZE_ERROR, ClauseRole.NOT_ON_SIZE_ERROR);

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.MIXED_PIC_COMPUTE;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        List<EdgeCase> out = new ArrayList<>();
        context.forEachStatement((node, statement) -> {
            if (!ARITHMETIC.contains(statement.getVerb())) {
                return;
            }
            nonNumericOperand(statement, context.getSymbols()).ifPresent(item -> out.add(
                    DetectionContext.at(this, node, statement,
                            statement.getVerb() + " uses non-numeric item " + item.getName())));
        });
        return out;
    }

    static Optional<DataItem> nonNumericOperand(StatementNode statement, SymbolTable symbols) {
        for (LstNode child : statement.getChildren()) {
            if (child instanceof ClauseNode clause && HANDLERS.contains(clause.getRole())) {
                continue;
            }
            for (ClauseNode reference : LstWalker.references(child)) {
                Resolution resolution = symbols.resolve(reference);
                if (resolution.isResolved() && resolution.getItem().getType() != null
                        && !resolution.getItem().getType().isNumeric()
                        && !resolution.getItem().isConditionName()) {
                    return Optional.of(resolution.getItem());
                }
            }
        }
        return Optional.empty();
    }
}

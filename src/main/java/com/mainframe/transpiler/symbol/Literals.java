package com.mainframe.transpiler.symbol;

import java.util.List;
import java.util.Optional;

import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LiteralKind;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;

import lombok.experimental.UtilityClass;

/**
 * Reads constant operands of the tree into {@link LiteralValue}s.
 */
@UtilityClass
public class Literals {

    /**
     * The constant an operand node denotes; empty for data references and expressions.
     */
    public static Optional<LiteralValue> of(LstNode operand) {
        if (operand instanceof LiteralNode literal) {
            return ofLiteral(literal);
        }
        if (operand instanceof ClauseNode clause && clause.getRole() == ClauseRole.VALUE
                && "ALL".equals(clause.getOperator())) {
            List<LiteralNode> literals = clause.literals();
            LiteralNode pattern = literals.get(literals.size() - 1);
            if (pattern.getLiteralKind() == LiteralKind.FIGURATIVE) {
                return Optional.of(LiteralValue.figurative(pattern.text()));
            }
            return Optional.of(LiteralValue.all(pattern.text()));
        }
        return Optional.empty();
    }

    private static Optional<LiteralValue> ofLiteral(LiteralNode literal) {
        switch (literal.getLiteralKind()) {
            case NUMERIC:
                return Optional.of(LiteralValue.numeric(literal.text()));
            case STRING:
                return Optional.of(LiteralValue.alphanumeric(literal.text()));
            case FIGURATIVE:
                return Optional.of(LiteralValue.figurative(literal.text()));
            default:
                return Optional.empty();
        }
    }
}

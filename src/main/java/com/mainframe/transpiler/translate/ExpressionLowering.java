package com.mainframe.transpiler.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.diagnostics.SemanticErrorKind;
import com.mainframe.transpiler.ir.Binary;
import com.mainframe.transpiler.ir.Compare;
import com.mainframe.transpiler.ir.ConditionTest;
import com.mainframe.transpiler.ir.IrExpression;
import com.mainframe.transpiler.ir.IrField;
import com.mainframe.transpiler.ir.IrType;
import com.mainframe.transpiler.ir.Literal;
import com.mainframe.transpiler.ir.Logical;
import com.mainframe.transpiler.ir.RecordAccess;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LiteralKind;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.symbol.ConditionNameType;
import com.mainframe.transpiler.symbol.DataItem;
import com.mainframe.transpiler.symbol.LiteralValue;
import com.mainframe.transpiler.symbol.Literals;
import com.mainframe.transpiler.symbol.Resolution;
import com.mainframe.transpiler.symbol.SymbolTable;
import com.mainframe.transpiler.symbol.SymbolTableBuilder;

/**
 * Lowers operands, arithmetic expressions and conditions. Conditions are lowered left to right so
 * an abbreviated relation ({@code A = 1 OR 2}) picks up the subject of the relation before it.
 */
class ExpressionLowering {
    /** Extra quotient digits kept beyond the operands' and target's scale. */
    static final int DIVISION_GUARD_DIGITS = 10;

    private final SymbolTable symbols;
    private final LayoutBuilder layout;

    private LstNode lastSubject;

    ExpressionLowering(SymbolTable symbols, LayoutBuilder layout) {
        this.symbols = symbols;
        this.layout = layout;
    }

    // ------------------------------------------------------------------ references

    /**
     * Resolves a data reference; fails on undeclared, ambiguous and blocked items.
     */
    DataItem resolve(ClauseNode reference) {
        Resolution resolution = symbols.resolve(reference);
        String name = SymbolTableBuilder.referenceName(reference).orElse("?");
        switch (resolution.getStatus()) {
            case UNDECLARED:
                throw new LoweringException(new SemanticError(SemanticErrorKind.UNDECLARED_REFERENCE, name,
                        name + " is not declared", reference.getSpan()));
            case AMBIGUOUS:
                throw new LoweringException(new SemanticError(SemanticErrorKind.AMBIGUOUS_REFERENCE, name,
                        name + " is ambiguous; qualify it (" + resolution.getCandidates().size() + " candidates)",
                        reference.getSpan()));
            default:
                break;
        }
        DataItem item = resolution.getItem();
        if (symbols.isBlocked(item)) {
            throw new LoweringException("record " + item.record().getName() + " has a semantic error");
        }
        return item;
    }

    /**
     * A reference to a field with its subscripts. Condition names are rejected.
     */
    RecordAccess access(ClauseNode reference) {
        DataItem item = resolve(reference);
        if (item.isConditionName()) {
            throw typeMismatch(reference, item.getName() + " is a condition name, not a data item");
        }
        return access(item, reference);
    }

    /**
     * Access to the item itself, or to the parent of a condition name.
     */
    RecordAccess access(DataItem item, ClauseNode reference) {
        DataItem target = item.isConditionName() ? item.getParent() : item;
        IrField field = layout.field(target);
        if (field == null) {
            throw new LoweringException("no storage for " + target.getName());
        }
        List<IrExpression> subscripts = new ArrayList<>();
        for (ClauseNode subscript : reference.clauses(ClauseRole.SUBSCRIPT)) {
            subscripts.add(arithmetic(subscript.operands().get(0), 0));
        }
        if (subscripts.size() != field.dimensions()) {
            throw typeMismatch(reference, target.getName() + " takes " + field.dimensions() + " subscript(s), got "
                    + subscripts.size());
        }
        return new RecordAccess(field, List.copyOf(subscripts));
    }

    /**
     * A numeric (or numeric edited) receiving field of an arithmetic statement.
     */
    RecordAccess numericTarget(ClauseNode reference) {
        RecordAccess target = access(reference);
        boolean numericEdited = target.type().getKind() == IrType.Kind.EDITED
                && target.type().isNumericEdited();
        if (!target.type().isNumeric() && !numericEdited) {
            throw typeMismatch(reference, target.getField().getCobolName() + " is not numeric");
        }
        return target;
    }

    LoweringException typeMismatch(ClauseNode reference, String message) {
        String name = SymbolTableBuilder.referenceName(reference).orElse("?");
        return new LoweringException(new SemanticError(SemanticErrorKind.TYPE_MISMATCH, name, message, reference.getSpan()));
    }

    // ------------------------------------------------------------------ operands and arithmetic

    /**
     * A literal, figurative constant, ALL literal or data reference.
     */
    IrExpression operand(LstNode node) {
        Optional<LiteralValue> constant = Literals.of(node);
        if (constant.isPresent()) {
            return new Literal(constant.get());
        }
        if (node instanceof ClauseNode clause && clause.getRole() == ClauseRole.REFERENCE) {
            return access(clause);
        }
        if (node instanceof ClauseNode clause && (clause.getRole() == ClauseRole.BINARY
                || clause.getRole() == ClauseRole.NEGATE || clause.getRole() == ClauseRole.EXPRESSION)) {
            return arithmetic(node, 0);
        }
        throw new LoweringException("unsupported operand " + node.toSourceText());
    }

    /**
     * An arithmetic expression; {@code targetScale} is the fraction digits of the receiving field,
     * which together with the operands fixes the scale of quotients.
     */
    IrExpression arithmetic(LstNode node, int targetScale) {
        if (node instanceof ClauseNode clause) {
            switch (clause.getRole()) {
                case BINARY: {
                    List<LstNode> sides = sidesOf(clause);
                    IrExpression left = arithmetic(sides.get(0), targetScale);
                    IrExpression right = arithmetic(sides.get(sides.size() - 1), targetScale);
                    return binary(binaryOp(clause.getOperator()), left, right, targetScale);
                }
                case NEGATE:
                    return binary(Binary.Op.SUBTRACT, Literal.number(0), arithmetic(last(clause), targetScale), targetScale);
                case EXPRESSION:
                    return arithmetic(inner(clause), targetScale);
                default:
                    break;
            }
        }
        return operand(node);
    }

    /**
     * Builds {@code left op right}. Sums and products record their exact scale; quotients and
     * powers are rounded to the guarded scale.
     */
    static IrExpression binary(Binary.Op op, IrExpression left, IrExpression right, int targetScale) {
        int l = left.type().getFractionDigits();
        int r = right.type().getFractionDigits();
        switch (op) {
            case ADD:
            case SUBTRACT:
                return new Binary(op, left, right, Math.max(l, r));
            case MULTIPLY:
                return new Binary(op, left, right, l + r);
            default:
                return new Binary(op, left, right, Math.max(targetScale, Math.max(l, r)) + DIVISION_GUARD_DIGITS);
        }
    }

    private static Binary.Op binaryOp(String symbol) {
        switch (symbol) {
            case "+":
                return Binary.Op.ADD;
            case "-":
                return Binary.Op.SUBTRACT;
            case "*":
                return Binary.Op.MULTIPLY;
            case "/":
                return Binary.Op.DIVIDE;
            default:
                return Binary.Op.POWER;
        }
    }

    // ------------------------------------------------------------------ conditions

    IrExpression condition(LstNode node) {
        lastSubject = null;
        return lowerCondition(node);
    }

    private IrExpression lowerCondition(LstNode node) {
        if (!(node instanceof ClauseNode clause)) {
            throw new LoweringException("not a condition: " + node.toSourceText());
        }
        switch (clause.getRole()) {
            case OR:
            case AND: {
                List<LstNode> sides = sidesOf(clause);
                IrExpression left = lowerCondition(sides.get(0));
                IrExpression right = lowerCondition(sides.get(sides.size() - 1));
                Logical.Op op = clause.getRole() == ClauseRole.OR ? Logical.Op.OR : Logical.Op.AND;
                return new Logical(op, List.of(left, right));
            }
            case NOT:
                return Logical.not(lowerCondition(last(clause)));
            case EXPRESSION:
            case CONDITION:
                return lowerCondition(inner(clause));
            case RELATION: {
                List<LstNode> children = clause.getChildren();
                lastSubject = children.get(0);
                return new Compare(compareOp(clause.getOperator()), arithmetic(children.get(0), 0),
                        arithmetic(children.get(children.size() - 1), 0));
            }
            case ABBREVIATED_RELATION: {
                if (lastSubject == null) {
                    throw new LoweringException("abbreviated relation without a subject at " + clause.getSpan().location());
                }
                List<LstNode> children = clause.getChildren();
                return new Compare(compareOp(clause.getOperator()), arithmetic(lastSubject, 0),
                        arithmetic(children.get(children.size() - 1), 0));
            }
            case CLASS_CONDITION:
                return classCondition(clause);
            case CONDITION_NAME:
                return conditionName(clause.clause(ClauseRole.REFERENCE)
                        .orElseThrow(() -> new LoweringException("condition name without reference")));
            default:
                throw new LoweringException("not a condition: " + clause.toSourceText());
        }
    }

    private IrExpression classCondition(ClauseNode clause) {
        String operator = clause.getOperator();
        boolean negated = operator.startsWith("NOT ");
        String word = negated ? operator.substring(4) : operator;
        ConditionTest.Kind kind;
        switch (word) {
            case "NUMERIC":
                kind = ConditionTest.Kind.NUMERIC;
                break;
            case "ALPHABETIC":
                kind = ConditionTest.Kind.ALPHABETIC;
                break;
            case "ALPHABETIC-LOWER":
                kind = ConditionTest.Kind.ALPHABETIC_LOWER;
                break;
            case "ALPHABETIC-UPPER":
                kind = ConditionTest.Kind.ALPHABETIC_UPPER;
                break;
            case "POSITIVE":
                kind = ConditionTest.Kind.POSITIVE;
                break;
            case "NEGATIVE":
                kind = ConditionTest.Kind.NEGATIVE;
                break;
            default:
                kind = ConditionTest.Kind.ZERO;
                break;
        }
        LstNode subjectNode = clause.getChildren().get(0);
        lastSubject = null;
        ConditionTest test = new ConditionTest(kind, arithmetic(subjectNode, 0), List.of());
        return negated ? Logical.not(test) : test;
    }

    /**
     * A level-88 test on its parent item, subscripted like the condition name.
     */
    IrExpression conditionName(ClauseNode reference) {
        DataItem item = resolve(reference);
        if (!(item.getType() instanceof ConditionNameType conditionType)) {
            throw typeMismatch(reference, item.getName() + " is used as a condition but is not a condition name");
        }
        lastSubject = null;
        return new ConditionTest(ConditionTest.Kind.CONDITION_NAME, access(item, reference), conditionType.getValues());
    }

    static Compare.Op compareOp(String operator) {
        switch (operator) {
            case "=":
                return Compare.Op.EQ;
            case "<>":
                return Compare.Op.NE;
            case "<":
                return Compare.Op.LT;
            case ">":
                return Compare.Op.GT;
            case "<=":
                return Compare.Op.LE;
            default:
                return Compare.Op.GE;
        }
    }

    // ------------------------------------------------------------------ tree helpers

    /**
     * Child nodes that carry a value: sub-clauses and literals other than keywords and punctuation.
     */
    static List<LstNode> values(LstNode node) {
        List<LstNode> out = new ArrayList<>();
        for (LstNode child : node.getChildren()) {
            if (child instanceof ClauseNode) {
                out.add(child);
            } else if (child instanceof LiteralNode literal && isValueLiteral(literal)) {
                out.add(child);
            }
        }
        return out;
    }

    static boolean isValueLiteral(LiteralNode literal) {
        LiteralKind kind = literal.getLiteralKind();
        return kind == LiteralKind.NUMERIC || kind == LiteralKind.STRING || kind == LiteralKind.FIGURATIVE;
    }

    private static List<LstNode> sidesOf(ClauseNode clause) {
        List<LstNode> children = clause.getChildren();
        return List.of(children.get(0), children.get(children.size() - 1));
    }

    private static LstNode last(ClauseNode clause) {
        List<LstNode> children = clause.getChildren();
        return children.get(children.size() - 1);
    }

    /**
     * The operand of a parenthesized or unary-plus expression, or of a CONDITION wrapper.
     */
    private static LstNode inner(ClauseNode clause) {
        for (LstNode child : clause.getChildren()) {
            if (!(child instanceof LiteralNode literal) || isValueLiteral(literal)
                    || literal.getLiteralKind() == LiteralKind.IDENTIFIER) {
                return child;
            }
        }
        throw new LoweringException("empty expression at " + clause.getSpan().location());
    }
}

package com.mainframe.transpiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.mainframe.transpiler.lexer.CobolToken;
import com.mainframe.transpiler.lexer.ReservedWords;
import com.mainframe.transpiler.lexer.TokenType;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;

/**
 * Parses data references, arithmetic expressions and conditions.
 *
 * Conditions follow COBOL precedence: NOT binds tighter than AND, AND tighter than OR. After AND / OR
 * a bare value (or an operator followed by a value) continues the previous relation, as in
 * {@code A = 1 OR 2}; such operands become ABBREVIATED_RELATION clauses carrying the effective operator.
 */
class ExpressionParser {

    private static final Set<String> CLASS_WORDS = Set.of(
            "NUMERIC", "ALPHABETIC", "ALPHABETIC-LOWER", "ALPHABETIC-UPPER", "POSITIVE", "NEGATIVE",
            "ZERO", "ZEROS", "ZEROES"
    );

    private final TokenStream in;
    private final Set<String> conditionNames;

    /** Operator of the last full relation, for abbreviated combined relations. */
    private String lastRelationOperator;

    ExpressionParser(TokenStream in, Set<String> conditionNames) {
        this.in = in;
        this.conditionNames = conditionNames;
    }

    // ------------------------------------------------------------------ operands

    boolean startsOperand() {
        CobolToken token = in.peek();
        switch (token.getType()) {
            case NUMBER:
            case STRING:
                return true;
            case WORD:
                return TokenStream.isIdentifier(token) || ReservedWords.isFigurative(token.getText())
                        || token.isWord("ALL");
            default:
                return false;
        }
    }

    /**
     * A literal, figurative constant or data reference.
     */
    LstNode parseOperand() {
        CobolToken token = in.peek();
        if (token.getType() == TokenType.NUMBER || token.getType() == TokenType.STRING) {
            return Nodes.literal(in.advance());
        }
        if (token.isWord("ALL")) {
            LiteralNode all = Nodes.literal(in.advance());
            CobolToken value = in.peek();
            if (value.getType() != TokenType.STRING && !ReservedWords.isFigurative(value.getText())) {
                throw new ParseException(value, "literal after ALL");
            }
            return Nodes.clause(ClauseRole.VALUE, "ALL", List.of(all, Nodes.literal(in.advance())));
        }
        if (token.getType() == TokenType.WORD && ReservedWords.isFigurative(token.getText())) {
            return Nodes.literal(in.advance());
        }
        if (in.checkIdentifier()) {
            return parseReference();
        }
        throw new ParseException(token, List.of("identifier", "literal"));
    }

    /**
     * name [OF|IN qualifier]... [( subscript ... )]
     */
    ClauseNode parseReference() {
        List<LstNode> children = new ArrayList<>();
        children.add(Nodes.identifier(in.expectIdentifier("data name")));

        while (in.checkWord("OF", "IN") && TokenStream.isIdentifier(in.peek(1))) {
            LiteralNode keyword = Nodes.literal(in.advance());
            children.add(keyword);
            children.add(Nodes.clause(ClauseRole.QUALIFIER, List.of(Nodes.identifier(in.advance()))));
        }

        if (in.check(TokenType.LPAREN)) {
            children.add(Nodes.literal(in.advance()));
            do {
                children.add(Nodes.clause(ClauseRole.SUBSCRIPT, List.of(parseArithmetic())));
            } while (!in.check(TokenType.RPAREN) && !in.isAtEnd() && startsArithmetic());
            children.add(Nodes.literal(in.expect(TokenType.RPAREN, ")")));
        }

        return Nodes.clause(ClauseRole.REFERENCE, children);
    }

    // ------------------------------------------------------------------ arithmetic

    boolean startsArithmetic() {
        return startsOperand() || in.check(TokenType.LPAREN) || in.checkOperator("-") || in.checkOperator("+");
    }

    LstNode parseArithmetic() {
        LstNode left = parseTerm();
        while (in.checkOperator("+") || in.checkOperator("-")) {
            LiteralNode op = Nodes.literal(in.advance());
            LstNode right = parseTerm();
            left = Nodes.clause(ClauseRole.BINARY, op.text(), List.of(left, op, right));
        }
        return left;
    }

    private LstNode parseTerm() {
        LstNode left = parseFactor();
        while (in.checkOperator("*") || in.checkOperator("/")) {
            LiteralNode op = Nodes.literal(in.advance());
            LstNode right = parseFactor();
            left = Nodes.clause(ClauseRole.BINARY, op.text(), List.of(left, op, right));
        }
        return left;
    }

    private LstNode parseFactor() {
        LstNode base = parseUnary();
        if (in.checkOperator("**")) {
            LiteralNode op = Nodes.literal(in.advance());
            LstNode exponent = parseFactor();
            return Nodes.clause(ClauseRole.BINARY, "**", List.of(base, op, exponent));
        }
        return base;
    }

    private LstNode parseUnary() {
        if (in.checkOperator("-") || in.checkOperator("+")) {
            LiteralNode op = Nodes.literal(in.advance());
            LstNode operand = parseUnary();
            if (op.text().equals("+")) {
                return Nodes.clause(ClauseRole.EXPRESSION, "+", List.of(op, operand));
            }
            return Nodes.clause(ClauseRole.NEGATE, "-", List.of(op, operand));
        }
        if (in.check(TokenType.LPAREN)) {
            LiteralNode open = Nodes.literal(in.advance());
            LstNode inner = parseArithmetic();
            LiteralNode close = Nodes.literal(in.expect(TokenType.RPAREN, ")"));
            return Nodes.clause(ClauseRole.EXPRESSION, "()", List.of(open, inner, close));
        }
        return parseOperand();
    }

    // ------------------------------------------------------------------ conditions

    LstNode parseCondition() {
        lastRelationOperator = null;
        return parseOr();
    }

    private LstNode parseOr() {
        LstNode left = parseAnd();
        while (in.checkWord("OR")) {
            LiteralNode op = Nodes.literal(in.advance());
            LstNode right = parseAnd();
            left = Nodes.clause(ClauseRole.OR, "OR", List.of(left, op, right));
        }
        return left;
    }

    private LstNode parseAnd() {
        LstNode left = parseNot();
        while (in.checkWord("AND")) {
            LiteralNode op = Nodes.literal(in.advance());
            LstNode right = parseNot();
            left = Nodes.clause(ClauseRole.AND, "AND", List.of(left, op, right));
        }
        return left;
    }

    private LstNode parseNot() {
        boolean continuation = in.previous().isWord("AND") || in.previous().isWord("OR");
        if (continuation && lastRelationOperator != null) {
            LstNode abbreviated = tryAbbreviatedRelation();
            if (abbreviated != null) {
                return abbreviated;
            }
        }
        if (in.checkWord("NOT")) {
            LiteralNode not = Nodes.literal(in.advance());
            LstNode operand = parseNot();
            return Nodes.clause(ClauseRole.NOT, "NOT", List.of(not, operand));
        }
        return parsePrimaryCondition();
    }

    /**
     * Parses an abbreviated relation operand, or returns null (position unchanged) when the next
     * tokens form a complete condition.
     */
    private LstNode tryAbbreviatedRelation() {
        int mark = in.mark();

        List<LstNode> children = new ArrayList<>();
        String operator = lastRelationOperator;
        if (startsRelationalOperator()) {
            RelationalOperator rel = parseRelationalOperator();
            children.addAll(rel.tokens);
            operator = rel.operator;
        } else if (in.checkWord("NOT") || isConditionNameAhead() || !startsArithmetic()) {
            return null;
        }

        try {
            LstNode object = parseArithmetic();
            if (startsRelationalOperator() || startsClassCondition()) {
                in.reset(mark);
                return null;
            }
            children.add(object);
        } catch (ParseException e) {
            in.reset(mark);
            return null;
        }

        lastRelationOperator = operator;
        return Nodes.clause(ClauseRole.ABBREVIATED_RELATION, operator, children);
    }

    private LstNode parsePrimaryCondition() {
        if (in.check(TokenType.LPAREN)) {
            int mark = in.mark();
            try {
                LiteralNode open = Nodes.literal(in.advance());
                LstNode inner = parseOr();
                LiteralNode close = Nodes.literal(in.expect(TokenType.RPAREN, ")"));
                if (!startsRelationalOperator() && !startsArithmeticOperator() && !startsClassCondition()) {
                    return Nodes.clause(ClauseRole.EXPRESSION, "()", List.of(open, inner, close));
                }
            } catch (ParseException e) {
                // Parenthesized arithmetic operand of a relation
            }
            in.reset(mark);
        }

        if (isConditionNameAhead()) {
            int mark = in.mark();
            ClauseNode reference = parseReference();
            if (!startsRelationalOperator()) {
                lastRelationOperator = null;
                return Nodes.clause(ClauseRole.CONDITION_NAME, List.of(reference));
            }
            in.reset(mark);
        }

        LstNode subject = parseArithmetic();

        if (startsClassCondition()) {
            List<LstNode> children = new ArrayList<>();
            children.add(subject);
            boolean negated = false;
            if (in.checkWord("IS")) {
                children.add(Nodes.literal(in.advance()));
            }
            if (in.checkWord("NOT")) {
                children.add(Nodes.literal(in.advance()));
                negated = true;
            }
            CobolToken classWord = in.advance();
            children.add(Nodes.literal(classWord));
            String word = classWord.upper();
            if (word.startsWith("ZERO")) {
                word = "ZERO";
            }
            lastRelationOperator = null;
            return Nodes.clause(ClauseRole.CLASS_CONDITION, negated ? "NOT " + word : word, children);
        }

        if (startsRelationalOperator()) {
            RelationalOperator rel = parseRelationalOperator();
            LstNode object = parseArithmetic();
            List<LstNode> children = new ArrayList<>();
            children.add(subject);
            children.addAll(rel.tokens);
            children.add(object);
            lastRelationOperator = rel.operator;
            return Nodes.clause(ClauseRole.RELATION, rel.operator, children);
        }

        if (subject instanceof ClauseNode clause && clause.getRole() == ClauseRole.REFERENCE) {
            // A condition name declared elsewhere or not at all; the symbol table decides.
            lastRelationOperator = null;
            return Nodes.clause(ClauseRole.CONDITION_NAME, List.of(subject));
        }

        throw new ParseException(in.peek(), "relational operator");
    }

    private boolean isConditionNameAhead() {
        CobolToken token = in.peek();
        return TokenStream.isIdentifier(token) && conditionNames.contains(token.upper());
    }

    private boolean startsArithmeticOperator() {
        return in.checkOperator("+") || in.checkOperator("-") || in.checkOperator("*")
                || in.checkOperator("/") || in.checkOperator("**");
    }

    private boolean startsClassCondition() {
        int ahead = 0;
        if (in.peek(ahead).isWord("IS")) ahead++;
        if (in.peek(ahead).isWord("NOT")) ahead++;
        CobolToken token = in.peek(ahead);
        return token.getType() == TokenType.WORD && CLASS_WORDS.contains(token.upper());
    }

    boolean startsRelationalOperator() {
        int ahead = 0;
        if (in.peek(ahead).isWord("IS")) ahead++;
        if (in.peek(ahead).isWord("NOT")) ahead++;
        CobolToken token = in.peek(ahead);
        if (token.getType() == TokenType.OPERATOR) {
            return Set.of("=", "<", ">", "<=", ">=", "<>").contains(token.getText());
        }
        return token.isWord("GREATER") || token.isWord("LESS") || token.isWord("EQUAL") || token.isWord("EQUALS");
    }

    /**
     * [IS] [NOT] GREATER [THAN] [OR EQUAL [TO]] | LESS ... | EQUAL [TO] | symbol
     */
    RelationalOperator parseRelationalOperator() {
        List<LstNode> tokens = new ArrayList<>();
        boolean negated = false;
        if (in.checkWord("IS")) {
            tokens.add(Nodes.literal(in.advance()));
        }
        if (in.checkWord("NOT")) {
            tokens.add(Nodes.literal(in.advance()));
            negated = true;
        }

        String op;
        CobolToken token = in.advance();
        tokens.add(Nodes.literal(token));
        String word = token.upper();

        if (token.getType() == TokenType.OPERATOR) {
            op = token.getText();
        } else if (word.equals("GREATER") || word.equals("LESS")) {
            op = word.equals("GREATER") ? ">" : "<";
            if (in.checkWord("THAN")) {
                tokens.add(Nodes.literal(in.advance()));
            }
            if (in.checkWord("OR") && in.checkWordAt(1, "EQUAL")) {
                tokens.add(Nodes.literal(in.advance()));
                tokens.add(Nodes.literal(in.advance()));
                if (in.checkWord("TO")) {
                    tokens.add(Nodes.literal(in.advance()));
                }
                op = op + "=";
            }
        } else if (word.equals("EQUAL") || word.equals("EQUALS")) {
            op = "=";
            if (in.checkWord("TO")) {
                tokens.add(Nodes.literal(in.advance()));
            }
        } else {
            throw new ParseException(token, "relational operator");
        }

        return new RelationalOperator(negated ? negate(op) : op, tokens);
    }

    private static String negate(String op) {
        switch (op) {
            case "=":
                return "<>";
            case "<>":
                return "=";
            case "<":
                return ">=";
            case ">":
                return "<=";
            case "<=":
                return ">";
            case ">=":
                return "<";
            default:
                throw new IllegalArgumentException("Unknown operator " + op.toUpperCase(Locale.ROOT));
        }
    }

    static final class RelationalOperator {
        final String operator;
        final List<LstNode> tokens;

        RelationalOperator(String operator, List<LstNode> tokens) {
            this.operator = operator;
            this.tokens = tokens;
        }
    }
}

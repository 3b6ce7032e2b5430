package com.mainframe.transpiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.lexer.CobolToken;
import com.mainframe.transpiler.lexer.ReservedWords;
import com.mainframe.transpiler.lexer.TokenType;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.StatementNode;

/**
 * Parses procedure division statements. Each method consumes one statement including its optional
 * explicit scope terminator; a statement list ends at a period or at a word that belongs to the
 * enclosing statement (ELSE, WHEN, AT END, NOT ..., END-xxx).
 */
class StatementParser {
    private static final Logger log = LoggerFactory.getLogger(StatementParser.class);

    private static final Set<String> STOP_WORDS = Set.of(
            "ELSE", "WHEN", "NOT", "AT", "ON", "END", "INVALID", "ALSO", "THEN"
    );

    private static final Set<String> OPEN_MODES = Set.of("INPUT", "OUTPUT", "I-O", "EXTEND");

    private final TokenStream in;
    private final ExpressionParser expr;

    StatementParser(TokenStream in, ExpressionParser expr) {
        this.in = in;
        this.expr = expr;
    }

    boolean atStatementListEnd() {
        CobolToken token = in.peek();
        if (token.getType() == TokenType.PERIOD || token.getType() == TokenType.EOF) {
            return true;
        }
        if (token.getType() != TokenType.WORD) {
            return false;
        }
        return STOP_WORDS.contains(token.upper()) || ReservedWords.isScopeTerminator(token.getText());
    }

    List<StatementNode> parseStatements() {
        List<StatementNode> out = new ArrayList<>();
        while (!atStatementListEnd()) {
            out.add(parseStatement());
        }
        return out;
    }

    /**
     * A statement list that may also be the phrase NEXT SENTENCE (IF branches, WHEN bodies).
     */
    private List<StatementNode> parseBranch() {
        if (in.checkWord("NEXT") && in.checkWordAt(1, "SENTENCE")) {
            int start = in.mark();
            List<LstNode> children = new ArrayList<>();
            children.add(Nodes.literal(in.advance()));
            children.add(Nodes.literal(in.advance()));
            return List.of(finish("NEXT-SENTENCE", start, children));
        }
        return parseStatements();
    }

    StatementNode parseStatement() {
        CobolToken verb = in.peek();
        if (verb.getType() != TokenType.WORD) {
            throw new ParseException(verb, "statement");
        }
        if (ReservedWords.isReserved(verb.getText()) && !ReservedWords.isVerb(verb.getText())) {
            throw new ParseException(verb, "statement");
        }

        switch (verb.upper()) {
            case "MOVE":
                return parseMove();
            case "ADD":
                return parseArithmeticStatement("ADD", "TO");
            case "SUBTRACT":
                return parseArithmeticStatement("SUBTRACT", "FROM");
            case "MULTIPLY":
                return parseArithmeticStatement("MULTIPLY", "BY");
            case "DIVIDE":
                return parseDivide();
            case "COMPUTE":
                return parseCompute();
            case "IF":
                return parseIf();
            case "EVALUATE":
                return parseEvaluate();
            case "PERFORM":
                return parsePerform();
            case "GO":
                return parseGoTo();
            case "DISPLAY":
                return parseDisplay();
            case "ACCEPT":
                return parseAccept();
            case "OPEN":
                return parseOpen();
            case "CLOSE":
                return parseClose();
            case "READ":
                return parseRead();
            case "WRITE":
                return parseWrite();
            case "STOP":
                return parseStop();
            case "GOBACK":
            case "CONTINUE":
                return parseKeywordOnly(verb.upper());
            case "EXIT":
                return parseExit();
            case "INITIALIZE":
                return parseInitialize();
            case "SET":
                return parseSet();
            case "CALL":
                return parseCall();
            case "ALTER":
                return parseAlter();
            case "EXEC":
                return parseExec();
            case "SORT":
            case "MERGE":
                return parseOpaque(verb.upper());
            default:
                return parseOpaque(StatementNode.UNKNOWN);
        }
    }

    // ------------------------------------------------------------------ data movement

    private StatementNode parseMove() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("MOVE"));
        if (in.checkWord("CORR", "CORRESPONDING")) {
            children.add(Nodes.clause(ClauseRole.OPTIONS, "CORRESPONDING", List.of(Nodes.literal(in.advance()))));
        }
        children.add(Nodes.clause(ClauseRole.SOURCES, List.of(expr.parseOperand())));
        children.add(keyword("TO"));
        List<LstNode> targets = new ArrayList<>();
        do {
            targets.add(expr.parseReference());
        } while (in.checkIdentifier());
        children.add(Nodes.clause(ClauseRole.TARGETS, targets));
        return finish("MOVE", start, children);
    }

    private StatementNode parseInitialize() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("INITIALIZE"));
        List<LstNode> targets = new ArrayList<>();
        do {
            targets.add(expr.parseReference());
        } while (in.checkIdentifier());
        children.add(Nodes.clause(ClauseRole.TARGETS, targets));
        if (in.checkWord("REPLACING")) {
            throw new ParseException(in.peek(), "end of INITIALIZE (REPLACING is not supported)");
        }
        return finish("INITIALIZE", start, children);
    }

    private StatementNode parseSet() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("SET"));
        List<LstNode> targets = new ArrayList<>();
        do {
            targets.add(expr.parseReference());
        } while (in.checkIdentifier());
        children.add(Nodes.clause(ClauseRole.TARGETS, targets));

        if (in.checkWord("TO")) {
            List<LstNode> value = new ArrayList<>();
            value.add(Nodes.literal(in.advance()));
            if (in.checkWord("TRUE", "FALSE")) {
                CobolToken bool = in.advance();
                value.add(Nodes.literal(bool));
                children.add(Nodes.clause(ClauseRole.VALUE, bool.upper(), value));
            } else {
                value.add(expr.parseOperand());
                children.add(Nodes.clause(ClauseRole.VALUE, "TO", value));
            }
        } else if (in.checkWord("UP", "DOWN")) {
            CobolToken direction = in.advance();
            List<LstNode> by = new ArrayList<>();
            by.add(Nodes.literal(direction));
            by.add(keyword("BY"));
            by.add(expr.parseOperand());
            children.add(Nodes.clause(ClauseRole.BY, direction.upper(), by));
        } else {
            throw new ParseException(in.peek(), List.of("TO", "UP BY", "DOWN BY"));
        }
        return finish("SET", start, children);
    }

    // ------------------------------------------------------------------ arithmetic

    /**
     * ADD / SUBTRACT / MULTIPLY: sources, then either a target list after the keyword, or a single
     * operand after the keyword followed by GIVING.
     */
    private StatementNode parseArithmeticStatement(String verb, String keyword) {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword(verb));
        if (in.checkWord("CORR", "CORRESPONDING")) {
            throw new ParseException(in.peek(), "operand (CORRESPONDING arithmetic is not supported)");
        }
        children.add(Nodes.clause(ClauseRole.SOURCES, operandList()));

        if (in.checkWord(keyword)) {
            int mark = in.mark();
            LiteralNode kw = Nodes.literal(in.advance());
            LstNode operand = expr.parseOperand();
            if (in.checkWord("GIVING")) {
                children.add(Nodes.clause(ClauseRole.OPERAND, keyword, List.of(kw, operand)));
                children.add(giving());
            } else {
                in.reset(mark);
                List<LstNode> targets = new ArrayList<>();
                targets.add(Nodes.literal(in.advance()));
                targets.addAll(targetList());
                children.add(Nodes.clause(ClauseRole.TARGETS, targets));
            }
        } else if (verb.equals("ADD") && in.checkWord("GIVING")) {
            children.add(giving());
        } else {
            throw new ParseException(in.peek(), keyword);
        }

        sizeErrorPhrases(children);
        scopeTerminator(children, "END-" + verb);
        return finish(verb, start, children);
    }

    private StatementNode parseDivide() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("DIVIDE"));
        children.add(Nodes.clause(ClauseRole.SOURCES, List.of(expr.parseOperand())));

        if (in.checkWord("INTO")) {
            int mark = in.mark();
            LiteralNode kw = Nodes.literal(in.advance());
            LstNode operand = expr.parseOperand();
            if (in.checkWord("GIVING")) {
                children.add(Nodes.clause(ClauseRole.OPERAND, "INTO", List.of(kw, operand)));
                children.add(giving());
                remainder(children);
            } else {
                in.reset(mark);
                List<LstNode> targets = new ArrayList<>();
                targets.add(Nodes.literal(in.advance()));
                targets.addAll(targetList());
                children.add(Nodes.clause(ClauseRole.TARGETS, targets));
            }
        } else if (in.checkWord("BY")) {
            LiteralNode kw = Nodes.literal(in.advance());
            children.add(Nodes.clause(ClauseRole.OPERAND, "BY", List.of(kw, expr.parseOperand())));
            if (!in.checkWord("GIVING")) {
                throw new ParseException(in.peek(), "GIVING");
            }
            children.add(giving());
            remainder(children);
        } else {
            throw new ParseException(in.peek(), List.of("INTO", "BY"));
        }

        sizeErrorPhrases(children);
        scopeTerminator(children, "END-DIVIDE");
        return finish("DIVIDE", start, children);
    }

    private StatementNode parseCompute() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("COMPUTE"));
        children.add(Nodes.clause(ClauseRole.TARGETS, targetList()));
        if (in.checkOperator("=") || in.checkWord("EQUAL")) {
            children.add(Nodes.literal(in.advance()));
        } else {
            throw new ParseException(in.peek(), "=");
        }
        children.add(Nodes.clause(ClauseRole.EXPRESSION, List.of(expr.parseArithmetic())));
        sizeErrorPhrases(children);
        scopeTerminator(children, "END-COMPUTE");
        return finish("COMPUTE", start, children);
    }

    private List<LstNode> operandList() {
        List<LstNode> operands = new ArrayList<>();
        do {
            operands.add(expr.parseOperand());
        } while (expr.startsOperand());
        return operands;
    }

    private List<LstNode> targetList() {
        List<LstNode> targets = new ArrayList<>();
        do {
            List<LstNode> target = new ArrayList<>();
            target.add(expr.parseReference());
            String rounded = null;
            if (in.checkWord("ROUNDED")) {
                target.add(Nodes.literal(in.advance()));
                rounded = "ROUNDED";
            }
            targets.add(Nodes.clause(ClauseRole.TARGET, rounded, target));
        } while (in.checkIdentifier());
        return targets;
    }

    private ClauseNode giving() {
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("GIVING"));
        children.addAll(targetList());
        return Nodes.clause(ClauseRole.GIVING, children);
    }

    private void remainder(List<LstNode> children) {
        if (in.checkWord("REMAINDER")) {
            LiteralNode kw = Nodes.literal(in.advance());
            children.add(Nodes.clause(ClauseRole.REMAINDER, List.of(kw, expr.parseReference())));
        }
    }

    /**
     * [ON] SIZE ERROR statements [NOT [ON] SIZE ERROR statements]
     */
    private void sizeErrorPhrases(List<LstNode> children) {
        if (in.checkWord("SIZE") || (in.checkWord("ON") && in.checkWordAt(1, "SIZE"))) {
            List<LstNode> phrase = new ArrayList<>();
            if (in.checkWord("ON")) phrase.add(Nodes.literal(in.advance()));
            phrase.add(keyword("SIZE"));
            phrase.add(keyword("ERROR"));
            phrase.addAll(parseStatements());
            children.add(Nodes.clause(ClauseRole.ON_SIZE_ERROR, phrase));
        }
        if (in.checkWord("NOT") && (in.checkWordAt(1, "SIZE") || (in.checkWordAt(1, "ON") && in.checkWordAt(2, "SIZE")))) {
            List<LstNode> phrase = new ArrayList<>();
            phrase.add(Nodes.literal(in.advance()));
            if (in.checkWord("ON")) phrase.add(Nodes.literal(in.advance()));
            phrase.add(keyword("SIZE"));
            phrase.add(keyword("ERROR"));
            phrase.addAll(parseStatements());
            children.add(Nodes.clause(ClauseRole.NOT_ON_SIZE_ERROR, phrase));
        }
    }

    // ------------------------------------------------------------------ control

    private StatementNode parseIf() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("IF"));
        children.add(Nodes.clause(ClauseRole.CONDITION, List.of(expr.parseCondition())));

        List<LstNode> thenPart = new ArrayList<>();
        if (in.checkWord("THEN")) {
            thenPart.add(Nodes.literal(in.advance()));
        }
        List<StatementNode> thenStatements = parseBranch();
        if (thenStatements.isEmpty()) {
            throw new ParseException(in.peek(), "statement");
        }
        thenPart.addAll(thenStatements);
        children.add(Nodes.clause(ClauseRole.THEN, thenPart));

        if (in.checkWord("ELSE")) {
            List<LstNode> elsePart = new ArrayList<>();
            elsePart.add(Nodes.literal(in.advance()));
            elsePart.addAll(parseBranch());
            children.add(Nodes.clause(ClauseRole.ELSE, elsePart));
        }

        scopeTerminator(children, "END-IF");
        return finish("IF", start, children);
    }

    private StatementNode parseEvaluate() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("EVALUATE"));

        boolean conditional;
        if (in.checkWord("TRUE", "FALSE")) {
            CobolToken bool = in.advance();
            children.add(Nodes.clause(ClauseRole.SUBJECT, bool.upper(), List.of(Nodes.literal(bool))));
            conditional = true;
        } else {
            children.add(Nodes.clause(ClauseRole.SUBJECT, List.of(expr.parseArithmetic())));
            conditional = false;
        }
        if (in.checkWord("ALSO")) {
            throw new ParseException(in.peek(), "WHEN (EVALUATE ... ALSO is not supported)");
        }

        if (!in.checkWord("WHEN")) {
            throw new ParseException(in.peek(), "WHEN");
        }

        while (in.checkWord("WHEN")) {
            List<LstNode> when = new ArrayList<>();
            when.add(Nodes.literal(in.advance()));
            if (in.checkWord("OTHER")) {
                when.add(Nodes.literal(in.advance()));
                when.addAll(parseBranch());
                children.add(Nodes.clause(ClauseRole.WHEN_OTHER, when));
                break;
            }
            when.add(conditional ? Nodes.clause(ClauseRole.CONDITION, List.of(expr.parseCondition())) : whenObject());
            if (in.checkWord("ALSO")) {
                throw new ParseException(in.peek(), "statement (WHEN ... ALSO is not supported)");
            }
            when.addAll(parseBranch());
            children.add(Nodes.clause(ClauseRole.WHEN, when));
        }

        scopeTerminator(children, "END-EVALUATE");
        return finish("EVALUATE", start, children);
    }

    /**
     * [NOT] ANY | value [THRU value]
     */
    private ClauseNode whenObject() {
        List<LstNode> children = new ArrayList<>();
        String negation = null;
        if (in.checkWord("NOT")) {
            children.add(Nodes.literal(in.advance()));
            negation = "NOT";
        }
        if (in.checkWord("ANY")) {
            children.add(Nodes.literal(in.advance()));
            return Nodes.clause(ClauseRole.VALUE, "ANY", children);
        }
        children.add(expr.parseArithmetic());
        if (in.checkWord("THRU", "THROUGH")) {
            children.add(Nodes.literal(in.advance()));
            children.add(expr.parseArithmetic());
            return Nodes.clause(ClauseRole.RANGE, negation, children);
        }
        return Nodes.clause(ClauseRole.VALUE, negation, children);
    }

    private StatementNode parsePerform() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("PERFORM"));

        boolean outOfLine = isProcedureName(in.peek()) && !in.checkWordAt(1, "TIMES");
        if (outOfLine) {
            children.add(Nodes.clause(ClauseRole.PROCEDURE, List.of(Nodes.identifier(in.advance()))));
            if (in.checkWord("THRU", "THROUGH")) {
                LiteralNode thru = Nodes.literal(in.advance());
                if (!isProcedureName(in.peek())) {
                    throw new ParseException(in.peek(), "procedure name");
                }
                children.add(Nodes.clause(ClauseRole.THRU, List.of(thru, Nodes.identifier(in.advance()))));
            }
        }

        performLoopPhrase(children);

        if (!outOfLine) {
            List<StatementNode> body = parseStatements();
            if (!body.isEmpty()) {
                children.add(Nodes.clause(ClauseRole.BODY, body));
            }
            if (!in.checkWord("END-PERFORM")) {
                throw new ParseException(in.peek(), "END-PERFORM");
            }
            children.add(Nodes.literal(in.advance()));
        }
        return finish("PERFORM", start, children);
    }

    private void performLoopPhrase(List<LstNode> children) {
        if (expr.startsOperand() && in.checkWordAt(1, "TIMES")) {
            LstNode count = expr.parseOperand();
            children.add(Nodes.clause(ClauseRole.TIMES, List.of(count, keyword("TIMES"))));
            return;
        }

        if (in.checkWord("WITH", "TEST")) {
            List<LstNode> test = new ArrayList<>();
            if (in.checkWord("WITH")) test.add(Nodes.literal(in.advance()));
            test.add(keyword("TEST"));
            if (!in.checkWord("BEFORE", "AFTER")) {
                throw new ParseException(in.peek(), List.of("BEFORE", "AFTER"));
            }
            CobolToken when = in.advance();
            test.add(Nodes.literal(when));
            children.add(Nodes.clause(ClauseRole.TEST_AFTER, when.upper(), test));
        }

        if (in.checkWord("UNTIL")) {
            children.add(untilClause());
        } else if (in.checkWord("VARYING")) {
            List<LstNode> varying = new ArrayList<>();
            varying.add(Nodes.literal(in.advance()));
            varying.add(Nodes.clause(ClauseRole.TARGET, List.of(expr.parseReference())));
            LiteralNode from = keyword("FROM");
            varying.add(Nodes.clause(ClauseRole.FROM, List.of(from, expr.parseArithmetic())));
            LiteralNode by = keyword("BY");
            varying.add(Nodes.clause(ClauseRole.BY, List.of(by, expr.parseArithmetic())));
            if (!in.checkWord("UNTIL")) {
                throw new ParseException(in.peek(), "UNTIL");
            }
            varying.add(untilClause());
            if (in.checkWord("AFTER")) {
                throw new ParseException(in.peek(), "statement (PERFORM VARYING ... AFTER is not supported)");
            }
            children.add(Nodes.clause(ClauseRole.VARYING, varying));
        }
    }

    private ClauseNode untilClause() {
        LiteralNode until = keyword("UNTIL");
        ClauseNode condition = Nodes.clause(ClauseRole.CONDITION, List.of(expr.parseCondition()));
        return Nodes.clause(ClauseRole.UNTIL, List.of(until, condition));
    }

    private StatementNode parseGoTo() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("GO"));
        if (in.checkWord("TO")) {
            children.add(Nodes.literal(in.advance()));
        }
        while (isProcedureName(in.peek())) {
            children.add(Nodes.clause(ClauseRole.PROCEDURE, List.of(Nodes.identifier(in.advance()))));
        }
        if (in.checkWord("DEPENDING")) {
            List<LstNode> depending = new ArrayList<>();
            depending.add(Nodes.literal(in.advance()));
            if (in.checkWord("ON")) depending.add(Nodes.literal(in.advance()));
            depending.add(expr.parseReference());
            children.add(Nodes.clause(ClauseRole.DEPENDING_ON, depending));
        }
        return finish("GO", start, children);
    }

    private StatementNode parseStop() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("STOP"));
        children.add(keyword("RUN"));
        return finish("STOP", start, children);
    }

    private StatementNode parseExit() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("EXIT"));
        if (in.checkWord("PROGRAM", "PARAGRAPH", "SECTION", "PERFORM")) {
            CobolToken kind = in.advance();
            List<LstNode> option = new ArrayList<>();
            option.add(Nodes.literal(kind));
            String operator = kind.upper();
            if (kind.isWord("PERFORM") && in.checkWord("CYCLE")) {
                option.add(Nodes.literal(in.advance()));
                operator = "PERFORM CYCLE";
            }
            children.add(Nodes.clause(ClauseRole.OPTIONS, operator, option));
        }
        return finish("EXIT", start, children);
    }

    private StatementNode parseKeywordOnly(String verb) {
        int start = in.mark();
        return finish(verb, start, List.of(keyword(verb)));
    }

    private StatementNode parseAlter() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("ALTER"));
        do {
            List<LstNode> pair = new ArrayList<>();
            pair.add(Nodes.identifier(in.advance()));
            pair.add(keyword("TO"));
            if (in.checkWord("PROCEED")) {
                pair.add(Nodes.literal(in.advance()));
                pair.add(keyword("TO"));
            }
            if (!isProcedureName(in.peek())) {
                throw new ParseException(in.peek(), "procedure name");
            }
            pair.add(Nodes.identifier(in.advance()));
            children.add(Nodes.clause(ClauseRole.ALTER_TARGET, pair));
        } while (isProcedureName(in.peek()));
        return finish("ALTER", start, children);
    }

    private StatementNode parseCall() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("CALL"));
        children.add(Nodes.clause(ClauseRole.OPERAND, List.of(expr.parseOperand())));
        if (in.checkWord("USING")) {
            List<LstNode> using = new ArrayList<>();
            using.add(Nodes.literal(in.advance()));
            while (expr.startsOperand() || in.checkWord("BY", "REFERENCE", "CONTENT", "VALUE")) {
                if (in.checkWord("BY", "REFERENCE", "CONTENT", "VALUE")) {
                    using.add(Nodes.literal(in.advance()));
                } else {
                    using.add(expr.parseOperand());
                }
            }
            children.add(Nodes.clause(ClauseRole.USING, using));
        }
        if (in.checkWord("ON") || (in.checkWord("NOT") && in.checkWordAt(1, "ON"))) {
            throw new ParseException(in.peek(), "END-CALL (ON EXCEPTION is not supported)");
        }
        scopeTerminator(children, "END-CALL");
        return finish("CALL", start, children);
    }

    // ------------------------------------------------------------------ I/O

    private StatementNode parseDisplay() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("DISPLAY"));
        List<LstNode> sources = new ArrayList<>();
        do {
            sources.add(expr.parseOperand());
        } while (expr.startsOperand());
        children.add(Nodes.clause(ClauseRole.SOURCES, sources));

        if (in.checkWord("UPON")) {
            LiteralNode upon = Nodes.literal(in.advance());
            CobolToken device = in.expect(TokenType.WORD, "mnemonic name");
            children.add(Nodes.clause(ClauseRole.UPON, device.upper(), List.of(upon, Nodes.literal(device))));
        }
        if (in.checkWord("NO") || (in.checkWord("WITH") && in.checkWordAt(1, "NO"))) {
            List<LstNode> advancing = new ArrayList<>();
            if (in.checkWord("WITH")) advancing.add(Nodes.literal(in.advance()));
            advancing.add(keyword("NO"));
            advancing.add(keyword("ADVANCING"));
            children.add(Nodes.clause(ClauseRole.ADVANCING, "NO", advancing));
        }
        scopeTerminator(children, "END-DISPLAY");
        return finish("DISPLAY", start, children);
    }

    private StatementNode parseAccept() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("ACCEPT"));
        children.add(Nodes.clause(ClauseRole.TARGET, List.of(expr.parseReference())));
        if (in.checkWord("FROM")) {
            LiteralNode from = Nodes.literal(in.advance());
            CobolToken source = in.expect(TokenType.WORD, "DATE, DAY, TIME or mnemonic name");
            List<LstNode> parts = new ArrayList<>(List.of(from, Nodes.literal(source)));
            String operator = source.upper();
            if (in.checkWord("YYYYMMDD", "YYYYDDD")) {
                CobolToken format = in.advance();
                parts.add(Nodes.literal(format));
                operator = operator + " " + format.upper();
            }
            children.add(Nodes.clause(ClauseRole.FROM, operator, parts));
        }
        scopeTerminator(children, "END-ACCEPT");
        return finish("ACCEPT", start, children);
    }

    private StatementNode parseOpen() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("OPEN"));
        if (!in.checkWord(OPEN_MODES.toArray(new String[0]))) {
            throw new ParseException(in.peek(), List.of("INPUT", "OUTPUT", "I-O", "EXTEND"));
        }
        while (in.checkWord(OPEN_MODES.toArray(new String[0]))) {
            CobolToken mode = in.advance();
            List<LstNode> group = new ArrayList<>();
            group.add(Nodes.literal(mode));
            do {
                group.add(Nodes.clause(ClauseRole.FILE, List.of(Nodes.identifier(in.expectIdentifier("file name")))));
            } while (in.checkIdentifier());
            children.add(Nodes.clause(ClauseRole.OPEN_MODE, mode.upper(), group));
        }
        return finish("OPEN", start, children);
    }

    private StatementNode parseClose() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("CLOSE"));
        do {
            children.add(Nodes.clause(ClauseRole.FILE, List.of(Nodes.identifier(in.expectIdentifier("file name")))));
        } while (in.checkIdentifier());
        return finish("CLOSE", start, children);
    }

    private StatementNode parseRead() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("READ"));
        children.add(Nodes.clause(ClauseRole.FILE, List.of(Nodes.identifier(in.expectIdentifier("file name")))));
        if (in.checkWord("NEXT")) children.add(Nodes.literal(in.advance()));
        if (in.checkWord("RECORD")) children.add(Nodes.literal(in.advance()));
        if (in.checkWord("INTO")) {
            LiteralNode into = Nodes.literal(in.advance());
            children.add(Nodes.clause(ClauseRole.INTO, List.of(into, expr.parseReference())));
        }
        if (in.checkWord("INVALID") || in.checkWord("KEY")) {
            throw new ParseException(in.peek(), "AT END (keyed READ is not supported)");
        }
        if (in.checkWord("END") || (in.checkWord("AT") && in.checkWordAt(1, "END"))) {
            List<LstNode> atEnd = new ArrayList<>();
            if (in.checkWord("AT")) atEnd.add(Nodes.literal(in.advance()));
            atEnd.add(keyword("END"));
            atEnd.addAll(parseStatements());
            children.add(Nodes.clause(ClauseRole.AT_END, atEnd));
        }
        if (in.checkWord("NOT") && (in.checkWordAt(1, "END") || (in.checkWordAt(1, "AT") && in.checkWordAt(2, "END")))) {
            List<LstNode> notAtEnd = new ArrayList<>();
            notAtEnd.add(Nodes.literal(in.advance()));
            if (in.checkWord("AT")) notAtEnd.add(Nodes.literal(in.advance()));
            notAtEnd.add(keyword("END"));
            notAtEnd.addAll(parseStatements());
            children.add(Nodes.clause(ClauseRole.NOT_AT_END, notAtEnd));
        }
        scopeTerminator(children, "END-READ");
        return finish("READ", start, children);
    }

    private StatementNode parseWrite() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("WRITE"));
        children.add(Nodes.clause(ClauseRole.TARGET, List.of(expr.parseReference())));
        if (in.checkWord("FROM")) {
            LiteralNode from = Nodes.literal(in.advance());
            children.add(Nodes.clause(ClauseRole.FROM, List.of(from, expr.parseOperand())));
        }
        if (in.checkWord("BEFORE", "AFTER")) {
            CobolToken when = in.advance();
            List<LstNode> advancing = new ArrayList<>();
            advancing.add(Nodes.literal(when));
            if (in.checkWord("ADVANCING")) advancing.add(Nodes.literal(in.advance()));
            if (in.checkWord("PAGE")) {
                advancing.add(Nodes.literal(in.advance()));
            } else {
                advancing.add(expr.parseOperand());
                if (in.checkWord("LINE", "LINES")) advancing.add(Nodes.literal(in.advance()));
            }
            children.add(Nodes.clause(ClauseRole.ADVANCING, when.upper(), advancing));
        }
        if (in.checkWord("INVALID") || (in.checkWord("AT") && in.checkWordAt(1, "END-OF-PAGE"))) {
            throw new ParseException(in.peek(), "END-WRITE (INVALID KEY / END-OF-PAGE is not supported)");
        }
        scopeTerminator(children, "END-WRITE");
        return finish("WRITE", start, children);
    }

    // ------------------------------------------------------------------ opaque statements

    private StatementNode parseExec() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(keyword("EXEC"));
        while (!in.isAtEnd() && !in.checkWord("END-EXEC")) {
            children.add(Nodes.literal(in.advance()));
        }
        if (!in.checkWord("END-EXEC")) {
            throw new ParseException(in.peek(), "END-EXEC");
        }
        children.add(Nodes.literal(in.advance()));
        return finish("EXEC", start, children);
    }

    /**
     * Statements kept only as tokens: SORT, MERGE, and verbs outside the supported set. They run to
     * their own END-verb, or else to the period or a word that closes an enclosing scope.
     */
    private StatementNode parseOpaque(String verb) {
        int start = in.mark();
        CobolToken first = in.advance();
        List<LstNode> children = new ArrayList<>();
        children.add(Nodes.literal(first));

        String terminator = "END-" + first.upper();
        boolean ownTerminator = ReservedWords.isScopeTerminator(terminator);
        boolean search = first.isWord("SEARCH");

        while (!in.isAtEnd() && !in.check(TokenType.PERIOD)) {
            if (ownTerminator && in.checkWord(terminator)) {
                children.add(Nodes.literal(in.advance()));
                break;
            }
            if (in.checkWord("ELSE") || (!search && in.checkWord("WHEN"))
                    || (ReservedWords.isScopeTerminator(in.peek().getText()) && !in.checkWord(terminator))) {
                break;
            }
            children.add(Nodes.literal(in.advance()));
        }

        log.debug("Opaque {} statement at line {}", first.upper(), first.getLine());
        return finish(verb, start, children);
    }

    // ------------------------------------------------------------------ helpers

    private static boolean isProcedureName(CobolToken token) {
        return TokenStream.isIdentifier(token) || token.getType() == TokenType.NUMBER && !token.getText().contains(".");
    }

    private LiteralNode keyword(String word) {
        return Nodes.literal(in.expectWord(word));
    }

    private void scopeTerminator(List<LstNode> children, String terminator) {
        if (in.checkWord(terminator)) {
            children.add(Nodes.literal(in.advance()));
        }
    }

    private StatementNode finish(String verb, int start, List<LstNode> children) {
        List<LstNode> all = new ArrayList<>(in.takeComments(start, in.mark()));
        all.addAll(children);
        return Nodes.statement(verb, all);
    }
}

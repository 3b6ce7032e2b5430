package com.mainframe.transpiler.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.diagnostics.SyntaxError;
import com.mainframe.transpiler.lexer.CobolToken;
import com.mainframe.transpiler.lexer.TokenType;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.CommentNode;
import com.mainframe.transpiler.lst.DivisionNode;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.ParagraphNode;
import com.mainframe.transpiler.lst.SectionNode;
import com.mainframe.transpiler.lst.SentenceNode;
import com.mainframe.transpiler.lst.StatementNode;

/**
 * Parser for COBOL programs.
 * Converts tokens into the Lossless Semantic Tree.
 *
 * Parsing only:
 * - Builds the tree, keeping every token and comment
 * - Collects condition names so abbreviated relations can be told apart from them
 * - Reports syntax errors
 *
 * It does NOT resolve data names, compute layouts or check control flow.
 *
 * A syntax error in the procedure division abandons the rest of the paragraph: its remaining tokens
 * are kept in an UNPARSED statement and parsing resumes at the next paragraph header.
 */
public class CobolParser {
    private static final Logger log = LoggerFactory.getLogger(CobolParser.class);

    private static final Set<String> DIVISIONS = Set.of("IDENTIFICATION", "ID", "ENVIRONMENT", "DATA", "PROCEDURE");

    private static final Set<String> IDENTIFICATION_PARAGRAPHS = Set.of(
            "PROGRAM-ID", "AUTHOR", "INSTALLATION", "DATE-WRITTEN", "DATE-COMPILED", "SECURITY", "REMARKS"
    );

    private static final Set<String> ENVIRONMENT_PARAGRAPHS = Set.of(
            "SOURCE-COMPUTER", "OBJECT-COMPUTER", "SPECIAL-NAMES", "FILE-CONTROL", "I-O-CONTROL", "REPOSITORY"
    );

    private static final Set<String> USAGE_WORDS = Set.of(
            "DISPLAY", "COMP", "COMPUTATIONAL", "COMP-1", "COMPUTATIONAL-1", "COMP-2", "COMPUTATIONAL-2",
            "COMP-3", "COMPUTATIONAL-3", "COMP-4", "COMPUTATIONAL-4", "COMP-5", "COMPUTATIONAL-5",
            "BINARY", "PACKED-DECIMAL", "INDEX", "POINTER"
    );

    private final TokenStream in;
    private final String fileName;
    private final Set<String> conditionNames = new HashSet<>();
    private final List<SyntaxError> errors = new ArrayList<>();
    private final ExpressionParser expressions;
    private final StatementParser statements;

    private String programId;
    private String currentParagraph;

    public CobolParser(List<CobolToken> tokens, String fileName) {
        this.in = new TokenStream(tokens);
        this.fileName = fileName;
        this.expressions = new ExpressionParser(in, conditionNames);
        this.statements = new StatementParser(in, expressions);
    }

    public ParseResult parse() {
        List<DivisionNode> divisions = new ArrayList<>();
        String fatalReason = null;

        List<LstNode> stray = new ArrayList<>();
        while (!in.isAtEnd() && !isDivisionHeader()) {
            stray.add(Nodes.literal(in.advance()));
        }
        if (!stray.isEmpty()) {
            error(new ParseException(((LiteralNode) stray.get(0)).getToken(), "IDENTIFICATION DIVISION"));
            divisions.add(new DivisionNode(StatementNode.UNPARSED, Nodes.spanOf(stray), stray));
        }

        while (!in.isAtEnd()) {
            if (!isDivisionHeader()) {
                // Only reachable after END PROGRAM
                List<LstNode> rest = new ArrayList<>();
                error(new ParseException(in.peek(), "end of program"));
                while (!in.isAtEnd()) {
                    rest.add(Nodes.literal(in.advance()));
                }
                divisions.add(new DivisionNode(StatementNode.UNPARSED, Nodes.spanOf(rest), rest));
                break;
            }
            String name = in.peek().upper();
            switch (name) {
                case "IDENTIFICATION":
                case "ID":
                    divisions.add(parseIdentification());
                    break;
                case "ENVIRONMENT":
                    divisions.add(parseEnvironment());
                    break;
                case "DATA":
                    divisions.add(parseData());
                    break;
                default:
                    divisions.add(parseProcedure());
                    break;
            }
        }

        if (divisions.stream().noneMatch(d -> d.getName().equals("IDENTIFICATION"))) {
            fatalReason = "IDENTIFICATION DIVISION is missing";
        } else if (divisions.stream().noneMatch(d -> d.getName().equals("PROCEDURE"))) {
            fatalReason = "PROCEDURE DIVISION could not be located";
        }

        List<CommentNode> trailing = in.takeRemainingComments();
        if (!trailing.isEmpty() && !divisions.isEmpty()) {
            DivisionNode last = divisions.remove(divisions.size() - 1);
            List<LstNode> children = new ArrayList<>(last.getChildren());
            children.addAll(trailing);
            divisions.add(new DivisionNode(last.getName(), last.getSpan(), children));
        }

        if (fatalReason != null) {
            log.warn("{}: {}", fileName, fatalReason);
        }
        log.debug("Parsed {} ({} divisions, {} syntax errors)", fileName, divisions.size(), errors.size());

        return ParseResult.builder()
                .fileName(fileName)
                .programId(programId)
                .divisions(divisions)
                .syntaxErrors(errors)
                .fatalReason(fatalReason)
                .build();
    }

    // ------------------------------------------------------------------ identification / environment

    private DivisionNode parseIdentification() {
        int start = in.mark();
        List<LstNode> children = divisionHeader();

        while (!in.isAtEnd() && !isDivisionHeader()) {
            int paragraphStart = in.mark();
            List<LstNode> paragraph = new ArrayList<>();
            String name;
            if (in.checkWord(IDENTIFICATION_PARAGRAPHS.toArray(new String[0])) && in.peek(1).is(TokenType.PERIOD)) {
                name = in.peek().upper();
                paragraph.add(Nodes.literal(in.advance()));
                paragraph.add(Nodes.literal(in.advance()));
            } else {
                name = StatementNode.UNPARSED;
                error(new ParseException(in.peek(), IDENTIFICATION_PARAGRAPHS.stream().sorted().toList()));
                paragraph.add(Nodes.literal(in.advance()));
            }

            if (name.equals("PROGRAM-ID") && (in.check(TokenType.WORD) || in.check(TokenType.STRING))) {
                programId = in.peek().getText().toUpperCase(Locale.ROOT);
            }
            while (!in.isAtEnd() && !isDivisionHeader() && !isIdentificationParagraph()) {
                paragraph.add(Nodes.literal(in.advance()));
            }

            List<LstNode> all = new ArrayList<>(in.takeComments(paragraphStart, in.mark()));
            all.addAll(paragraph);
            children.add(new ParagraphNode(name, false, Nodes.spanOf(all), all));
        }
        return division("IDENTIFICATION", start, children);
    }

    private boolean isIdentificationParagraph() {
        return in.checkWord(IDENTIFICATION_PARAGRAPHS.toArray(new String[0])) && in.peek(1).is(TokenType.PERIOD);
    }

    private DivisionNode parseEnvironment() {
        int start = in.mark();
        List<LstNode> children = divisionHeader();

        SectionBuilder section = null;
        while (!in.isAtEnd() && !isDivisionHeader()) {
            if (isSectionHeaderWord()) {
                if (section != null) children.add(section.build());
                section = new SectionBuilder(in.peek().upper(), sectionHeader());
                continue;
            }

            int paragraphStart = in.mark();
            List<LstNode> paragraph = new ArrayList<>();
            String name;
            if (in.checkWord(ENVIRONMENT_PARAGRAPHS.toArray(new String[0])) && in.peek(1).is(TokenType.PERIOD)) {
                name = in.peek().upper();
                paragraph.add(Nodes.literal(in.advance()));
                paragraph.add(Nodes.literal(in.advance()));
            } else {
                name = StatementNode.UNPARSED;
                error(new ParseException(in.peek(), ENVIRONMENT_PARAGRAPHS.stream().sorted().toList()));
                paragraph.add(Nodes.literal(in.advance()));
            }

            while (!in.isAtEnd() && !isDivisionHeader() && !isSectionHeaderWord() && !isEnvironmentParagraph()) {
                if (name.equals("FILE-CONTROL") && in.checkWord("SELECT")) {
                    paragraph.add(parseEntry(this::parseSelect));
                } else {
                    paragraph.add(Nodes.literal(in.advance()));
                }
            }

            List<LstNode> all = new ArrayList<>(in.takeComments(paragraphStart, in.mark()));
            all.addAll(paragraph);
            ParagraphNode node = new ParagraphNode(name, false, Nodes.spanOf(all), all);
            if (section != null) {
                section.add(node);
            } else {
                children.add(node);
            }
        }
        if (section != null) children.add(section.build());
        return division("ENVIRONMENT", start, children);
    }

    private boolean isEnvironmentParagraph() {
        return in.checkWord(ENVIRONMENT_PARAGRAPHS.toArray(new String[0])) && in.peek(1).is(TokenType.PERIOD);
    }

    /**
     * SELECT [OPTIONAL] file ASSIGN [TO] name [ORGANIZATION [IS] ...] [other clauses] .
     */
    private StatementNode parseSelect() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(Nodes.literal(in.expectWord("SELECT")));
        if (in.checkWord("OPTIONAL")) children.add(Nodes.literal(in.advance()));
        children.add(Nodes.clause(ClauseRole.NAME, List.of(Nodes.identifier(in.expectIdentifier("file name")))));

        while (!in.isAtEnd() && !in.check(TokenType.PERIOD)) {
            if (in.checkWord("ASSIGN")) {
                List<LstNode> assign = new ArrayList<>();
                assign.add(Nodes.literal(in.advance()));
                if (in.checkWord("TO")) assign.add(Nodes.literal(in.advance()));
                CobolToken target = in.advance();
                assign.add(Nodes.literal(target));
                children.add(Nodes.clause(ClauseRole.ASSIGN, target.getText(), assign));
            } else if (in.checkWord("ORGANIZATION")) {
                List<LstNode> organization = new ArrayList<>();
                organization.add(Nodes.literal(in.advance()));
                if (in.checkWord("IS")) organization.add(Nodes.literal(in.advance()));
                if (in.checkWord("LINE", "RECORD")) organization.add(Nodes.literal(in.advance()));
                CobolToken kind = in.expect(TokenType.WORD, "SEQUENTIAL, INDEXED or RELATIVE");
                organization.add(Nodes.literal(kind));
                children.add(Nodes.clause(ClauseRole.ORGANIZATION, kind.upper(), organization));
            } else if (in.checkWord("STATUS") || (in.checkWord("FILE") && in.checkWordAt(1, "STATUS"))) {
                List<LstNode> status = new ArrayList<>();
                if (in.checkWord("FILE")) status.add(Nodes.literal(in.advance()));
                status.add(Nodes.literal(in.advance()));
                if (in.checkWord("IS")) status.add(Nodes.literal(in.advance()));
                status.add(expressions.parseReference());
                children.add(Nodes.clause(ClauseRole.OPTIONS, "STATUS", status));
            } else {
                children.add(Nodes.literal(in.advance()));
            }
        }
        children.add(Nodes.literal(in.expect(TokenType.PERIOD, ".")));
        return finishEntry(StatementNode.SELECT, start, children);
    }

    // ------------------------------------------------------------------ data division

    private DivisionNode parseData() {
        int start = in.mark();
        List<LstNode> children = divisionHeader();

        SectionBuilder section = null;
        while (!in.isAtEnd() && !isDivisionHeader()) {
            if (isSectionHeaderWord()) {
                if (section != null) children.add(section.build());
                section = new SectionBuilder(in.peek().upper(), sectionHeader());
                continue;
            }

            StatementNode entry;
            if (in.checkWord("FD", "SD")) {
                entry = parseEntry(this::parseFileDescription);
            } else {
                entry = parseEntry(this::parseDataEntry);
            }
            if (section != null) {
                section.add(entry);
            } else {
                children.add(entry);
            }
        }
        if (section != null) children.add(section.build());
        return division("DATA", start, children);
    }

    private boolean isSectionHeaderWord() {
        return in.check(TokenType.WORD) && in.peek(1).isWord("SECTION") && in.peek(2).is(TokenType.PERIOD);
    }

    private StatementNode parseFileDescription() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        CobolToken kind = in.advance();
        children.add(Nodes.literal(kind));
        children.add(Nodes.clause(ClauseRole.NAME, List.of(Nodes.identifier(in.expectIdentifier("file name")))));
        while (!in.isAtEnd() && !in.check(TokenType.PERIOD)) {
            children.add(Nodes.literal(in.advance()));
        }
        children.add(Nodes.literal(in.expect(TokenType.PERIOD, ".")));
        return finishEntry(kind.upper().equals("SD") ? "SD" : StatementNode.FILE_DESCRIPTION, start, children);
    }

    /**
     * level [name | FILLER] [REDEFINES x] [PIC p] [USAGE u] [OCCURS ...] [VALUE v] ... .
     */
    private StatementNode parseDataEntry() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();

        CobolToken levelToken = in.expect(TokenType.NUMBER, "level number");
        int level;
        try {
            level = Integer.parseInt(levelToken.getText());
        } catch (NumberFormatException e) {
            throw new ParseException(levelToken, "level number");
        }
        children.add(Nodes.clause(ClauseRole.LEVEL, String.valueOf(level), List.of(Nodes.literal(levelToken))));

        String name = null;
        if (in.checkWord("FILLER")) {
            children.add(Nodes.clause(ClauseRole.NAME, "FILLER", List.of(Nodes.literal(in.advance()))));
        } else if (in.checkIdentifier()) {
            CobolToken nameToken = in.advance();
            name = nameToken.upper();
            children.add(Nodes.clause(ClauseRole.NAME, name, List.of(Nodes.identifier(nameToken))));
        }

        if (level == 88) {
            if (name == null) {
                throw new ParseException(in.peek(), "condition name");
            }
            conditionNames.add(name);
        }

        while (!in.isAtEnd() && !in.check(TokenType.PERIOD)) {
            if (in.checkWord("REDEFINES")) {
                LiteralNode kw = Nodes.literal(in.advance());
                children.add(Nodes.clause(ClauseRole.REDEFINES, List.of(kw, Nodes.identifier(in.expectIdentifier("data name")))));
            } else if (in.checkWord("RENAMES")) {
                List<LstNode> renames = new ArrayList<>();
                renames.add(Nodes.literal(in.advance()));
                renames.add(Nodes.identifier(in.expectIdentifier("data name")));
                if (in.checkWord("THRU", "THROUGH")) {
                    renames.add(Nodes.literal(in.advance()));
                    renames.add(Nodes.identifier(in.expectIdentifier("data name")));
                }
                children.add(Nodes.clause(ClauseRole.RENAMES, renames));
            } else if (in.checkWord("PIC", "PICTURE")) {
                List<LstNode> picture = new ArrayList<>();
                picture.add(Nodes.literal(in.advance()));
                if (in.checkWord("IS")) picture.add(Nodes.literal(in.advance()));
                CobolToken pic = in.expect(TokenType.PICTURE_STRING, "picture string");
                picture.add(Nodes.literal(pic));
                children.add(Nodes.clause(ClauseRole.PICTURE, pic.getText().toUpperCase(Locale.ROOT), picture));
            } else if (in.checkWord("USAGE") || in.checkWord(USAGE_WORDS.toArray(new String[0]))) {
                List<LstNode> usage = new ArrayList<>();
                if (in.checkWord("USAGE")) usage.add(Nodes.literal(in.advance()));
                if (in.checkWord("IS")) usage.add(Nodes.literal(in.advance()));
                if (!in.checkWord(USAGE_WORDS.toArray(new String[0]))) {
                    throw new ParseException(in.peek(), "usage");
                }
                CobolToken word = in.advance();
                usage.add(Nodes.literal(word));
                children.add(Nodes.clause(ClauseRole.USAGE, word.upper(), usage));
            } else if (in.checkWord("OCCURS")) {
                children.add(parseOccurs());
            } else if (in.checkWord("VALUE", "VALUES")) {
                children.add(parseValueClause());
            } else if (in.checkWord("SIGN", "LEADING", "TRAILING", "SEPARATE", "CHARACTER", "SYNC", "SYNCHRONIZED",
                    "JUST", "JUSTIFIED", "RIGHT", "LEFT", "BLANK", "WHEN", "ZERO", "EXTERNAL", "GLOBAL", "IS")) {
                CobolToken option = in.advance();
                children.add(Nodes.clause(ClauseRole.OPTIONS, option.upper(), List.of(Nodes.literal(option))));
            } else {
                throw new ParseException(in.peek(), "data description clause");
            }
        }

        children.add(Nodes.literal(in.expect(TokenType.PERIOD, ".")));
        return finishEntry(StatementNode.DATA_DESCRIPTION, start, children);
    }

    /**
     * OCCURS n [TO m] [TIMES] [DEPENDING [ON] x] [ASCENDING|DESCENDING [KEY] [IS] k...] [INDEXED [BY] i...]
     */
    private LstNode parseOccurs() {
        List<LstNode> occurs = new ArrayList<>();
        occurs.add(Nodes.literal(in.advance()));
        occurs.add(Nodes.literal(in.expect(TokenType.NUMBER, "occurrence count")));
        if (in.checkWord("TO")) {
            occurs.add(Nodes.literal(in.advance()));
            occurs.add(Nodes.literal(in.expect(TokenType.NUMBER, "maximum occurrence count")));
        }
        if (in.checkWord("TIMES")) occurs.add(Nodes.literal(in.advance()));
        if (in.checkWord("DEPENDING")) {
            List<LstNode> depending = new ArrayList<>();
            depending.add(Nodes.literal(in.advance()));
            if (in.checkWord("ON")) depending.add(Nodes.literal(in.advance()));
            depending.add(expressions.parseReference());
            occurs.add(Nodes.clause(ClauseRole.DEPENDING_ON, depending));
        }
        while (in.checkWord("ASCENDING", "DESCENDING")) {
            List<LstNode> key = new ArrayList<>();
            key.add(Nodes.literal(in.advance()));
            if (in.checkWord("KEY")) key.add(Nodes.literal(in.advance()));
            if (in.checkWord("IS")) key.add(Nodes.literal(in.advance()));
            do {
                key.add(Nodes.identifier(in.expectIdentifier("key name")));
            } while (in.checkIdentifier());
            occurs.add(Nodes.clause(ClauseRole.OPTIONS, "KEY", key));
        }
        if (in.checkWord("INDEXED")) {
            List<LstNode> indexed = new ArrayList<>();
            indexed.add(Nodes.literal(in.advance()));
            if (in.checkWord("BY")) indexed.add(Nodes.literal(in.advance()));
            do {
                indexed.add(Nodes.identifier(in.expectIdentifier("index name")));
            } while (in.checkIdentifier());
            occurs.add(Nodes.clause(ClauseRole.OPTIONS, "INDEXED", indexed));
        }
        return Nodes.clause(ClauseRole.OCCURS, occurs);
    }

    /**
     * VALUE[S] [IS|ARE] v [THRU v] ...
     */
    private LstNode parseValueClause() {
        List<LstNode> value = new ArrayList<>();
        value.add(Nodes.literal(in.advance()));
        if (in.checkWord("IS", "ARE")) value.add(Nodes.literal(in.advance()));
        do {
            LstNode first = expressions.parseOperand();
            if (in.checkWord("THRU", "THROUGH")) {
                LiteralNode thru = Nodes.literal(in.advance());
                value.add(Nodes.clause(ClauseRole.RANGE, List.of(first, thru, expressions.parseOperand())));
            } else {
                value.add(Nodes.clause(ClauseRole.VALUE, List.of(first)));
            }
        } while (expressions.startsOperand());
        return Nodes.clause(ClauseRole.VALUE, value);
    }

    // ------------------------------------------------------------------ procedure division

    private DivisionNode parseProcedure() {
        int start = in.mark();
        List<LstNode> children = new ArrayList<>();
        children.add(Nodes.literal(in.advance()));
        children.add(Nodes.literal(in.expectWord("DIVISION")));
        if (in.checkWord("USING")) {
            List<LstNode> using = new ArrayList<>();
            using.add(Nodes.literal(in.advance()));
            while (in.checkIdentifier() || in.checkWord("BY", "REFERENCE", "VALUE")) {
                using.add(in.checkIdentifier() ? expressions.parseReference() : Nodes.literal(in.advance()));
            }
            children.add(Nodes.clause(ClauseRole.USING, using));
        }
        children.add(Nodes.literal(in.expect(TokenType.PERIOD, ".")));
        List<LstNode> header = new ArrayList<>(in.takeComments(start, in.mark()));
        header.addAll(children);
        children = header;

        if (in.checkWord("DECLARATIVES")) {
            error(new ParseException(in.peek(), "paragraph (DECLARATIVES are not supported)"));
            List<LstNode> skipped = new ArrayList<>();
            while (!in.isAtEnd() && !(in.checkWord("END") && in.checkWordAt(1, "DECLARATIVES"))) {
                skipped.add(Nodes.literal(in.advance()));
            }
            for (int i = 0; i < 3 && !in.isAtEnd(); i++) {
                skipped.add(Nodes.literal(in.advance()));
            }
            children.add(Nodes.statement(StatementNode.UNPARSED, skipped));
        }

        SectionBuilder section = null;
        while (!in.isAtEnd() && !isDivisionHeader()) {
            if (isEndProgram()) {
                int endStart = in.mark();
                List<LstNode> end = new ArrayList<>();
                while (!in.isAtEnd() && !in.check(TokenType.PERIOD)) {
                    end.add(Nodes.literal(in.advance()));
                }
                if (in.check(TokenType.PERIOD)) end.add(Nodes.literal(in.advance()));
                if (section != null) {
                    children.add(section.build());
                    section = null;
                }
                children.add(finishEntry("END-PROGRAM", endStart, end));
                break;
            }

            if (isSectionHeader()) {
                if (section != null) children.add(section.build());
                int headerStart = in.mark();
                CobolToken name = in.peek();
                List<LstNode> header2 = new ArrayList<>();
                header2.add(Nodes.identifier(in.advance()));
                header2.add(Nodes.literal(in.advance()));
                if (in.check(TokenType.NUMBER)) header2.add(Nodes.literal(in.advance()));
                header2.add(Nodes.literal(in.advance()));
                List<LstNode> withComments = new ArrayList<>(in.takeComments(headerStart, in.mark()));
                withComments.addAll(header2);
                section = new SectionBuilder(name.upper(), withComments);
                currentParagraph = name.upper();
                parseSentences(section.children);
                continue;
            }

            ParagraphNode paragraph = isParagraphHeader() ? parseParagraph() : parseImplicitParagraph();
            if (section != null) {
                section.add(paragraph);
            } else {
                children.add(paragraph);
            }
        }
        if (section != null) children.add(section.build());

        return new DivisionNode("PROCEDURE", Nodes.spanOf(children), children);
    }

    private ParagraphNode parseParagraph() {
        int start = in.mark();
        CobolToken name = in.advance();
        CobolToken period = in.advance();
        currentParagraph = name.upper();

        List<LstNode> children = new ArrayList<>(in.takeComments(start, in.mark()));
        children.add(Nodes.identifier(name));
        children.add(Nodes.literal(period));
        parseSentences(children);

        log.debug("Parsed paragraph {} at line {}", name.upper(), name.getLine());
        return new ParagraphNode(name.upper(), false, Nodes.spanOf(children), children);
    }

    private ParagraphNode parseImplicitParagraph() {
        currentParagraph = null;
        List<LstNode> children = new ArrayList<>();
        parseSentences(children);
        return new ParagraphNode("ENTRY-PARAGRAPH", true, Nodes.spanOf(children), children);
    }

    /**
     * Sentences up to the next header. A syntax error abandons the rest of the paragraph.
     */
    private void parseSentences(List<LstNode> into) {
        while (!isProcedureBoundary()) {
            int start = in.mark();
            try {
                into.add(parseSentence());
            } catch (ParseException e) {
                error(e);
                in.reset(start);
                List<LstNode> skipped = new ArrayList<>();
                do {
                    skipped.add(Nodes.literal(in.advance()));
                } while (!isProcedureBoundary());
                List<LstNode> all = new ArrayList<>(in.takeComments(start, in.mark()));
                all.addAll(skipped);
                into.add(Nodes.statement(StatementNode.UNPARSED, all));
                log.debug("Abandoned rest of paragraph {} after syntax error at line {}",
                        currentParagraph, e.getFound().getLine());
                return;
            }
        }
    }

    private SentenceNode parseSentence() {
        int start = in.mark();
        List<StatementNode> body = statements.parseStatements();
        CobolToken period = in.expect(TokenType.PERIOD, ".");
        List<LstNode> children = new ArrayList<>(in.takeComments(start, in.mark()));
        children.addAll(body);
        children.add(Nodes.literal(period));
        return new SentenceNode(Nodes.spanOf(children), children);
    }

    private boolean isProcedureBoundary() {
        if (in.isAtEnd() || isDivisionHeader() || isEndProgram()) {
            return true;
        }
        return in.previous().is(TokenType.PERIOD) && (isSectionHeader() || isParagraphHeader());
    }

    private boolean isSectionHeader() {
        CobolToken name = in.peek();
        if (!isProcedureName(name) || !in.peek(1).isWord("SECTION")) {
            return false;
        }
        return in.peek(2).is(TokenType.PERIOD) || (in.peek(2).is(TokenType.NUMBER) && in.peek(3).is(TokenType.PERIOD));
    }

    private boolean isParagraphHeader() {
        return isProcedureName(in.peek()) && in.peek(1).is(TokenType.PERIOD);
    }

    private static boolean isProcedureName(CobolToken token) {
        return TokenStream.isIdentifier(token) || (token.is(TokenType.NUMBER) && token.getText().chars().allMatch(Character::isDigit));
    }

    private boolean isEndProgram() {
        return in.checkWord("END") && in.checkWordAt(1, "PROGRAM");
    }

    private boolean isDivisionHeader() {
        return in.checkWord(DIVISIONS.toArray(new String[0])) && in.peek(1).isWord("DIVISION");
    }

    // ------------------------------------------------------------------ helpers

    private List<LstNode> divisionHeader() {
        List<LstNode> children = new ArrayList<>();
        children.add(Nodes.literal(in.advance()));
        children.add(Nodes.literal(in.advance()));
        children.add(Nodes.literal(in.expect(TokenType.PERIOD, ".")));
        return children;
    }

    private List<LstNode> sectionHeader() {
        int start = in.mark();
        List<LstNode> header = new ArrayList<>();
        header.add(Nodes.literal(in.advance()));
        header.add(Nodes.literal(in.advance()));
        header.add(Nodes.literal(in.advance()));
        List<LstNode> all = new ArrayList<>(in.takeComments(start, in.mark()));
        all.addAll(header);
        return all;
    }

    private DivisionNode division(String name, int start, List<LstNode> children) {
        List<LstNode> all = new ArrayList<>(in.takeComments(start, start + 1));
        all.addAll(children);
        return new DivisionNode(name, Nodes.spanOf(all), all);
    }

    private interface EntryParser {
        StatementNode parse();
    }

    /**
     * Runs a data / file entry parser; on a syntax error the entry's tokens up to the period are kept
     * in an UNPARSED statement.
     */
    private StatementNode parseEntry(EntryParser parser) {
        int start = in.mark();
        try {
            return parser.parse();
        } catch (ParseException e) {
            error(e);
            in.reset(start);
            List<LstNode> skipped = new ArrayList<>();
            while (!in.isAtEnd() && !in.check(TokenType.PERIOD) && !isDivisionHeader()
                    && !(in.mark() > start && isSectionHeaderWord())) {
                skipped.add(Nodes.literal(in.advance()));
            }
            if (in.check(TokenType.PERIOD)) skipped.add(Nodes.literal(in.advance()));
            if (skipped.isEmpty()) {
                skipped.add(Nodes.literal(in.advance()));
            }
            return finishEntry(StatementNode.UNPARSED, start, skipped);
        }
    }

    private StatementNode finishEntry(String verb, int start, List<LstNode> children) {
        List<LstNode> all = new ArrayList<>(in.takeComments(start, in.mark()));
        all.addAll(children);
        return Nodes.statement(verb, all);
    }

    private void error(ParseException e) {
        CobolToken found = e.getFound();
        String text = found.is(TokenType.EOF) ? "end of file" : found.getText();
        SyntaxError error = new SyntaxError(found.getFileName().isEmpty() ? fileName : found.getFileName(),
                found.getLine(), found.getColumn(), e.getExpected(), text, currentParagraph);
        errors.add(error);
        log.warn("Syntax error: {}", error.getMessage());
    }

    private static final class SectionBuilder {
        private final String name;
        private final List<LstNode> children;

        SectionBuilder(String name, List<LstNode> header) {
            this.name = name;
            this.children = new ArrayList<>(header);
        }

        void add(LstNode node) {
            children.add(node);
        }

        SectionNode build() {
            return new SectionNode(name, Nodes.spanOf(children), children);
        }
    }
}

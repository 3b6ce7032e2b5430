package com.mainframe.transpiler.lst;

import java.util.List;

import lombok.Getter;

/**
 * A statement or a data / file description entry, identified by its verb.
 */
@Getter
public class StatementNode extends LstNode {
    public static final String DATA_DESCRIPTION = "DATA-DESCRIPTION";
    public static final String FILE_DESCRIPTION = "FD";
    public static final String SELECT = "SELECT";
    public static final String UNKNOWN = "UNKNOWN";
    public static final String UNPARSED = "UNPARSED";

    private final String verb;

    public StatementNode(String verb, SourceSpan span, List<? extends LstNode> children) {
        super(LstKind.STATEMENT, span, children);
        this.verb = verb;
    }

    public boolean isVerb(String name) {
        return verb.equals(name);
    }

    /**
     * Statements nested in the given clause (a THEN branch, a loop body, an AT END block).
     */
    public List<StatementNode> body(ClauseRole role) {
        return clause(role).map(c -> c.childrenOfType(StatementNode.class)).orElse(List.of());
    }

    /**
     * First keyword or identifier after the verb, upper-cased; the "word" of GO TO, STOP RUN, EXIT PROGRAM.
     */
    public String firstWordAfterVerb() {
        List<LiteralNode> tokens = tokens();
        return tokens.size() > 1 ? tokens.get(1).getToken().upper() : "";
    }

    @Override
    public <R> R accept(LstVisitor<R> visitor) {
        return visitor.visitStatement(this);
    }

    @Override
    public String toString() {
        return verb + "@" + getSpan();
    }
}

package com.mainframe.transpiler.lexer;

import java.util.Locale;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Read-only table of the COBOL words the parser treats specially. Shared by every program.
 */
@UtilityClass
public class ReservedWords {

    /** Statement verbs the parser lowers. */
    public static final Set<String> SUPPORTED_VERBS = Set.of(
            "MOVE", "ADD", "SUBTRACT", "MULTIPLY", "DIVIDE", "COMPUTE",
            "IF", "EVALUATE", "PERFORM", "GO", "DISPLAY", "ACCEPT",
            "OPEN", "CLOSE", "READ", "WRITE", "STOP", "GOBACK", "EXIT",
            "CONTINUE", "INITIALIZE", "SET", "CALL"
    );

    /** Verbs recognized only to be reported as edge cases. */
    public static final Set<String> EDGE_CASE_VERBS = Set.of(
            "ALTER", "SORT", "MERGE", "EXEC"
    );

    /** Verbs that start a statement but are outside the supported set. */
    public static final Set<String> OTHER_VERBS = Set.of(
            "STRING", "UNSTRING", "INSPECT", "SEARCH", "REWRITE", "DELETE", "START",
            "RELEASE", "RETURN", "CANCEL", "ENTRY", "GENERATE", "INITIATE", "TERMINATE",
            "SUPPRESS", "USE", "INVOKE", "ALLOCATE", "FREE", "RAISE", "RESUME", "XML", "JSON", "TRANSFORM",
            "EXAMINE", "NOTE", "READY", "RESET", "COMMIT", "ROLLBACK"
    );

    public static final Set<String> SCOPE_TERMINATORS = Set.of(
            "END-IF", "END-PERFORM", "END-READ", "END-EVALUATE", "END-COMPUTE", "END-ADD",
            "END-SUBTRACT", "END-MULTIPLY", "END-DIVIDE", "END-WRITE", "END-SEARCH", "END-EXEC",
            "END-CALL", "END-STRING", "END-UNSTRING", "END-RETURN", "END-REWRITE", "END-DELETE",
            "END-START", "END-ACCEPT", "END-DISPLAY"
    );

    public static final Set<String> FIGURATIVES = Set.of(
            "ZERO", "ZEROS", "ZEROES", "SPACE", "SPACES", "HIGH-VALUE", "HIGH-VALUES",
            "LOW-VALUE", "LOW-VALUES", "QUOTE", "QUOTES", "NULL", "NULLS"
    );

    /** Other reserved words that can never be user-defined names. */
    private static final Set<String> KEYWORDS = Set.of(
            "ACCESS", "ADVANCING", "AFTER", "ALL", "ALPHABETIC", "ALPHABETIC-LOWER", "ALPHABETIC-UPPER",
            "ALSO", "AND", "ARE", "ASSIGN", "AT", "BEFORE", "BINARY", "BLANK", "BY", "CHARACTERS",
            "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5", "COMPUTATIONAL",
            "COMPUTATIONAL-1", "COMPUTATIONAL-2", "COMPUTATIONAL-3", "COMPUTATIONAL-4",
            "COMPUTATIONAL-5", "CONFIGURATION", "CORR", "CORRESPONDING", "DATA", "DECLARATIVES",
            "DEPENDING", "DIVISION", "DOWN", "ELSE", "END", "END-OF-PAGE", "ENVIRONMENT", "EOP",
            "EQUAL", "ERROR", "EXTEND", "FALSE", "FD", "FILE", "FILE-CONTROL", "FILLER", "FROM",
            "GIVING", "GLOBAL", "GREATER", "I-O", "I-O-CONTROL", "IDENTIFICATION", "ID", "IN",
            "INDEXED", "INPUT", "INPUT-OUTPUT", "INTO", "INVALID", "IS", "JUST", "JUSTIFIED",
            "KEY", "LABEL", "LEADING", "LESS", "LINE", "LINES", "LINKAGE", "LOCAL-STORAGE",
            "MODE", "NEGATIVE", "NO", "NOT", "NUMERIC", "OCCURS", "OF", "OFF", "OMITTED", "ON",
            "OR", "ORGANIZATION", "OTHER", "OUTPUT", "PACKED-DECIMAL", "PAGE", "PIC", "PICTURE",
            "POSITIVE", "PROCEDURE", "PROCEED", "PROGRAM", "PROGRAM-ID", "RECORD", "RECORDS",
            "REDEFINES", "REFERENCE", "RELATIVE", "REMAINDER", "RENAMES", "REPLACING", "ROUNDED",
            "RUN", "SECTION", "SELECT", "SENTENCE", "SEPARATE", "SEQUENTIAL", "SIGN", "SIZE",
            "STANDARD", "STATUS", "SYNC", "SYNCHRONIZED", "TALLYING", "TEST", "THAN", "THEN",
            "THROUGH", "THRU", "TIMES", "TO", "TRAILING", "TRUE", "UNTIL", "UP", "UPON", "USAGE",
            "USING", "VALUE", "VALUES", "VARYING", "WHEN", "WITH", "WORKING-STORAGE", "ZERO"
    );

    public static boolean isVerb(String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        return SUPPORTED_VERBS.contains(upper) || EDGE_CASE_VERBS.contains(upper) || OTHER_VERBS.contains(upper);
    }

    public static boolean isSupportedVerb(String word) {
        return SUPPORTED_VERBS.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isScopeTerminator(String word) {
        return SCOPE_TERMINATORS.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isFigurative(String word) {
        return FIGURATIVES.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isReserved(String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        return KEYWORDS.contains(upper)
                || FIGURATIVES.contains(upper)
                || SCOPE_TERMINATORS.contains(upper)
                || isVerb(upper);
    }
}

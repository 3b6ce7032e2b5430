package com.mainframe.transpiler.lst;

/**
 * Role of a clause within its statement or expression.
 */
public enum ClauseRole {
    // Data references and values
    REFERENCE,
    QUALIFIER,
    SUBSCRIPT,
    SOURCES,
    TARGETS,
    TARGET,
    GIVING,
    REMAINDER,
    OPERAND,
    VALUE,
    FROM,
    BY,
    INTO,
    UPON,

    // Expressions
    EXPRESSION,
    CONDITION,
    RELATION,
    AND,
    OR,
    NOT,
    CLASS_CONDITION,
    CONDITION_NAME,
    BINARY,
    NEGATE,

    // Bodies and branches
    THEN,
    ELSE,
    BODY,
    WHEN,
    WHEN_OTHER,
    SUBJECT,
    RANGE,
    AT_END,
    NOT_AT_END,
    ON_SIZE_ERROR,
    NOT_ON_SIZE_ERROR,

    // PERFORM
    PROCEDURE,
    THRU,
    TIMES,
    UNTIL,
    VARYING,
    TEST_AFTER,

    // GO TO / CALL / misc
    DEPENDING_ON,
    USING,
    ALTER_TARGET,
    ABBREVIATED_RELATION,
    OPEN_MODE,
    FILE,
    ADVANCING,
    ROUNDED,
    OPTIONS,

    // Data description
    LEVEL,
    NAME,
    PICTURE,
    USAGE,
    OCCURS,
    REDEFINES,
    RENAMES,
    ASSIGN,
    ORGANIZATION,
    UNPARSED
}

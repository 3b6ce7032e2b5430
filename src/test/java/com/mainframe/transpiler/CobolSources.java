package com.mainframe.transpiler;

import java.util.stream.Collectors;

/**
 * Sample programs shared by the tests. Text blocks are written with area A at indentation 0 and
 * area B at 4; {@link #fixed} shifts them into fixed reference format.
 */
public final class CobolSources {

    private CobolSources() {
    }

    /**
     * Prefixes every line with the sequence and indicator areas. A line starting with '*' becomes
     * a comment line.
     */
    public static String fixed(String text) {
        return text.lines()
                .map(line -> {
                    if (line.isEmpty()) {
                        return "";
                    }
                    if (line.startsWith("*")) {
                        return "      " + line;
                    }
                    return "       " + line;
                })
                .collect(Collectors.joining("\n", "", "\n"));
    }

    public static final String CHOICE = fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. CHOOSER.
            DATA DIVISION.
            WORKING-STORAGE SECTION.
            01 WS-VARS.
                05 CHOICE PIC 9 VALUE 1.
                05 RESULT-VAR PIC X(10).
            PROCEDURE DIVISION.
            MAIN-PARA.
                IF CHOICE = 1
                    MOVE 'ONE' TO RESULT-VAR
                ELSE
                    MOVE 'OTHER' TO RESULT-VAR
                END-IF.
                DISPLAY 'CHOICE IS ' RESULT-VAR.
                STOP RUN.
            """);

    public static final String PERFORM_UNTIL = fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. COUNTING.
            DATA DIVISION.
            WORKING-STORAGE SECTION.
            01 WS-VARS.
                05 COUNTER PIC 9(3) VALUE 0.
                05 MORE-DATA PIC X(3) VALUE 'YES'.
            PROCEDURE DIVISION.
            100-MAIN.
                PERFORM 200-STEP UNTIL MORE-DATA = 'NO'.
                DISPLAY 'COUNTER ' COUNTER.
                STOP RUN.
            200-STEP.
                ADD 1 TO COUNTER.
                IF COUNTER > 5
                    MOVE 'NO' TO MORE-DATA
                END-IF.
            """);

    public static final String FILE_COPY = fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. FILECOPY.
            ENVIRONMENT DIVISION.
            INPUT-OUTPUT SECTION.
            FILE-CONTROL.
                SELECT IN-FILE ASSIGN TO 'INPUT.DAT'
                    ORGANIZATION IS LINE SEQUENTIAL.
                SELECT OUT-FILE ASSIGN TO 'OUTPUT.DAT'
                    ORGANIZATION IS LINE SEQUENTIAL.
            DATA DIVISION.
            FILE SECTION.
            FD IN-FILE.
            01 IN-RECORD PIC X(20).
            FD OUT-FILE.
            01 OUT-RECORD PIC X(20).
            WORKING-STORAGE SECTION.
            01 WS-VARS.
                05 EOF-FLAG PIC X VALUE 'N'.
                05 LINE-COUNT PIC 9 VALUE 0.
            PROCEDURE DIVISION.
            MAIN-PARA.
                OPEN INPUT IN-FILE OUTPUT OUT-FILE.
                PERFORM UNTIL EOF-FLAG = 'Y'
                    READ IN-FILE
                        AT END
                            MOVE 'Y' TO EOF-FLAG
                        NOT AT END
                            MOVE IN-RECORD TO OUT-RECORD
                            WRITE OUT-RECORD
                            ADD 1 TO LINE-COUNT
                    END-READ
                END-PERFORM.
                CLOSE IN-FILE OUT-FILE.
                DISPLAY 'LINE-COUNT = ' LINE-COUNT.
                STOP RUN.
            """);

    /** ALTER is blocking, EXEC needs augmentation and CALL is informational. */
    public static final String EDGE_CASES = fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. EDGES.
            DATA DIVISION.
            WORKING-STORAGE SECTION.
            01 WS-VARS.
                05 WS-CODE PIC X(4) VALUE SPACES.
            PROCEDURE DIVISION.
            100-MAIN.
                CALL 'SUBPROG'.
                EXEC CICS RETURN END-EXEC.
                ALTER 200-SWITCH TO PROCEED TO 300-DONE.
                GO TO 200-SWITCH.
            200-SWITCH.
                GO TO 300-DONE.
            300-DONE.
                STOP RUN.
            """);

    /** 200-A and 300-B form a GO TO loop entered at both paragraphs. */
    public static final String IRREDUCIBLE = fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. TANGLE.
            DATA DIVISION.
            WORKING-STORAGE SECTION.
            01 WS-VARS.
                05 N PIC 9(2) VALUE 0.
            PROCEDURE DIVISION.
            100-MAIN.
                IF N > 0
                    GO TO 300-B
                END-IF.
            200-A.
                ADD 1 TO N.
                IF N < 5
                    GO TO 300-B
                END-IF.
                STOP RUN.
            300-B.
                ADD 1 TO N.
                GO TO 200-A.
            """);

    /** Only an external call: translates fully with an informational edge case. */
    public static final String CALLER = fixed("""
            IDENTIFICATION DIVISION.
            PROGRAM-ID. CALLER.
            PROCEDURE DIVISION.
            MAIN-PARA.
                DISPLAY 'BEFORE'.
                CALL 'AUDITLOG'.
                DISPLAY 'AFTER'.
                STOP RUN.
            """);
}

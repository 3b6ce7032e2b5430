package com.mainframe.transpiler.symbol;

import java.util.Locale;

/**
 * COBOL USAGE clause types. Usage selects the storage representation only.
 */
public enum Usage {
    /**
     * Default display format (character or zoned decimal).
     */
    DISPLAY,

    /**
     * Binary format (COMP, COMP-4 or BINARY).
     */
    BINARY,

    /**
     * Packed decimal format (COMP-3).
     */
    PACKED_DECIMAL,

    /**
     * Native binary (COMP-5).
     */
    COMP_5,

    /**
     * Floating point single precision (COMP-1).
     */
    COMP_1,

    /**
     * Floating point double precision (COMP-2).
     */
    COMP_2,

    INDEX,
    POINTER;

    public static Usage fromCobol(String usage) {
        if (usage == null) {
            return DISPLAY;
        }
        String normalized = usage.toUpperCase(Locale.ROOT).trim();
        switch (normalized) {
            case "COMP":
            case "COMP-4":
            case "BINARY":
            case "COMPUTATIONAL":
            case "COMPUTATIONAL-4":
                return BINARY;
            case "COMP-3":
            case "COMPUTATIONAL-3":
            case "PACKED-DECIMAL":
                return PACKED_DECIMAL;
            case "COMP-5":
            case "COMPUTATIONAL-5":
                return COMP_5;
            case "COMP-1":
            case "COMPUTATIONAL-1":
                return COMP_1;
            case "COMP-2":
            case "COMPUTATIONAL-2":
                return COMP_2;
            case "INDEX":
                return INDEX;
            case "POINTER":
                return POINTER;
            default:
                return DISPLAY;
        }
    }

    /**
     * True for usages that carry no PICTURE clause.
     */
    public boolean isImplicitlyTyped() {
        return this == COMP_1 || this == COMP_2 || this == INDEX || this == POINTER;
    }
}

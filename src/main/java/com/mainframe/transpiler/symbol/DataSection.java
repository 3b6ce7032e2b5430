package com.mainframe.transpiler.symbol;

import java.util.Locale;

public enum DataSection {
    FILE,
    WORKING_STORAGE,
    LOCAL_STORAGE,
    LINKAGE;

    /**
     * Section for a DATA DIVISION section header word such as {@code WORKING-STORAGE}.
     */
    public static DataSection fromHeader(String header) {
        String normalized = header.toUpperCase(Locale.ROOT).replace('-', '_');
        for (DataSection section : values()) {
            if (section.name().equals(normalized)) {
                return section;
            }
        }
        return WORKING_STORAGE;
    }
}

package com.mainframe.transpiler.naming;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Utility for type and unit names of generated code.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts COBOL-NAME or cobol_name to PascalCase; a leading digit gets a letter prefix.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isBlank()) {
            return "Type";
        }
        String pascal = Arrays.stream(name.trim().split("[-_\\s.]+"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""))
                .replaceAll("[^A-Za-z0-9]", "");
        if (pascal.isEmpty()) {
            return "Type";
        }
        if (Character.isDigit(pascal.charAt(0))) {
            pascal = NameKind.TYPE.getDigitPrefix() + pascal;
        }
        return pascal;
    }

    /**
     * Unit name of a program: the PROGRAM-ID, else the file name without directory and extension.
     */
    public static String unitName(String programId, String fileName) {
        String base = programId;
        if (base == null || base.isBlank()) {
            base = fileName == null ? "Program" : fileName;
            base = base.substring(Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\')) + 1);
            int dot = base.lastIndexOf('.');
            if (dot > 0) {
                base = base.substring(0, dot);
            }
        }
        String pascal = toPascalCase(base);
        return IdentifierSanitizer.isReserved(pascal.toLowerCase(Locale.ROOT)) ? pascal + "Program" : pascal;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1).toLowerCase(Locale.ROOT);
    }
}

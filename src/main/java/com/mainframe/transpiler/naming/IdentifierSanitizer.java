package com.mainframe.transpiler.naming;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Turns COBOL names into identifiers that are legal in every target language.
 *
 * Rules, applied in order: lower-case; hyphens become underscores; other characters outside
 * {@code [a-z0-9_]} become underscores; a leading digit gets the kind's prefix; a reserved word of
 * any target (or a runtime helper name) gets a trailing underscore. Collisions left after that are
 * settled by {@link NameScope}.
 */
@UtilityClass
public class IdentifierSanitizer {

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "record", "yield", "sealed", "permits"
    );

    private static final Set<String> PYTHON_KEYWORDS = Set.of(
            "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif",
            "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda",
            "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield",
            "none", "true", "false", "self", "print", "len", "range", "str", "int", "list", "dict", "type",
            "object", "decimal", "dataclass", "field"
    );

    /** Names of members the generated runtime defines itself. */
    private static final Set<String> RUNTIME_NAMES = Set.of(
            "main", "run", "image", "load", "alnum", "num", "fits", "store", "div", "display_num",
            "zoned", "unzoned", "idx", "cmp_alnum", "streams", "out", "jump", "cur", "stop_run",
            "record_streams", "record_stream", "in_memory_streams", "edit", "pow", "initialize", "stopped",
            "stream", "accept", "external", "warn", "self", "cls"
    );

    private static final Set<String> RESERVED;

    static {
        Set<String> all = new HashSet<>(JAVA_KEYWORDS);
        all.addAll(PYTHON_KEYWORDS);
        all.addAll(RUNTIME_NAMES);
        RESERVED = Set.copyOf(all);
    }

    public static String sanitize(String cobolName, NameKind kind) {
        if (cobolName == null || cobolName.isBlank()) {
            return kind == NameKind.PARAGRAPH ? "p_unnamed" : "f_unnamed";
        }

        String lower = cobolName.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        StringBuilder sb = new StringBuilder(lower.length());
        for (char c : lower.toCharArray()) {
            sb.append((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' ? c : '_');
        }

        String result = sb.toString();
        if (Character.isDigit(result.charAt(0))) {
            result = kind.getDigitPrefix() + result;
        }
        if (isReserved(result)) {
            result = result + "_";
        }
        return result;
    }

    public static boolean isReserved(String identifier) {
        return RESERVED.contains(identifier.toLowerCase(Locale.ROOT));
    }
}

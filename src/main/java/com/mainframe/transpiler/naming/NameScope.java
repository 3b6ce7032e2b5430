package com.mainframe.transpiler.naming;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out unique identifiers within one namespace. Deterministic: the same sequence of requests
 * always yields the same names.
 */
public class NameScope {
    private final Set<String> used = new HashSet<>();

    public String claim(String candidate) {
        if (used.add(candidate)) {
            return candidate;
        }
        // Numeric suffix as last resort
        int suffix = 2;
        String next;
        do {
            next = candidate + "_" + suffix;
            suffix++;
        } while (used.contains(next));
        used.add(next);
        return next;
    }

    public String claim(String cobolName, NameKind kind) {
        return claim(IdentifierSanitizer.sanitize(cobolName, kind));
    }

    public boolean isUsed(String identifier) {
        return used.contains(identifier);
    }

    public void reserve(String identifier) {
        used.add(identifier);
    }
}

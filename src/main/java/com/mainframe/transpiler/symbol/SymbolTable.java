package com.mainframe.transpiler.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.naming.NameScope;

import lombok.Getter;

/**
 * Typed record hierarchy of one program. Immutable once built; owned by the program's context.
 */
public class SymbolTable {
    @Getter
    private final List<DataItem> records;

    @Getter
    private final List<DataItem> items;

    private final Map<String, FileDefinition> files;
    private final Map<String, List<DataItem>> byName;
    private final Set<DataItem> blockedRecords;

    @Getter
    private final List<SemanticError> errors;

    /** Identifier namespace of the program; later stages claim paragraph names from it. */
    @Getter
    private final NameScope names;

    SymbolTable(List<DataItem> records, List<DataItem> items, Map<String, FileDefinition> files,
                Map<String, List<DataItem>> byName, Set<DataItem> blockedRecords,
                List<SemanticError> errors, NameScope names) {
        this.records = Collections.unmodifiableList(records);
        this.items = Collections.unmodifiableList(items);
        this.files = Collections.unmodifiableMap(files);
        this.byName = byName;
        this.blockedRecords = blockedRecords;
        this.errors = Collections.unmodifiableList(errors);
        this.names = names;
    }

    /**
     * Looks up {@code name [OF q1 [OF q2 ...]]}. Qualifiers name ancestors from the innermost
     * outwards; the outermost may also be the file a record belongs to.
     */
    public Resolution resolve(String name, List<String> qualifiers) {
        List<DataItem> candidates = byName.getOrDefault(name.toUpperCase(Locale.ROOT), List.of());
        List<DataItem> matches = new ArrayList<>();
        for (DataItem candidate : candidates) {
            if (matchesQualifiers(candidate, qualifiers)) {
                matches.add(candidate);
            }
        }
        return Resolution.of(matches);
    }

    public Resolution resolve(String name) {
        return resolve(name, List.of());
    }

    /**
     * Resolves a REFERENCE clause of the tree.
     */
    public Resolution resolve(ClauseNode reference) {
        String name = SymbolTableBuilder.referenceName(reference).orElse("");
        return resolve(name, SymbolTableBuilder.qualifiers(reference));
    }

    private static boolean matchesQualifiers(DataItem candidate, List<String> qualifiers) {
        DataItem current = candidate.getParent();
        DataItem top = candidate.record();
        for (String qualifier : qualifiers) {
            String upper = qualifier.toUpperCase(Locale.ROOT);
            while (current != null && !current.getName().equals(upper)) {
                current = current.getParent();
            }
            if (current == null) {
                if (top.getFile() != null && top.getFile().getName().equals(upper)) {
                    continue;
                }
                return false;
            }
            current = current.getParent();
        }
        return true;
    }

    public Optional<FileDefinition> file(String name) {
        return Optional.ofNullable(files.get(name.toUpperCase(Locale.ROOT)));
    }

    public List<FileDefinition> files() {
        return List.copyOf(files.values());
    }

    /**
     * True when a semantic error in the item's record forbids translating statements that touch it.
     */
    public boolean isBlocked(DataItem item) {
        return blockedRecords.contains(item.record());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Record size in bytes, with variable tables at their maximum.
     */
    public int recordSize(DataItem record) {
        return record.totalSize();
    }

    /**
     * False when the record contains an OCCURS DEPENDING ON.
     */
    public boolean isStaticSize(DataItem record) {
        for (DataItem item : items) {
            if (item.record() == record && item.getOccurs() != null && item.getOccurs().isVariable()) {
                return false;
            }
        }
        return true;
    }
}

package com.mainframe.transpiler.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.mainframe.transpiler.lst.SourceSpan;

import lombok.Getter;

/**
 * A SELECT / ASSIGN entry together with its FD and record descriptions.
 */
@Getter
public class FileDefinition {
    private final String name;
    private final String targetIdentifier;
    private final String assignment;
    private final String organization;
    private final String statusName;
    private final SourceSpan span;
    private final List<DataItem> records = new ArrayList<>();

    /** False when an FD names a file no SELECT declared. */
    private final boolean selected;

    FileDefinition(String name, String targetIdentifier, String assignment, String organization,
                   String statusName, SourceSpan span, boolean selected) {
        this.name = name;
        this.targetIdentifier = targetIdentifier;
        this.assignment = assignment;
        this.organization = organization;
        this.statusName = statusName;
        this.span = span;
        this.selected = selected;
    }

    public List<DataItem> getRecords() {
        return Collections.unmodifiableList(records);
    }

    void addRecord(DataItem record) {
        records.add(record);
    }

    /**
     * Largest record, which fixes the record length of the file.
     */
    public int recordLength() {
        return records.stream().mapToInt(DataItem::totalSize).max().orElse(0);
    }

    @Override
    public String toString() {
        return "FD " + name;
    }
}

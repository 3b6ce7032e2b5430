package com.mainframe.transpiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.mainframe.transpiler.symbol.LiteralValue;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

/**
 * A node of the IR record layout: a record, a group or an elementary field. Derived from the
 * symbol table once per program; equality is identity.
 */
@Getter
public class IrField {
    private final String cobolName;

    /** Field name in generated code. */
    private final String identifier;

    /** Nested type name for groups; null for elementary fields. */
    private final String typeName;

    private final IrType type;
    private final int level;
    private final boolean filler;

    /** Maximum occurrences; 0 without OCCURS. */
    private final int occurs;

    /** Initial VALUE, or null for the default (zero / spaces). */
    private final LiteralValue value;

    /** COBOL name of the item this one REDEFINES; it keeps separate storage. */
    private final String redefines;

    private final int offset;
    private final int size;

    @Getter(AccessLevel.NONE)
    private final List<IrField> children = new ArrayList<>();

    /** Level 66: elementary fields of the same record it renames, in order. */
    @Getter(AccessLevel.NONE)
    private final List<IrField> renamed = new ArrayList<>();

    private IrField parent;
    private IrField dependingOn;

    @Builder
    private IrField(String cobolName, String identifier, String typeName, IrType type, int level, boolean filler,
                    int occurs, LiteralValue value, String redefines, int offset, int size) {
        this.cobolName = cobolName;
        this.identifier = identifier;
        this.typeName = typeName;
        this.type = type;
        this.level = level;
        this.filler = filler;
        this.occurs = occurs;
        this.value = value;
        this.redefines = redefines;
        this.offset = offset;
        this.size = size;
    }

    public void addChild(IrField child) {
        child.parent = this;
        children.add(child);
    }

    public void addRenamed(IrField field) {
        renamed.add(field);
    }

    public void dependingOn(IrField field) {
        this.dependingOn = field;
    }

    public List<IrField> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<IrField> getRenamed() {
        return Collections.unmodifiableList(renamed);
    }

    public boolean isGroup() {
        return type.isGroup() && !isRenames();
    }

    public boolean isRenames() {
        return level == 66;
    }

    public boolean isTable() {
        return occurs > 0;
    }

    public boolean isRecord() {
        return parent == null;
    }

    /**
     * Fields from the record down to this one, the record first.
     */
    public List<IrField> path() {
        List<IrField> path = new ArrayList<>();
        for (IrField current = this; current != null; current = current.parent) {
            path.add(0, current);
        }
        return path;
    }

    /**
     * Number of subscripts an access needs: one per table on the path.
     */
    public int dimensions() {
        return (int) path().stream().filter(IrField::isTable).count();
    }

    @Override
    public String toString() {
        return cobolName + ":" + type.getKind();
    }
}

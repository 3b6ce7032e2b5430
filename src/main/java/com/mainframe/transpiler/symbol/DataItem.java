package com.mainframe.transpiler.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.mainframe.transpiler.lst.SourceSpan;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * A symbol table entry. Entries are created and laid out by {@link SymbolTableBuilder} and are
 * read-only afterwards; equality is identity.
 */
@Getter
public class DataItem {
    private final String name;
    private final boolean filler;
    private final String targetIdentifier;
    private final int level;
    private final DataSection section;
    private final SourceSpan span;

    @Getter(AccessLevel.NONE)
    private final List<DataItem> children = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<DataItem> conditionNames = new ArrayList<>();

    private DataItem parent;
    private Usage usage = Usage.DISPLAY;
    private PictureClause picture;
    private boolean separateSign;

    @Setter(AccessLevel.PACKAGE)
    private DataType type;

    private OccursClause occurs;
    private DataItem redefines;
    private LiteralValue value;

    /** Level 66: first and last item renamed. */
    private DataItem renamesFrom;
    private DataItem renamesThru;

    /** File whose record this is, for 01 entries under an FD. */
    private FileDefinition file;

    /** Item an INDEXED BY name indexes. */
    private DataItem indexes;

    @Setter(AccessLevel.PACKAGE)
    private int offset;

    /** Size of one occurrence in bytes. */
    @Setter(AccessLevel.PACKAGE)
    private int size;

    DataItem(String name, boolean filler, String targetIdentifier, int level, DataSection section, SourceSpan span) {
        this.name = name;
        this.filler = filler;
        this.targetIdentifier = targetIdentifier;
        this.level = level;
        this.section = section;
        this.span = span;
    }

    public List<DataItem> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<DataItem> getConditionNames() {
        return Collections.unmodifiableList(conditionNames);
    }

    void addChild(DataItem child) {
        child.parent = this;
        children.add(child);
    }

    void addConditionName(DataItem condition) {
        condition.parent = this;
        conditionNames.add(condition);
    }

    void attachTo(DataItem parent) {
        this.parent = parent;
    }

    void usage(Usage usage) {
        this.usage = usage;
    }

    void picture(PictureClause picture) {
        this.picture = picture;
    }

    void separateSign(boolean separateSign) {
        this.separateSign = separateSign;
    }

    void occurs(OccursClause occurs) {
        this.occurs = occurs;
    }

    void redefines(DataItem target) {
        this.redefines = target;
    }

    void value(LiteralValue value) {
        this.value = value;
    }

    void renames(DataItem from, DataItem thru) {
        this.renamesFrom = from;
        this.renamesThru = thru;
    }

    void file(FileDefinition file) {
        this.file = file;
    }

    void indexes(DataItem item) {
        this.indexes = item;
    }

    public boolean isRecord() {
        return parent == null && level != 88;
    }

    public boolean isGroup() {
        return type != null && type.isGroup();
    }

    public boolean isElementary() {
        return !isGroup() && !isConditionName();
    }

    public boolean isConditionName() {
        return level == 88;
    }

    public boolean isRenames() {
        return level == 66;
    }

    public boolean isIndexName() {
        return indexes != null;
    }

    public int occurrences() {
        return occurs == null ? 1 : Math.max(1, occurs.getMax());
    }

    /**
     * Bytes occupied including all occurrences at maximum.
     */
    public int totalSize() {
        return size * occurrences();
    }

    /**
     * Top-level (01 / 77) item this entry belongs to.
     */
    public DataItem record() {
        DataItem current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /**
     * Items with an OCCURS clause from the record down to this item, inclusive.
     */
    public List<DataItem> occursChain() {
        List<DataItem> chain = new ArrayList<>();
        for (DataItem current = this; current != null; current = current.parent) {
            if (current.occurs != null) {
                chain.add(0, current);
            }
        }
        return chain;
    }

    /**
     * Path from the record to this item, the record first.
     */
    public List<DataItem> path() {
        List<DataItem> path = new ArrayList<>();
        for (DataItem current = this; current != null; current = current.parent) {
            path.add(0, current);
        }
        return path;
    }

    public boolean isAncestorOf(DataItem other) {
        for (DataItem current = other.parent; current != null; current = current.parent) {
            if (current == this) {
                return true;
            }
        }
        return false;
    }

    /**
     * Elementary items below this one in declaration order; the item itself when elementary.
     */
    public List<DataItem> elementaryItems() {
        List<DataItem> out = new ArrayList<>();
        collectElementary(this, out);
        return out;
    }

    private static void collectElementary(DataItem item, List<DataItem> out) {
        if (!item.isGroup()) {
            out.add(item);
            return;
        }
        for (DataItem child : item.children) {
            collectElementary(child, out);
        }
    }

    @Override
    public String toString() {
        return String.format("%02d %s", level, name);
    }
}

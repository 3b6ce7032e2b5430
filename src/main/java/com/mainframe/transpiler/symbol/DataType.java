package com.mainframe.transpiler.symbol;

/**
 * Resolved type of a data item. The set of implementations is closed: numeric, alphanumeric,
 * edited, condition name and group. Downstream stages never look at raw PICTURE strings.
 */
public interface DataType {

    default boolean isNumeric() {
        return false;
    }

    default boolean isAlphanumeric() {
        return false;
    }

    default boolean isGroup() {
        return false;
    }

    /**
     * Character positions of the item's display form; 0 for condition names.
     */
    int displayLength();
}

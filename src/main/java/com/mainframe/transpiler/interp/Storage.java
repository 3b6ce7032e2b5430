package com.mainframe.transpiler.interp;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.mainframe.transpiler.ir.IrField;
import com.mainframe.transpiler.ir.IrType;
import com.mainframe.transpiler.runtime.CobolSemantics;
import com.mainframe.transpiler.symbol.LiteralValue;

import lombok.Value;

/**
 * Working storage of one interpreted run. Elementary fields hold a value per occurrence slot:
 * numeric fields a scaled {@link BigDecimal}, the others a fixed-length string. Groups have no
 * storage of their own; their image is built from and loaded into their children.
 */
class Storage {
    private final Map<Slot, Object> values = new HashMap<>();

    Storage(List<IrField> records) {
        for (IrField record : records) {
            initialValues(record, new ArrayList<>());
        }
    }

    Object get(IrField field, List<Integer> index) {
        return values.computeIfAbsent(new Slot(field, List.copyOf(index)), s -> initial(field));
    }

    void put(IrField field, List<Integer> index, Object value) {
        values.put(new Slot(field, List.copyOf(index)), value);
    }

    /**
     * Display image of a field occurrence, a group's being the concatenation of its children.
     */
    String image(IrField field, List<Integer> index) {
        if (field.isRenames()) {
            StringBuilder out = new StringBuilder();
            field.getRenamed().forEach(r -> out.append(image(r, List.of())));
            return out.toString();
        }
        if (field.isGroup()) {
            StringBuilder out = new StringBuilder();
            for (IrField child : field.getChildren()) {
                if (!stored(child)) {
                    continue;
                }
                if (child.isTable()) {
                    for (int k = 1; k <= child.getOccurs(); k++) {
                        out.append(image(child, extend(index, k)));
                    }
                } else {
                    out.append(image(child, index));
                }
            }
            return out.toString();
        }
        IrType type = field.getType();
        Object value = get(field, index);
        if (type.isNumeric()) {
            return CobolSemantics.zoned((BigDecimal) value, type.getIntegerDigits(), type.getFractionDigits(), type.isSigned());
        }
        return (String) value;
    }

    /**
     * Splits {@code text}, padded or truncated to the field's length, over the field's storage.
     */
    void load(IrField field, List<Integer> index, String text) {
        String image = CobolSemantics.alphanumeric(text, field.getType().getLength());
        if (field.isRenames()) {
            int position = 0;
            for (IrField renamed : field.getRenamed()) {
                int length = renamed.getType().getLength();
                load(renamed, List.of(), image.substring(position, Math.min(image.length(), position + length)));
                position += length;
            }
            return;
        }
        if (field.isGroup()) {
            int position = 0;
            for (IrField child : field.getChildren()) {
                if (!stored(child)) {
                    continue;
                }
                int length = child.getType().getLength();
                int count = child.isTable() ? child.getOccurs() : 1;
                for (int k = 1; k <= count; k++) {
                    int end = Math.min(image.length(), position + length);
                    String part = position < end ? image.substring(position, end) : "";
                    load(child, child.isTable() ? extend(index, k) : index, part);
                    position += length;
                }
            }
            return;
        }
        IrType type = field.getType();
        if (type.isNumeric()) {
            put(field, index, CobolSemantics.unzoned(image, type.getIntegerDigits(), type.getFractionDigits(), type.isSigned()));
        } else {
            put(field, index, image);
        }
    }

    /**
     * INITIALIZE: zero or spaces into every elementary field below, FILLER and REDEFINES excluded.
     */
    void initialize(IrField field, List<Integer> index) {
        if (field.isRenames()) {
            field.getRenamed().forEach(r -> initialize(r, List.of()));
            return;
        }
        if (field.isGroup()) {
            for (IrField child : field.getChildren()) {
                if (!stored(child) || child.isFiller()) {
                    continue;
                }
                if (child.isTable()) {
                    for (int k = 1; k <= child.getOccurs(); k++) {
                        initialize(child, extend(index, k));
                    }
                } else {
                    initialize(child, index);
                }
            }
            return;
        }
        put(field, index, Conversions.empty(field.getType()));
    }

    static List<Integer> extend(List<Integer> index, int k) {
        List<Integer> extended = new ArrayList<>(index);
        extended.add(k);
        return extended;
    }

    private static boolean stored(IrField child) {
        return child.getRedefines() == null && !child.isRenames();
    }

    private Object initial(IrField field) {
        LiteralValue value = field.getValue();
        if (value == null) {
            return Conversions.empty(field.getType());
        }
        return Conversions.move(value, field.getType());
    }

    private void initialValues(IrField field, List<Integer> index) {
        if (field.isGroup() && field.getValue() != null) {
            load(field, index, Conversions.text(field.getValue(), field.getType().getLength()));
        }
        for (IrField child : field.getChildren()) {
            if (child.isRenames()) {
                continue;
            }
            if (child.isTable()) {
                for (int k = 1; k <= child.getOccurs(); k++) {
                    initialValues(child, extend(index, k));
                }
            } else {
                initialValues(child, index);
            }
        }
    }

    @Value
    private static class Slot {
        IrField field;
        List<Integer> index;
    }
}

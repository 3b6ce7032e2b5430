package com.mainframe.transpiler.translate;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.ir.IrField;
import com.mainframe.transpiler.ir.IrFile;
import com.mainframe.transpiler.ir.IrType;
import com.mainframe.transpiler.naming.NameScope;
import com.mainframe.transpiler.naming.NamingUtil;
import com.mainframe.transpiler.symbol.AlphanumericEditedType;
import com.mainframe.transpiler.symbol.DataItem;
import com.mainframe.transpiler.symbol.DataType;
import com.mainframe.transpiler.symbol.FileDefinition;
import com.mainframe.transpiler.symbol.NumericType;
import com.mainframe.transpiler.symbol.SymbolTable;

/**
 * Derives the IR record layout from the symbol table: one {@link IrField} per data item except
 * condition names, with nested type names for groups.
 */
class LayoutBuilder {
    private static final Logger log = LoggerFactory.getLogger(LayoutBuilder.class);

    /** Names the generated unit defines itself; group types never take them. */
    static final List<String> RESERVED_TYPE_NAMES = List.of(
            "RecordStream", "InMemoryRecordStream", "StopRun", "SizeError", "BigDecimal", "RoundingMode",
            "String", "Object", "Math", "System", "List", "ArrayList", "Map", "Files", "Path", "Paths",
            "IOException", "Decimal", "Rt", "Runtime", "Integer", "Override", "Exception", "Thread",
            "StandardCharsets", "LocalDate", "LocalTime", "Type", "Arrays", "StringBuilder", "Character",
            "LocalDateTime", "DateTimeFormatter", "BufferedReader", "InputStreamReader", "LinkedHashMap",
            "HashMap", "Iterator", "IllegalStateException", "RuntimeException", "ArithmeticException",
            "UncheckedIOException", "Collections", "IllegalArgumentException");

    private final SymbolTable symbols;
    private final NameScope typeNames = new NameScope();
    private final Map<DataItem, IrField> fields = new IdentityHashMap<>();

    LayoutBuilder(SymbolTable symbols, String unitName) {
        this.symbols = symbols;
        typeNames.reserve(unitName);
        RESERVED_TYPE_NAMES.forEach(typeNames::reserve);
    }

    List<IrField> records() {
        List<IrField> records = new ArrayList<>();
        for (DataItem record : symbols.getRecords()) {
            records.add(build(record));
        }
        for (DataItem item : symbols.getItems()) {
            if (item.isRenames() && item.getRenamesFrom() != null && fields.containsKey(item.getParent())) {
                attachRenames(item);
            }
        }
        for (Map.Entry<DataItem, IrField> entry : fields.entrySet()) {
            DataItem item = entry.getKey();
            if (item.getOccurs() != null && item.getOccurs().getDependingOn() != null) {
                IrField counter = fields.get(item.getOccurs().getDependingOn());
                if (counter != null) {
                    entry.getValue().dependingOn(counter);
                }
            }
        }
        log.debug("Laid out {} records ({} fields)", records.size(), fields.size());
        return records;
    }

    List<IrFile> files() {
        List<IrFile> files = new ArrayList<>();
        for (FileDefinition definition : symbols.files()) {
            IrFile.IrFileBuilder file = IrFile.builder()
                    .cobolName(definition.getName())
                    .identifier(definition.getTargetIdentifier())
                    .assignment(definition.getAssignment())
                    .organization(definition.getOrganization());
            int length = 0;
            for (DataItem record : definition.getRecords()) {
                IrField field = fields.get(record);
                if (field != null) {
                    file.record(field);
                    length = Math.max(length, field.getType().getLength());
                }
            }
            file.recordLength(length);
            if (definition.getStatusName() != null) {
                symbols.resolve(definition.getStatusName()).getCandidates().stream()
                        .findFirst()
                        .map(fields::get)
                        .ifPresent(file::status);
            }
            files.add(file.build());
        }
        return files;
    }

    IrField field(DataItem item) {
        return fields.get(item);
    }

    private IrField build(DataItem item) {
        boolean group = item.isGroup() && !item.getChildren().isEmpty();
        IrField field = IrField.builder()
                .cobolName(item.getName())
                .identifier(item.getTargetIdentifier())
                .typeName(group ? typeNames.claim(NamingUtil.toPascalCase(item.isFiller() ? "FILLER" : item.getName())) : null)
                .type(group ? IrType.group(displayLength(item)) : typeOf(item.getType(), item.getSize()))
                .level(item.getLevel())
                .filler(item.isFiller())
                .occurs(item.getOccurs() == null ? 0 : Math.max(1, item.getOccurs().getMax()))
                .value(item.getValue())
                .redefines(item.getRedefines() == null ? null : item.getRedefines().getName())
                .offset(item.getOffset())
                .size(item.getSize())
                .build();
        fields.put(item, field);
        for (DataItem child : item.getChildren()) {
            if (!child.isConditionName()) {
                field.addChild(build(child));
            }
        }
        return field;
    }

    private void attachRenames(DataItem alias) {
        DataItem from = alias.getRenamesFrom();
        DataItem thru = alias.getRenamesThru() != null ? alias.getRenamesThru() : from;
        List<IrField> covered = new ArrayList<>();
        int start = from.getOffset();
        int end = thru.getOffset() + thru.totalSize();
        for (DataItem elementary : alias.getParent().record().elementaryItems()) {
            if (elementary.getOffset() >= start && elementary.getOffset() < end && elementary.getRedefines() == null
                    && !insideRedefines(elementary) && fields.containsKey(elementary)) {
                covered.add(fields.get(elementary));
            }
        }
        int length = covered.stream().mapToInt(f -> f.getType().getLength()).sum();
        IrType type = covered.size() == 1 ? covered.get(0).getType() : IrType.alphanumeric(length);
        IrField field = IrField.builder()
                .cobolName(alias.getName())
                .identifier(alias.getTargetIdentifier())
                .type(type)
                .level(66)
                .offset(alias.getOffset())
                .size(alias.getSize())
                .build();
        covered.forEach(field::addRenamed);
        fields.get(alias.getParent()).addChild(field);
        fields.put(alias, field);
    }

    private static boolean insideRedefines(DataItem item) {
        for (DataItem current = item.getParent(); current != null; current = current.getParent()) {
            if (current.getRedefines() != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Characters of a group's display image: its children's images in order, REDEFINES excluded.
     */
    private static int displayLength(DataItem item) {
        if (!item.isGroup() || item.getChildren().isEmpty()) {
            return item.getType() == null ? 0 : item.getType().displayLength();
        }
        int length = 0;
        for (DataItem child : item.getChildren()) {
            if (child.getRedefines() == null && !child.isConditionName() && !child.isRenames()) {
                length += displayLength(child) * child.occurrences();
            }
        }
        return length;
    }

    static IrType typeOf(DataType type, int size) {
        if (type instanceof NumericType numeric) {
            return IrType.numeric(numeric.getIntegerDigits(), numeric.getFractionDigits(), numeric.isSigned());
        }
        if (type instanceof AlphanumericEditedType edited) {
            return IrType.edited(edited.getLength(), edited.getPicture(), edited.isNumericEdited(),
                    edited.getIntegerDigits(), edited.getFractionDigits());
        }
        if (type == null) {
            return IrType.alphanumeric(size);
        }
        if (type.isGroup()) {
            return IrType.group(type.displayLength());
        }
        return IrType.alphanumeric(type.displayLength());
    }
}

package com.mainframe.transpiler.symbol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.diagnostics.SemanticErrorKind;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.DivisionNode;
import com.mainframe.transpiler.lst.LiteralKind;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.LstWalker;
import com.mainframe.transpiler.lst.SectionNode;
import com.mainframe.transpiler.lst.StatementNode;
import com.mainframe.transpiler.naming.NameKind;
import com.mainframe.transpiler.naming.NameScope;
import com.mainframe.transpiler.parser.ParseResult;

/**
 * Walks the DATA DIVISION (and FILE-CONTROL) of a parsed program and builds its symbol table.
 *
 * Building only resolves declarations:
 * - level numbers into the record tree
 * - PICTURE and USAGE into a closed type
 * - REDEFINES, OCCURS DEPENDING ON and RENAMES into back-references
 * - byte offsets and sizes, computed once after all entries are read
 *
 * Declaration errors are collected and block the affected record only.
 */
public class SymbolTableBuilder {
    private static final Logger log = LoggerFactory.getLogger(SymbolTableBuilder.class);

    private final NameScope names;

    private final List<DataItem> records = new ArrayList<>();
    private final List<DataItem> indexItems = new ArrayList<>();
    private final List<DataItem> items = new ArrayList<>();
    private final List<DataItem> renames = new ArrayList<>();
    private final Map<String, FileDefinition> files = new LinkedHashMap<>();
    private final Map<String, List<DataItem>> byName = new LinkedHashMap<>();
    private final Set<DataItem> blockedRecords = new HashSet<>();
    private final List<SemanticError> errors = new ArrayList<>();

    private final Deque<DataItem> itemStack = new ArrayDeque<>();
    private DataSection section = DataSection.WORKING_STORAGE;
    private FileDefinition currentFile;
    private DataItem currentRecord;
    private DataItem lastItem;

    public SymbolTableBuilder() {
        this(new NameScope());
    }

    public SymbolTableBuilder(NameScope names) {
        this.names = names;
    }

    public SymbolTable build(ParseResult parse) {
        parse.division("ENVIRONMENT").ifPresent(this::collectSelects);
        parse.dataDivision().ifPresent(this::collectData);

        records.addAll(indexItems);
        for (DataItem record : records) {
            layout(record, 0);
        }
        for (DataItem alias : renames) {
            layoutRenames(alias);
        }

        log.info("Built symbol table for {}: {} records, {} items, {} files, {} semantic errors",
                parse.getFileName(), records.size(), items.size(), files.size(), errors.size());

        return new SymbolTable(records, items, files, byName, blockedRecords, errors, names);
    }

    // ------------------------------------------------------------------ FILE-CONTROL

    private void collectSelects(DivisionNode environment) {
        for (StatementNode select : LstWalker.statements(environment)) {
            if (!select.isVerb(StatementNode.SELECT)) {
                continue;
            }
            String name = firstIdentifier(select.clause(ClauseRole.NAME)).orElse(null);
            if (name == null) {
                continue;
            }
            String assignment = select.clause(ClauseRole.ASSIGN).map(ClauseNode::getOperator).orElse(name);
            String organization = select.clause(ClauseRole.ORGANIZATION).map(ClauseNode::getOperator).orElse("SEQUENTIAL");
            String status = select.clauses(ClauseRole.OPTIONS).stream()
                    .filter(c -> "STATUS".equals(c.getOperator()))
                    .findFirst()
                    .flatMap(c -> c.clause(ClauseRole.REFERENCE))
                    .flatMap(SymbolTableBuilder::referenceName)
                    .orElse(null);

            FileDefinition file = new FileDefinition(name, names.claim(name, NameKind.DATA), assignment,
                    organization, status, select.getSpan(), true);
            files.put(name, file);
            log.debug("Declared file {} assigned to {}", name, assignment);
        }
    }

    // ------------------------------------------------------------------ DATA DIVISION

    private void collectData(DivisionNode data) {
        for (LstNode child : data.getChildren()) {
            if (child instanceof SectionNode sectionNode) {
                startSection(DataSection.fromHeader(sectionNode.getName()));
                for (StatementNode entry : sectionNode.statements()) {
                    processEntry(entry);
                }
            } else if (child instanceof StatementNode entry) {
                processEntry(entry);
            }
        }
    }

    private void startSection(DataSection next) {
        section = next;
        currentFile = null;
        currentRecord = null;
        lastItem = null;
        itemStack.clear();
    }

    private void processEntry(StatementNode entry) {
        if (entry.isVerb(StatementNode.FILE_DESCRIPTION) || entry.isVerb("SD")) {
            String name = firstIdentifier(entry.clause(ClauseRole.NAME)).orElse("FILE");
            currentFile = files.computeIfAbsent(name, n -> {
                log.warn("{} describes file {} without a SELECT entry", entry.getVerb(), n);
                return new FileDefinition(n, names.claim(n, NameKind.DATA), n, "SEQUENTIAL", null, entry.getSpan(), false);
            });
            itemStack.clear();
            currentRecord = null;
            lastItem = null;
            return;
        }
        if (!entry.isVerb(StatementNode.DATA_DESCRIPTION)) {
            log.debug("Skipping {} entry at {}", entry.getVerb(), entry.getSpan());
            return;
        }

        int level = Integer.parseInt(entry.clause(ClauseRole.LEVEL).map(ClauseNode::getOperator).orElse("1"));
        String name = entry.clause(ClauseRole.NAME).map(ClauseNode::getOperator).orElse("FILLER");

        if (level == 88) {
            addConditionName(entry, name);
        } else if (level == 66) {
            addRenames(entry, name);
        } else if ((level >= 1 && level <= 49) || level == 77) {
            addDataItem(entry, level, name);
        } else {
            log.warn("Ignoring entry {} with invalid level number {} at {}", name, level, entry.getSpan());
        }
    }

    private void addDataItem(StatementNode entry, int level, String name) {
        boolean filler = name.equals("FILLER");
        String identifier = names.claim(filler ? "filler" : name, NameKind.DATA);
        DataItem item = new DataItem(name, filler, identifier, level, section, entry.getSpan());

        DataItem parent = null;
        if (level == 1 || level == 77) {
            itemStack.clear();
        } else {
            adjustStackForLevel(level);
            parent = itemStack.peek();
        }

        if (parent == null) {
            declareRecord(item);
        } else {
            parent.addChild(item);
        }
        register(item);

        entry.clause(ClauseRole.USAGE)
                .map(c -> Usage.fromCobol(c.getOperator()))
                .ifPresentOrElse(item::usage, () -> {
                    if (item.getParent() != null) {
                        item.usage(item.getParent().getUsage());
                    }
                });
        item.separateSign(entry.clauses(ClauseRole.OPTIONS).stream().anyMatch(c -> "SEPARATE".equals(c.getOperator())));

        entry.clause(ClauseRole.PICTURE).ifPresent(pic -> resolvePicture(item, pic));
        if (item.getPicture() == null && item.getType() == null && item.getUsage().isImplicitlyTyped()) {
            item.setType(implicitType(item.getUsage()));
        }
        DataItem owner = parent;
        entry.clause(ClauseRole.REDEFINES).ifPresent(clause -> resolveRedefines(item, owner, clause));
        entry.clause(ClauseRole.OCCURS).ifPresent(clause -> resolveOccurs(item, clause));
        entry.clause(ClauseRole.VALUE).ifPresent(clause -> firstValue(clause).ifPresent(item::value));

        itemStack.push(item);
        lastItem = item;
    }

    private void declareRecord(DataItem record) {
        if (!record.isFiller()) {
            boolean duplicate = records.stream()
                    .anyMatch(r -> r.getSection() == section && r.getName().equals(record.getName()));
            if (duplicate) {
                error(SemanticErrorKind.DUPLICATE_RECORD, record,
                        "Record " + record.getName() + " is declared more than once in " + section);
            }
        }
        records.add(record);
        currentRecord = record;
        if (section == DataSection.FILE && currentFile != null && record.getLevel() == 1) {
            currentFile.addRecord(record);
            record.file(currentFile);
        }
    }

    private void register(DataItem item) {
        items.add(item);
        if (!item.isFiller()) {
            byName.computeIfAbsent(item.getName(), n -> new ArrayList<>()).add(item);
        }
    }

    private void adjustStackForLevel(int level) {
        while (!itemStack.isEmpty()) {
            DataItem top = itemStack.peek();
            if (top.getLevel() >= level || top.getLevel() == 77) {
                itemStack.pop();
            } else {
                break;
            }
        }
    }

    private void resolvePicture(DataItem item, ClauseNode clause) {
        try {
            PictureClause picture = PictureClause.parse(clause.getOperator());
            item.picture(picture);
            item.setType(typeOf(picture, item.getUsage()));
        } catch (InvalidPictureException e) {
            error(SemanticErrorKind.INVALID_PICTURE, item, e.getMessage());
            item.setType(new AlphanumericType(Math.max(1, clause.getOperator().length())));
        }
    }

    private static DataType typeOf(PictureClause picture, Usage usage) {
        switch (picture.getCategory()) {
            case NUMERIC:
                return new NumericType(picture.getIntegerDigits(), picture.getFractionDigits(), picture.isSigned(), usage);
            case NUMERIC_EDITED:
            case ALPHANUMERIC_EDITED:
                return new AlphanumericEditedType(picture.getLength(), picture.getExpandedPicture(),
                        picture.getCategory() == PictureCategory.NUMERIC_EDITED,
                        picture.getIntegerDigits(), picture.getFractionDigits());
            default:
                return new AlphanumericType(picture.getLength());
        }
    }

    private static DataType implicitType(Usage usage) {
        switch (usage) {
            case COMP_1:
                return new NumericType(9, 9, true, usage);
            case COMP_2:
                return new NumericType(18, 18, true, usage);
            case POINTER:
                return new NumericType(18, 0, false, usage);
            default:
                return new NumericType(9, 0, false, Usage.INDEX);
        }
    }

    /**
     * The target must be an earlier item with the same level under the same parent.
     */
    private void resolveRedefines(DataItem item, DataItem parent, ClauseNode clause) {
        String targetName = firstIdentifier(Optional.of(clause)).orElse("");
        List<DataItem> siblings = parent == null
                ? records.stream().filter(r -> r.getSection() == item.getSection()).toList()
                : parent.getChildren();

        DataItem target = null;
        for (DataItem sibling : siblings) {
            if (sibling == item) {
                break;
            }
            if (sibling.getName().equals(targetName)) {
                target = sibling;
            }
        }

        if (target == null) {
            boolean declaredElsewhere = byName.containsKey(targetName);
            error(declaredElsewhere ? SemanticErrorKind.REDEFINES_LEVEL_MISMATCH : SemanticErrorKind.UNDECLARED_REDEFINES,
                    item, declaredElsewhere
                            ? item.getName() + " redefines " + targetName + " which is not an earlier item at the same level"
                            : item.getName() + " redefines undeclared item " + targetName);
            return;
        }
        if (target.getLevel() != item.getLevel()) {
            error(SemanticErrorKind.REDEFINES_LEVEL_MISMATCH, item,
                    item.getName() + " (level " + item.getLevel() + ") redefines " + targetName
                            + " (level " + target.getLevel() + ")");
            return;
        }
        item.redefines(target);
    }

    private void resolveOccurs(DataItem item, ClauseNode clause) {
        List<Integer> counts = new ArrayList<>();
        for (LiteralNode literal : clause.literals()) {
            if (literal.getLiteralKind() == LiteralKind.NUMERIC) {
                try {
                    counts.add(Integer.parseInt(literal.text()));
                } catch (NumberFormatException e) {
                    error(SemanticErrorKind.INVALID_OCCURS, item,
                            item.getName() + " has an OCCURS count that is not a whole number in range: " + literal.text());
                    return;
                }
            }
        }
        int min = counts.isEmpty() ? 1 : counts.get(0);
        int max = counts.size() > 1 ? counts.get(1) : min;

        OccursClause.OccursClauseBuilder occurs = OccursClause.builder().min(min).max(max);

        Optional<ClauseNode> depending = clause.clause(ClauseRole.DEPENDING_ON).flatMap(d -> d.clause(ClauseRole.REFERENCE));
        if (depending.isPresent()) {
            ClauseNode reference = depending.get();
            String counterName = referenceName(reference).orElse("");
            occurs.dependingOnName(counterName);
            Resolution resolution = new SymbolTable(records, items, files, byName, blockedRecords, errors, names)
                    .resolve(counterName, qualifiers(reference));
            if (!resolution.isResolved()) {
                error(SemanticErrorKind.INVALID_DEPENDING_ON, item,
                        item.getName() + " OCCURS DEPENDING ON " + counterName + " which is "
                                + resolution.getStatus().name().toLowerCase(Locale.ROOT));
            } else if (resolution.getItem().getType() == null || !resolution.getItem().getType().isNumeric()) {
                error(SemanticErrorKind.INVALID_DEPENDING_ON, item,
                        item.getName() + " OCCURS DEPENDING ON non-numeric item " + counterName);
            } else {
                occurs.dependingOn(resolution.getItem());
            }
        }

        clause.clauses(ClauseRole.OPTIONS).stream()
                .filter(c -> "INDEXED".equals(c.getOperator()))
                .flatMap(c -> c.literals().stream())
                .filter(l -> l.getLiteralKind() == LiteralKind.IDENTIFIER)
                .forEach(l -> {
                    String indexName = l.upper();
                    occurs.indexName(indexName);
                    declareIndex(indexName, item);
                });

        item.occurs(occurs.build());
    }

    private void declareIndex(String indexName, DataItem table) {
        DataItem index = new DataItem(indexName, false, names.claim(indexName, NameKind.DATA), 77,
                DataSection.WORKING_STORAGE, table.getSpan());
        index.usage(Usage.INDEX);
        index.setType(new NumericType(9, 0, false, Usage.INDEX));
        index.indexes(table);
        index.value(LiteralValue.numeric("1"));
        indexItems.add(index);
        register(index);
    }

    private void addConditionName(StatementNode entry, String name) {
        if (lastItem == null) {
            log.warn("Condition name {} at {} has no item to attach to", name, entry.getSpan());
            return;
        }
        List<ConditionValue> values = new ArrayList<>();
        entry.clause(ClauseRole.VALUE).ifPresent(clause -> {
            for (ClauseNode value : clause.subClauses()) {
                List<LstNode> operands = operandsOf(value);
                if (operands.isEmpty()) {
                    continue;
                }
                Optional<LiteralValue> from = Literals.of(operands.get(0));
                if (from.isEmpty()) {
                    continue;
                }
                if (value.getRole() == ClauseRole.RANGE && operands.size() > 1) {
                    values.add(new ConditionValue(from.get(), Literals.of(operands.get(operands.size() - 1)).orElse(from.get())));
                } else {
                    values.add(ConditionValue.single(from.get()));
                }
            }
        });

        DataItem condition = new DataItem(name, false, names.claim(name, NameKind.DATA), 88, section, entry.getSpan());
        lastItem.addConditionName(condition);
        if (values.isEmpty()) {
            values.add(ConditionValue.single(LiteralValue.figurative(LiteralValue.SPACE)));
            log.warn("Condition name {} at {} has no VALUE clause", name, entry.getSpan());
        }
        condition.setType(new ConditionNameType(lastItem, List.copyOf(values)));
        register(condition);
    }

    private void addRenames(StatementNode entry, String name) {
        DataItem alias = new DataItem(name, false, names.claim(name, NameKind.DATA), 66, section, entry.getSpan());
        Optional<ClauseNode> clause = entry.clause(ClauseRole.RENAMES);
        List<String> renamed = clause.map(c -> c.literals().stream()
                        .filter(l -> l.getLiteralKind() == LiteralKind.IDENTIFIER)
                        .map(LiteralNode::upper)
                        .toList())
                .orElse(List.of());

        DataItem record = currentRecord;
        DataItem from = renamed.isEmpty() ? null : findInRecord(record, renamed.get(0));
        DataItem thru = renamed.size() > 1 ? findInRecord(record, renamed.get(1)) : null;
        if (record == null || from == null || (renamed.size() > 1 && thru == null)) {
            error(SemanticErrorKind.INVALID_RENAMES, alias, name + " renames items not found in the preceding record");
            alias.setType(new AlphanumericType(0));
            register(alias);
            return;
        }

        alias.attachTo(record);
        alias.renames(from, thru);
        renames.add(alias);
        register(alias);
    }

    private static DataItem findInRecord(DataItem record, String name) {
        if (record == null) {
            return null;
        }
        if (record.getName().equals(name)) {
            return record;
        }
        for (DataItem child : record.getChildren()) {
            DataItem found = findInRecord(child, name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    // ------------------------------------------------------------------ layout

    /**
     * Assigns offsets relative to the record; returns the offset just past the item's last occurrence.
     */
    private int layout(DataItem item, int offset) {
        item.setOffset(offset);

        if (!item.getChildren().isEmpty()) {
            int cursor = offset;
            for (DataItem child : item.getChildren()) {
                int start = child.getRedefines() != null ? child.getRedefines().getOffset() : cursor;
                int end = layout(child, start);
                cursor = Math.max(cursor, end);
            }
            item.setSize(cursor - offset);
            item.setType(new GroupType(item.getSize()));
        } else if (item.getType() == null) {
            item.setSize(0);
            item.setType(new GroupType(0));
        } else {
            item.setSize(elementarySize(item));
        }

        return offset + item.totalSize();
    }

    private static int elementarySize(DataItem item) {
        if (item.getPicture() != null) {
            return item.getPicture().getByteLength(item.getUsage(), item.isSeparateSign());
        }
        switch (item.getUsage()) {
            case COMP_1:
            case INDEX:
                return 4;
            case COMP_2:
            case POINTER:
                return 8;
            default:
                return item.getType().displayLength();
        }
    }

    private static void layoutRenames(DataItem alias) {
        DataItem from = alias.getRenamesFrom();
        DataItem last = alias.getRenamesThru() != null ? alias.getRenamesThru() : from;
        int start = from.getOffset();
        int end = last.getOffset() + last.totalSize();
        alias.setOffset(start);
        alias.setSize(Math.max(0, end - start));
        if (alias.getRenamesThru() == null && from.isElementary()) {
            alias.setType(from.getType());
        } else {
            alias.setType(new AlphanumericType(alias.getSize()));
        }
    }

    // ------------------------------------------------------------------ helpers

    private void error(SemanticErrorKind kind, DataItem item, String message) {
        log.warn("{}: {}", item.getSpan(), message);
        errors.add(new SemanticError(kind, item.getName(), message, item.getSpan()));
        blockedRecords.add(item.record());
    }

    private static Optional<LiteralValue> firstValue(ClauseNode valueClause) {
        for (ClauseNode value : valueClause.subClauses()) {
            List<LstNode> operands = operandsOf(value);
            if (!operands.isEmpty()) {
                return Literals.of(operands.get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Operand children of a VALUE or RANGE clause: everything but the THRU keyword.
     */
    private static List<LstNode> operandsOf(ClauseNode clause) {
        List<LstNode> out = new ArrayList<>();
        for (LstNode child : clause.getChildren()) {
            if (child instanceof LiteralNode literal && literal.getLiteralKind() == LiteralKind.KEYWORD) {
                continue;
            }
            out.add(child);
        }
        return out;
    }

    private static Optional<String> firstIdentifier(Optional<ClauseNode> clause) {
        return clause.flatMap(c -> c.literals().stream()
                .filter(l -> l.getLiteralKind() == LiteralKind.IDENTIFIER)
                .map(LiteralNode::upper)
                .findFirst());
    }

    /**
     * Data name of a REFERENCE clause.
     */
    public static Optional<String> referenceName(ClauseNode reference) {
        List<LiteralNode> literals = reference.literals();
        return literals.isEmpty() ? Optional.empty() : Optional.of(literals.get(0).upper());
    }

    /**
     * Qualifier names of a REFERENCE clause, innermost first.
     */
    public static List<String> qualifiers(ClauseNode reference) {
        List<String> out = new ArrayList<>();
        for (ClauseNode qualifier : reference.clauses(ClauseRole.QUALIFIER)) {
            qualifier.literals().stream().findFirst().ifPresent(l -> out.add(l.upper()));
        }
        return out;
    }
}

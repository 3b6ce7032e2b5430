package com.mainframe.transpiler.codegen.python;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.mainframe.transpiler.codegen.LineWriter;
import com.mainframe.transpiler.codegen.RenderSupport;
import com.mainframe.transpiler.codegen.model.MethodModel;
import com.mainframe.transpiler.codegen.model.TypeModel;
import com.mainframe.transpiler.codegen.model.UnitModel;
import com.mainframe.transpiler.flow.RegionShape;
import com.mainframe.transpiler.interp.Conversions;
import com.mainframe.transpiler.ir.Accept;
import com.mainframe.transpiler.ir.Arithmetic;
import com.mainframe.transpiler.ir.ArithmeticStore;
import com.mainframe.transpiler.ir.Assign;
import com.mainframe.transpiler.ir.Binary;
import com.mainframe.transpiler.ir.Call;
import com.mainframe.transpiler.ir.Compare;
import com.mainframe.transpiler.ir.ConditionTest;
import com.mainframe.transpiler.ir.Conditional;
import com.mainframe.transpiler.ir.ControlRef;
import com.mainframe.transpiler.ir.ControlVariable;
import com.mainframe.transpiler.ir.Display;
import com.mainframe.transpiler.ir.Exit;
import com.mainframe.transpiler.ir.ExternalCall;
import com.mainframe.transpiler.ir.FileOp;
import com.mainframe.transpiler.ir.Initialize;
import com.mainframe.transpiler.ir.IrExpression;
import com.mainframe.transpiler.ir.IrField;
import com.mainframe.transpiler.ir.IrFile;
import com.mainframe.transpiler.ir.IrParagraph;
import com.mainframe.transpiler.ir.IrProgram;
import com.mainframe.transpiler.ir.IrRegion;
import com.mainframe.transpiler.ir.IrStatement;
import com.mainframe.transpiler.ir.IrType;
import com.mainframe.transpiler.ir.IrVisitor;
import com.mainframe.transpiler.ir.Literal;
import com.mainframe.transpiler.ir.Logical;
import com.mainframe.transpiler.ir.Loop;
import com.mainframe.transpiler.ir.RecordAccess;
import com.mainframe.transpiler.ir.Sequence;
import com.mainframe.transpiler.ir.Stop;
import com.mainframe.transpiler.ir.Tagged;
import com.mainframe.transpiler.symbol.ConditionValue;
import com.mainframe.transpiler.symbol.LiteralValue;

/**
 * Renders one program as Python. Same shape as the Java renderer: statements append lines,
 * expressions render to a {@code Decimal}, a {@code str}, an {@code int} or a {@code bool}.
 * Unit state lives on {@code self}; the data rules are the module's underscore helpers.
 */
class PythonUnitRenderer implements IrVisitor<Void> {
    private static final String INDENT = "    ";

    private final IrProgram program;
    private final Map<String, String> hints;
    private LineWriter out;
    private int locals;

    PythonUnitRenderer(IrProgram program, Map<String, String> hints) {
        this.program = program;
        this.hints = hints;
    }

    UnitModel render() {
        UnitModel.UnitModelBuilder unit = UnitModel.builder()
                .unitName(program.getUnitName())
                .programId(program.getProgramId())
                .sourcePath(program.getSourcePath())
                .entry(program.getEntryRegion());

        for (IrField record : program.getRecords()) {
            if (record.isGroup()) {
                unit.type(type(record));
                unit.constructorLine("self." + record.getIdentifier() + " = " + record.getTypeName() + "()");
            } else {
                unit.constructorLine("self." + record.getIdentifier() + " = " + initial(record));
            }
        }
        for (ControlVariable variable : program.getControlVariables()) {
            unit.constructorLine("self." + variable.getIdentifier() + " = " + variable.getInitialValue());
        }
        for (IrFile file : program.getFiles()) {
            unit.constructorLine(stream(file) + " = _stream(streams, " + PythonSyntax.string(file.getCobolName()) + ", "
                    + (file.getAssignment() == null ? "None" : PythonSyntax.string(file.getAssignment())) + ")");
        }
        for (IrParagraph paragraph : program.getParagraphs()) {
            unit.paragraph(paragraph(paragraph));
        }
        for (IrRegion region : program.getRegions()) {
            unit.region(region(region));
        }
        return unit.build();
    }

    // ------------------------------------------------------------------ layout

    private static String initial(IrField field) {
        String initial = PythonSyntax.constant(RenderSupport.initialValue(field));
        return field.isTable() ? "[" + initial + "] * " + field.getOccurs() : initial;
    }

    private TypeModel type(IrField group) {
        int length = group.getType().getLength();
        TypeModel.TypeModelBuilder type = TypeModel.builder()
                .name(group.getTypeName())
                .cobolName(group.getCobolName())
                .length(length);

        for (IrField child : group.getChildren()) {
            if (child.isRenames()) {
                if (RenderSupport.isMultiRenames(child)) {
                    type.accessor(renamesGetter(child));
                    type.accessor(renamesSetter(child));
                }
                continue;
            }
            if (child.isGroup()) {
                type.nestedType(type(child));
                String name = child.getTypeName();
                if (child.isTable()) {
                    type.field(child.getIdentifier() + ": list = field(default_factory=lambda: [" + name
                            + "() for _ in range(" + child.getOccurs() + ")])");
                } else {
                    type.field(child.getIdentifier() + ": " + name + " = field(default_factory=" + name + ")");
                }
            } else if (child.isTable()) {
                type.field(child.getIdentifier() + ": list = field(default_factory=lambda: " + initial(child) + ")");
            } else {
                type.field(child.getIdentifier() + ": " + (child.getType().isNumeric() ? "Decimal" : "str") + " = "
                        + initial(child));
            }
        }
        if (group.getValue() != null) {
            type.constructorLine("self.load(" + PythonSyntax.string(Conversions.text(group.getValue(), length)) + ")");
        }

        type.imageLine("image_out = []");
        type.loadLine("load_text = _alnum(image_text, " + length + ")");
        type.loadLine("load_pos = 0");
        for (IrField child : group.getChildren()) {
            if (!RenderSupport.stored(child)) {
                continue;
            }
            String member = "self." + child.getIdentifier();
            int childLength = child.getType().getLength();
            if (child.isTable()) {
                type.imageLine("for each_element in " + member + ":");
                type.imageLine(INDENT + "image_out.append(" + image(child, "each_element") + ")");
                type.loadLine("for table_index in range(len(" + member + ")):");
                type.loadLine(INDENT + load(child, member + "[table_index]", childLength));
                type.loadLine(INDENT + "load_pos += " + childLength);
            } else {
                type.imageLine("image_out.append(" + image(child, member) + ")");
                type.loadLine(load(child, member, childLength));
                type.loadLine("load_pos += " + childLength);
            }
            if (child.isFiller()) {
                continue;
            }
            if (child.isGroup()) {
                if (child.isTable()) {
                    type.initializeLine("for each_element in " + member + ":");
                    type.initializeLine(INDENT + "each_element.initialize()");
                } else {
                    type.initializeLine(member + ".initialize()");
                }
            } else {
                String empty = PythonSyntax.constant(Conversions.empty(child.getType()));
                type.initializeLine(member + " = " + (child.isTable() ? "[" + empty + "] * " + child.getOccurs() : empty));
            }
        }
        type.imageLine("return \"\".join(image_out)");
        return type.build();
    }

    private MethodModel renamesGetter(IrField alias) {
        List<String> parts = new ArrayList<>();
        for (IrField renamed : alias.getRenamed()) {
            parts.add(image(renamed, relative(renamed)));
        }
        return MethodModel.builder()
                .name(alias.getIdentifier())
                .parameters("(self)")
                .returnType("str")
                .comment("66 " + alias.getCobolName() + " RENAMES")
                .line("return " + (parts.isEmpty() ? "\"\"" : String.join(" + ", parts)))
                .build();
    }

    private MethodModel renamesSetter(IrField alias) {
        MethodModel.MethodModelBuilder method = MethodModel.builder()
                .name(setter(alias))
                .parameters("(self, image_text)")
                .line("load_text = _alnum(image_text, " + alias.getType().getLength() + ")")
                .line("load_pos = 0");
        for (IrField renamed : alias.getRenamed()) {
            int length = renamed.getType().getLength();
            method.line(load(renamed, relative(renamed), length));
            method.line("load_pos += " + length);
        }
        return method.build();
    }

    private static String setter(IrField alias) {
        return "set_" + alias.getIdentifier();
    }

    private static String relative(IrField field) {
        List<IrField> path = field.path();
        StringBuilder ref = new StringBuilder("self");
        for (int i = 1; i < path.size(); i++) {
            ref.append('.').append(path.get(i).getIdentifier());
            if (path.get(i).isTable()) {
                ref.append("[0]");
            }
        }
        return ref.toString();
    }

    private static String image(IrField field, String ref) {
        IrType type = field.getType();
        if (field.isGroup()) {
            return ref + ".image()";
        }
        if (type.isNumeric()) {
            return "_zoned(" + ref + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits() + ", "
                    + bool(type.isSigned()) + ")";
        }
        return ref;
    }

    private static String load(IrField field, String ref, int length) {
        String segment = "load_text[load_pos:load_pos + " + length + "]";
        IrType type = field.getType();
        if (field.isGroup()) {
            return ref + ".load(" + segment + ")";
        }
        if (type.isNumeric()) {
            return ref + " = _unzoned(" + segment + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits() + ", "
                    + bool(type.isSigned()) + ")";
        }
        return ref + " = " + segment;
    }

    private static String stream(IrFile file) {
        return "self._s_" + file.getIdentifier();
    }

    private static String bool(boolean value) {
        return value ? "True" : "False";
    }

    // ------------------------------------------------------------------ units

    private MethodModel paragraph(IrParagraph paragraph) {
        MethodModel.MethodModelBuilder method = MethodModel.builder()
                .name(paragraph.getIdentifier())
                .parameters("(self)")
                .comment("Paragraph " + paragraph.getCobolName()
                        + (paragraph.getSectionName() == null ? "" : " in section " + paragraph.getSectionName()));
        if (paragraph.isBlocked()) {
            method.comment("Not translated: " + RenderSupport.commentSafe(paragraph.getBlockedReason()));
            method.line("raise RuntimeError(" + PythonSyntax.string("paragraph " + paragraph.getCobolName()
                    + " was not translated: " + paragraph.getBlockedReason()) + ")");
            return method.build();
        }
        return method.body(body(paragraph.getBody())).build();
    }

    private MethodModel region(IrRegion region) {
        MethodModel.MethodModelBuilder method = MethodModel.builder()
                .name(region.getIdentifier())
                .parameters("(self)")
                .comment("PERFORM range " + region.getKey() + " (" + region.getShape().name().toLowerCase() + ")");
        if (region.getShape() == RegionShape.IRREDUCIBLE) {
            method.line("raise RuntimeError(" + PythonSyntax.string("range " + region.getKey()
                    + " has several entries into one cycle and was not translated") + ")");
            return method.build();
        }
        return method.body(body(region.getBody())).build();
    }

    private List<String> body(IrStatement statement) {
        LineWriter saved = out;
        out = new LineWriter(INDENT);
        locals = 0;
        statement.accept(this);
        if (out.size() == 0) {
            out.line("pass");
        }
        List<String> lines = out.lines();
        out = saved;
        return lines;
    }

    /**
     * An indented suite; Python needs {@code pass} where nothing was rendered.
     */
    private void block(IrStatement statement) {
        out.indent();
        int before = out.size();
        if (statement != null) {
            statement.accept(this);
        }
        if (out.size() == before) {
            out.line("pass");
        }
        out.dedent();
    }

    private String local(String stem) {
        return stem + (++locals);
    }

    // ------------------------------------------------------------------ statements

    @Override
    public Void visitSequence(Sequence node) {
        for (IrStatement statement : node.getStatements()) {
            statement.accept(this);
            if (RenderSupport.terminates(statement)) {
                break;
            }
        }
        return null;
    }

    @Override
    public Void visitAssign(Assign node) {
        assign(node.getTarget(), node.getValue());
        return null;
    }

    @Override
    public Void visitArithmetic(Arithmetic node) {
        if (!node.isSizeErrorGuarded()) {
            for (ArithmeticStore store : node.getStores()) {
                String statement = store(store.getTarget(), num(store.getValue()), store.isRounded());
                if (RenderSupport.hasDivision(store.getValue())) {
                    out.line("try:").indent().line(statement).dedent();
                    out.line("except _SizeError as size_error_cause:").indent().line("_warn(size_error_cause)").dedent();
                } else {
                    out.line(statement);
                }
            }
            return null;
        }

        String flag = local("size_error");
        out.line(flag + " = False");
        for (ArithmeticStore store : node.getStores()) {
            String value = local("store_value");
            IrType type = RenderSupport.elementary(store.getTarget().getField()).getType();
            out.line("try:").indent();
            out.line(value + " = " + num(store.getValue()));
            out.line("if _fits(" + value + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits() + ", "
                    + mode(store.isRounded()) + "):");
            out.indent().line(store(store.getTarget(), value, store.isRounded())).dedent();
            out.line("else:").indent().line(flag + " = True").dedent();
            out.dedent().line("except _SizeError:");
            out.indent().line(flag + " = True").dedent();
        }
        if (node.getOnSizeError() != null) {
            out.line("if " + flag + ":");
            block(node.getOnSizeError());
            if (node.getNotOnSizeError() != null) {
                out.line("else:");
                block(node.getNotOnSizeError());
            }
        } else if (node.getNotOnSizeError() != null) {
            out.line("if not " + flag + ":");
            block(node.getNotOnSizeError());
        }
        return null;
    }

    @Override
    public Void visitConditional(Conditional node) {
        out.line("if " + cond(node.getCondition()) + ":");
        block(node.getThen());
        IrStatement otherwise = node.getOtherwise();
        while (otherwise instanceof Conditional) {
            Conditional next = (Conditional) otherwise;
            out.line("elif " + cond(next.getCondition()) + ":");
            block(next.getThen());
            otherwise = next.getOtherwise();
        }
        if (otherwise != null) {
            out.line("else:");
            block(otherwise);
        }
        return null;
    }

    @Override
    public Void visitLoop(Loop node) {
        switch (node.getKind()) {
            case COUNT:
                out.line("for " + local("loop_index") + " in range(" + ctl(node.getCount()) + "):");
                block(node.getBody());
                break;
            case WHILE:
                out.line("while not (" + cond(node.getUntil()) + "):");
                block(node.getBody());
                break;
            default:
                out.line("while True:");
                out.indent();
                node.getBody().accept(this);
                if (!RenderSupport.terminates(node.getBody())) {
                    out.line("if " + cond(node.getUntil()) + ":");
                    out.indent().line("break").dedent();
                }
                out.dedent();
                break;
        }
        return null;
    }

    @Override
    public Void visitCall(Call node) {
        out.line("self." + node.getIdentifier() + "()");
        return null;
    }

    @Override
    public Void visitExit(Exit node) {
        out.line("return");
        return null;
    }

    @Override
    public Void visitStop(Stop node) {
        out.line("raise _StopRun()");
        return null;
    }

    @Override
    public Void visitDisplay(Display node) {
        String text = node.getOperands().isEmpty()
                ? "\"\""
                : node.getOperands().stream().map(this::display).collect(Collectors.joining(" + "));
        out.line("print(" + text + (node.isNoAdvancing() ? ", end=\"\")" : ")"));
        return null;
    }

    @Override
    public Void visitAccept(Accept node) {
        String from = node.getFrom() == null ? "None" : PythonSyntax.string(node.getFrom());
        assignText(node.getTarget(), "_accept(" + from + ")");
        return null;
    }

    @Override
    public Void visitInitialize(Initialize node) {
        RecordAccess target = node.getTarget();
        IrField field = target.getField();
        if (RenderSupport.isMultiRenames(field)) {
            for (IrField renamed : field.getRenamed()) {
                out.line(ref(RecordAccess.of(renamed)) + " = " + PythonSyntax.constant(Conversions.empty(renamed.getType())));
            }
        } else if (field.isGroup()) {
            out.line(ref(target) + ".initialize()");
        } else {
            IrField elementary = RenderSupport.elementary(field);
            out.line(ref(access(target)) + " = " + PythonSyntax.constant(Conversions.empty(elementary.getType())));
        }
        return null;
    }

    @Override
    public Void visitFileOp(FileOp node) {
        IrFile file = node.getFile();
        String stream = stream(file);
        switch (node.getKind()) {
            case OPEN:
                out.line(stream + ".open(" + PythonSyntax.string(node.getMode().name().replace('_', '-')) + ")");
                status(file, "00");
                break;
            case CLOSE:
                out.line(stream + ".close()");
                status(file, "00");
                break;
            case READ: {
                String record = local("read_record");
                out.line(record + " = " + stream + ".read()");
                out.line("if " + record + " is None:").indent();
                int before = out.size();
                status(file, "10");
                if (node.getAtEnd() != null) {
                    node.getAtEnd().accept(this);
                }
                if (out.size() == before) {
                    out.line("pass");
                }
                out.dedent().line("else:").indent();
                status(file, "00");
                for (IrField layout : file.getRecords()) {
                    assignText(RecordAccess.of(layout), record);
                }
                if (node.getInto() != null) {
                    assignText(node.getInto(), record);
                }
                if (node.getNotAtEnd() != null) {
                    node.getNotAtEnd().accept(this);
                }
                out.dedent();
                break;
            }
            default:
                if (node.getFrom() != null) {
                    assign(node.getRecord(), node.getFrom());
                }
                out.line(stream + ".write(" + text(node.getRecord(), 0) + ")");
                status(file, "00");
                break;
        }
        return null;
    }

    @Override
    public Void visitExternalCall(ExternalCall node) {
        if (node.getSnippet() != null) {
            for (String line : node.getSnippet().split("\\R")) {
                if (!line.isBlank()) {
                    out.line("# " + RenderSupport.commentSafe(line.strip()));
                }
            }
        }
        out.line("_external(" + PythonSyntax.string(node.getName()) + ")");
        return null;
    }

    @Override
    public Void visitTagged(Tagged node) {
        for (String line : RenderSupport.tagComment(node.getEdgeCaseIds(), hints)) {
            out.line("# " + RenderSupport.commentSafe(line));
        }
        node.getStatement().accept(this);
        return null;
    }

    @Override
    public Void visitLiteral(Literal node) {
        throw unexpected(node);
    }

    @Override
    public Void visitRecordAccess(RecordAccess node) {
        throw unexpected(node);
    }

    @Override
    public Void visitControlRef(ControlRef node) {
        throw unexpected(node);
    }

    @Override
    public Void visitBinary(Binary node) {
        throw unexpected(node);
    }

    @Override
    public Void visitCompare(Compare node) {
        throw unexpected(node);
    }

    @Override
    public Void visitLogical(Logical node) {
        throw unexpected(node);
    }

    @Override
    public Void visitConditionTest(ConditionTest node) {
        throw unexpected(node);
    }

    private static IllegalStateException unexpected(IrExpression expression) {
        return new IllegalStateException("Expression in statement position: " + expression);
    }

    // ------------------------------------------------------------------ stores

    private void assign(IrExpression target, IrExpression value) {
        if (target instanceof ControlRef) {
            out.line("self." + ((ControlRef) target).getVariable().getIdentifier() + " = " + ctl(value));
            return;
        }
        RecordAccess access = (RecordAccess) target;
        IrField field = access.getField();
        int length = field.getType().getLength();
        if (RenderSupport.isMultiRenames(field)) {
            out.line(renamesOwner(access) + "." + setter(field) + "(" + text(value, length) + ")");
            return;
        }
        if (field.isGroup()) {
            out.line(ref(access) + ".load(" + text(value, length) + ")");
            return;
        }
        RecordAccess elementary = access(access);
        IrType type = elementary.getField().getType();
        String ref = ref(elementary);
        switch (type.getKind()) {
            case NUMERIC:
                out.line(ref + " = _store(" + num(value) + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits()
                        + ", " + bool(type.isSigned()) + ")");
                break;
            case EDITED:
                if (RenderSupport.isFigurative(value)) {
                    out.line(ref + " = " + text(value, type.getLength()));
                } else if (type.isNumericEdited()) {
                    out.line(ref + " = " + edited(num(value), type, false));
                } else {
                    out.line(ref + " = _alnum(_edit_text(" + text(value, 0) + ", " + PythonSyntax.string(type.getPicture())
                            + "), " + type.getLength() + ")");
                }
                break;
            default:
                if (value instanceof Literal) {
                    out.line(ref + " = " + text(value, type.getLength()));
                } else {
                    out.line(ref + " = _alnum(" + text(value, type.getLength()) + ", " + type.getLength() + ")");
                }
                break;
        }
    }

    private void assignText(RecordAccess access, String text) {
        IrField field = access.getField();
        int length = field.getType().getLength();
        if (RenderSupport.isMultiRenames(field)) {
            out.line(renamesOwner(access) + "." + setter(field) + "(" + text + ")");
            return;
        }
        if (field.isGroup()) {
            out.line(ref(access) + ".load(" + text + ")");
            return;
        }
        RecordAccess elementary = access(access);
        IrType type = elementary.getField().getType();
        String ref = ref(elementary);
        switch (type.getKind()) {
            case NUMERIC:
                out.line(ref + " = _store(_parse_digits(" + text + "), " + type.getIntegerDigits() + ", "
                        + type.getFractionDigits() + ", " + bool(type.isSigned()) + ")");
                break;
            case EDITED:
                if (type.isNumericEdited()) {
                    out.line(ref + " = " + edited("_parse_digits(" + text + ")", type, false));
                } else {
                    out.line(ref + " = _alnum(_edit_text(" + text + ", " + PythonSyntax.string(type.getPicture()) + "), "
                            + length + ")");
                }
                break;
            default:
                out.line(ref + " = _alnum(" + text + ", " + length + ")");
                break;
        }
    }

    private String store(RecordAccess target, String value, boolean rounded) {
        RecordAccess elementary = access(target);
        IrType type = elementary.getField().getType();
        if (type.isNumeric()) {
            return ref(elementary) + " = _store(" + value + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits()
                    + ", " + bool(type.isSigned()) + ", " + mode(rounded) + ")";
        }
        return ref(elementary) + " = " + edited(value, type, rounded);
    }

    private static String edited(String value, IrType type, boolean rounded) {
        return "_alnum(_edit(_store(" + value + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits()
                + ", True, " + mode(rounded) + "), " + PythonSyntax.string(type.getPicture()) + "), " + type.getLength() + ")";
    }

    private static String mode(boolean rounded) {
        return rounded ? "ROUND_HALF_UP" : "ROUND_DOWN";
    }

    private void status(IrFile file, String code) {
        if (file.getStatus() != null) {
            assign(RecordAccess.of(file.getStatus()), new Literal(LiteralValue.alphanumeric(code)));
        }
    }

    // ------------------------------------------------------------------ expressions

    private static RecordAccess access(RecordAccess access) {
        IrField elementary = RenderSupport.elementary(access.getField());
        return elementary == access.getField() ? access : RecordAccess.of(elementary);
    }

    private String ref(RecordAccess access) {
        List<IrField> path = access.getField().path();
        StringBuilder ref = new StringBuilder("self");
        int subscript = 0;
        for (IrField field : path) {
            ref.append('.').append(field.getIdentifier());
            if (field.isTable()) {
                String index = subscript < access.getSubscripts().size()
                        ? "_idx(" + num(access.getSubscripts().get(subscript)) + ", " + field.getOccurs() + ")"
                        : "0";
                subscript++;
                ref.append('[').append(index).append(']');
            }
        }
        return ref.toString();
    }

    private String renamesOwner(RecordAccess access) {
        return ref(RecordAccess.of(access.getField().getParent()));
    }

    private String num(IrExpression expression) {
        if (expression instanceof Literal) {
            return PythonSyntax.decimal(Conversions.number(Conversions.evaluate(((Literal) expression).getValue())));
        }
        if (expression instanceof ControlRef) {
            return "Decimal(" + ctl(expression) + ")";
        }
        if (expression instanceof RecordAccess) {
            RecordAccess access = (RecordAccess) expression;
            IrField field = RenderSupport.elementary(access.getField());
            if (field.getType().isNumeric() && !RenderSupport.isMultiRenames(access.getField())) {
                return ref(access(access));
            }
            return "_parse_digits(" + text(expression, 0) + ")";
        }
        if (expression instanceof Binary) {
            Binary binary = (Binary) expression;
            if (binary.type().isControl()) {
                return "Decimal(" + ctl(expression) + ")";
            }
            String left = num(binary.getLeft());
            String right = num(binary.getRight());
            switch (binary.getOp()) {
                case ADD:
                    return "(" + left + " + " + right + ")";
                case SUBTRACT:
                    return "(" + left + " - " + right + ")";
                case MULTIPLY:
                    return "(" + left + " * " + right + ")";
                case DIVIDE:
                    return "_div(" + left + ", " + right + ", " + binary.getScale() + ")";
                default:
                    return "_pow(" + left + ", " + right + ", " + binary.getScale() + ")";
            }
        }
        throw new IllegalStateException("Not a numeric operand: " + expression);
    }

    private String ctl(IrExpression expression) {
        if (expression instanceof ControlRef) {
            return "self." + ((ControlRef) expression).getVariable().getIdentifier();
        }
        if (expression instanceof Literal) {
            return String.valueOf(Conversions.number(Conversions.evaluate(((Literal) expression).getValue())).intValue());
        }
        if (expression instanceof Binary && expression.type().isControl()) {
            Binary binary = (Binary) expression;
            return "(" + ctl(binary.getLeft()) + " " + binary.getOp().symbol() + " " + ctl(binary.getRight()) + ")";
        }
        return "int(" + num(expression) + ")";
    }

    private String text(IrExpression expression, int length) {
        if (expression instanceof Literal) {
            Literal literal = (Literal) expression;
            return PythonSyntax.string(Conversions.text(Conversions.evaluate(literal.getValue()), literal.type(), length));
        }
        if (expression instanceof RecordAccess) {
            RecordAccess access = (RecordAccess) expression;
            IrField field = access.getField();
            if (RenderSupport.isMultiRenames(field)) {
                return renamesOwner(access) + "." + field.getIdentifier() + "()";
            }
            if (field.isGroup()) {
                return ref(access) + ".image()";
            }
            IrType type = RenderSupport.elementary(field).getType();
            String ref = ref(access(access));
            if (type.isNumeric()) {
                return "_digits(" + ref + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits() + ")";
            }
            return ref;
        }
        return "_digits_of(" + num(expression) + ")";
    }

    private String display(IrExpression expression) {
        if (expression instanceof Literal) {
            return PythonSyntax.string(Conversions.display(((Literal) expression).getValue(), null));
        }
        if (expression instanceof RecordAccess) {
            RecordAccess access = (RecordAccess) expression;
            IrType type = RenderSupport.elementary(access.getField()).getType();
            if (type.isNumeric() && !RenderSupport.isMultiRenames(access.getField())) {
                return "_display_num(" + ref(access(access)) + ", " + type.getIntegerDigits() + ", "
                        + type.getFractionDigits() + ")";
            }
            return text(expression, 0);
        }
        return "_plain(" + num(expression) + ")";
    }

    private String cond(IrExpression expression) {
        if (expression instanceof Compare) {
            return compare((Compare) expression);
        }
        if (expression instanceof Logical) {
            Logical logical = (Logical) expression;
            if (logical.getOp() == Logical.Op.NOT) {
                return "(not " + cond(logical.getOperands().get(0)) + ")";
            }
            String joiner = logical.getOp() == Logical.Op.AND ? " and " : " or ";
            return "(" + logical.getOperands().stream().map(this::cond).collect(Collectors.joining(joiner)) + ")";
        }
        if (expression instanceof ConditionTest) {
            return conditionTest((ConditionTest) expression);
        }
        throw new IllegalStateException("Not a condition: " + expression);
    }

    private String compare(Compare node) {
        String op = operator(node.getOp());
        IrExpression left = node.getLeft();
        IrExpression right = node.getRight();
        if (node.isNumeric()) {
            if (left.type().isControl() || right.type().isControl()) {
                if (integral(left) && integral(right)) {
                    return "(" + ctl(left) + " " + op + " " + ctl(right) + ")";
                }
            }
            return "(" + num(left) + " " + op + " " + num(right) + ")";
        }
        String l = RenderSupport.isFigurative(left) ? text(left, lengthOf(right)) : text(left, 0);
        String r = RenderSupport.isFigurative(right)
                ? text(right, RenderSupport.isFigurative(left) ? 1 : lengthOf(left))
                : text(right, 0);
        return "(_compare_text(" + l + ", " + r + ") " + op + " 0)";
    }

    private static boolean integral(IrExpression expression) {
        if (expression.type().isControl()) {
            return true;
        }
        return expression instanceof Literal
                && ((Literal) expression).getValue().getKind() == LiteralValue.Kind.NUMERIC
                && ((Literal) expression).getValue().toDecimal().stripTrailingZeros().scale() <= 0;
    }

    private static int lengthOf(IrExpression expression) {
        if (expression instanceof Literal) {
            Literal literal = (Literal) expression;
            return RenderSupport.isFigurative(expression)
                    ? 1
                    : Conversions.text(Conversions.evaluate(literal.getValue()), literal.type(), 0).length();
        }
        if (expression instanceof RecordAccess) {
            return Math.max(1, expression.type().getLength());
        }
        return 1;
    }

    private String conditionTest(ConditionTest node) {
        IrExpression subject = node.getSubject();
        switch (node.getKind()) {
            case CONDITION_NAME: {
                List<String> tests = new ArrayList<>();
                for (ConditionValue value : node.getValues()) {
                    if (value.isRange()) {
                        tests.add("(" + compareValue(subject, value.getFrom()) + " >= 0 and "
                                + compareValue(subject, value.getTo()) + " <= 0)");
                    } else {
                        tests.add("(" + compareValue(subject, value.getFrom()) + " == 0)");
                    }
                }
                return tests.isEmpty() ? "False" : "(" + String.join(" or ", tests) + ")";
            }
            case NUMERIC:
                return "_is_numeric_text(" + text(subject, 0) + ")";
            case ALPHABETIC:
                return "_is_alphabetic(" + text(subject, 0) + ", False, False)";
            case ALPHABETIC_LOWER:
                return "_is_alphabetic(" + text(subject, 0) + ", True, False)";
            case ALPHABETIC_UPPER:
                return "_is_alphabetic(" + text(subject, 0) + ", False, True)";
            case POSITIVE:
                return "(" + num(subject) + " > 0)";
            case NEGATIVE:
                return "(" + num(subject) + " < 0)";
            default:
                return "(" + num(subject) + " == 0)";
        }
    }

    /**
     * Three-way comparison of a condition name's subject with one of its values.
     */
    private String compareValue(IrExpression subject, LiteralValue value) {
        if (subject.type().isNumeric() && value.isNumeric()) {
            return "_compare_num(" + num(subject) + ", " + PythonSyntax.decimal(value.toDecimal()) + ")";
        }
        String literal;
        if (value.getKind() == LiteralValue.Kind.NUMERIC) {
            literal = Conversions.text(value.toDecimal(), null, 0);
        } else if (value.getKind() == LiteralValue.Kind.ALPHANUMERIC) {
            literal = value.getText();
        } else {
            literal = Conversions.text(value, Math.max(1, subject.type().getLength()));
        }
        return "_compare_text(" + text(subject, 0) + ", " + PythonSyntax.string(literal) + ")";
    }

    private static String operator(Compare.Op op) {
        switch (op) {
            case EQ:
                return "==";
            case NE:
                return "!=";
            case LT:
                return "<";
            case GT:
                return ">";
            case LE:
                return "<=";
            default:
                return ">=";
        }
    }
}

package com.mainframe.transpiler.codegen.java;

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
 * Renders one program. Statement visits append to the current method's lines; expressions are
 * rendered on demand in the form their context needs: a {@code BigDecimal}, a {@code String},
 * an {@code int} for control variables, or a {@code boolean}.
 *
 * Locals introduced by the rendering are camel-cased and numbered, so they never meet a
 * sanitized COBOL name, which is always lower case.
 */
class JavaUnitRenderer implements IrVisitor<Void> {
    private static final String INDENT = "    ";

    private final IrProgram program;
    private final Map<String, String> hints;
    private LineWriter out;
    private int locals;

    JavaUnitRenderer(IrProgram program, Map<String, String> hints) {
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
                unit.field("final " + record.getTypeName() + " " + record.getIdentifier() + " = new "
                        + record.getTypeName() + "();");
            } else {
                unit.field(declaration(record));
            }
        }
        for (ControlVariable variable : program.getControlVariables()) {
            unit.field("int " + variable.getIdentifier() + " = " + variable.getInitialValue() + ";");
        }
        for (IrFile file : program.getFiles()) {
            unit.field("final RecordStream " + stream(file) + ";");
            unit.constructorLine(stream(file) + " = Rt.stream(streams, " + JavaSyntax.string(file.getCobolName()) + ", "
                    + (file.getAssignment() == null ? "null" : JavaSyntax.string(file.getAssignment())) + ");");
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

    private String declaration(IrField field) {
        IrType type = field.getType();
        String javaType = type.isNumeric() ? "BigDecimal" : "String";
        String initial = JavaSyntax.constant(RenderSupport.initialValue(field));
        if (field.isTable()) {
            return "final " + javaType + "[] " + field.getIdentifier() + " = Rt." + (type.isNumeric() ? "nums" : "texts")
                    + "(" + field.getOccurs() + ", " + initial + ");";
        }
        return javaType + " " + field.getIdentifier() + " = " + initial + ";";
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
                    type.field("final " + name + "[] " + child.getIdentifier() + " = new " + name + "[" + child.getOccurs() + "];");
                    type.constructorLine("for (int tableIndex = 0; tableIndex < this." + child.getIdentifier()
                            + ".length; tableIndex++) {");
                    type.constructorLine(INDENT + "this." + child.getIdentifier() + "[tableIndex] = new " + name + "();");
                    type.constructorLine("}");
                } else {
                    type.field("final " + name + " " + child.getIdentifier() + " = new " + name + "();");
                }
            } else {
                type.field(declaration(child));
            }
        }
        if (group.getValue() != null) {
            type.constructorLine("load(" + JavaSyntax.string(Conversions.text(group.getValue(), length)) + ");");
        }

        type.imageLine("StringBuilder imageOut = new StringBuilder(" + length + ");");
        type.loadLine("String loadText = Rt.alnum(imageText, " + length + ");");
        type.loadLine("int loadPos = 0;");
        for (IrField child : group.getChildren()) {
            if (!RenderSupport.stored(child)) {
                continue;
            }
            String member = "this." + child.getIdentifier();
            int childLength = child.getType().getLength();
            if (child.isTable()) {
                type.imageLine("for (" + elementType(child) + " eachElement : " + member + ") {");
                type.imageLine(INDENT + "imageOut.append(" + image(child, "eachElement") + ");");
                type.imageLine("}");
                type.loadLine("for (int tableIndex = 0; tableIndex < " + member + ".length; tableIndex++) {");
                type.loadLine(INDENT + load(child, member + "[tableIndex]", childLength));
                type.loadLine(INDENT + "loadPos += " + childLength + ";");
                type.loadLine("}");
            } else {
                type.imageLine("imageOut.append(" + image(child, member) + ");");
                type.loadLine(load(child, member, childLength));
                type.loadLine("loadPos += " + childLength + ";");
            }
            if (child.isFiller()) {
                continue;
            }
            if (child.isGroup()) {
                if (child.isTable()) {
                    type.initializeLine("for (" + child.getTypeName() + " eachElement : " + member + ") {");
                    type.initializeLine(INDENT + "eachElement.initialize();");
                    type.initializeLine("}");
                } else {
                    type.initializeLine(member + ".initialize();");
                }
            } else {
                String empty = JavaSyntax.constant(Conversions.empty(child.getType()));
                type.initializeLine(child.isTable() ? "Arrays.fill(" + member + ", " + empty + ");" : member + " = " + empty + ";");
            }
        }
        type.imageLine("return imageOut.toString();");
        return type.build();
    }

    private MethodModel renamesGetter(IrField alias) {
        List<String> parts = new ArrayList<>();
        for (IrField renamed : alias.getRenamed()) {
            parts.add(image(renamed, relative(renamed)));
        }
        return MethodModel.builder()
                .name(alias.getIdentifier())
                .returnType("String")
                .comment("66 " + alias.getCobolName() + " RENAMES")
                .line("return " + (parts.isEmpty() ? "\"\"" : String.join(" + ", parts)) + ";")
                .build();
    }

    private MethodModel renamesSetter(IrField alias) {
        MethodModel.MethodModelBuilder method = MethodModel.builder()
                .name(alias.getIdentifier())
                .parameters("(String imageText)")
                .line("String loadText = Rt.alnum(imageText, " + alias.getType().getLength() + ");")
                .line("int loadPos = 0;");
        for (IrField renamed : alias.getRenamed()) {
            int length = renamed.getType().getLength();
            method.line(load(renamed, relative(renamed), length));
            method.line("loadPos += " + length + ";");
        }
        return method.build();
    }

    /**
     * Path of a field from inside its record's type.
     */
    private static String relative(IrField field) {
        List<IrField> path = field.path();
        StringBuilder ref = new StringBuilder("this");
        for (int i = 1; i < path.size(); i++) {
            ref.append('.').append(path.get(i).getIdentifier());
            if (path.get(i).isTable()) {
                ref.append("[0]");
            }
        }
        return ref.toString();
    }

    private static String elementType(IrField field) {
        if (field.isGroup()) {
            return field.getTypeName();
        }
        return field.getType().isNumeric() ? "BigDecimal" : "String";
    }

    private static String image(IrField field, String ref) {
        IrType type = field.getType();
        if (field.isGroup()) {
            return ref + ".image()";
        }
        if (type.isNumeric()) {
            return "Rt.zoned(" + ref + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits() + ", "
                    + type.isSigned() + ")";
        }
        return ref;
    }

    private static String load(IrField field, String ref, int length) {
        String segment = "loadText.substring(loadPos, loadPos + " + length + ")";
        IrType type = field.getType();
        if (field.isGroup()) {
            return ref + ".load(" + segment + ");";
        }
        if (type.isNumeric()) {
            return ref + " = Rt.unzoned(" + segment + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits()
                    + ", " + type.isSigned() + ");";
        }
        return ref + " = " + segment + ";";
    }

    private static String stream(IrFile file) {
        return file.getIdentifier() + "Stream";
    }

    // ------------------------------------------------------------------ units

    private MethodModel paragraph(IrParagraph paragraph) {
        MethodModel.MethodModelBuilder method = MethodModel.builder()
                .name(paragraph.getIdentifier())
                .comment("Paragraph " + paragraph.getCobolName()
                        + (paragraph.getSectionName() == null ? "" : " in section " + paragraph.getSectionName()));
        if (paragraph.isBlocked()) {
            method.comment("Not translated: " + RenderSupport.commentSafe(paragraph.getBlockedReason()));
            method.line("throw new IllegalStateException(" + JavaSyntax.string("paragraph " + paragraph.getCobolName()
                    + " was not translated: " + paragraph.getBlockedReason()) + ");");
            return method.build();
        }
        return method.body(body(paragraph.getBody())).build();
    }

    private MethodModel region(IrRegion region) {
        MethodModel.MethodModelBuilder method = MethodModel.builder()
                .name(region.getIdentifier())
                .comment("PERFORM range " + region.getKey() + " (" + region.getShape().name().toLowerCase() + ")");
        if (region.getShape() == RegionShape.IRREDUCIBLE) {
            method.line("throw new IllegalStateException(" + JavaSyntax.string("range " + region.getKey()
                    + " has several entries into one cycle and was not translated") + ");");
            return method.build();
        }
        return method.body(body(region.getBody())).build();
    }

    private List<String> body(IrStatement statement) {
        LineWriter saved = out;
        out = new LineWriter(INDENT);
        locals = 0;
        statement.accept(this);
        List<String> lines = out.lines();
        out = saved;
        return lines;
    }

    private void block(IrStatement statement) {
        out.indent();
        statement.accept(this);
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
                    out.line("try {").indent().line(statement).dedent();
                    out.line("} catch (SizeError sizeErrorCause) {").indent().line("Rt.warn(sizeErrorCause);").dedent();
                    out.line("}");
                } else {
                    out.line(statement);
                }
            }
            return null;
        }

        String flag = local("sizeError");
        out.line("boolean " + flag + " = false;");
        for (ArithmeticStore store : node.getStores()) {
            String value = local("storeValue");
            IrType type = RenderSupport.elementary(store.getTarget().getField()).getType();
            out.line("try {").indent();
            out.line("BigDecimal " + value + " = " + num(store.getValue()) + ";");
            out.line("if (Rt.fits(" + value + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits() + ", "
                    + mode(store.isRounded()) + ")) {");
            out.indent().line(store(store.getTarget(), value, store.isRounded())).dedent();
            out.line("} else {").indent().line(flag + " = true;").dedent().line("}");
            out.dedent().line("} catch (SizeError sizeErrorCause) {");
            out.indent().line(flag + " = true;").dedent().line("}");
        }
        if (node.getOnSizeError() != null) {
            out.line("if (" + flag + ") {");
            block(node.getOnSizeError());
            if (node.getNotOnSizeError() != null) {
                out.line("} else {");
                block(node.getNotOnSizeError());
            }
            out.line("}");
        } else if (node.getNotOnSizeError() != null) {
            out.line("if (!" + flag + ") {");
            block(node.getNotOnSizeError());
            out.line("}");
        }
        return null;
    }

    @Override
    public Void visitConditional(Conditional node) {
        out.line("if " + paren(cond(node.getCondition())) + " {");
        block(node.getThen());
        IrStatement otherwise = node.getOtherwise();
        while (otherwise instanceof Conditional) {
            Conditional next = (Conditional) otherwise;
            out.line("} else if " + paren(cond(next.getCondition())) + " {");
            block(next.getThen());
            otherwise = next.getOtherwise();
        }
        if (otherwise != null) {
            out.line("} else {");
            block(otherwise);
        }
        out.line("}");
        return null;
    }

    @Override
    public Void visitLoop(Loop node) {
        switch (node.getKind()) {
            case COUNT: {
                String index = local("loopIndex");
                String count = local("loopCount");
                out.line("for (int " + index + " = 0, " + count + " = " + ctl(node.getCount()) + "; " + index + " < "
                        + count + "; " + index + "++) {");
                block(node.getBody());
                out.line("}");
                break;
            }
            case WHILE:
                out.line("while (!" + paren(cond(node.getUntil())) + ") {");
                block(node.getBody());
                out.line("}");
                break;
            default:
                out.line("do {");
                block(node.getBody());
                out.line("} while (!" + paren(cond(node.getUntil())) + ");");
                break;
        }
        return null;
    }

    @Override
    public Void visitCall(Call node) {
        out.line(node.getIdentifier() + "();");
        return null;
    }

    @Override
    public Void visitExit(Exit node) {
        out.line("return;");
        return null;
    }

    @Override
    public Void visitStop(Stop node) {
        out.line("throw new StopRun();");
        return null;
    }

    @Override
    public Void visitDisplay(Display node) {
        String text = node.getOperands().isEmpty()
                ? "\"\""
                : node.getOperands().stream().map(this::display).collect(Collectors.joining(" + "));
        out.line((node.isNoAdvancing() ? "System.out.print(" : "System.out.println(") + text + ");");
        return null;
    }

    @Override
    public Void visitAccept(Accept node) {
        String from = node.getFrom() == null ? "null" : JavaSyntax.string(node.getFrom());
        assignText(node.getTarget(), "Rt.accept(" + from + ")");
        return null;
    }

    @Override
    public Void visitInitialize(Initialize node) {
        RecordAccess target = node.getTarget();
        IrField field = target.getField();
        if (RenderSupport.isMultiRenames(field)) {
            for (IrField renamed : field.getRenamed()) {
                out.line(ref(RecordAccess.of(renamed)) + " = " + JavaSyntax.constant(Conversions.empty(renamed.getType())) + ";");
            }
        } else if (field.isGroup()) {
            out.line(ref(target) + ".initialize();");
        } else {
            IrField elementary = RenderSupport.elementary(field);
            out.line(ref(access(target)) + " = " + JavaSyntax.constant(Conversions.empty(elementary.getType())) + ";");
        }
        return null;
    }

    @Override
    public Void visitFileOp(FileOp node) {
        IrFile file = node.getFile();
        String stream = stream(file);
        switch (node.getKind()) {
            case OPEN:
                out.line(stream + ".open(" + JavaSyntax.string(node.getMode().name().replace('_', '-')) + ");");
                status(file, "00");
                break;
            case CLOSE:
                out.line(stream + ".close();");
                status(file, "00");
                break;
            case READ: {
                String record = local("readRecord");
                out.line("String " + record + " = " + stream + ".read();");
                out.line("if (" + record + " == null) {").indent();
                status(file, "10");
                if (node.getAtEnd() != null) {
                    node.getAtEnd().accept(this);
                }
                out.dedent().line("} else {").indent();
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
                out.dedent().line("}");
                break;
            }
            default:
                if (node.getFrom() != null) {
                    assign(node.getRecord(), node.getFrom());
                }
                out.line(stream + ".write(" + text(node.getRecord(), 0) + ");");
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
                    out.line("// " + RenderSupport.commentSafe(line.strip()));
                }
            }
        }
        out.line("Rt.external(" + JavaSyntax.string(node.getName()) + ");");
        return null;
    }

    @Override
    public Void visitTagged(Tagged node) {
        for (String line : RenderSupport.tagComment(node.getEdgeCaseIds(), hints)) {
            out.line("// " + RenderSupport.commentSafe(line));
        }
        node.getStatement().accept(this);
        return null;
    }

    // Expressions are rendered through num / text / ctl / cond rather than visited.

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
            out.line(((ControlRef) target).getVariable().getIdentifier() + " = " + ctl(value) + ";");
            return;
        }
        RecordAccess access = (RecordAccess) target;
        IrField field = access.getField();
        int length = field.getType().getLength();
        if (RenderSupport.isMultiRenames(field)) {
            out.line(renamesOwner(access) + "." + field.getIdentifier() + "(" + text(value, length) + ");");
            return;
        }
        if (field.isGroup()) {
            out.line(ref(access) + ".load(" + text(value, length) + ");");
            return;
        }
        RecordAccess elementary = access(access);
        IrType type = elementary.getField().getType();
        String ref = ref(elementary);
        switch (type.getKind()) {
            case NUMERIC:
                out.line(ref + " = Rt.store(" + num(value) + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits()
                        + ", " + type.isSigned() + ");");
                break;
            case EDITED:
                if (RenderSupport.isFigurative(value)) {
                    out.line(ref + " = " + text(value, type.getLength()) + ";");
                } else if (type.isNumericEdited()) {
                    out.line(ref + " = " + edited(num(value), type, RoundingMode.DOWN) + ";");
                } else {
                    out.line(ref + " = Rt.alnum(Rt.editText(" + text(value, 0) + ", " + JavaSyntax.string(type.getPicture())
                            + "), " + type.getLength() + ");");
                }
                break;
            default:
                if (value instanceof Literal) {
                    out.line(ref + " = " + text(value, type.getLength()) + ";");
                } else {
                    out.line(ref + " = Rt.alnum(" + text(value, type.getLength()) + ", " + type.getLength() + ");");
                }
                break;
        }
    }

    /**
     * MOVE of text produced at run time, as ACCEPT and READ deliver it.
     */
    private void assignText(RecordAccess access, String text) {
        IrField field = access.getField();
        int length = field.getType().getLength();
        if (RenderSupport.isMultiRenames(field)) {
            out.line(renamesOwner(access) + "." + field.getIdentifier() + "(" + text + ");");
            return;
        }
        if (field.isGroup()) {
            out.line(ref(access) + ".load(" + text + ");");
            return;
        }
        RecordAccess elementary = access(access);
        IrType type = elementary.getField().getType();
        String ref = ref(elementary);
        switch (type.getKind()) {
            case NUMERIC:
                out.line(ref + " = Rt.store(Rt.parseDigits(" + text + "), " + type.getIntegerDigits() + ", "
                        + type.getFractionDigits() + ", " + type.isSigned() + ");");
                break;
            case EDITED:
                if (type.isNumericEdited()) {
                    out.line(ref + " = " + edited("Rt.parseDigits(" + text + ")", type, RoundingMode.DOWN) + ";");
                } else {
                    out.line(ref + " = Rt.alnum(Rt.editText(" + text + ", " + JavaSyntax.string(type.getPicture()) + "), "
                            + length + ");");
                }
                break;
            default:
                out.line(ref + " = Rt.alnum(" + text + ", " + length + ");");
                break;
        }
    }

    private String store(RecordAccess target, String value, boolean rounded) {
        RecordAccess elementary = access(target);
        IrType type = elementary.getField().getType();
        RoundingMode mode = rounded ? RoundingMode.HALF_UP : RoundingMode.DOWN;
        if (type.isNumeric()) {
            return ref(elementary) + " = Rt.store(" + value + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits()
                    + ", " + type.isSigned() + ", " + mode(rounded) + ");";
        }
        return ref(elementary) + " = " + edited(value, type, mode) + ";";
    }

    private static String edited(String value, IrType type, RoundingMode mode) {
        return "Rt.alnum(Rt.edit(Rt.store(" + value + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits()
                + ", true, " + mode.expression + "), " + JavaSyntax.string(type.getPicture()) + "), " + type.getLength() + ")";
    }

    private static String mode(boolean rounded) {
        return (rounded ? RoundingMode.HALF_UP : RoundingMode.DOWN).expression;
    }

    private void status(IrFile file, String code) {
        if (file.getStatus() != null) {
            assign(RecordAccess.of(file.getStatus()), new Literal(LiteralValue.alphanumeric(code)));
        }
    }

    private enum RoundingMode {
        DOWN("RoundingMode.DOWN"),
        HALF_UP("RoundingMode.HALF_UP");

        private final String expression;

        RoundingMode(String expression) {
            this.expression = expression;
        }
    }

    // ------------------------------------------------------------------ expressions

    /**
     * A single-field RENAMES alias accessed as the field it renames.
     */
    private static RecordAccess access(RecordAccess access) {
        IrField elementary = RenderSupport.elementary(access.getField());
        return elementary == access.getField() ? access : RecordAccess.of(elementary);
    }

    private String ref(RecordAccess access) {
        List<IrField> path = access.getField().path();
        StringBuilder ref = new StringBuilder();
        int subscript = 0;
        for (int i = 0; i < path.size(); i++) {
            IrField field = path.get(i);
            if (i > 0) {
                ref.append('.');
            }
            ref.append(field.getIdentifier());
            if (field.isTable()) {
                String index = subscript < access.getSubscripts().size()
                        ? "Rt.idx(" + num(access.getSubscripts().get(subscript)) + ", " + field.getOccurs() + ")"
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
            return JavaSyntax.decimal(Conversions.number(Conversions.evaluate(((Literal) expression).getValue())));
        }
        if (expression instanceof ControlRef) {
            return "BigDecimal.valueOf(" + ctl(expression) + ")";
        }
        if (expression instanceof RecordAccess) {
            RecordAccess access = (RecordAccess) expression;
            IrField field = RenderSupport.elementary(access.getField());
            if (field.getType().isNumeric() && !RenderSupport.isMultiRenames(access.getField())) {
                return ref(access(access));
            }
            return "Rt.parseDigits(" + text(expression, 0) + ")";
        }
        if (expression instanceof Binary) {
            Binary binary = (Binary) expression;
            if (binary.type().isControl()) {
                return "BigDecimal.valueOf(" + ctl(expression) + ")";
            }
            String left = num(binary.getLeft());
            String right = num(binary.getRight());
            switch (binary.getOp()) {
                case ADD:
                    return left + ".add(" + right + ")";
                case SUBTRACT:
                    return left + ".subtract(" + right + ")";
                case MULTIPLY:
                    return left + ".multiply(" + right + ")";
                case DIVIDE:
                    return "Rt.div(" + left + ", " + right + ", " + binary.getScale() + ")";
                default:
                    return "Rt.pow(" + left + ", " + right + ", " + binary.getScale() + ")";
            }
        }
        throw new IllegalStateException("Not a numeric operand: " + expression);
    }

    private String ctl(IrExpression expression) {
        if (expression instanceof ControlRef) {
            return ((ControlRef) expression).getVariable().getIdentifier();
        }
        if (expression instanceof Literal) {
            return String.valueOf(Conversions.number(Conversions.evaluate(((Literal) expression).getValue())).intValue());
        }
        if (expression instanceof Binary && expression.type().isControl()) {
            Binary binary = (Binary) expression;
            return "(" + ctl(binary.getLeft()) + " " + binary.getOp().symbol() + " " + ctl(binary.getRight()) + ")";
        }
        return num(expression) + ".intValue()";
    }

    /**
     * Text of an operand; figuratives and ALL literals are produced {@code length} long (one
     * character when 0).
     */
    private String text(IrExpression expression, int length) {
        if (expression instanceof Literal) {
            Literal literal = (Literal) expression;
            return JavaSyntax.string(Conversions.text(Conversions.evaluate(literal.getValue()), literal.type(), length));
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
                return "Rt.digits(" + ref + ", " + type.getIntegerDigits() + ", " + type.getFractionDigits() + ")";
            }
            return ref;
        }
        return "Rt.digits(" + num(expression) + ")";
    }

    private String display(IrExpression expression) {
        if (expression instanceof Literal) {
            return JavaSyntax.string(Conversions.display(((Literal) expression).getValue(), null));
        }
        if (expression instanceof RecordAccess) {
            RecordAccess access = (RecordAccess) expression;
            IrType type = RenderSupport.elementary(access.getField()).getType();
            if (type.isNumeric() && !RenderSupport.isMultiRenames(access.getField())) {
                return "Rt.displayNum(" + ref(access(access)) + ", " + type.getIntegerDigits() + ", "
                        + type.getFractionDigits() + ")";
            }
            return text(expression, 0);
        }
        return num(expression) + ".toPlainString()";
    }

    private static String paren(String condition) {
        return condition.startsWith("(") && condition.endsWith(")") && balanced(condition) ? condition : "(" + condition + ")";
    }

    private static boolean balanced(String condition) {
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < condition.length(); i++) {
            char c = condition.charAt(i);
            if (c == '"' && (i == 0 || condition.charAt(i - 1) != '\\')) {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth == 0 && i < condition.length() - 1) {
                    return false;
                }
            }
        }
        return true;
    }

    private String cond(IrExpression expression) {
        if (expression instanceof Compare) {
            return compare((Compare) expression);
        }
        if (expression instanceof Logical) {
            Logical logical = (Logical) expression;
            if (logical.getOp() == Logical.Op.NOT) {
                return "!" + paren(cond(logical.getOperands().get(0)));
            }
            String joiner = logical.getOp() == Logical.Op.AND ? " && " : " || ";
            return "(" + logical.getOperands().stream().map(this::cond).map(JavaUnitRenderer::paren)
                    .collect(Collectors.joining(joiner)) + ")";
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
            if ((left.type().isControl() || right.type().isControl()) && integral(left) && integral(right)) {
                return "(" + ctl(left) + " " + op + " " + ctl(right) + ")";
            }
            return "(" + num(left) + ".compareTo(" + num(right) + ") " + op + " 0)";
        }
        String l = RenderSupport.isFigurative(left) ? text(left, lengthOf(right)) : text(left, 0);
        String r = RenderSupport.isFigurative(right)
                ? text(right, RenderSupport.isFigurative(left) ? 1 : lengthOf(left))
                : text(right, 0);
        return "(Rt.compareText(" + l + ", " + r + ") " + op + " 0)";
    }

    private static boolean integral(IrExpression expression) {
        if (expression.type().isControl()) {
            return true;
        }
        return expression instanceof Literal
                && ((Literal) expression).getValue().getKind() == LiteralValue.Kind.NUMERIC
                && ((Literal) expression).getValue().toDecimal().stripTrailingZeros().scale() <= 0;
    }

    /**
     * Length of an operand's text, as a figurative on the other side of a comparison takes it.
     */
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
        IrType type = subject.type();
        switch (node.getKind()) {
            case CONDITION_NAME: {
                List<String> tests = new ArrayList<>();
                for (ConditionValue value : node.getValues()) {
                    if (value.isRange()) {
                        tests.add("(" + compareValue(subject, value.getFrom()) + " >= 0 && "
                                + compareValue(subject, value.getTo()) + " <= 0)");
                    } else {
                        tests.add("(" + compareValue(subject, value.getFrom()) + " == 0)");
                    }
                }
                return tests.isEmpty() ? "Boolean.FALSE" : "(" + String.join(" || ", tests) + ")";
            }
            case NUMERIC:
                return "Rt.isNumericText(" + text(subject, 0) + ")";
            case ALPHABETIC:
                return "Rt.isAlphabetic(" + text(subject, 0) + ", false, false)";
            case ALPHABETIC_LOWER:
                return "Rt.isAlphabetic(" + text(subject, 0) + ", true, false)";
            case ALPHABETIC_UPPER:
                return "Rt.isAlphabetic(" + text(subject, 0) + ", false, true)";
            case POSITIVE:
                return "(" + num(subject) + ".signum() > 0)";
            case NEGATIVE:
                return "(" + num(subject) + ".signum() < 0)";
            default:
                return "(" + num(subject) + ".signum() == 0)";
        }
    }

    private String compareValue(IrExpression subject, LiteralValue value) {
        if (subject.type().isNumeric() && value.isNumeric()) {
            return num(subject) + ".compareTo(" + JavaSyntax.decimal(value.toDecimal()) + ")";
        }
        String literal;
        if (value.getKind() == LiteralValue.Kind.NUMERIC) {
            literal = Conversions.text(value.toDecimal(), null, 0);
        } else if (value.getKind() == LiteralValue.Kind.ALPHANUMERIC) {
            literal = value.getText();
        } else {
            literal = Conversions.text(value, Math.max(1, subject.type().getLength()));
        }
        return "Rt.compareText(" + text(subject, 0) + ", " + JavaSyntax.string(literal) + ")";
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

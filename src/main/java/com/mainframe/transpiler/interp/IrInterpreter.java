package com.mainframe.transpiler.interp;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.diagnostics.TranspilerException;
import com.mainframe.transpiler.flow.RegionShape;
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
import com.mainframe.transpiler.runtime.CobolSemantics;
import com.mainframe.transpiler.runtime.InMemoryRecordStream;
import com.mainframe.transpiler.runtime.RecordStream;
import com.mainframe.transpiler.runtime.SizeErrorException;
import com.mainframe.transpiler.symbol.ConditionValue;
import com.mainframe.transpiler.symbol.LiteralValue;

import lombok.Builder;
import lombok.Singular;

/**
 * Executes an {@link IrProgram} directly, with the data semantics of {@link CobolSemantics}. It is
 * the reference the generated code is held against: the validation pass runs every translated
 * program through it, and tests compare its observable output with that of the generated unit.
 *
 * Files without a stream of their own get an empty in-memory one. ACCEPT reads the input lines
 * in order and then spaces. A run stops with a failure when it reaches a blocked paragraph or an
 * irreducible range, or after {@code stepLimit} paragraph calls and loop iterations.
 */
public class IrInterpreter {
    private static final Logger log = LoggerFactory.getLogger(IrInterpreter.class);

    public static final long DEFAULT_STEP_LIMIT = 100_000;

    private final IrProgram program;
    private final Map<String, RecordStream> streams;
    private final List<String> inputLines;
    private final long stepLimit;
    private final Clock clock;

    @Builder
    private IrInterpreter(IrProgram program, @Singular Map<String, RecordStream> streams,
                          @Singular List<String> inputLines, Long stepLimit, Clock clock) {
        this.program = program;
        this.streams = streams;
        this.inputLines = inputLines;
        this.stepLimit = stepLimit == null ? DEFAULT_STEP_LIMIT : stepLimit;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public static IrInterpreter of(IrProgram program) {
        return builder().program(program).build();
    }

    public ExecutionResult run() {
        Execution execution = new Execution();
        String failure = null;
        boolean stopped = false;
        try {
            execution.start();
        } catch (StopSignal signal) {
            stopped = true;
        } catch (ExitSignal signal) {
            log.debug("{} left its entry range through an EXIT", program.getUnitName());
        } catch (TranspilerException | ArithmeticException e) {
            failure = e.getMessage();
            log.debug("Interpreted run of {} failed: {}", program.getUnitName(), failure);
        }
        ExecutionResult result = execution.result(stopped, failure);
        log.debug("Interpreted {}: {} steps, {} of {} paragraphs executed", program.getUnitName(), result.getSteps(),
                result.executedParagraphs(), program.getParagraphs().size());
        return result;
    }

    private static final class StopSignal extends RuntimeException {
        private static final StopSignal INSTANCE = new StopSignal();

        private StopSignal() {
            super(null, null, false, false);
        }
    }

    private static final class ExitSignal extends RuntimeException {
        private static final ExitSignal INSTANCE = new ExitSignal();

        private ExitSignal() {
            super(null, null, false, false);
        }
    }

    /**
     * State of one run. Statements evaluate to null; expressions to a {@link BigDecimal}, a
     * {@link String}, a figurative {@link LiteralValue} or, for conditions, a {@link Boolean}.
     */
    private final class Execution implements IrVisitor<Object> {
        private final Storage storage = new Storage(program.getRecords());
        private final Map<String, Integer> controls = new HashMap<>();
        private final Map<String, IrParagraph> paragraphs = new HashMap<>();
        private final Map<String, Integer> counts = new LinkedHashMap<>();
        private final Map<IrFile, RecordStream> fileStreams = new IdentityHashMap<>();
        private final List<String> lines = new ArrayList<>();
        private final StringBuilder pending = new StringBuilder();
        private final List<String> externalCalls = new ArrayList<>();
        private final Iterator<String> input = inputLines.iterator();
        private long steps;

        Execution() {
            for (ControlVariable variable : program.getControlVariables()) {
                controls.put(variable.getIdentifier(), variable.getInitialValue());
            }
            for (IrParagraph paragraph : program.getParagraphs()) {
                paragraphs.put(paragraph.getIdentifier(), paragraph);
                counts.put(paragraph.getCobolName(), 0);
            }
        }

        void start() {
            if (program.getEntryRegion() == null) {
                return;
            }
            IrRegion entry = program.region(program.getEntryRegion())
                    .orElseThrow(() -> new InterpreterException("entry range " + program.getEntryRegion() + " is missing"));
            runRegion(entry);
        }

        ExecutionResult result(boolean stopped, String failure) {
            if (pending.length() > 0) {
                lines.add(pending.toString());
            }
            Map<String, List<String>> written = new LinkedHashMap<>();
            for (IrFile file : program.getFiles()) {
                RecordStream stream = fileStreams.get(file);
                if (stream instanceof InMemoryRecordStream) {
                    written.put(file.getCobolName(), List.copyOf(((InMemoryRecordStream) stream).getWritten()));
                }
            }
            return ExecutionResult.builder()
                    .displayed(List.copyOf(lines))
                    .written(written)
                    .paragraphCounts(counts)
                    .externalCalls(externalCalls)
                    .steps(steps)
                    .stopped(stopped)
                    .failure(failure)
                    .build();
        }

        // ------------------------------------------------------------------ statements

        @Override
        public Object visitSequence(Sequence node) {
            for (IrStatement statement : node.getStatements()) {
                statement.accept(this);
            }
            return null;
        }

        @Override
        public Object visitAssign(Assign node) {
            assign(node.getTarget(), node.getValue().accept(this), sourceType(node.getValue()));
            return null;
        }

        @Override
        public Object visitArithmetic(Arithmetic node) {
            boolean sizeError = false;
            for (ArithmeticStore store : node.getStores()) {
                BigDecimal value;
                try {
                    value = Conversions.number(store.getValue().accept(this));
                } catch (SizeErrorException e) {
                    if (!node.isSizeErrorGuarded()) {
                        log.warn("{} in {} without ON SIZE ERROR: {}; target left unchanged", node.getVerb(),
                                program.getUnitName(), e.getMessage());
                    }
                    sizeError = true;
                    continue;
                }
                IrField target = elementary(store.getTarget().getField());
                List<Integer> index = target == store.getTarget().getField() ? subscripts(store.getTarget()) : List.of();
                IrType type = target.getType();
                RoundingMode mode = store.isRounded() ? RoundingMode.HALF_UP : RoundingMode.DOWN;
                if (node.isSizeErrorGuarded()
                        && !CobolSemantics.fits(value, type.getIntegerDigits(), type.getFractionDigits(), mode)) {
                    sizeError = true;
                    continue;
                }
                boolean signed = !type.isNumeric() || type.isSigned();
                BigDecimal stored = CobolSemantics.store(value, type.getIntegerDigits(), type.getFractionDigits(), signed, mode);
                storage.put(target, index, type.isNumeric() ? stored : Conversions.move(stored, null, type));
            }
            if (node.isSizeErrorGuarded()) {
                run(sizeError ? node.getOnSizeError() : node.getNotOnSizeError());
            }
            return null;
        }

        @Override
        public Object visitConditional(Conditional node) {
            if (truth(node.getCondition())) {
                node.getThen().accept(this);
            } else {
                run(node.getOtherwise());
            }
            return null;
        }

        @Override
        public Object visitLoop(Loop node) {
            switch (node.getKind()) {
                case COUNT: {
                    int times = Conversions.number(node.getCount().accept(this)).intValue();
                    for (int i = 0; i < times; i++) {
                        tick();
                        node.getBody().accept(this);
                    }
                    break;
                }
                case WHILE:
                    while (!truth(node.getUntil())) {
                        tick();
                        node.getBody().accept(this);
                    }
                    break;
                default:
                    do {
                        tick();
                        node.getBody().accept(this);
                    } while (!truth(node.getUntil()));
                    break;
            }
            return null;
        }

        @Override
        public Object visitCall(Call node) {
            if (node.getTarget() == Call.Target.REGION) {
                IrRegion region = program.region(node.getIdentifier())
                        .orElseThrow(() -> new InterpreterException("range unit " + node.getIdentifier() + " is missing"));
                runRegion(region);
                return null;
            }
            IrParagraph paragraph = paragraphs.get(node.getIdentifier());
            if (paragraph == null) {
                throw new InterpreterException("paragraph unit " + node.getIdentifier() + " is missing");
            }
            tick();
            counts.merge(paragraph.getCobolName(), 1, Integer::sum);
            if (paragraph.isBlocked()) {
                throw new InterpreterException("paragraph " + paragraph.getCobolName() + " is blocked: "
                        + paragraph.getBlockedReason());
            }
            try {
                paragraph.getBody().accept(this);
            } catch (ExitSignal signal) {
                log.trace("Left {} early", paragraph.getCobolName());
            }
            return null;
        }

        @Override
        public Object visitExit(Exit node) {
            throw ExitSignal.INSTANCE;
        }

        @Override
        public Object visitStop(Stop node) {
            throw StopSignal.INSTANCE;
        }

        @Override
        public Object visitDisplay(Display node) {
            StringBuilder line = new StringBuilder();
            for (IrExpression operand : node.getOperands()) {
                if (operand instanceof Literal) {
                    line.append(Conversions.display(((Literal) operand).getValue(), null));
                } else {
                    line.append(Conversions.display(operand.accept(this), sourceType(operand)));
                }
            }
            pending.append(line);
            if (!node.isNoAdvancing()) {
                lines.add(pending.toString());
                pending.setLength(0);
            }
            return null;
        }

        @Override
        public Object visitAccept(Accept node) {
            String text = node.getFrom() == null ? nextInput() : special(node.getFrom());
            assign(node.getTarget(), text, IrType.alphanumeric(text.length()));
            return null;
        }

        @Override
        public Object visitInitialize(Initialize node) {
            storage.initialize(node.getTarget().getField(), subscripts(node.getTarget()));
            return null;
        }

        @Override
        public Object visitFileOp(FileOp node) {
            IrFile file = node.getFile();
            RecordStream stream = stream(file);
            switch (node.getKind()) {
                case OPEN:
                    stream.open(node.getMode().name().replace('_', '-'));
                    status(file, "00");
                    break;
                case CLOSE:
                    stream.close();
                    status(file, "00");
                    break;
                case READ: {
                    String record = stream.read();
                    if (record == null) {
                        status(file, "10");
                        run(node.getAtEnd());
                        break;
                    }
                    status(file, "00");
                    for (IrField layout : file.getRecords()) {
                        storage.load(layout, List.of(), record);
                    }
                    if (node.getInto() != null) {
                        assign(node.getInto(), record, IrType.alphanumeric(record.length()));
                    }
                    run(node.getNotAtEnd());
                    break;
                }
                default: {
                    RecordAccess record = node.getRecord();
                    if (node.getFrom() != null) {
                        assign(record, node.getFrom().accept(this), sourceType(node.getFrom()));
                    }
                    stream.write(storage.image(record.getField(), subscripts(record)));
                    status(file, "00");
                    break;
                }
            }
            return null;
        }

        @Override
        public Object visitExternalCall(ExternalCall node) {
            externalCalls.add(node.getName());
            log.info("Skipping external call {} in {}", node.getName(), program.getUnitName());
            return null;
        }

        @Override
        public Object visitTagged(Tagged node) {
            return node.getStatement().accept(this);
        }

        // ------------------------------------------------------------------ expressions

        @Override
        public Object visitLiteral(Literal node) {
            return Conversions.evaluate(node.getValue());
        }

        @Override
        public Object visitRecordAccess(RecordAccess node) {
            IrField field = node.getField();
            IrField target = elementary(field);
            if (target != field) {
                return storage.get(target, List.of());
            }
            if (field.isGroup() || field.isRenames()) {
                return storage.image(field, subscripts(node));
            }
            return storage.get(field, subscripts(node));
        }

        @Override
        public Object visitControlRef(ControlRef node) {
            return BigDecimal.valueOf(controls.getOrDefault(node.getVariable().getIdentifier(), 0));
        }

        @Override
        public Object visitBinary(Binary node) {
            BigDecimal left = Conversions.number(node.getLeft().accept(this));
            BigDecimal right = Conversions.number(node.getRight().accept(this));
            switch (node.getOp()) {
                case ADD:
                    return left.add(right);
                case SUBTRACT:
                    return left.subtract(right);
                case MULTIPLY:
                    return left.multiply(right);
                case DIVIDE:
                    return CobolSemantics.divide(left, right, node.getScale());
                default:
                    return CobolSemantics.power(left, right, node.getScale());
            }
        }

        @Override
        public Object visitCompare(Compare node) {
            Object left = node.getLeft().accept(this);
            Object right = node.getRight().accept(this);
            int comparison;
            if (node.isNumeric()) {
                comparison = Conversions.number(left).compareTo(Conversions.number(right));
            } else {
                comparison = compareText(left, sourceType(node.getLeft()), right, sourceType(node.getRight()));
            }
            return node.getOp().test(comparison);
        }

        @Override
        public Object visitLogical(Logical node) {
            switch (node.getOp()) {
                case NOT:
                    return !truth(node.getOperands().get(0));
                case AND:
                    for (IrExpression operand : node.getOperands()) {
                        if (!truth(operand)) {
                            return false;
                        }
                    }
                    return true;
                default:
                    for (IrExpression operand : node.getOperands()) {
                        if (truth(operand)) {
                            return true;
                        }
                    }
                    return false;
            }
        }

        @Override
        public Object visitConditionTest(ConditionTest node) {
            Object subject = node.getSubject().accept(this);
            IrType type = node.getSubject().type();
            switch (node.getKind()) {
                case CONDITION_NAME:
                    for (ConditionValue value : node.getValues()) {
                        if (matches(subject, type, value)) {
                            return true;
                        }
                    }
                    return false;
                case NUMERIC:
                    return type.isNumeric() || CobolSemantics.isNumericText(Conversions.text(subject, type, 0));
                case ALPHABETIC:
                    return CobolSemantics.isAlphabetic(Conversions.text(subject, type, 0), false, false);
                case ALPHABETIC_LOWER:
                    return CobolSemantics.isAlphabetic(Conversions.text(subject, type, 0), true, false);
                case ALPHABETIC_UPPER:
                    return CobolSemantics.isAlphabetic(Conversions.text(subject, type, 0), false, true);
                case POSITIVE:
                    return Conversions.number(subject).signum() > 0;
                case NEGATIVE:
                    return Conversions.number(subject).signum() < 0;
                default:
                    return Conversions.number(subject).signum() == 0;
            }
        }

        // ------------------------------------------------------------------ helpers

        private void run(IrStatement statement) {
            if (statement != null) {
                statement.accept(this);
            }
        }

        private void runRegion(IrRegion region) {
            if (region.getShape() == RegionShape.IRREDUCIBLE) {
                throw new InterpreterException("range " + region.getKey() + " has several entries into one cycle");
            }
            region.getBody().accept(this);
        }

        private boolean truth(IrExpression condition) {
            return (Boolean) condition.accept(this);
        }

        private void tick() {
            if (++steps > stepLimit) {
                throw new InterpreterException("step limit of " + stepLimit + " exceeded");
            }
        }

        private void assign(IrExpression target, Object value, IrType source) {
            if (target instanceof ControlRef) {
                controls.put(((ControlRef) target).getVariable().getIdentifier(), Conversions.number(value).intValue());
                return;
            }
            RecordAccess access = (RecordAccess) target;
            IrField field = access.getField();
            IrField elementary = elementary(field);
            if (elementary != field) {
                storage.put(elementary, List.of(), Conversions.move(value, source, elementary.getType()));
            } else if (field.isGroup() || field.isRenames()) {
                storage.load(field, subscripts(access), Conversions.text(value, source, field.getType().getLength()));
            } else {
                storage.put(field, subscripts(access), Conversions.move(value, source, field.getType()));
            }
        }

        /**
         * A RENAMES alias of a single field stands for that field.
         */
        private IrField elementary(IrField field) {
            if (field.isRenames() && field.getRenamed().size() == 1) {
                return field.getRenamed().get(0);
            }
            return field;
        }

        private List<Integer> subscripts(RecordAccess access) {
            if (access.getSubscripts().isEmpty()) {
                return List.of();
            }
            List<IrField> tables = new ArrayList<>();
            for (IrField field : access.getField().path()) {
                if (field.isTable()) {
                    tables.add(field);
                }
            }
            List<Integer> index = new ArrayList<>();
            for (int i = 0; i < access.getSubscripts().size(); i++) {
                int k = Conversions.number(access.getSubscripts().get(i).accept(this)).intValue();
                IrField table = tables.get(i);
                if (k < 1 || k > table.getOccurs()) {
                    throw new InterpreterException("subscript " + k + " out of range for " + table.getCobolName()
                            + " (1.." + table.getOccurs() + ")");
                }
                index.add(k);
            }
            return index;
        }

        private int compareText(Object left, IrType leftType, Object right, IrType rightType) {
            boolean leftFigurative = left instanceof LiteralValue;
            boolean rightFigurative = right instanceof LiteralValue;
            String l = leftFigurative ? null : Conversions.text(left, leftType, 0);
            String r = rightFigurative ? null : Conversions.text(right, rightType, 0);
            if (leftFigurative) {
                l = Conversions.text((LiteralValue) left, r == null ? 1 : r.length());
            }
            if (rightFigurative) {
                r = Conversions.text((LiteralValue) right, l.length());
            }
            return CobolSemantics.compareText(l, r);
        }

        private boolean matches(Object subject, IrType type, ConditionValue value) {
            if (!value.isRange()) {
                return compareValue(subject, type, value.getFrom()) == 0;
            }
            return compareValue(subject, type, value.getFrom()) >= 0 && compareValue(subject, type, value.getTo()) <= 0;
        }

        private int compareValue(Object subject, IrType type, LiteralValue value) {
            if (type.isNumeric() && value.isNumeric()) {
                return Conversions.number(subject).compareTo(value.toDecimal());
            }
            Object literal = value.getKind() == LiteralValue.Kind.ALPHANUMERIC ? value.getText() : value;
            if (value.getKind() == LiteralValue.Kind.NUMERIC) {
                literal = value.toDecimal();
            }
            return compareText(subject, type, literal, null);
        }

        private IrType sourceType(IrExpression expression) {
            if (expression instanceof Binary || expression instanceof ControlRef) {
                return null;
            }
            return expression.type();
        }

        private RecordStream stream(IrFile file) {
            return fileStreams.computeIfAbsent(file, f -> {
                RecordStream stream = streams.get(f.getCobolName());
                if (stream == null && f.getAssignment() != null) {
                    stream = streams.get(f.getAssignment());
                }
                return stream != null ? stream : new InMemoryRecordStream();
            });
        }

        private void status(IrFile file, String code) {
            if (file.getStatus() != null) {
                storage.put(file.getStatus(), List.of(), Conversions.move(code, null, file.getStatus().getType()));
            }
        }

        private String nextInput() {
            return input.hasNext() ? input.next() : "";
        }

        private String special(String from) {
            LocalDateTime now = LocalDateTime.now(clock);
            switch (from) {
                case "DATE":
                    return now.format(DateTimeFormatter.ofPattern("yyMMdd"));
                case "DATE YYYYMMDD":
                    return now.format(DateTimeFormatter.ofPattern("yyyyMMdd"));
                case "DAY":
                    return now.format(DateTimeFormatter.ofPattern("yyDDD"));
                case "DAY YYYYDDD":
                    return now.format(DateTimeFormatter.ofPattern("yyyyDDD"));
                case "DAY-OF-WEEK":
                    return String.valueOf(now.getDayOfWeek().getValue());
                case "TIME":
                    return now.format(DateTimeFormatter.ofPattern("HHmmss"))
                            + String.format("%02d", now.getNano() / 10_000_000);
                default:
                    return nextInput();
            }
        }
    }
}

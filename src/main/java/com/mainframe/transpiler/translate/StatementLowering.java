package com.mainframe.transpiler.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.diagnostics.SemanticErrorKind;
import com.mainframe.transpiler.edgecase.EdgeCase;
import com.mainframe.transpiler.edgecase.EdgeCaseReport;
import com.mainframe.transpiler.flow.ControlFlowResolver;
import com.mainframe.transpiler.flow.FlowAnalysis;
import com.mainframe.transpiler.flow.FlowNode;
import com.mainframe.transpiler.flow.PerformSite;
import com.mainframe.transpiler.flow.Region;
import com.mainframe.transpiler.flow.RegionShape;
import com.mainframe.transpiler.ir.Accept;
import com.mainframe.transpiler.ir.Arithmetic;
import com.mainframe.transpiler.ir.ArithmeticStore;
import com.mainframe.transpiler.ir.Assign;
import com.mainframe.transpiler.ir.Binary;
import com.mainframe.transpiler.ir.Call;
import com.mainframe.transpiler.ir.Compare;
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
import com.mainframe.transpiler.ir.IrStatement;
import com.mainframe.transpiler.ir.Literal;
import com.mainframe.transpiler.ir.Logical;
import com.mainframe.transpiler.ir.Loop;
import com.mainframe.transpiler.ir.RecordAccess;
import com.mainframe.transpiler.ir.Sequence;
import com.mainframe.transpiler.ir.Stop;
import com.mainframe.transpiler.ir.Tagged;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LiteralKind;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.StatementNode;
import com.mainframe.transpiler.symbol.ConditionNameType;
import com.mainframe.transpiler.symbol.DataItem;
import com.mainframe.transpiler.symbol.FileDefinition;

import lombok.Getter;

/**
 * Lowers the statements of one paragraph at a time. Any {@link LoweringException} abandons the
 * whole paragraph; the caller turns it into a blocked unit.
 */
class StatementLowering {
    private static final Logger log = LoggerFactory.getLogger(StatementLowering.class);

    private final FlowAnalysis flow;
    private final EdgeCaseReport edgeCases;
    private final ExpressionLowering expressions;
    private final Map<FlowNode, String> paragraphIds;
    private final Map<String, String> regionIds;
    private final Map<String, IrFile> files;
    private final ControlVariable jump;

    /** Keys of the regions some PERFORM calls as a unit. */
    @Getter
    private final Set<String> calledRegions;

    @Getter
    private boolean jumpUsed;

    private FlowNode current;

    StatementLowering(FlowAnalysis flow, EdgeCaseReport edgeCases, ExpressionLowering expressions,
                      Map<FlowNode, String> paragraphIds, Map<String, String> regionIds, Map<String, IrFile> files,
                      ControlVariable jump, Set<String> calledRegions) {
        this.flow = flow;
        this.edgeCases = edgeCases;
        this.expressions = expressions;
        this.paragraphIds = paragraphIds;
        this.regionIds = regionIds;
        this.files = files;
        this.jump = jump;
        this.calledRegions = calledRegions;
    }

    IrStatement paragraph(FlowNode node) {
        current = node;
        return lowerAll(node.getStatements());
    }

    IrStatement lowerAll(List<StatementNode> statements) {
        List<IrStatement> out = new ArrayList<>();
        for (StatementNode statement : statements) {
            IrStatement lowered = lower(statement);
            if (!(lowered instanceof Sequence sequence && sequence.isEmpty())) {
                out.add(lowered);
            }
        }
        return out.size() == 1 ? out.get(0) : new Sequence(List.copyOf(out));
    }

    private IrStatement lower(StatementNode statement) {
        IrStatement lowered = lowerVerb(statement);
        List<EdgeCase> cases = edgeCases.forStatement(statement);
        if (cases.isEmpty()) {
            return lowered;
        }
        return new Tagged(cases.stream().map(EdgeCase::getId).toList(), lowered);
    }

    private IrStatement lowerVerb(StatementNode statement) {
        switch (statement.getVerb()) {
            case "MOVE":
                return move(statement);
            case "INITIALIZE":
                return initialize(statement);
            case "SET":
                return set(statement);
            case "ADD":
            case "SUBTRACT":
            case "MULTIPLY":
            case "DIVIDE":
            case "COMPUTE":
                return arithmetic(statement);
            case "IF":
                return ifStatement(statement);
            case "EVALUATE":
                return evaluate(statement);
            case "PERFORM":
                return perform(statement);
            case "GO":
                return goTo(statement);
            case "STOP":
            case "GOBACK":
                return Stop.INSTANCE;
            case "EXIT":
                return exit(statement);
            case "CONTINUE":
            case "NEXT-SENTENCE":
                return Sequence.empty();
            case "DISPLAY":
                return display(statement);
            case "ACCEPT":
                return accept(statement);
            case "OPEN":
                return open(statement);
            case "CLOSE":
                return close(statement);
            case "READ":
                return read(statement);
            case "WRITE":
                return write(statement);
            case "CALL":
                return call(statement);
            case StatementNode.UNPARSED:
                throw new LoweringException("statement at " + statement.getSpan().location() + " did not parse");
            default:
                // EXEC, SORT, MERGE, ALTER and unrecognized verbs keep their source for augmentation
                return new ExternalCall(statement.getVerb(), List.of(), statement.toSourceText());
        }
    }

    // ------------------------------------------------------------------ data movement

    private IrStatement move(StatementNode statement) {
        LstNode sourceNode = firstValue(statement.clause(ClauseRole.SOURCES));
        boolean corresponding = statement.clause(ClauseRole.OPTIONS)
                .map(c -> "CORRESPONDING".equals(c.getOperator()))
                .orElse(false);
        IrExpression source = expressions.operand(sourceNode);
        List<IrStatement> out = new ArrayList<>();
        for (ClauseNode target : references(statement.clause(ClauseRole.TARGETS))) {
            RecordAccess access = expressions.access(target);
            if (corresponding) {
                if (!(source instanceof RecordAccess group) || !group.getField().isGroup() || !access.getField().isGroup()) {
                    throw expressions.typeMismatch(target, "MOVE CORRESPONDING needs two group items");
                }
                int before = out.size();
                moveCorresponding(group, access, out);
                if (out.size() == before) {
                    log.warn("MOVE CORRESPONDING at {} pairs no fields", statement.getSpan().location());
                }
            } else {
                out.add(new Assign(access, source));
            }
        }
        return out.size() == 1 ? out.get(0) : new Sequence(List.copyOf(out));
    }

    /**
     * Pairs subordinate items of the same name; groups on both sides recurse, tables,
     * REDEFINES and FILLER take no part.
     */
    private static void moveCorresponding(RecordAccess source, RecordAccess target, List<IrStatement> out) {
        for (IrField to : target.getField().getChildren()) {
            if (!corresponds(to)) {
                continue;
            }
            for (IrField from : source.getField().getChildren()) {
                if (!corresponds(from) || !from.getCobolName().equals(to.getCobolName())) {
                    continue;
                }
                RecordAccess fromAccess = new RecordAccess(from, source.getSubscripts());
                RecordAccess toAccess = new RecordAccess(to, target.getSubscripts());
                if (from.isGroup() && to.isGroup()) {
                    moveCorresponding(fromAccess, toAccess, out);
                } else {
                    out.add(new Assign(toAccess, fromAccess));
                }
            }
        }
    }

    private static boolean corresponds(IrField field) {
        return !field.isFiller() && !field.isRenames() && field.getRedefines() == null && !field.isTable();
    }

    private IrStatement initialize(StatementNode statement) {
        List<IrStatement> out = new ArrayList<>();
        for (ClauseNode target : references(statement.clause(ClauseRole.TARGETS))) {
            out.add(new Initialize(expressions.access(target)));
        }
        return out.size() == 1 ? out.get(0) : new Sequence(List.copyOf(out));
    }

    private IrStatement set(StatementNode statement) {
        Optional<ClauseNode> value = statement.clause(ClauseRole.VALUE);
        Optional<ClauseNode> by = statement.clause(ClauseRole.BY);
        List<IrStatement> out = new ArrayList<>();
        for (ClauseNode target : references(statement.clause(ClauseRole.TARGETS))) {
            if (value.isPresent() && "TRUE".equals(value.get().getOperator())) {
                DataItem item = expressions.resolve(target);
                if (!(item.getType() instanceof ConditionNameType condition)) {
                    throw expressions.typeMismatch(target, item.getName() + " is not a condition name");
                }
                out.add(new Assign(expressions.access(item, target), new Literal(condition.trueValue())));
            } else if (value.isPresent() && "FALSE".equals(value.get().getOperator())) {
                throw expressions.typeMismatch(target, "SET " + target.toSourceText() + " TO FALSE has no false value to store");
            } else if (value.isPresent()) {
                out.add(new Assign(expressions.access(target), expressions.operand(firstValue(value))));
            } else if (by.isPresent()) {
                RecordAccess access = expressions.access(target);
                Binary.Op op = "DOWN".equals(by.get().getOperator()) ? Binary.Op.SUBTRACT : Binary.Op.ADD;
                out.add(new Assign(access, ExpressionLowering.binary(op, access, expressions.operand(firstValue(by)), 0)));
            }
        }
        return out.size() == 1 ? out.get(0) : new Sequence(List.copyOf(out));
    }

    // ------------------------------------------------------------------ arithmetic

    private IrStatement arithmetic(StatementNode statement) {
        String verb = statement.getVerb();
        List<LstNode> sources = statement.clause(ClauseRole.SOURCES).map(ExpressionLowering::values).orElse(List.of());
        Optional<ClauseNode> targets = statement.clause(ClauseRole.TARGETS);
        Optional<ClauseNode> operand = statement.clause(ClauseRole.OPERAND);
        List<ClauseNode> giving = statement.clause(ClauseRole.GIVING)
                .map(c -> c.clauses(ClauseRole.TARGET))
                .orElse(List.of());

        List<ArithmeticStore> stores = new ArrayList<>();
        switch (verb) {
            case "ADD":
                if (targets.isPresent()) {
                    for (ClauseNode target : targets.get().clauses(ClauseRole.TARGET)) {
                        RecordAccess access = receiving(target);
                        stores.add(store(target, access, add(access, sum(sources))));
                    }
                } else {
                    IrExpression total = sum(sources);
                    if (operand.isPresent()) {
                        total = add(total, expressions.operand(firstValue(operand)));
                    }
                    for (ClauseNode target : giving) {
                        stores.add(store(target, receiving(target), total));
                    }
                }
                break;
            case "SUBTRACT":
                if (targets.isPresent()) {
                    for (ClauseNode target : targets.get().clauses(ClauseRole.TARGET)) {
                        RecordAccess access = receiving(target);
                        stores.add(store(target, access, ExpressionLowering.binary(Binary.Op.SUBTRACT, access, sum(sources), 0)));
                    }
                } else {
                    IrExpression minuend = expressions.operand(firstValue(operand));
                    for (ClauseNode target : giving) {
                        stores.add(store(target, receiving(target),
                                ExpressionLowering.binary(Binary.Op.SUBTRACT, minuend, sum(sources), 0)));
                    }
                }
                break;
            case "MULTIPLY": {
                IrExpression multiplier = expressions.operand(sources.get(0));
                if (targets.isPresent()) {
                    for (ClauseNode target : targets.get().clauses(ClauseRole.TARGET)) {
                        RecordAccess access = receiving(target);
                        stores.add(store(target, access, ExpressionLowering.binary(Binary.Op.MULTIPLY, multiplier, access, 0)));
                    }
                } else {
                    IrExpression multiplicand = expressions.operand(firstValue(operand));
                    for (ClauseNode target : giving) {
                        stores.add(store(target, receiving(target),
                                ExpressionLowering.binary(Binary.Op.MULTIPLY, multiplier, multiplicand, 0)));
                    }
                }
                break;
            }
            case "DIVIDE":
                divide(statement, sources, targets, operand, giving, stores);
                break;
            default: {
                LstNode expression = firstValue(statement.clause(ClauseRole.EXPRESSION));
                for (ClauseNode target : targets.map(c -> c.clauses(ClauseRole.TARGET)).orElse(List.of())) {
                    RecordAccess access = receiving(target);
                    stores.add(store(target, access, expressions.arithmetic(expression, access.type().getFractionDigits())));
                }
                break;
            }
        }

        Optional<ClauseNode> onSizeError = statement.clause(ClauseRole.ON_SIZE_ERROR);
        Optional<ClauseNode> notOnSizeError = statement.clause(ClauseRole.NOT_ON_SIZE_ERROR);
        return new Arithmetic(verb, List.copyOf(stores), onSizeError.isPresent() || notOnSizeError.isPresent(),
                onSizeError.map(this::nested).orElse(null),
                notOnSizeError.map(this::nested).orElse(null));
    }

    private void divide(StatementNode statement, List<LstNode> sources, Optional<ClauseNode> targets,
                        Optional<ClauseNode> operand, List<ClauseNode> giving, List<ArithmeticStore> stores) {
        IrExpression first = expressions.operand(sources.get(0));
        if (targets.isPresent()) {
            for (ClauseNode target : targets.get().clauses(ClauseRole.TARGET)) {
                RecordAccess access = receiving(target);
                stores.add(store(target, access, quotient(access, first, access)));
            }
            return;
        }
        IrExpression second = expressions.operand(firstValue(operand));
        boolean into = "INTO".equals(operand.map(ClauseNode::getOperator).orElse("INTO"));
        IrExpression dividend = into ? second : first;
        IrExpression divisor = into ? first : second;
        RecordAccess firstQuotient = null;
        for (ClauseNode target : giving) {
            RecordAccess access = receiving(target);
            if (firstQuotient == null) {
                firstQuotient = access;
            }
            stores.add(store(target, access, quotient(access, dividend, divisor)));
        }
        Optional<ClauseNode> remainder = statement.clause(ClauseRole.REMAINDER);
        if (remainder.isPresent() && firstQuotient != null) {
            ClauseNode reference = references(remainder).get(0);
            RecordAccess access = expressions.numericTarget(reference);
            IrExpression product = ExpressionLowering.binary(Binary.Op.MULTIPLY, firstQuotient, divisor, 0);
            stores.add(new ArithmeticStore(access, ExpressionLowering.binary(Binary.Op.SUBTRACT, dividend, product, 0), false));
        }
    }

    private static IrExpression quotient(RecordAccess target, IrExpression dividend, IrExpression divisor) {
        return ExpressionLowering.binary(Binary.Op.DIVIDE, dividend, divisor, target.type().getFractionDigits());
    }

    private IrExpression sum(List<LstNode> operands) {
        IrExpression total = null;
        for (LstNode operand : operands) {
            IrExpression value = expressions.operand(operand);
            total = total == null ? value : add(total, value);
        }
        return total == null ? Literal.number(0) : total;
    }

    private static IrExpression add(IrExpression left, IrExpression right) {
        return ExpressionLowering.binary(Binary.Op.ADD, left, right, 0);
    }

    private RecordAccess receiving(ClauseNode target) {
        return expressions.numericTarget(target.clause(ClauseRole.REFERENCE)
                .orElseThrow(() -> new LoweringException("arithmetic target without a reference")));
    }

    private static ArithmeticStore store(ClauseNode target, RecordAccess access, IrExpression value) {
        return new ArithmeticStore(access, value, "ROUNDED".equals(target.getOperator()));
    }

    // ------------------------------------------------------------------ control

    private IrStatement ifStatement(StatementNode statement) {
        IrExpression condition = expressions.condition(firstValue(statement.clause(ClauseRole.CONDITION)));
        IrStatement then = lowerAll(statement.body(ClauseRole.THEN));
        IrStatement otherwise = statement.hasClause(ClauseRole.ELSE) ? lowerAll(statement.body(ClauseRole.ELSE)) : null;
        return new Conditional(condition, then, otherwise);
    }

    private IrStatement evaluate(StatementNode statement) {
        ClauseNode subject = statement.clause(ClauseRole.SUBJECT)
                .orElseThrow(() -> new LoweringException("EVALUATE without subject"));
        String mode = subject.getOperator();
        LstNode subjectNode = mode == null ? firstValue(Optional.of(subject)) : null;

        List<IrExpression> conditions = new ArrayList<>();
        List<IrStatement> bodies = new ArrayList<>();
        List<IrExpression> pending = new ArrayList<>();
        boolean anyPending = false;
        IrStatement other = null;

        for (ClauseNode branch : statement.getChildren().stream()
                .filter(ClauseNode.class::isInstance)
                .map(ClauseNode.class::cast)
                .filter(c -> c.getRole() == ClauseRole.WHEN || c.getRole() == ClauseRole.WHEN_OTHER)
                .toList()) {
            List<StatementNode> body = branch.childrenOfType(StatementNode.class);
            if (branch.getRole() == ClauseRole.WHEN_OTHER) {
                other = lowerAll(body);
                break;
            }
            IrExpression selected = selection(branch.subClauses().get(0), mode, subjectNode);
            if (selected == null) {
                anyPending = true;
            } else {
                pending.add(selected);
            }
            if (body.isEmpty()) {
                continue;
            }
            if (anyPending) {
                other = lowerAll(body);
                break;
            }
            conditions.add(pending.size() == 1 ? pending.get(0) : new Logical(Logical.Op.OR, List.copyOf(pending)));
            bodies.add(lowerAll(body));
            pending.clear();
        }

        IrStatement result = other;
        for (int i = conditions.size() - 1; i >= 0; i--) {
            result = new Conditional(conditions.get(i), bodies.get(i), result);
        }
        return result == null ? Sequence.empty() : result;
    }

    /**
     * The condition a WHEN selects on; null for ANY.
     */
    private IrExpression selection(ClauseNode selector, String mode, LstNode subjectNode) {
        if (selector.getRole() == ClauseRole.CONDITION) {
            IrExpression condition = expressions.condition(firstValue(Optional.of(selector)));
            return "FALSE".equals(mode) ? Logical.not(condition) : condition;
        }
        if ("ANY".equals(selector.getOperator())) {
            return null;
        }
        if (subjectNode == null) {
            throw new LoweringException("WHEN value without an EVALUATE subject at " + selector.getSpan().location());
        }
        boolean negated = "NOT".equals(selector.getOperator());
        List<LstNode> values = ExpressionLowering.values(selector);
        IrExpression result;
        if (selector.getRole() == ClauseRole.RANGE) {
            IrExpression low = new Compare(Compare.Op.GE, expressions.arithmetic(subjectNode, 0),
                    expressions.arithmetic(values.get(0), 0));
            IrExpression high = new Compare(Compare.Op.LE, expressions.arithmetic(subjectNode, 0),
                    expressions.arithmetic(values.get(values.size() - 1), 0));
            result = new Logical(Logical.Op.AND, List.of(low, high));
        } else {
            result = new Compare(Compare.Op.EQ, expressions.arithmetic(subjectNode, 0),
                    expressions.arithmetic(values.get(0), 0));
        }
        return negated ? Logical.not(result) : result;
    }

    private IrStatement perform(StatementNode statement) {
        IrStatement body;
        if (statement.hasClause(ClauseRole.PROCEDURE)) {
            body = performCall(statement);
        } else {
            body = lowerAll(statement.body(ClauseRole.BODY));
        }

        boolean testAfter = statement.clause(ClauseRole.TEST_AFTER)
                .map(c -> "AFTER".equals(c.getOperator()))
                .orElse(false);

        Optional<ClauseNode> times = statement.clause(ClauseRole.TIMES);
        if (times.isPresent()) {
            return Loop.times(expressions.operand(firstValue(times)), body);
        }
        Optional<ClauseNode> until = statement.clause(ClauseRole.UNTIL);
        if (until.isPresent()) {
            return Loop.until(testAfter, untilCondition(until.get()), body);
        }
        Optional<ClauseNode> varying = statement.clause(ClauseRole.VARYING);
        if (varying.isPresent()) {
            ClauseNode clause = varying.get();
            RecordAccess counter = expressions.access(references(clause.clause(ClauseRole.TARGET)).get(0));
            IrExpression from = expressions.arithmetic(firstValue(clause.clause(ClauseRole.FROM)), 0);
            IrExpression step = expressions.arithmetic(firstValue(clause.clause(ClauseRole.BY)), 0);
            IrExpression condition = untilCondition(clause.clause(ClauseRole.UNTIL)
                    .orElseThrow(() -> new LoweringException("PERFORM VARYING without UNTIL")));
            IrStatement advance = new Assign(counter, add(counter, step));
            return Sequence.of(new Assign(counter, from), Loop.until(testAfter, condition, Sequence.of(body, advance)));
        }
        return body;
    }

    private IrExpression untilCondition(ClauseNode until) {
        return expressions.condition(firstValue(until.clause(ClauseRole.CONDITION)));
    }

    /**
     * Call of the performed range: the paragraph itself when the range is one GO TO-free
     * paragraph, its region unit otherwise.
     */
    private IrStatement performCall(StatementNode statement) {
        Region region = flow.site(statement)
                .map(PerformSite::getRegion)
                .orElseThrow(() -> new LoweringException("PERFORM target of " + statement.toSourceText() + " is not declared"));
        if (region.getShape() == RegionShape.SEQUENTIAL && region.getMembers().size() == 1) {
            return new Call(Call.Target.PARAGRAPH, paragraphIds.get(region.head()));
        }
        calledRegions.add(region.getKey());
        return new Call(Call.Target.REGION, regionIds.get(region.getKey()));
    }

    private IrStatement goTo(StatementNode statement) {
        List<String> targets = ControlFlowResolver.procedureNames(statement);
        if (targets.isEmpty()) {
            log.warn("GO TO without a target at {} leaves the paragraph", statement.getSpan().location());
            return Exit.INSTANCE;
        }
        Optional<ClauseNode> depending = statement.clause(ClauseRole.DEPENDING_ON);
        if (depending.isEmpty()) {
            return jumpTo(targets.get(0));
        }
        RecordAccess selector = expressions.access(references(depending).get(0));
        IrStatement chain = null;
        for (int i = targets.size() - 1; i >= 0; i--) {
            chain = new Conditional(new Compare(Compare.Op.EQ, selector, Literal.number(i + 1L)), jumpTo(targets.get(i)), chain);
        }
        return chain;
    }

    /**
     * Leaves the paragraph; the dispatch loop of the enclosing region continues at the target.
     */
    private IrStatement jumpTo(String name) {
        FlowNode target = flow.getGraph().resolve(name, current.getSectionName())
                .orElseThrow(() -> new LoweringException("GO TO target " + name + " is not declared"));
        if (target.getOrdinal() == current.getOrdinal() + 1) {
            return Exit.INSTANCE;
        }
        jumpUsed = true;
        return Sequence.of(new Assign(new ControlRef(jump), Literal.number(target.getOrdinal())), Exit.INSTANCE);
    }

    private static IrStatement exit(StatementNode statement) {
        String option = statement.clause(ClauseRole.OPTIONS).map(ClauseNode::getOperator).orElse("");
        switch (option) {
            case "PROGRAM":
                return Stop.INSTANCE;
            case "PARAGRAPH":
            case "SECTION":
                return Exit.INSTANCE;
            default:
                return Sequence.empty();
        }
    }

    // ------------------------------------------------------------------ input / output

    private IrStatement display(StatementNode statement) {
        List<IrExpression> operands = new ArrayList<>();
        for (LstNode operand : statement.clause(ClauseRole.SOURCES).map(ExpressionLowering::values).orElse(List.of())) {
            operands.add(expressions.operand(operand));
        }
        String upon = statement.clause(ClauseRole.UPON).map(ClauseNode::getOperator).orElse(null);
        return new Display(List.copyOf(operands), upon, statement.hasClause(ClauseRole.ADVANCING));
    }

    private IrStatement accept(StatementNode statement) {
        RecordAccess target = expressions.access(references(statement.clause(ClauseRole.TARGET)).get(0));
        return new Accept(target, statement.clause(ClauseRole.FROM).map(ClauseNode::getOperator).orElse(null));
    }

    private IrStatement open(StatementNode statement) {
        List<IrStatement> out = new ArrayList<>();
        for (ClauseNode group : statement.clauses(ClauseRole.OPEN_MODE)) {
            FileOp.Mode mode = openMode(group.getOperator());
            for (ClauseNode file : group.clauses(ClauseRole.FILE)) {
                out.add(FileOp.builder().kind(FileOp.Kind.OPEN).file(file(file)).mode(mode).build());
            }
        }
        return out.size() == 1 ? out.get(0) : new Sequence(List.copyOf(out));
    }

    private static FileOp.Mode openMode(String mode) {
        switch (mode) {
            case "OUTPUT":
                return FileOp.Mode.OUTPUT;
            case "I-O":
                return FileOp.Mode.I_O;
            case "EXTEND":
                return FileOp.Mode.EXTEND;
            default:
                return FileOp.Mode.INPUT;
        }
    }

    private IrStatement close(StatementNode statement) {
        List<IrStatement> out = new ArrayList<>();
        for (ClauseNode file : statement.clauses(ClauseRole.FILE)) {
            out.add(FileOp.builder().kind(FileOp.Kind.CLOSE).file(file(file)).build());
        }
        return out.size() == 1 ? out.get(0) : new Sequence(List.copyOf(out));
    }

    private IrStatement read(StatementNode statement) {
        IrFile file = file(statement.clause(ClauseRole.FILE)
                .orElseThrow(() -> new LoweringException("READ without a file")));
        FileOp.FileOpBuilder read = FileOp.builder().kind(FileOp.Kind.READ).file(file);
        if (!file.getRecords().isEmpty()) {
            read.record(RecordAccess.of(file.getRecords().get(0)));
        }
        statement.clause(ClauseRole.INTO).ifPresent(into ->
                read.into(expressions.access(references(Optional.of(into)).get(0))));
        statement.clause(ClauseRole.AT_END).ifPresent(c -> read.atEnd(nested(c)));
        statement.clause(ClauseRole.NOT_AT_END).ifPresent(c -> read.notAtEnd(nested(c)));
        return read.build();
    }

    private IrStatement write(StatementNode statement) {
        ClauseNode reference = references(statement.clause(ClauseRole.TARGET)).get(0);
        DataItem item = expressions.resolve(reference);
        FileDefinition definition = item.record().getFile();
        IrFile file = definition == null ? null : files.get(definition.getName());
        if (file == null) {
            throw new LoweringException(new SemanticError(SemanticErrorKind.UNDECLARED_FILE, item.getName(),
                    item.getName() + " is not a record of any file", reference.getSpan()));
        }
        FileOp.FileOpBuilder write = FileOp.builder()
                .kind(FileOp.Kind.WRITE)
                .file(file)
                .record(expressions.access(reference));
        statement.clause(ClauseRole.FROM).ifPresent(from -> write.from(expressions.operand(firstValue(Optional.of(from)))));
        return write.build();
    }

    private IrFile file(ClauseNode clause) {
        List<LiteralNode> literals = clause.literals();
        String name = literals.get(literals.size() - 1).upper();
        IrFile file = files.get(name);
        if (file == null) {
            throw new LoweringException(new SemanticError(SemanticErrorKind.UNDECLARED_FILE, name,
                    "file " + name + " is not declared", clause.getSpan()));
        }
        return file;
    }

    private IrStatement call(StatementNode statement) {
        LstNode program = firstValue(statement.clause(ClauseRole.OPERAND));
        String name = program instanceof LiteralNode literal && literal.getLiteralKind() == LiteralKind.STRING
                ? literal.text()
                : program.toSourceText();
        List<IrExpression> arguments = new ArrayList<>();
        for (LstNode argument : statement.clause(ClauseRole.USING).map(ExpressionLowering::values).orElse(List.of())) {
            arguments.add(expressions.operand(argument));
        }
        return new ExternalCall(name, List.copyOf(arguments), statement.toSourceText());
    }

    // ------------------------------------------------------------------ helpers

    private IrStatement nested(ClauseNode clause) {
        return lowerAll(clause.childrenOfType(StatementNode.class));
    }

    private static LstNode firstValue(Optional<ClauseNode> clause) {
        List<LstNode> values = clause.map(ExpressionLowering::values).orElse(List.of());
        if (values.isEmpty()) {
            throw new LoweringException("missing operand in " + clause.map(LstNode::toSourceText).orElse("statement"));
        }
        return values.get(0);
    }

    private static List<ClauseNode> references(Optional<ClauseNode> clause) {
        List<ClauseNode> out = new ArrayList<>();
        clause.ifPresent(c -> {
            for (ClauseNode child : c.subClauses()) {
                if (child.getRole() == ClauseRole.REFERENCE) {
                    out.add(child);
                }
            }
        });
        if (out.isEmpty()) {
            throw new LoweringException("missing data reference in " + clause.map(LstNode::toSourceText).orElse("statement"));
        }
        return out;
    }
}

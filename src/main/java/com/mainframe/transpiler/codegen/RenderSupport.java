package com.mainframe.transpiler.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.mainframe.transpiler.interp.Conversions;
import com.mainframe.transpiler.ir.Arithmetic;
import com.mainframe.transpiler.ir.Binary;
import com.mainframe.transpiler.ir.Conditional;
import com.mainframe.transpiler.ir.Exit;
import com.mainframe.transpiler.ir.FileOp;
import com.mainframe.transpiler.ir.IrExpression;
import com.mainframe.transpiler.ir.IrField;
import com.mainframe.transpiler.ir.IrStatement;
import com.mainframe.transpiler.ir.Literal;
import com.mainframe.transpiler.ir.Loop;
import com.mainframe.transpiler.ir.Sequence;
import com.mainframe.transpiler.ir.Stop;
import com.mainframe.transpiler.ir.Tagged;
import com.mainframe.transpiler.symbol.LiteralValue;

import lombok.experimental.UtilityClass;

/**
 * Target-independent questions the renderers ask about the IR.
 */
@UtilityClass
public class RenderSupport {

    /**
     * Children that take part in a group's image: not REDEFINES, not RENAMES.
     */
    public static boolean stored(IrField child) {
        return child.getRedefines() == null && !child.isRenames();
    }

    /**
     * A RENAMES alias of one field stands for that field; anything else stands for itself.
     */
    public static IrField elementary(IrField field) {
        if (field.isRenames() && field.getRenamed().size() == 1) {
            return field.getRenamed().get(0);
        }
        return field;
    }

    public static boolean isMultiRenames(IrField field) {
        return field.isRenames() && field.getRenamed().size() != 1;
    }

    /**
     * Value a field starts with: its VALUE moved in, or zero / spaces.
     */
    public static Object initialValue(IrField field) {
        LiteralValue value = field.getValue();
        return value == null ? Conversions.empty(field.getType()) : Conversions.move(value, field.getType());
    }

    /**
     * Figurative constants and ALL literals take the length of what they meet.
     */
    public static boolean isFigurative(IrExpression expression) {
        if (!(expression instanceof Literal)) {
            return false;
        }
        LiteralValue.Kind kind = ((Literal) expression).getValue().getKind();
        return kind == LiteralValue.Kind.FIGURATIVE || kind == LiteralValue.Kind.ALL;
    }

    public static boolean hasDivision(IrExpression expression) {
        if (expression instanceof Binary) {
            Binary binary = (Binary) expression;
            return binary.getOp() == Binary.Op.DIVIDE || binary.getOp() == Binary.Op.POWER
                    || hasDivision(binary.getLeft()) || hasDivision(binary.getRight());
        }
        return false;
    }

    /**
     * True when control never reaches the statement after this one.
     */
    public static boolean terminates(IrStatement statement) {
        if (statement == null) {
            return false;
        }
        if (statement instanceof Exit || statement instanceof Stop) {
            return true;
        }
        if (statement instanceof Sequence) {
            return ((Sequence) statement).getStatements().stream().anyMatch(RenderSupport::terminates);
        }
        if (statement instanceof Tagged) {
            return terminates(((Tagged) statement).getStatement());
        }
        if (statement instanceof Conditional) {
            Conditional conditional = (Conditional) statement;
            return terminates(conditional.getThen()) && terminates(conditional.getOtherwise());
        }
        if (statement instanceof Loop) {
            Loop loop = (Loop) statement;
            return loop.getKind() == Loop.Kind.POST_TEST && terminates(loop.getBody());
        }
        if (statement instanceof Arithmetic) {
            Arithmetic arithmetic = (Arithmetic) statement;
            return arithmetic.isSizeErrorGuarded()
                    && terminates(arithmetic.getOnSizeError()) && terminates(arithmetic.getNotOnSizeError());
        }
        if (statement instanceof FileOp) {
            FileOp op = (FileOp) statement;
            return op.getKind() == FileOp.Kind.READ && terminates(op.getAtEnd()) && terminates(op.getNotAtEnd());
        }
        return false;
    }

    /**
     * Comment text for a tagged statement: the edge-case ids, then any hint recorded for them.
     */
    public static List<String> tagComment(List<String> ids, Map<String, String> hints) {
        List<String> lines = new ArrayList<>();
        lines.add("edge case " + String.join(", ", ids));
        for (String id : ids) {
            String hint = hints.get(id);
            if (hint != null) {
                for (String line : hint.split("\\R")) {
                    lines.add(id + " hint: " + line.strip());
                }
            }
        }
        return lines;
    }

    /**
     * Text safe inside a single-line comment: control characters and unicode escapes neutralized.
     */
    public static String commentSafe(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == 'u') {
                out.append("\\\\");
            } else if (c < 0x20 || c == 0x7F) {
                out.append(' ');
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}

package com.mainframe.transpiler.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.mainframe.transpiler.flow.FlowNode;
import com.mainframe.transpiler.flow.Region;
import com.mainframe.transpiler.ir.Assign;
import com.mainframe.transpiler.ir.Binary;
import com.mainframe.transpiler.ir.Call;
import com.mainframe.transpiler.ir.Compare;
import com.mainframe.transpiler.ir.Conditional;
import com.mainframe.transpiler.ir.ControlRef;
import com.mainframe.transpiler.ir.ControlVariable;
import com.mainframe.transpiler.ir.IrExpression;
import com.mainframe.transpiler.ir.IrRegion;
import com.mainframe.transpiler.ir.IrStatement;
import com.mainframe.transpiler.ir.Literal;
import com.mainframe.transpiler.ir.Logical;
import com.mainframe.transpiler.ir.Loop;
import com.mainframe.transpiler.ir.Sequence;

/**
 * Builds the unit of a paragraph range.
 *
 * A sequential range calls its members in order. A dispatch range runs a loop over a cursor
 * holding the ordinal of the paragraph to run next: each pass calls that paragraph, then moves the
 * cursor to the GO TO target it left in the shared jump variable, or to the next ordinal. The
 * loop ends when the cursor leaves the range.
 */
class RegionLowering {
    private final Map<FlowNode, String> paragraphIds;
    private final ControlVariable jump;

    RegionLowering(Map<FlowNode, String> paragraphIds, ControlVariable jump) {
        this.paragraphIds = paragraphIds;
        this.jump = jump;
    }

    IrRegion sequential(Region region, String identifier) {
        List<IrStatement> calls = new ArrayList<>();
        for (FlowNode member : region.getCallSequence()) {
            calls.add(new Call(Call.Target.PARAGRAPH, paragraphIds.get(member)));
        }
        return IrRegion.builder()
                .key(region.getKey())
                .identifier(identifier)
                .shape(region.getShape())
                .body(new Sequence(List.copyOf(calls)))
                .build();
    }

    IrRegion dispatch(Region region, String identifier, ControlVariable cursor) {
        ControlRef cur = new ControlRef(cursor);
        ControlRef next = new ControlRef(jump);
        int head = region.head().getOrdinal();
        int last = region.last().getOrdinal();

        IrStatement select = null;
        List<FlowNode> members = region.getMembers();
        for (int i = members.size() - 1; i >= 0; i--) {
            FlowNode member = members.get(i);
            select = new Conditional(new Compare(Compare.Op.EQ, cur, Literal.number(member.getOrdinal())),
                    new Call(Call.Target.PARAGRAPH, paragraphIds.get(member)), select);
        }

        IrStatement advance = new Conditional(new Compare(Compare.Op.GE, next, Literal.number(0)),
                new Assign(cur, next),
                new Assign(cur, Binary.of(Binary.Op.ADD, cur, Literal.number(1))));
        IrStatement pass = Sequence.of(new Assign(next, Literal.number(-1)), select, advance);
        IrExpression outside = new Logical(Logical.Op.OR, List.of(
                new Compare(Compare.Op.LT, cur, Literal.number(head)),
                new Compare(Compare.Op.GT, cur, Literal.number(last))));

        IrStatement body = Sequence.of(
                new Assign(cur, Literal.number(head)),
                Loop.until(false, outside, pass),
                new Assign(next, Literal.number(-1)));
        return IrRegion.builder()
                .key(region.getKey())
                .identifier(identifier)
                .shape(region.getShape())
                .body(body)
                .build();
    }

    /**
     * A range with several entries into one cycle; its unit only raises.
     */
    IrRegion irreducible(Region region, String identifier) {
        return IrRegion.builder()
                .key(region.getKey())
                .identifier(identifier)
                .shape(region.getShape())
                .body(Sequence.empty())
                .build();
    }
}

package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.transpiler.symbol.DataItem;

/**
 * REDEFINES involving a variable-length table, or a redefining item longer than the item it
 * redefines. Either way the two views do not line up byte for byte.
 */
public class RedefinesVariableOccursPredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.REDEFINES_VARIABLE_OCCURS;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        List<EdgeCase> out = new ArrayList<>();
        for (DataItem item : context.getSymbols().getItems()) {
            DataItem target = item.getRedefines();
            if (target == null) {
                continue;
            }
            String reason = null;
            if (hasVariableOccurs(item) || hasVariableOccurs(target)) {
                reason = "involves an OCCURS DEPENDING ON table";
            } else if (item.totalSize() > target.totalSize()) {
                reason = "is longer than " + target.getName() + " (" + item.totalSize() + " > " + target.totalSize() + " bytes)";
            }
            if (reason != null) {
                out.add(finding()
                        .span(item.getSpan())
                        .message(item.getName() + " REDEFINES " + target.getName() + " " + reason)
                        .snippet(item.getName() + " REDEFINES " + target.getName())
                        .build());
            }
        }
        return out;
    }

    static boolean hasVariableOccurs(DataItem item) {
        if (item.getOccurs() != null && item.getOccurs().isVariable()) {
            return true;
        }
        for (DataItem child : item.getChildren()) {
            if (hasVariableOccurs(child)) {
                return true;
            }
        }
        return false;
    }
}

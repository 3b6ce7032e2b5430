package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.transpiler.symbol.DataItem;

/**
 * Generated code keeps each REDEFINES view in its own storage, so a store through one name is not
 * seen through the other.
 */
public class RedefinesAliasingPredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.REDEFINES_ALIASING;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        List<EdgeCase> out = new ArrayList<>();
        for (DataItem item : context.getSymbols().getItems()) {
            DataItem target = item.getRedefines();
            if (target == null
                    || RedefinesVariableOccursPredicate.hasVariableOccurs(item)
                    || RedefinesVariableOccursPredicate.hasVariableOccurs(target)
                    || item.totalSize() > target.totalSize()) {
                continue;
            }
            out.add(finding()
                    .span(item.getSpan())
                    .message(item.getName() + " and " + target.getName() + " do not share storage in generated code")
                    .snippet(item.getName() + " REDEFINES " + target.getName())
                    .build());
        }
        return out;
    }
}

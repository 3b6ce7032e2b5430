package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.List;

import com.mainframe.transpiler.flow.DataAccess;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.symbol.AlphanumericEditedType;
import com.mainframe.transpiler.symbol.Resolution;

/**
 * MOVE into an edited picture. Editing is approximated: digits are placed right-justified under
 * the picture's digit positions and insertion characters are kept.
 */
public class AlphanumericEditedTargetPredicate implements EdgeCasePredicate {

    @Override
    public EdgeCaseCategory category() {
        return EdgeCaseCategory.ALPHANUMERIC_EDITED_TARGET;
    }

    @Override
    public List<EdgeCase> detect(DetectionContext context) {
        List<EdgeCase> out = new ArrayList<>();
        context.forEachStatement((node, statement) -> {
            if (!statement.isVerb("MOVE")) {
                return;
            }
            for (ClauseNode reference : DataAccess.targetReferences(statement)) {
                Resolution resolution = context.getSymbols().resolve(reference);
                if (resolution.isResolved() && resolution.getItem().getType() instanceof AlphanumericEditedType edited) {
                    out.add(DetectionContext.at(this, node, statement,
                            "MOVE into edited item " + resolution.getItem().getName() + " (PIC " + edited.getPicture() + ")"));
                    return;
                }
            }
        });
        return out;
    }
}

package com.mainframe.transpiler.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.mainframe.transpiler.augment.AugmentationResult;
import com.mainframe.transpiler.edgecase.EdgeCase;
import com.mainframe.transpiler.ir.IrParagraph;
import com.mainframe.transpiler.ir.IrProgram;

/**
 * Creates one mapping per paragraph of a generated program. The level follows the worst edge case
 * in the paragraph: blocked, then unhelped augmentation, then helped augmentation, then
 * informational.
 */
public class MappingFactory {

    /**
     * @param augmentations outcome of each augmentation request, by edge-case id
     */
    public List<FunctionalityMapping> create(IrProgram program, List<EdgeCase> edgeCases,
                                             Map<String, AugmentationResult> augmentations) {
        List<FunctionalityMapping> out = new ArrayList<>();
        for (IrParagraph paragraph : program.getParagraphs()) {
            List<EdgeCase> own = edgeCases.stream()
                    .filter(e -> paragraph.getCobolName().equals(e.getParagraph()))
                    .toList();
            out.add(new FunctionalityMapping(
                    program.getProgramId() + "." + paragraph.getCobolName(),
                    program.getSourcePath() + ":" + paragraph.getCobolName(),
                    program.getUnitName() + "." + paragraph.getIdentifier(),
                    level(paragraph, own, augmentations)));
        }
        return out;
    }

    static EquivalenceLevel level(IrParagraph paragraph, List<EdgeCase> edgeCases,
                                  Map<String, AugmentationResult> augmentations) {
        if (paragraph.isBlocked() || edgeCases.stream().anyMatch(EdgeCase::isBlocking)) {
            return EquivalenceLevel.PARTIAL;
        }
        List<EdgeCase> augmented = edgeCases.stream().filter(EdgeCase::needsAugmentation).toList();
        if (!augmented.isEmpty()) {
            boolean allHelped = augmented.stream().allMatch(e -> {
                AugmentationResult result = augmentations.get(e.getId());
                return result != null && result.isSuccess();
            });
            return allHelped ? EquivalenceLevel.MEDIUM : EquivalenceLevel.LOW;
        }
        return edgeCases.isEmpty() ? EquivalenceLevel.EXACT : EquivalenceLevel.HIGH;
    }
}

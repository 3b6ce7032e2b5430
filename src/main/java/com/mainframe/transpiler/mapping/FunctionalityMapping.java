package com.mainframe.transpiler.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Links one COBOL paragraph to the method generated for it. Findings are the only thing that
 * changes after the mapping is created.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FunctionalityMapping {
    /** {@code PROGRAM-ID.PARAGRAPH}. */
    private final String functionalityId;

    /** {@code file:PARAGRAPH}. */
    private final String sourceName;

    /** {@code Unit.method}. */
    private final String targetName;

    private final EquivalenceLevel equivalenceLevel;
    private final double confidence;
    private final List<String> findings;

    @JsonCreator
    public FunctionalityMapping(@JsonProperty("functionalityId") String functionalityId,
                                @JsonProperty("sourceName") String sourceName,
                                @JsonProperty("targetName") String targetName,
                                @JsonProperty("equivalenceLevel") EquivalenceLevel equivalenceLevel,
                                @JsonProperty("confidence") double confidence,
                                @JsonProperty("findings") List<String> findings) {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be in [0, 1]: " + confidence);
        }
        this.functionalityId = functionalityId;
        this.sourceName = sourceName;
        this.targetName = targetName;
        this.equivalenceLevel = equivalenceLevel;
        this.confidence = confidence;
        this.findings = findings != null ? new ArrayList<>(findings) : new ArrayList<>();
    }

    public FunctionalityMapping(String functionalityId, String sourceName, String targetName,
                                EquivalenceLevel equivalenceLevel) {
        this(functionalityId, sourceName, targetName, equivalenceLevel, equivalenceLevel.getConfidence(), null);
    }

    public List<String> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    public synchronized void addFinding(String finding) {
        findings.add(finding);
    }
}

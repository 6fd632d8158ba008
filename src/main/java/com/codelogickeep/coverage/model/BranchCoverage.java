package com.codelogickeep.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One outcome of a branching line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchCoverage {
    private int lineNumber;
    private int branchNumber;
    private int hitCount;
    /** Condition text as reported, e.g. "50% (1/2)" */
    private String condition;
    private BranchType type;

    public boolean isCovered() {
        return hitCount > 0;
    }
}

package com.codelogickeep.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hit information for a single source line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineCoverage {
    private int lineNumber;
    private int hitCount;
    private CoverageStatus status;
    /** Source text of the line, when it could be read */
    private String sourceCode;
    /** Whether the report flagged this line as containing a branch */
    private boolean branch;

    public boolean isCovered() {
        return hitCount > 0;
    }
}

package com.codelogickeep.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UncoveredBranch {
    private String projectName;
    private String filePath;
    private int lineNumber;
    private int branchNumber;
    private String condition;
    private BranchType type;
    private String methodName;
    private String className;
}

package com.codelogickeep.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UncoveredLine {
    private String projectName;
    private String filePath;
    private int lineNumber;
    private String sourceCode;
    private String methodName;
    private String className;
}

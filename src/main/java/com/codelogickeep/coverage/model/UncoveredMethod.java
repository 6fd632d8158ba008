package com.codelogickeep.coverage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A method none of whose lines were executed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UncoveredMethod {
    private String projectName;
    private String methodName;
    private String className;
    private String filePath;
    private int startLine;
    private int endLine;
    /** Parameter signature as reported, e.g. "(int,int)" */
    private String signature;
    private int lineCount;
    private String reason;
}

package com.codelogickeep.coverage.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Coverage of a single class as reported by the coverage tool.
 */
@Data
public class ClassCoverage {
    private String className = "";
    private String namespace = "";
    private String filePath = "";
    private CoverageSummary summary = new CoverageSummary();
    private List<MethodCoverage> methods = new ArrayList<>();
}

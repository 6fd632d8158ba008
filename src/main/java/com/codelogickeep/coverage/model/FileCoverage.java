package com.codelogickeep.coverage.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Coverage of one source file. Several reported classes may share a file
 * (nested and compiler-generated classes), so lines are merged per file.
 */
@Data
public class FileCoverage {
    private String filePath = "";
    private String fileName = "";
    private CoverageSummary summary = new CoverageSummary();
    private List<LineCoverage> lines = new ArrayList<>();
    private List<BranchCoverage> branches = new ArrayList<>();
    private List<MethodCoverage> methods = new ArrayList<>();
}

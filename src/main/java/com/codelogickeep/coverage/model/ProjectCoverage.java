package com.codelogickeep.coverage.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Coverage of one covered project (a Cobertura package).
 */
@Data
public class ProjectCoverage {
    private String projectName = "";
    /** Coverage report the project was read from */
    private String projectPath = "";
    /** Source roots declared by the report, used to resolve relative file paths */
    private List<String> sourceRoots = new ArrayList<>();
    private CoverageSummary summary = new CoverageSummary();
    private List<FileCoverage> files = new ArrayList<>();
    private List<ClassCoverage> classes = new ArrayList<>();
}

package com.codelogickeep.coverage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Options for one coverage analysis invocation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CoverageAnalysisOptions {
    /** Covered project names to keep; empty keeps all */
    @Singular(ignoreNullCollections = true)
    List<String> includedProjects;

    /** Project names removed from both test discovery and coverage results */
    @Singular(ignoreNullCollections = true)
    List<String> excludedProjects;

    /** Test project names to run; empty runs every discovered test project */
    @Singular(ignoreNullCollections = true)
    List<String> includedTestProjects;

    @Singular(ignoreNullCollections = true)
    List<String> excludedTestProjects;

    /** File paths or glob patterns removed from coverage results */
    @Singular(ignoreNullCollections = true)
    List<String> excludedFiles;

    @Builder.Default
    boolean collectBranchCoverage = true;

    @Builder.Default
    boolean collectMethodCoverage = true;

    @Builder.Default
    int timeoutMinutes = 10;

    @Builder.Default
    boolean runInParallel = true;

    /** Passed to the test runner as its test filter expression */
    String testFilter;

    public static CoverageAnalysisOptions defaults() {
        return CoverageAnalysisOptions.builder().build();
    }
}

package com.codelogickeep.coverage.engine;

/**
 * Why a workspace project was or was not treated as a test project.
 */
public enum TestProjectClassification {
    /** References a recognized test framework */
    FRAMEWORK_DEPENDENCY(true),
    /** Descriptor explicitly marks it as a test project */
    EXPLICIT_FLAG(true),
    /** Name matches the test naming pattern */
    NAMING_CONVENTION(true),
    NOT_A_TEST_PROJECT(false),
    UNREADABLE_METADATA(false);

    private final boolean testProject;

    TestProjectClassification(boolean testProject) {
        this.testProject = testProject;
    }

    public boolean isTestProject() {
        return testProject;
    }
}

package com.codelogickeep.coverage.model;

import com.codelogickeep.coverage.util.JsonUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CoverageAnalysisOptions Tests")
class CoverageAnalysisOptionsTest {

    @Test
    @DisplayName("defaults should select everything with branches and methods")
    void defaultsShouldSelectEverything() {
        CoverageAnalysisOptions options = CoverageAnalysisOptions.defaults();

        assertTrue(options.getIncludedProjects().isEmpty());
        assertTrue(options.getExcludedProjects().isEmpty());
        assertTrue(options.getIncludedTestProjects().isEmpty());
        assertTrue(options.getExcludedTestProjects().isEmpty());
        assertTrue(options.getExcludedFiles().isEmpty());
        assertTrue(options.isCollectBranchCoverage());
        assertTrue(options.isCollectMethodCoverage());
        assertTrue(options.isRunInParallel());
        assertEquals(10, options.getTimeoutMinutes());
        assertNull(options.getTestFilter());
    }

    @Test
    @DisplayName("should keep list order through JSON")
    void shouldKeepListOrderThroughJson() {
        CoverageAnalysisOptions options = CoverageAnalysisOptions.builder()
                .includedProject("Zeta")
                .includedProject("Alpha")
                .excludedFile("glob:**/obj/**")
                .timeoutMinutes(45)
                .runInParallel(false)
                .testFilter("FullyQualifiedName~Calc")
                .build();

        CoverageAnalysisOptions restored = JsonUtil.fromJson(JsonUtil.toJson(options), CoverageAnalysisOptions.class);

        assertEquals(options, restored);
        assertEquals(List.of("Zeta", "Alpha"), restored.getIncludedProjects());
    }

    @Test
    @DisplayName("toBuilder should leave the original untouched")
    void toBuilderShouldCopy() {
        CoverageAnalysisOptions original = CoverageAnalysisOptions.builder().excludedProject("Legacy").build();

        CoverageAnalysisOptions changed = original.toBuilder().clearExcludedProjects().timeoutMinutes(5).build();

        assertEquals(List.of("Legacy"), original.getExcludedProjects());
        assertTrue(changed.getExcludedProjects().isEmpty());
        assertEquals(5, changed.getTimeoutMinutes());
    }

    @Test
    @DisplayName("missing JSON fields should fall back to defaults")
    void missingJsonFieldsShouldUseDefaults() {
        CoverageAnalysisOptions options = JsonUtil.fromJson("{\"timeoutMinutes\": 3}", CoverageAnalysisOptions.class);

        assertEquals(3, options.getTimeoutMinutes());
        assertTrue(options.isCollectBranchCoverage());
        assertTrue(options.getExcludedFiles().isEmpty());
    }
}

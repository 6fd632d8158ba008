package com.codelogickeep.coverage.util;

import com.codelogickeep.coverage.exception.CoverageAnalysisException;
import com.codelogickeep.coverage.model.ClassCoverage;
import com.codelogickeep.coverage.model.CoverageAnalysisResult;
import com.codelogickeep.coverage.model.MethodCoverage;
import com.codelogickeep.coverage.model.ProjectCoverage;
import com.codelogickeep.coverage.model.TestProjectRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonUtil Tests")
class JsonUtilTest {

    @TempDir
    Path tempDir;

    private static CoverageAnalysisResult baseline() {
        CoverageAnalysisResult result = new CoverageAnalysisResult();
        result.setSuccess(true);
        result.setAnalysisTime(Instant.parse("2024-05-01T10:15:30Z"));
        result.setExecutionDuration(Duration.ofSeconds(42));
        result.getSummary().recordLines(10, 7);

        MethodCoverage method = new MethodCoverage();
        method.setClassName("Calc.Calculator");
        method.setMethodName("Add");
        method.getSummary().setLinesCoveredPercentage(100.0);

        ProjectCoverage project = new ProjectCoverage();
        project.setProjectName("Calc");
        project.getClasses().add(new ClassCoverage());
        project.getClasses().get(0).getMethods().add(method);
        result.getProjects().add(project);

        result.getTestProjectRuns().add(TestProjectRun.builder()
                .projectName("Calc.Tests")
                .success(true)
                .outputLines(List.of("Passed!"))
                .build());
        return result;
    }

    @Test
    @DisplayName("should write and read back a baseline result")
    void shouldWriteAndReadBaseline() {
        Path file = tempDir.resolve("reports/baseline.json");

        JsonUtil.writeValue(file, baseline());
        CoverageAnalysisResult restored = JsonUtil.readValue(file, CoverageAnalysisResult.class);

        assertTrue(Files.exists(file));
        assertTrue(restored.isSuccess());
        assertEquals(Instant.parse("2024-05-01T10:15:30Z"), restored.getAnalysisTime());
        assertEquals(Duration.ofSeconds(42), restored.getExecutionDuration());
        assertEquals(70.0, restored.getSummary().getLinesCoveredPercentage());
        assertEquals("Calc.Calculator.Add", restored.getProjects().get(0).getClasses().get(0).getMethods().get(0).getIdentifier());
        assertNull(restored.getTestProjectRuns().get(0).getOutputLines());
    }

    @Test
    @DisplayName("should write times as ISO-8601 text")
    void shouldWriteIsoTimes() {
        String json = JsonUtil.toJson(baseline());

        assertTrue(json.contains("\"analysisTime\" : \"2024-05-01T10:15:30Z\""));
        assertTrue(json.contains("\"executionDuration\" : \"PT42S\""));
        assertFalse(json.contains("Passed!"));
    }

    @Test
    @DisplayName("should report unreadable input as a serialization error")
    void shouldReportSerializationErrors() {
        CoverageAnalysisException missing = assertThrows(CoverageAnalysisException.class,
                () -> JsonUtil.readValue(tempDir.resolve("absent.json"), CoverageAnalysisResult.class));
        CoverageAnalysisException malformed = assertThrows(CoverageAnalysisException.class,
                () -> JsonUtil.fromJson("{\"success\": ", CoverageAnalysisResult.class));

        assertEquals(CoverageAnalysisException.ErrorCode.SERIALIZATION_FAILED, missing.getErrorCode());
        assertEquals(CoverageAnalysisException.ErrorCode.SERIALIZATION_FAILED, malformed.getErrorCode());
    }
}

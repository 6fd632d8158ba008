package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.workspace.WorkspaceProject;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether a project is a test project from its metadata alone.
 * Checks, in order: test-framework dependency, explicit flag, naming convention.
 */
public class TestProjectClassifier {

    private final List<String> frameworkMarkers;
    private final Pattern namePattern;

    public TestProjectClassifier(AppConfig.DiscoveryConfig config) {
        this(config.getTestFrameworkMarkers(), config.getTestNamePattern());
    }

    public TestProjectClassifier(List<String> frameworkMarkers, String namePattern) {
        this.frameworkMarkers = frameworkMarkers.stream()
                .map(m -> m.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        this.namePattern = namePattern != null ? Pattern.compile(namePattern) : null;
    }

    public TestProjectClassification classify(WorkspaceProject project) {
        if (project == null || !project.isMetadataReadable()) {
            return TestProjectClassification.UNREADABLE_METADATA;
        }
        for (String dependency : project.dependencies()) {
            if (isFrameworkMarker(dependency)) {
                return TestProjectClassification.FRAMEWORK_DEPENDENCY;
            }
        }
        if (project.testProjectFlag()) {
            return TestProjectClassification.EXPLICIT_FLAG;
        }
        if (namePattern != null && project.name() != null && namePattern.matcher(project.name()).matches()) {
            return TestProjectClassification.NAMING_CONVENTION;
        }
        return TestProjectClassification.NOT_A_TEST_PROJECT;
    }

    private boolean isFrameworkMarker(String dependency) {
        String lower = dependency.toLowerCase(Locale.ROOT);
        for (String marker : frameworkMarkers) {
            if (lower.startsWith(marker)) {
                return true;
            }
        }
        return false;
    }
}

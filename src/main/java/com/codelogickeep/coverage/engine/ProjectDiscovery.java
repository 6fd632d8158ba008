package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import com.codelogickeep.coverage.workspace.WorkspaceProject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the test projects to run from the projects of a workspace.
 */
@Slf4j
public class ProjectDiscovery {

    private final TestProjectClassifier classifier;

    public ProjectDiscovery(TestProjectClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Returns the test projects eligible under the given options, ordered by descriptor path.
     * Projects with unreadable metadata are skipped and logged.
     */
    public List<WorkspaceProject> selectTestProjects(Collection<WorkspaceProject> projects, CoverageAnalysisOptions options) {
        List<WorkspaceProject> selected = new ArrayList<>();
        if (projects == null) {
            return selected;
        }

        for (WorkspaceProject project : projects) {
            TestProjectClassification classification = classifier.classify(project);
            if (classification == TestProjectClassification.UNREADABLE_METADATA) {
                log.warn("[{}] Skipping project {}: metadata unreadable ({})", ErrorCode.DISCOVERY_FAILED.getCode(),
                        project != null ? project.path() : "<null>",
                        project != null ? project.metadataError() : "no project");
                continue;
            }
            if (!classification.isTestProject()) {
                continue;
            }
            if (containsIgnoreCase(options.getExcludedProjects(), project.name())
                    || containsIgnoreCase(options.getExcludedTestProjects(), project.name())) {
                log.debug("Test project {} excluded by options", project.name());
                continue;
            }
            if (!options.getIncludedTestProjects().isEmpty()
                    && !containsIgnoreCase(options.getIncludedTestProjects(), project.name())) {
                log.debug("Test project {} not in the included test projects", project.name());
                continue;
            }
            log.debug("Selected test project {} ({})", project.name(), classification);
            selected.add(project);
        }

        selected.sort(Comparator.comparing(WorkspaceProject::path));
        log.info("Discovered {} test project(s)", selected.size());
        return selected;
    }

    public TestProjectClassification classify(WorkspaceProject project) {
        return classifier.classify(project);
    }

    static boolean containsIgnoreCase(Collection<String> names, String name) {
        if (names == null || name == null) {
            return false;
        }
        for (String candidate : names) {
            if (candidate != null && candidate.trim().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }
}

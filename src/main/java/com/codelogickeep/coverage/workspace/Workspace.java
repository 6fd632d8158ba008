package com.codelogickeep.coverage.workspace;

import java.nio.file.Path;
import java.util.List;

/**
 * Read-only handle on a loaded workspace.
 */
public record Workspace(Path root, List<WorkspaceProject> projects) {
    public Workspace {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }
}

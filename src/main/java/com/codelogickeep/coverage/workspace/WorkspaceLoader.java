package com.codelogickeep.coverage.workspace;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies the projects of a workspace together with their metadata.
 */
public interface WorkspaceLoader {

    /**
     * Loads the workspace rooted at (or described by) the given path.
     * Projects whose metadata cannot be read are still returned, flagged as unreadable.
     *
     * @throws IOException when the workspace itself cannot be read
     */
    Workspace load(Path path) throws IOException;
}

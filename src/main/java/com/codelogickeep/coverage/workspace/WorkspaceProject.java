package com.codelogickeep.coverage.workspace;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Metadata of one project in a workspace, read once by the {@link WorkspaceLoader}.
 *
 * @param name             project name
 * @param descriptorPath   project descriptor file (e.g. a .csproj or pom.xml)
 * @param dependencies     package/artifact identifiers the project references
 * @param testProjectFlag  whether the descriptor explicitly marks the project as a test project
 * @param files            source files belonging to the project
 * @param metadataError    why the descriptor could not be read, or null when it was read
 */
public record WorkspaceProject(
        String name,
        Path descriptorPath,
        Set<String> dependencies,
        boolean testProjectFlag,
        List<String> files,
        String metadataError
) {
    public WorkspaceProject {
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static WorkspaceProject unreadable(String name, Path descriptorPath, String error) {
        return new WorkspaceProject(name, descriptorPath, Set.of(), false, List.of(), error);
    }

    public boolean isMetadataReadable() {
        return metadataError == null;
    }

    /** Directory holding the project descriptor; the test process runs here. */
    public Path directory() {
        Path parent = descriptorPath.toAbsolutePath().getParent();
        return parent != null ? parent : descriptorPath.toAbsolutePath();
    }

    public String path() {
        return descriptorPath.toString();
    }
}

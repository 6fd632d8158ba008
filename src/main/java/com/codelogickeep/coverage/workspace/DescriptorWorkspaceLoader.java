package com.codelogickeep.coverage.workspace;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.util.XmlDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads a workspace by scanning a directory tree for project descriptor files
 * ({@code *.csproj}, {@code pom.xml}). A path pointing at a single descriptor loads
 * just that project.
 */
public class DescriptorWorkspaceLoader implements WorkspaceLoader {
    private static final Logger log = LoggerFactory.getLogger(DescriptorWorkspaceLoader.class);

    private static final Set<String> SOURCE_EXTENSIONS = Set.of(".cs", ".fs", ".vb", ".java", ".kt");

    private final List<PathMatcher> descriptorMatchers;
    private final Set<String> ignoredDirectories;
    private final int maxDepth;

    public DescriptorWorkspaceLoader(AppConfig.DiscoveryConfig config) {
        this.descriptorMatchers = config.getDescriptorPatterns().stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .collect(Collectors.toList());
        this.ignoredDirectories = new LinkedHashSet<>(config.getIgnoredDirectories());
        this.maxDepth = config.getMaxDepth();
    }

    @Override
    public Workspace load(Path path) throws IOException {
        log.info("Loading workspace: {}", path);
        if (path == null || !Files.exists(path)) {
            throw new IOException("Workspace path does not exist: " + path);
        }
        Path absolute = path.toAbsolutePath().normalize();

        if (Files.isRegularFile(absolute)) {
            if (!isDescriptor(absolute)) {
                throw new IOException("Not a project descriptor: " + absolute);
            }
            List<WorkspaceProject> single = new ArrayList<>();
            readProject(absolute).ifPresent(single::add);
            return new Workspace(absolute.getParent(), single);
        }

        List<Path> descriptors;
        try (Stream<Path> stream = Files.find(absolute, maxDepth,
                (p, attr) -> attr.isRegularFile() && isDescriptor(p) && !isIgnored(absolute, p))) {
            descriptors = stream.sorted(Comparator.comparing(Path::toString)).collect(Collectors.toList());
        }

        List<WorkspaceProject> projects = new ArrayList<>();
        for (Path descriptor : descriptors) {
            readProject(descriptor).ifPresent(projects::add);
        }
        log.info("Loaded {} project(s) from {}", projects.size(), absolute);
        return new Workspace(absolute, projects);
    }

    private Optional<WorkspaceProject> readProject(Path descriptor) {
        String fileName = descriptor.getFileName().toString();
        String fallbackName = fallbackName(descriptor);
        try {
            Document doc = XmlDocuments.parse(descriptor);
            Element root = doc.getDocumentElement();
            if ("pom.xml".equals(fileName)) {
                return readPom(descriptor, root);
            }
            return Optional.of(readMsBuildProject(descriptor, root, fallbackName));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read project descriptor {}: {}", descriptor, e.getMessage());
            return Optional.of(WorkspaceProject.unreadable(fallbackName, descriptor, e.getMessage()));
        }
    }

    private WorkspaceProject readMsBuildProject(Path descriptor, Element root, String fallbackName) {
        Set<String> dependencies = new LinkedHashSet<>();
        for (Element reference : XmlDocuments.descendants(root, "PackageReference")) {
            String include = reference.getAttribute("Include");
            if (include.isEmpty()) {
                include = reference.getAttribute("Update");
            }
            if (!include.isEmpty()) {
                dependencies.add(include);
            }
        }

        boolean testFlag = false;
        for (Element flag : XmlDocuments.descendants(root, "IsTestProject")) {
            if ("true".equalsIgnoreCase(flag.getTextContent().trim())) {
                testFlag = true;
            }
        }

        String name = fallbackName;
        List<Element> assemblyNames = XmlDocuments.descendants(root, "AssemblyName");
        if (!assemblyNames.isEmpty() && !assemblyNames.get(0).getTextContent().trim().isEmpty()) {
            name = assemblyNames.get(0).getTextContent().trim();
        }

        return new WorkspaceProject(name, descriptor, dependencies, testFlag, listSourceFiles(descriptor), null);
    }

    private Optional<WorkspaceProject> readPom(Path descriptor, Element root) {
        if ("pom".equals(XmlDocuments.childText(root, "packaging"))) {
            log.debug("Skipping aggregator pom: {}", descriptor);
            return Optional.empty();
        }

        Set<String> dependencies = new LinkedHashSet<>();
        Element dependencyList = XmlDocuments.child(root, "dependencies");
        for (Element dependency : XmlDocuments.children(dependencyList, "dependency")) {
            // Test-scoped dependencies say how a module is tested, not that it is a test module
            if ("test".equals(XmlDocuments.childText(dependency, "scope"))) {
                continue;
            }
            String artifactId = XmlDocuments.childText(dependency, "artifactId");
            if (artifactId != null && !artifactId.isEmpty()) {
                dependencies.add(artifactId);
            }
        }

        String name = XmlDocuments.childText(root, "artifactId");
        if (name == null || name.isEmpty()) {
            name = fallbackName(descriptor);
        }
        return Optional.of(new WorkspaceProject(name, descriptor, dependencies, false,
                listSourceFiles(descriptor), null));
    }

    private List<String> listSourceFiles(Path descriptor) {
        Path dir = descriptor.getParent();
        try (Stream<Path> stream = Files.find(dir, maxDepth,
                (p, attr) -> attr.isRegularFile() && isSourceFile(p) && !isIgnored(dir, p))) {
            return stream.map(Path::toString).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list source files of {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private boolean isDescriptor(Path file) {
        Path name = file.getFileName();
        return name != null && descriptorMatchers.stream().anyMatch(m -> m.matches(name));
    }

    private boolean isIgnored(Path root, Path file) {
        Path relative = root.relativize(file);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (ignoredDirectories.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSourceFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SOURCE_EXTENSIONS.contains(name.substring(dot));
    }

    private static String fallbackName(Path descriptor) {
        String fileName = descriptor.getFileName().toString();
        if ("pom.xml".equals(fileName)) {
            Path parent = descriptor.toAbsolutePath().getParent();
            return parent != null && parent.getFileName() != null ? parent.getFileName().toString() : fileName;
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

package com.codelogickeep.coverage.parser;

import com.codelogickeep.coverage.exception.CoverageAnalysisException;
import com.codelogickeep.coverage.model.BranchCoverage;
import com.codelogickeep.coverage.model.BranchType;
import com.codelogickeep.coverage.model.ClassCoverage;
import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import com.codelogickeep.coverage.model.CoverageStatus;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;
import com.codelogickeep.coverage.model.MethodCoverage;
import com.codelogickeep.coverage.model.ProjectCoverage;
import com.codelogickeep.coverage.util.Percentages;
import com.codelogickeep.coverage.util.XmlDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Cobertura XML coverage reports.
 * <p>
 * Report layout: {@code coverage > packages > package > classes > class > (methods > method > lines > line) + (lines > line)}.
 * Percentages of classes and methods are the {@code line-rate}/{@code branch-rate} attributes
 * reported by the coverage tool, counts are derived from the lines.
 */
public class CoberturaReportParser {
    private static final Logger log = LoggerFactory.getLogger(CoberturaReportParser.class);

    private static final Pattern CONDITION_COVERAGE = Pattern.compile("\\((\\d+)\\s*/\\s*(\\d+)\\)");

    /**
     * Parses a whole report into one {@link ProjectCoverage} per package.
     * A report without packages yields a single empty project named {@code projectName}.
     *
     * @throws CoverageAnalysisException REPORT_PARSE_FAILED if the file is not a readable Cobertura report
     */
    public List<ProjectCoverage> parseReport(Path reportFile, String projectName, CoverageAnalysisOptions options) {
        log.debug("Parsing coverage report: {}", reportFile);
        Document doc;
        try {
            doc = XmlDocuments.parse(reportFile);
        } catch (IOException e) {
            throw new CoverageAnalysisException(
                    CoverageAnalysisException.ErrorCode.REPORT_PARSE_FAILED,
                    "Failed to read coverage report " + reportFile + ": " + e.getMessage(),
                    projectName, e);
        }

        Element root = doc.getDocumentElement();
        if (!"coverage".equals(root.getNodeName())) {
            throw new CoverageAnalysisException(
                    CoverageAnalysisException.ErrorCode.REPORT_PARSE_FAILED,
                    "Not a Cobertura report (root element <" + root.getNodeName() + ">): " + reportFile,
                    projectName);
        }

        List<String> sourceRoots = new ArrayList<>();
        for (Element source : XmlDocuments.children(XmlDocuments.child(root, "sources"), "source")) {
            String text = source.getTextContent().trim();
            if (!text.isEmpty()) {
                sourceRoots.add(text);
            }
        }

        List<ProjectCoverage> projects = new ArrayList<>();
        for (Element packageElement : XmlDocuments.children(XmlDocuments.child(root, "packages"), "package")) {
            ProjectCoverage project = parsePackage(packageElement, reportFile, options);
            project.getSourceRoots().addAll(sourceRoots);
            projects.add(project);
        }

        if (projects.isEmpty()) {
            ProjectCoverage empty = new ProjectCoverage();
            empty.setProjectName(projectName != null ? projectName : "");
            empty.setProjectPath(reportFile.toString());
            empty.getSourceRoots().addAll(sourceRoots);
            projects.add(empty);
        }

        log.debug("Parsed {} package(s) from {}", projects.size(), reportFile);
        return projects;
    }

    /**
     * Parses one {@code <package>}. Classes reported against the same file are grouped
     * into one {@link FileCoverage}; lines reported twice keep the higher hit count.
     */
    public ProjectCoverage parsePackage(Element packageElement, Path reportFile, CoverageAnalysisOptions options) {
        ProjectCoverage project = new ProjectCoverage();
        project.setProjectName(attribute(packageElement, "name", "Unknown"));
        project.setProjectPath(reportFile != null ? reportFile.toString() : "");

        Map<String, FileAccumulator> files = new LinkedHashMap<>();
        for (Element classElement : XmlDocuments.children(XmlDocuments.child(packageElement, "classes"), "class")) {
            ClassCoverage classCoverage = parseClass(classElement, options.isCollectBranchCoverage());
            if (!options.isCollectMethodCoverage()) {
                classCoverage.getMethods().clear();
            }
            project.getClasses().add(classCoverage);

            FileAccumulator file = files.computeIfAbsent(classCoverage.getFilePath(), FileAccumulator::new);
            file.methods.addAll(classCoverage.getMethods());
            for (Element lineElement : classLines(classElement)) {
                LineCoverage line = parseLine(lineElement);
                if (line == null) {
                    continue;
                }
                file.addLine(line);
                if (options.isCollectBranchCoverage()) {
                    for (BranchCoverage branch : parseBranches(lineElement)) {
                        file.addBranch(branch);
                    }
                }
            }
        }

        for (FileAccumulator file : files.values()) {
            project.getFiles().add(file.toFileCoverage());
        }
        return project;
    }

    public ClassCoverage parseClass(Element classElement) {
        return parseClass(classElement, true);
    }

    /**
     * Parses one {@code <class>} with its methods. Without branch collection the methods carry
     * no branches and no branch percentage.
     */
    public ClassCoverage parseClass(Element classElement, boolean collectBranches) {
        String className = attribute(classElement, "name", "Unknown");
        ClassCoverage classCoverage = new ClassCoverage();
        classCoverage.setClassName(className);
        classCoverage.setNamespace(namespaceOf(className));
        classCoverage.setFilePath(attribute(classElement, "filename", ""));

        for (Element methodElement : XmlDocuments.children(XmlDocuments.child(classElement, "methods"), "method")) {
            MethodCoverage method = parseMethod(methodElement, collectBranches);
            method.setClassName(className);
            classCoverage.getMethods().add(method);
        }

        List<LineCoverage> lines = new ArrayList<>();
        for (Element lineElement : classLines(classElement)) {
            LineCoverage line = parseLine(lineElement);
            if (line != null) {
                lines.add(line);
            }
        }

        double lineRate = rate(classElement, "line-rate");
        double branchRate = rate(classElement, "branch-rate");
        int coveredMethods = (int) classCoverage.getMethods().stream()
                .filter(m -> m.getSummary().getLinesCoveredPercentage() > 0)
                .count();

        classCoverage.getSummary().recordLines(lines.size(), (int) lines.stream().filter(LineCoverage::isCovered).count());
        classCoverage.getSummary().recordMethods(classCoverage.getMethods().size(), coveredMethods);
        classCoverage.getSummary().recordClasses(1, lineRate > 0 ? 1 : 0);
        classCoverage.getSummary().setLinesCoveredPercentage(Percentages.fromRate(lineRate));
        if (collectBranches) {
            classCoverage.getSummary().setBranchesCoveredPercentage(Percentages.fromRate(branchRate));
        }
        return classCoverage;
    }

    public MethodCoverage parseMethod(Element methodElement) {
        return parseMethod(methodElement, true);
    }

    public MethodCoverage parseMethod(Element methodElement, boolean collectBranches) {
        MethodCoverage method = new MethodCoverage();
        method.setMethodName(attribute(methodElement, "name", "Unknown"));
        method.setSignature(attribute(methodElement, "signature", ""));

        int first = Integer.MAX_VALUE;
        int last = 0;
        for (Element lineElement : XmlDocuments.children(XmlDocuments.child(methodElement, "lines"), "line")) {
            LineCoverage line = parseLine(lineElement);
            if (line == null) {
                continue;
            }
            method.getLines().add(line);
            if (collectBranches) {
                method.getBranches().addAll(parseBranches(lineElement));
            }
            first = Math.min(first, line.getLineNumber());
            last = Math.max(last, line.getLineNumber());
        }
        if (!method.getLines().isEmpty()) {
            method.setStartLine(first);
            method.setEndLine(last);
        }

        int coveredLines = (int) method.getLines().stream().filter(LineCoverage::isCovered).count();
        int coveredBranches = (int) method.getBranches().stream().filter(BranchCoverage::isCovered).count();
        method.getSummary().recordLines(method.getLines().size(), coveredLines);
        method.getSummary().recordBranches(method.getBranches().size(), coveredBranches);
        method.getSummary().setLinesCoveredPercentage(Percentages.fromRate(rate(methodElement, "line-rate")));
        if (collectBranches) {
            method.getSummary().setBranchesCoveredPercentage(Percentages.fromRate(rate(methodElement, "branch-rate")));
        }
        return method;
    }

    /**
     * Parses a {@code <line>} element. Returns null (and logs) when the line number is missing
     * or malformed; a missing or malformed hit count reads as zero.
     */
    public LineCoverage parseLine(Element lineElement) {
        String numberText = lineElement.getAttribute("number");
        int lineNumber;
        try {
            lineNumber = Integer.parseInt(numberText.trim());
        } catch (NumberFormatException e) {
            log.warn("Skipping coverage line with invalid number '{}'", numberText);
            return null;
        }
        if (lineNumber <= 0) {
            log.warn("Skipping coverage line with invalid number '{}'", numberText);
            return null;
        }

        int hits = 0;
        String hitsText = lineElement.getAttribute("hits");
        if (!hitsText.isEmpty()) {
            try {
                hits = Math.max(0, Integer.parseInt(hitsText.trim()));
            } catch (NumberFormatException e) {
                log.debug("Line {} has malformed hits '{}', treating as 0", lineNumber, hitsText);
            }
        }

        return LineCoverage.builder()
                .lineNumber(lineNumber)
                .hitCount(hits)
                .status(hits > 0 ? CoverageStatus.COVERED : CoverageStatus.UNCOVERED)
                .branch("true".equalsIgnoreCase(lineElement.getAttribute("branch")))
                .build();
    }

    /**
     * Expands the {@code condition-coverage="50% (1/2)"} attribute of a branch line into
     * one entry per outcome. Covered outcomes come first since the report only carries counts.
     */
    public List<BranchCoverage> parseBranches(Element lineElement) {
        List<BranchCoverage> branches = new ArrayList<>();
        if (!"true".equalsIgnoreCase(lineElement.getAttribute("branch"))) {
            return branches;
        }
        String conditionCoverage = lineElement.getAttribute("condition-coverage");
        Matcher m = CONDITION_COVERAGE.matcher(conditionCoverage);
        if (!m.find()) {
            return branches;
        }

        int lineNumber;
        int covered;
        int total;
        try {
            lineNumber = Integer.parseInt(lineElement.getAttribute("number").trim());
            covered = Integer.parseInt(m.group(1));
            total = Integer.parseInt(m.group(2));
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed condition coverage '{}'", conditionCoverage);
            return branches;
        }

        Element condition = XmlDocuments.child(XmlDocuments.child(lineElement, "conditions"), "condition");
        BranchType type = BranchType.fromConditionType(condition != null ? condition.getAttribute("type") : null);

        for (int i = 0; i < total; i++) {
            branches.add(BranchCoverage.builder()
                    .lineNumber(lineNumber)
                    .branchNumber(i)
                    .hitCount(i < covered ? 1 : 0)
                    .condition(conditionCoverage)
                    .type(type)
                    .build());
        }
        return branches;
    }

    // Class-level <lines>, or the union of method lines when a report omits them
    private List<Element> classLines(Element classElement) {
        List<Element> lines = XmlDocuments.children(XmlDocuments.child(classElement, "lines"), "line");
        if (!lines.isEmpty()) {
            return lines;
        }
        List<Element> methodLines = new ArrayList<>();
        for (Element method : XmlDocuments.children(XmlDocuments.child(classElement, "methods"), "method")) {
            methodLines.addAll(XmlDocuments.children(XmlDocuments.child(method, "lines"), "line"));
        }
        return methodLines;
    }

    private static double rate(Element element, String name) {
        String value = element.getAttribute(name);
        if (value.isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Malformed {} '{}' on <{}>", name, value, element.getNodeName());
            return 0.0;
        }
    }

    private static String attribute(Element element, String name, String defaultValue) {
        String value = element.getAttribute(name);
        return value.isEmpty() ? defaultValue : value;
    }

    private static String namespaceOf(String className) {
        int dot = className.lastIndexOf('.');
        return dot > 0 ? className.substring(0, dot) : "";
    }

    private static final class FileAccumulator {
        private final String filePath;
        private final Map<Integer, LineCoverage> lines = new TreeMap<>();
        private final Map<String, BranchCoverage> branches = new LinkedHashMap<>();
        private final List<MethodCoverage> methods = new ArrayList<>();

        FileAccumulator(String filePath) {
            this.filePath = filePath;
        }

        void addLine(LineCoverage line) {
            lines.merge(line.getLineNumber(), line,
                    (existing, incoming) -> incoming.getHitCount() > existing.getHitCount() ? incoming : existing);
        }

        void addBranch(BranchCoverage branch) {
            branches.merge(branch.getLineNumber() + ":" + branch.getBranchNumber(), branch,
                    (existing, incoming) -> incoming.getHitCount() > existing.getHitCount() ? incoming : existing);
        }

        FileCoverage toFileCoverage() {
            FileCoverage file = new FileCoverage();
            file.setFilePath(filePath);
            file.setFileName(fileNameOf(filePath));
            file.getLines().addAll(lines.values());
            file.getBranches().addAll(branches.values());
            file.getMethods().addAll(methods);
            return file;
        }

        private static String fileNameOf(String path) {
            String unified = path.replace('\\', '/');
            int slash = unified.lastIndexOf('/');
            return slash >= 0 ? unified.substring(slash + 1) : unified;
        }
    }
}

package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.model.BranchCoverage;
import com.codelogickeep.coverage.model.ClassCoverage;
import com.codelogickeep.coverage.model.CoverageAnalysisResult;
import com.codelogickeep.coverage.model.CoverageStatus;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;
import com.codelogickeep.coverage.model.MethodCoverage;
import com.codelogickeep.coverage.model.ProjectCoverage;
import com.codelogickeep.coverage.model.TestExecutionSummary;
import com.codelogickeep.coverage.model.TestProjectRun;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds summaries bottom-up: files from their lines, projects from their files and classes,
 * the whole result from its projects. Percentages are always derived from summed counts.
 */
public class CoverageAggregator {

    /**
     * Recomputes the root summary of a result from its project summaries.
     * Calling it repeatedly yields the same summary.
     */
    public void calculateOverallSummary(CoverageAnalysisResult result) {
        int totalLines = 0;
        int coveredLines = 0;
        int totalBranches = 0;
        int coveredBranches = 0;
        int totalMethods = 0;
        int coveredMethods = 0;
        int totalClasses = 0;
        int coveredClasses = 0;

        for (ProjectCoverage project : result.getProjects()) {
            CoverageSummary s = project.getSummary();
            totalLines += s.getTotalLines();
            coveredLines += s.getCoveredLines();
            totalBranches += s.getTotalBranches();
            coveredBranches += s.getCoveredBranches();
            totalMethods += s.getTotalMethods();
            coveredMethods += s.getCoveredMethods();
            totalClasses += s.getTotalClasses();
            coveredClasses += s.getCoveredClasses();
        }

        CoverageSummary summary = new CoverageSummary();
        summary.recordLines(totalLines, coveredLines);
        summary.recordBranches(totalBranches, coveredBranches);
        summary.recordMethods(totalMethods, coveredMethods);
        summary.recordClasses(totalClasses, coveredClasses);
        result.setSummary(summary);
    }

    /**
     * Computes the summary of a file from its lines, branches and methods.
     *
     * @param classCount        classes reported against the file
     * @param coveredClassCount those with any line executed
     */
    public CoverageSummary summarizeFile(FileCoverage file, int classCount, int coveredClassCount) {
        CoverageSummary summary = new CoverageSummary();
        summary.recordLines(file.getLines().size(), countCoveredLines(file.getLines()));
        summary.recordBranches(file.getBranches().size(), countCoveredBranches(file.getBranches()));
        summary.recordMethods(file.getMethods().size(), countCoveredMethods(file.getMethods()));
        summary.recordClasses(classCount, coveredClassCount);
        file.setSummary(summary);
        return summary;
    }

    /**
     * Computes file summaries and the project summary.
     */
    public CoverageSummary summarizeProject(ProjectCoverage project) {
        int totalLines = 0;
        int coveredLines = 0;
        int totalBranches = 0;
        int coveredBranches = 0;
        int totalMethods = 0;
        int coveredMethods = 0;

        for (FileCoverage file : project.getFiles()) {
            int classCount = 0;
            int coveredClassCount = 0;
            for (ClassCoverage cls : project.getClasses()) {
                if (cls.getFilePath().equals(file.getFilePath())) {
                    classCount++;
                    if (isCovered(cls)) {
                        coveredClassCount++;
                    }
                }
            }
            CoverageSummary fileSummary = summarizeFile(file, classCount, coveredClassCount);
            totalLines += fileSummary.getTotalLines();
            coveredLines += fileSummary.getCoveredLines();
            totalBranches += fileSummary.getTotalBranches();
            coveredBranches += fileSummary.getCoveredBranches();
            totalMethods += fileSummary.getTotalMethods();
            coveredMethods += fileSummary.getCoveredMethods();
        }

        int coveredClasses = (int) project.getClasses().stream().filter(CoverageAggregator::isCovered).count();

        CoverageSummary summary = new CoverageSummary();
        summary.recordLines(totalLines, coveredLines);
        summary.recordBranches(totalBranches, coveredBranches);
        summary.recordMethods(totalMethods, coveredMethods);
        summary.recordClasses(project.getClasses().size(), coveredClasses);
        project.setSummary(summary);
        return summary;
    }

    /**
     * Merges projects with the same name (e.g. one library covered by two test projects).
     * Line hits are combined per file and line; a method or class counts as covered when
     * any of the merged reports covered it.
     */
    public List<ProjectCoverage> mergeProjects(Collection<ProjectCoverage> projects) {
        Map<String, ProjectCoverage> byName = new LinkedHashMap<>();
        for (ProjectCoverage project : projects) {
            ProjectCoverage existing = byName.get(project.getProjectName());
            if (existing == null) {
                byName.put(project.getProjectName(), project);
            } else {
                mergeInto(existing, project);
            }
        }
        return new ArrayList<>(byName.values());
    }

    /** Sums the per-project test summaries. */
    public TestExecutionSummary mergeTestResults(Collection<TestProjectRun> runs) {
        TestExecutionSummary total = new TestExecutionSummary();
        for (TestProjectRun run : runs) {
            total.add(run.getTestSummary());
        }
        return total;
    }

    private void mergeInto(ProjectCoverage target, ProjectCoverage source) {
        for (String root : source.getSourceRoots()) {
            if (!target.getSourceRoots().contains(root)) {
                target.getSourceRoots().add(root);
            }
        }

        Map<String, FileCoverage> files = new LinkedHashMap<>();
        target.getFiles().forEach(f -> files.put(f.getFilePath(), f));
        for (FileCoverage file : source.getFiles()) {
            FileCoverage existing = files.get(file.getFilePath());
            if (existing == null) {
                files.put(file.getFilePath(), file);
            } else {
                mergeFile(existing, file);
            }
        }
        target.setFiles(new ArrayList<>(files.values()));

        Map<String, ClassCoverage> classes = new LinkedHashMap<>();
        target.getClasses().forEach(c -> classes.put(c.getClassName(), c));
        for (ClassCoverage cls : source.getClasses()) {
            ClassCoverage existing = classes.get(cls.getClassName());
            if (existing == null) {
                classes.put(cls.getClassName(), cls);
            } else {
                mergeClass(existing, cls);
            }
        }
        target.setClasses(new ArrayList<>(classes.values()));
    }

    private void mergeFile(FileCoverage target, FileCoverage source) {
        Map<Integer, LineCoverage> lines = new TreeMap<>();
        target.getLines().forEach(l -> lines.put(l.getLineNumber(), l));
        for (LineCoverage line : source.getLines()) {
            lines.merge(line.getLineNumber(), line, (a, b) -> {
                int hits = a.getHitCount() + b.getHitCount();
                return LineCoverage.builder()
                        .lineNumber(a.getLineNumber())
                        .hitCount(hits)
                        .status(hits > 0 ? CoverageStatus.COVERED : CoverageStatus.UNCOVERED)
                        .branch(a.isBranch() || b.isBranch())
                        .sourceCode(a.getSourceCode() != null ? a.getSourceCode() : b.getSourceCode())
                        .build();
            });
        }
        target.setLines(new ArrayList<>(lines.values()));

        Map<String, BranchCoverage> branches = new LinkedHashMap<>();
        target.getBranches().forEach(b -> branches.put(b.getLineNumber() + ":" + b.getBranchNumber(), b));
        for (BranchCoverage branch : source.getBranches()) {
            branches.merge(branch.getLineNumber() + ":" + branch.getBranchNumber(), branch,
                    (a, b) -> a.getHitCount() >= b.getHitCount() ? a : b);
        }
        target.setBranches(new ArrayList<>(branches.values()));

        target.setMethods(mergeMethods(target.getMethods(), source.getMethods()));
    }

    private void mergeClass(ClassCoverage target, ClassCoverage source) {
        CoverageSummary t = target.getSummary();
        CoverageSummary s = source.getSummary();
        t.setLinesCoveredPercentage(Math.max(t.getLinesCoveredPercentage(), s.getLinesCoveredPercentage()));
        t.setBranchesCoveredPercentage(Math.max(t.getBranchesCoveredPercentage(), s.getBranchesCoveredPercentage()));
        target.setMethods(mergeMethods(target.getMethods(), source.getMethods()));
    }

    // Methods are shared between class and file trees, so merging a class also updates its file
    private List<MethodCoverage> mergeMethods(List<MethodCoverage> target, List<MethodCoverage> source) {
        Map<String, MethodCoverage> methods = new LinkedHashMap<>();
        target.forEach(m -> methods.put(m.getIdentifier(), m));
        for (MethodCoverage method : source) {
            MethodCoverage existing = methods.get(method.getIdentifier());
            if (existing == null) {
                methods.put(method.getIdentifier(), method);
            } else if (method.getSummary().getLinesCoveredPercentage() > existing.getSummary().getLinesCoveredPercentage()) {
                existing.setSummary(method.getSummary());
                existing.setLines(method.getLines());
                existing.setBranches(method.getBranches());
            }
        }
        return new ArrayList<>(methods.values());
    }

    private static boolean isCovered(ClassCoverage cls) {
        return cls.getSummary().getLinesCoveredPercentage() > 0;
    }

    private static int countCoveredLines(List<LineCoverage> lines) {
        return (int) lines.stream().filter(LineCoverage::isCovered).count();
    }

    private static int countCoveredBranches(List<BranchCoverage> branches) {
        return (int) branches.stream().filter(BranchCoverage::isCovered).count();
    }

    private static int countCoveredMethods(List<MethodCoverage> methods) {
        return (int) methods.stream().filter(m -> m.getSummary().getLinesCoveredPercentage() > 0).count();
    }
}

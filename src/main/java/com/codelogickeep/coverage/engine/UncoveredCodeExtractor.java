package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.exception.CoverageAnalysisException.ErrorCode;
import com.codelogickeep.coverage.model.BranchCoverage;
import com.codelogickeep.coverage.model.ClassCoverage;
import com.codelogickeep.coverage.model.CoverageAnalysisOptions;
import com.codelogickeep.coverage.model.CoverageAnalysisResult;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.LineCoverage;
import com.codelogickeep.coverage.model.MethodCoverage;
import com.codelogickeep.coverage.model.ProjectCoverage;
import com.codelogickeep.coverage.model.UncoveredBranch;
import com.codelogickeep.coverage.model.UncoveredCodeResult;
import com.codelogickeep.coverage.model.UncoveredLine;
import com.codelogickeep.coverage.model.UncoveredMethod;
import com.codelogickeep.coverage.util.PathPatterns;
import com.codelogickeep.coverage.util.SourceSnippetReader;

import java.util.Comparator;
import java.util.Optional;

/**
 * Flattens a coverage tree into lists of methods, lines and branches that no test executed.
 */
public class UncoveredCodeExtractor {

    public UncoveredCodeResult findUncovered(CoverageAnalysisResult analysis, CoverageAnalysisOptions options) {
        if (analysis == null) {
            return UncoveredCodeResult.failure(ErrorCode.NO_COVERAGE_DATA, "No coverage analysis result available.");
        }
        if (!analysis.isSuccess()) {
            ErrorCode code = analysis.getErrorCode() != null ? analysis.getErrorCode() : ErrorCode.UNKNOWN_ERROR;
            return UncoveredCodeResult.failure(code, analysis.getErrorMessage() != null
                    ? analysis.getErrorMessage()
                    : "Coverage analysis failed.");
        }

        UncoveredCodeResult result = new UncoveredCodeResult();
        SourceSnippetReader snippets = new SourceSnippetReader();

        for (ProjectCoverage project : analysis.getProjects()) {
            if (!isProjectSelected(project.getProjectName(), options)) {
                continue;
            }
            for (FileCoverage file : project.getFiles()) {
                if (PathPatterns.matchesAny(file.getFilePath(), options.getExcludedFiles())) {
                    continue;
                }
                collectFile(project, file, snippets, result);
            }
        }

        Comparator<UncoveredMethod> methodOrder = Comparator.comparing(UncoveredMethod::getFilePath)
                .thenComparingInt(UncoveredMethod::getStartLine);
        Comparator<UncoveredLine> lineOrder = Comparator.comparing(UncoveredLine::getFilePath)
                .thenComparingInt(UncoveredLine::getLineNumber);
        Comparator<UncoveredBranch> branchOrder = Comparator.comparing(UncoveredBranch::getFilePath)
                .thenComparingInt(UncoveredBranch::getLineNumber)
                .thenComparingInt(UncoveredBranch::getBranchNumber);
        result.getUncoveredMethods().sort(methodOrder);
        result.getUncoveredLines().sort(lineOrder);
        result.getUncoveredBranches().sort(branchOrder);

        result.setSuccess(true);
        return result;
    }

    private void collectFile(ProjectCoverage project, FileCoverage file, SourceSnippetReader snippets, UncoveredCodeResult result) {
        String defaultClass = project.getClasses().stream()
                .filter(c -> c.getFilePath().equals(file.getFilePath()))
                .map(ClassCoverage::getClassName)
                .findFirst()
                .orElse("");

        for (MethodCoverage method : file.getMethods()) {
            if (!method.isUncovered()) {
                continue;
            }
            int lineCount = method.getStartLine() > 0 ? method.getEndLine() - method.getStartLine() + 1 : 0;
            result.getUncoveredMethods().add(UncoveredMethod.builder()
                    .projectName(project.getProjectName())
                    .methodName(method.getMethodName())
                    .className(method.getClassName())
                    .filePath(file.getFilePath())
                    .startLine(method.getStartLine())
                    .endLine(method.getEndLine())
                    .signature(method.getSignature())
                    .lineCount(lineCount)
                    .reason(method.getLines().isEmpty()
                            ? "Method has no executable lines reported"
                            : "Method was never executed by any test")
                    .build());
        }

        for (LineCoverage line : file.getLines()) {
            if (line.isCovered()) {
                continue;
            }
            Optional<MethodCoverage> owner = ownerOf(file, line.getLineNumber());
            String source = line.getSourceCode() != null
                    ? line.getSourceCode()
                    : snippets.readLine(file.getFilePath(), project.getSourceRoots(), line.getLineNumber());
            result.getUncoveredLines().add(UncoveredLine.builder()
                    .projectName(project.getProjectName())
                    .filePath(file.getFilePath())
                    .lineNumber(line.getLineNumber())
                    .sourceCode(source)
                    .methodName(owner.map(MethodCoverage::getMethodName).orElse(""))
                    .className(owner.map(MethodCoverage::getClassName).orElse(defaultClass))
                    .build());
        }

        for (BranchCoverage branch : file.getBranches()) {
            if (branch.isCovered()) {
                continue;
            }
            Optional<MethodCoverage> owner = ownerOf(file, branch.getLineNumber());
            result.getUncoveredBranches().add(UncoveredBranch.builder()
                    .projectName(project.getProjectName())
                    .filePath(file.getFilePath())
                    .lineNumber(branch.getLineNumber())
                    .branchNumber(branch.getBranchNumber())
                    .condition(branch.getCondition())
                    .type(branch.getType())
                    .methodName(owner.map(MethodCoverage::getMethodName).orElse(""))
                    .className(owner.map(MethodCoverage::getClassName).orElse(defaultClass))
                    .build());
        }
    }

    private static Optional<MethodCoverage> ownerOf(FileCoverage file, int lineNumber) {
        return file.getMethods().stream().filter(m -> m.containsLine(lineNumber)).findFirst();
    }

    static boolean isProjectSelected(String projectName, CoverageAnalysisOptions options) {
        if (ProjectDiscovery.containsIgnoreCase(options.getExcludedProjects(), projectName)) {
            return false;
        }
        return options.getIncludedProjects().isEmpty()
                || ProjectDiscovery.containsIgnoreCase(options.getIncludedProjects(), projectName);
    }
}

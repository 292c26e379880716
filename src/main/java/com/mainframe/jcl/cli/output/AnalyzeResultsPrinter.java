package com.mainframe.jcl.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.cli.model.ValidatedAnalyzeOptions;
import com.mainframe.jcl.config.JclConfig;
import com.mainframe.jcl.diagnostics.JclDiagnostics;
import com.mainframe.jcl.diagnostics.UnresolvedSymbolWarning;
import com.mainframe.jcl.model.Step;
import com.mainframe.jcl.pipeline.AnalysisResult;

/**
 * Responsible only for printing CLI output for the "analyze" command.
 * No validation, no execution.
 */
public class AnalyzeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeResultsPrinter.class);

    public void printBanner(ValidatedAnalyzeOptions v) {
        JclConfig config = v.getConfig();
        log.info("=================================================");
        log.info("JCL Resolver");
        log.info("=================================================");
        log.info("Project: {}", config.getProjectName());
        log.info("Member Root: {}", config.getRoot());
        log.info("Libraries: {}", config.getLibraries().isEmpty() ? "None" : config.getLibraries());
        log.info("System: {}", config.getHostConvention());
        log.info("Extension: {}", config.getExtension() != null ? config.getExtension() : "None");
        log.info("Members: {}", v.getMembers());
        log.info("Max Depth / Passes: {} / {}", config.getMaxIncludeDepth(), config.getMaxExpansionPasses());
        log.info("Output: {}", v.getOutput() != null ? v.getOutput().toAbsolutePath() : "None");
        log.info("=================================================");
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  - {}", error);
        }
    }

    public void printResult(AnalysisResult result) {
        if (!result.isSuccess()) {
            printFailure(result);
            return;
        }

        log.info("");
        log.info("=================================================");
        log.info("ANALYSIS SUCCESSFUL: {}", result.getMember());
        log.info("=================================================");
        log.info("Steps: {}", result.getSteps().size());
        log.info("Allocations: {}", result.getAllocationCount());
        for (Step step : result.getSteps()) {
            log.info("  {} {}{} -> {}", step.getRelativeStep(),
                    step.getStepName() != null ? step.getStepName() : "(unnamed)",
                    step.getProcStepName() != null ? "." + step.getProcStepName() : "",
                    step.isProcCall() ? "PROC " + step.getProcName() : step.getProgramName());
        }
        printDiagnostics(result.getDiagnostics());
    }

    public void printFailure(AnalysisResult result) {
        log.error("Analysis of {} failed [{}] at {} line {}: {}", result.getMember(), result.getErrorKind(),
                result.getErrorMember(), result.getErrorLine(), result.getErrorMessage());
    }

    public void printSummary(List<AnalysisResult> results) {
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("");
        log.info("=================================================");
        log.info("{} member(s) analyzed, {} failed", results.size(), failed);
        log.info("=================================================");
    }

    private void printDiagnostics(JclDiagnostics diagnostics) {
        if (diagnostics == null) {
            return;
        }
        log.info("");
        log.info("Diagnostics:");
        log.info("  Skipped statements: {}", diagnostics.getSkipCount());
        log.info("  Unresolved symbols: {}", diagnostics.getUnresolvedSymbols().size());
        for (UnresolvedSymbolWarning warning : diagnostics.getUnresolvedSymbols()) {
            log.info("    {}", warning);
        }
        if (!diagnostics.getWarnings().isEmpty()) {
            log.info("  Warnings: {}", diagnostics.getWarnings().size());
        }
    }
}

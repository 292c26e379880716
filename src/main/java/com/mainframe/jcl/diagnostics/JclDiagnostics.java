package com.mainframe.jcl.diagnostics;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics accumulated during one pipeline run.
 *
 * Pure structure only: no logging, no formatting, no IO. Each run owns its own instance.
 */
@Getter
public class JclDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();
    private final List<SkippedStatement> skippedStatements = new ArrayList<>();
    private final List<UnresolvedSymbolWarning> unresolvedSymbols = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void recordSkipped(SkippedStatement skipped) {
        skippedStatements.add(skipped);
        errors.add(skipped.getReason());
    }

    public void recordUnresolved(UnresolvedSymbolWarning warning) {
        unresolvedSymbols.add(warning);
        warnings.add(warning.toString());
    }

    public int getSkipCount() {
        return skippedStatements.size();
    }
}

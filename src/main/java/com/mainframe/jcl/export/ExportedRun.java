package com.mainframe.jcl.export;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mainframe.jcl.diagnostics.JclDiagnostics;
import com.mainframe.jcl.pipeline.AnalysisResult;

import lombok.Builder;
import lombok.Value;

/**
 * Serialized form of one analysis run.
 */
@Value
@Builder
@JsonPropertyOrder({"project", "member", "success", "error", "steps", "diagnostics"})
public class ExportedRun {
    String project;
    String member;
    boolean success;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Failure error;
    List<ExportedStep> steps;
    Diagnostics diagnostics;

    static ExportedRun from(AnalysisResult result) {
        Failure error = result.isSuccess() ? null
                : new Failure(result.getErrorKind(), result.getErrorMessage(), result.getErrorMember(),
                        result.getErrorLine());
        return ExportedRun.builder()
                .project(result.getProjectName())
                .member(result.getMember())
                .success(result.isSuccess())
                .error(error)
                .steps(result.getSteps().stream().map(ExportedStep::from).toList())
                .diagnostics(Diagnostics.from(result.getDiagnostics()))
                .build();
    }

    @Value
    public static class Failure {
        String kind;
        String message;
        String member;
        int line;
    }

    @Value
    @Builder
    public static class Diagnostics {
        int skipCount;
        List<String> skipped;
        List<String> unresolvedSymbols;
        List<String> warnings;
        List<String> errors;

        static Diagnostics from(JclDiagnostics diagnostics) {
            if (diagnostics == null) {
                diagnostics = new JclDiagnostics();
            }
            return Diagnostics.builder()
                    .skipCount(diagnostics.getSkipCount())
                    .skipped(diagnostics.getSkippedStatements().stream()
                            .map(s -> s.getMemberName() + " line " + s.getFirstLine() + ": " + s.getStatementText())
                            .toList())
                    .unresolvedSymbols(diagnostics.getUnresolvedSymbols().stream().map(Object::toString).toList())
                    .warnings(List.copyOf(diagnostics.getWarnings()))
                    .errors(List.copyOf(diagnostics.getErrors()))
                    .build();
        }
    }
}

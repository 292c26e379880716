package com.mainframe.jcl.pipeline;

import java.util.List;

import com.mainframe.jcl.diagnostics.JclDiagnostics;
import com.mainframe.jcl.exception.JclProcessingException;
import com.mainframe.jcl.model.Step;

import lombok.Builder;
import lombok.Data;

/**
 * Result of analyzing one member tree. A failed run carries no steps.
 */
@Data
@Builder
public class AnalysisResult {
    private boolean success;
    private String projectName;
    private String member;
    @Builder.Default
    private List<Step> steps = List.of();
    private JclDiagnostics diagnostics;

    private String errorMessage;
    private String errorKind;
    private String errorMember;
    private int errorLine;

    public int getAllocationCount() {
        return steps.stream().mapToInt(s -> s.getAllocations().size()).sum();
    }

    public static AnalysisResult failure(String projectName, String member, JclProcessingException e,
                                         JclDiagnostics diagnostics) {
        return AnalysisResult.builder()
                .success(false)
                .projectName(projectName)
                .member(member)
                .diagnostics(diagnostics)
                .errorMessage(e.getMessage())
                .errorKind(e.getKind())
                .errorMember(e.getMemberName())
                .errorLine(e.getLine())
                .build();
    }
}

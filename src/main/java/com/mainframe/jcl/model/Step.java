package com.mainframe.jcl.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * A job step. Exactly one of {@code programName} and {@code procName} is set.
 */
@Value
@Builder
public class Step {
    int stepId;
    String relativeStep;
    String stepName;
    String procStepName;
    String programName;
    String procName;
    String parameters;
    String condLogic;
    String sourceMember;
    int sourceLine;
    @Builder.Default
    List<DataAllocation> allocations = List.of();

    public boolean isProcCall() {
        return procName != null;
    }
}

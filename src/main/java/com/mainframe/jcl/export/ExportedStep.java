package com.mainframe.jcl.export;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mainframe.jcl.model.Step;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonPropertyOrder({"step_id", "relative_step", "step_name", "proc_step_name", "program_name", "proc_name",
        "parameters", "cond_logic", "source_member", "source_line", "allocations"})
public class ExportedStep {
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
    List<ExportedAllocation> allocations;

    static ExportedStep from(Step step) {
        return ExportedStep.builder()
                .stepId(step.getStepId())
                .relativeStep(step.getRelativeStep())
                .stepName(step.getStepName())
                .procStepName(step.getProcStepName())
                .programName(step.getProgramName())
                .procName(step.getProcName())
                .parameters(step.getParameters())
                .condLogic(step.getCondLogic())
                .sourceMember(step.getSourceMember())
                .sourceLine(step.getSourceLine())
                .allocations(step.getAllocations().stream().map(ExportedAllocation::from).toList())
                .build();
    }
}

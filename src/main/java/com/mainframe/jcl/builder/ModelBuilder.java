package com.mainframe.jcl.builder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.diagnostics.JclDiagnostics;
import com.mainframe.jcl.diagnostics.SkippedStatement;
import com.mainframe.jcl.exception.JclParseException;
import com.mainframe.jcl.model.DataAllocation;
import com.mainframe.jcl.model.Statement;
import com.mainframe.jcl.model.Step;
import com.mainframe.jcl.model.node.ConditionNode;
import com.mainframe.jcl.model.node.DdNode;
import com.mainframe.jcl.model.node.ExecNode;
import com.mainframe.jcl.model.node.IncludeNode;
import com.mainframe.jcl.model.node.JclNode;
import com.mainframe.jcl.model.node.JclNodeVisitor;
import com.mainframe.jcl.model.node.JcllibNode;
import com.mainframe.jcl.model.node.PendNode;
import com.mainframe.jcl.model.node.ProcNode;
import com.mainframe.jcl.model.node.SetNode;

/**
 * Assembles Step and DataAllocation records from the expanded node stream.
 *
 * Concatenation: a labeled DD opens a dd name group at offset 1; each following
 * unlabeled DD joins the last group of its step with the next offset. A
 * {@code PROCSTEP.DDNAME} label addresses the most recent step expanded from that
 * procedure step and replaces any allocation it already has under that dd name, in
 * the position of the first one replaced. A labeled DD without a qualifier that follows
 * a procedure call belongs to the first step of that procedure and is treated the same way.
 *
 * One builder per run; {@link #build(List)} resets it.
 */
public class ModelBuilder implements JclNodeVisitor {
    private static final Logger log = LoggerFactory.getLogger(ModelBuilder.class);

    private final char tier;
    private final JclDiagnostics diagnostics;
    private final AllocationFactory allocationFactory;

    private RelativeStepSequence sequence;
    private List<StepDraft> steps;
    private Deque<ConditionFrame> conditions;
    /** Step that received the previous DD; unlabeled DDs continue its concatenation. */
    private StepDraft ddTarget;
    /** First program step of the latest job-level procedure call, or null. */
    private StepDraft invocationFirstStep;

    public ModelBuilder(JclDiagnostics diagnostics) {
        this(RelativeStepSequence.DEFAULT_TIER, diagnostics);
    }

    public ModelBuilder(char tier, JclDiagnostics diagnostics) {
        this.tier = tier;
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.allocationFactory = new AllocationFactory();
        reset();
    }

    public List<Step> build(List<JclNode> nodes) {
        reset();
        for (JclNode node : nodes) {
            node.accept(this);
        }
        if (!conditions.isEmpty()) {
            String msg = conditions.size() + " IF construct(s) without ENDIF";
            diagnostics.getWarnings().add(msg);
            log.warn(msg);
        }

        List<Step> result = steps.stream().map(StepDraft::toStep).collect(Collectors.toUnmodifiableList());
        log.info("Built {} step(s) with {} allocation(s)", result.size(),
                result.stream().mapToInt(s -> s.getAllocations().size()).sum());
        return result;
    }

    private void reset() {
        sequence = new RelativeStepSequence(tier);
        steps = new ArrayList<>();
        conditions = new ArrayDeque<>();
        ddTarget = null;
        invocationFirstStep = null;
    }

    @Override
    public void visit(ExecNode node) {
        StepDraft draft = new StepDraft();
        draft.stepId = steps.size() + 1;
        draft.relativeStep = sequence.next();
        if (node.isInsideProc()) {
            draft.stepName = node.getInvokingStepName();
            draft.procStepName = node.getLabel();
        } else {
            draft.stepName = node.getLabel();
        }
        draft.programName = node.getProgramName();
        draft.procName = node.getProcName();
        draft.parameters = node.getParm();
        draft.condLogic = node.getCond() != null ? node.getCond() : activeCondition();
        draft.sourceMember = node.getMemberName();
        draft.sourceLine = node.getLine();
        steps.add(draft);
        ddTarget = null;
        if (!node.isInsideProc()) {
            invocationFirstStep = null;
        } else if (invocationFirstStep == null && !node.isProcCall()) {
            invocationFirstStep = draft;
        }
        log.debug("Step {} {} ({})", draft.relativeStep, draft.stepName,
                draft.programName != null ? draft.programName : "PROC " + draft.procName);
    }

    @Override
    public void visit(DdNode node) {
        if (steps.isEmpty()) {
            skip("DD statement before any EXEC", node.getStatement());
            return;
        }

        StepDraft target = ddTarget != null && !node.hasLabel() ? ddTarget : steps.get(steps.size() - 1);
        Optional<String> procStep = node.getProcStepQualifier();
        boolean replacing = procStep.isPresent();
        if (procStep.isEmpty() && node.hasLabel() && !node.isInsideProc() && invocationFirstStep != null) {
            target = invocationFirstStep;
            replacing = true;
        } else if (procStep.isPresent()) {
            Optional<StepDraft> found = findProcStep(procStep.get());
            if (found.isEmpty()) {
                skip("No procedure step " + procStep.get() + " for override " + node.getLabel(), node.getStatement());
                return;
            }
            target = found.get();
        }

        String ddName;
        int offset;
        int position;
        if (node.hasLabel()) {
            ddName = node.getDdName();
            offset = 1;
            int replaced = replacing ? target.removeAllocations(ddName) : -1;
            position = replaced >= 0 ? replaced : target.allocations.size();
        } else {
            if (target.lastDdName == null) {
                skip("Unlabeled DD without a preceding DD in the step", node.getStatement());
                return;
            }
            ddName = target.lastDdName;
            offset = target.lastOffset + 1;
            position = target.lastIndex + 1;
        }

        DataAllocation allocation = allocationFactory.create(node)
                .ddName(ddName)
                .allocationOffset(offset)
                .build();
        target.allocations.add(position, allocation);
        target.lastDdName = ddName;
        target.lastOffset = offset;
        target.lastIndex = position;
        ddTarget = target;
        log.debug("  DD {}#{} -> {}", ddName, offset, allocation.getDsn());
    }

    @Override
    public void visit(ConditionNode node) {
        switch (node.getKind()) {
            case IF -> conditions.push(new ConditionFrame(node.getExpression()));
            case ELSE -> {
                if (conditions.isEmpty()) {
                    skip("ELSE without IF", node.getStatement());
                } else {
                    conditions.peek().inElse = true;
                }
            }
            case ENDIF -> {
                if (conditions.isEmpty()) {
                    skip("ENDIF without IF", node.getStatement());
                } else {
                    conditions.pop();
                }
            }
            default -> log.debug("Ignoring {} at {}", node.getKind(), node.getStatement().span());
        }
    }

    @Override
    public void visit(SetNode node) {
        ignored(node);
    }

    @Override
    public void visit(ProcNode node) {
        ignored(node);
    }

    @Override
    public void visit(PendNode node) {
        ignored(node);
    }

    @Override
    public void visit(IncludeNode node) {
        ignored(node);
    }

    @Override
    public void visit(JcllibNode node) {
        ignored(node);
    }

    private void ignored(JclNode node) {
        // resolved before the model is built
        log.debug("Ignoring {} node at {} line {}", node.getOpcode(), node.getMemberName(), node.getLine());
    }

    /**
     * Text of the enclosing IF branches, innermost last, or null outside any IF.
     */
    private String activeCondition() {
        if (conditions.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        Iterator<ConditionFrame> outermostFirst = conditions.descendingIterator();
        while (outermostFirst.hasNext()) {
            parts.add(outermostFirst.next().render());
        }
        return String.join(" AND ", parts);
    }

    private Optional<StepDraft> findProcStep(String procStepName) {
        for (int i = steps.size() - 1; i >= 0; i--) {
            StepDraft draft = steps.get(i);
            if (procStepName.equals(draft.procStepName)) {
                return Optional.of(draft);
            }
        }
        return Optional.empty();
    }

    private void skip(String reason, Statement statement) {
        JclParseException error = new JclParseException(reason, statement.getText(), statement.getMemberName(),
                statement.getFirstLine(), statement.getLastLine());
        diagnostics.recordSkipped(SkippedStatement.from(error));
        log.warn("Skipping statement: {}", error.getMessage());
    }

    private static final class ConditionFrame {
        private final String expression;
        private boolean inElse;

        private ConditionFrame(String expression) {
            String trimmed = expression.trim();
            this.expression = trimmed.startsWith("(") && trimmed.endsWith(")") ? trimmed : "(" + trimmed + ")";
        }

        private String render() {
            return inElse ? "NOT (" + expression + ")" : expression;
        }
    }

    private static final class StepDraft {
        private int stepId;
        private String relativeStep;
        private String stepName;
        private String procStepName;
        private String programName;
        private String procName;
        private String parameters;
        private String condLogic;
        private String sourceMember;
        private int sourceLine;
        private final List<DataAllocation> allocations = new ArrayList<>();
        private String lastDdName;
        private int lastOffset;
        private int lastIndex = -1;

        /**
         * @return index of the first allocation removed, or -1 when none had that dd name
         */
        private int removeAllocations(String ddName) {
            int first = -1;
            for (int i = allocations.size() - 1; i >= 0; i--) {
                if (allocations.get(i).getDdName().equals(ddName)) {
                    allocations.remove(i);
                    first = i;
                }
            }
            return first;
        }

        private Step toStep() {
            return Step.builder()
                    .stepId(stepId)
                    .relativeStep(relativeStep)
                    .stepName(stepName)
                    .procStepName(procStepName)
                    .programName(programName)
                    .procName(procName)
                    .parameters(parameters)
                    .condLogic(condLogic)
                    .sourceMember(sourceMember)
                    .sourceLine(sourceLine)
                    .allocations(List.copyOf(allocations))
                    .build();
        }
    }
}

package com.mainframe.jcl.resolver;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.diagnostics.SkippedStatement;
import com.mainframe.jcl.exception.JclParseException;
import com.mainframe.jcl.exception.MemberNotFoundException;
import com.mainframe.jcl.exception.MemberReadException;
import com.mainframe.jcl.model.SourceMember;
import com.mainframe.jcl.model.Statement;
import com.mainframe.jcl.model.node.DdNode;
import com.mainframe.jcl.model.node.ExecNode;
import com.mainframe.jcl.model.node.IncludeNode;
import com.mainframe.jcl.model.node.JclNode;
import com.mainframe.jcl.model.node.JclOpcode;
import com.mainframe.jcl.model.node.JcllibNode;
import com.mainframe.jcl.model.node.PendNode;
import com.mainframe.jcl.model.node.ProcNode;
import com.mainframe.jcl.model.node.SetNode;
import com.mainframe.jcl.parser.SourceNormalizer;
import com.mainframe.jcl.parser.StatementClassifier;
import com.mainframe.jcl.symbol.ScopeFrame;
import com.mainframe.jcl.symbol.ScopeKind;
import com.mainframe.jcl.symbol.SymbolTable;
import com.mainframe.jcl.symbol.SymbolicExpander;

import lombok.Value;

/**
 * Expands a member tree into a flat stream of classified nodes.
 *
 * Every member it reads goes through normalization, symbol expansion and classification.
 * INCLUDE members and procedure bodies are expanded depth-first in place; SET, JCLLIB
 * and in-stream PROC definitions update the run's context and produce no node.
 *
 * Parse errors are recorded in the run's diagnostics and the statement is skipped.
 * Missing members, cycles, depth overruns and divergent symbols abort the run.
 */
public class MemberResolver {
    private static final Logger log = LoggerFactory.getLogger(MemberResolver.class);

    private final MemberSource source;
    private final SourceNormalizer normalizer;
    private final StatementClassifier classifier;
    private final SymbolicExpander expander;
    private final boolean allowMissingProcs;

    public MemberResolver(MemberSource source) {
        this(source, new SourceNormalizer(), new StatementClassifier(), new SymbolicExpander(), false);
    }

    public MemberResolver(MemberSource source, SourceNormalizer normalizer, StatementClassifier classifier,
                          SymbolicExpander expander, boolean allowMissingProcs) {
        this.source = Objects.requireNonNull(source, "source");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.expander = Objects.requireNonNull(expander, "expander");
        this.allowMissingProcs = allowMissingProcs;
    }

    /**
     * Find a member in the first location that holds it.
     *
     * @throws MemberNotFoundException listing every location searched
     */
    public SourceMember resolve(String memberName, List<String> searchPaths) {
        return resolve(memberName, searchPaths, null, 0);
    }

    /**
     * Expand the root member and everything it pulls in.
     */
    public List<JclNode> expand(String rootMember, ExpansionContext context) {
        Objects.requireNonNull(rootMember, "rootMember");
        Objects.requireNonNull(context, "context");

        List<JclNode> nodes = new ArrayList<>();
        context.enter(rootMember, null, 0);
        try {
            SourceMember member = resolve(rootMember, context.getSearchPaths(), null, 0);
            process(normalizer.normalize(member), context, null, nodes);
        } finally {
            context.exit(rootMember);
        }
        log.info("Expanded {} into {} node(s)", rootMember, nodes.size());
        return nodes;
    }

    private SourceMember resolve(String memberName, List<String> searchPaths, String referencingMember, int line) {
        List<String> searched = new ArrayList<>();
        for (String location : searchPaths) {
            searched.add(source.describe(location));
            Optional<SourceMember> found;
            try {
                found = source.find(memberName, location);
            } catch (IOException e) {
                log.error("Failed to read member {} from {}", memberName, location, e);
                throw new MemberReadException(memberName, source.describe(location), e);
            }
            if (found.isPresent()) {
                log.info("Resolved {} -> {}", memberName, found.get().getOrigin());
                return found.get();
            }
        }
        throw new MemberNotFoundException(memberName, searched, referencingMember, line);
    }

    /**
     * Walk one member's statements.
     *
     * @param invocation the procedure call being expanded, or null in the job stream
     */
    private void process(List<Statement> statements, ExpansionContext context, ProcInvocation invocation,
                         List<JclNode> out) {
        int index = 0;
        while (index < statements.size()) {
            Statement raw = statements.get(index++);

            Statement statement = expander.expand(raw, context.getSymbols(), context.getDiagnostics());
            Optional<JclNode> classified;
            try {
                classified = classifier.classify(statement);
            } catch (JclParseException e) {
                context.getDiagnostics().recordSkipped(SkippedStatement.from(e));
                log.warn("Skipping statement: {}", e.getMessage());
                continue;
            }
            if (classified.isEmpty()) {
                continue;
            }
            JclNode node = classified.get();

            if (node instanceof SetNode set) {
                set.getAssignments().forEach(context::defineGlobal);
                log.debug("SET {} at {}", set.getAssignments(), statement.span());
            } else if (node instanceof IncludeNode include) {
                expandInclude(include, context, invocation, out);
            } else if (node instanceof JcllibNode jcllib) {
                context.prependSearchPaths(jcllib.getOrder());
                log.info("JCLLIB ORDER {} -> search path {}", jcllib.getOrder(), context.getSearchPaths());
            } else if (node instanceof ProcNode proc) {
                if (invocation != null) {
                    skip(context, "Nested PROC definition inside procedure " + invocation.getProcName(), statement);
                } else {
                    index = captureInstreamProc(proc, raw, statements, index, context);
                }
            } else if (node instanceof PendNode) {
                log.debug("Ignoring PEND outside an in-stream definition at {}", statement.span());
            } else if (node instanceof ExecNode exec) {
                ExecNode step = invocation != null
                        ? exec.withProcContext(invocation.getStepName(), invocation.getProcName())
                        : exec;
                out.add(step);
                if (step.isProcCall()) {
                    expandProcCall(step, context, out);
                }
            } else if (node instanceof DdNode dd && invocation != null) {
                out.add(dd.withProcContext(invocation.getProcName()));
            } else {
                out.add(node);
            }
        }
    }

    private void expandInclude(IncludeNode include, ExpansionContext context, ProcInvocation invocation,
                               List<JclNode> out) {
        String member = include.getTargetMember();
        context.enter(member, include.getMemberName(), include.getLine());
        try {
            SourceMember resolved = resolve(member, context.getSearchPaths(), include.getMemberName(), include.getLine());
            process(normalizer.normalize(resolved), context, invocation, out);
        } finally {
            context.exit(member);
        }
    }

    /**
     * Expand an EXEC that calls a procedure: in-stream definitions first, then the
     * cataloged member. The procedure's defaults and the call's overrides are scoped
     * to the body and replace those of any enclosing invocation; SET values made
     * inside it stay global.
     */
    private void expandProcCall(ExecNode exec, ExpansionContext context, List<JclNode> out) {
        String procName = exec.getProcName();
        context.enter(procName, exec.getMemberName(), exec.getLine());
        try {
            Statement header;
            List<Statement> body;

            Optional<InstreamProc> instream = context.findInstreamProc(procName);
            if (instream.isPresent()) {
                header = instream.get().getHeader();
                body = instream.get().getBody();
                log.debug("Calling in-stream procedure {}", procName);
            } else {
                SourceMember member;
                try {
                    member = resolve(procName, context.getSearchPaths(), exec.getMemberName(), exec.getLine());
                } catch (MemberNotFoundException e) {
                    if (!allowMissingProcs) {
                        throw e;
                    }
                    context.getDiagnostics().getWarnings().add(e.getMessage());
                    log.warn("Procedure {} not found, step {} left unexpanded", procName, exec.getLabel());
                    return;
                }
                List<Statement> statements = normalizer.normalize(member);
                int procIndex = indexOfOpcode(statements, JclOpcode.PROC);
                header = procIndex >= 0 ? statements.get(procIndex) : null;
                int start = procIndex >= 0 ? procIndex + 1 : 0;
                int pend = indexOfOpcode(statements.subList(start, statements.size()), JclOpcode.PEND);
                body = statements.subList(start, pend >= 0 ? start + pend : statements.size());
            }

            Map<String, String> defaults = header != null ? procDefaults(header, context) : Map.of();
            String stepName = exec.getLabel() != null ? exec.getLabel() : procName;

            // the body sees GLOBAL plus this invocation only, never an enclosing procedure's frames
            SymbolTable caller = context.getSymbols();
            context.setSymbols(caller.globalOnly()
                    .push(new ScopeFrame(ScopeKind.PROC_DEFAULT, procName, defaults))
                    .push(new ScopeFrame(ScopeKind.CALL_OVERRIDE, stepName, exec.getSymbolicOverrides())));
            try {
                process(body, context, new ProcInvocation(stepName, procName), out);
            } finally {
                context.setSymbols(caller.withGlobalOf(context.getSymbols()));
            }
        } finally {
            context.exit(procName);
        }
    }

    /**
     * Store statements up to PEND under the procedure's name.
     *
     * @return index of the first statement after the definition
     */
    private int captureInstreamProc(ProcNode proc, Statement rawHeader, List<Statement> statements, int index,
                                    ExpansionContext context) {
        List<Statement> body = new ArrayList<>();
        boolean terminated = false;
        while (index < statements.size()) {
            Statement candidate = statements.get(index++);
            if (opcodeOf(candidate) == JclOpcode.PEND) {
                terminated = true;
                break;
            }
            body.add(candidate);
        }

        if (!proc.hasLabel()) {
            skip(context, "In-stream PROC without a name", rawHeader);
            return index;
        }
        if (!terminated) {
            context.getDiagnostics().getWarnings().add(
                    "In-stream procedure " + proc.getProcName() + " has no PEND (" + rawHeader.span() + ")");
            log.warn("In-stream procedure {} has no PEND", proc.getProcName());
        }
        context.registerInstreamProc(new InstreamProc(proc.getProcName(), rawHeader, body));
        log.info("Registered in-stream procedure {} ({} statement(s))", proc.getProcName(), body.size());
        return index;
    }

    /**
     * PROC statement defaults, expanded in the caller's scope.
     */
    private Map<String, String> procDefaults(Statement header, ExpansionContext context) {
        Statement expanded = expander.expand(header, context.getSymbols(), context.getDiagnostics());
        try {
            return classifier.classify(expanded)
                    .filter(ProcNode.class::isInstance)
                    .map(node -> ((ProcNode) node).getDefaults())
                    .orElse(Map.of());
        } catch (JclParseException e) {
            context.getDiagnostics().recordSkipped(SkippedStatement.from(e));
            log.warn("Skipping PROC defaults: {}", e.getMessage());
            return Map.of();
        }
    }

    private int indexOfOpcode(List<Statement> statements, JclOpcode opcode) {
        for (int i = 0; i < statements.size(); i++) {
            if (opcodeOf(statements.get(i)) == opcode) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Operation of an unexpanded statement, or null when it cannot be tokenized yet.
     */
    private JclOpcode opcodeOf(Statement statement) {
        try {
            return classifier.tokenize(statement).getOpcode();
        } catch (JclParseException e) {
            return null;
        }
    }

    private void skip(ExpansionContext context, String reason, Statement statement) {
        JclParseException error = new JclParseException(reason, statement.getText(), statement.getMemberName(),
                statement.getFirstLine(), statement.getLastLine());
        context.getDiagnostics().recordSkipped(SkippedStatement.from(error));
        log.warn("Skipping statement: {}", error.getMessage());
    }

    @Value
    private static class ProcInvocation {
        String stepName;
        String procName;
    }
}

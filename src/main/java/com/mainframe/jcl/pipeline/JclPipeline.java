package com.mainframe.jcl.pipeline;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.builder.ModelBuilder;
import com.mainframe.jcl.config.JclConfig;
import com.mainframe.jcl.diagnostics.JclDiagnostics;
import com.mainframe.jcl.exception.JclProcessingException;
import com.mainframe.jcl.model.Step;
import com.mainframe.jcl.model.node.JclNode;
import com.mainframe.jcl.parser.SourceNormalizer;
import com.mainframe.jcl.parser.StatementClassifier;
import com.mainframe.jcl.resolver.ExpansionContext;
import com.mainframe.jcl.resolver.MemberResolver;
import com.mainframe.jcl.resolver.MemberSource;
import com.mainframe.jcl.symbol.SymbolicExpander;

/**
 * Runs the whole chain for one member tree: resolve and expand, then build the model.
 *
 * Each call to {@link #analyze(String)} owns a fresh context, symbol table and
 * diagnostics, so one pipeline may be reused but nothing leaks between runs.
 */
public class JclPipeline {
    private static final Logger log = LoggerFactory.getLogger(JclPipeline.class);

    private final JclConfig config;
    private final MemberSource source;

    public JclPipeline(JclConfig config) {
        this(config, config.createMemberSource());
    }

    public JclPipeline(JclConfig config, MemberSource source) {
        this.config = Objects.requireNonNull(config, "config");
        this.source = Objects.requireNonNull(source, "source");
    }

    public AnalysisResult analyze(String member) {
        Objects.requireNonNull(member, "member");
        JclDiagnostics diagnostics = new JclDiagnostics();

        log.info("Analyzing {} (search path {})", member, config.getSearchPaths());
        try {
            MemberResolver resolver = new MemberResolver(source, new SourceNormalizer(), new StatementClassifier(),
                    new SymbolicExpander(config.getMaxExpansionPasses()), config.isAllowMissingProcs());
            ExpansionContext context = new ExpansionContext(config.getSearchPaths(), diagnostics,
                    config.getMaxIncludeDepth());

            List<JclNode> nodes = resolver.expand(member, context);
            List<Step> steps = new ModelBuilder(config.getTierLetter(), diagnostics).build(nodes);

            log.info("{}: {} step(s), {} skipped statement(s), {} unresolved symbol(s)", member, steps.size(),
                    diagnostics.getSkipCount(), diagnostics.getUnresolvedSymbols().size());
            return AnalysisResult.builder()
                    .success(true)
                    .projectName(config.getProjectName())
                    .member(member)
                    .steps(steps)
                    .diagnostics(diagnostics)
                    .build();
        } catch (JclProcessingException e) {
            diagnostics.getErrors().add(e.getMessage());
            log.error("{} failed at {}: {}", member, e.describeLocation(), e.getMessage());
            return AnalysisResult.failure(config.getProjectName(), member, e, diagnostics);
        }
    }
}

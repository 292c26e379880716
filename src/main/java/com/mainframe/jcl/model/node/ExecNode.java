package com.mainframe.jcl.model.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.mainframe.jcl.model.Statement;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * EXEC statement. Names either a program ({@code PGM=}) or a procedure (positional
 * name or {@code PROC=}); never both.
 */
@Getter
@ToString(callSuper = true)
public class ExecNode extends JclNode {

    /** EXEC keywords that configure the step rather than override proc symbols. */
    public static final Set<String> RESERVED_KEYWORDS = Set.of(
            "PGM", "PROC", "PARM", "PARMDD", "COND", "REGION", "REGIONX", "TIME", "ACCT",
            "ADDRSPC", "DYNAMNBR", "PERFORM", "RD", "DPRTY", "MEMLIMIT", "CCSID");

    private final String programName;
    private final String procName;
    private final String parm;
    private final String cond;
    private final Map<String, JclValue> keywords;
    /** Set when this step came out of an expanded procedure. */
    private final String invokingStepName;
    private final String enclosingProcName;

    @Builder
    public ExecNode(String label, Statement statement, String programName, String procName,
                    String parm, String cond, Map<String, JclValue> keywords,
                    String invokingStepName, String enclosingProcName) {
        super(label, statement);
        this.programName = programName;
        this.procName = procName;
        this.parm = parm;
        this.cond = cond;
        this.keywords = keywords != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(keywords))
                : Map.of();
        this.invokingStepName = invokingStepName;
        this.enclosingProcName = enclosingProcName;
    }

    @Override
    public JclOpcode getOpcode() {
        return JclOpcode.EXEC;
    }

    @Override
    public void accept(JclNodeVisitor visitor) {
        visitor.visit(this);
    }

    public boolean isProcCall() {
        return procName != null;
    }

    public boolean isInsideProc() {
        return enclosingProcName != null;
    }

    /**
     * Keyword=value pairs that override symbolic parameters of the called procedure.
     */
    public Map<String, String> getSymbolicOverrides() {
        Map<String, String> overrides = new LinkedHashMap<>();
        keywords.forEach((key, value) -> {
            String base = key.contains(".") ? key.substring(0, key.indexOf('.')) : key;
            if (!RESERVED_KEYWORDS.contains(base.toUpperCase(Locale.ROOT))) {
                overrides.put(key.toUpperCase(Locale.ROOT), value == null ? "" : value.render());
            }
        });
        return overrides;
    }

    /**
     * Copy tagged with the procedure invocation it was expanded from.
     */
    public ExecNode withProcContext(String invokingStep, String procedure) {
        return new ExecNode(label, statement, programName, procName, parm, cond, keywords,
                invokingStep, procedure);
    }
}

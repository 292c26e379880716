package com.mainframe.jcl.model.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.mainframe.jcl.model.Statement;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * DD statement, kept close to its operands; the model builder decides what they mean.
 */
@Getter
@ToString(callSuper = true)
public class DdNode extends JclNode {

    private final List<String> positionals;
    private final Map<String, JclValue> keywords;
    /** Set when this DD came out of an expanded procedure body. */
    private final String enclosingProcName;

    @Builder
    public DdNode(String label, Statement statement, List<String> positionals, Map<String, JclValue> keywords,
                  String enclosingProcName) {
        super(label, statement);
        this.enclosingProcName = enclosingProcName;
        this.positionals = positionals != null ? List.copyOf(positionals) : List.of();
        this.keywords = keywords != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(keywords))
                : Map.of();
    }

    @Override
    public JclOpcode getOpcode() {
        return JclOpcode.DD;
    }

    @Override
    public void accept(JclNodeVisitor visitor) {
        visitor.visit(this);
    }

    public Optional<JclValue> keyword(String name) {
        return Optional.ofNullable(keywords.get(name.toUpperCase(Locale.ROOT)));
    }

    public boolean hasKeyword(String name) {
        return keywords.containsKey(name.toUpperCase(Locale.ROOT));
    }

    public boolean hasPositional(String value) {
        return positionals.stream().anyMatch(p -> p.equalsIgnoreCase(value));
    }

    public boolean isDummy() {
        return hasPositional("DUMMY");
    }

    public boolean isInstream() {
        return hasPositional("*") || hasPositional("DATA");
    }

    /**
     * Proc-step qualifier of a {@code PROCSTEP.DDNAME} override label, if any.
     */
    public Optional<String> getProcStepQualifier() {
        if (label == null || !label.contains(".")) return Optional.empty();
        return Optional.of(label.substring(0, label.indexOf('.')));
    }

    /**
     * DD name without any proc-step qualifier.
     */
    public String getDdName() {
        if (label == null) return null;
        return label.contains(".") ? label.substring(label.indexOf('.') + 1) : label;
    }

    public boolean isInsideProc() {
        return enclosingProcName != null;
    }

    public DdNode withProcContext(String procedure) {
        return new DdNode(label, statement, positionals, keywords, procedure);
    }

    public List<String> getInstreamData() {
        return statement != null ? statement.getInstreamData() : List.of();
    }
}

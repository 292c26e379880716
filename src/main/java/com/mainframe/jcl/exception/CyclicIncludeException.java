package com.mainframe.jcl.exception;

import java.util.List;

/**
 * A member was requested while it is still being expanded further up the same branch.
 */
public class CyclicIncludeException extends JclProcessingException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CyclicIncludeException(List<String> cycle, String referencingMember, int line) {
        super("Cyclic dependency detected: " + String.join(" -> ", cycle)
                + " (referenced from " + referencingMember + " line " + line + ")", referencingMember, line);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }

    @Override
    public String getKind() {
        return "CyclicInclude";
    }
}

package com.mainframe.jcl.exception;

public class RecursionLimitExceededException extends JclProcessingException {

    private static final long serialVersionUID = 1L;

    private final int limit;

    public RecursionLimitExceededException(String requestedMember, int limit, String referencingMember, int line) {
        super("Expansion of '" + requestedMember + "' exceeds the nesting limit of " + limit
                + " (referenced from " + referencingMember + " line " + line + ")", referencingMember, line);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String getKind() {
        return "RecursionLimitExceeded";
    }
}

package com.mainframe.jcl.exception;

/**
 * Fatal failure of a single member-tree pipeline run.
 *
 * Carries the member and physical line where the failure was detected so the
 * caller can surface file and statement context. A run that throws one of these
 * hands no steps to the exporter.
 */
public abstract class JclProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String memberName;
    private final int line;

    protected JclProcessingException(String message, String memberName, int line) {
        super(message);
        this.memberName = memberName;
        this.line = line;
    }

    public String getMemberName() {
        return memberName;
    }

    /**
     * 1-based physical line, or 0 when the failure is not tied to a line.
     */
    public int getLine() {
        return line;
    }

    /**
     * Short label for the failure kind, used in reports.
     */
    public abstract String getKind();

    public String describeLocation() {
        if (memberName == null) {
            return "<unknown member>";
        }
        return line > 0 ? memberName + " line " + line : memberName;
    }
}

package com.mainframe.jcl.exception;

/**
 * Symbol substitution kept changing the statement after the maximum number of passes,
 * which means some symbol refers back to itself.
 */
public class SymbolExpansionDivergenceException extends JclProcessingException {

    private static final long serialVersionUID = 1L;

    private final String originalText;
    private final int passes;

    public SymbolExpansionDivergenceException(String originalText, int passes, String memberName, int line) {
        super("Symbol expansion did not settle after " + passes + " passes: " + originalText, memberName, line);
        this.originalText = originalText;
        this.passes = passes;
    }

    public String getOriginalText() {
        return originalText;
    }

    public int getPasses() {
        return passes;
    }

    @Override
    public String getKind() {
        return "SymbolExpansionDivergence";
    }
}

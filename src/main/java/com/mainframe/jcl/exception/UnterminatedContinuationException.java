package com.mainframe.jcl.exception;

/**
 * Input ended (or a non-JCL line arrived) while a statement was still being continued.
 */
public class UnterminatedContinuationException extends JclProcessingException {

    private static final long serialVersionUID = 1L;

    public UnterminatedContinuationException(String memberName, int line, String pendingText) {
        super("Unterminated continuation in " + memberName + " starting at line " + line
                + ": " + pendingText, memberName, line);
    }

    @Override
    public String getKind() {
        return "UnterminatedContinuation";
    }
}

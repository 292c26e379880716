package com.mainframe.jcl.exception;

/**
 * Recoverable classification failure for one statement. The statement is skipped and
 * counted; the run continues.
 */
public class JclParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String statementText;
    private final String memberName;
    private final int firstLine;
    private final int lastLine;

    public JclParseException(String message, String statementText, String memberName, int firstLine, int lastLine) {
        super(message + " in " + memberName + " lines " + firstLine + "-" + lastLine + ": " + statementText);
        this.statementText = statementText;
        this.memberName = memberName;
        this.firstLine = firstLine;
        this.lastLine = lastLine;
    }

    public String getStatementText() {
        return statementText;
    }

    public String getMemberName() {
        return memberName;
    }

    public int getFirstLine() {
        return firstLine;
    }

    public int getLastLine() {
        return lastLine;
    }
}

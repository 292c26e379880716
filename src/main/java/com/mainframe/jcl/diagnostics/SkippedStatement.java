package com.mainframe.jcl.diagnostics;

import com.mainframe.jcl.exception.JclParseException;

import lombok.Value;

/**
 * Record of a statement dropped after a recoverable parse failure.
 */
@Value
public class SkippedStatement {
    String reason;
    String statementText;
    String memberName;
    int firstLine;
    int lastLine;

    public static SkippedStatement from(JclParseException e) {
        return new SkippedStatement(e.getMessage(), e.getStatementText(), e.getMemberName(),
                e.getFirstLine(), e.getLastLine());
    }
}

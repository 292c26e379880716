package com.mainframe.jcl.diagnostics;

import lombok.Value;

/**
 * A {@code &NAME} reference that no scope frame could resolve. Non-fatal: the token is
 * left verbatim in the statement text.
 */
@Value
public class UnresolvedSymbolWarning {
    String symbol;
    String memberName;
    int line;

    @Override
    public String toString() {
        return "&" + symbol + " unresolved in " + memberName + " line " + line;
    }
}

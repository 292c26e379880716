package com.mainframe.jcl.symbol;

import java.util.List;

import lombok.Value;

/**
 * Statement text after symbol substitution, plus the names still unresolved.
 */
@Value
public class ExpansionResult {
    String text;
    List<String> unresolved;
    int passes;

    public boolean isFullyResolved() {
        return unresolved.isEmpty();
    }
}

package com.mainframe.jcl.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One logical JCL statement: continuation lines joined, comment field removed.
 * Immutable; symbol expansion produces a copy via {@link #withText(String)}.
 */
@Value
@Builder(toBuilder = true)
public class Statement {
    @With
    String text;
    String memberName;
    int firstLine;
    int lastLine;
    /** Payload lines of a {@code DD *} / {@code DD DATA} statement, otherwise empty. */
    @Builder.Default
    List<String> instreamData = List.of();

    public boolean hasInstreamData() {
        return instreamData != null && !instreamData.isEmpty();
    }

    public String span() {
        return firstLine == lastLine ? memberName + " line " + firstLine
                : memberName + " lines " + firstLine + "-" + lastLine;
    }
}

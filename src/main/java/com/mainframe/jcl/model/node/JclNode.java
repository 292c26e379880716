package com.mainframe.jcl.model.node;

import com.mainframe.jcl.model.Statement;

import lombok.Getter;
import lombok.ToString;

/**
 * Base class for classified statements.
 */
@Getter
@ToString
public abstract class JclNode {
    protected final String label;
    @ToString.Exclude
    protected final Statement statement;

    protected JclNode(String label, Statement statement) {
        this.label = label;
        this.statement = statement;
    }

    public abstract JclOpcode getOpcode();

    public abstract void accept(JclNodeVisitor visitor);

    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }

    public String getMemberName() {
        return statement != null ? statement.getMemberName() : null;
    }

    public int getLine() {
        return statement != null ? statement.getFirstLine() : 0;
    }
}

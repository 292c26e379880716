package com.mainframe.jcl.model.node;

import com.mainframe.jcl.model.Statement;

import lombok.Getter;
import lombok.ToString;

/**
 * IF / ELSE / ENDIF construct. The expression is carried as written and never evaluated.
 */
@Getter
@ToString(callSuper = true)
public class ConditionNode extends JclNode {

    private final JclOpcode kind;
    private final String expression;

    public ConditionNode(String label, Statement statement, JclOpcode kind, String expression) {
        super(label, statement);
        this.kind = kind;
        this.expression = expression;
    }

    @Override
    public JclOpcode getOpcode() {
        return kind;
    }

    @Override
    public void accept(JclNodeVisitor visitor) {
        visitor.visit(this);
    }
}

package com.mainframe.jcl.model.node;

import java.util.List;

import com.mainframe.jcl.model.Statement;

import lombok.Getter;
import lombok.ToString;

/**
 * JCLLIB ORDER=(...): libraries searched ahead of the configured ones.
 */
@Getter
@ToString(callSuper = true)
public class JcllibNode extends JclNode {

    private final List<String> order;

    public JcllibNode(String label, Statement statement, List<String> order) {
        super(label, statement);
        this.order = List.copyOf(order);
    }

    @Override
    public JclOpcode getOpcode() {
        return JclOpcode.JCLLIB;
    }

    @Override
    public void accept(JclNodeVisitor visitor) {
        visitor.visit(this);
    }
}

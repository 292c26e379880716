package com.mainframe.jcl.model.node;

import com.mainframe.jcl.model.Statement;

public class PendNode extends JclNode {

    public PendNode(String label, Statement statement) {
        super(label, statement);
    }

    @Override
    public JclOpcode getOpcode() {
        return JclOpcode.PEND;
    }

    @Override
    public void accept(JclNodeVisitor visitor) {
        visitor.visit(this);
    }
}

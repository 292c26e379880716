package com.mainframe.jcl.model.node;

import com.mainframe.jcl.model.Statement;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class IncludeNode extends JclNode {

    private final String targetMember;

    public IncludeNode(String label, Statement statement, String targetMember) {
        super(label, statement);
        this.targetMember = targetMember;
    }

    @Override
    public JclOpcode getOpcode() {
        return JclOpcode.INCLUDE;
    }

    @Override
    public void accept(JclNodeVisitor visitor) {
        visitor.visit(this);
    }
}

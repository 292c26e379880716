package com.mainframe.jcl.model.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.mainframe.jcl.model.Statement;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class SetNode extends JclNode {

    private final Map<String, String> assignments;

    public SetNode(String label, Statement statement, Map<String, String> assignments) {
        super(label, statement);
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    @Override
    public JclOpcode getOpcode() {
        return JclOpcode.SET;
    }

    @Override
    public void accept(JclNodeVisitor visitor) {
        visitor.visit(this);
    }
}

package com.mainframe.jcl.model.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.mainframe.jcl.model.Statement;

import lombok.Getter;
import lombok.ToString;

/**
 * PROC statement; the label is the procedure name, the keywords its symbol defaults.
 */
@Getter
@ToString(callSuper = true)
public class ProcNode extends JclNode {

    private final Map<String, String> defaults;

    public ProcNode(String label, Statement statement, Map<String, String> defaults) {
        super(label, statement);
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    @Override
    public JclOpcode getOpcode() {
        return JclOpcode.PROC;
    }

    @Override
    public void accept(JclNodeVisitor visitor) {
        visitor.visit(this);
    }

    public String getProcName() {
        return label;
    }
}

package com.mainframe.jcl.model.node;

/**
 * Visitor over classified statements.
 */
public interface JclNodeVisitor {
    void visit(ExecNode node);

    void visit(DdNode node);

    void visit(SetNode node);

    void visit(ProcNode node);

    void visit(PendNode node);

    void visit(IncludeNode node);

    void visit(JcllibNode node);

    void visit(ConditionNode node);
}

package com.mainframe.jcl.resolver;

import java.util.List;

import com.mainframe.jcl.model.Statement;

import lombok.Value;

/**
 * In-stream procedure captured between PROC and PEND. Statements are kept unexpanded;
 * symbols are substituted when the procedure is called.
 */
@Value
public class InstreamProc {
    String name;
    Statement header;
    List<Statement> body;

    public InstreamProc(String name, Statement header, List<Statement> body) {
        this.name = name;
        this.header = header;
        this.body = List.copyOf(body);
    }
}

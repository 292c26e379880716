package com.mainframe.jcl.parser;

import java.util.List;

import com.mainframe.jcl.model.Statement;
import com.mainframe.jcl.model.node.JclOpcode;

import lombok.Value;

/**
 * Tokenized statement: name and operation fields plus the lexed operand field.
 * The token list always ends with an EOF token.
 */
@Value
public class JclTokenStream {
    Statement statement;
    String label;
    JclOpcode opcode;
    String operandText;
    List<JclToken> tokens;

    public boolean hasLabel() {
        return label != null;
    }
}

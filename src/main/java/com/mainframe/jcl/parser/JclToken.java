package com.mainframe.jcl.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token of a logical JCL statement.
 * Column is the 0-based offset inside the field the token was read from.
 */
@Data
@AllArgsConstructor
public class JclToken {
    private TokenType type;
    private String value;
    private int column;
    private int length;

    public enum TokenType {
        LABEL,
        OPCODE,
        WORD,
        QUOTED,
        COMMA,
        LPAREN,
        RPAREN,
        EQUALS,
        EOF
    }

    public int endColumn() {
        return column + length;
    }
}

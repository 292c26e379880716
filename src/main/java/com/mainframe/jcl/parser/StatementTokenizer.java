package com.mainframe.jcl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.exception.JclParseException;
import com.mainframe.jcl.model.Statement;
import com.mainframe.jcl.model.node.JclOpcode;
import com.mainframe.jcl.parser.JclToken.TokenType;

/**
 * Tokenizer for logical JCL statements.
 *
 * The name and operation fields are identified with {@link FieldMatcher}; the operand
 * field is lexed into words, quoted strings and punctuation. Conditional statements
 * (IF/ELSE/ENDIF) keep their operand text unlexed.
 */
public class StatementTokenizer {
    private static final Logger log = LoggerFactory.getLogger(StatementTokenizer.class);

    public JclTokenStream tokenize(Statement statement) {
        String text = statement.getText();
        if (text == null || !text.startsWith("//")) {
            throw error("Statement does not start with //", statement);
        }

        String body = text.substring(2);
        List<JclToken> tokens = new ArrayList<>();

        int pos = 0;
        String nameField = null;
        if (!body.isEmpty() && !Character.isWhitespace(body.charAt(0))) {
            pos = wordEnd(body, 0);
            nameField = body.substring(0, pos);
        }
        pos = skipBlanks(body, pos);
        int opEnd = wordEnd(body, pos);
        String operationField = body.substring(pos, opEnd);
        int operandStart = skipBlanks(body, opEnd);

        String label = null;
        String operation;
        String operandText;

        if (nameField != null) {
            switch (FieldMatcher.match(nameField)) {
                case OPCODE -> {
                    operation = nameField;
                    operandText = body.substring(skipBlanks(body, nameField.length())).trim();
                }
                case LABEL -> {
                    label = nameField.toUpperCase(Locale.ROOT);
                    operation = operationField;
                    operandText = body.substring(operandStart).trim();
                }
                default -> throw error("Invalid name field '" + nameField + "'", statement);
            }
        } else {
            operation = operationField;
            operandText = body.substring(operandStart).trim();
        }

        if (operation.isEmpty()) {
            throw error("Missing operation field", statement);
        }
        if (FieldMatcher.match(operation) != FieldMatcher.OPCODE) {
            throw error("Unknown operation '" + operation + "'", statement);
        }
        JclOpcode opcode = JclOpcode.fromKeyword(operation).orElseThrow();

        if (label != null) {
            tokens.add(new JclToken(TokenType.LABEL, label, 2, label.length()));
        }
        tokens.add(new JclToken(TokenType.OPCODE, opcode.name(), 0, operation.length()));

        if (!isConditional(opcode)) {
            lexOperands(operandText, statement, tokens);
        }
        tokens.add(new JclToken(TokenType.EOF, "", operandText.length(), 0));

        log.debug("Tokenized {} {} with {} token(s)", opcode, statement.span(), tokens.size());
        return new JclTokenStream(statement, label, opcode, operandText, List.copyOf(tokens));
    }

    private void lexOperands(String operands, Statement statement, List<JclToken> tokens) {
        int pos = 0;
        while (pos < operands.length()) {
            char c = operands.charAt(pos);

            if (Character.isWhitespace(c)) {
                // anything after an unquoted blank is comment text
                break;
            }
            switch (c) {
                case ',' -> {
                    tokens.add(new JclToken(TokenType.COMMA, ",", pos, 1));
                    pos++;
                }
                case '(' -> {
                    tokens.add(new JclToken(TokenType.LPAREN, "(", pos, 1));
                    pos++;
                }
                case ')' -> {
                    tokens.add(new JclToken(TokenType.RPAREN, ")", pos, 1));
                    pos++;
                }
                case '=' -> {
                    tokens.add(new JclToken(TokenType.EQUALS, "=", pos, 1));
                    pos++;
                }
                case '\'' -> pos = readQuoted(operands, pos, statement, tokens);
                default -> pos = readWord(operands, pos, tokens);
            }
        }
    }

    private int readQuoted(String operands, int start, Statement statement, List<JclToken> tokens) {
        StringBuilder sb = new StringBuilder();
        int pos = start + 1;
        while (pos < operands.length()) {
            char c = operands.charAt(pos);
            if (c == '\'') {
                // doubled quote is an escaped quote
                if (pos + 1 < operands.length() && operands.charAt(pos + 1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                tokens.add(new JclToken(TokenType.QUOTED, sb.toString(), start, pos + 1 - start));
                return pos + 1;
            }
            sb.append(c);
            pos++;
        }
        throw error("Unterminated quoted string", statement);
    }

    private int readWord(String operands, int start, List<JclToken> tokens) {
        int pos = start;
        while (pos < operands.length()) {
            char c = operands.charAt(pos);
            if (c == ',' || c == '(' || c == ')' || c == '=' || c == '\'' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        String word = operands.substring(start, pos);
        tokens.add(new JclToken(TokenType.WORD, word, start, word.length()));
        return pos;
    }

    private static boolean isConditional(JclOpcode opcode) {
        return opcode == JclOpcode.IF || opcode == JclOpcode.THEN
                || opcode == JclOpcode.ELSE || opcode == JclOpcode.ENDIF;
    }

    private static int wordEnd(String text, int from) {
        int pos = from;
        while (pos < text.length() && !Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static int skipBlanks(String text, int from) {
        int pos = from;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    static JclParseException error(String message, Statement statement) {
        return new JclParseException(message, statement.getText(), statement.getMemberName(),
                statement.getFirstLine(), statement.getLastLine());
    }
}

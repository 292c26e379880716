package com.mainframe.jcl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.mainframe.jcl.model.Statement;
import com.mainframe.jcl.model.node.JclParameter;
import com.mainframe.jcl.model.node.JclValue;
import com.mainframe.jcl.parser.JclToken.TokenType;

/**
 * Recursive-descent parser for the operand field of one statement.
 *
 * <pre>
 * parameters := parameter? (',' parameter?)*
 * parameter  := WORD '=' value | value
 * value      := QUOTED | '(' parameters ')' | WORD ('=' value)? suffix? | (empty)
 * suffix     := '(' ... ')' immediately after the word, e.g. LIB(MEMBER) or GDG(+1)
 * </pre>
 */
class OperandParser {

    private final List<JclToken> tokens;
    private final Statement statement;
    private int pos;

    OperandParser(JclTokenStream stream) {
        this.tokens = stream.getTokens();
        this.statement = stream.getStatement();
        this.pos = 0;
        while (check(TokenType.LABEL) || check(TokenType.OPCODE)) {
            advance();
        }
    }

    List<JclParameter> parseAll() {
        List<JclParameter> params = parseParameters(false);
        if (!isAtEnd()) {
            throw StatementTokenizer.error("Unexpected '" + peek().getValue() + "' in operands", statement);
        }
        return params;
    }

    private List<JclParameter> parseParameters(boolean inList) {
        List<JclParameter> params = new ArrayList<>();
        if (isAtEnd() || (inList && check(TokenType.RPAREN))) {
            return params;
        }
        while (true) {
            if (check(TokenType.COMMA) || (inList && check(TokenType.RPAREN)) || isAtEnd()) {
                params.add(JclParameter.positional(null));
            } else {
                params.add(parseParameter());
            }
            if (check(TokenType.COMMA)) {
                advance();
                if (!inList && isAtEnd()) {
                    break;
                }
                continue;
            }
            break;
        }
        return params;
    }

    private JclParameter parseParameter() {
        if (check(TokenType.WORD) && checkNext(TokenType.EQUALS)) {
            String keyword = advance().getValue().toUpperCase(Locale.ROOT);
            advance();
            return JclParameter.keyword(keyword, parseValue());
        }
        return JclParameter.positional(parseValue());
    }

    private JclValue parseValue() {
        if (check(TokenType.QUOTED)) {
            return JclValue.quoted(advance().getValue());
        }
        if (check(TokenType.LPAREN)) {
            advance();
            List<JclParameter> items = parseParameters(true);
            expect(TokenType.RPAREN);
            return JclValue.list(items);
        }
        if (check(TokenType.WORD)) {
            JclToken word = advance();
            if (check(TokenType.EQUALS)) {
                // nested keyword, e.g. VOL=SER=123456
                advance();
                JclValue inner = parseValue();
                return JclValue.list(List.of(JclParameter.keyword(word.getValue().toUpperCase(Locale.ROOT), inner)));
            }
            if (check(TokenType.LPAREN) && peek().getColumn() == word.endColumn()) {
                return JclValue.scalar(word.getValue() + readSuffix());
            }
            return JclValue.scalar(word.getValue());
        }
        if (check(TokenType.COMMA) || check(TokenType.RPAREN) || isAtEnd()) {
            // KEYWORD= with nothing after it
            return JclValue.scalar("");
        }
        throw StatementTokenizer.error("Unexpected '" + peek().getValue() + "' in operands", statement);
    }

    private String readSuffix() {
        StringBuilder sb = new StringBuilder();
        int depth = 0;
        do {
            JclToken token = advance();
            if (token.getType() == TokenType.LPAREN) depth++;
            if (token.getType() == TokenType.RPAREN) depth--;
            sb.append(token.getType() == TokenType.QUOTED ? "'" + token.getValue() + "'" : token.getValue());
            if (isAtEnd() && depth > 0) {
                throw StatementTokenizer.error("Unbalanced parentheses", statement);
            }
        } while (depth > 0);
        return sb.toString();
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private JclToken peek() {
        return tokens.get(pos);
    }

    private JclToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private boolean checkNext(TokenType type) {
        return pos + 1 < tokens.size() && tokens.get(pos + 1).getType() == type;
    }

    private JclToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private JclToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw StatementTokenizer.error("Expected " + type + " but found " + peek().getType(), statement);
    }
}

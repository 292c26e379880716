package com.mainframe.jcl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.exception.UnterminatedContinuationException;
import com.mainframe.jcl.model.SourceMember;
import com.mainframe.jcl.model.Statement;
import com.mainframe.jcl.model.node.JclOpcode;

/**
 * Turns card images into logical statements.
 *
 * Handles the JCL column conventions:
 * - Columns 1-72: statement area
 * - Columns 73-80: sequence area (ignored)
 * - {@code //*} comment cards, {@code /*} delimiters and a bare {@code //} are dropped
 * - A statement whose operand field ends with a comma continues on the next card
 * - Text after the operand field is a comment
 * - Cards following {@code DD *} / {@code DD DATA} are in-stream data, not JCL
 */
public class SourceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SourceNormalizer.class);

    public static final int SIGNIFICANT_COLUMNS = 72;

    private static final Pattern INSTREAM_DD = Pattern.compile(
            "^//\\S*\\s+DD\\s+(\\*|DATA)\\s*(,|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DLM_OPERAND = Pattern.compile(
            "DLM=(?:'([^']{2})'|([^\\s,']{2}))", Pattern.CASE_INSENSITIVE);

    /**
     * Apply the column rules to one physical card.
     *
     * @return the significant text, or empty for comment, delimiter, end-marker and blank cards
     */
    public Optional<String> normalizeLine(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String line = truncate(raw).stripTrailing();
        if (line.isEmpty()) {
            return Optional.empty();
        }
        if (line.startsWith("//*") || line.startsWith("/*") || line.equals("//")) {
            return Optional.empty();
        }
        return Optional.of(line);
    }

    public List<Statement> normalize(SourceMember member) {
        return joinStatements(member.getName(), member.getLines());
    }

    /**
     * Join physical cards into logical statements and capture in-stream data.
     *
     * @throws UnterminatedContinuationException when the input ends (or non-JCL text
     *         appears) while a statement is still being continued
     */
    public List<Statement> joinStatements(String memberName, List<String> lines) {
        List<Statement> statements = new ArrayList<>();
        StringBuilder pending = null;
        int pendingStart = 0;

        int index = 0;
        while (index < lines.size()) {
            int lineNumber = index + 1;
            Optional<String> normalized = normalizeLine(lines.get(index));
            index++;

            if (normalized.isEmpty()) {
                continue;
            }
            String line = normalized.get();

            if (!line.startsWith("//")) {
                if (pending != null) {
                    throw new UnterminatedContinuationException(memberName, pendingStart, pending.toString());
                }
                log.debug("Ignoring non-JCL card in {} line {}", memberName, lineNumber);
                continue;
            }

            boolean continuation = pending != null;
            String content = stripCommentField(line, continuation);
            if (!continuation) {
                pending = new StringBuilder(content);
                pendingStart = lineNumber;
            } else {
                pending.append(content);
            }

            if (endsWithComma(pending)) {
                continue;
            }

            Statement statement = Statement.builder()
                    .text(pending.toString())
                    .memberName(memberName)
                    .firstLine(pendingStart)
                    .lastLine(lineNumber)
                    .build();
            pending = null;

            Matcher instream = INSTREAM_DD.matcher(statement.getText());
            if (instream.find()) {
                boolean dataForm = instream.group(1).equalsIgnoreCase("DATA");
                String delimiter = findDelimiter(statement.getText());
                List<String> payload = new ArrayList<>();
                index = collectPayload(lines, index, dataForm, delimiter, payload);
                statement = statement.toBuilder().instreamData(List.copyOf(payload)).build();
                log.debug("Captured {} in-stream card(s) for {}", payload.size(), statement.span());
            }

            statements.add(statement);
        }

        if (pending != null) {
            throw new UnterminatedContinuationException(memberName, pendingStart, pending.toString());
        }

        return statements;
    }

    /**
     * Reduce a card to its name, operation and operand fields.
     * Continuation cards contribute operand text only.
     */
    String stripCommentField(String line, boolean continuation) {
        String body = line.substring(2);

        if (continuation) {
            return operandField(body.stripLeading());
        }

        int pos = 0;
        String name = "";
        if (!body.isEmpty() && !Character.isWhitespace(body.charAt(0))) {
            pos = wordEnd(body, 0);
            name = body.substring(0, pos);
        }
        pos = skipBlanks(body, pos);
        int opEnd = wordEnd(body, pos);
        String operation = body.substring(pos, opEnd);
        String rest = body.substring(skipBlanks(body, opEnd));

        // A reserved word in the name field is the operation itself.
        if (!name.isEmpty() && JclOpcode.isReserved(name)) {
            rest = (operation + " " + rest).trim();
            operation = name;
            name = "";
        }

        if (operation.isEmpty()) {
            return "//" + name;
        }

        String operands = isConditional(operation) ? rest.trim() : operandField(rest);
        StringBuilder sb = new StringBuilder("//").append(name).append(' ').append(operation);
        if (!operands.isEmpty()) {
            sb.append(' ').append(operands);
        }
        return sb.toString();
    }

    private int collectPayload(List<String> lines, int index, boolean dataForm, String delimiter,
                               List<String> payload) {
        while (index < lines.size()) {
            String card = truncate(lines.get(index)).stripTrailing();
            if (delimiter != null) {
                if (card.startsWith(delimiter)) {
                    return index + 1;
                }
            } else if (card.startsWith("/*")) {
                return index + 1;
            } else if (!dataForm && card.startsWith("//")) {
                // next statement: leave it for the caller
                return index;
            }
            payload.add(card);
            index++;
        }
        return index;
    }

    private String findDelimiter(String statementText) {
        Matcher m = DLM_OPERAND.matcher(statementText);
        if (!m.find()) {
            return null;
        }
        return m.group(1) != null ? m.group(1) : m.group(2);
    }

    /**
     * Operand text up to the first blank outside quotes.
     */
    private static String operandField(String text) {
        boolean inQuotes = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                inQuotes = !inQuotes;
            } else if (Character.isWhitespace(c) && !inQuotes) {
                return text.substring(0, i);
            }
        }
        return text;
    }

    private static boolean isConditional(String operation) {
        return JclOpcode.fromKeyword(operation)
                .map(op -> op == JclOpcode.IF || op == JclOpcode.THEN
                        || op == JclOpcode.ELSE || op == JclOpcode.ENDIF)
                .orElse(false);
    }

    private static boolean endsWithComma(CharSequence text) {
        return text.length() > 0 && text.charAt(text.length() - 1) == ',';
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

    private static String truncate(String raw) {
        String line = raw;
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        return line.length() > SIGNIFICANT_COLUMNS ? line.substring(0, SIGNIFICANT_COLUMNS) : line;
    }
}

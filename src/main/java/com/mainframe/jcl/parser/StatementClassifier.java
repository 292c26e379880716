package com.mainframe.jcl.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.exception.JclParseException;
import com.mainframe.jcl.model.Statement;
import com.mainframe.jcl.model.node.ConditionNode;
import com.mainframe.jcl.model.node.DdNode;
import com.mainframe.jcl.model.node.ExecNode;
import com.mainframe.jcl.model.node.IncludeNode;
import com.mainframe.jcl.model.node.JclNode;
import com.mainframe.jcl.model.node.JclOpcode;
import com.mainframe.jcl.model.node.JclParameter;
import com.mainframe.jcl.model.node.JclValue;
import com.mainframe.jcl.model.node.JcllibNode;
import com.mainframe.jcl.model.node.PendNode;
import com.mainframe.jcl.model.node.ProcNode;
import com.mainframe.jcl.model.node.SetNode;

/**
 * Classifies resolved statements into typed nodes.
 *
 * Classification only:
 * - Parses the operand field
 * - Builds the node for the statement's operation
 *
 * It does NOT interpret DD semantics (DSN precedence, defaults); that belongs to the
 * model builder. Statements the model does not need (JOB, OUTPUT, ...) yield no node.
 */
public class StatementClassifier {
    private static final Logger log = LoggerFactory.getLogger(StatementClassifier.class);

    private static final Map<String, String> DD_KEYWORD_ALIASES = Map.of(
            "DSNAME", "DSN",
            "VOLUME", "VOL");

    private final StatementTokenizer tokenizer;

    public StatementClassifier() {
        this(new StatementTokenizer());
    }

    public StatementClassifier(StatementTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public JclTokenStream tokenize(Statement statement) {
        return tokenizer.tokenize(statement);
    }

    /**
     * Tokenize and classify in one go.
     *
     * @throws JclParseException when the statement is malformed
     */
    public Optional<JclNode> classify(Statement statement) {
        return classify(tokenize(statement));
    }

    public Optional<JclNode> classify(JclTokenStream stream) {
        JclOpcode opcode = stream.getOpcode();
        JclNode node = switch (opcode) {
            case EXEC -> classifyExec(stream);
            case DD -> classifyDd(stream);
            case SET -> classifySet(stream);
            case PROC -> classifyProc(stream);
            case PEND -> new PendNode(stream.getLabel(), stream.getStatement());
            case INCLUDE -> classifyInclude(stream);
            case JCLLIB -> classifyJcllib(stream);
            case IF -> classifyIf(stream);
            case ELSE, ENDIF -> new ConditionNode(stream.getLabel(), stream.getStatement(), opcode, null);
            default -> null;
        };

        if (node == null) {
            log.debug("No model node for {} at {}", opcode, stream.getStatement().span());
            return Optional.empty();
        }
        return Optional.of(node);
    }

    private ExecNode classifyExec(JclTokenStream stream) {
        List<JclParameter> params = new OperandParser(stream).parseAll();
        Statement statement = stream.getStatement();

        String procName = null;
        Map<String, JclValue> keywords = new LinkedHashMap<>();

        for (int i = 0; i < params.size(); i++) {
            JclParameter param = params.get(i);
            if (param.isPositional()) {
                if (i == 0 && param.getValue() != null && !param.getValue().isList()) {
                    procName = param.getValue().getText();
                }
                continue;
            }
            keywords.put(param.getKeyword(), param.getValue());
        }

        String programName = scalarKeyword(keywords, "PGM", statement);
        String procKeyword = scalarKeyword(keywords, "PROC", statement);
        if (procKeyword != null) {
            if (procName != null) {
                throw StatementTokenizer.error("EXEC names a procedure twice", statement);
            }
            procName = procKeyword;
        }

        if (programName != null && procName != null) {
            throw StatementTokenizer.error("EXEC names both a program and a procedure", statement);
        }
        if (isBlank(programName) && isBlank(procName)) {
            throw StatementTokenizer.error("EXEC without program or procedure name", statement);
        }

        return ExecNode.builder()
                .label(stream.getLabel())
                .statement(statement)
                .programName(upper(programName))
                .procName(upper(procName))
                .parm(renderKeyword(keywords, "PARM"))
                .cond(renderKeyword(keywords, "COND"))
                .keywords(keywords)
                .build();
    }

    private DdNode classifyDd(JclTokenStream stream) {
        List<JclParameter> params = new OperandParser(stream).parseAll();

        List<String> positionals = new ArrayList<>();
        Map<String, JclValue> keywords = new LinkedHashMap<>();

        for (JclParameter param : params) {
            if (param.isPositional()) {
                if (param.getValue() != null && !param.getValue().render().isEmpty()) {
                    positionals.add(param.getValue().render().toUpperCase(Locale.ROOT));
                }
            } else {
                String key = DD_KEYWORD_ALIASES.getOrDefault(param.getKeyword(), param.getKeyword());
                keywords.put(key, param.getValue());
            }
        }

        return DdNode.builder()
                .label(stream.getLabel())
                .statement(stream.getStatement())
                .positionals(positionals)
                .keywords(keywords)
                .build();
    }

    private SetNode classifySet(JclTokenStream stream) {
        Map<String, String> assignments = keywordTexts(stream, "SET");
        if (assignments.isEmpty()) {
            throw StatementTokenizer.error("SET without assignments", stream.getStatement());
        }
        return new SetNode(stream.getLabel(), stream.getStatement(), assignments);
    }

    private ProcNode classifyProc(JclTokenStream stream) {
        return new ProcNode(stream.getLabel(), stream.getStatement(), keywordTexts(stream, "PROC"));
    }

    private IncludeNode classifyInclude(JclTokenStream stream) {
        Map<String, String> operands = keywordTexts(stream, "INCLUDE");
        String member = operands.get("MEMBER");
        if (isBlank(member)) {
            throw StatementTokenizer.error("INCLUDE without MEMBER=", stream.getStatement());
        }
        return new IncludeNode(stream.getLabel(), stream.getStatement(), member.toUpperCase(Locale.ROOT));
    }

    private JcllibNode classifyJcllib(JclTokenStream stream) {
        List<JclParameter> params = new OperandParser(stream).parseAll();
        List<String> order = new ArrayList<>();
        for (JclParameter param : params) {
            if (!param.isPositional() && param.getKeyword().equals("ORDER") && param.getValue() != null) {
                JclValue value = param.getValue();
                if (value.isList()) {
                    for (String slot : value.positionalSlots()) {
                        if (!isBlank(slot)) order.add(slot);
                    }
                } else if (!isBlank(value.getText())) {
                    order.add(value.getText());
                }
            }
        }
        if (order.isEmpty()) {
            throw StatementTokenizer.error("JCLLIB without ORDER=", stream.getStatement());
        }
        return new JcllibNode(stream.getLabel(), stream.getStatement(), order);
    }

    private ConditionNode classifyIf(JclTokenStream stream) {
        String expression = stream.getOperandText();
        String upper = expression.toUpperCase(Locale.ROOT);
        int then = upper.lastIndexOf("THEN");
        if (then < 0) {
            throw StatementTokenizer.error("IF without THEN", stream.getStatement());
        }
        expression = expression.substring(0, then).trim();
        if (expression.isEmpty()) {
            throw StatementTokenizer.error("IF without a condition", stream.getStatement());
        }
        return new ConditionNode(stream.getLabel(), stream.getStatement(), JclOpcode.IF, expression);
    }

    /**
     * Operands that must all be KEYWORD=value, rendered as text.
     */
    private Map<String, String> keywordTexts(JclTokenStream stream, String what) {
        Map<String, String> result = new LinkedHashMap<>();
        for (JclParameter param : new OperandParser(stream).parseAll()) {
            if (param.isPositional()) {
                if (param.getValue() == null) continue;
                throw StatementTokenizer.error(what + " accepts only KEYWORD=value operands", stream.getStatement());
            }
            result.put(param.getKeyword(), param.getValue() == null ? "" : param.getValue().render());
        }
        return result;
    }

    private static String scalarKeyword(Map<String, JclValue> keywords, String name, Statement statement) {
        JclValue value = keywords.get(name);
        if (value == null) return null;
        if (value.isList()) {
            throw StatementTokenizer.error(name + "= must be a single value", statement);
        }
        return value.getText();
    }

    private static String renderKeyword(Map<String, JclValue> keywords, String name) {
        JclValue value = keywords.get(name);
        return value == null ? null : value.render();
    }

    private static String upper(String s) {
        return s == null ? null : s.toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

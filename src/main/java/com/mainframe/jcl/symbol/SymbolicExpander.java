package com.mainframe.jcl.symbol;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.diagnostics.JclDiagnostics;
import com.mainframe.jcl.diagnostics.UnresolvedSymbolWarning;
import com.mainframe.jcl.exception.SymbolExpansionDivergenceException;
import com.mainframe.jcl.model.Statement;

/**
 * Substitutes {@code &NAME} references in statement text.
 *
 * Delimiter rules:
 * - {@code &VAR} uses the longest defined name that prefixes the token
 * - {@code &VAR.} consumes the period
 * - {@code &VAR..} leaves one period after the value
 * - {@code &&NAME} is a temporary data set name and is never substituted
 *
 * Substitution repeats until a pass changes nothing, so values may refer to other
 * symbols. The number of passes is bounded. A pass that substitutes something but
 * leaves the text as it was means a symbol expands to itself ({@code SET A=&A}); that
 * is treated as divergence too.
 */
public class SymbolicExpander {
    private static final Logger log = LoggerFactory.getLogger(SymbolicExpander.class);

    public static final int DEFAULT_MAX_PASSES = 16;

    private final int maxPasses;

    public SymbolicExpander() {
        this(DEFAULT_MAX_PASSES);
    }

    public SymbolicExpander(int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be >= 1, got " + maxPasses);
        }
        this.maxPasses = maxPasses;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    /**
     * Expand a statement and record unresolved symbols against its source location.
     */
    public Statement expand(Statement statement, SymbolTable table, JclDiagnostics diagnostics) {
        ExpansionResult result = expand(statement.getText(), table, statement.getMemberName(), statement.getFirstLine());
        for (String name : result.getUnresolved()) {
            UnresolvedSymbolWarning warning = new UnresolvedSymbolWarning(
                    name, statement.getMemberName(), statement.getFirstLine());
            diagnostics.recordUnresolved(warning);
            log.warn("Unresolved symbol: {}", warning);
        }
        if (result.getText().equals(statement.getText())) {
            return statement;
        }
        log.debug("Expanded {} -> {}", statement.getText(), result.getText());
        return statement.withText(result.getText());
    }

    public ExpansionResult expand(String text, SymbolTable table) {
        return expand(text, table, null, 0);
    }

    private ExpansionResult expand(String text, SymbolTable table, String memberName, int line) {
        if (text.indexOf('&') < 0) {
            return new ExpansionResult(text, List.of(), 0);
        }

        String current = text;
        int passes = 0;
        while (true) {
            Pass pass = substitutePass(current, table);
            if (pass.text.equals(current)) {
                if (pass.substitutions > 0) {
                    log.warn("Symbol expands to itself in {}", current);
                    throw new SymbolExpansionDivergenceException(text, passes + 1, memberName, line);
                }
                return new ExpansionResult(current, unresolvedNames(current, table), passes);
            }
            passes++;
            if (passes > maxPasses) {
                throw new SymbolExpansionDivergenceException(text, maxPasses, memberName, line);
            }
            current = pass.text;
        }
    }

    /**
     * One left-to-right substitution pass.
     */
    String substitute(String text, SymbolTable table) {
        return substitutePass(text, table).text;
    }

    private Pass substitutePass(String text, SymbolTable table) {
        StringBuilder out = new StringBuilder(text.length());
        int substitutions = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '&') {
                out.append(c);
                i++;
                continue;
            }

            if (i + 1 < text.length() && text.charAt(i + 1) == '&') {
                int end = nameEnd(text, i + 2);
                out.append(text, i, end);
                i = end;
                continue;
            }

            int start = i + 1;
            int end = nameEnd(text, start);
            String candidate = text.substring(start, end);
            Optional<String> name = isSymbolStart(candidate) ? table.longestDefinedPrefix(candidate) : Optional.empty();

            if (name.isEmpty()) {
                out.append('&').append(candidate);
                i = end;
                continue;
            }

            out.append(table.lookup(name.get()).orElseThrow());
            substitutions++;
            int after = start + name.get().length();
            if (after < text.length() && text.charAt(after) == '.') {
                after++;
            }
            i = after;
        }
        return new Pass(out.toString(), substitutions);
    }

    private List<String> unresolvedNames(String text, SymbolTable table) {
        Set<String> names = new LinkedHashSet<>();
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) != '&') {
                i++;
                continue;
            }
            if (i + 1 < text.length() && text.charAt(i + 1) == '&') {
                i = nameEnd(text, i + 2);
                continue;
            }
            int end = nameEnd(text, i + 1);
            String candidate = text.substring(i + 1, end);
            if (isSymbolStart(candidate) && table.longestDefinedPrefix(candidate).isEmpty()) {
                names.add(candidate);
            }
            i = end;
        }
        return new ArrayList<>(names);
    }

    private static int nameEnd(String text, int from) {
        int pos = from;
        while (pos < text.length() && isNameChar(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isSymbolStart(String candidate) {
        if (candidate.isEmpty()) return false;
        char first = candidate.charAt(0);
        return Character.isLetter(first) || first == '#' || first == '$' || first == '@';
    }

    private static boolean isNameChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '#' || c == '$' || c == '@';
    }

    private static final class Pass {
        private final String text;
        private final int substitutions;

        private Pass(String text, int substitutions) {
            this.text = text;
            this.substitutions = substitutions;
        }
    }
}

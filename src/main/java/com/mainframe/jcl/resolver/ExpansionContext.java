package com.mainframe.jcl.resolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.mainframe.jcl.diagnostics.JclDiagnostics;
import com.mainframe.jcl.exception.CyclicIncludeException;
import com.mainframe.jcl.exception.RecursionLimitExceededException;
import com.mainframe.jcl.symbol.ScopeKind;
import com.mainframe.jcl.symbol.SymbolTable;

import lombok.Getter;

/**
 * Mutable state of one expansion run. Created per run and never shared.
 */
@Getter
public class ExpansionContext {

    public static final int DEFAULT_MAX_DEPTH = 15;

    private SymbolTable symbols = SymbolTable.create();
    private final List<String> searchPaths;
    private final Map<String, InstreamProc> instreamProcs = new HashMap<>();
    /** Members and procedures currently being expanded, outermost first. */
    private final Deque<String> callStack = new ArrayDeque<>();
    private final JclDiagnostics diagnostics;
    private final int maxDepth;

    public ExpansionContext(List<String> searchPaths, JclDiagnostics diagnostics) {
        this(searchPaths, diagnostics, DEFAULT_MAX_DEPTH);
    }

    public ExpansionContext(List<String> searchPaths, JclDiagnostics diagnostics, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        }
        this.searchPaths = new ArrayList<>(searchPaths != null ? searchPaths : List.of());
        this.diagnostics = diagnostics != null ? diagnostics : new JclDiagnostics();
        this.maxDepth = maxDepth;
    }

    public List<String> getSearchPaths() {
        return Collections.unmodifiableList(searchPaths);
    }

    public void setSymbols(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public void defineGlobal(String name, String value) {
        symbols = symbols.define(name, value, ScopeKind.GLOBAL);
    }

    /**
     * JCLLIB ORDER: the listed libraries are searched first, in the order given.
     */
    public void prependSearchPaths(List<String> libraries) {
        List<String> fresh = new ArrayList<>();
        for (String library : libraries) {
            if (!fresh.contains(library)) {
                fresh.add(library);
            }
        }
        searchPaths.removeAll(fresh);
        searchPaths.addAll(0, fresh);
    }

    public void registerInstreamProc(InstreamProc proc) {
        instreamProcs.put(key(proc.getName()), proc);
    }

    public Optional<InstreamProc> findInstreamProc(String name) {
        return Optional.ofNullable(instreamProcs.get(key(name)));
    }

    /**
     * Push a member or procedure onto the call stack.
     *
     * @throws CyclicIncludeException when it is already being expanded on this branch
     * @throws RecursionLimitExceededException when the stack is already at the depth limit
     */
    public void enter(String name, String referencingMember, int line) {
        String key = key(name);
        if (callStack.contains(key)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String entry : callStack) {
                if (entry.equals(key)) inCycle = true;
                if (inCycle) cycle.add(entry);
            }
            cycle.add(key);
            throw new CyclicIncludeException(cycle, referencingMember, line);
        }
        if (callStack.size() >= maxDepth) {
            throw new RecursionLimitExceededException(key, maxDepth, referencingMember, line);
        }
        callStack.addLast(key);
    }

    public void exit(String name) {
        String key = key(name);
        if (!key.equals(callStack.peekLast())) {
            throw new IllegalStateException("Call stack out of balance: expected " + key + " on top of " + callStack);
        }
        callStack.removeLast();
    }

    public int depth() {
        return callStack.size();
    }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}

package com.mainframe.jcl.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Persistent stack of scope frames. Every mutation returns a new table, so a caller can
 * keep a snapshot and return to it; the bottom frame is always the GLOBAL one.
 *
 * Lookup walks from the top of the stack down. For one procedure invocation the stack
 * reads GLOBAL, PROC_DEFAULT, CALL_OVERRIDE, so overrides win over defaults and
 * defaults win over SET values.
 */
public final class SymbolTable {

    private final List<ScopeFrame> frames;

    private SymbolTable(List<ScopeFrame> frames) {
        this.frames = Collections.unmodifiableList(frames);
    }

    public static SymbolTable create() {
        List<ScopeFrame> frames = new ArrayList<>();
        frames.add(ScopeFrame.empty(ScopeKind.GLOBAL, "JOB"));
        return new SymbolTable(frames);
    }

    public Optional<String> lookup(String name) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            Optional<String> value = frames.get(i).get(name);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public boolean isDefined(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Bind a name in the topmost frame of the given kind.
     *
     * @throws IllegalStateException when no frame of that kind is on the stack
     */
    public SymbolTable define(String name, String value, ScopeKind kind) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).getKind() == kind) {
                List<ScopeFrame> copy = new ArrayList<>(frames);
                copy.set(i, frames.get(i).with(name, value));
                return new SymbolTable(copy);
            }
        }
        throw new IllegalStateException("No " + kind + " scope on the stack for symbol " + name);
    }

    public SymbolTable push(ScopeFrame frame) {
        if (frame.getKind() == ScopeKind.GLOBAL) {
            throw new IllegalArgumentException("Only one GLOBAL scope is allowed");
        }
        List<ScopeFrame> copy = new ArrayList<>(frames);
        copy.add(frame);
        return new SymbolTable(copy);
    }

    public SymbolTable pop() {
        if (frames.size() == 1) {
            throw new IllegalStateException("Cannot pop the GLOBAL scope");
        }
        return new SymbolTable(new ArrayList<>(frames.subList(0, frames.size() - 1)));
    }

    /**
     * Table holding only this table's GLOBAL frame.
     */
    public SymbolTable globalOnly() {
        return new SymbolTable(new ArrayList<>(frames.subList(0, 1)));
    }

    /**
     * This table's frames with the GLOBAL frame taken from {@code other}.
     */
    public SymbolTable withGlobalOf(SymbolTable other) {
        List<ScopeFrame> copy = new ArrayList<>(frames);
        copy.set(0, other.frames.get(0));
        return new SymbolTable(copy);
    }

    public int depth() {
        return frames.size();
    }

    public List<ScopeFrame> getFrames() {
        return frames;
    }

    /**
     * Longest defined symbol name that starts {@code candidate}, so that {@code &VAR1}
     * is not read as {@code &VAR} followed by "1" when both are defined.
     */
    public Optional<String> longestDefinedPrefix(String candidate) {
        for (int length = candidate.length(); length > 0; length--) {
            String prefix = candidate.substring(0, length);
            if (isDefined(prefix)) {
                return Optional.of(prefix);
            }
        }
        return Optional.empty();
    }
}

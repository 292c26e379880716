package com.mainframe.jcl.symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;
import lombok.ToString;

/**
 * Immutable snapshot of one scope's bindings. Names are stored upper-case.
 */
@Getter
@ToString
public final class ScopeFrame {

    private final ScopeKind kind;
    private final String owner;
    private final Map<String, String> bindings;

    public ScopeFrame(ScopeKind kind, String owner, Map<String, String> bindings) {
        this.kind = kind;
        this.owner = owner;
        Map<String, String> copy = new LinkedHashMap<>();
        bindings.forEach((name, value) -> copy.put(normalize(name), value == null ? "" : value));
        this.bindings = Collections.unmodifiableMap(copy);
    }

    public static ScopeFrame empty(ScopeKind kind, String owner) {
        return new ScopeFrame(kind, owner, Map.of());
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(bindings.get(normalize(name)));
    }

    public boolean isDefined(String name) {
        return bindings.containsKey(normalize(name));
    }

    /**
     * Copy of this frame with one binding added or replaced.
     */
    public ScopeFrame with(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(bindings);
        copy.put(normalize(name), value == null ? "" : value);
        return new ScopeFrame(kind, owner, copy);
    }

    private static String normalize(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}

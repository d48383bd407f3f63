package com.grammar.playground.analyzer.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flat name to entry mapping. The language has no blocks, so there is a
 * single scope per analysis and a name is never rebound.
 */
public final class SymbolTable {

    private final Map<String, SymbolEntry> entries = new LinkedHashMap<>();

    /** @return false if {@code name} is already present; the existing entry is kept */
    public boolean declare(String name, TypeTag type, int line) {
        return entries.putIfAbsent(name, new SymbolEntry(name, type, line, false)) == null;
    }

    public Optional<SymbolEntry> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public void markInitialized(String name) {
        entries.computeIfPresent(name, (key, entry) -> entry.markInitialized());
    }

    /** Copy in declaration order; later changes to the table do not show through. */
    public Map<String, SymbolEntry> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}

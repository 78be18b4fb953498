package com.example.rpaengine.variables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Interned variable names plus id-indexed values, shared by every scenario of one run.
 * <p>
 * Ids are dense and assigned on first {@link #intern(String)}; they never change for the lifetime
 * of the store. Reading any id that holds no value yields {@link Value#UNDEFINED}; writing an
 * id that was never interned is a caller bug and throws.
 * Not thread-safe: a store is owned by the single thread executing the run.
 * </p>
 */
public final class VariableStore {

    private final Map<String, Integer> ids = new HashMap<>();
    private final List<String> names = new ArrayList<>();
    private final List<Value> values = new ArrayList<>();
    private VariableListener listener;

    public VariableStore() {
    }

    /**
     * Store pre-seeded with the given names in order, so that the ids match those a compiler assigned.
     */
    public static VariableStore withSymbols(List<String> symbols) {
        VariableStore store = new VariableStore();
        for (String symbol : symbols) {
            store.intern(symbol);
        }
        return store;
    }

    public int intern(String name) {
        Objects.requireNonNull(name, "name");
        Integer existing = ids.get(name);
        if (existing != null) {
            return existing;
        }
        int id = names.size();
        ids.put(name, id);
        names.add(name);
        values.add(Value.UNDEFINED);
        return id;
    }

    public Optional<Integer> lookup(String name) {
        return Optional.ofNullable(ids.get(name));
    }

    /**
     * Value by id; undefined for an id that was never written or never interned. Never throws.
     */
    public Value get(int id) {
        if (id < 0 || id >= values.size()) {
            return Value.UNDEFINED;
        }
        return values.get(id);
    }

    /**
     * Value by name; undefined when the name was never interned.
     */
    public Value get(String name) {
        Integer id = ids.get(name);
        return id != null ? values.get(id) : Value.UNDEFINED;
    }

    public void set(int id, Value value) {
        checkId(id);
        Objects.requireNonNull(value, "value");
        Value old = values.set(id, value);
        if (listener != null) {
            listener.onSet(names.get(id), old, value);
        }
    }

    public void set(String name, Value value) {
        set(intern(name), value);
    }

    public String name(int id) {
        checkId(id);
        return names.get(id);
    }

    public int size() {
        return names.size();
    }

    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    public void setListener(VariableListener listener) {
        this.listener = listener;
    }

    /**
     * Every variable currently holding a value, in interning order.
     */
    public Map<String, Value> snapshot() {
        Map<String, Value> snapshot = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            Value v = values.get(i);
            if (!(v instanceof Value.Undefined)) {
                snapshot.put(names.get(i), v);
            }
        }
        return snapshot;
    }

    private void checkId(int id) {
        if (id < 0 || id >= names.size()) {
            throw new IllegalArgumentException("unknown variable id " + id);
        }
    }
}

package com.example.rpaengine.ir;

import com.example.rpaengine.graph.ScenarioParameter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scenario id to entry address and parameter signature.
 * <p>
 * Every scenario is reserved before any code is emitted, so calls can name scenarios that are
 * compiled later, including the calling scenario itself.
 * </p>
 */
public final class CallTable {

    /**
     * Entry of one scenario; {@code entryAddress} stays {@link Instruction#PLACEHOLDER} until its unit is emitted.
     */
    public record Entry(String scenarioId, String name, int entryAddress, List<ScenarioParameter> parameters) {
        public Entry {
            parameters = List.copyOf(parameters);
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public void reserve(String scenarioId, String name, List<ScenarioParameter> parameters) {
        if (entries.containsKey(scenarioId)) {
            throw new IllegalArgumentException("duplicate scenario id: " + scenarioId);
        }
        entries.put(scenarioId, new Entry(scenarioId, name, Instruction.PLACEHOLDER, parameters));
    }

    public void setEntryAddress(String scenarioId, int address) {
        Entry entry = entries.get(scenarioId);
        if (entry == null) {
            throw new IllegalArgumentException("scenario not reserved: " + scenarioId);
        }
        entries.put(scenarioId, new Entry(scenarioId, entry.name(), address, entry.parameters()));
    }

    public Optional<Entry> entry(String scenarioId) {
        return Optional.ofNullable(entries.get(scenarioId));
    }

    public boolean contains(String scenarioId) {
        return entries.containsKey(scenarioId);
    }

    public Collection<Entry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /**
     * The scenario whose address range contains {@code address}, i.e. the entry with the greatest
     * entry address not above it.
     */
    public Optional<Entry> owner(int address) {
        Entry best = null;
        for (Entry e : entries.values()) {
            if (e.entryAddress() >= 0 && e.entryAddress() <= address
                    && (best == null || e.entryAddress() > best.entryAddress())) {
                best = e;
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CallTable other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}

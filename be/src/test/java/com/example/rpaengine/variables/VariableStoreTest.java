package com.example.rpaengine.variables;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("VariableStore")
class VariableStoreTest {

    @Nested
    @DisplayName("interning")
    class Interning {

        @Test
        @DisplayName("same name yields same id; ids are dense in first-use order")
        void stableDenseIds() {
            VariableStore store = new VariableStore();
            int a = store.intern("a");
            int b = store.intern("b");
            assertEquals(0, a);
            assertEquals(1, b);
            assertEquals(a, store.intern("a"));
            assertEquals(2, store.size());
            assertEquals(List.of("a", "b"), store.names());
        }

        @Test
        @DisplayName("withSymbols reproduces compiler-assigned ids")
        void withSymbols() {
            VariableStore store = VariableStore.withSymbols(List.of("last_error", "x", "y"));
            assertEquals(1, store.lookup("x").orElseThrow());
            assertEquals("y", store.name(2));
            assertTrue(store.lookup("z").isEmpty());
        }
    }

    @Nested
    @DisplayName("values")
    class Values {

        @Test
        @DisplayName("unset variables read as undefined, by id and by unknown name")
        void unsetIsUndefined() {
            VariableStore store = new VariableStore();
            int x = store.intern("x");
            assertEquals(Value.UNDEFINED, store.get(x));
            assertEquals(Value.UNDEFINED, store.get("never-seen"));
        }

        @Test
        @DisplayName("set by name interns and stores; snapshot skips undefined and keeps order")
        void setAndSnapshot() {
            VariableStore store = new VariableStore();
            store.intern("unset");
            store.set("b", Value.of(2));
            store.set("a", Value.of("text"));
            Map<String, Value> snapshot = store.snapshot();
            assertEquals(List.of("b", "a"), new ArrayList<>(snapshot.keySet()));
            assertEquals(Value.of("text"), snapshot.get("a"));
        }

        @Test
        @DisplayName("reading an id without a value is undefined, writing an unknown id is rejected")
        void unknownId() {
            VariableStore store = new VariableStore();
            int unset = store.intern("unset");
            assertEquals(Value.UNDEFINED, store.get(unset));
            assertEquals(Value.UNDEFINED, store.get(3));
            assertEquals(Value.UNDEFINED, store.get(-1));
            assertThrows(IllegalArgumentException.class, () -> store.set(-1, Value.of(true)));
        }

        @Test
        @DisplayName("listener sees old and new value")
        void listener() {
            VariableStore store = new VariableStore();
            List<String> seen = new ArrayList<>();
            store.setListener((name, old, value) -> seen.add(name + ":" + old.display() + "->" + value.display()));
            store.set("n", Value.of(1));
            store.set("n", Value.of(2));
            assertEquals(List.of("n:undefined->1", "n:1->2"), seen);
        }
    }
}

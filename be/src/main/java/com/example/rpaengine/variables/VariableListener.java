package com.example.rpaengine.variables;

/**
 * One-way notification of variable writes. Not consulted for execution results.
 */
@FunctionalInterface
public interface VariableListener {

    void onSet(String name, Value oldValue, Value newValue);
}

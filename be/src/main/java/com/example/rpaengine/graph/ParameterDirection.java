package com.example.rpaengine.graph;

/**
 * Direction of a scenario parameter: copied in at call time, copied out at return, or both.
 */
public enum ParameterDirection {
    IN,
    OUT,
    INOUT;

    public boolean copiesIn() {
        return this == IN || this == INOUT;
    }

    public boolean copiesOut() {
        return this == OUT || this == INOUT;
    }
}

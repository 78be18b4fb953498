package com.example.rpaengine.graph;

/**
 * Semantic label of a connection; selects which compiled path the connection feeds.
 */
public enum BranchType {
    DEFAULT,
    TRUE_BRANCH,
    FALSE_BRANCH,
    LOOP_BODY,
    ERROR_BRANCH,
    TRY_BRANCH,
    CATCH_BRANCH
}

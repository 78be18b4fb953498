package com.example.rpaengine.graph;

import java.util.Objects;

/**
 * A node of a scenario graph. The id is unique only within its scenario.
 */
public record Node(String id, String name, Activity activity) {
    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(activity, "activity");
    }

    public Node(String id, Activity activity) {
        this(id, null, activity);
    }

    /**
     * Label for logs and listings: the name if set, otherwise the activity name.
     */
    public String label() {
        return name != null && !name.isBlank() ? name : activity.displayName();
    }
}

package com.example.rpaengine.ir;

import com.example.rpaengine.graph.ParameterDirection;

/**
 * A call-site parameter binding with both sides interned to variable ids.
 */
public record ResolvedBinding(
        int calleeVar,
        String calleeName,
        int callerVar,
        String callerName,
        ParameterDirection direction
) {
}

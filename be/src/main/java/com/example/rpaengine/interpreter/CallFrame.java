package com.example.rpaengine.interpreter;

import com.example.rpaengine.ir.ResolvedBinding;
import com.example.rpaengine.variables.Value;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Saved caller context for one active scenario invocation.
 *
 * @param callSite       address of the Call instruction
 * @param returnAddress  address to resume at, always {@code callSite + 1}
 * @param savedValues    callee parameter values before the call, restored on return or unwind
 * @param whileCounters  iteration counters of the callee's while loops, keyed by check address
 */
record CallFrame(
        int callSite,
        int returnAddress,
        String callerScenarioId,
        String callerNodeId,
        String callerActivity,
        List<ResolvedBinding> bindings,
        Map<Integer, Value> savedValues,
        Map<Integer, Integer> whileCounters
) {
    CallFrame(int callSite, String callerScenarioId, String callerNodeId, String callerActivity,
              List<ResolvedBinding> bindings, Map<Integer, Value> savedValues) {
        this(callSite, callSite + 1, callerScenarioId, callerNodeId, callerActivity, bindings, savedValues,
                new HashMap<>());
    }
}

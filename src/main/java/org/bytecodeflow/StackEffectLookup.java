package org.bytecodeflow;

import java.util.HashMap;
import java.util.Map;

/**
 * Stack effects for opcodes the simulator does not model, supplied by the
 * decoder. Returns null when nothing is known.
 */
@FunctionalInterface
public interface StackEffectLookup {

    StackEffectLookup NONE = (opname, arg) -> null;

    StackEffect lookup(String opname, Integer arg);

    /** Table keyed by (opname, arg); an entry with a null arg matches any operand. */
    static StackEffectLookup of(Map<String, Map<Integer, StackEffect>> table) {
        Map<String, Map<Integer, StackEffect>> copy = new HashMap<>();
        table.forEach((k, v) -> copy.put(k, new HashMap<>(v)));
        return (opname, arg) -> {
            Map<Integer, StackEffect> byArg = copy.get(opname);
            if (byArg == null) return null;
            StackEffect exact = byArg.get(arg);
            return exact != null ? exact : byArg.get(null);
        };
    }
}

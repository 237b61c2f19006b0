package org.bytecodeflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Ordered simulation steps of one function, up to the first return. */
public class Trace {

    private final List<ExecutionStep> steps;
    private final SymbolicValue returnValue;

    Trace(List<ExecutionStep> steps, SymbolicValue returnValue) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.returnValue = returnValue;
    }

    public List<ExecutionStep> getSteps() { return steps; }

    /** Value popped by the terminating return, or null when the trace ran off the end. */
    public SymbolicValue getReturnValue() { return returnValue; }

    public boolean isEmpty() { return steps.isEmpty(); }

    public int size() { return steps.size(); }

    public ExecutionStep last() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1);
    }

    public Map<String, SymbolicValue> finalLocals() {
        return steps.isEmpty() ? Map.of() : last().localsSnapshot;
    }
}

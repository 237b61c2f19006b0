package org.bytecodeflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Simulator state around one instruction. */
public class ExecutionStep {
    public final int offset;
    public final String opcode;
    public final String operandDisplay;
    public final List<SymbolicValue> stackBefore;
    public final List<SymbolicValue> stackAfter;
    public final Map<String, SymbolicValue> localsSnapshot;

    public ExecutionStep(int offset, String opcode, String operandDisplay,
                         List<SymbolicValue> stackBefore, List<SymbolicValue> stackAfter,
                         Map<String, SymbolicValue> localsSnapshot) {
        this.offset = offset;
        this.opcode = opcode;
        this.operandDisplay = operandDisplay;
        this.stackBefore = Collections.unmodifiableList(new ArrayList<>(stackBefore));
        this.stackAfter = Collections.unmodifiableList(new ArrayList<>(stackAfter));
        this.localsSnapshot = Collections.unmodifiableMap(new LinkedHashMap<>(localsSnapshot));
    }

    public int stackDelta() {
        return stackAfter.size() - stackBefore.size();
    }

    @Override
    public String toString() {
        return offset + " " + opcode + " " + stackBefore + " -> " + stackAfter;
    }
}

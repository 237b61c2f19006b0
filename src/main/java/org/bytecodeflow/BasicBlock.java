package org.bytecodeflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maximal straight-line run of instructions with its outgoing edges.
 * Immutable once built by {@link CfgBuilder}.
 */
public class BasicBlock {

    private final List<Instruction> instructions;
    private final List<Edge> successors;
    private final BlockRole role;

    BasicBlock(List<Instruction> instructions, List<Edge> successors, BlockRole role) {
        if (instructions.isEmpty()) throw new IllegalArgumentException("a block needs at least one instruction");
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.successors = Collections.unmodifiableList(new ArrayList<>(successors));
        this.role = role;
    }

    public int getStartOffset() { return instructions.get(0).offset; }
    public int getEndOffset() { return last().offset; }
    public List<Instruction> getInstructions() { return instructions; }
    public List<Edge> getSuccessors() { return successors; }
    public BlockRole getRole() { return role; }

    public Instruction last() {
        return instructions.get(instructions.size() - 1);
    }

    public List<Integer> successorOffsets() {
        List<Integer> out = new ArrayList<>(successors.size());
        for (Edge e : successors) out.add(e.target);
        return out;
    }

    /** Edge to the block starting at {@code target}, or null. */
    public Edge edgeTo(int target) {
        for (Edge e : successors) {
            if (e.target == target) return e;
        }
        return null;
    }

    public boolean isExit() {
        return successors.isEmpty();
    }

    @Override
    public String toString() {
        return "Block(" + getStartOffset() + "-" + getEndOffset() + ", " + instructions.size() + " instrs)";
    }
}

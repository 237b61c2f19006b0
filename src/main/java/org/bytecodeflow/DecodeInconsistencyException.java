package org.bytecodeflow;

/**
 * A branch names a target offset that no instruction of the sequence starts
 * at, or carries no usable target at all. The decoder broke its contract;
 * the analysis is aborted.
 */
public class DecodeInconsistencyException extends BytecodeFlowException {

    private static final long serialVersionUID = -2215096893012787003L;

    /** {@link #getTarget()} of a branch whose operand is not an offset. */
    public static final int NO_TARGET = -1;

    private final int offset;
    private final int target;

    public DecodeInconsistencyException(int offset, int target) {
        this(String.format("branch at offset %d targets offset %d, which is not an instruction boundary",
                offset, target), offset, target);
    }

    private DecodeInconsistencyException(String msg, int offset, int target) {
        super(msg);
        this.offset = offset;
        this.target = target;
    }

    /** The branch at {@code ins} has no numeric target operand. */
    public static DecodeInconsistencyException unresolvedTarget(Instruction ins) {
        return new DecodeInconsistencyException(String.format("branch %s at offset %d has no target offset (argval %s)",
                ins.opname, ins.offset, ins.argval), ins.offset, NO_TARGET);
    }

    public int getOffset() { return offset; }
    public int getTarget() { return target; }
}

package org.bytecodeflow;

public enum BranchKind {
    NONE,
    UNCONDITIONAL,
    CONDITIONAL,
    ITERATOR;

    /** Conditional and iterator branches also fall through to the next block. */
    public boolean fallsThrough() {
        return this == CONDITIONAL || this == ITERATOR;
    }
}

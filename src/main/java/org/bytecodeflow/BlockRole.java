package org.bytecodeflow;

/** Coarse kind of a block, used by renderers to pick a style. */
public enum BlockRole {
    ENTRY,
    RETURN,
    RAISE,
    CONDITIONAL,
    LOOP,
    PLAIN
}

package org.bytecodeflow;

import java.util.Arrays;
import java.util.List;

/**
 * One decoded instruction of the analyzed function. Offsets are the identity
 * used to address blocks and jump targets.
 */
public class Instruction {
    public final int offset;      // byte offset in the code object
    public final String opname;   // e.g., LOAD_FAST, POP_JUMP_IF_FALSE
    public final Integer arg;     // raw operand, null when the opcode takes none
    public final Object argval;   // resolved operand (target offset, constant, name, name list)
    public final String argrepr;  // decoder's printable operand
    public final int size;        // instruction width in bytes
    public final OpcodeInfo info;

    public Instruction(int offset, String opname, Integer arg, Object argval, String argrepr, int size) {
        if (offset < 0) throw new IllegalArgumentException("negative offset: " + offset);
        this.offset = offset;
        this.opname = opname;
        this.arg = arg;
        this.argval = argval;
        this.argrepr = argrepr == null ? "" : argrepr;
        this.size = size;
        this.info = OpcodeTable.getDefault().lookup(opname);
    }

    public Instruction(int offset, String opname, Integer arg, Object argval, String argrepr) {
        this(offset, opname, arg, argval, argrepr, 2);
    }

    public boolean isBranch() {
        return info.branch != BranchKind.NONE;
    }

    public boolean isTerminal() {
        return info.terminal;
    }

    /** Resolved jump target, or null when the operand is not an offset. */
    public Integer jumpTarget() {
        if (!isBranch()) return null;
        if (argval instanceof Number n) return n.intValue();
        return null;
    }

    /** Local names for single and fused two-variable forms. */
    public List<String> names() {
        if (argval instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (argval instanceof String s) {
            if (info.category == OpcodeCategory.LOAD_LOCAL_PAIR
                    || info.category == OpcodeCategory.STORE_LOCAL_PAIR
                    || info.category == OpcodeCategory.STORE_LOAD_LOCAL) {
                return splitNames(s);
            }
            return List.of(s);
        }
        if (!argrepr.isEmpty()) return splitNames(argrepr);
        return List.of();
    }

    private static List<String> splitNames(String text) {
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return offset + " " + opname + (argrepr.isEmpty() ? "" : " (" + argrepr + ")");
    }
}

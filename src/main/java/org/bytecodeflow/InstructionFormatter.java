package org.bytecodeflow;

/**
 * Renders instructions as short one-line strings for block labels, e.g.
 * {@code POP_JUMP_IF_FALSE 2 (16)} or {@code LOAD_CONST 1 ('hello')}.
 */
public class InstructionFormatter {

    private final int operandWidth;
    private final int lineWidth;

    public InstructionFormatter(int operandWidth, int lineWidth) {
        if (operandWidth < 4 || lineWidth < 4)
            throw new IllegalArgumentException("display widths must be at least 4");
        this.operandWidth = operandWidth;
        this.lineWidth = lineWidth;
    }

    public InstructionFormatter(FlowConfig config) {
        this(config.getOperandWidth(), config.getInstructionWidth());
    }

    public String format(Instruction ins) {
        StringBuilder sb = new StringBuilder(ins.opname);
        if (ins.arg != null) sb.append(' ').append(ins.arg);

        Object v = ins.argval;
        if (v != null && !sameAsArg(v, ins.arg)) {
            String text = SymbolicValue.fromObject(v).display();
            if (v instanceof String) text = truncate(text, operandWidth);
            sb.append(" (").append(text).append(')');
        }
        return truncate(sb.toString(), lineWidth);
    }

    private static boolean sameAsArg(Object v, Integer arg) {
        return arg != null && v instanceof Number n && !(v instanceof Double) && n.longValue() == arg;
    }

    static String truncate(String s, int width) {
        return s.length() > width ? s.substring(0, width - 3) + "..." : s;
    }
}

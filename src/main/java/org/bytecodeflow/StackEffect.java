package org.bytecodeflow;

/** How many values an opcode consumes and produces. */
public class StackEffect {
    public final int consumed;
    public final int produced;

    public StackEffect(int consumed, int produced) {
        if (consumed < 0 || produced < 0)
            throw new IllegalArgumentException("negative stack effect: " + consumed + "/" + produced);
        this.consumed = consumed;
        this.produced = produced;
    }

    public int net() {
        return produced - consumed;
    }

    @Override
    public String toString() {
        return "-" + consumed + "/+" + produced;
    }
}

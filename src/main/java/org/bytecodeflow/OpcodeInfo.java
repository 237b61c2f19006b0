package org.bytecodeflow;

import java.util.Objects;

/** Classification of one mnemonic, as loaded from the opcode table. */
public class OpcodeInfo {

    public static final OpcodeInfo OTHER =
            new OpcodeInfo(OpcodeCategory.OTHER, BranchKind.NONE, EdgePolarity.NONE, false, 0);

    public final OpcodeCategory category;
    public final BranchKind branch;
    public final EdgePolarity polarity;
    public final boolean terminal;
    public final int pops; // values a conditional branch consumes

    public OpcodeInfo(OpcodeCategory category, BranchKind branch, EdgePolarity polarity,
                      boolean terminal, int pops) {
        this.category = Objects.requireNonNull(category);
        this.branch = Objects.requireNonNull(branch);
        this.polarity = Objects.requireNonNull(polarity);
        this.terminal = terminal;
        this.pops = pops;
    }

    @Override
    public String toString() {
        return category + "/" + branch + (terminal ? "/terminal" : "");
    }
}

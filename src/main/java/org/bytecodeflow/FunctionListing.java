package org.bytecodeflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Everything the external decoder hands over for one function. */
public class FunctionListing {
    public final String name;
    public final FunctionSignature signature;
    public final List<Instruction> instructions;
    public final StackEffectLookup stackEffects;

    public FunctionListing(String name, FunctionSignature signature,
                           List<Instruction> instructions, StackEffectLookup stackEffects) {
        this.name = name;
        this.signature = signature;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.stackEffects = stackEffects == null ? StackEffectLookup.NONE : stackEffects;
    }
}

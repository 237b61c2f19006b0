package org.bytecodeflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups a flat instruction sequence into maximal straight-line runs.
 * A run starts at the first instruction, at every branch target and right
 * after every branch. Reachability is not considered: dead instructions stay
 * in whichever run owns them by offset order.
 */
public class BlockPartitioner {

    /**
     * @return start offset to the instructions of that block, in offset order.
     *         Empty when {@code instructions} is empty.
     * @throws DecodeInconsistencyException a branch has no target, or its target is not the offset of any instruction
     */
    public SortedMap<Integer, List<Instruction>> partition(List<Instruction> instructions)
            throws DecodeInconsistencyException {
        SortedMap<Integer, List<Instruction>> blocks = new TreeMap<>();
        if (instructions.isEmpty()) return blocks;

        Set<Integer> offsets = new HashSet<>();
        int previous = -1;
        for (Instruction ins : instructions) {
            if (ins.offset <= previous)
                throw new IllegalArgumentException("offsets must be strictly increasing: " + previous + " then " + ins.offset);
            offsets.add(ins.offset);
            previous = ins.offset;
        }

        // 1) block starts
        Set<Integer> starts = new HashSet<>();
        starts.add(instructions.get(0).offset);
        for (int i = 0; i < instructions.size(); i++) {
            Instruction ins = instructions.get(i);
            if (!ins.isBranch()) continue;

            Integer target = ins.jumpTarget();
            if (target == null) throw DecodeInconsistencyException.unresolvedTarget(ins);
            if (!offsets.contains(target)) throw new DecodeInconsistencyException(ins.offset, target);
            starts.add(target);
            if (i + 1 < instructions.size()) {
                starts.add(instructions.get(i + 1).offset); // fall-through after a branch
            }
        }

        // 2) sequential grouping
        List<Instruction> current = null;
        int currentStart = -1;
        for (Instruction ins : instructions) {
            if (starts.contains(ins.offset)) {
                if (current != null) blocks.put(currentStart, Collections.unmodifiableList(current));
                current = new ArrayList<>();
                currentStart = ins.offset;
            }
            current.add(ins);
        }
        blocks.put(currentStart, Collections.unmodifiableList(current));
        return blocks;
    }
}

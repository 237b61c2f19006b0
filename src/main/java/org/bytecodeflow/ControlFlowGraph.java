package org.bytecodeflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/** Basic blocks keyed by start offset, with one designated entry block. */
public class ControlFlowGraph {

    private static final ControlFlowGraph EMPTY = new ControlFlowGraph(new TreeMap<>(), -1);

    private final SortedMap<Integer, BasicBlock> blocks;
    private final int entryOffset;

    ControlFlowGraph(SortedMap<Integer, BasicBlock> blocks, int entryOffset) {
        this.blocks = Collections.unmodifiableSortedMap(blocks);
        this.entryOffset = entryOffset;
    }

    static ControlFlowGraph empty() {
        return EMPTY;
    }

    public SortedMap<Integer, BasicBlock> getBlocks() { return blocks; }

    public BasicBlock block(int startOffset) {
        return blocks.get(startOffset);
    }

    /** Entry block, or null for an empty graph. */
    public BasicBlock entry() {
        return blocks.get(entryOffset);
    }

    public int getEntryOffset() { return entryOffset; }

    public List<BasicBlock> exits() {
        List<BasicBlock> out = new ArrayList<>();
        for (BasicBlock b : blocks.values()) {
            if (b.isExit()) out.add(b);
        }
        return out;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public int size() {
        return blocks.size();
    }
}

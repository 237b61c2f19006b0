package org.bytecodeflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds a block-level control-flow graph from a decoded instruction sequence.
 * Edges are driven by the last instruction of each block:
 * <ul>
 *   <li>branch: edge to the resolved target; conditional and iterator
 *       branches also get a fall-through edge to the next block;</li>
 *   <li>terminal (return, raise): no successors;</li>
 *   <li>anything else: one unconditional edge to the next block.</li>
 * </ul>
 */
public class CfgBuilder {

    private static final Logger log = LoggerFactory.getLogger(CfgBuilder.class);

    private final BlockPartitioner partitioner;

    public CfgBuilder() {
        this(new BlockPartitioner());
    }

    public CfgBuilder(BlockPartitioner partitioner) {
        this.partitioner = partitioner;
    }

    public ControlFlowGraph build(List<Instruction> instructions) throws DecodeInconsistencyException {
        return build(partitioner.partition(instructions));
    }

    /** Attaches edges to an already partitioned block mapping. */
    public ControlFlowGraph build(SortedMap<Integer, List<Instruction>> spans) throws DecodeInconsistencyException {
        if (spans.isEmpty()) return ControlFlowGraph.empty();

        // 1) block order, computed once
        List<Integer> order = new ArrayList<>(spans.keySet());
        int entryOffset = findEntry(spans);

        // 2) edges per block
        SortedMap<Integer, BasicBlock> blocks = new TreeMap<>();
        for (int i = 0; i < order.size(); i++) {
            int start = order.get(i);
            List<Instruction> body = spans.get(start);
            Integer next = (i + 1 < order.size()) ? order.get(i + 1) : null;

            List<Edge> edges = edgesFor(body.get(body.size() - 1), next, spans);
            blocks.put(start, new BasicBlock(body, edges, roleOf(start == entryOffset, body)));
        }

        log.debug("built CFG with {} blocks, entry at {}", blocks.size(), entryOffset);
        return new ControlFlowGraph(blocks, entryOffset);
    }

    private List<Edge> edgesFor(Instruction last, Integer next,
                                Map<Integer, List<Instruction>> spans) throws DecodeInconsistencyException {
        List<Edge> edges = new ArrayList<>(2);
        OpcodeInfo info = last.info;

        if (info.branch != BranchKind.NONE) {
            boolean conditional = info.branch.fallsThrough();
            Integer target = last.jumpTarget();
            if (target == null) throw DecodeInconsistencyException.unresolvedTarget(last);
            if (!spans.containsKey(target)) throw new DecodeInconsistencyException(last.offset, target);
            addEdge(edges, new Edge(target, conditional,
                    conditional ? info.polarity.takenLabel : EdgePolarity.NONE.takenLabel));
            if (conditional && next != null) {
                addEdge(edges, new Edge(next, true, info.polarity.notTakenLabel));
            }
        } else if (!info.terminal && next != null) {
            addEdge(edges, new Edge(next, false, EdgePolarity.NONE.notTakenLabel));
        }
        return edges;
    }

    // successor set semantics: a target already present keeps its first edge
    private static void addEdge(List<Edge> edges, Edge edge) {
        for (Edge e : edges) {
            if (e.target == edge.target) return;
        }
        edges.add(edge);
    }

    // same table the instructions were classified against
    private static int findEntry(SortedMap<Integer, List<Instruction>> spans) {
        OpcodeTable opcodes = OpcodeTable.getDefault();
        for (Map.Entry<Integer, List<Instruction>> e : spans.entrySet()) {
            for (Instruction ins : e.getValue()) {
                if (opcodes.isEntryMarker(ins.opname)) return e.getKey();
            }
        }
        return spans.firstKey();
    }

    private static BlockRole roleOf(boolean entry, List<Instruction> body) {
        if (entry) return BlockRole.ENTRY;

        Instruction last = body.get(body.size() - 1);
        switch (last.info.category) {
            case RETURN_VALUE:
            case RETURN_CONST:
                return BlockRole.RETURN;
            default:
                if (last.isTerminal()) return BlockRole.RAISE;
        }
        for (Instruction ins : body) {
            if (ins.info.branch == BranchKind.CONDITIONAL) return BlockRole.CONDITIONAL;
        }
        for (Instruction ins : body) {
            if (ins.info.branch == BranchKind.ITERATOR) return BlockRole.LOOP;
        }
        return BlockRole.PLAIN;
    }
}

package org.bytecodeflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Output for renderers: the block graph (ids, instruction lines, labelled
 * edges) and the step trace (stack before/after, locals), as one JSON
 * document per function.
 */
public class JsonExporter {

    private final ObjectMapper om;
    private final InstructionFormatter formatter;

    public JsonExporter(ObjectMapper om, InstructionFormatter formatter) {
        this.om = om;
        this.formatter = formatter;
    }

    public JsonExporter(InstructionFormatter formatter) {
        this(new ObjectMapper(), formatter);
    }

    public void export(String function, ControlFlowGraph cfg, Trace trace, Path out) throws IOException {
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), toJson(function, cfg, trace));
    }

    public ObjectNode toJson(String function, ControlFlowGraph cfg, Trace trace) {
        ObjectNode root = om.createObjectNode();
        root.put("function", function);
        root.set("cfg", cfgNode(cfg));
        root.set("trace", traceNode(trace));
        return root;
    }

    public ObjectNode cfgNode(ControlFlowGraph cfg) {
        // ids are handed out per call, in offset order
        Map<Integer, String> ids = new HashMap<>();
        int counter = 0;
        for (Integer start : cfg.getBlocks().keySet()) ids.put(start, "B" + counter++);

        ObjectNode node = om.createObjectNode();
        if (cfg.isEmpty()) node.putNull("entry");
        else node.put("entry", ids.get(cfg.getEntryOffset()));

        ArrayNode blocks = om.createArrayNode();
        for (BasicBlock b : cfg.getBlocks().values()) {
            ObjectNode n = om.createObjectNode();
            n.put("id", ids.get(b.getStartOffset()));
            n.put("start", b.getStartOffset());
            n.put("end", b.getEndOffset());
            n.put("role", b.getRole().name().toLowerCase(Locale.ROOT));

            ArrayNode lines = om.createArrayNode();
            for (Instruction ins : b.getInstructions()) lines.add(formatter.format(ins));
            n.set("instructions", lines);

            ArrayNode succ = om.createArrayNode();
            for (Edge e : b.getSuccessors()) {
                ObjectNode s = om.createObjectNode();
                s.put("id", ids.get(e.target));
                s.put("conditional", e.conditional);
                s.put("label", e.label);
                succ.add(s);
            }
            n.set("successors", succ);
            blocks.add(n);
        }
        node.set("blocks", blocks);
        return node;
    }

    public ObjectNode traceNode(Trace trace) {
        ObjectNode node = om.createObjectNode();
        ArrayNode steps = om.createArrayNode();
        for (ExecutionStep step : trace.getSteps()) {
            ObjectNode s = om.createObjectNode();
            s.put("offset", step.offset);
            s.put("opcode", step.opcode);
            s.put("arg", step.operandDisplay);
            s.set("stack_before", values(step.stackBefore));
            s.set("stack_after", values(step.stackAfter));
            ObjectNode locals = om.createObjectNode();
            for (Map.Entry<String, SymbolicValue> e : step.localsSnapshot.entrySet()) {
                locals.put(e.getKey(), e.getValue().display());
            }
            s.set("locals", locals);
            steps.add(s);
        }
        node.set("steps", steps);
        if (trace.getReturnValue() == null) node.putNull("return_value");
        else node.put("return_value", trace.getReturnValue().display());
        return node;
    }

    private ArrayNode values(List<SymbolicValue> stack) {
        ArrayNode arr = om.createArrayNode();
        for (SymbolicValue v : stack) arr.add(v.display());
        return arr;
    }
}

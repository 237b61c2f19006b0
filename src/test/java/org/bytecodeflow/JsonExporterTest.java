package org.bytecodeflow;

import static org.junit.Assert.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class JsonExporterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final JsonExporter exporter = new JsonExporter(new InstructionFormatter(20, 30));

    private ObjectNode export(String fixture, CallArguments args) throws Exception {
        FunctionListing listing = Listings.load(fixture);
        ControlFlowGraph cfg = new CfgBuilder().build(listing.instructions);
        Trace trace = new StackSimulator(listing.signature, args, listing.stackEffects).run(listing.instructions);
        return exporter.toJson(listing.name, cfg, trace);
    }

    private static Map<String, JsonNode> blocksById(JsonNode cfg) {
        Map<String, JsonNode> byId = new HashMap<>();
        for (JsonNode b : cfg.get("blocks")) byId.put(b.get("id").asText(), b);
        return byId;
    }

    @Test
    public void testCfgSection() throws Exception {
        ObjectNode root = export("simple_if", CallArguments.NONE);
        assertEquals("simple_if", root.get("function").asText());

        JsonNode cfg = root.get("cfg");
        assertEquals("B0", cfg.get("entry").asText());
        assertEquals(3, cfg.get("blocks").size());

        Map<String, JsonNode> blocks = blocksById(cfg);
        JsonNode b0 = blocks.get("B0");
        assertEquals(0, b0.get("start").asInt());
        assertEquals(10, b0.get("end").asInt());
        assertEquals("entry", b0.get("role").asText());
        assertEquals("POP_JUMP_IF_FALSE 2 (16)", b0.get("instructions").get(4).asText());

        Map<String, JsonNode> edges = new HashMap<>();
        for (JsonNode e : b0.get("successors")) edges.put(e.get("id").asText(), e);
        assertEquals(2, edges.size());
        assertEquals("false", edges.get("B2").get("label").asText());
        assertEquals("true", edges.get("B1").get("label").asText());
        assertTrue(edges.get("B1").get("conditional").asBoolean());

        assertEquals("return", blocks.get("B1").get("role").asText());
        assertEquals(0, blocks.get("B1").get("successors").size());
        assertEquals(16, blocks.get("B2").get("start").asInt());
    }

    @Test
    public void testTraceSection() throws Exception {
        ObjectNode root = export("simple_if", CallArguments.of(5));
        JsonNode trace = root.get("trace");
        JsonNode steps = trace.get("steps");
        assertEquals(7, steps.size());

        JsonNode compare = steps.get(3);
        assertEquals(6, compare.get("offset").asInt());
        assertEquals("COMPARE_OP", compare.get("opcode").asText());
        assertEquals(">", compare.get("arg").asText());
        assertEquals(2, compare.get("stack_before").size());
        assertEquals("True", compare.get("stack_after").get(0).asText());
        assertEquals("5", compare.get("locals").get("x").asText());

        assertEquals("5", trace.get("return_value").asText());
    }

    @Test
    public void testEmptyGraphAndNoReturn() throws Exception {
        ObjectNode root = exporter.toJson("empty", ControlFlowGraph.empty(),
                new StackSimulator(FunctionSignature.EMPTY, CallArguments.NONE).run(List.of()));
        assertTrue(root.get("cfg").get("entry").isNull());
        assertEquals(0, root.get("cfg").get("blocks").size());
        assertTrue(root.get("trace").get("return_value").isNull());
    }

    @Test
    public void testExportWritesFile() throws Exception {
        FunctionListing listing = Listings.load("for_loop");
        ControlFlowGraph cfg = new CfgBuilder().build(listing.instructions);
        Trace trace = new StackSimulator(listing.signature, CallArguments.NONE, listing.stackEffects)
                .run(listing.instructions);
        Path out = tmp.getRoot().toPath().resolve("for_loop.json");

        exporter.export(listing.name, cfg, trace, out);

        assertTrue(Files.exists(out));
        JsonNode back = new ObjectMapper().readTree(out.toFile());
        assertEquals(cfg.size(), back.get("cfg").get("blocks").size());
        assertEquals(listing.instructions.size(), back.get("trace").get("steps").size());
    }
}

package org.bytecodeflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a decoded instruction listing (JSON) into a {@link FunctionListing}.
 *
 * <pre>
 * { "name": "f", "parameters": ["x"], "defaults": {"x": 1},
 *   "instructions": [ {"offset": 0, "opname": "RESUME", "arg": 0, "argval": 0, "argrepr": ""}, ... ],
 *   "stack_effects": [ {"opname": "END_FOR", "arg": null, "pops": 1, "pushes": 0} ] }
 * </pre>
 */
public class ListingReader {

    private final ObjectMapper om;

    public ListingReader() {
        this(new ObjectMapper());
    }

    public ListingReader(ObjectMapper om) {
        this.om = om;
    }

    public FunctionListing read(Path file) throws ListingFormatException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.getFileName().toString());
        } catch (IOException e) {
            throw new ListingFormatException("cannot read listing " + file + ": " + e.getMessage(), e);
        }
    }

    public FunctionListing read(InputStream in, String source) throws ListingFormatException {
        JsonNode root;
        try {
            root = om.readTree(in);
        } catch (IOException e) {
            throw new ListingFormatException("malformed JSON in " + source + ": " + e.getMessage(), e);
        }
        return parse(root, source);
    }

    public FunctionListing parse(JsonNode root, String source) throws ListingFormatException {
        if (root == null || !root.isObject()) throw new ListingFormatException(source + ": listing must be a JSON object");

        String name = root.path("name").asText(stripExtension(source));

        // 1) signature
        List<String> params = new ArrayList<>();
        for (JsonNode p : root.path("parameters")) params.add(p.asText());
        Map<String, SymbolicValue> defaults = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = root.path("defaults").fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> e = it.next();
            defaults.put(e.getKey(), SymbolicValue.fromObject(toJava(e.getValue())));
        }

        // 2) instructions
        JsonNode insNode = root.path("instructions");
        if (!insNode.isArray()) throw new ListingFormatException(source + ": 'instructions' must be an array");
        List<Instruction> instructions = new ArrayList<>(insNode.size());
        int previous = -1;
        for (JsonNode n : insNode) {
            Instruction ins = instruction(n, source);
            if (ins.offset <= previous)
                throw new ListingFormatException(source + ": offsets must be strictly increasing, got "
                        + previous + " then " + ins.offset);
            previous = ins.offset;
            instructions.add(ins);
        }

        // 3) fallback stack effects
        Map<String, Map<Integer, StackEffect>> effects = new HashMap<>();
        for (JsonNode n : root.path("stack_effects")) {
            String op = required(n, "opname", source).asText();
            Integer arg = n.hasNonNull("arg") ? n.get("arg").asInt() : null;
            try {
                effects.computeIfAbsent(op, k -> new HashMap<>())
                        .put(arg, new StackEffect(n.path("pops").asInt(0), n.path("pushes").asInt(0)));
            } catch (IllegalArgumentException e) {
                throw new ListingFormatException(source + ": bad stack effect for " + op + ": " + e.getMessage(), e);
            }
        }

        return new FunctionListing(name, new FunctionSignature(params, defaults), instructions,
                effects.isEmpty() ? StackEffectLookup.NONE : StackEffectLookup.of(effects));
    }

    private Instruction instruction(JsonNode n, String source) throws ListingFormatException {
        JsonNode off = required(n, "offset", source);
        if (!off.canConvertToInt() || off.asInt() < 0)
            throw new ListingFormatException(source + ": bad offset " + off);
        String opname = required(n, "opname", source).asText();

        Integer arg = n.hasNonNull("arg") ? n.get("arg").asInt() : null;
        Object argval = toJava(n.get("argval"));
        if (n.hasNonNull("jump_target") && OpcodeTable.getDefault().lookup(opname).branch != BranchKind.NONE) {
            argval = n.get("jump_target").asInt();
        }
        String argrepr = n.path("argrepr").asText("");
        int size = n.path("size").asInt(2);
        return new Instruction(off.asInt(), opname, arg, argval, argrepr, size);
    }

    private static JsonNode required(JsonNode n, String field, String source) throws ListingFormatException {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) throw new ListingFormatException(source + ": missing '" + field + "' in " + n);
        return v;
    }

    /** JSON operand to plain Java: Long, Double, String, Boolean, List, Map, or null. */
    static Object toJava(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return null;
        if (n.isBoolean()) return n.booleanValue();
        if (n.isIntegralNumber()) return n.canConvertToLong() ? (Object) n.longValue() : n.asText();
        if (n.isNumber()) return n.doubleValue();
        if (n.isTextual()) return n.textValue();
        if (n.isArray()) {
            List<Object> list = new ArrayList<>(n.size());
            for (JsonNode e : n) list.add(toJava(e));
            return list;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = n.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> e = it.next();
            map.put(e.getKey(), toJava(e.getValue()));
        }
        return map;
    }

    /** Parses a command-line argument as a JSON literal; anything else is taken as a string. */
    public SymbolicValue literal(String text) {
        try {
            return SymbolicValue.fromObject(toJava(om.readTree(text)));
        } catch (JsonProcessingException e) {
            return SymbolicValue.of(text);
        }
    }

    private static String stripExtension(String source) {
        int dot = source.lastIndexOf('.');
        return dot > 0 ? source.substring(0, dot) : source;
    }
}

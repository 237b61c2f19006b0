package org.bytecodeflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only classification of opcode mnemonics: which are branches, which are
 * terminal, which are fused two-variable forms. Loaded once from the
 * {@code opcodes.json} classpath resource and shared by every analysis.
 */
public final class OpcodeTable {

    public static final String RESOURCE = "/opcodes.json";

    private static volatile OpcodeTable defaultTable;

    private final Map<String, OpcodeInfo> byName;
    private final Set<String> entryMarkers;

    private OpcodeTable(Map<String, OpcodeInfo> byName, Set<String> entryMarkers) {
        this.byName = Collections.unmodifiableMap(byName);
        this.entryMarkers = Collections.unmodifiableSet(entryMarkers);
    }

    public static OpcodeTable getDefault() {
        OpcodeTable t = defaultTable;
        if (t == null) {
            synchronized (OpcodeTable.class) {
                t = defaultTable;
                if (t == null) {
                    t = loadResource(RESOURCE);
                    defaultTable = t;
                }
            }
        }
        return t;
    }

    static OpcodeTable loadResource(String resource) {
        try (InputStream in = OpcodeTable.class.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("opcode table not found on classpath: " + resource);
            return parse(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("cannot read opcode table " + resource + ": " + e.getMessage(), e);
        }
    }

    static OpcodeTable parse(JsonNode root) {
        Map<String, OpcodeInfo> map = new LinkedHashMap<>();
        JsonNode opcodes = root.path("opcodes");
        if (!opcodes.isObject()) throw new IllegalStateException("opcode table has no 'opcodes' object");

        for (Iterator<Map.Entry<String, JsonNode>> it = opcodes.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> e = it.next();
            map.put(e.getKey(), parseEntry(e.getKey(), e.getValue()));
        }

        Set<String> markers = new HashSet<>();
        for (JsonNode m : root.path("entry_markers")) markers.add(m.asText());
        return new OpcodeTable(map, markers);
    }

    private static OpcodeInfo parseEntry(String name, JsonNode n) {
        try {
            return toInfo(n);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("bad opcode table entry " + name + ": " + e.getMessage(), e);
        }
    }

    private static OpcodeInfo toInfo(JsonNode n) {
        OpcodeCategory category = OpcodeCategory.valueOf(n.path("category").asText("OTHER"));
        BranchKind branch;
        EdgePolarity polarity;
        switch (category) {
            case JUMP:
                branch = BranchKind.UNCONDITIONAL;
                polarity = EdgePolarity.NONE;
                break;
            case CONDITIONAL_JUMP:
                branch = BranchKind.CONDITIONAL;
                polarity = EdgePolarity.valueOf(n.path("polarity").asText("GENERIC"));
                break;
            case FOR_ITER:
                branch = BranchKind.ITERATOR;
                polarity = EdgePolarity.ITERATOR;
                break;
            default:
                branch = BranchKind.NONE;
                polarity = EdgePolarity.NONE;
        }
        int pops = n.path("pops").asInt(branch == BranchKind.CONDITIONAL ? 1 : 0);
        return new OpcodeInfo(category, branch, polarity, n.path("terminal").asBoolean(false), pops);
    }

    /** Classification of {@code opname}; {@link OpcodeInfo#OTHER} when the mnemonic is unknown. */
    public OpcodeInfo lookup(String opname) {
        if (opname == null) return OpcodeInfo.OTHER;
        return byName.getOrDefault(opname, OpcodeInfo.OTHER);
    }

    public boolean isEntryMarker(String opname) {
        return entryMarkers.contains(opname);
    }

    public int size() {
        return byName.size();
    }
}

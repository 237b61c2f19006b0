package org.bytecodeflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Declared parameter names of the analyzed function and their defaults. */
public class FunctionSignature {

    public static final FunctionSignature EMPTY = new FunctionSignature(List.of(), Map.of());

    public final List<String> parameters;
    public final Map<String, SymbolicValue> defaults;

    public FunctionSignature(List<String> parameters, Map<String, SymbolicValue> defaults) {
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    public FunctionSignature(List<String> parameters) {
        this(parameters, Map.of());
    }
}

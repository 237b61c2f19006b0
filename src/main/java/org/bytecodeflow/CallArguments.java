package org.bytecodeflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Positional and keyword arguments supplied for one simulation. */
public class CallArguments {

    public static final CallArguments NONE = new CallArguments(List.of(), Map.of());

    public final List<SymbolicValue> positional;
    public final Map<String, SymbolicValue> keywords;

    public CallArguments(List<SymbolicValue> positional, Map<String, SymbolicValue> keywords) {
        this.positional = Collections.unmodifiableList(new ArrayList<>(positional));
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    /** Positional arguments converted with {@link SymbolicValue#fromObject}. */
    public static CallArguments of(Object... values) {
        List<SymbolicValue> list = new ArrayList<>(values.length);
        for (Object v : values) list.add(SymbolicValue.fromObject(v));
        return new CallArguments(list, Map.of());
    }
}

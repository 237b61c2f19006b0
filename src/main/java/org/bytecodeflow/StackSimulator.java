package org.bytecodeflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays instruction semantics on an abstract operand stack and a local
 * variable environment without executing anything. Values are folded when
 * both operands are concrete numbers and kept as display text otherwise.
 *
 * <p>One instance owns its stack and locals; {@link #run} resets them, so a
 * simulator can be reused but not shared between threads.
 */
public class StackSimulator {

    private static final Logger log = LoggerFactory.getLogger(StackSimulator.class);

    static final String NEXT_ITEM = "<next_item>";

    private final FunctionSignature signature;
    private final CallArguments arguments;
    private final StackEffectLookup fallback;

    private final List<SymbolicValue> stack = new ArrayList<>();
    private final Map<String, SymbolicValue> locals = new LinkedHashMap<>();
    private SymbolicValue returnValue;
    private boolean finished;

    public StackSimulator(FunctionSignature signature, CallArguments arguments, StackEffectLookup fallback) {
        this.signature = signature;
        this.arguments = arguments;
        this.fallback = fallback == null ? StackEffectLookup.NONE : fallback;
        reset();
    }

    public StackSimulator(FunctionSignature signature, CallArguments arguments) {
        this(signature, arguments, StackEffectLookup.NONE);
    }

    /** Simulates {@code instructions} in order, stopping after the first return. */
    public Trace run(List<Instruction> instructions) {
        reset();
        List<ExecutionStep> steps = new ArrayList<>(instructions.size());
        for (Instruction ins : instructions) {
            steps.add(step(ins));
            if (finished) break;
        }
        log.debug("simulated {} of {} instructions", steps.size(), instructions.size());
        return new Trace(steps, returnValue);
    }

    /** Applies one instruction to the current state. */
    public ExecutionStep step(Instruction ins) {
        List<SymbolicValue> before = new ArrayList<>(stack);
        apply(ins);
        return new ExecutionStep(ins.offset, ins.opname, ins.argrepr, before, stack, locals);
    }

    public boolean isFinished() {
        return finished;
    }

    public List<SymbolicValue> getStack() {
        return Collections.unmodifiableList(stack);
    }

    public Map<String, SymbolicValue> getLocals() {
        return Collections.unmodifiableMap(locals);
    }

    /* =========================
     *   state
     * ========================= */

    private void reset() {
        stack.clear();
        locals.clear();
        returnValue = null;
        finished = false;

        // positional, then keywords, then defaults for whatever is still unbound
        List<String> params = signature.parameters;
        for (int i = 0; i < arguments.positional.size() && i < params.size(); i++) {
            locals.put(params.get(i), arguments.positional.get(i));
        }
        locals.putAll(arguments.keywords);
        for (String p : params) {
            SymbolicValue d = signature.defaults.get(p);
            if (d != null && !locals.containsKey(p)) locals.put(p, d);
        }
    }

    private void push(SymbolicValue v) {
        stack.add(v);
    }

    private SymbolicValue pop() {
        return stack.remove(stack.size() - 1);
    }

    private SymbolicValue peek(int depth) {
        return stack.get(stack.size() - depth);
    }

    private boolean has(int n) {
        return stack.size() >= n;
    }

    private SymbolicValue local(String name) {
        SymbolicValue v = locals.get(name);
        return v != null ? v : SymbolicValue.tag(name);
    }

    /** Pops up to {@code n} values and returns them in push order. */
    private List<SymbolicValue> popMany(int n) {
        List<SymbolicValue> items = new ArrayList<>(n);
        for (int i = 0; i < n && !stack.isEmpty(); i++) items.add(pop());
        Collections.reverse(items);
        return items;
    }

    private static int argOr(Instruction ins, int fallback) {
        return ins.arg != null ? ins.arg : fallback;
    }

    /* =========================
     *   instruction semantics
     * ========================= */

    private void apply(Instruction ins) {
        List<String> names;
        switch (ins.info.category) {
            case NOP, JUMP -> { }
            case PUSH_CONST -> push(SymbolicValue.fromObject(ins.argval));
            case LOAD_LOCAL, LOAD_LOCAL_PAIR -> {
                for (String name : ins.names()) push(local(name));
            }
            case LOAD_GLOBAL -> loadGlobal(ins);
            case PUSH_NULL -> push(SymbolicValue.NULL_MARKER);
            case STORE_LOCAL -> {
                names = ins.names();
                if (!names.isEmpty() && has(1)) locals.put(names.get(0), pop());
            }
            case STORE_LOCAL_PAIR -> {
                names = ins.names();
                for (int i = names.size() - 1; i >= 0; i--) {
                    if (has(1)) locals.put(names.get(i), pop());
                }
            }
            case STORE_LOAD_LOCAL -> {
                names = ins.names();
                if (names.size() == 2) {
                    if (has(1)) locals.put(names.get(0), pop());
                    push(local(names.get(1)));
                }
            }
            case DELETE_LOCAL -> {
                for (String name : ins.names()) locals.remove(name);
            }
            case BINARY_OP -> {
                if (has(2)) {
                    SymbolicValue right = pop();
                    SymbolicValue left = pop();
                    push(SymbolicArithmetic.binary(ins.argrepr.isEmpty() ? "op" : ins.argrepr, left, right));
                }
            }
            case COMPARE_OP -> {
                if (has(2)) {
                    SymbolicValue right = pop();
                    SymbolicValue left = pop();
                    push(SymbolicArithmetic.compare(ins.argrepr, left, right));
                }
            }
            case UNARY_NEGATIVE -> {
                if (has(1)) push(SymbolicArithmetic.negate(pop()));
            }
            case UNARY_NOT -> {
                if (has(1)) push(SymbolicArithmetic.not(pop()));
            }
            case CALL -> call(argOr(ins, 0));
            case RETURN_VALUE -> {
                returnValue = has(1) ? pop() : null;
                finished = true;
            }
            case RETURN_CONST -> {
                returnValue = SymbolicValue.fromObject(ins.argval);
                finished = true;
            }
            case RAISE -> popMany(argOr(ins, 0));
            case POP_TOP -> {
                if (has(1)) pop();
            }
            case DUP_TOP -> {
                if (has(1)) push(peek(1));
            }
            case DUP_TOP_TWO -> {
                if (has(2)) {
                    SymbolicValue second = peek(2);
                    SymbolicValue top = peek(1);
                    push(second);
                    push(top);
                }
            }
            case COPY -> {
                int n = argOr(ins, 1);
                if (n > 0 && has(n)) push(peek(n));
            }
            case SWAP -> swap(argOr(ins, 2));
            case ROT_TWO -> swap(2);
            case ROT_THREE -> {
                if (has(3)) {
                    SymbolicValue top = pop();
                    stack.add(stack.size() - 2, top);
                }
            }
            case BUILD_LIST -> push(SymbolicValue.composite(SymbolicValue.CompositeKind.LIST, popMany(argOr(ins, 0))));
            case BUILD_TUPLE -> push(SymbolicValue.composite(SymbolicValue.CompositeKind.TUPLE, popMany(argOr(ins, 0))));
            case BUILD_SET -> push(SymbolicValue.composite(SymbolicValue.CompositeKind.SET, popMany(argOr(ins, 0))));
            case BUILD_MAP -> push(SymbolicValue.composite(SymbolicValue.CompositeKind.MAP, popMany(2 * argOr(ins, 0))));
            case BUILD_CONST_KEY_MAP -> buildConstKeyMap(argOr(ins, 0));
            case GET_ITER -> {
                if (has(1)) push(SymbolicValue.placeholder("iter(" + pop().display() + ")"));
            }
            case FOR_ITER -> push(SymbolicValue.placeholder(NEXT_ITEM));
            case CONDITIONAL_JUMP -> popMany(ins.info.pops);
            case OTHER -> applyFallback(ins);
        }
    }

    private void loadGlobal(Instruction ins) {
        String name = ins.argval instanceof String s ? s : globalName(ins.argrepr);
        if (ins.argrepr.startsWith("NULL + ")) {
            push(SymbolicValue.NULL_MARKER);
            push(SymbolicValue.tag(name));
        } else if (ins.argrepr.endsWith(" + NULL")) {
            push(SymbolicValue.tag(name));
            push(SymbolicValue.NULL_MARKER);
        } else {
            push(SymbolicValue.tag(name));
        }
    }

    private static String globalName(String argrepr) {
        String s = argrepr.replace("NULL + ", "").replace(" + NULL", "").trim();
        return s.isEmpty() ? "global" : s;
    }

    private void call(int argc) {
        List<SymbolicValue> args = popMany(argc);
        if (has(1) && peek(1) == SymbolicValue.NULL_MARKER) pop();
        if (!has(1)) return;

        SymbolicValue callable = pop();
        if (has(1) && peek(1) == SymbolicValue.NULL_MARKER) pop();

        StringBuilder sb = new StringBuilder(callable.display()).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i).display());
        }
        push(SymbolicValue.placeholder(sb.append(')').toString()));
    }

    private void swap(int n) {
        if (n < 2 || !has(n)) return;
        int top = stack.size() - 1;
        int other = stack.size() - n;
        SymbolicValue tmp = stack.get(top);
        stack.set(top, stack.get(other));
        stack.set(other, tmp);
    }

    private void buildConstKeyMap(int n) {
        if (!has(n + 1)) return;
        SymbolicValue keys = pop();
        List<SymbolicValue> values = popMany(n);
        List<SymbolicValue> keyList = keys instanceof SymbolicValue.Composite c && c.elements().size() == n
                ? c.elements() : null;

        List<SymbolicValue> items = new ArrayList<>(2 * n);
        for (int i = 0; i < n; i++) {
            items.add(keyList != null ? keyList.get(i) : SymbolicValue.placeholder(keys.display() + "[" + i + "]"));
            items.add(values.get(i));
        }
        push(SymbolicValue.composite(SymbolicValue.CompositeKind.MAP, items));
    }

    private void applyFallback(Instruction ins) {
        StackEffect effect = fallback.lookup(ins.opname, ins.arg);
        if (effect == null) {
            log.debug("no stack effect known for {} at offset {}; treating as no-op", ins.opname, ins.offset);
            return;
        }
        popMany(effect.consumed);
        for (int i = 0; i < effect.produced; i++) {
            push(SymbolicValue.placeholder("<" + ins.opname + "_result>"));
        }
    }
}

package org.bytecodeflow;

import static org.bytecodeflow.Listings.*;
import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;

import org.junit.Test;

public class StackSimulatorTest {

    private static Trace simulate(List<Instruction> code) {
        return new StackSimulator(FunctionSignature.EMPTY, CallArguments.NONE).run(code);
    }

    private static List<SymbolicValue> finalStack(Trace trace) {
        return trace.last().stackAfter;
    }

    @Test
    public void testConstantFolding() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, 2L, "2"),
                ins(2, "LOAD_CONST", 1, 3L, "3"),
                ins(4, "BINARY_OP", 0, 0L, "+")));
        assertEquals(List.of(SymbolicValue.of(5)), finalStack(trace));
    }

    @Test
    public void testDivisionByZeroIsSymbolic() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, 1L, "1"),
                ins(2, "LOAD_CONST", 1, 0L, "0"),
                ins(4, "BINARY_OP", 11, 11L, "/")));
        SymbolicValue v = finalStack(trace).get(0);
        assertEquals(SymbolicValue.Kind.PLACEHOLDER, v.kind());
        assertEquals("(1 / 0)", v.display());
    }

    @Test
    public void testCallWithGlobalCallable() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_GLOBAL", 1, "max", "max + NULL"),
                ins(10, "LOAD_CONST", 1, 1L, "1"),
                ins(12, "LOAD_CONST", 2, 2L, "2"),
                ins(14, "CALL", 2, 2L, "")));
        assertEquals(List.of(SymbolicValue.placeholder("<max>(1, 2)")), finalStack(trace));
        // marker pushed after the name
        assertEquals(List.of(SymbolicValue.tag("max"), SymbolicValue.NULL_MARKER), trace.getSteps().get(0).stackAfter);
    }

    @Test
    public void testCallDiscardsMarkerBelowCallable() {
        Trace trace = simulate(seq(
                ins(0, "PUSH_NULL"),
                ins(2, "LOAD_NAME", 0, "print", "print"),
                ins(4, "LOAD_CONST", 0, "hi", "'hi'"),
                ins(6, "CALL", 1, 1L, "")));
        assertEquals(List.of(SymbolicValue.placeholder("<print>('hi')")), finalStack(trace));
    }

    @Test
    public void testSimpleIfTrace() throws Exception {
        FunctionListing listing = load("simple_if");
        Trace trace = new StackSimulator(listing.signature, CallArguments.of(5)).run(listing.instructions);

        // stops at the first return
        assertEquals(7, trace.size());
        assertEquals(14, trace.last().offset);
        assertEquals(SymbolicValue.of(5), trace.getReturnValue());
        assertEquals(List.of(SymbolicValue.of(true)), trace.getSteps().get(3).stackAfter);
        assertTrue(trace.getSteps().get(4).stackAfter.isEmpty());
        assertEquals(Map.of("x", SymbolicValue.of(5)), trace.finalLocals());
    }

    @Test
    public void testUnboundParameterIsPlaceholder() throws Exception {
        FunctionListing listing = load("simple_if");
        Trace trace = new StackSimulator(listing.signature, CallArguments.NONE).run(listing.instructions);
        assertEquals("(<x> > 0)", trace.getSteps().get(3).stackAfter.get(0).display());
        assertEquals(SymbolicValue.tag("x"), trace.getReturnValue());
    }

    @Test
    public void testForLoopTraceUsesFallbackEffects() throws Exception {
        FunctionListing listing = load("for_loop");
        Trace trace = new StackSimulator(listing.signature, CallArguments.of(3), listing.stackEffects)
                .run(listing.instructions);

        assertEquals(listing.instructions.size(), trace.size());
        ExecutionStep call = trace.getSteps().get(5);
        assertEquals(List.of(SymbolicValue.placeholder("<range>(3)")), call.stackAfter);
        ExecutionStep getIter = trace.getSteps().get(6);
        assertEquals("iter(<range>(3))", getIter.stackAfter.get(0).display());
        ExecutionStep forIter = trace.getSteps().get(7);
        assertEquals(1, forIter.stackDelta());
        assertEquals(StackSimulator.NEXT_ITEM, forIter.stackAfter.get(1).display());

        ExecutionStep endFor = trace.getSteps().get(13);
        assertEquals("END_FOR", endFor.opcode);
        assertTrue(endFor.stackAfter.isEmpty());
        assertEquals("(0 += <next_item>)", trace.getReturnValue().display());
    }

    @Test
    public void testLocalsBinding() {
        FunctionSignature sig = new FunctionSignature(List.of("a", "b", "c"),
                Map.of("b", SymbolicValue.of(20), "c", SymbolicValue.of(30)));
        CallArguments args = new CallArguments(List.of(SymbolicValue.of(1)), Map.of("c", SymbolicValue.of(3)));
        StackSimulator sim = new StackSimulator(sig, args);
        assertEquals(SymbolicValue.of(1), sim.getLocals().get("a"));
        assertEquals(SymbolicValue.of(20), sim.getLocals().get("b"));
        assertEquals(SymbolicValue.of(3), sim.getLocals().get("c"));
    }

    @Test
    public void testFusedStoreAndLoad() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, 1L, "1"),
                ins(2, "LOAD_CONST", 1, 2L, "2"),
                ins(4, "STORE_FAST_STORE_FAST", 16, List.of("a", "b"), "a, b"),
                ins(6, "LOAD_FAST_LOAD_FAST", 1, List.of("b", "a"), "b, a")));
        // last-in-first-out: b gets the top value
        assertEquals(SymbolicValue.of(2), trace.finalLocals().get("b"));
        assertEquals(SymbolicValue.of(1), trace.finalLocals().get("a"));
        assertEquals(List.of(SymbolicValue.of(2), SymbolicValue.of(1)), finalStack(trace));
    }

    @Test
    public void testStoreFastLoadFast() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, 7L, "7"),
                ins(2, "STORE_FAST_LOAD_FAST", 0, null, "x, y")));
        assertEquals(SymbolicValue.of(7), trace.finalLocals().get("x"));
        assertEquals(List.of(SymbolicValue.tag("y")), finalStack(trace));
    }

    @Test
    public void testStackShuffles() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, 1L, "1"),
                ins(2, "LOAD_CONST", 1, 2L, "2"),
                ins(4, "LOAD_CONST", 2, 3L, "3"),
                ins(6, "SWAP", 3, 3L, "3"),
                ins(8, "COPY", 2, 2L, "2"),
                ins(10, "POP_TOP"),
                ins(12, "DUP_TOP"),
                ins(14, "ROT_THREE")));
        // [1,2,3] swap3 -> [3,2,1]; copy2 -> [3,2,1,2]; pop -> [3,2,1]; dup -> [3,2,1,1]; rot3 -> [3,1,2,1]
        assertEquals(List.of(SymbolicValue.of(3), SymbolicValue.of(1), SymbolicValue.of(2), SymbolicValue.of(1)),
                finalStack(trace));
    }

    @Test
    public void testCollections() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, 1L, "1"),
                ins(2, "LOAD_CONST", 1, 2L, "2"),
                ins(4, "BUILD_LIST", 2, 2L, ""),
                ins(6, "LOAD_CONST", 2, "k", "'k'"),
                ins(8, "LOAD_CONST", 3, 3L, "3"),
                ins(10, "BUILD_MAP", 1, 1L, ""),
                ins(12, "LOAD_FAST", 0, "z", "z"),
                ins(14, "BUILD_TUPLE", 1, 1L, ""),
                ins(16, "BUILD_TUPLE", 3, 3L, "")));
        assertEquals("([1, 2], {'k': 3}, (<z>,))", finalStack(trace).get(0).display());
    }

    @Test
    public void testConstKeyMap() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, 1L, "1"),
                ins(2, "LOAD_CONST", 1, 2L, "2"),
                ins(4, "LOAD_CONST", 2, List.of("a", "b"), "('a', 'b')"),
                ins(6, "BUILD_CONST_KEY_MAP", 2, 2L, "")));
        assertEquals("{'a': 1, 'b': 2}", finalStack(trace).get(0).display());
    }

    @Test
    public void testConditionalBranchPopsAndJumpDoesNot() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, true, "True"),
                ins(2, "POP_JUMP_IF_TRUE", 1, 6, "to 6"),
                ins(4, "JUMP_FORWARD", 0, 6, "to 6"),
                ins(6, "NOP")));
        assertEquals(-1, trace.getSteps().get(1).stackDelta());
        assertEquals(0, trace.getSteps().get(2).stackDelta());
    }

    @Test
    public void testSteppingStopsAtReturn() {
        StackSimulator sim = new StackSimulator(FunctionSignature.EMPTY, CallArguments.NONE);
        sim.step(ins(0, "LOAD_CONST", 0, 7L, "7"));
        assertFalse(sim.isFinished());
        sim.step(ins(2, "RETURN_VALUE"));
        assertTrue(sim.isFinished());
        assertTrue(sim.getStack().isEmpty());
    }

    @Test
    public void testUnknownOpcodeIsNoOp() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, 1L, "1"),
                ins(2, "SOMETHING_NEW", 5, 5L, "")));
        assertEquals(2, trace.size());
        assertEquals(trace.getSteps().get(1).stackBefore, trace.getSteps().get(1).stackAfter);
    }

    @Test
    public void testFallbackLookupProducesPlaceholders() {
        StackEffectLookup lookup = (op, arg) -> "FORMAT_VALUE".equals(op) ? new StackEffect(1, 1) : null;
        Trace trace = new StackSimulator(FunctionSignature.EMPTY, CallArguments.NONE, lookup).run(seq(
                ins(0, "LOAD_CONST", 0, 1L, "1"),
                ins(2, "FORMAT_VALUE", 0, 0L, "")));
        assertEquals(List.of(SymbolicValue.placeholder("<FORMAT_VALUE_result>")), finalStack(trace));
    }

    @Test
    public void testStackBalanceForKnownEffects() {
        Trace trace = simulate(seq(
                ins(0, "LOAD_CONST", 0, 1L, "1"),          // +1
                ins(2, "LOAD_FAST", 0, "a", "a"),          // +1
                ins(4, "BINARY_OP", 5, 5L, "*"),           // -1
                ins(6, "LOAD_CONST", 1, 4L, "4"),          // +1
                ins(8, "COMPARE_OP", 2, "<", "<"),         // -1
                ins(10, "UNARY_NOT"),                      // 0
                ins(12, "STORE_FAST", 1, "b", "b"),        // -1
                ins(14, "RETURN_CONST", 0, null, "None"))); // 0
        int[] expected = {1, 1, -1, 1, -1, 0, -1, 0};
        for (int i = 0; i < expected.length; i++) {
            assertEquals(trace.getSteps().get(i).toString(), expected[i], trace.getSteps().get(i).stackDelta());
        }
        assertEquals(SymbolicValue.NONE, trace.getReturnValue());
    }

    @Test
    public void testNoReturnRunsWholeSequence() {
        Trace trace = simulate(seq(ins(0, "NOP"), ins(2, "NOP")));
        assertEquals(2, trace.size());
        assertNull(trace.getReturnValue());
    }

    @Test
    public void testEmptyInputGivesEmptyTrace() {
        Trace trace = simulate(List.of());
        assertTrue(trace.isEmpty());
        assertTrue(trace.finalLocals().isEmpty());
    }

    @Test
    public void testRunIsRepeatable() throws Exception {
        FunctionListing listing = load("for_loop");
        StackSimulator sim = new StackSimulator(listing.signature, CallArguments.of(4), listing.stackEffects);
        Trace a = sim.run(listing.instructions);
        Trace b = sim.run(listing.instructions);
        assertEquals(a.size(), b.size());
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.getSteps().get(i).stackAfter, b.getSteps().get(i).stackAfter);
            assertEquals(a.getSteps().get(i).localsSnapshot, b.getSteps().get(i).localsSnapshot);
        }
    }
}

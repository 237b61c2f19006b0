package org.bytecodeflow;

/**
 * Stack-effect family of an opcode. The simulator dispatches on this; every
 * mnemonic the table does not know resolves to {@link #OTHER}.
 */
public enum OpcodeCategory {
    NOP,
    PUSH_CONST,
    LOAD_LOCAL,
    LOAD_LOCAL_PAIR,
    LOAD_GLOBAL,
    PUSH_NULL,
    STORE_LOCAL,
    STORE_LOCAL_PAIR,
    STORE_LOAD_LOCAL,
    DELETE_LOCAL,
    BINARY_OP,
    COMPARE_OP,
    UNARY_NEGATIVE,
    UNARY_NOT,
    CALL,
    RETURN_VALUE,
    RETURN_CONST,
    RAISE,
    POP_TOP,
    DUP_TOP,
    DUP_TOP_TWO,
    COPY,
    SWAP,
    ROT_TWO,
    ROT_THREE,
    BUILD_LIST,
    BUILD_TUPLE,
    BUILD_SET,
    BUILD_MAP,
    BUILD_CONST_KEY_MAP,
    GET_ITER,
    FOR_ITER,
    JUMP,
    CONDITIONAL_JUMP,
    OTHER
}

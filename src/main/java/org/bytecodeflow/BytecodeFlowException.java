package org.bytecodeflow;

/** Base of the errors an analysis surfaces to its caller. */
public class BytecodeFlowException extends Exception {

    private static final long serialVersionUID = 4087611329045130512L;

    public BytecodeFlowException(String msg) {
        super(msg);
    }

    public BytecodeFlowException(String msg, Throwable cause) {
        super(msg, cause);
    }
}

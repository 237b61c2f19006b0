package org.bytecodeflow;

/** A decoded instruction listing could not be read. */
public class ListingFormatException extends BytecodeFlowException {

    private static final long serialVersionUID = 6140227751409553310L;

    public ListingFormatException(String msg) {
        super(msg);
    }

    public ListingFormatException(String msg, Throwable cause) {
        super(msg, cause);
    }
}

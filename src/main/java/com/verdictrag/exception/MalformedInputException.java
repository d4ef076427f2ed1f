package com.verdictrag.exception;

/**
 * Input rejected synchronously: empty documents, blank questions, vectors whose
 * dimensionality does not match the index, invalid chunking options.
 */
public class MalformedInputException extends RagException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }

    public static MalformedInputException dimensionMismatch(String what, int expected, int actual) {
        return new MalformedInputException(String.format(
                "%s has dimension %d but the index is configured for %d", what, actual, expected));
    }
}
